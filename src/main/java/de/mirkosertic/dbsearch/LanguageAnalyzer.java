package de.mirkosertic.dbsearch;

import org.apache.lucene.analysis.Analyzer;
import org.apache.lucene.analysis.LowerCaseFilter;
import org.apache.lucene.analysis.TokenStream;
import org.apache.lucene.analysis.Tokenizer;
import org.apache.lucene.analysis.icu.ICUFoldingFilter;
import org.apache.lucene.analysis.icu.segmentation.ICUTokenizer;
import org.apache.lucene.analysis.snowball.SnowballFilter;
import org.jspecify.annotations.Nullable;

import java.util.Locale;

/**
 * Analyzer for the {@code content} field of the index.
 *
 * <p>Token chain: {@code ICUTokenizer -> LowerCaseFilter -> ICUFoldingFilter -> SnowballFilter(stemmer)}.
 * The stemming step is left out for languages without a Snowball stemmer (Chinese).</p>
 *
 * <p>ICU word segmentation splits on Unicode word boundaries and uses dictionaries for
 * scripts written without spaces, so already segmented token text and the raw text
 * appended to short documents are both broken into comparable terms.</p>
 */
public class LanguageAnalyzer extends Analyzer {

    private final @Nullable String stemmerName;

    /**
     * @param stemmerName the Snowball stemmer name (e.g. {@code "English"}), or {@code null} for no stemming
     */
    public LanguageAnalyzer(final @Nullable String stemmerName) {
        this.stemmerName = stemmerName;
    }

    /**
     * Creates the analyzer for a full engine language name such as {@code "german"}.
     * Unknown names fall back to English.
     */
    public static LanguageAnalyzer forLanguageName(final String languageName) {
        final IndexLanguage language = IndexLanguage.fromName(languageName).orElse(IndexLanguage.ENGLISH);
        if (language == IndexLanguage.CHINESE) {
            return new LanguageAnalyzer(null);
        }
        final String name = language.languageName();
        return new LanguageAnalyzer(name.substring(0, 1).toUpperCase(Locale.ROOT) + name.substring(1));
    }

    public @Nullable String getStemmerName() {
        return stemmerName;
    }

    @Override
    protected TokenStreamComponents createComponents(final String fieldName) {
        final Tokenizer tokenizer = new ICUTokenizer();
        TokenStream stream = new LowerCaseFilter(tokenizer);
        stream = new ICUFoldingFilter(stream);
        if (stemmerName != null) {
            stream = new SnowballFilter(stream, stemmerName);
        }
        return new TokenStreamComponents(tokenizer, stream);
    }
}
