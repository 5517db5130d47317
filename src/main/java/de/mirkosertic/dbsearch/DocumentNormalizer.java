package de.mirkosertic.dbsearch;

import org.apache.lucene.analysis.Analyzer;
import org.apache.lucene.analysis.TokenStream;
import org.apache.lucene.analysis.Tokenizer;
import org.apache.lucene.analysis.cn.smart.HMMChineseTokenizer;
import org.apache.lucene.analysis.icu.segmentation.ICUTokenizer;
import org.apache.lucene.analysis.tokenattributes.CharTermAttribute;

import java.io.Closeable;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Turns the raw title or body of a document into index-ready token text.
 * <p>
 * The text is segmented into words with the rules of the configured language (HMM word
 * segmentation for Chinese, Unicode word-break rules otherwise) and the words are joined
 * with single spaces. Texts shorter than {@value #RAW_TEXT_THRESHOLD} characters get the
 * original text appended so that exact substrings of short titles stay findable; longer
 * texts are reduced to their tokens.
 */
public class DocumentNormalizer implements Closeable {

    public static final int RAW_TEXT_THRESHOLD = 500;

    private final Map<String, Analyzer> segmenters = new ConcurrentHashMap<>();

    public String normalize(final String text, final String languageCode) {
        final String tokens = String.join(" ", segment(text, languageCode));
        if (text.length() < RAW_TEXT_THRESHOLD) {
            return tokens.isEmpty() ? text : tokens + " " + text;
        }
        return tokens;
    }

    /**
     * Splits {@code text} into words, keeping their original spelling.
     */
    public List<String> segment(final String text, final String languageCode) {
        final Analyzer segmenter = segmenters.computeIfAbsent(segmenterKey(languageCode), DocumentNormalizer::createSegmenter);
        final List<String> tokens = new ArrayList<>();
        try (final TokenStream stream = segmenter.tokenStream("content", text)) {
            final CharTermAttribute term = stream.addAttribute(CharTermAttribute.class);
            stream.reset();
            while (stream.incrementToken()) {
                tokens.add(term.toString());
            }
            stream.end();
        } catch (final IOException e) {
            throw new UncheckedIOException("Failed to segment text", e);
        }
        return tokens;
    }

    @Override
    public void close() {
        segmenters.values().forEach(Analyzer::close);
        segmenters.clear();
    }

    private static String segmenterKey(final String languageCode) {
        return IndexLanguage.fromCode(languageCode).orElse(IndexLanguage.ENGLISH) == IndexLanguage.CHINESE ? "zh" : "icu";
    }

    private static Analyzer createSegmenter(final String key) {
        return new Analyzer() {
            @Override
            protected TokenStreamComponents createComponents(final String fieldName) {
                final Tokenizer tokenizer = "zh".equals(key) ? new HMMChineseTokenizer() : new ICUTokenizer();
                return new TokenStreamComponents(tokenizer);
            }
        };
    }
}
