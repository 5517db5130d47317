package de.mirkosertic.dbsearch;

import org.apache.lucene.analysis.Analyzer;
import org.apache.lucene.analysis.DelegatingAnalyzerWrapper;

/**
 * Analyzer handed to the {@code IndexWriter} once, whose actual analysis can be switched
 * to another language at runtime. Token stream components are cached per delegate, so a
 * switch takes effect for the next document or query.
 */
public class LanguageSwitchingAnalyzer extends DelegatingAnalyzerWrapper {

    private volatile Analyzer delegate;

    public LanguageSwitchingAnalyzer(final Analyzer initialDelegate) {
        super(PER_FIELD_REUSE_STRATEGY);
        this.delegate = initialDelegate;
    }

    public void switchTo(final Analyzer newDelegate) {
        this.delegate = newDelegate;
    }

    @Override
    protected Analyzer getWrappedAnalyzer(final String fieldName) {
        return delegate;
    }
}
