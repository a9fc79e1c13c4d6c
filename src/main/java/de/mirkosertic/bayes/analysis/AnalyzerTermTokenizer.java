package de.mirkosertic.bayes.analysis;

import de.mirkosertic.bayes.util.TextCleaner;
import org.apache.lucene.analysis.Analyzer;
import org.apache.lucene.analysis.TokenStream;
import org.apache.lucene.analysis.tokenattributes.CharTermAttribute;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * {@link TermTokenizer} backed by a Lucene {@link Analyzer}.
 *
 * <p>The text is cleaned with {@link TextCleaner} first, then every token the analyzer emits
 * is counted. Terms keep the order of their first occurrence.</p>
 */
public class AnalyzerTermTokenizer implements TermTokenizer, AutoCloseable {

    private static final String FIELD_NAME = "content";

    private final Analyzer analyzer;

    public AnalyzerTermTokenizer(final Analyzer analyzer) {
        this.analyzer = Objects.requireNonNull(analyzer, "analyzer");
    }

    @Override
    public Map<String, Integer> tokenize(final String text) {
        final String cleaned = TextCleaner.clean(text);
        if (cleaned == null || cleaned.isEmpty()) {
            return Map.of();
        }

        final Map<String, Integer> counts = new LinkedHashMap<>();
        try (final TokenStream tokenStream = analyzer.tokenStream(FIELD_NAME, cleaned)) {
            final CharTermAttribute termAttr = tokenStream.addAttribute(CharTermAttribute.class);
            tokenStream.reset();
            while (tokenStream.incrementToken()) {
                counts.merge(termAttr.toString(), 1, Integer::sum);
            }
            tokenStream.end();
        } catch (final IOException e) {
            throw new UncheckedIOException("Failed to analyze text", e);
        }
        return Collections.unmodifiableMap(counts);
    }

    public Analyzer getAnalyzer() {
        return analyzer;
    }

    @Override
    public void close() {
        analyzer.close();
    }
}
