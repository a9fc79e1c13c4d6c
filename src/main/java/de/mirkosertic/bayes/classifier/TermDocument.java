package de.mirkosertic.bayes.classifier;

import de.mirkosertic.bayes.analysis.TermTokenizer;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.function.ObjLongConsumer;

/**
 * A text reduced to its terms and their occurrence counts.
 *
 * <p>Built fresh for every train, untrain and classify call. Term normalization is
 * entirely up to the {@link TermTokenizer}; the same text and tokenizer always yield
 * the same document.</p>
 */
public final class TermDocument {

    private static final TermDocument EMPTY = new TermDocument(Map.of());

    private final Map<String, Integer> termCounts;

    private TermDocument(final Map<String, Integer> termCounts) {
        this.termCounts = termCounts;
    }

    /**
     * Tokenizes {@code text} with the given tokenizer.
     */
    public static TermDocument of(final String text, final TermTokenizer tokenizer) {
        Objects.requireNonNull(tokenizer, "tokenizer");
        if (text == null || text.isEmpty()) {
            return EMPTY;
        }
        return fromCounts(tokenizer.tokenize(text));
    }

    /**
     * Wraps an already computed term-count table. Terms with a count of zero are dropped.
     *
     * @throws IllegalArgumentException if a count is negative
     */
    public static TermDocument fromCounts(final Map<String, Integer> counts) {
        if (counts == null || counts.isEmpty()) {
            return EMPTY;
        }
        final Map<String, Integer> copy = new LinkedHashMap<>();
        for (final Map.Entry<String, Integer> entry : counts.entrySet()) {
            final int count = entry.getValue();
            if (count < 0) {
                throw new IllegalArgumentException("Negative count " + count + " for term '" + entry.getKey() + "'");
            }
            if (count > 0) {
                copy.put(entry.getKey(), count);
            }
        }
        return copy.isEmpty() ? EMPTY : new TermDocument(Collections.unmodifiableMap(copy));
    }

    /**
     * Visits every (term, count) pair exactly once.
     */
    public void forEachTerm(final ObjLongConsumer<String> consumer) {
        for (final Map.Entry<String, Integer> entry : termCounts.entrySet()) {
            consumer.accept(entry.getKey(), entry.getValue());
        }
    }

    public int count(final String term) {
        return termCounts.getOrDefault(term, 0);
    }

    public Map<String, Integer> termCounts() {
        return termCounts;
    }

    public boolean isEmpty() {
        return termCounts.isEmpty();
    }

    @Override
    public String toString() {
        return "TermDocument" + termCounts;
    }
}
