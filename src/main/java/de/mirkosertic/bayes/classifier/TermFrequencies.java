package de.mirkosertic.bayes.classifier;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Mutable term-count table.
 *
 * <p>Absent terms count as zero: {@link #get(String)} never fails for an unknown term.
 * Counts never go negative, removal is clamped at zero. Keys are never deleted once
 * observed, so a term untrained down to zero still counts as a unique term.</p>
 *
 * <p>Not thread-safe; callers synchronize.</p>
 */
public final class TermFrequencies {

    private final Map<String, Long> counts = new LinkedHashMap<>();
    private long total;

    /**
     * Returns the count for {@code term}, or 0 if the term was never recorded.
     */
    public long get(final String term) {
        final Long count = counts.get(term);
        return count == null ? 0L : count;
    }

    public boolean contains(final String term) {
        return counts.containsKey(term);
    }

    /**
     * Adds {@code count} occurrences of {@code term}.
     *
     * @throws IllegalArgumentException if count is negative
     */
    public void add(final String term, final long count) {
        if (count < 0) {
            throw new IllegalArgumentException("count must be >= 0, got " + count + " for term '" + term + "'");
        }
        counts.merge(term, count, Long::sum);
        total += count;
    }

    /**
     * Removes up to {@code count} occurrences of {@code term}, clamping at zero.
     * Unknown terms are left untouched.
     *
     * @return the number of occurrences actually removed
     */
    public long removeClamped(final String term, final long count) {
        if (count < 0) {
            throw new IllegalArgumentException("count must be >= 0, got " + count + " for term '" + term + "'");
        }
        final Long current = counts.get(term);
        if (current == null) {
            return 0L;
        }
        final long removed = Math.min(count, current);
        counts.put(term, current - removed);
        total -= removed;
        return removed;
    }

    /**
     * Sum of all counts.
     */
    public long total() {
        return total;
    }

    /**
     * Number of distinct terms ever recorded, including those clamped down to zero.
     */
    public int uniqueTerms() {
        return counts.size();
    }

    public boolean isEmpty() {
        return total == 0L;
    }

    /**
     * Read-only view in insertion order.
     */
    public Map<String, Long> asMap() {
        return Collections.unmodifiableMap(counts);
    }

    @Override
    public String toString() {
        return "TermFrequencies[unique=" + counts.size() + ", total=" + total + "]";
    }
}
