package de.mirkosertic.bayes.analysis;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.RemovalCause;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Memoizing wrapper around another {@link TermTokenizer}.
 *
 * <p>Classifying the same text against a trained model, or training from corpora with
 * repeated lines, analyzes identical strings over and over. The wrapper keeps the term
 * tables of recently seen texts in a bounded Caffeine cache keyed by the raw text.
 * Cached tables are immutable, so handing the same instance to several callers is safe.</p>
 *
 * <p>Relies on the delegate being deterministic, which every {@link TermTokenizer} must be.</p>
 */
public class CachingTermTokenizer implements TermTokenizer {

    private final TermTokenizer delegate;
    private final Cache<String, Map<String, Integer>> cache;
    private final TokenizerCacheStats stats;

    /**
     * @param delegate     tokenizer consulted on cache misses
     * @param maximumSize  maximum number of cached texts
     * @param stats        collector for hits, misses and evictions
     */
    public CachingTermTokenizer(final TermTokenizer delegate, final long maximumSize, final TokenizerCacheStats stats) {
        if (maximumSize <= 0) {
            throw new IllegalArgumentException("maximumSize must be > 0, got " + maximumSize);
        }
        this.delegate = Objects.requireNonNull(delegate, "delegate");
        this.stats = Objects.requireNonNull(stats, "stats");
        this.cache = Caffeine.newBuilder()
                .maximumSize(maximumSize)
                .evictionListener((String key, Map<String, Integer> value, RemovalCause cause) -> {
                    if (cause.wasEvicted()) {
                        stats.recordEviction();
                    }
                })
                .build();
    }

    /**
     * Wraps {@code delegate} when {@code maximumSize} is positive, returns it unchanged otherwise.
     */
    public static TermTokenizer wrap(final TermTokenizer delegate, final long maximumSize, final TokenizerCacheStats stats) {
        if (maximumSize <= 0) {
            return delegate;
        }
        return new CachingTermTokenizer(delegate, maximumSize, stats);
    }

    @Override
    public Map<String, Integer> tokenize(final String text) {
        if (text == null || text.isEmpty()) {
            return Map.of();
        }

        final Map<String, Integer> cached = cache.getIfPresent(text);
        if (cached != null) {
            stats.recordHit();
            return cached;
        }

        final Map<String, Integer> terms = Collections.unmodifiableMap(new LinkedHashMap<>(delegate.tokenize(text)));
        cache.put(text, terms);
        stats.recordMiss();
        stats.setCurrentSize(cache.estimatedSize());
        return terms;
    }

    public TokenizerCacheStats getStats() {
        return stats;
    }

    /**
     * Drops all cached entries.
     */
    public void invalidateAll() {
        cache.invalidateAll();
        stats.setCurrentSize(0);
    }
}
