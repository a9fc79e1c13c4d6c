package de.mirkosertic.bayes.analysis;

import java.util.concurrent.atomic.AtomicLong;

/**
 * Thread-safe counters for {@link CachingTermTokenizer}.
 */
public class TokenizerCacheStats {

    private final AtomicLong hits = new AtomicLong(0);
    private final AtomicLong misses = new AtomicLong(0);
    private final AtomicLong evictions = new AtomicLong(0);
    private final AtomicLong currentSize = new AtomicLong(0);

    public void recordHit() {
        hits.incrementAndGet();
    }

    public void recordMiss() {
        misses.incrementAndGet();
    }

    public void recordEviction() {
        evictions.incrementAndGet();
    }

    public void setCurrentSize(final long size) {
        currentSize.set(size);
    }

    public long getTotalRequests() {
        return hits.get() + misses.get();
    }

    public long getCacheHits() {
        return hits.get();
    }

    public long getCacheMisses() {
        return misses.get();
    }

    public long getEvictions() {
        return evictions.get();
    }

    public long getCurrentSize() {
        return currentSize.get();
    }

    /**
     * Hit rate as a percentage (0-100), 0.0 before the first request.
     */
    public double getHitRate() {
        final long total = getTotalRequests();
        if (total == 0) {
            return 0.0;
        }
        return (hits.get() * 100.0) / total;
    }

    @Override
    public String toString() {
        return String.format(
                "TokenizerCacheStats[total=%d, hits=%d, misses=%d, hitRate=%.1f%%, size=%d, evictions=%d]",
                getTotalRequests(),
                getCacheHits(),
                getCacheMisses(),
                getHitRate(),
                getCurrentSize(),
                getEvictions()
        );
    }
}
