package org.puneet.cheops.ageing.analysis;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Process-wide memo of analysis results keyed by the full selection tuple.
 *
 * <p>Every invalidation advances a generation counter. A result computed under an older
 * generation is not stored, so a computation that overlapped a source-data change cannot
 * repopulate the cache with stale values.</p>
 *
 * @author CHEOPS Ageing Monitoring Framework
 * @version 1.0.0
 * @since 2025-09-02
 */
public class ResultCache {
    private static final Logger logger = LoggerFactory.getLogger(ResultCache.class);

    private final Map<Selection, AnalysisResult> entries = new ConcurrentHashMap<>();
    private final AtomicLong generation = new AtomicLong();
    private final AtomicLong hits = new AtomicLong();
    private final AtomicLong misses = new AtomicLong();

    public Optional<AnalysisResult> get(Selection selection) {
        AnalysisResult result = entries.get(selection);
        if (result != null) {
            hits.incrementAndGet();
        } else {
            misses.incrementAndGet();
        }
        return Optional.ofNullable(result);
    }

    /**
     * @return the current generation; pass it to {@link #put} once the computation completes
     */
    public long currentGeneration() {
        return generation.get();
    }

    /**
     * Stores a result unless the cache was invalidated since {@code computedAt} was read.
     *
     * @return true if the result was stored
     */
    public boolean put(Selection selection, AnalysisResult result, long computedAt) {
        synchronized (generation) {
            if (computedAt != generation.get()) {
                logger.debug("Discarding stale result for {}", selection);
                return false;
            }
            entries.put(selection, result);
            return true;
        }
    }

    /**
     * Drops every entry of a target after its source data changed.
     *
     * @return number of entries removed
     */
    public int invalidateTarget(String target) {
        synchronized (generation) {
            generation.incrementAndGet();
            int before = entries.size();
            entries.keySet().removeIf(selection -> selection.getTarget().equals(target));
            int removed = before - entries.size();
            logger.info("Invalidated {} cached result(s) for target {}", removed, target);
            return removed;
        }
    }

    public void invalidateAll() {
        synchronized (generation) {
            generation.incrementAndGet();
            int removed = entries.size();
            entries.clear();
            logger.info("Invalidated all {} cached result(s)", removed);
        }
    }

    public int size() {
        return entries.size();
    }

    public long getHitCount() {
        return hits.get();
    }

    public long getMissCount() {
        return misses.get();
    }
}
