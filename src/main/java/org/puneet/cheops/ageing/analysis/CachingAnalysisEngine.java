package org.puneet.cheops.ageing.analysis;

import org.puneet.cheops.ageing.exceptions.AnalysisException;

import java.util.Objects;
import java.util.Optional;

/**
 * Front for an analyzer such as {@link AnalysisEngine} that memoizes results in a {@link ResultCache}.
 * Failures are never cached.
 *
 * @author CHEOPS Ageing Monitoring Framework
 * @version 1.0.0
 * @since 2025-09-02
 */
public class CachingAnalysisEngine implements SelectionAnalyzer {

    private final SelectionAnalyzer delegate;
    private final ResultCache cache;

    public CachingAnalysisEngine(SelectionAnalyzer delegate) {
        this(delegate, new ResultCache());
    }

    public CachingAnalysisEngine(SelectionAnalyzer delegate, ResultCache cache) {
        this.delegate = Objects.requireNonNull(delegate, "delegate cannot be null");
        this.cache = Objects.requireNonNull(cache, "cache cannot be null");
    }

    @Override
    public AnalysisResult compute(Selection selection) throws AnalysisException {
        Optional<AnalysisResult> cached = cache.get(selection);
        if (cached.isPresent()) {
            return cached.get();
        }
        long generation = cache.currentGeneration();
        AnalysisResult result = delegate.compute(selection);
        cache.put(selection, result, generation);
        return result;
    }

    /**
     * Called when the source data of a target changed.
     */
    public void invalidateTarget(String target) {
        cache.invalidateTarget(target);
    }

    public void invalidateAll() {
        cache.invalidateAll();
    }

    public ResultCache getCache() {
        return cache;
    }
}
