package org.puneet.cheops.ageing.analysis;

import org.puneet.cheops.ageing.config.AnalysisCatalog;
import org.puneet.cheops.ageing.config.AnalysisType;
import org.puneet.cheops.ageing.exceptions.AnalysisException;
import org.puneet.cheops.ageing.exceptions.ValidationException;
import org.puneet.cheops.ageing.model.NoiseProfile;
import org.puneet.cheops.ageing.model.StatisticSet;
import org.puneet.cheops.ageing.model.TimeSeries;
import org.puneet.cheops.ageing.statistical.NoiseEstimator;
import org.puneet.cheops.ageing.statistical.OutlierFilter;
import org.puneet.cheops.ageing.statistical.RobustStatistics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.Objects;

/**
 * Pure computation boundary: {@code compute(selection) -> result}.
 *
 * <p>The engine keeps no state between calls beyond its collaborators. Triggering and caching
 * belong to the caller (see {@link CachingAnalysisEngine}). A pass runs the outlier filter when
 * requested, then the descriptive statistics, then the noise profile for lightcurve types.
 * Direct-value types skip the filter and return the valid raw values.</p>
 *
 * @author CHEOPS Ageing Monitoring Framework
 * @version 1.0.0
 * @since 2025-09-02
 */
public class AnalysisEngine implements SelectionAnalyzer {
    private static final Logger logger = LoggerFactory.getLogger(AnalysisEngine.class);

    private final SeriesSource seriesSource;
    private final NoiseEstimator noiseEstimator;

    public AnalysisEngine(SeriesSource seriesSource) {
        this(seriesSource, new NoiseEstimator());
    }

    public AnalysisEngine(SeriesSource seriesSource, NoiseEstimator noiseEstimator) {
        this.seriesSource = Objects.requireNonNull(seriesSource, "seriesSource cannot be null");
        this.noiseEstimator = Objects.requireNonNull(noiseEstimator, "noiseEstimator cannot be null");
    }

    /**
     * Loads the series of a selection and analyzes it.
     *
     * @param selection the selection
     * @return the result
     * @throws AnalysisException if the selection is invalid or its data cannot be loaded
     */
    @Override
    public AnalysisResult compute(Selection selection) throws AnalysisException {
        try {
            validate(selection);
        } catch (ValidationException e) {
            throw AnalysisException.invalidSelection(e);
        }

        TimeSeries series;
        try {
            series = seriesSource.load(selection.getTarget(), selection.getAnalysisType(), selection.getParameter());
        } catch (IOException e) {
            throw AnalysisException.sourceUnavailable(selection.getTarget(), selection.getParameter(), e);
        } catch (ValidationException e) {
            AnalysisException ex = new AnalysisException(
                    AnalysisException.AnalysisErrorType.SERIES_CONSTRUCTION_ERROR,
                    "Malformed series for " + selection, e);
            ex.addContext("target", selection.getTarget());
            ex.addContext("parameter", selection.getParameter());
            throw ex;
        }

        try {
            return compute(selection, series);
        } catch (ValidationException e) {
            throw AnalysisException.invalidSelection(e);
        }
    }

    /**
     * Analyzes an already loaded series.
     *
     * @param selection the selection the series belongs to
     * @param series the raw series
     * @return the result
     * @throws ValidationException if the parameter does not belong to the analysis type, the
     *         multiplier is invalid while filtering is requested, or a bin width is invalid
     */
    public AnalysisResult compute(Selection selection, TimeSeries series) throws ValidationException {
        validate(selection);
        AnalysisType type = selection.getAnalysisType();

        if (!type.isCalculateStats()) {
            logger.debug("{} reports direct values, {} valid samples", type.getDisplayName(), series.validCount());
            return new AnalysisResult(selection, null, null, series.validValues(), series.size(), 0);
        }

        TimeSeries analyzed = series;
        int rejected = 0;
        if (selection.isRemoveOutliers()) {
            OutlierFilter.FilterResult filtered = new OutlierFilter(selection.getOutlierMultiplier()).apply(series);
            analyzed = filtered.getFilteredSeries();
            rejected = filtered.getRejectedCount();
        }

        StatisticSet statistics = RobustStatistics.compute(analyzed);
        NoiseProfile noise = null;
        if (type.isBinnedNoiseApplicable()) {
            noise = noiseEstimator.estimate(analyzed, selection.getBinWidthsHours());
        }

        if (statistics.isEmpty()) {
            logger.warn("No valid samples for {}, statistics are NaN", selection);
        } else {
            logger.debug("Computed {}: n={}, rejected={}", selection, statistics.getSampleSize(), rejected);
        }
        return new AnalysisResult(selection, statistics, noise, null, series.size(), rejected);
    }

    private static void validate(Selection selection) throws ValidationException {
        if (selection == null) {
            throw ValidationException.nullValue("selection");
        }
        AnalysisCatalog.requireParameter(selection.getAnalysisType(), selection.getParameter());
    }
}
