package org.puneet.cheops.ageing.analysis;

import org.puneet.cheops.ageing.model.NoiseProfile;
import org.puneet.cheops.ageing.model.StatisticSet;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Output of one {@link AnalysisEngine#compute(Selection)} pass.
 *
 * <p>Statistic types carry a {@link StatisticSet} and, for lightcurve types, a
 * {@link NoiseProfile}. Direct-value types carry only the retained raw values.</p>
 *
 * @author CHEOPS Ageing Monitoring Framework
 * @version 1.0.0
 * @since 2025-09-02
 */
public final class AnalysisResult {

    private final Selection selection;
    private final StatisticSet statistics;
    private final NoiseProfile noiseProfile;
    private final double[] directValues;
    private final int sampleCount;
    private final int rejectedCount;

    AnalysisResult(Selection selection, StatisticSet statistics, NoiseProfile noiseProfile,
                   double[] directValues, int sampleCount, int rejectedCount) {
        this.selection = Objects.requireNonNull(selection, "selection cannot be null");
        this.statistics = statistics;
        this.noiseProfile = noiseProfile;
        this.directValues = directValues;
        this.sampleCount = sampleCount;
        this.rejectedCount = rejectedCount;
    }

    public Selection getSelection() {
        return selection;
    }

    /**
     * @return the statistics, empty for direct-value analysis types
     */
    public Optional<StatisticSet> getStatistics() {
        return Optional.ofNullable(statistics);
    }

    /**
     * @return the noise profile, present only for lightcurve analysis types
     */
    public Optional<NoiseProfile> getNoiseProfile() {
        return Optional.ofNullable(noiseProfile);
    }

    /**
     * @return raw retained values for direct-value types, an empty array otherwise
     */
    public double[] getDirectValues() {
        return directValues != null ? directValues.clone() : new double[0];
    }

    public boolean isDirectValues() {
        return directValues != null;
    }

    /**
     * @return number of samples in the loaded series, valid or not
     */
    public int getSampleCount() {
        return sampleCount;
    }

    /**
     * @return number of valid samples removed by the outlier filter
     */
    public int getRejectedCount() {
        return rejectedCount;
    }

    /**
     * Renders the result as summary-table columns, e.g. {@code FLUX_mean} and
     * {@code FLUX_bin_noise_1h}.
     */
    public Map<String, Double> toColumns() {
        Map<String, Double> columns = new LinkedHashMap<>();
        String parameter = selection.getParameter();
        if (statistics != null) {
            columns.putAll(statistics.toColumns(parameter));
        }
        if (noiseProfile != null) {
            noiseProfile.asMap().forEach((width, estimate) ->
                    columns.put(NoiseProfile.columnName(parameter, width), estimate.orNaN()));
        }
        return columns;
    }

    @Override
    public String toString() {
        return String.format("AnalysisResult{%s, samples=%d, rejected=%d, stats=%s, noise=%s}",
                selection, sampleCount, rejectedCount, statistics, noiseProfile);
    }
}
