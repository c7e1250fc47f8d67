package org.puneet.cheops.ageing.model;

import java.util.Optional;

/**
 * Descriptor computed for every parameter. The key is the suffix used in statistic
 * column names such as {@code FLUX_median}.
 *
 * @author CHEOPS Ageing Monitoring Framework
 * @version 1.0.0
 * @since 2025-09-02
 */
public enum Metric {
    MEAN("mean", "Average value"),
    MEDIAN("median", "Middle value (less sensitive to outliers)"),
    SIGMA("sigma", "Standard deviation"),
    MAD("mad", "Median Absolute Deviation"),
    MIN("min", "Minimum value"),
    MAX("max", "Maximum value"),
    PTP("ptp", "Peak-to-peak range (max - min)"),
    P01("p01", "1st percentile"),
    P99("p99", "99th percentile"),
    SKEW("skew", "Distribution asymmetry"),
    KURTOSIS("kurtosis", "Distribution tail heaviness");

    private final String key;
    private final String definition;

    Metric(String key, String definition) {
        this.key = key;
        this.definition = definition;
    }

    public String getKey() {
        return key;
    }

    public String getDefinition() {
        return definition;
    }

    /**
     * Looks a metric up by its column suffix.
     *
     * @param key suffix such as {@code "p99"}
     * @return the metric, or empty if the key is unknown
     */
    public static Optional<Metric> fromKey(String key) {
        for (Metric metric : values()) {
            if (metric.key.equals(key)) {
                return Optional.of(metric);
            }
        }
        return Optional.empty();
    }
}
