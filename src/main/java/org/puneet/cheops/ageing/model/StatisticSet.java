package org.puneet.cheops.ageing.model;

import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Immutable set of descriptive statistics computed from one value set.
 * Metrics that could not be computed hold NaN.
 *
 * @author CHEOPS Ageing Monitoring Framework
 * @version 1.0.0
 * @since 2025-09-02
 */
public final class StatisticSet {

    private final EnumMap<Metric, Double> values;
    private final int sampleSize;

    /**
     * @param values metric values; metrics missing from the map are stored as NaN
     * @param sampleSize number of valid values the statistics were computed from
     */
    public StatisticSet(Map<Metric, Double> values, int sampleSize) {
        Objects.requireNonNull(values, "values cannot be null");
        if (sampleSize < 0) {
            throw new IllegalArgumentException("Sample size cannot be negative: " + sampleSize);
        }
        this.values = new EnumMap<>(Metric.class);
        for (Metric metric : Metric.values()) {
            Double value = values.get(metric);
            this.values.put(metric, value != null ? value : Double.NaN);
        }
        this.sampleSize = sampleSize;
    }

    /**
     * @return a statistic set in which every metric is NaN
     */
    public static StatisticSet empty() {
        return new StatisticSet(Collections.emptyMap(), 0);
    }

    public double get(Metric metric) {
        return values.get(metric);
    }

    public int getSampleSize() {
        return sampleSize;
    }

    /**
     * @return true if no valid values contributed to this set
     */
    public boolean isEmpty() {
        return sampleSize == 0;
    }

    /**
     * Renders the set as prefixed column names, e.g. {@code FLUX_mean}.
     *
     * @param prefix parameter name
     * @return ordered column map
     */
    public Map<String, Double> toColumns(String prefix) {
        Map<String, Double> columns = new LinkedHashMap<>();
        for (Map.Entry<Metric, Double> entry : values.entrySet()) {
            columns.put(prefix + "_" + entry.getKey().getKey(), entry.getValue());
        }
        return columns;
    }

    public Map<Metric, Double> asMap() {
        return Collections.unmodifiableMap(values);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (obj == null || getClass() != obj.getClass()) return false;
        StatisticSet that = (StatisticSet) obj;
        return sampleSize == that.sampleSize && values.equals(that.values);
    }

    @Override
    public int hashCode() {
        return Objects.hash(values, sampleSize);
    }

    @Override
    public String toString() {
        return String.format("StatisticSet{n=%d, mean=%.6g, median=%.6g, sigma=%.6g, mad=%.6g}",
                sampleSize, get(Metric.MEAN), get(Metric.MEDIAN), get(Metric.SIGMA), get(Metric.MAD));
    }
}
