package org.puneet.cheops.ageing.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * One row of a visit summary table: the statistic columns of every usable parameter of a
 * visit, or the raw values for analysis types that report direct values.
 *
 * @author CHEOPS Ageing Monitoring Framework
 * @version 1.0.0
 * @since 2025-09-02
 */
public final class VisitSummary {

    private final String target;
    private final double visitTime;
    private final String fileName;
    private final int observationCount;
    private final Map<String, Double> columns;
    private final Map<String, double[]> directValues;

    public VisitSummary(String target, double visitTime, String fileName, int observationCount,
                        Map<String, Double> columns, Map<String, double[]> directValues) {
        this.target = Objects.requireNonNull(target, "target cannot be null");
        this.visitTime = visitTime;
        this.fileName = fileName;
        this.observationCount = observationCount;
        this.columns = Collections.unmodifiableMap(new LinkedHashMap<>(columns));
        Map<String, double[]> copy = new LinkedHashMap<>();
        directValues.forEach((name, values) -> copy.put(name, values.clone()));
        this.directValues = Collections.unmodifiableMap(copy);
    }

    public String getTarget() {
        return target;
    }

    /**
     * @return visit time in MJD
     */
    public double getVisitTime() {
        return visitTime;
    }

    /**
     * Day-resolution visit key on which statistics of different analysis types of one visit
     * are matched.
     *
     * @return the visit time truncated to 00:00 UTC, in MJD
     */
    public double getVisitDay() {
        return Math.floor(visitTime);
    }

    public String getFileName() {
        return fileName;
    }

    public int getObservationCount() {
        return observationCount;
    }

    /**
     * @return statistic column values in insertion order
     */
    public Map<String, Double> getColumns() {
        return columns;
    }

    /**
     * @return the column value, NaN if the visit has no such column
     */
    public double getColumn(String name) {
        Double value = columns.get(name);
        return value != null ? value : Double.NaN;
    }

    public boolean hasColumn(String name) {
        return columns.containsKey(name);
    }

    /**
     * @return raw values of a direct-value parameter, or an empty array
     */
    public double[] getDirectValues(String parameter) {
        double[] values = directValues.get(parameter);
        return values != null ? values.clone() : new double[0];
    }

    public Map<String, double[]> getDirectValueMap() {
        return directValues;
    }

    public boolean isEmpty() {
        return columns.isEmpty() && directValues.isEmpty();
    }

    @Override
    public String toString() {
        return String.format("VisitSummary{target='%s', visitTime=%.5f, columns=%d, direct=%s}",
                target, visitTime, columns.size(), directValues.keySet());
    }
}
