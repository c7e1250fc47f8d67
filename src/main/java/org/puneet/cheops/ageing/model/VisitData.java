package org.puneet.cheops.ageing.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Parameter series extracted from the data product of one visit.
 *
 * @author CHEOPS Ageing Monitoring Framework
 * @version 1.0.0
 * @since 2025-09-02
 */
public final class VisitData {

    private final String target;
    private final double visitTime;
    private final String fileName;
    private final int observationCount;
    private final Map<String, TimeSeries> series;

    /**
     * @param target target name
     * @param visitTime visit time in MJD, taken from the first sample of the product
     * @param fileName name of the file the data came from
     * @param observationCount number of rows in the product
     * @param series parameter name to series, in column order
     */
    public VisitData(String target, double visitTime, String fileName, int observationCount,
                     Map<String, TimeSeries> series) {
        this.target = Objects.requireNonNull(target, "target cannot be null");
        this.visitTime = visitTime;
        this.fileName = fileName;
        this.observationCount = observationCount;
        this.series = Collections.unmodifiableMap(new LinkedHashMap<>(
                Objects.requireNonNull(series, "series cannot be null")));
    }

    public String getTarget() {
        return target;
    }

    public double getVisitTime() {
        return visitTime;
    }

    public String getFileName() {
        return fileName;
    }

    public int getObservationCount() {
        return observationCount;
    }

    public Map<String, TimeSeries> getSeries() {
        return series;
    }

    public Optional<TimeSeries> getSeries(String parameter) {
        return Optional.ofNullable(series.get(parameter));
    }

    @Override
    public String toString() {
        return String.format("VisitData{target='%s', visitTime=%.5f, file='%s', parameters=%s}",
                target, visitTime, fileName, series.keySet());
    }
}
