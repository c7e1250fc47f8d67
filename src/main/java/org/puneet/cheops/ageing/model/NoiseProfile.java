package org.puneet.cheops.ageing.model;

import java.util.Collections;
import java.util.Map;
import java.util.NavigableMap;
import java.util.Objects;
import java.util.TreeMap;

/**
 * Binned-noise estimates of one series keyed by bin width in hours, in ascending width order.
 *
 * @author CHEOPS Ageing Monitoring Framework
 * @version 1.0.0
 * @since 2025-09-02
 */
public final class NoiseProfile {

    private final NavigableMap<Double, NoiseEstimate> estimates;

    public NoiseProfile(Map<Double, NoiseEstimate> estimates) {
        Objects.requireNonNull(estimates, "estimates cannot be null");
        this.estimates = Collections.unmodifiableNavigableMap(new TreeMap<>(estimates));
    }

    /**
     * @param binWidthHours a bin width that was evaluated
     * @return the estimate, or null if the width was not part of this profile
     */
    public NoiseEstimate get(double binWidthHours) {
        return estimates.get(binWidthHours);
    }

    /**
     * @return the noise value for the width, NaN if absent or insufficient
     */
    public double valueOrNaN(double binWidthHours) {
        NoiseEstimate estimate = estimates.get(binWidthHours);
        return estimate != null ? estimate.orNaN() : Double.NaN;
    }

    public NavigableMap<Double, NoiseEstimate> asMap() {
        return estimates;
    }

    public int size() {
        return estimates.size();
    }

    /**
     * Column name used for a bin width, e.g. {@code FLUX_bin_noise_1h} or {@code FLUX_bin_noise_0.5h}.
     */
    public static String columnName(String parameter, double binWidthHours) {
        String width = binWidthHours == Math.rint(binWidthHours)
                ? String.valueOf((long) binWidthHours)
                : String.valueOf(binWidthHours);
        return parameter + "_bin_noise_" + width + "h";
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (obj == null || getClass() != obj.getClass()) return false;
        return estimates.equals(((NoiseProfile) obj).estimates);
    }

    @Override
    public int hashCode() {
        return estimates.hashCode();
    }

    @Override
    public String toString() {
        return "NoiseProfile" + estimates;
    }
}
