package org.puneet.cheops.ageing.model;

import java.util.Objects;
import java.util.Optional;

/**
 * Outcome of a binned-noise estimate for one bin width: either a value or an
 * insufficient-data marker with the reason it could not be evaluated.
 *
 * @author CHEOPS Ageing Monitoring Framework
 * @version 1.0.0
 * @since 2025-09-02
 */
public final class NoiseEstimate {

    /**
     * Why a noise value could not be produced.
     */
    public enum InsufficiencyReason {
        TOO_FEW_VALUES("Fewer than two valid values"),
        NO_TIME_INFORMATION("No usable time information"),
        MISALIGNED_ARRAYS("Time and value arrays differ in length"),
        TOO_FEW_BINS("Fewer than two populated bins");

        private final String description;

        InsufficiencyReason(String description) {
            this.description = description;
        }

        public String getDescription() {
            return description;
        }
    }

    private final double value;
    private final InsufficiencyReason reason;
    private final int binCount;

    private NoiseEstimate(double value, InsufficiencyReason reason, int binCount) {
        this.value = value;
        this.reason = reason;
        this.binCount = binCount;
    }

    /**
     * @param value standard deviation of the bin means
     * @param binCount number of populated bins the value was computed from
     */
    public static NoiseEstimate of(double value, int binCount) {
        return new NoiseEstimate(value, null, binCount);
    }

    public static NoiseEstimate insufficient(InsufficiencyReason reason) {
        return insufficient(reason, 0);
    }

    public static NoiseEstimate insufficient(InsufficiencyReason reason, int binCount) {
        Objects.requireNonNull(reason, "reason cannot be null");
        return new NoiseEstimate(Double.NaN, reason, binCount);
    }

    public boolean isAvailable() {
        return reason == null;
    }

    /**
     * @return the noise value
     * @throws IllegalStateException if the estimate is insufficient
     */
    public double getValue() {
        if (reason != null) {
            throw new IllegalStateException("Noise estimate unavailable: " + reason.getDescription());
        }
        return value;
    }

    /**
     * @return the noise value, or NaN when the estimate is insufficient
     */
    public double orNaN() {
        return value;
    }

    public Optional<InsufficiencyReason> getReason() {
        return Optional.ofNullable(reason);
    }

    public int getBinCount() {
        return binCount;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (obj == null || getClass() != obj.getClass()) return false;
        NoiseEstimate that = (NoiseEstimate) obj;
        return Double.compare(value, that.value) == 0
                && binCount == that.binCount
                && reason == that.reason;
    }

    @Override
    public int hashCode() {
        return Objects.hash(value, reason, binCount);
    }

    @Override
    public String toString() {
        return isAvailable()
                ? String.format("NoiseEstimate{value=%.6g, bins=%d}", value, binCount)
                : String.format("NoiseEstimate{insufficient=%s, bins=%d}", reason, binCount);
    }
}
