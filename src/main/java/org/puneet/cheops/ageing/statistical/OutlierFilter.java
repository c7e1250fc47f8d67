package org.puneet.cheops.ageing.statistical;

import org.puneet.cheops.ageing.config.AnalysisConfig;
import org.puneet.cheops.ageing.exceptions.ValidationException;
import org.puneet.cheops.ageing.model.TimeSeries;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Single-pass MAD outlier rejection.
 *
 * <p>Bounds are {@code median ± k · 1.4826 · MAD} of the valid values, inclusive. When the MAD is
 * zero the bounds collapse to {@code [median, median]}: values equal to the median are kept and
 * every other value is rejected. The bounds are estimated once; the filtered data is never
 * re-estimated.</p>
 *
 * @author CHEOPS Ageing Monitoring Framework
 * @version 1.0.0
 * @since 2025-09-02
 */
public class OutlierFilter {
    private static final Logger logger = LoggerFactory.getLogger(OutlierFilter.class);

    private final double multiplier;

    /**
     * @param multiplier robust-sigma multiplier k
     * @throws ValidationException if k is not a positive finite number
     */
    public OutlierFilter(double multiplier) throws ValidationException {
        if (!Double.isFinite(multiplier) || multiplier <= 0) {
            throw ValidationException.outOfRange("outlierMultiplier", multiplier, "> 0 and finite");
        }
        this.multiplier = multiplier;
    }

    public double getMultiplier() {
        return multiplier;
    }

    /**
     * Computes the acceptance bounds of a value set.
     *
     * @param values values, NaN entries are ignored
     * @return the bounds; all fields are NaN when there is no finite value
     */
    public Bounds computeBounds(double[] values) {
        double median = RobustStatistics.median(values);
        double mad = RobustStatistics.mad(values);
        double robustSigma = AnalysisConfig.ROBUST_SIGMA_SCALE * mad;
        double lower = median - multiplier * robustSigma;
        double upper = median + multiplier * robustSigma;
        return new Bounds(median, mad, robustSigma, lower, upper);
    }

    /**
     * Builds the validity mask of a raw value array. NaN values are invalid.
     */
    public boolean[] mask(double[] values) {
        Bounds bounds = computeBounds(values);
        boolean[] mask = new boolean[values.length];
        for (int i = 0; i < values.length; i++) {
            mask[i] = bounds.accepts(values[i]);
        }
        return mask;
    }

    /**
     * @return the values that fall inside the bounds, in their original order
     */
    public double[] filterValues(double[] values) {
        boolean[] mask = mask(values);
        int kept = 0;
        for (boolean m : mask) {
            if (m) kept++;
        }
        double[] out = new double[kept];
        int j = 0;
        for (int i = 0; i < values.length; i++) {
            if (mask[i]) {
                out[j++] = values[i];
            }
        }
        return out;
    }

    /**
     * Filters a series. Samples that were already invalid stay invalid.
     *
     * @param series the series to filter
     * @return the mask, the filtered series and the bounds used
     */
    public FilterResult apply(TimeSeries series) {
        double[] values = series.getValues();
        boolean[] valid = series.getValidMask();

        double[] candidates = new double[values.length];
        for (int i = 0; i < values.length; i++) {
            candidates[i] = valid[i] ? values[i] : Double.NaN;
        }

        Bounds bounds = computeBounds(candidates);
        boolean[] mask = new boolean[values.length];
        int rejected = 0;
        for (int i = 0; i < values.length; i++) {
            mask[i] = valid[i] && bounds.accepts(values[i]);
            if (valid[i] && !mask[i]) {
                rejected++;
            }
        }

        TimeSeries filtered;
        try {
            filtered = series.withMask(mask);
        } catch (ValidationException e) {
            // the mask is built from the series itself
            throw new IllegalStateException("Mask length diverged from series length", e);
        }

        if (rejected > 0) {
            logger.debug("Rejected {} of {} valid samples outside [{}, {}] (k={})",
                    rejected, series.validCount(), bounds.getLower(), bounds.getUpper(), multiplier);
        }
        return new FilterResult(filtered, mask, bounds, rejected);
    }

    /**
     * Acceptance interval of the filter.
     */
    public static final class Bounds {
        private final double median;
        private final double mad;
        private final double robustSigma;
        private final double lower;
        private final double upper;

        Bounds(double median, double mad, double robustSigma, double lower, double upper) {
            this.median = median;
            this.mad = mad;
            this.robustSigma = robustSigma;
            this.lower = lower;
            this.upper = upper;
        }

        /**
         * @return true if the value lies in {@code [lower, upper]}; NaN is never accepted
         */
        public boolean accepts(double value) {
            return value >= lower && value <= upper;
        }

        public double getMedian() {
            return median;
        }

        public double getMad() {
            return mad;
        }

        public double getRobustSigma() {
            return robustSigma;
        }

        public double getLower() {
            return lower;
        }

        public double getUpper() {
            return upper;
        }

        @Override
        public String toString() {
            return String.format("Bounds[%.6g, %.6g] (median=%.6g, mad=%.6g)", lower, upper, median, mad);
        }
    }

    /**
     * Output of {@link #apply(TimeSeries)}.
     */
    public static final class FilterResult {
        private final TimeSeries filteredSeries;
        private final boolean[] mask;
        private final Bounds bounds;
        private final int rejectedCount;

        FilterResult(TimeSeries filteredSeries, boolean[] mask, Bounds bounds, int rejectedCount) {
            this.filteredSeries = filteredSeries;
            this.mask = mask;
            this.bounds = bounds;
            this.rejectedCount = rejectedCount;
        }

        public TimeSeries getFilteredSeries() {
            return filteredSeries;
        }

        public boolean[] getMask() {
            return mask.clone();
        }

        public Bounds getBounds() {
            return bounds;
        }

        /**
         * @return number of previously valid samples the filter rejected
         */
        public int getRejectedCount() {
            return rejectedCount;
        }

        public double[] getRetainedValues() {
            return filteredSeries.validValues();
        }
    }
}
