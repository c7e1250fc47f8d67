package org.puneet.cheops.ageing.statistical;

import org.apache.commons.math3.stat.descriptive.DescriptiveStatistics;
import org.apache.commons.math3.stat.descriptive.rank.Median;
import org.apache.commons.math3.stat.descriptive.rank.Percentile;
import org.puneet.cheops.ageing.config.AnalysisConfig;
import org.puneet.cheops.ageing.model.Metric;
import org.puneet.cheops.ageing.model.StatisticSet;
import org.puneet.cheops.ageing.model.TimeSeries;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Arrays;
import java.util.EnumMap;
import java.util.Map;

/**
 * Computes the standard descriptor set of a value set.
 *
 * <p>Conventions:</p>
 * <ul>
 *   <li>NaN and infinite values are dropped before anything is computed.</li>
 *   <li>{@code sigma} is the population standard deviation (divisor n).</li>
 *   <li>Percentiles and the median interpolate linearly between order statistics
 *       (commons-math {@link Percentile.EstimationType#R_7}).</li>
 *   <li>{@code skew} is {@code m3 / m2^1.5} and needs at least 3 values, {@code kurtosis} is the
 *       excess {@code m4 / m2^2 - 3} and needs at least 4; both are NaN when the variance is zero.</li>
 * </ul>
 *
 * @author CHEOPS Ageing Monitoring Framework
 * @version 1.0.0
 * @since 2025-09-02
 */
public final class RobustStatistics {
    private static final Logger logger = LoggerFactory.getLogger(RobustStatistics.class);

    private static final int MIN_SKEW_SAMPLES = 3;
    private static final int MIN_KURTOSIS_SAMPLES = 4;

    private RobustStatistics() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * Computes statistics over the valid samples of a series.
     *
     * @param series the series
     * @return the statistic set, all NaN if the series has no valid sample
     */
    public static StatisticSet compute(TimeSeries series) {
        return computeFinite(series.validValues());
    }

    /**
     * Computes statistics over a raw value array.
     *
     * @param values values, may contain NaN gaps
     * @return the statistic set, all NaN if no value is finite
     */
    public static StatisticSet compute(double[] values) {
        if (values == null) {
            return StatisticSet.empty();
        }
        return computeFinite(finiteValues(values));
    }

    private static StatisticSet computeFinite(double[] data) {
        int n = data.length;
        if (n == 0) {
            logger.debug("No valid values, returning NaN statistics");
            return StatisticSet.empty();
        }

        DescriptiveStatistics stats = new DescriptiveStatistics(data);
        stats.setPercentileImpl(newPercentile());

        double mean = stats.getMean();
        double median = stats.getPercentile(50.0);
        double min = stats.getMin();
        double max = stats.getMax();

        Map<Metric, Double> values = new EnumMap<>(Metric.class);
        values.put(Metric.MEAN, mean);
        values.put(Metric.MEDIAN, median);
        values.put(Metric.SIGMA, Math.sqrt(stats.getPopulationVariance()));
        values.put(Metric.MAD, medianAbsoluteDeviation(data, median));
        values.put(Metric.MIN, min);
        values.put(Metric.MAX, max);
        values.put(Metric.PTP, max - min);
        values.put(Metric.P01, stats.getPercentile(AnalysisConfig.LOWER_PERCENTILE));
        values.put(Metric.P99, stats.getPercentile(AnalysisConfig.UPPER_PERCENTILE));

        double[] moments = centralMoments(data, mean);
        double m2 = moments[0];
        double m3 = moments[1];
        double m4 = moments[2];
        values.put(Metric.SKEW, n >= MIN_SKEW_SAMPLES && m2 > 0 ? m3 / Math.pow(m2, 1.5) : Double.NaN);
        values.put(Metric.KURTOSIS, n >= MIN_KURTOSIS_SAMPLES && m2 > 0 ? m4 / (m2 * m2) - 3.0 : Double.NaN);

        return new StatisticSet(values, n);
    }

    /**
     * Median of the finite values, NaN if there are none.
     */
    public static double median(double[] values) {
        double[] data = finiteValues(values);
        if (data.length == 0) {
            return Double.NaN;
        }
        return newMedian().evaluate(data);
    }

    /**
     * Median absolute deviation from the median of the finite values, NaN if there are none.
     */
    public static double mad(double[] values) {
        double[] data = finiteValues(values);
        if (data.length == 0) {
            return Double.NaN;
        }
        return medianAbsoluteDeviation(data, newMedian().evaluate(data));
    }

    /**
     * Percentile of the finite values using linear interpolation.
     *
     * @param values the values
     * @param p percentile in (0, 100]
     * @return the percentile, NaN if there are no finite values
     */
    public static double percentile(double[] values, double p) {
        double[] data = finiteValues(values);
        if (data.length == 0) {
            return Double.NaN;
        }
        return newPercentile().evaluate(data, p);
    }

    private static double medianAbsoluteDeviation(double[] data, double median) {
        double[] deviations = new double[data.length];
        for (int i = 0; i < data.length; i++) {
            deviations[i] = Math.abs(data[i] - median);
        }
        return newMedian().evaluate(deviations);
    }

    /**
     * @return {m2, m3, m4}, the biased second to fourth central moments
     */
    private static double[] centralMoments(double[] data, double mean) {
        double s2 = 0;
        double s3 = 0;
        double s4 = 0;
        for (double x : data) {
            double d = x - mean;
            double d2 = d * d;
            s2 += d2;
            s3 += d2 * d;
            s4 += d2 * d2;
        }
        int n = data.length;
        return new double[] {s2 / n, s3 / n, s4 / n};
    }

    static double[] finiteValues(double[] values) {
        return Arrays.stream(values).filter(Double::isFinite).toArray();
    }

    private static Percentile newPercentile() {
        return new Percentile().withEstimationType(Percentile.EstimationType.R_7);
    }

    private static Median newMedian() {
        return new Median().withEstimationType(Percentile.EstimationType.R_7);
    }
}
