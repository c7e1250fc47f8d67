package org.puneet.cheops.ageing.statistical;

import org.puneet.cheops.ageing.config.AnalysisConfig;
import org.puneet.cheops.ageing.exceptions.InvalidBinSizeException;
import org.puneet.cheops.ageing.model.Bin;
import org.puneet.cheops.ageing.model.TimeSeries;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Partitions the valid samples of a series into fixed-width time bins.
 *
 * <p>Series times are days (MJD). Elapsed time is {@code h(t) = (t - t0) * 24} hours, where
 * {@code t0} is the time of the first valid sample. Bin {@code k} covers
 * {@code [k·w, (k+1)·w)}; the partition has {@code ceil(span / w)} bins (at least one) and its
 * last bin is closed on the right, with its end clipped to the span, so the final sample is
 * always binned. Bins that receive no sample are not returned.</p>
 *
 * @author CHEOPS Ageing Monitoring Framework
 * @version 1.0.0
 * @since 2025-09-02
 */
public final class TimeBinner {
    private static final Logger logger = LoggerFactory.getLogger(TimeBinner.class);

    private TimeBinner() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * @param binSizeHours candidate bin width
     * @throws InvalidBinSizeException if the width is not a positive finite number
     */
    public static void validateBinSize(double binSizeHours) throws InvalidBinSizeException {
        if (!Double.isFinite(binSizeHours) || binSizeHours <= 0) {
            throw new InvalidBinSizeException(binSizeHours);
        }
    }

    /**
     * Elapsed hours of every sample relative to the first valid sample. Invalid samples map to NaN.
     */
    public static double[] elapsedHours(TimeSeries series) {
        double[] hours = new double[series.size()];
        int first = series.firstValidIndex();
        if (first < 0) {
            Arrays.fill(hours, Double.NaN);
            return hours;
        }
        double t0 = series.getTime(first);
        for (int i = 0; i < hours.length; i++) {
            hours[i] = series.isValid(i)
                    ? (series.getTime(i) - t0) * AnalysisConfig.HOURS_PER_DAY
                    : Double.NaN;
        }
        return hours;
    }

    /**
     * Partitions a series.
     *
     * @param series the series to bin
     * @param binSizeHours bin width in hours
     * @return populated bins in time order; empty if the series has no valid sample
     * @throws InvalidBinSizeException if the width is not a positive finite number
     */
    public static List<Bin> partition(TimeSeries series, double binSizeHours) throws InvalidBinSizeException {
        validateBinSize(binSizeHours);

        int first = series.firstValidIndex();
        if (first < 0) {
            return Collections.emptyList();
        }

        double[] hours = elapsedHours(series);
        double span = hours[series.lastValidIndex()];
        long binCount = Math.max(1L, (long) Math.ceil(span / binSizeHours));

        SortedMap<Long, List<Integer>> members = new TreeMap<>();
        for (int i = 0; i < hours.length; i++) {
            if (!series.isValid(i)) {
                continue;
            }
            long k = (long) Math.floor(hours[i] / binSizeHours);
            if (k >= binCount) {
                k = binCount - 1;
            }
            members.computeIfAbsent(k, key -> new ArrayList<>()).add(i);
        }

        List<Bin> bins = new ArrayList<>(members.size());
        for (Map.Entry<Long, List<Integer>> entry : members.entrySet()) {
            long k = entry.getKey();
            boolean last = k == binCount - 1;
            double start = k * binSizeHours;
            double end = last ? Math.max(start, Math.min((k + 1) * binSizeHours, span)) : (k + 1) * binSizeHours;
            int[] indices = entry.getValue().stream().mapToInt(Integer::intValue).toArray();
            bins.add(new Bin(k, start, end, last, indices));
        }

        logger.debug("Partitioned {} valid samples spanning {} h into {} populated of {} bins of {} h",
                series.validCount(), span, bins.size(), binCount, binSizeHours);
        return Collections.unmodifiableList(bins);
    }
}
