package org.puneet.cheops.ageing.statistical;

import org.apache.commons.math3.stat.descriptive.moment.Mean;
import org.apache.commons.math3.stat.descriptive.moment.StandardDeviation;
import org.puneet.cheops.ageing.config.AnalysisConfig;
import org.puneet.cheops.ageing.exceptions.InvalidBinSizeException;
import org.puneet.cheops.ageing.exceptions.ValidationException;
import org.puneet.cheops.ageing.model.Bin;
import org.puneet.cheops.ageing.model.NoiseEstimate;
import org.puneet.cheops.ageing.model.NoiseEstimate.InsufficiencyReason;
import org.puneet.cheops.ageing.model.NoiseProfile;
import org.puneet.cheops.ageing.model.TimeSeries;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Binned-noise estimation: the spread of per-bin means at one or more time scales.
 *
 * <p>For every bin width the valid samples are partitioned with {@link TimeBinner}, the mean of
 * each populated bin is taken, and the noise is the population standard deviation (divisor n) of
 * those means. The same convention is used for every width so the values can be compared against
 * the white-noise expectation {@code sigma / sqrt(samples per bin)}.</p>
 *
 * <p>Insufficient data never raises: a width that yields fewer than two populated bins, a series
 * with fewer than two valid values, or missing or misaligned time information produce an
 * insufficient {@link NoiseEstimate} for that width while other widths are still evaluated.
 * Invalid widths are caller errors and are rejected before any estimation.</p>
 *
 * @author CHEOPS Ageing Monitoring Framework
 * @version 1.0.0
 * @since 2025-09-02
 */
public class NoiseEstimator {
    private static final Logger logger = LoggerFactory.getLogger(NoiseEstimator.class);

    /**
     * Estimates the noise profile of a series.
     *
     * @param series the (possibly outlier-filtered) series
     * @param binWidthsHours bin widths to evaluate
     * @return one estimate per width
     * @throws InvalidBinSizeException if any width is not a positive finite number
     */
    public NoiseProfile estimate(TimeSeries series, List<Double> binWidthsHours) throws InvalidBinSizeException {
        validateWidths(binWidthsHours);

        Map<Double, NoiseEstimate> estimates = new LinkedHashMap<>();
        for (Double width : binWidthsHours) {
            estimates.put(width, estimateWidth(series, width));
        }
        return new NoiseProfile(estimates);
    }

    /**
     * Estimates the noise profile of raw arrays as delivered by the ingestion layer.
     *
     * @param values parameter values, NaN marks a gap
     * @param timesDays sample times in days, or null when the data product carries none
     * @param binWidthsHours bin widths to evaluate
     * @return one estimate per width
     * @throws InvalidBinSizeException if any width is not a positive finite number
     * @throws ValidationException if the time array is not ascending
     */
    public NoiseProfile estimate(double[] values, double[] timesDays, List<Double> binWidthsHours)
            throws ValidationException {
        validateWidths(binWidthsHours);

        InsufficiencyReason reason = null;
        if (values == null) {
            reason = InsufficiencyReason.TOO_FEW_VALUES;
        } else if (timesDays == null || timesDays.length == 0) {
            reason = InsufficiencyReason.NO_TIME_INFORMATION;
        } else if (timesDays.length != values.length) {
            reason = InsufficiencyReason.MISALIGNED_ARRAYS;
        } else {
            for (double t : timesDays) {
                if (!Double.isFinite(t)) {
                    reason = InsufficiencyReason.NO_TIME_INFORMATION;
                    break;
                }
            }
        }

        if (reason != null) {
            logger.debug("Noise profile unavailable: {}", reason.getDescription());
            Map<Double, NoiseEstimate> estimates = new LinkedHashMap<>();
            for (Double width : binWidthsHours) {
                estimates.put(width, NoiseEstimate.insufficient(reason));
            }
            return new NoiseProfile(estimates);
        }

        return estimate(TimeSeries.of(timesDays, values), binWidthsHours);
    }

    /**
     * Estimates the noise for a single bin width.
     *
     * @throws InvalidBinSizeException if the width is not a positive finite number
     */
    public NoiseEstimate estimateWidth(TimeSeries series, double binWidthHours) throws InvalidBinSizeException {
        TimeBinner.validateBinSize(binWidthHours);

        if (series.validCount() < AnalysisConfig.MIN_NOISE_VALUES) {
            return NoiseEstimate.insufficient(InsufficiencyReason.TOO_FEW_VALUES);
        }

        List<Bin> bins = TimeBinner.partition(series, binWidthHours);
        if (bins.size() < AnalysisConfig.MIN_NOISE_BINS) {
            logger.debug("Only {} populated bin(s) at {} h, noise undefined", bins.size(), binWidthHours);
            return NoiseEstimate.insufficient(InsufficiencyReason.TOO_FEW_BINS, bins.size());
        }

        double[] binMeans = new double[bins.size()];
        Mean mean = new Mean();
        for (int b = 0; b < bins.size(); b++) {
            int[] indices = bins.get(b).getSampleIndices();
            double[] binValues = new double[indices.length];
            for (int i = 0; i < indices.length; i++) {
                binValues[i] = series.getValue(indices[i]);
            }
            binMeans[b] = mean.evaluate(binValues);
        }

        double noise = new StandardDeviation(false).evaluate(binMeans);
        logger.debug("Binned noise at {} h over {} bins: {}", binWidthHours, bins.size(), noise);
        return NoiseEstimate.of(noise, bins.size());
    }

    private static void validateWidths(List<Double> binWidthsHours) throws InvalidBinSizeException {
        if (binWidthsHours == null) {
            throw new IllegalArgumentException("Bin widths cannot be null");
        }
        for (Double width : binWidthsHours) {
            TimeBinner.validateBinSize(width == null ? Double.NaN : width);
        }
    }
}
