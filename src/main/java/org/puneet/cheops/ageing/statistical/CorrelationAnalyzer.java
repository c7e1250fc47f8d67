package org.puneet.cheops.ageing.statistical;

import org.apache.commons.math3.exception.MathIllegalArgumentException;
import org.apache.commons.math3.stat.correlation.PearsonsCorrelation;
import org.puneet.cheops.ageing.exceptions.ValidationException;
import org.puneet.cheops.ageing.model.CorrelationPair;
import org.puneet.cheops.ageing.model.TimeSeries;
import org.puneet.cheops.ageing.model.VisitSummary;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Aligns two series on their shared sample times for dual-axis inspection.
 *
 * <p>Alignment is an exact match on time; there is no interpolation between different cadences.
 * Statistic series of visit summaries are timed by visit day before alignment.
 * Only samples that are valid in both series are paired, and repeated times are paired one to one
 * in order. Series without common times yield an empty pair.</p>
 *
 * @author CHEOPS Ageing Monitoring Framework
 * @version 1.0.0
 * @since 2025-09-02
 */
public class CorrelationAnalyzer {
    private static final Logger logger = LoggerFactory.getLogger(CorrelationAnalyzer.class);

    private static final int MIN_CORRELATION_PAIRS = 3;

    /**
     * Aligns two series.
     *
     * @param left series for the left axis
     * @param leftLabel label of the left series
     * @param right series for the right axis
     * @param rightLabel label of the right series
     * @return the aligned pair, empty when the series share no time
     */
    public CorrelationPair align(TimeSeries left, String leftLabel, TimeSeries right, String rightLabel) {
        List<double[]> rows = new ArrayList<>();

        int i = 0;
        int j = 0;
        while (i < left.size() && j < right.size()) {
            if (!left.isValid(i)) {
                i++;
                continue;
            }
            if (!right.isValid(j)) {
                j++;
                continue;
            }
            double lt = left.getTime(i);
            double rt = right.getTime(j);
            if (lt < rt) {
                i++;
            } else if (lt > rt) {
                j++;
            } else {
                rows.add(new double[] {lt, left.getValue(i), right.getValue(j)});
                i++;
                j++;
            }
        }

        if (rows.isEmpty()) {
            logger.debug("No common times between {} and {}", leftLabel, rightLabel);
            return CorrelationPair.empty(leftLabel, rightLabel);
        }

        double[] times = new double[rows.size()];
        double[] leftValues = new double[rows.size()];
        double[] rightValues = new double[rows.size()];
        for (int k = 0; k < rows.size(); k++) {
            double[] row = rows.get(k);
            times[k] = row[0];
            leftValues[k] = row[1];
            rightValues[k] = row[2];
        }
        logger.debug("Aligned {} and {} on {} common times", leftLabel, rightLabel, times.length);
        return new CorrelationPair(leftLabel, rightLabel, times, leftValues, rightValues);
    }

    /**
     * Aligns two statistic series of one target taken from per-visit summaries, e.g.
     * {@code FLUX_median} of one analysis type against {@code HK_TEMP_FEE_CCD_mean} of another.
     * Visits are matched on their UTC day.
     *
     * @param target target whose visits are compared; visits of other targets are ignored
     * @param left visits providing the left column
     * @param leftColumn statistic column of the left series
     * @param right visits providing the right column
     * @param rightColumn statistic column of the right series
     * @return the aligned pair on common visit days
     * @throws ValidationException if the target is null or a visit time is not finite
     */
    public CorrelationPair alignStatistics(String target, List<VisitSummary> left, String leftColumn,
                                           List<VisitSummary> right, String rightColumn)
            throws ValidationException {
        if (target == null) {
            throw ValidationException.nullValue("target");
        }
        List<VisitSummary> leftVisits = forTarget(left, target);
        List<VisitSummary> rightVisits = forTarget(right, target);
        logger.debug("Correlating {} of {} visits with {} of {} visits for {}",
                leftColumn, leftVisits.size(), rightColumn, rightVisits.size(), target);
        return align(toStatisticSeries(leftVisits, leftColumn), leftColumn,
                toStatisticSeries(rightVisits, rightColumn), rightColumn);
    }

    /**
     * Builds the series of one statistic column across visits, timed by visit day. Visits
     * lacking the column contribute an invalid sample.
     *
     * @throws ValidationException if a visit time is not finite
     */
    public static TimeSeries toStatisticSeries(List<VisitSummary> visits, String column) throws ValidationException {
        List<VisitSummary> ordered = new ArrayList<>(visits);
        ordered.sort(Comparator.comparingDouble(VisitSummary::getVisitTime));

        double[] times = new double[ordered.size()];
        double[] values = new double[ordered.size()];
        for (int k = 0; k < ordered.size(); k++) {
            times[k] = ordered.get(k).getVisitDay();
            values[k] = ordered.get(k).getColumn(column);
        }
        return TimeSeries.of(times, values);
    }

    private static List<VisitSummary> forTarget(List<VisitSummary> visits, String target) {
        List<VisitSummary> selected = new ArrayList<>();
        for (VisitSummary visit : visits) {
            if (target.equals(visit.getTarget())) {
                selected.add(visit);
            }
        }
        return selected;
    }

    /**
     * Pearson correlation coefficient of an aligned pair. Advisory only.
     *
     * @return the coefficient, NaN with fewer than three pairs or a constant side
     */
    public double pearson(CorrelationPair pair) {
        if (pair.size() < MIN_CORRELATION_PAIRS) {
            return Double.NaN;
        }
        try {
            return new PearsonsCorrelation().correlation(pair.getLeftValues(), pair.getRightValues());
        } catch (MathIllegalArgumentException e) {
            logger.warn("Correlation of {} and {} could not be computed: {}",
                    pair.getLeftLabel(), pair.getRightLabel(), e.getMessage());
            return Double.NaN;
        }
    }
}
