package org.puneet.cheops.ageing.model;

import java.util.Objects;

/**
 * Two series aligned on their shared sample times, for dual-axis inspection.
 * An empty pair means the inputs had no time in common.
 *
 * @author CHEOPS Ageing Monitoring Framework
 * @version 1.0.0
 * @since 2025-09-02
 */
public final class CorrelationPair {

    private final String leftLabel;
    private final String rightLabel;
    private final double[] times;
    private final double[] leftValues;
    private final double[] rightValues;

    public CorrelationPair(String leftLabel, String rightLabel,
                           double[] times, double[] leftValues, double[] rightValues) {
        Objects.requireNonNull(times, "times cannot be null");
        Objects.requireNonNull(leftValues, "leftValues cannot be null");
        Objects.requireNonNull(rightValues, "rightValues cannot be null");
        if (leftValues.length != times.length || rightValues.length != times.length) {
            throw new IllegalArgumentException(String.format(
                    "Aligned arrays must have equal length: times=%d, left=%d, right=%d",
                    times.length, leftValues.length, rightValues.length));
        }
        this.leftLabel = leftLabel;
        this.rightLabel = rightLabel;
        this.times = times.clone();
        this.leftValues = leftValues.clone();
        this.rightValues = rightValues.clone();
    }

    public static CorrelationPair empty(String leftLabel, String rightLabel) {
        return new CorrelationPair(leftLabel, rightLabel, new double[0], new double[0], new double[0]);
    }

    public String getLeftLabel() {
        return leftLabel;
    }

    public String getRightLabel() {
        return rightLabel;
    }

    public double[] getTimes() {
        return times.clone();
    }

    public double[] getLeftValues() {
        return leftValues.clone();
    }

    public double[] getRightValues() {
        return rightValues.clone();
    }

    public int size() {
        return times.length;
    }

    public boolean isEmpty() {
        return times.length == 0;
    }

    @Override
    public String toString() {
        return String.format("CorrelationPair{%s vs %s, n=%d}", leftLabel, rightLabel, times.length);
    }
}
