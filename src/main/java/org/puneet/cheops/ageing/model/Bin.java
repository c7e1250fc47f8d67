package org.puneet.cheops.ageing.model;

import java.util.Arrays;

/**
 * Time bin expressed in elapsed hours since the first observation of a series.
 * Covers {@code [start, end)}, or {@code [start, end]} for the last bin of a partition.
 *
 * @author CHEOPS Ageing Monitoring Framework
 * @version 1.0.0
 * @since 2025-09-02
 */
public final class Bin {

    private final long index;
    private final double startHours;
    private final double endHours;
    private final boolean closedRight;
    private final int[] sampleIndices;

    public Bin(long index, double startHours, double endHours, boolean closedRight, int[] sampleIndices) {
        if (sampleIndices == null) {
            throw new IllegalArgumentException("Sample indices cannot be null");
        }
        this.index = index;
        this.startHours = startHours;
        this.endHours = endHours;
        this.closedRight = closedRight;
        this.sampleIndices = sampleIndices.clone();
    }

    /**
     * @return position of this bin in the full partition, counting dropped empty bins
     */
    public long getIndex() {
        return index;
    }

    public double getStartHours() {
        return startHours;
    }

    public double getEndHours() {
        return endHours;
    }

    public boolean isClosedRight() {
        return closedRight;
    }

    /**
     * @return indices into the source series of the samples this bin holds
     */
    public int[] getSampleIndices() {
        return sampleIndices.clone();
    }

    public int size() {
        return sampleIndices.length;
    }

    public boolean contains(double elapsedHours) {
        if (elapsedHours < startHours) {
            return false;
        }
        return closedRight ? elapsedHours <= endHours : elapsedHours < endHours;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (obj == null || getClass() != obj.getClass()) return false;
        Bin that = (Bin) obj;
        return index == that.index
                && Double.compare(startHours, that.startHours) == 0
                && Double.compare(endHours, that.endHours) == 0
                && closedRight == that.closedRight
                && Arrays.equals(sampleIndices, that.sampleIndices);
    }

    @Override
    public int hashCode() {
        int result = Long.hashCode(index);
        result = 31 * result + Double.hashCode(startHours);
        result = 31 * result + Double.hashCode(endHours);
        result = 31 * result + Boolean.hashCode(closedRight);
        result = 31 * result + Arrays.hashCode(sampleIndices);
        return result;
    }

    @Override
    public String toString() {
        return String.format("Bin[%s, %s%s n=%d", startHours, endHours, closedRight ? "]" : ")", sampleIndices.length);
    }
}
