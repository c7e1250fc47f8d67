package org.puneet.cheops.ageing.model;

import org.puneet.cheops.ageing.exceptions.ValidationException;

import java.util.Arrays;

/**
 * Immutable sequence of {@code (time, value, valid)} triples ordered by time.
 *
 * <p>Times are expressed in days using the modified Julian date convention. A sample
 * whose value is NaN or infinite is never valid, whatever the supplied mask says.
 * All arrays are copied on the way in and on the way out.</p>
 *
 * @author CHEOPS Ageing Monitoring Framework
 * @version 1.0.0
 * @since 2025-09-02
 */
public final class TimeSeries {

    private final double[] times;
    private final double[] values;
    private final boolean[] valid;
    private final int validCount;

    /**
     * Creates a series with an explicit validity mask.
     *
     * @param times sample times in days, non-decreasing
     * @param values sample values, NaN marks a gap
     * @param valid validity mask, same length as {@code times}
     * @throws ValidationException if the arrays are null, differ in length,
     *         or the times are not finite and non-decreasing
     */
    public TimeSeries(double[] times, double[] values, boolean[] valid) throws ValidationException {
        if (times == null) {
            throw ValidationException.nullValue("times");
        }
        if (values == null) {
            throw ValidationException.nullValue("values");
        }
        if (valid == null) {
            throw ValidationException.nullValue("valid");
        }
        if (values.length != times.length) {
            throw ValidationException.sizeMismatch("values", values.length, times.length);
        }
        if (valid.length != times.length) {
            throw ValidationException.sizeMismatch("valid", valid.length, times.length);
        }
        for (int i = 0; i < times.length; i++) {
            if (!Double.isFinite(times[i])) {
                throw ValidationException.outOfRange("times[" + i + "]", times[i], "finite");
            }
            if (i > 0 && times[i] < times[i - 1]) {
                throw ValidationException.notAscending(i, times[i - 1], times[i]);
            }
        }

        this.times = times.clone();
        this.values = values.clone();
        this.valid = new boolean[valid.length];
        int count = 0;
        for (int i = 0; i < valid.length; i++) {
            this.valid[i] = valid[i] && Double.isFinite(values[i]);
            if (this.valid[i]) {
                count++;
            }
        }
        this.validCount = count;
    }

    /**
     * Creates a series in which every finite value is valid.
     *
     * @param times sample times in days, non-decreasing
     * @param values sample values, NaN marks a gap
     * @return the new series
     * @throws ValidationException if the arrays are structurally inconsistent
     */
    public static TimeSeries of(double[] times, double[] values) throws ValidationException {
        if (times == null) {
            throw ValidationException.nullValue("times");
        }
        boolean[] mask = new boolean[times.length];
        Arrays.fill(mask, true);
        return new TimeSeries(times, values, mask);
    }

    /**
     * Returns a copy of this series whose validity is the conjunction of the current
     * validity and {@code mask}.
     *
     * @param mask additional validity mask
     * @return the masked series
     * @throws ValidationException if the mask length differs from the series length
     */
    public TimeSeries withMask(boolean[] mask) throws ValidationException {
        if (mask == null) {
            throw ValidationException.nullValue("mask");
        }
        if (mask.length != times.length) {
            throw ValidationException.sizeMismatch("mask", mask.length, times.length);
        }
        boolean[] combined = new boolean[mask.length];
        for (int i = 0; i < mask.length; i++) {
            combined[i] = valid[i] && mask[i];
        }
        return new TimeSeries(times, values, combined);
    }

    public int size() {
        return times.length;
    }

    public boolean isEmpty() {
        return times.length == 0;
    }

    public int validCount() {
        return validCount;
    }

    public double getTime(int index) {
        return times[index];
    }

    public double getValue(int index) {
        return values[index];
    }

    public boolean isValid(int index) {
        return valid[index];
    }

    public double[] getTimes() {
        return times.clone();
    }

    public double[] getValues() {
        return values.clone();
    }

    public boolean[] getValidMask() {
        return valid.clone();
    }

    /**
     * @return the valid values in time order
     */
    public double[] validValues() {
        double[] out = new double[validCount];
        int j = 0;
        for (int i = 0; i < values.length; i++) {
            if (valid[i]) {
                out[j++] = values[i];
            }
        }
        return out;
    }

    /**
     * @return the times of the valid samples
     */
    public double[] validTimes() {
        double[] out = new double[validCount];
        int j = 0;
        for (int i = 0; i < times.length; i++) {
            if (valid[i]) {
                out[j++] = times[i];
            }
        }
        return out;
    }

    /**
     * @return index of the first valid sample, or -1 if there is none
     */
    public int firstValidIndex() {
        for (int i = 0; i < valid.length; i++) {
            if (valid[i]) {
                return i;
            }
        }
        return -1;
    }

    /**
     * @return index of the last valid sample, or -1 if there is none
     */
    public int lastValidIndex() {
        for (int i = valid.length - 1; i >= 0; i--) {
            if (valid[i]) {
                return i;
            }
        }
        return -1;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (obj == null || getClass() != obj.getClass()) return false;
        TimeSeries that = (TimeSeries) obj;
        return Arrays.equals(times, that.times)
                && Arrays.equals(values, that.values)
                && Arrays.equals(valid, that.valid);
    }

    @Override
    public int hashCode() {
        int result = Arrays.hashCode(times);
        result = 31 * result + Arrays.hashCode(values);
        result = 31 * result + Arrays.hashCode(valid);
        return result;
    }

    @Override
    public String toString() {
        return String.format("TimeSeries{size=%d, valid=%d}", times.length, validCount);
    }
}
