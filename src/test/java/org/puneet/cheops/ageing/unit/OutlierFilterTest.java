package org.puneet.cheops.ageing.unit;

import org.junit.jupiter.api.Test;
import org.puneet.cheops.ageing.exceptions.ValidationException;
import org.puneet.cheops.ageing.model.TimeSeries;
import org.puneet.cheops.ageing.statistical.OutlierFilter;
import static org.junit.jupiter.api.Assertions.*;

class OutlierFilterTest {

    private static final double[] WITH_SPIKE = {1, 2, 3, 4, 5, 6, 7, 8, 9, 1000};

    @Test
    void testConstantValuesStayValid() throws ValidationException {
        OutlierFilter filter = new OutlierFilter(3.0);
        boolean[] mask = filter.mask(new double[] {5, 5, 5, 5});
        for (boolean valid : mask) {
            assertTrue(valid);
        }
        OutlierFilter.Bounds bounds = filter.computeBounds(new double[] {5, 5, 5, 5});
        assertEquals(0.0, bounds.getMad());
        assertEquals(5.0, bounds.getLower());
        assertEquals(5.0, bounds.getUpper());
    }

    @Test
    void testZeroMadRejectsEveryDistinctValue() throws ValidationException {
        OutlierFilter filter = new OutlierFilter(3.0);
        double[] values = {10, 10, 10, 10, 10, 10, 10.0001, 100};
        boolean[] mask = filter.mask(values);
        for (int i = 0; i < 6; i++) {
            assertTrue(mask[i]);
        }
        assertFalse(mask[6]);
        assertFalse(mask[7]);
    }

    @Test
    void testSpikeRejected() throws ValidationException {
        OutlierFilter filter = new OutlierFilter(3.0);
        OutlierFilter.Bounds bounds = filter.computeBounds(WITH_SPIKE);
        assertEquals(5.5, bounds.getMedian(), 1e-12);
        assertEquals(2.5, bounds.getMad(), 1e-12);
        assertEquals(1.4826 * 2.5, bounds.getRobustSigma(), 1e-12);

        double[] kept = filter.filterValues(WITH_SPIKE);
        assertArrayEquals(new double[] {1, 2, 3, 4, 5, 6, 7, 8, 9}, kept);
    }

    @Test
    void testBoundsAreInclusive() throws ValidationException {
        OutlierFilter filter = new OutlierFilter(1.0);
        OutlierFilter.Bounds bounds = filter.computeBounds(new double[] {0, 1, 2});
        assertTrue(bounds.accepts(bounds.getLower()));
        assertTrue(bounds.accepts(bounds.getUpper()));
        assertFalse(bounds.accepts(Double.NaN));
    }

    @Test
    void testIdempotent() throws ValidationException {
        OutlierFilter filter = new OutlierFilter(3.0);
        double[] once = filter.filterValues(WITH_SPIKE);
        double[] twice = filter.filterValues(once);
        assertArrayEquals(once, twice);

        double[] degenerate = {10, 10, 10, 10, 10, 10, 100};
        double[] degenerateOnce = filter.filterValues(degenerate);
        assertArrayEquals(degenerateOnce, filter.filterValues(degenerateOnce));
    }

    @Test
    void testApplyOnSeries() throws ValidationException {
        double[] times = new double[WITH_SPIKE.length];
        for (int i = 0; i < times.length; i++) {
            times[i] = 60000 + i;
        }
        OutlierFilter filter = new OutlierFilter(3.0);
        OutlierFilter.FilterResult result = filter.apply(TimeSeries.of(times, WITH_SPIKE));

        assertEquals(1, result.getRejectedCount());
        assertEquals(9, result.getFilteredSeries().validCount());
        assertEquals(WITH_SPIKE.length, result.getFilteredSeries().size());
        assertFalse(result.getMask()[9]);
        assertEquals(9, result.getRetainedValues().length);

        OutlierFilter.FilterResult again = filter.apply(result.getFilteredSeries());
        assertEquals(0, again.getRejectedCount());
        assertEquals(result.getFilteredSeries(), again.getFilteredSeries());
    }

    @Test
    void testInvalidSamplesStayInvalid() throws ValidationException {
        TimeSeries series = new TimeSeries(
                new double[] {0, 1, 2, 3},
                new double[] {1, 2, 3, Double.NaN},
                new boolean[] {true, false, true, true});
        OutlierFilter.FilterResult result = new OutlierFilter(3.0).apply(series);
        assertFalse(result.getMask()[1]);
        assertFalse(result.getMask()[3]);
        assertEquals(0, result.getRejectedCount());
        assertEquals(2, result.getFilteredSeries().validCount());
    }

    @Test
    void testNoValidValues() throws ValidationException {
        OutlierFilter filter = new OutlierFilter(3.0);
        boolean[] mask = assertDoesNotThrow(() -> filter.mask(new double[] {Double.NaN, Double.NaN}));
        assertFalse(mask[0]);
        assertFalse(mask[1]);
        assertEquals(0, filter.filterValues(new double[0]).length);
    }

    @Test
    void testInvalidMultiplier() {
        for (double k : new double[] {0.0, -1.0, Double.NaN, Double.POSITIVE_INFINITY}) {
            ValidationException ex = assertThrows(ValidationException.class, () -> new OutlierFilter(k));
            assertEquals(ValidationException.ValidationType.RANGE_VALIDATION, ex.getValidationType());
        }
    }
}
