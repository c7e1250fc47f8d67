package org.puneet.cheops.ageing.unit;

import org.junit.jupiter.api.Test;
import org.puneet.cheops.ageing.analysis.AnalysisEngine;
import org.puneet.cheops.ageing.analysis.AnalysisResult;
import org.puneet.cheops.ageing.analysis.Selection;
import org.puneet.cheops.ageing.config.AnalysisType;
import org.puneet.cheops.ageing.exceptions.AnalysisException;
import org.puneet.cheops.ageing.exceptions.InvalidBinSizeException;
import org.puneet.cheops.ageing.exceptions.ValidationException;
import org.puneet.cheops.ageing.model.Metric;
import org.puneet.cheops.ageing.model.NoiseEstimate;
import org.puneet.cheops.ageing.model.NoiseProfile;
import org.puneet.cheops.ageing.model.StatisticSet;
import org.puneet.cheops.ageing.model.TimeSeries;
import static org.junit.jupiter.api.Assertions.*;
import java.io.IOException;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

class AnalysisEngineTest {

    private static final List<Double> WIDTHS = List.of(1.0, 3.0, 6.0);

    static TimeSeries tenHourSeries(double... values) throws ValidationException {
        double[] times = new double[values.length];
        for (int i = 0; i < values.length; i++) {
            times[i] = 60000.0 + i * (10.0 / (values.length - 1)) / 24.0;
        }
        return TimeSeries.of(times, values);
    }

    static TimeSeries spikySeries() throws ValidationException {
        return tenHourSeries(1, 2, 3, 4, 5, 6, 7, 8, 9, 1000, 5);
    }

    private static AnalysisEngine engineFor(Map<String, TimeSeries> seriesByParameter) {
        return new AnalysisEngine((target, type, parameter) -> {
            TimeSeries series = seriesByParameter.get(parameter);
            if (series == null) {
                throw new IOException("no data for " + parameter);
            }
            return series;
        });
    }

    @Test
    void testLightcurveSelectionWithOutlierRemoval() throws Exception {
        AnalysisEngine engine = engineFor(Map.of("FLUX", spikySeries()));
        Selection selection = new Selection("TG001", AnalysisType.DRP_LIGHTCURVE, "FLUX", true, 3.0, WIDTHS);

        AnalysisResult result = engine.compute(selection);

        assertEquals(1, result.getRejectedCount());
        assertEquals(11, result.getSampleCount());
        StatisticSet stats = result.getStatistics().orElseThrow();
        assertEquals(10, stats.getSampleSize());
        assertEquals(9.0, stats.get(Metric.MAX), 1e-12);

        NoiseProfile noise = result.getNoiseProfile().orElseThrow();
        assertEquals(3, noise.size());
        assertTrue(noise.get(1.0).isAvailable());
        assertFalse(result.isDirectValues());

        Map<String, Double> columns = result.toColumns();
        assertEquals(9.0, columns.get("FLUX_max"), 1e-12);
        assertTrue(columns.containsKey("FLUX_bin_noise_6h"));
    }

    @Test
    void testWithoutOutlierRemovalKeepsSpike() throws Exception {
        AnalysisEngine engine = engineFor(Map.of("FLUX", spikySeries()));
        Selection selection = new Selection("TG001", AnalysisType.DRP_LIGHTCURVE, "FLUX", false, 3.0, WIDTHS);

        AnalysisResult result = engine.compute(selection);
        assertEquals(0, result.getRejectedCount());
        assertEquals(1000.0, result.getStatistics().orElseThrow().get(Metric.MAX), 1e-12);
    }

    @Test
    void testNonLightcurveTypeHasNoNoiseProfile() throws Exception {
        AnalysisEngine engine = engineFor(Map.of("LOS_TO_SUN_ANGLE", tenHourSeries(100, 101, 102)));
        Selection selection = new Selection("TG001", AnalysisType.GEOMETRY, "LOS_TO_SUN_ANGLE", false, 3.0, WIDTHS);

        AnalysisResult result = engine.compute(selection);
        assertTrue(result.getNoiseProfile().isEmpty());
        assertEquals(101.0, result.getStatistics().orElseThrow().get(Metric.MEAN), 1e-12);
        assertEquals(Metric.values().length, result.toColumns().size());
    }

    @Test
    void testDirectValueType() throws Exception {
        AnalysisEngine engine = engineFor(Map.of("sx_std", tenHourSeries(1.5, Double.NaN, 2.5)));
        Selection selection = new Selection("TG001", AnalysisType.PSF_SHAPE, "sx_std", true, 3.0, WIDTHS);

        AnalysisResult result = engine.compute(selection);
        assertTrue(result.isDirectValues());
        assertArrayEquals(new double[] {1.5, 2.5}, result.getDirectValues());
        assertTrue(result.getStatistics().isEmpty());
        assertTrue(result.getNoiseProfile().isEmpty());
    }

    @Test
    void testUnknownParameterIsRejectedBeforeLoading() {
        AtomicInteger loads = new AtomicInteger();
        AnalysisEngine engine = new AnalysisEngine((target, type, parameter) -> {
            loads.incrementAndGet();
            return spikySeries();
        });
        Selection selection = new Selection("TG001", AnalysisType.GEOMETRY, "FLUX", false, 3.0, WIDTHS);

        AnalysisException ex = assertThrows(AnalysisException.class, () -> engine.compute(selection));
        assertEquals(AnalysisException.AnalysisErrorType.INVALID_SELECTION, ex.getErrorType());
        assertEquals(0, loads.get());
    }

    @Test
    void testSourceFailures() {
        AnalysisEngine missing = engineFor(Map.of());
        Selection selection = new Selection("TG001", AnalysisType.DRP_LIGHTCURVE, "FLUX", false, 3.0, WIDTHS);
        AnalysisException ex = assertThrows(AnalysisException.class, () -> missing.compute(selection));
        assertEquals(AnalysisException.AnalysisErrorType.SOURCE_UNAVAILABLE, ex.getErrorType());
        assertTrue(ex.getCause() instanceof IOException);

        AnalysisEngine malformed = new AnalysisEngine((target, type, parameter) ->
                TimeSeries.of(new double[] {2, 1}, new double[] {1, 2}));
        AnalysisException malformedEx = assertThrows(AnalysisException.class, () -> malformed.compute(selection));
        assertEquals(AnalysisException.AnalysisErrorType.SERIES_CONSTRUCTION_ERROR, malformedEx.getErrorType());
    }

    @Test
    void testInvalidBinWidth() throws ValidationException {
        AnalysisEngine engine = engineFor(Map.of("FLUX", spikySeries()));
        Selection selection = new Selection("TG001", AnalysisType.DRP_LIGHTCURVE, "FLUX", false, 3.0, List.of(1.0, 0.0));

        AnalysisException ex = assertThrows(AnalysisException.class, () -> engine.compute(selection));
        assertEquals(AnalysisException.AnalysisErrorType.INVALID_SELECTION, ex.getErrorType());
        assertTrue(ex.getCause() instanceof InvalidBinSizeException);

        assertThrows(InvalidBinSizeException.class, () -> engine.compute(selection, spikySeries()));
    }

    @Test
    void testInvalidMultiplierOnlyMattersWhenFiltering() throws Exception {
        AnalysisEngine engine = engineFor(Map.of("FLUX", spikySeries()));
        Selection unfiltered = new Selection("TG001", AnalysisType.DRP_LIGHTCURVE, "FLUX", false, -1.0, WIDTHS);
        assertDoesNotThrow(() -> engine.compute(unfiltered));

        assertThrows(AnalysisException.class, () -> engine.compute(unfiltered.withOutlierRemoval(true)));
    }

    @Test
    void testAllInvalidSeriesDegradesToNaN() throws Exception {
        AnalysisEngine engine = engineFor(Map.of("FLUX", tenHourSeries(Double.NaN, Double.NaN, Double.NaN)));
        Selection selection = new Selection("TG001", AnalysisType.DRP_LIGHTCURVE, "FLUX", true, 3.0, WIDTHS);

        AnalysisResult result = engine.compute(selection);
        assertTrue(result.getStatistics().orElseThrow().isEmpty());
        assertTrue(Double.isNaN(result.getStatistics().orElseThrow().get(Metric.MEAN)));
        NoiseEstimate estimate = result.getNoiseProfile().orElseThrow().get(1.0);
        assertEquals(NoiseEstimate.InsufficiencyReason.TOO_FEW_VALUES, estimate.getReason().orElseThrow());
    }
}
