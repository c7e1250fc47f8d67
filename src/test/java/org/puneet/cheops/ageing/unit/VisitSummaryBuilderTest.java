package org.puneet.cheops.ageing.unit;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.puneet.cheops.ageing.analysis.AnalysisEngine;
import org.puneet.cheops.ageing.analysis.VisitSummaryBuilder;
import org.puneet.cheops.ageing.config.AnalysisType;
import org.puneet.cheops.ageing.exceptions.ValidationException;
import org.puneet.cheops.ageing.model.TimeSeries;
import org.puneet.cheops.ageing.model.VisitData;
import org.puneet.cheops.ageing.model.VisitSummary;
import static org.junit.jupiter.api.Assertions.*;
import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

class VisitSummaryBuilderTest {

    private static final List<Double> WIDTHS = List.of(1.0, 3.0);

    private VisitSummaryBuilder builder;

    @BeforeEach
    void setUp() {
        builder = new VisitSummaryBuilder(new AnalysisEngine((target, type, parameter) -> {
            throw new IOException("summaries are built from in-memory visits");
        }));
    }

    private static VisitData visit(String fileName, double visitTime, Map<String, TimeSeries> series) {
        return new VisitData("TG001", visitTime, fileName, 11, series);
    }

    @Test
    void testSummariesAreSortedAndCarryColumns() throws ValidationException {
        Map<String, TimeSeries> later = new LinkedHashMap<>();
        later.put("FLUX", AnalysisEngineTest.spikySeries());
        Map<String, TimeSeries> earlier = new LinkedHashMap<>();
        earlier.put("FLUX", AnalysisEngineTest.tenHourSeries(10, 20, 30));
        earlier.put("BACKGROUND", AnalysisEngineTest.tenHourSeries(1, 1, 1));

        List<VisitSummary> summaries = builder.build(AnalysisType.DRP_LIGHTCURVE,
                List.of(visit("later.csv", 60010.0, later), visit("earlier.csv", 60000.0, earlier)),
                true, 3.0, WIDTHS);

        assertEquals(2, summaries.size());
        assertEquals("earlier.csv", summaries.get(0).getFileName());
        assertEquals(20.0, summaries.get(0).getColumn("FLUX_mean"), 1e-12);
        assertEquals(1.0, summaries.get(0).getColumn("BACKGROUND_median"), 1e-12);
        assertTrue(summaries.get(0).hasColumn("FLUX_bin_noise_1h"));

        VisitSummary second = summaries.get(1);
        assertEquals(9.0, second.getColumn("FLUX_max"), 1e-12);
        assertFalse(second.hasColumn("BACKGROUND_mean"));
        assertTrue(Double.isNaN(second.getColumn("BACKGROUND_mean")));
    }

    @Test
    void testAllInvalidParameterAndEmptyVisitAreSkipped() throws ValidationException {
        Map<String, TimeSeries> invalid = Map.of("FLUX", AnalysisEngineTest.tenHourSeries(Double.NaN, Double.NaN, Double.NaN));
        Map<String, TimeSeries> unrelated = Map.of("NOT_A_PARAMETER", AnalysisEngineTest.tenHourSeries(1, 2, 3));

        List<VisitSummary> summaries = builder.build(AnalysisType.DRP_LIGHTCURVE,
                List.of(visit("invalid.csv", 60000.0, invalid), visit("unrelated.csv", 60001.0, unrelated)),
                false, 3.0, WIDTHS);

        assertTrue(summaries.isEmpty());
    }

    @Test
    void testDirectValuesIgnoreOutlierRemoval() throws ValidationException {
        Map<String, TimeSeries> report = Map.of("h_max", AnalysisEngineTest.tenHourSeries(1.0, 2.0, 1000.0));

        List<VisitSummary> summaries = builder.build(AnalysisType.PSF_SHAPE,
                List.of(visit("TG001_TU2024-01-15_report.csv", 60324.0, report)), true, 3.0, WIDTHS);

        assertEquals(1, summaries.size());
        assertArrayEquals(new double[] {1.0, 2.0, 1000.0}, summaries.get(0).getDirectValues("h_max"));
        assertTrue(summaries.get(0).getColumns().isEmpty());
    }

    @Test
    void testInvalidMultiplierFails() throws ValidationException {
        Map<String, TimeSeries> series = Map.of("FLUX", AnalysisEngineTest.spikySeries());
        assertThrows(ValidationException.class, () -> builder.build(AnalysisType.DRP_LIGHTCURVE,
                List.of(visit("a.csv", 60000.0, series)), true, 0.0, WIDTHS));
    }
}
