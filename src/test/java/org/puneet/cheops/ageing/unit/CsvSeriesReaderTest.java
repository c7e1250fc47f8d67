package org.puneet.cheops.ageing.unit;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.puneet.cheops.ageing.config.AnalysisType;
import org.puneet.cheops.ageing.exceptions.ValidationException;
import org.puneet.cheops.ageing.io.CsvSeriesReader;
import org.puneet.cheops.ageing.io.CsvSeriesSource;
import org.puneet.cheops.ageing.model.TimeSeries;
import org.puneet.cheops.ageing.model.VisitData;
import static org.junit.jupiter.api.Assertions.*;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

class CsvSeriesReaderTest {

    @TempDir
    Path tempDir;

    private final CsvSeriesReader reader = new CsvSeriesReader();

    private Path write(String name, String... lines) throws IOException {
        Path file = tempDir.resolve(name);
        Files.write(file, String.join("\n", lines).getBytes(StandardCharsets.UTF_8));
        return file;
    }

    @Test
    void testReadsIsoTimedLightcurve() throws Exception {
        Path file = write("CH_PR100018_TG000101_V0200_DRP_lightcurve.csv",
                "UTC_TIME,FLUX,BACKGROUND,OTHER",
                "2024-01-15T00:00:00,100.0,5.0,x",
                "2024-01-15T06:00:00,,5.5,y",
                "not-a-time,999,999,z",
                "2024-01-15T12:00:00,102.0,abc,w");

        VisitData visit = reader.readVisit(file, AnalysisType.DRP_LIGHTCURVE, null);

        assertEquals("TG000101", visit.getTarget());
        assertEquals(3, visit.getObservationCount());
        assertEquals(60324.0, visit.getVisitTime(), 1e-9);
        assertEquals(2, visit.getSeries().size());

        TimeSeries flux = visit.getSeries("FLUX").orElseThrow();
        assertEquals(3, flux.size());
        assertEquals(2, flux.validCount());
        assertEquals(60324.25, flux.getTimes()[1], 1e-9);
        assertTrue(Double.isNaN(flux.getValues()[1]));
        assertTrue(Double.isNaN(visit.getSeries("BACKGROUND").orElseThrow().getValues()[2]));
        assertTrue(visit.getSeries("CONTA_LC").isEmpty());
    }

    @Test
    void testExplicitTargetAndUnknownTarget() throws Exception {
        Path file = write("pipe_sa.csv", "MJD_TIME,FLUX", "60000.5,1", "60000.6,2");

        assertEquals("TG9", reader.readVisit(file, AnalysisType.PIPE_LIGHTCURVE_SA, "TG9").getTarget());
        VisitData visit = reader.readVisit(file, AnalysisType.PIPE_LIGHTCURVE_SA, null);
        assertEquals("Unknown", visit.getTarget());
        assertEquals(60000.5, visit.getVisitTime(), 1e-12);
    }

    @Test
    void testUntimedReportUsesRowIndexAndFileDate() throws Exception {
        Path file = write("CH_TG000202_TU2024-01-15_report.csv", "h_max,sx_std", "1.5,0.2", "2.5,");

        VisitData visit = reader.readVisit(file, AnalysisType.PSF_SHAPE, null);

        assertEquals(60324.0, visit.getVisitTime(), 1e-9);
        TimeSeries height = visit.getSeries("h_max").orElseThrow();
        assertArrayEquals(new double[] {0.0, 1.0}, height.getTimes());
        assertEquals(1, visit.getSeries("sx_std").orElseThrow().validCount());
    }

    @Test
    void testShortRowsBecomeGaps() throws Exception {
        Path file = write("short.csv", "MJD_TIME,FLUX,FLUXERR", "60000.1,1,0.1", "60000.2,2");

        VisitData visit = reader.readVisit(file, AnalysisType.PIPE_LIGHTCURVE_IM, "TG1");
        assertTrue(Double.isNaN(visit.getSeries("FLUXERR").orElseThrow().getValues()[1]));
    }

    @Test
    void testMissingTimeColumn() throws IOException {
        Path file = write("no_time.csv", "FLUX", "1", "2");
        assertThrows(IOException.class, () -> reader.readVisit(file, AnalysisType.DRP_LIGHTCURVE, "TG1"));
    }

    @Test
    void testDescendingTimesAreRejected() throws IOException {
        Path file = write("descending.csv", "MJD_TIME,FLUX", "60000.2,1", "60000.1,2");
        assertThrows(ValidationException.class, () -> reader.readVisit(file, AnalysisType.PIPE_LIGHTCURVE_SA, "TG1"));
    }

    @Test
    void testReadSeriesAndSource() throws Exception {
        Path file = write("geometry.csv", "UTC_TIME,LOS_TO_SUN_ANGLE", "2024-01-15T00:00:00Z,100", "2024-01-15T01:00:00Z,110");

        TimeSeries sun = reader.readSeries(file, AnalysisType.GEOMETRY, "LOS_TO_SUN_ANGLE");
        assertEquals(2, sun.validCount());
        assertThrows(IOException.class, () -> reader.readSeries(file, AnalysisType.GEOMETRY, "LOS_TO_MOON_ANGLE"));

        CsvSeriesSource source = new CsvSeriesSource(reader);
        source.register("TG1", AnalysisType.GEOMETRY, file);
        assertEquals(110.0, source.load("TG1", AnalysisType.GEOMETRY, "LOS_TO_SUN_ANGLE").getValues()[1], 1e-12);
        assertThrows(IOException.class, () -> source.load("TG2", AnalysisType.GEOMETRY, "LOS_TO_SUN_ANGLE"));
        assertThrows(IOException.class, () -> source.load("TG1", AnalysisType.VOLTAGES, "HK_VOLT_FEE_VOD"));
    }
}
