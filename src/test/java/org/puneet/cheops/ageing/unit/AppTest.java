package org.puneet.cheops.ageing.unit;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.puneet.cheops.ageing.App;
import org.puneet.cheops.ageing.config.AnalysisConfigLoader;
import org.puneet.cheops.ageing.exceptions.ValidationException;
import org.puneet.cheops.ageing.model.VisitSummary;
import static org.junit.jupiter.api.Assertions.*;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

class AppTest {

    @TempDir
    Path tempDir;

    private Path visitFile(String name, String firstTime, double offset) throws IOException {
        StringBuilder csv = new StringBuilder("MJD_TIME,FLUX,BG,XC,YC\n");
        double start = Double.parseDouble(firstTime);
        for (int i = 0; i < 48; i++) {
            double time = start + i / 96.0;
            double flux = 1000.0 + offset + (i % 2 == 0 ? 1.0 : -1.0);
            csv.append(time).append(',').append(i == 20 ? 50000.0 : flux).append(",10,").append(i).append(",\n");
        }
        Path file = tempDir.resolve(name);
        Files.write(file, csv.toString().getBytes(StandardCharsets.UTF_8));
        return file;
    }

    @Test
    void testRunWritesSummaryTable() throws Exception {
        Path later = visitFile("CH_TG000101_late_PIPE_lightcurve_sa.csv", "60010.0", 5.0);
        Path earlier = visitFile("CH_TG000101_early_PIPE_lightcurve_sa.csv", "60000.0", 0.0);
        Path output = tempDir.resolve("out/summary.csv");

        List<VisitSummary> summaries = App.run(new String[] {
                output.toString(), "PIPE Lightcurve (sa)", later.toString(), earlier.toString()},
                new AnalysisConfigLoader("analysis-test.properties"));

        assertEquals(2, summaries.size());
        VisitSummary first = summaries.get(0);
        assertEquals("TG000101", first.getTarget());
        assertEquals(60000.0, first.getVisitTime(), 1e-9);
        assertEquals(48, first.getObservationCount());
        assertEquals(1001.0, first.getColumn("FLUX_max"), 1e-9);
        assertTrue(first.hasColumn("FLUX_bin_noise_3h"));
        assertTrue(first.hasColumn("XC_mean"));
        assertFalse(first.hasColumn("YC_mean"));
        assertEquals(1004.0, summaries.get(1).getColumn("FLUX_min"), 1e-9);
        assertEquals(1006.0, summaries.get(1).getColumn("FLUX_max"), 1e-9);

        List<String> lines = Files.readAllLines(output, StandardCharsets.UTF_8);
        assertEquals(3, lines.size());
        assertTrue(lines.get(0).startsWith("Target,Date of visit (MJD),Date of visit,file,n_observations,FLUX_mean"));
        assertTrue(lines.get(1).contains("CH_TG000101_early_PIPE_lightcurve_sa.csv"));
    }

    @Test
    void testInvalidArguments() throws IOException {
        AnalysisConfigLoader config = new AnalysisConfigLoader("analysis-test.properties");
        Path visit = visitFile("visit.csv", "60000.0", 0.0);

        ValidationException usage = assertThrows(ValidationException.class,
                () -> App.run(new String[] {"out.csv", "Geometry"}, config));
        assertEquals(ValidationException.ValidationType.CONFIGURATION_VALIDATION, usage.getValidationType());

        ValidationException unknownType = assertThrows(ValidationException.class,
                () -> App.run(new String[] {tempDir.resolve("o.csv").toString(), "Nope", visit.toString()}, config));
        assertEquals(ValidationException.ValidationType.SELECTION_VALIDATION, unknownType.getValidationType());

    }

    @Test
    void testUnreadableVisitFilesAreSkipped() throws Exception {
        Path good = tempDir.resolve("CH_TG000303_TU2023-03-01_SCI_RAW_good.csv");
        Files.write(good, String.join("\n",
                "UTC_TIME,HK_TEMP_FEE_CCD,HK_TEMP_FEE_ADC",
                "2023-03-01T10:00:00,-40.0,20.0",
                "2023-03-01T10:01:00,-40.5,20.5",
                "2023-03-01T10:02:00,-41.0,21.0").getBytes(StandardCharsets.UTF_8));
        Path descending = tempDir.resolve("CH_TG000303_TU2023-03-02_SCI_RAW_bad.csv");
        Files.write(descending, String.join("\n",
                "UTC_TIME,HK_TEMP_FEE_CCD",
                "2023-03-02T10:02:00,-40.0",
                "2023-03-02T10:00:00,-41.0").getBytes(StandardCharsets.UTF_8));
        Path missing = tempDir.resolve("missing.csv");
        Path output = tempDir.resolve("temperatures.csv");

        List<VisitSummary> summaries = App.run(new String[] {
                output.toString(), "Temperatures", good.toString(), descending.toString(), missing.toString()},
                new AnalysisConfigLoader("analysis-test.properties"));

        assertEquals(1, summaries.size());
        assertEquals("TG000303", summaries.get(0).getTarget());
        assertEquals(-40.5, summaries.get(0).getColumn("HK_TEMP_FEE_CCD_median"), 1e-12);

        List<String> lines = Files.readAllLines(output, StandardCharsets.UTF_8);
        assertEquals(2, lines.size());
        assertTrue(lines.get(1).contains(good.getFileName().toString()));
    }
}
