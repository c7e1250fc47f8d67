package org.puneet.cheops.ageing.unit;

import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.puneet.cheops.ageing.io.SummaryTableWriter;
import org.puneet.cheops.ageing.model.VisitSummary;
import static org.junit.jupiter.api.Assertions.*;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

class SummaryTableWriterTest {

    @TempDir
    Path tempDir;

    @Test
    void testWritesUnionOfColumns() throws Exception {
        Map<String, Double> first = new LinkedHashMap<>();
        first.put("FLUX_mean", 10.0);
        first.put("FLUX_bin_noise_1h", Double.NaN);
        Map<String, Double> second = new LinkedHashMap<>();
        second.put("FLUX_mean", 11.0);
        second.put("BACKGROUND_mean", 2.0);

        List<VisitSummary> summaries = List.of(
                new VisitSummary("TG001", 60324.0, "a.csv", 100, first, Map.of()),
                new VisitSummary("TG001", 60325.5, "b.csv", 90, second, Map.of()));

        Path output = tempDir.resolve("nested/dir/summary.csv");
        new SummaryTableWriter().write(output, summaries);

        try (Reader reader = Files.newBufferedReader(output, StandardCharsets.UTF_8);
             CSVParser parser = new CSVParser(reader, CSVFormat.DEFAULT.withFirstRecordAsHeader())) {
            assertEquals(List.of("Target", "Date of visit (MJD)", "Date of visit", "file", "n_observations",
                    "FLUX_mean", "FLUX_bin_noise_1h", "BACKGROUND_mean"), parser.getHeaderNames());

            List<CSVRecord> records = parser.getRecords();
            assertEquals(2, records.size());
            assertEquals("2024-01-15", records.get(0).get("Date of visit"));
            assertEquals("100", records.get(0).get("n_observations"));
            assertEquals("", records.get(0).get("FLUX_bin_noise_1h"));
            assertEquals("", records.get(0).get("BACKGROUND_mean"));
            assertEquals(11.0, Double.parseDouble(records.get(1).get("FLUX_mean")), 1e-12);
            assertEquals("2024-01-16", records.get(1).get("Date of visit"));
        }
    }

    @Test
    void testDirectValuesAreJoined() throws Exception {
        VisitSummary summary = new VisitSummary("TG002", 60324.0, "report.csv", 2, Map.of(),
                Map.of("h_max", new double[] {1.5, 2.5}));

        Path output = tempDir.resolve("direct.csv");
        new SummaryTableWriter().write(output, List.of(summary));

        try (Reader reader = Files.newBufferedReader(output, StandardCharsets.UTF_8);
             CSVParser parser = new CSVParser(reader, CSVFormat.DEFAULT.withFirstRecordAsHeader())) {
            CSVRecord record = parser.getRecords().get(0);
            assertEquals("1.5;2.5", record.get("h_max"));
            assertEquals("TG002", record.get("Target"));
        }
    }

    @Test
    void testEmptyTableHasFixedHeaderOnly() throws Exception {
        Path output = tempDir.resolve("empty.csv");
        new SummaryTableWriter().write(output, List.of());

        List<String> lines = Files.readAllLines(output, StandardCharsets.UTF_8);
        assertEquals(1, lines.size());
        assertEquals("Target,Date of visit (MJD),Date of visit,file,n_observations", lines.get(0));
    }
}
