package org.puneet.cheops.ageing.io;

import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVPrinter;
import org.puneet.cheops.ageing.model.VisitSummary;
import org.puneet.cheops.ageing.util.TimeConversions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.StringJoiner;

/**
 * Writes visit summaries as a CSV table, one row per visit.
 *
 * <p>Fixed columns come first, followed by the union of all statistic and direct-value columns
 * in first-seen order. NaN and missing cells are written empty; direct values are joined with
 * {@code ;}.</p>
 *
 * @author CHEOPS Ageing Monitoring Framework
 * @version 1.0.0
 * @since 2025-09-02
 */
public class SummaryTableWriter {
    private static final Logger logger = LoggerFactory.getLogger(SummaryTableWriter.class);

    static final String[] FIXED_HEADER = {"Target", "Date of visit (MJD)", "Date of visit", "file", "n_observations"};

    /**
     * @param output destination file, parent directories are created
     * @param summaries rows to write
     * @throws IOException if the file cannot be written
     */
    public void write(Path output, List<VisitSummary> summaries) throws IOException {
        List<String> dataColumns = collectColumns(summaries);
        List<String> header = new ArrayList<>(List.of(FIXED_HEADER));
        header.addAll(dataColumns);

        Path parent = output.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }

        try (BufferedWriter writer = Files.newBufferedWriter(output, StandardCharsets.UTF_8);
             CSVPrinter printer = new CSVPrinter(writer,
                     CSVFormat.DEFAULT.withHeader(header.toArray(new String[0])))) {

            for (VisitSummary summary : summaries) {
                List<Object> row = new ArrayList<>(header.size());
                row.add(summary.getTarget());
                row.add(summary.getVisitTime());
                row.add(TimeConversions.mjdToIsoDate(summary.getVisitTime()));
                row.add(summary.getFileName());
                row.add(summary.getObservationCount());
                for (String column : dataColumns) {
                    row.add(cell(summary, column));
                }
                printer.printRecord(row);
            }
        }
        logger.info("Wrote {} visit summaries with {} columns to {}", summaries.size(), header.size(), output);
    }

    static List<String> collectColumns(List<VisitSummary> summaries) {
        Set<String> columns = new LinkedHashSet<>();
        for (VisitSummary summary : summaries) {
            columns.addAll(summary.getColumns().keySet());
            columns.addAll(summary.getDirectValueMap().keySet());
        }
        return new ArrayList<>(columns);
    }

    private static String cell(VisitSummary summary, String column) {
        if (summary.hasColumn(column)) {
            double value = summary.getColumn(column);
            return Double.isNaN(value) ? "" : String.valueOf(value);
        }
        double[] direct = summary.getDirectValueMap().get(column);
        if (direct == null) {
            return "";
        }
        StringJoiner joiner = new StringJoiner(";");
        for (double value : direct) {
            joiner.add(String.valueOf(value));
        }
        return joiner.toString();
    }
}
