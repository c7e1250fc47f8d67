package org.puneet.cheops.ageing.io;

import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;
import org.puneet.cheops.ageing.config.AnalysisType;
import org.puneet.cheops.ageing.config.DataSource;
import org.puneet.cheops.ageing.exceptions.ValidationException;
import org.puneet.cheops.ageing.model.TimeSeries;
import org.puneet.cheops.ageing.model.VisitData;
import org.puneet.cheops.ageing.util.TimeConversions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.OptionalDouble;

/**
 * Reads one visit's data product exported as CSV with a header row.
 *
 * <p>The time column and its encoding come from the analysis type's {@link DataSource}. Empty or
 * non-numeric parameter cells become NaN gaps. Rows whose time cannot be parsed are skipped.
 * Products without a time column are indexed by row number and dated from the {@code TU<date>}
 * token of their file name.</p>
 *
 * @author CHEOPS Ageing Monitoring Framework
 * @version 1.0.0
 * @since 2025-09-02
 */
public class CsvSeriesReader {
    private static final Logger logger = LoggerFactory.getLogger(CsvSeriesReader.class);

    static final String UNKNOWN_TARGET = "Unknown";

    /**
     * Reads every parameter of an analysis type present in the file.
     *
     * @param file CSV file
     * @param type analysis type whose parameters to extract
     * @param target target name, or null to take it from the file name
     * @return the visit data
     * @throws IOException if the file cannot be read or lacks the time column
     * @throws ValidationException if the time column is not ascending
     */
    public VisitData readVisit(Path file, AnalysisType type, String target) throws IOException, ValidationException {
        DataSource source = type.getSource();
        String fileName = file.getFileName().toString();
        String resolvedTarget = target != null
                ? target
                : TimeConversions.targetFromFileName(fileName).orElse(UNKNOWN_TARGET);

        List<Double> times = new ArrayList<>();
        Map<String, List<Double>> columns = new LinkedHashMap<>();
        int skipped = 0;

        try (Reader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8);
             CSVParser parser = new CSVParser(reader, CSVFormat.DEFAULT.withFirstRecordAsHeader().withTrim())) {

            Map<String, Integer> header = parser.getHeaderMap();
            boolean timed = source.getTimeFormat() != DataSource.TimeFormat.NONE;
            if (timed && !header.containsKey(source.getTimeColumn())) {
                throw new IOException("Time column " + source.getTimeColumn() + " not found in " + fileName);
            }
            for (String parameter : type.getAllParameters()) {
                if (header.containsKey(parameter)) {
                    columns.put(parameter, new ArrayList<>());
                }
            }

            int row = 0;
            for (CSVRecord record : parser) {
                double time;
                if (timed) {
                    time = parseTime(cell(record, source.getTimeColumn()), source.getTimeFormat());
                    if (!Double.isFinite(time)) {
                        skipped++;
                        continue;
                    }
                } else {
                    time = row;
                }
                row++;
                times.add(time);
                for (Map.Entry<String, List<Double>> column : columns.entrySet()) {
                    column.getValue().add(parseValue(cell(record, column.getKey())));
                }
            }
        }

        if (skipped > 0) {
            logger.warn("Skipped {} row(s) with unreadable time in {}", skipped, fileName);
        }

        double[] timeArray = toArray(times);
        Map<String, TimeSeries> series = new LinkedHashMap<>();
        for (Map.Entry<String, List<Double>> column : columns.entrySet()) {
            series.put(column.getKey(), TimeSeries.of(timeArray, toArray(column.getValue())));
        }

        double visitTime = visitTime(file, source, timeArray);
        logger.debug("Read {} rows and {} parameter(s) of {} from {}", timeArray.length, series.size(), type, fileName);
        return new VisitData(resolvedTarget, visitTime, fileName, timeArray.length, series);
    }

    /**
     * Reads the series of a single parameter.
     *
     * @throws IOException if the file cannot be read or has no such column
     * @throws ValidationException if the time column is not ascending
     */
    public TimeSeries readSeries(Path file, AnalysisType type, String parameter) throws IOException, ValidationException {
        VisitData visit = readVisit(file, type, null);
        return visit.getSeries(parameter)
                .orElseThrow(() -> new IOException("Column " + parameter + " not found in " + file.getFileName()));
    }

    private static String cell(CSVRecord record, String column) {
        return record.isSet(column) ? record.get(column) : null;
    }

    static double parseTime(String cell, DataSource.TimeFormat format) {
        if (cell == null || cell.isEmpty()) {
            return Double.NaN;
        }
        try {
            return format == DataSource.TimeFormat.ISO_UTC
                    ? TimeConversions.isoToMjd(cell)
                    : Double.parseDouble(cell);
        } catch (DateTimeParseException | NumberFormatException e) {
            return Double.NaN;
        }
    }

    static double parseValue(String cell) {
        if (cell == null || cell.isEmpty()) {
            return Double.NaN;
        }
        try {
            return Double.parseDouble(cell);
        } catch (NumberFormatException e) {
            return Double.NaN;
        }
    }

    private static double visitTime(Path file, DataSource source, double[] times) throws IOException {
        if (source.getTimeFormat() != DataSource.TimeFormat.NONE && times.length > 0) {
            return times[0];
        }
        OptionalDouble fromName = TimeConversions.visitDateFromFileName(file.getFileName().toString());
        if (fromName.isPresent()) {
            return fromName.getAsDouble();
        }
        logger.warn("No visit date for {}, using file modification time", file.getFileName());
        return TimeConversions.instantToMjd(Files.getLastModifiedTime(file).toInstant());
    }

    private static double[] toArray(List<Double> values) {
        return values.stream().mapToDouble(Double::doubleValue).toArray();
    }
}
