package org.puneet.cheops.ageing.io;

import org.puneet.cheops.ageing.analysis.SeriesSource;
import org.puneet.cheops.ageing.config.AnalysisType;
import org.puneet.cheops.ageing.exceptions.ValidationException;
import org.puneet.cheops.ageing.model.TimeSeries;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;

/**
 * {@link SeriesSource} over CSV exports, one file per (target, analysis type).
 *
 * @author CHEOPS Ageing Monitoring Framework
 * @version 1.0.0
 * @since 2025-09-02
 */
public class CsvSeriesSource implements SeriesSource {

    private final CsvSeriesReader reader;
    private final Map<String, Path> files = new ConcurrentHashMap<>();

    public CsvSeriesSource(CsvSeriesReader reader) {
        this.reader = Objects.requireNonNull(reader, "reader cannot be null");
    }

    /**
     * Registers the file holding a target's data for an analysis type, replacing any earlier one.
     */
    public void register(String target, AnalysisType type, Path file) {
        files.put(key(target, type), Objects.requireNonNull(file, "file cannot be null"));
    }

    @Override
    public TimeSeries load(String target, AnalysisType type, String parameter) throws IOException, ValidationException {
        Path file = files.get(key(target, type));
        if (file == null) {
            throw new IOException("No " + type.getDisplayName() + " data registered for target " + target);
        }
        return reader.readSeries(file, type, parameter);
    }

    private static String key(String target, AnalysisType type) {
        return target + '|' + type.name();
    }
}
