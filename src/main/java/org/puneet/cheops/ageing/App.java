package org.puneet.cheops.ageing;

import org.puneet.cheops.ageing.analysis.AnalysisEngine;
import org.puneet.cheops.ageing.analysis.VisitSummaryBuilder;
import org.puneet.cheops.ageing.config.AnalysisCatalog;
import org.puneet.cheops.ageing.config.AnalysisConfigLoader;
import org.puneet.cheops.ageing.config.AnalysisType;
import org.puneet.cheops.ageing.exceptions.ValidationException;
import org.puneet.cheops.ageing.io.CsvSeriesReader;
import org.puneet.cheops.ageing.io.CsvSeriesSource;
import org.puneet.cheops.ageing.io.SummaryTableWriter;
import org.puneet.cheops.ageing.model.VisitData;
import org.puneet.cheops.ageing.model.VisitSummary;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;

/**
 * Command line entry point: builds the visit summary table of one analysis type from per-visit
 * CSV exports. Visit files that cannot be read are logged and left out of the table.
 *
 * <pre>
 * App &lt;output.csv&gt; &lt;analysis type&gt; &lt;visit.csv&gt; [&lt;visit.csv&gt; ...]
 * </pre>
 *
 * @author CHEOPS Ageing Monitoring Framework
 * @version 1.0.0
 * @since 2025-09-02
 */
public class App {
    private static final Logger logger = LoggerFactory.getLogger(App.class);

    public static void main(String[] args) {
        logger.info("Starting ageing monitoring analysis");

        try {
            run(args, new AnalysisConfigLoader());
        } catch (ValidationException e) {
            logger.error("Invalid arguments or configuration\n{}", e.getDetailedMessage());
            System.exit(1);
        } catch (Exception e) {
            logger.error("Critical error in application execution", e);
            System.exit(1);
        }
    }

    /**
     * Runs one summary build.
     *
     * @param args output file, analysis type display name, then one or more visit files
     * @param config analysis configuration
     * @return the summaries written
     * @throws ValidationException if the arguments or the configuration are invalid
     * @throws IOException if the summary table cannot be written
     */
    public static List<VisitSummary> run(String[] args, AnalysisConfigLoader config) throws ValidationException, IOException {
        if (args == null || args.length < 3) {
            throw ValidationException.invalidConfiguration("arguments",
                    "usage: App <output.csv> <analysis type> <visit.csv> [<visit.csv> ...]");
        }

        config.validateConfiguration();
        Path output = Paths.get(args[0]);
        AnalysisType type = AnalysisCatalog.requireByDisplayName(args[1]);
        logger.info("Analysis type: {} ({})", type.getDisplayName(), type.getDescription());

        CsvSeriesReader reader = new CsvSeriesReader();
        CsvSeriesSource source = new CsvSeriesSource(reader);
        List<VisitData> visits = new ArrayList<>();
        int skipped = 0;
        for (int i = 2; i < args.length; i++) {
            Path file = Paths.get(args[i]);
            try {
                VisitData visit = reader.readVisit(file, type, null);
                source.register(visit.getTarget(), type, file);
                visits.add(visit);
            } catch (IOException | ValidationException e) {
                skipped++;
                logger.warn("Skipping visit file {}: {}", file, e.getMessage());
            }
        }
        if (skipped > 0) {
            logger.warn("{} of {} visit file(s) could not be read", skipped, args.length - 2);
        }

        VisitSummaryBuilder builder = new VisitSummaryBuilder(new AnalysisEngine(source));
        List<VisitSummary> summaries = builder.build(type, visits,
                config.isOutlierRemovalEnabled(), config.getOutlierMultiplier(), config.getBinWidthsHours());

        new SummaryTableWriter().write(output, summaries);
        logger.info("Analysis completed: {} of {} visits summarized", summaries.size(), visits.size());
        return summaries;
    }
}
