package org.puneet.cheops.ageing.analysis;

import org.puneet.cheops.ageing.config.AnalysisType;
import org.puneet.cheops.ageing.exceptions.ValidationException;
import org.puneet.cheops.ageing.model.TimeSeries;
import org.puneet.cheops.ageing.model.VisitData;
import org.puneet.cheops.ageing.model.VisitSummary;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Builds the per-visit summary table of an analysis type.
 *
 * <p>Every parameter of the type is analyzed for every visit. Parameters missing from a visit, or
 * without any valid sample before or after outlier removal, are skipped for that visit only. A
 * visit that ends up with no usable parameter is left out of the table. Rows are ordered by
 * visit time.</p>
 *
 * @author CHEOPS Ageing Monitoring Framework
 * @version 1.0.0
 * @since 2025-09-02
 */
public class VisitSummaryBuilder {
    private static final Logger logger = LoggerFactory.getLogger(VisitSummaryBuilder.class);

    private final AnalysisEngine engine;

    public VisitSummaryBuilder(AnalysisEngine engine) {
        this.engine = Objects.requireNonNull(engine, "engine cannot be null");
    }

    /**
     * @param type analysis type of the visits
     * @param visits visit data, in any order
     * @param removeOutliers whether to apply the outlier filter (ignored for direct-value types)
     * @param outlierMultiplier filter multiplier k
     * @param binWidthsHours noise bin widths for lightcurve types
     * @return summaries ordered by visit time
     * @throws ValidationException if k or a bin width is invalid
     */
    public List<VisitSummary> build(AnalysisType type, List<VisitData> visits, boolean removeOutliers,
                                    double outlierMultiplier, List<Double> binWidthsHours)
            throws ValidationException {
        Objects.requireNonNull(type, "type cannot be null");
        Objects.requireNonNull(visits, "visits cannot be null");

        boolean filter = removeOutliers && type.isCalculateStats();
        List<VisitSummary> summaries = new ArrayList<>();

        for (VisitData visit : visits) {
            Map<String, Double> columns = new LinkedHashMap<>();
            Map<String, double[]> direct = new LinkedHashMap<>();

            for (String parameter : type.getAllParameters()) {
                Optional<TimeSeries> series = visit.getSeries(parameter);
                if (series.isEmpty() || series.get().validCount() == 0) {
                    continue;
                }

                Selection selection = new Selection(visit.getTarget(), type, parameter,
                        filter, outlierMultiplier, binWidthsHours);
                AnalysisResult result = engine.compute(selection, series.get());

                if (result.isDirectValues()) {
                    direct.put(parameter, result.getDirectValues());
                } else if (result.getStatistics().map(stats -> !stats.isEmpty()).orElse(false)) {
                    columns.putAll(result.toColumns());
                } else {
                    logger.debug("All samples of {} rejected in {}", parameter, visit.getFileName());
                }
            }

            if (columns.isEmpty() && direct.isEmpty()) {
                logger.debug("Visit {} has no usable parameter for {}, skipped", visit.getFileName(), type);
                continue;
            }
            summaries.add(new VisitSummary(visit.getTarget(), visit.getVisitTime(), visit.getFileName(),
                    visit.getObservationCount(), columns, direct));
        }

        summaries.sort(Comparator.comparingDouble(VisitSummary::getVisitTime));
        logger.info("Built {} visit summaries for {} from {} visits", summaries.size(), type, visits.size());
        return summaries;
    }
}
