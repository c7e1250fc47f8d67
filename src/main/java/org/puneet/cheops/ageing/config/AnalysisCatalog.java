package org.puneet.cheops.ageing.config;

import org.puneet.cheops.ageing.exceptions.ValidationException;
import org.puneet.cheops.ageing.model.Metric;
import org.puneet.cheops.ageing.model.NoiseProfile;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

/**
 * Lookup table over {@link AnalysisType}: resolution by display name, statistic column naming
 * and metric definitions. Built once when the class is initialized.
 *
 * <p>Statistic columns are named {@code PARAM_metric} for every {@link Metric}; lightcurve
 * types additionally get {@code PARAM_bin_noise_<w>h} for every configured bin width.
 * Types that report raw values use the bare parameter names as columns.</p>
 *
 * @author CHEOPS Ageing Monitoring Framework
 * @version 1.0.0
 * @since 2025-09-02
 */
public final class AnalysisCatalog {
    private static final Logger logger = LoggerFactory.getLogger(AnalysisCatalog.class);

    private static final String BIN_NOISE_MARKER = "_bin_noise_";

    private static final Map<String, AnalysisType> BY_DISPLAY_NAME;

    static {
        Map<String, AnalysisType> byName = new LinkedHashMap<>();
        for (AnalysisType type : AnalysisType.values()) {
            if (byName.put(type.getDisplayName(), type) != null) {
                throw new IllegalStateException("Duplicate analysis type name: " + type.getDisplayName());
            }
        }
        BY_DISPLAY_NAME = Collections.unmodifiableMap(byName);
        logger.debug("Analysis catalog resolved with {} analysis types", BY_DISPLAY_NAME.size());
    }

    private AnalysisCatalog() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * @return display names in declaration order
     */
    public static Set<String> getDisplayNames() {
        return BY_DISPLAY_NAME.keySet();
    }

    /**
     * Resolves an analysis type from its display name, e.g. {@code "PIPE Lightcurve (sa)"}.
     */
    public static Optional<AnalysisType> findByDisplayName(String displayName) {
        if (displayName == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(BY_DISPLAY_NAME.get(displayName.trim()));
    }

    /**
     * Like {@link #findByDisplayName(String)} but fails for unknown names.
     *
     * @throws ValidationException if no analysis type has that name
     */
    public static AnalysisType requireByDisplayName(String displayName) throws ValidationException {
        return findByDisplayName(displayName).orElseThrow(() -> new ValidationException(
                ValidationException.ValidationType.SELECTION_VALIDATION,
                "Unknown analysis type '" + displayName + "'"));
    }

    /**
     * Verifies that the parameter is listed by the analysis type.
     *
     * @throws ValidationException if it is not
     */
    public static void requireParameter(AnalysisType type, String parameter) throws ValidationException {
        if (type == null) {
            throw ValidationException.nullValue("analysisType");
        }
        if (parameter == null || !type.hasParameter(parameter)) {
            throw ValidationException.unknownParameter(type.getDisplayName(), parameter);
        }
    }

    /**
     * Statistic column names per parameter group.
     *
     * @param type the analysis type
     * @param binWidthsHours configured bin widths, used only for lightcurve types
     * @return group name to ordered column names
     */
    public static Map<String, List<String>> getStatColumns(AnalysisType type, List<Double> binWidthsHours) {
        Map<String, List<String>> columns = new LinkedHashMap<>();
        for (ParameterGroup group : type.getGroups()) {
            List<String> groupColumns = new ArrayList<>();
            for (String param : group.getParameters()) {
                groupColumns.addAll(getParameterColumns(type, param, binWidthsHours));
            }
            columns.put(group.getName(), Collections.unmodifiableList(groupColumns));
        }
        return Collections.unmodifiableMap(columns);
    }

    /**
     * Column names produced for one parameter of an analysis type.
     */
    public static List<String> getParameterColumns(AnalysisType type, String parameter, List<Double> binWidthsHours) {
        if (!type.isCalculateStats()) {
            return List.of(parameter);
        }
        List<String> columns = new ArrayList<>();
        for (Metric metric : Metric.values()) {
            columns.add(parameter + "_" + metric.getKey());
        }
        if (type.isBinnedNoiseApplicable() && binWidthsHours != null) {
            for (Double width : binWidthsHours) {
                columns.add(NoiseProfile.columnName(parameter, width));
            }
        }
        return columns;
    }

    /**
     * Available statistic columns, optionally restricted to one group.
     *
     * @param groupName group to restrict to, or null for every group
     */
    public static List<String> getAvailableStats(AnalysisType type, String groupName, List<Double> binWidthsHours) {
        Map<String, List<String>> columns = getStatColumns(type, binWidthsHours);
        if (groupName != null && columns.containsKey(groupName)) {
            return columns.get(groupName);
        }
        List<String> all = new ArrayList<>();
        columns.values().forEach(all::addAll);
        return all;
    }

    /**
     * Human readable definition of a statistic column such as {@code FLUX_p99}.
     *
     * @return the definition, or an empty string if the column is not a known statistic
     */
    public static String getStatDefinition(String columnName) {
        if (columnName == null) {
            return "";
        }
        int noiseAt = columnName.lastIndexOf(BIN_NOISE_MARKER);
        if (noiseAt >= 0) {
            String width = columnName.substring(noiseAt + BIN_NOISE_MARKER.length());
            return "Standard deviation of " + width + " bin means";
        }
        for (Metric metric : Metric.values()) {
            if (columnName.equals(metric.getKey()) || columnName.endsWith("_" + metric.getKey())) {
                return metric.getDefinition();
            }
        }
        return "";
    }
}
