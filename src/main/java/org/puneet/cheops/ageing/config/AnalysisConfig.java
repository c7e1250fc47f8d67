package org.puneet.cheops.ageing.config;

import java.util.List;

/**
 * Fixed constants of the analysis engine.
 *
 * <p>Values a user is expected to tune (the outlier multiplier, bin widths, thread count)
 * are read from {@code analysis.properties} by {@link AnalysisConfigLoader}; the defaults
 * below are only used when a key is absent.</p>
 *
 * @author CHEOPS Ageing Monitoring Framework
 * @version 1.0.0
 * @since 2025-09-02
 */
public final class AnalysisConfig {

    // ===================================================================================
    // STATISTICS
    // ===================================================================================

    /** Scale factor from MAD to standard deviation for normally distributed data */
    public static final double ROBUST_SIGMA_SCALE = 1.4826;

    /** Lower percentile reported as p01 */
    public static final double LOWER_PERCENTILE = 1.0;

    /** Upper percentile reported as p99 */
    public static final double UPPER_PERCENTILE = 99.0;

    // ===================================================================================
    // TIME BINNING
    // ===================================================================================

    /** Series times are days (MJD); bins are expressed in hours */
    public static final double HOURS_PER_DAY = 24.0;

    /** Modified Julian date of the Unix epoch, 1970-01-01T00:00Z */
    public static final double MJD_UNIX_EPOCH = 40587.0;

    /** Minimum number of populated bins for a noise estimate */
    public static final int MIN_NOISE_BINS = 2;

    /** Minimum number of valid values for a noise estimate */
    public static final int MIN_NOISE_VALUES = 2;

    // ===================================================================================
    // DEFAULTS FOR CONFIGURABLE VALUES
    // ===================================================================================

    /** Fallback outlier multiplier when analysis.properties does not set one */
    public static final double DEFAULT_OUTLIER_MULTIPLIER = 3.0;

    /** Fallback bin widths in hours */
    public static final List<Double> DEFAULT_BIN_WIDTHS_HOURS = List.of(1.0, 3.0, 6.0);

    /** Fallback thread count for parallel selections */
    public static final int DEFAULT_THREAD_POOL_SIZE = Math.max(1,
            Runtime.getRuntime().availableProcessors() / 2);

    private AnalysisConfig() {
        throw new UnsupportedOperationException("Configuration class cannot be instantiated");
    }
}
