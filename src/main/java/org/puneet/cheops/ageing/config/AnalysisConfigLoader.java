package org.puneet.cheops.ageing.config;

import org.puneet.cheops.ageing.exceptions.ValidationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.util.*;
import java.util.stream.Collectors;

/**
 * Loads the tunable analysis settings from {@code analysis.properties} on the classpath.
 *
 * <p>Recognised keys:</p>
 * <ul>
 *   <li>{@code outlier.remove} - whether selections filter outliers by default</li>
 *   <li>{@code outlier.multiplier} - robust-sigma multiplier k</li>
 *   <li>{@code noise.bin.widths.hours} - comma separated bin widths</li>
 *   <li>{@code runner.threads} - worker threads for parallel selections</li>
 * </ul>
 *
 * @author CHEOPS Ageing Monitoring Framework
 * @version 1.0.0
 * @since 2025-09-02
 */
public class AnalysisConfigLoader {
    private static final Logger logger = LoggerFactory.getLogger(AnalysisConfigLoader.class);

    public static final String CONFIG_FILE = "analysis.properties";

    static final String OUTLIER_REMOVE_KEY = "outlier.remove";
    static final String OUTLIER_MULTIPLIER_KEY = "outlier.multiplier";
    static final String BIN_WIDTHS_KEY = "noise.bin.widths.hours";
    static final String RUNNER_THREADS_KEY = "runner.threads";

    private final Properties config;

    /**
     * Creates a loader for the default configuration file.
     *
     * @throws RuntimeException if the configuration cannot be loaded
     */
    public AnalysisConfigLoader() {
        this(CONFIG_FILE);
    }

    /**
     * Creates a loader for a named classpath resource.
     *
     * @param resourceName classpath resource to read
     * @throws RuntimeException if the configuration cannot be loaded
     */
    public AnalysisConfigLoader(String resourceName) {
        this.config = loadConfiguration(resourceName);
    }

    /**
     * Creates a loader over already loaded properties.
     */
    public AnalysisConfigLoader(Properties properties) {
        this.config = new Properties();
        this.config.putAll(Objects.requireNonNull(properties, "properties cannot be null"));
    }

    private Properties loadConfiguration(String resourceName) {
        Properties props = new Properties();

        try (InputStream inputStream = getClass().getClassLoader().getResourceAsStream(resourceName)) {
            if (inputStream == null) {
                throw new RuntimeException("Configuration file " + resourceName + " not found in classpath");
            }

            props.load(inputStream);
            logger.info("Successfully loaded configuration from {}", resourceName);

        } catch (IOException e) {
            throw new RuntimeException("Failed to load configuration from " + resourceName, e);
        }

        return props;
    }

    /**
     * @return true if selections remove outliers unless told otherwise
     */
    public boolean isOutlierRemovalEnabled() {
        return Boolean.parseBoolean(config.getProperty(OUTLIER_REMOVE_KEY, "false").trim());
    }

    /**
     * @return the robust-sigma multiplier k
     * @throws ValidationException if the value is not a positive finite number
     */
    public double getOutlierMultiplier() throws ValidationException {
        String raw = config.getProperty(OUTLIER_MULTIPLIER_KEY);
        if (raw == null || raw.trim().isEmpty()) {
            logger.debug("No {} configured, using default {}", OUTLIER_MULTIPLIER_KEY,
                    AnalysisConfig.DEFAULT_OUTLIER_MULTIPLIER);
            return AnalysisConfig.DEFAULT_OUTLIER_MULTIPLIER;
        }
        double k = parseDouble(OUTLIER_MULTIPLIER_KEY, raw);
        if (!Double.isFinite(k) || k <= 0) {
            throw ValidationException.invalidConfiguration(OUTLIER_MULTIPLIER_KEY,
                    "multiplier must be a positive number, got " + raw);
        }
        return k;
    }

    /**
     * @return configured bin widths in hours, ascending and without duplicates
     * @throws ValidationException if a width is not a positive finite number
     */
    public List<Double> getBinWidthsHours() throws ValidationException {
        String raw = config.getProperty(BIN_WIDTHS_KEY, "");

        if (raw.trim().isEmpty()) {
            logger.warn("No bin widths configured, using defaults {}", AnalysisConfig.DEFAULT_BIN_WIDTHS_HOURS);
            return AnalysisConfig.DEFAULT_BIN_WIDTHS_HOURS;
        }

        List<String> tokens = Arrays.stream(raw.split(","))
            .map(String::trim)
            .filter(s -> !s.isEmpty())
            .collect(Collectors.toList());

        SortedSet<Double> widths = new TreeSet<>();
        for (String token : tokens) {
            double width = parseDouble(BIN_WIDTHS_KEY, token);
            if (!Double.isFinite(width) || width <= 0) {
                throw ValidationException.invalidConfiguration(BIN_WIDTHS_KEY,
                        "bin widths must be positive numbers of hours, got " + token);
            }
            widths.add(width);
        }

        logger.debug("Loaded bin widths: {}", widths);
        return List.copyOf(widths);
    }

    /**
     * @return worker threads for parallel selections
     * @throws ValidationException if the value is not a positive integer
     */
    public int getThreadPoolSize() throws ValidationException {
        String raw = config.getProperty(RUNNER_THREADS_KEY);
        if (raw == null || raw.trim().isEmpty()) {
            return AnalysisConfig.DEFAULT_THREAD_POOL_SIZE;
        }
        try {
            int threads = Integer.parseInt(raw.trim());
            if (threads <= 0) {
                throw ValidationException.invalidConfiguration(RUNNER_THREADS_KEY,
                        "thread count must be positive, got " + raw);
            }
            return threads;
        } catch (NumberFormatException e) {
            throw new ValidationException(ValidationException.ValidationType.CONFIGURATION_VALIDATION,
                    "Invalid integer for " + RUNNER_THREADS_KEY + ": " + raw, e);
        }
    }

    /**
     * Validates every recognised key.
     *
     * @throws ValidationException on the first invalid value
     */
    public void validateConfiguration() throws ValidationException {
        getOutlierMultiplier();
        getBinWidthsHours();
        getThreadPoolSize();
        logger.info("Configuration validation passed");
    }

    public String getProperty(String key, String defaultValue) {
        return config.getProperty(key, defaultValue);
    }

    private static double parseDouble(String key, String raw) throws ValidationException {
        try {
            return Double.parseDouble(raw.trim());
        } catch (NumberFormatException e) {
            throw new ValidationException(ValidationException.ValidationType.CONFIGURATION_VALIDATION,
                    "Invalid number for " + key + ": " + raw, e);
        }
    }
}
