package org.puneet.cheops.ageing.exceptions;

import java.io.Serial;
import java.io.Serializable;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.*;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Exception for failures of an analysis pass that are not caused by the statistics themselves:
 * the series source could not be read, the selection was structurally invalid, or an
 * export could not be written.
 *
 * @author CHEOPS Ageing Monitoring Framework
 * @version 1.0.0
 * @since 2025-09-02
 */
public class AnalysisException extends Exception implements Serializable {

    @Serial
    private static final long serialVersionUID = 1L;

    private static final Logger LOGGER = Logger.getLogger(AnalysisException.class.getName());

    /**
     * Types of analysis failures
     */
    public enum AnalysisErrorType {
        SOURCE_UNAVAILABLE("ANA001", "Series source could not be read"),
        INVALID_SELECTION("ANA002", "Selection failed validation"),
        SERIES_CONSTRUCTION_ERROR("ANA003", "Series could not be constructed from source data"),
        EXPORT_ERROR("ANA004", "Result export failed"),
        EXECUTION_ERROR("ANA005", "Analysis execution failed");

        private final String code;
        private final String description;

        AnalysisErrorType(String code, String description) {
            this.code = code;
            this.description = description;
        }

        public String getCode() {
            return code;
        }

        public String getDescription() {
            return description;
        }
    }

    private final AnalysisErrorType errorType;
    private final LocalDateTime timestamp;
    private final Map<String, Object> analysisContext;

    /**
     * Constructs a new AnalysisException with error type and message.
     *
     * @param errorType The type of analysis error
     * @param message The detailed error message
     */
    public AnalysisException(AnalysisErrorType errorType, String message) {
        this(errorType, message, null);
    }

    /**
     * Constructs a new AnalysisException with error type, message, and cause.
     *
     * @param errorType The type of analysis error
     * @param message The detailed error message
     * @param cause The underlying cause
     * @throws NullPointerException if errorType is null
     */
    public AnalysisException(AnalysisErrorType errorType, String message, Throwable cause) {
        super(formatMessage(errorType, message), cause);

        Objects.requireNonNull(errorType, "Error type cannot be null");

        this.errorType = errorType;
        this.timestamp = LocalDateTime.now();
        this.analysisContext = new HashMap<>();

        logException();
    }

    /**
     * Creates an exception for a series source that failed to deliver data.
     *
     * @param target Target name of the selection
     * @param parameter Parameter of the selection
     * @param cause The I/O or parsing failure
     * @return A new AnalysisException
     */
    public static AnalysisException sourceUnavailable(String target, String parameter, Throwable cause) {
        String message = String.format(
                "Could not load series for target '%s', parameter '%s'", target, parameter);
        AnalysisException ex = new AnalysisException(AnalysisErrorType.SOURCE_UNAVAILABLE, message, cause);
        ex.addContext("target", target);
        ex.addContext("parameter", parameter);
        return ex;
    }

    /**
     * Wraps a structural validation failure raised while serving a selection.
     *
     * @param cause The validation failure
     * @return A new AnalysisException
     */
    public static AnalysisException invalidSelection(ValidationException cause) {
        AnalysisException ex = new AnalysisException(
                AnalysisErrorType.INVALID_SELECTION, cause.getMessage(), cause);
        ex.addContext("validationCode", cause.getValidationType().getCode());
        return ex;
    }

    private static String formatMessage(AnalysisErrorType errorType, String message) {
        StringBuilder sb = new StringBuilder();
        sb.append("[").append(errorType.getCode()).append("] ");
        sb.append(errorType.getDescription());
        if (message != null && !message.isEmpty()) {
            sb.append(": ").append(message);
        }
        return sb.toString();
    }

    private void logException() {
        if (LOGGER.isLoggable(Level.WARNING)) {
            LOGGER.log(Level.WARNING, String.format(
                    "AnalysisException created: [%s] %s at %s",
                    errorType.getCode(),
                    getMessage(),
                    timestamp.format(DateTimeFormatter.ISO_LOCAL_DATE_TIME)));
        }
    }

    /**
     * Adds context information to this exception.
     *
     * @param key Context key
     * @param value Context value
     */
    public void addContext(String key, Object value) {
        if (key != null) {
            analysisContext.put(key, value);
        }
    }

    public AnalysisErrorType getErrorType() {
        return errorType;
    }

    public LocalDateTime getTimestamp() {
        return timestamp;
    }

    public Map<String, Object> getAnalysisContext() {
        return Collections.unmodifiableMap(analysisContext);
    }

    /**
     * Checks if this failure should abort a batch of selections rather than a single one.
     *
     * @return true for failures that affect every selection
     */
    public boolean isCritical() {
        return errorType == AnalysisErrorType.EXECUTION_ERROR;
    }

    @Override
    public String toString() {
        return String.format("AnalysisException[type=%s, timestamp=%s]: %s",
                errorType.name(),
                timestamp.format(DateTimeFormatter.ISO_LOCAL_DATE_TIME),
                getMessage());
    }
}
