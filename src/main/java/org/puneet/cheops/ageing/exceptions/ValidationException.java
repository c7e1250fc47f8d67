package org.puneet.cheops.ageing.exceptions;

import java.io.Serial;
import java.io.Serializable;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.*;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Structural validation failure raised when the analysis engine is misused by its caller.
 * Covers misaligned time/value arrays, descending time arrays, non-positive bin widths,
 * invalid outlier multipliers and parameters that do not belong to the selected analysis type.
 *
 * <p>Data insufficiency (too few samples, too few bins, no time overlap) is never reported
 * through this exception; those outcomes degrade to NaN or empty results instead.</p>
 *
 * @author CHEOPS Ageing Monitoring Framework
 * @version 1.0.0
 * @since 2025-09-02
 */
public class ValidationException extends Exception implements Serializable {

    @Serial
    private static final long serialVersionUID = 1L;

    private static final Logger LOGGER = Logger.getLogger(ValidationException.class.getName());

    /**
     * Types of validation failures
     */
    public enum ValidationType {
        NULL_VALIDATION("VAL001", "Null value not allowed"),
        SIZE_VALIDATION("VAL002", "Array sizes do not match"),
        ORDER_VALIDATION("VAL003", "Time array is not ascending"),
        RANGE_VALIDATION("VAL004", "Value out of valid range"),
        BIN_SIZE_VALIDATION("VAL005", "Invalid bin size"),
        CONFIGURATION_VALIDATION("VAL006", "Configuration validation failed"),
        SELECTION_VALIDATION("VAL007", "Selection is not consistent with the analysis catalog");

        private final String code;
        private final String description;

        ValidationType(String code, String description) {
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

    /**
     * Validation error details
     */
    public static class ValidationError implements Serializable {
        @Serial
        private static final long serialVersionUID = 1L;

        private final String fieldName;
        private final Object actualValue;
        private final Object expectedValue;
        private final String constraint;

        public ValidationError(String fieldName, Object actualValue,
                               Object expectedValue, String constraint) {
            this.fieldName = fieldName;
            this.actualValue = actualValue;
            this.expectedValue = expectedValue;
            this.constraint = constraint;
        }

        public String getFieldName() {
            return fieldName;
        }

        public Object getActualValue() {
            return actualValue;
        }

        public Object getExpectedValue() {
            return expectedValue;
        }

        public String getConstraint() {
            return constraint;
        }

        @Override
        public String toString() {
            return String.format("Field '%s': expected %s %s, but got %s",
                    fieldName, constraint, expectedValue, actualValue);
        }
    }

    private final ValidationType validationType;
    private final List<ValidationError> validationErrors;
    private final LocalDateTime timestamp;
    private final Map<String, Object> metadata;

    /**
     * Constructs a new ValidationException with type and message.
     *
     * @param validationType The type of validation that failed
     * @param message The detailed error message
     * @throws NullPointerException if validationType is null
     */
    public ValidationException(ValidationType validationType, String message) {
        this(validationType, message, new ArrayList<>(), null);
    }

    /**
     * Constructs a new ValidationException with type, message, and cause.
     *
     * @param validationType The type of validation that failed
     * @param message The detailed error message
     * @param cause The underlying cause of the exception
     */
    public ValidationException(ValidationType validationType, String message, Throwable cause) {
        this(validationType, message, new ArrayList<>(), cause);
    }

    /**
     * Constructs a new ValidationException with all parameters.
     *
     * @param validationType The type of validation that failed
     * @param message The detailed error message
     * @param validationErrors List of specific validation errors
     * @param cause The underlying cause, may be null
     */
    public ValidationException(ValidationType validationType, String message,
                               List<ValidationError> validationErrors, Throwable cause) {
        super(formatMessage(validationType, message, validationErrors), cause);

        Objects.requireNonNull(validationType, "Validation type cannot be null");

        this.validationType = validationType;
        this.validationErrors = validationErrors != null ?
                new ArrayList<>(validationErrors) : new ArrayList<>();
        this.timestamp = LocalDateTime.now();
        this.metadata = new HashMap<>();

        logException();
    }

    /**
     * Creates a validation exception for a null argument.
     *
     * @param fieldName The name of the field that is null
     * @return A new ValidationException configured for null validation
     */
    public static ValidationException nullValue(String fieldName) {
        String message = String.format("Null value not allowed for field '%s'", fieldName);
        List<ValidationError> errors = List.of(
                new ValidationError(fieldName, null, "non-null", "NOT_NULL"));
        return new ValidationException(ValidationType.NULL_VALIDATION, message, errors, null);
    }

    /**
     * Creates a validation exception for arrays whose lengths differ.
     *
     * @param fieldName The name of the array that does not match
     * @param actualSize The actual length
     * @param expectedSize The length it has to match
     * @return A new ValidationException configured for size validation
     */
    public static ValidationException sizeMismatch(String fieldName, int actualSize, int expectedSize) {
        String message = String.format(
                "Length of '%s' is %d but must match %d", fieldName, actualSize, expectedSize);
        List<ValidationError> errors = List.of(
                new ValidationError(fieldName, actualSize, expectedSize, "EXACT"));
        return new ValidationException(ValidationType.SIZE_VALIDATION, message, errors, null);
    }

    /**
     * Creates a validation exception for a time array that goes backwards.
     *
     * @param index Index of the first offending element
     * @param previous The time at index - 1
     * @param current The time at index
     * @return A new ValidationException configured for order validation
     */
    public static ValidationException notAscending(int index, double previous, double current) {
        String message = String.format(
                "Time at index %d (%s) precedes the previous time (%s)", index, current, previous);
        List<ValidationError> errors = List.of(
                new ValidationError("times[" + index + "]", current, previous, ">="));
        return new ValidationException(ValidationType.ORDER_VALIDATION, message, errors, null);
    }

    /**
     * Creates a validation exception for range violation scenarios.
     *
     * @param fieldName The name of the field
     * @param value The actual value
     * @param constraint Human readable description of the allowed range
     * @return A new ValidationException configured for range validation
     */
    public static ValidationException outOfRange(String fieldName, Number value, String constraint) {
        String message = String.format(
                "Value %s for field '%s' is out of range (%s)", value, fieldName, constraint);
        List<ValidationError> errors = List.of(
                new ValidationError(fieldName, value, constraint, "RANGE"));
        return new ValidationException(ValidationType.RANGE_VALIDATION, message, errors, null);
    }

    /**
     * Creates a validation exception for invalid configuration.
     *
     * @param configName The configuration key
     * @param reason The reason for invalidity
     * @return A new ValidationException configured for configuration validation
     */
    public static ValidationException invalidConfiguration(String configName, String reason) {
        String message = String.format("Invalid configuration '%s': %s", configName, reason);
        ValidationException ex = new ValidationException(
                ValidationType.CONFIGURATION_VALIDATION, message);
        ex.addMetadata("configName", configName);
        return ex;
    }

    /**
     * Creates a validation exception for a parameter requested from an analysis type
     * that does not list it.
     *
     * @param analysisType Display name of the analysis type
     * @param parameter The requested parameter
     * @return A new ValidationException configured for selection validation
     */
    public static ValidationException unknownParameter(String analysisType, String parameter) {
        String message = String.format(
                "Parameter '%s' is not configured for analysis type '%s'", parameter, analysisType);
        List<ValidationError> errors = List.of(
                new ValidationError("parameter", parameter, analysisType, "MEMBER_OF"));
        return new ValidationException(ValidationType.SELECTION_VALIDATION, message, errors, null);
    }

    private static String formatMessage(ValidationType validationType, String message,
                                        List<ValidationError> errors) {
        StringBuilder sb = new StringBuilder();
        sb.append("[").append(validationType.getCode()).append("] ");
        sb.append(validationType.getDescription());

        if (message != null && !message.isEmpty()) {
            sb.append(": ").append(message);
        }

        if (errors != null && !errors.isEmpty()) {
            sb.append(" | Errors: ");
            sb.append(errors.size()).append(" validation error(s)");
        }

        return sb.toString();
    }

    private void logException() {
        if (LOGGER.isLoggable(Level.FINE)) {
            LOGGER.log(Level.FINE, String.format(
                    "ValidationException created: [%s] %s at %s",
                    validationType.getCode(),
                    getMessage(),
                    timestamp.format(DateTimeFormatter.ISO_LOCAL_DATE_TIME)));
        }
    }

    public ValidationType getValidationType() {
        return validationType;
    }

    /**
     * Gets the list of validation errors.
     *
     * @return An unmodifiable list of validation errors
     */
    public List<ValidationError> getValidationErrors() {
        return Collections.unmodifiableList(validationErrors);
    }

    public LocalDateTime getTimestamp() {
        return timestamp;
    }

    public Map<String, Object> getMetadata() {
        return Collections.unmodifiableMap(metadata);
    }

    /**
     * Adds metadata to this exception.
     *
     * @param key The metadata key
     * @param value The metadata value
     */
    public void addMetadata(String key, Object value) {
        if (key != null) {
            metadata.put(key, value);
        }
    }

    /**
     * Gets a detailed string representation for logging.
     *
     * @return A detailed string representation
     */
    public String getDetailedMessage() {
        StringBuilder sb = new StringBuilder();
        sb.append("ValidationException Details:\n");
        sb.append("  Type: ").append(validationType.getCode()).append(" - ")
          .append(validationType.getDescription()).append("\n");
        sb.append("  Message: ").append(getMessage()).append("\n");
        sb.append("  Timestamp: ").append(timestamp.format(DateTimeFormatter.ISO_LOCAL_DATE_TIME)).append("\n");

        if (!validationErrors.isEmpty()) {
            sb.append("  Validation Errors (").append(validationErrors.size()).append("):\n");
            for (ValidationError error : validationErrors) {
                sb.append("    - ").append(error).append("\n");
            }
        }

        if (!metadata.isEmpty()) {
            sb.append("  Metadata:\n");
            for (Map.Entry<String, Object> entry : metadata.entrySet()) {
                sb.append("    ").append(entry.getKey()).append(": ")
                  .append(entry.getValue()).append("\n");
            }
        }

        return sb.toString();
    }

    @Override
    public String toString() {
        return String.format("ValidationException[type=%s, errors=%d, timestamp=%s]: %s",
                validationType.getCode(),
                validationErrors.size(),
                timestamp.format(DateTimeFormatter.ISO_LOCAL_DATE_TIME),
                getMessage());
    }
}
