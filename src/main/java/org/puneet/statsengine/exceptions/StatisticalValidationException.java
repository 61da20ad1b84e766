package org.puneet.statsengine.exceptions;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Serial;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Exception raised by every computation of the statistics engine when its input
 * does not satisfy the preconditions of the requested statistic, test or
 * distribution function.
 *
 * <p>The {@link StatisticalErrorType} tells the caller which kind of input to
 * change. When the failure happened inside a grouped computation the group key
 * is available through {@link #getDatasetName()}.</p>
 *
 * @author Puneet Chandna
 * @version 1.0.0
 * @since 2025-09-02
 */
public class StatisticalValidationException extends Exception {

    @Serial
    private static final long serialVersionUID = 1L;

    private static final Logger logger = LoggerFactory.getLogger(StatisticalValidationException.class);

    /**
     * Types of statistical validation failures
     */
    public enum StatisticalErrorType {
        EMPTY_DATASET("STAT001", "Dataset contains no observations"),
        INSUFFICIENT_SAMPLE_SIZE("STAT002", "Sample size too small for the requested computation"),
        INVALID_SAMPLE_SIZE("STAT003", "Sample size outside the valid domain of the test"),
        INVALID_INPUT("STAT004", "Malformed input data"),
        INVALID_PARAMETER("STAT005", "Invalid parameter passed to a statistical function"),
        DIVISION_BY_ZERO("STAT006", "Degenerate input leads to a division by zero"),
        NUMERICAL_CONVERGENCE("STAT007", "Numerical approximation failed to converge");

        private final String code;
        private final String description;

        StatisticalErrorType(String code, String description) {
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

    private final StatisticalErrorType errorType;
    private final String datasetName;
    private final Integer sampleSize;
    private final Map<String, Object> statisticalContext;

    /**
     * Constructs a new StatisticalValidationException with error type and message.
     *
     * @param errorType The type of statistical error
     * @param message The detailed error message
     * @throws NullPointerException if errorType is null
     */
    public StatisticalValidationException(StatisticalErrorType errorType, String message) {
        this(errorType, message, null, null, null);
    }

    /**
     * Constructs a new StatisticalValidationException with error type, message, and cause.
     *
     * @param errorType The type of statistical error
     * @param message The detailed error message
     * @param cause The underlying cause
     * @throws NullPointerException if errorType is null
     */
    public StatisticalValidationException(StatisticalErrorType errorType, String message, Throwable cause) {
        this(errorType, message, null, null, cause);
    }

    /**
     * Full constructor with all parameters.
     *
     * @param errorType The type of statistical error
     * @param message The detailed error message
     * @param datasetName Name of the dataset (group) being analyzed, may be null
     * @param sampleSize Size of the offending sample, may be null
     * @param cause The underlying cause, may be null
     * @throws NullPointerException if errorType is null
     */
    public StatisticalValidationException(StatisticalErrorType errorType, String message,
                                          String datasetName, Integer sampleSize, Throwable cause) {
        super(formatMessage(Objects.requireNonNull(errorType, "Error type cannot be null"),
                message, datasetName), cause);
        this.errorType = errorType;
        this.datasetName = datasetName;
        this.sampleSize = sampleSize;
        this.statisticalContext = new LinkedHashMap<>();

        logger.debug("StatisticalValidationException created: {}", getMessage());
    }

    /**
     * Creates an exception for a sample without observations.
     *
     * @param computation The computation that was requested
     * @return A new StatisticalValidationException
     */
    public static StatisticalValidationException emptyDataset(String computation) {
        StatisticalValidationException ex = new StatisticalValidationException(
                StatisticalErrorType.EMPTY_DATASET,
                String.format("%s requires at least one observation", computation),
                null, 0, null);
        ex.addContext("computation", computation);
        return ex;
    }

    /**
     * Creates an exception for insufficient sample size.
     *
     * @param actualSize The actual sample size
     * @param requiredSize The required minimum sample size
     * @param computation The statistic or test requiring the sample size
     * @return A new StatisticalValidationException
     */
    public static StatisticalValidationException insufficientSampleSize(
            int actualSize, int requiredSize, String computation) {

        String message = String.format(
                "Sample size %d is insufficient for %s (minimum required: %d)",
                actualSize, computation, requiredSize);

        StatisticalValidationException ex = new StatisticalValidationException(
                StatisticalErrorType.INSUFFICIENT_SAMPLE_SIZE, message, null, actualSize, null);
        ex.addContext("requiredSize", requiredSize);
        ex.addContext("computation", computation);
        return ex;
    }

    /**
     * Creates an exception for a sample size outside the valid domain of a test.
     *
     * @param actualSize The actual sample size
     * @param minSize Smallest accepted size
     * @param maxSize Largest accepted size
     * @param testName The test with the bounded domain
     * @return A new StatisticalValidationException
     */
    public static StatisticalValidationException invalidSampleSize(
            int actualSize, int minSize, int maxSize, String testName) {

        String message = String.format(
                "%s is valid for %d <= n <= %d, got n = %d",
                testName, minSize, maxSize, actualSize);

        StatisticalValidationException ex = new StatisticalValidationException(
                StatisticalErrorType.INVALID_SAMPLE_SIZE, message, null, actualSize, null);
        ex.addContext("minSize", minSize);
        ex.addContext("maxSize", maxSize);
        ex.addContext("testName", testName);
        return ex;
    }

    /**
     * Creates an exception for malformed input data.
     *
     * @param reason What is wrong with the input
     * @return A new StatisticalValidationException
     */
    public static StatisticalValidationException invalidInput(String reason) {
        return new StatisticalValidationException(StatisticalErrorType.INVALID_INPUT, reason);
    }

    /**
     * Creates an exception for a parameter outside its domain.
     *
     * @param name The parameter name
     * @param value The rejected value
     * @param constraint Human readable constraint, e.g. "> 0"
     * @return A new StatisticalValidationException
     */
    public static StatisticalValidationException invalidParameter(String name, double value, String constraint) {
        return invalidParameter(name, value, constraint, null);
    }

    /**
     * Creates an exception for a parameter rejected by an underlying numerical library.
     *
     * @param name The parameter name
     * @param value The rejected value
     * @param constraint Human readable constraint
     * @param cause The library exception, may be null
     * @return A new StatisticalValidationException
     */
    public static StatisticalValidationException invalidParameter(String name, double value, String constraint,
                                                                  Throwable cause) {
        StatisticalValidationException ex = new StatisticalValidationException(
                StatisticalErrorType.INVALID_PARAMETER,
                String.format("Parameter '%s' must be %s, got %s", name, constraint, value), cause);
        ex.addContext("parameter", name);
        ex.addContext("value", value);
        return ex;
    }

    /**
     * Creates an exception for a degenerate input that would divide by zero.
     *
     * @param computation The computation that cannot be carried out
     * @param reason Why the denominator vanishes
     * @return A new StatisticalValidationException
     */
    public static StatisticalValidationException divisionByZero(String computation, String reason) {
        StatisticalValidationException ex = new StatisticalValidationException(
                StatisticalErrorType.DIVISION_BY_ZERO,
                String.format("%s is undefined: %s", computation, reason));
        ex.addContext("computation", computation);
        return ex;
    }

    /**
     * Creates an exception for an iterative approximation that hit its iteration cap.
     *
     * @param function The numerical function
     * @param iterations The number of iterations performed
     * @return A new StatisticalValidationException
     */
    public static StatisticalValidationException convergenceFailure(String function, int iterations) {
        return convergenceFailure(function, iterations, null);
    }

    /**
     * Creates an exception for an iteration cap hit inside an underlying numerical library.
     *
     * @param function The numerical function
     * @param iterations The number of iterations performed
     * @param cause The library exception, may be null
     * @return A new StatisticalValidationException
     */
    public static StatisticalValidationException convergenceFailure(String function, int iterations,
                                                                    Throwable cause) {
        StatisticalValidationException ex = new StatisticalValidationException(
                StatisticalErrorType.NUMERICAL_CONVERGENCE,
                String.format("%s did not converge after %d iterations", function, iterations), cause);
        ex.addContext("function", function);
        ex.addContext("iterations", iterations);
        return ex;
    }

    /**
     * Re-reports a failure that happened while processing one group of a grouped computation.
     * The error type and sample size of the cause are preserved.
     *
     * @param groupKey The key of the failing group
     * @param cause The original failure
     * @return A new StatisticalValidationException naming the group
     */
    public static StatisticalValidationException forGroup(String groupKey, StatisticalValidationException cause) {
        StatisticalValidationException ex = new StatisticalValidationException(
                cause.getErrorType(),
                String.format("Group '%s' failed: %s", groupKey, cause.getMessage()),
                groupKey, cause.getSampleSize(), cause);
        cause.getStatisticalContext().forEach(ex::addContext);
        return ex;
    }

    private static String formatMessage(StatisticalErrorType errorType, String message, String datasetName) {
        StringBuilder sb = new StringBuilder();
        sb.append("[").append(errorType.getCode()).append("] ");
        sb.append(errorType.getDescription());

        if (datasetName != null) {
            sb.append(" (dataset '").append(datasetName).append("')");
        }

        if (message != null && !message.isEmpty()) {
            sb.append(": ").append(message);
        }

        return sb.toString();
    }

    /**
     * Adds statistical context information.
     *
     * @param key The context key
     * @param value The context value
     */
    public void addContext(String key, Object value) {
        if (key != null) {
            statisticalContext.put(key, value);
        }
    }

    public StatisticalErrorType getErrorType() {
        return errorType;
    }

    /**
     * Gets the dataset name.
     *
     * @return The group key of a grouped computation, may be null
     */
    public String getDatasetName() {
        return datasetName;
    }

    /**
     * Gets the sample size.
     *
     * @return The sample size, may be null
     */
    public Integer getSampleSize() {
        return sampleSize;
    }

    /**
     * Gets the statistical context.
     *
     * @return An unmodifiable map of statistical context
     */
    public Map<String, Object> getStatisticalContext() {
        return Collections.unmodifiableMap(statisticalContext);
    }

    /**
     * Gets a detailed message for logging.
     *
     * @return A detailed string representation
     */
    public String getDetailedMessage() {
        StringBuilder sb = new StringBuilder();
        sb.append("StatisticalValidationException Details:\n");
        sb.append("  Error Type: ").append(errorType.getCode()).append(" - ")
          .append(errorType.getDescription()).append("\n");
        sb.append("  Message: ").append(getMessage()).append("\n");

        if (datasetName != null) {
            sb.append("  Dataset: ").append(datasetName).append("\n");
        }

        if (sampleSize != null) {
            sb.append("  Sample Size: ").append(sampleSize).append("\n");
        }

        if (!statisticalContext.isEmpty()) {
            sb.append("  Statistical Context:\n");
            statisticalContext.forEach((key, value) ->
                    sb.append("    ").append(key).append(": ").append(value).append("\n"));
        }

        if (getCause() != null) {
            sb.append("  Cause: ").append(getCause().getClass().getName())
              .append(" - ").append(getCause().getMessage()).append("\n");
        }

        return sb.toString();
    }

    @Override
    public String toString() {
        return String.format("StatisticalValidationException[type=%s, dataset=%s]: %s",
                errorType.name(),
                datasetName != null ? datasetName : "unknown",
                getMessage());
    }
}
