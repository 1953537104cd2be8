package co.fanki.semanticanalyzer.collaboration.domain;

import co.fanki.semanticanalyzer.shared.Preconditions;
import co.fanki.semanticanalyzer.shared.ValueObject;

import java.time.Duration;
import java.time.Instant;

/**
 * Telemetry record of one tool operation.
 *
 * @param toolId the tool that ran, e.g. {@code semantic-analyzer}
 * @param operation the operation, e.g. {@code analyze-intent}
 * @param timestamp when the operation started
 * @param duration how long it took
 * @param success whether it produced a result
 * @param input what it consumed
 * @param output what it produced
 * @param confidence the confidence of the result, 0 on failure
 * @param error the failure message, null on success
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public record ToolMetric(
        String toolId,
        String operation,
        Instant timestamp,
        Duration duration,
        boolean success,
        IoDescriptor input,
        IoDescriptor output,
        double confidence,
        String error
) implements ValueObject {

    /**
     * Creates a metric, validating its fields.
     */
    public ToolMetric {
        Preconditions.requireNonBlank(toolId, "Tool id is required");
        Preconditions.requireNonBlank(operation, "Operation is required");
        Preconditions.requireNonNull(timestamp, "Timestamp is required");
        Preconditions.requireNonNull(duration, "Duration is required");
        Preconditions.require(!duration.isNegative(),
                "Duration must not be negative");
        Preconditions.requireNonNull(input, "Input is required");
        Preconditions.requireNonNull(output, "Output is required");
        Preconditions.require(confidence >= 0 && confidence <= 1,
                "Confidence must be between 0 and 1");
    }

    /**
     * Creates the metric of a successful operation.
     *
     * @param toolId the tool id
     * @param operation the operation
     * @param timestamp when it started
     * @param duration how long it took
     * @param input what it consumed
     * @param output what it produced
     * @param confidence the result confidence
     * @return the metric
     */
    public static ToolMetric success(final String toolId,
            final String operation, final Instant timestamp,
            final Duration duration, final IoDescriptor input,
            final IoDescriptor output, final double confidence) {
        return new ToolMetric(toolId, operation, timestamp, duration, true,
                input, output, confidence, null);
    }

    /**
     * Creates the metric of a failed operation. The output is
     * {@code error} with size 0 and the confidence is 0.
     *
     * @param toolId the tool id
     * @param operation the operation
     * @param timestamp when it started
     * @param duration how long it took until it failed
     * @param input what it consumed
     * @param error the failure message
     * @return the metric
     */
    public static ToolMetric failure(final String toolId,
            final String operation, final Instant timestamp,
            final Duration duration, final IoDescriptor input,
            final String error) {
        return new ToolMetric(toolId, operation, timestamp, duration, false,
                input, new IoDescriptor("error", 0), 0, error);
    }

}
