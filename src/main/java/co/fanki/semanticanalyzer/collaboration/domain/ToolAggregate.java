package co.fanki.semanticanalyzer.collaboration.domain;

import java.time.Duration;

/**
 * Aggregated telemetry of one tool.
 *
 * @param toolId the tool id
 * @param operations how many operations were recorded
 * @param successRate the share of successful operations
 * @param averageDuration the mean operation duration
 * @param averageConfidence the mean confidence
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public record ToolAggregate(
        String toolId,
        int operations,
        double successRate,
        Duration averageDuration,
        double averageConfidence
) {

    /**
     * Returns the aggregate of a tool with no recorded operation.
     *
     * @param toolId the tool id
     * @return an all-zero aggregate
     */
    public static ToolAggregate empty(final String toolId) {
        return new ToolAggregate(toolId, 0, 0, Duration.ZERO, 0);
    }

}
