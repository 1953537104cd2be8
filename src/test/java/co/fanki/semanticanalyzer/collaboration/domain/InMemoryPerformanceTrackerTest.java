package co.fanki.semanticanalyzer.collaboration.domain;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;

/**
 * Unit tests for {@link InMemoryPerformanceTracker}.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
class InMemoryPerformanceTrackerTest {

    private static final IoDescriptor CODE = new IoDescriptor("code", 120);

    private static ToolMetric success(final String toolId,
            final long millis, final double confidence) {
        return ToolMetric.success(toolId, "analyze-intent", Instant.now(),
                Duration.ofMillis(millis), CODE,
                new IoDescriptor("intent", 800), confidence);
    }

    @Test
    void whenAggregating_givenMixedResults_shouldAverageThem() {
        final InMemoryPerformanceTracker tracker =
                new InMemoryPerformanceTracker();
        tracker.track(success("semantic-analyzer", 10, 0.8));
        tracker.track(ToolMetric.failure("semantic-analyzer",
                "analyze-intent", Instant.now(), Duration.ofMillis(30), CODE,
                "Unparseable input"));
        tracker.track(success("smart-reviewer", 500, 0.9));

        final ToolAggregate aggregate = tracker.aggregate("semantic-analyzer");

        assertEquals(2, aggregate.operations());
        assertEquals(0.5, aggregate.successRate());
        assertEquals(Duration.ofMillis(20), aggregate.averageDuration());
        assertEquals(0.4, aggregate.averageConfidence(), 1e-9);
    }

    @Test
    void whenAggregating_givenUnknownTool_shouldReturnEmpty() {
        assertEquals(ToolAggregate.empty("ghost"),
                new InMemoryPerformanceTracker().aggregate("ghost"));
    }

    @Test
    void whenTracking_givenFullLog_shouldDropTheOldest() {
        final InMemoryPerformanceTracker tracker =
                new InMemoryPerformanceTracker(2);
        tracker.track(success("a", 1, 0.5));
        tracker.track(success("b", 1, 0.5));
        tracker.track(success("c", 1, 0.5));

        assertEquals(2, tracker.size());
        assertEquals(0, tracker.metricsFor("a").size());
        assertEquals(1, tracker.metricsFor("c").size());
    }

    @Test
    void whenCreatingFailure_givenError_shouldUseErrorOutput() {
        final ToolMetric failure = ToolMetric.failure("a", "op",
                Instant.now(), Duration.ZERO, CODE, "boom");

        assertFalse(failure.success());
        assertEquals(new IoDescriptor("error", 0), failure.output());
        assertEquals(0.0, failure.confidence());
    }

    @Test
    void whenCreatingDescriptor_givenNegativeSize_shouldFail() {
        assertThrows(IllegalArgumentException.class,
                () -> new IoDescriptor("code", -1));
    }

}
