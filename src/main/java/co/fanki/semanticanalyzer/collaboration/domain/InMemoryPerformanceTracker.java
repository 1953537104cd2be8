package co.fanki.semanticanalyzer.collaboration.domain;

import co.fanki.semanticanalyzer.shared.Preconditions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * {@link PerformanceTracker} that keeps the most recent metrics in memory.
 *
 * <p>When the log is full the oldest metric is dropped. Aggregates are
 * computed over the metrics still in the log.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public class InMemoryPerformanceTracker implements PerformanceTracker {

    private static final Logger LOG = LoggerFactory.getLogger(
            InMemoryPerformanceTracker.class);

    /** Default number of metrics kept. */
    public static final int DEFAULT_CAPACITY = 1000;

    private final int capacity;

    private final Deque<ToolMetric> metrics = new ArrayDeque<>();

    /** Creates a tracker with the default capacity. */
    public InMemoryPerformanceTracker() {
        this(DEFAULT_CAPACITY);
    }

    /**
     * Creates a tracker.
     *
     * @param theCapacity how many metrics to keep, at least 1
     */
    public InMemoryPerformanceTracker(final int theCapacity) {
        Preconditions.require(theCapacity > 0, "Capacity must be positive");
        this.capacity = theCapacity;
    }

    /** {@inheritDoc} */
    @Override
    public void track(final ToolMetric metric) {
        Preconditions.requireNonNull(metric, "Metric is required");
        synchronized (metrics) {
            metrics.addLast(metric);
            if (metrics.size() > capacity) {
                metrics.removeFirst();
            }
        }
        LOG.debug("Tracked {} {} in {} ms, success: {}", metric.toolId(),
                metric.operation(), metric.duration().toMillis(),
                metric.success());
    }

    /**
     * Returns the kept metrics of one tool, oldest first.
     *
     * @param toolId the tool id
     * @return the metrics, never null
     */
    public List<ToolMetric> metricsFor(final String toolId) {
        final List<ToolMetric> result = new ArrayList<>();
        synchronized (metrics) {
            for (final ToolMetric metric : metrics) {
                if (metric.toolId().equals(toolId)) {
                    result.add(metric);
                }
            }
        }
        return result;
    }

    /**
     * Aggregates the kept metrics of one tool.
     *
     * @param toolId the tool id
     * @return the aggregate, all zeros when nothing was tracked
     */
    public ToolAggregate aggregate(final String toolId) {
        final List<ToolMetric> toolMetrics = metricsFor(toolId);
        if (toolMetrics.isEmpty()) {
            return ToolAggregate.empty(toolId);
        }
        int successes = 0;
        Duration totalDuration = Duration.ZERO;
        double totalConfidence = 0;
        for (final ToolMetric metric : toolMetrics) {
            if (metric.success()) {
                successes++;
            }
            totalDuration = totalDuration.plus(metric.duration());
            totalConfidence += metric.confidence();
        }
        final int count = toolMetrics.size();
        return new ToolAggregate(toolId, count, (double) successes / count,
                totalDuration.dividedBy(count), totalConfidence / count);
    }

    /**
     * Returns how many metrics are kept.
     *
     * @return the log size
     */
    public int size() {
        synchronized (metrics) {
            return metrics.size();
        }
    }

}
