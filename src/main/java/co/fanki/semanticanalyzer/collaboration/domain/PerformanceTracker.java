package co.fanki.semanticanalyzer.collaboration.domain;

/**
 * Sink for tool operation telemetry.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public interface PerformanceTracker {

    /**
     * Records one operation.
     *
     * @param metric the operation metric
     * @throws CollaboratorException if the metric cannot be recorded
     */
    void track(ToolMetric metric);

}
