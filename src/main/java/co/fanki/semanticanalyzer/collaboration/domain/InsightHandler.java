package co.fanki.semanticanalyzer.collaboration.domain;

/**
 * Receives the insights delivered to a registered tool.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
@FunctionalInterface
public interface InsightHandler {

    /**
     * Handles one delivered message.
     *
     * @param message the message
     */
    void onInsight(InsightMessage message);

}
