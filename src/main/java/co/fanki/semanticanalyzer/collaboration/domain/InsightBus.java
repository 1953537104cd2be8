package co.fanki.semanticanalyzer.collaboration.domain;

/**
 * Publish/subscribe channel between analysis tools.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public interface InsightBus {

    /**
     * Shares an insight with the tools it affects.
     *
     * @param sourceId the id of the sending tool
     * @param insight the insight
     * @throws CollaboratorException if the insight cannot be delivered
     */
    void shareInsight(String sourceId, Insight insight);

}
