package co.fanki.semanticanalyzer.collaboration.domain;

/**
 * Message counters of one tool registered on an {@link InMemoryInsightBus}.
 *
 * @param sent messages the tool sent, one per delivery
 * @param received messages delivered to the tool
 * @param processed deliveries its handlers completed
 * @param failed deliveries one of its handlers failed on
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public record MessageStats(
        long sent,
        long received,
        long processed,
        long failed
) {

    /** Counters of a tool that has not exchanged any message. */
    public static final MessageStats NONE = new MessageStats(0, 0, 0, 0);

}
