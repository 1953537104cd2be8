package co.fanki.semanticanalyzer.collaboration.domain;

import java.time.Instant;

/**
 * One delivery of an insight to one tool.
 *
 * @param id the message id
 * @param from the sending tool
 * @param to the receiving tool
 * @param subject the subject line, {@code Insight: <type>}
 * @param insight the insight delivered
 * @param timestamp when the message was sent
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public record InsightMessage(
        String id,
        String from,
        String to,
        String subject,
        Insight insight,
        Instant timestamp
) {
}
