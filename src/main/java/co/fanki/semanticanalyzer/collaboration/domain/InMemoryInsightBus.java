package co.fanki.semanticanalyzer.collaboration.domain;

import co.fanki.semanticanalyzer.shared.Preconditions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicLong;

/**
 * {@link InsightBus} that delivers insights synchronously to handlers
 * registered in the same process.
 *
 * <p>An insight naming the tools it affects is delivered once to each of
 * them. An insight naming none is delivered to every registered tool but
 * the sender. Tools that are not registered still count as recipients in
 * the message history, they just have nobody to handle the message.</p>
 *
 * <p>The bus keeps the last {@code historyLimit} messages and per-tool
 * counters. It is safe for concurrent use.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public class InMemoryInsightBus implements InsightBus {

    private static final Logger LOG = LoggerFactory.getLogger(
            InMemoryInsightBus.class);

    /** Default number of messages kept in the history. */
    public static final int DEFAULT_HISTORY_LIMIT = 1000;

    private final int historyLimit;

    private final Clock clock;

    private final Map<String, List<InsightHandler>> handlers =
            new ConcurrentHashMap<>();

    private final Map<String, Counters> stats = new ConcurrentHashMap<>();

    private final Deque<InsightMessage> history = new ArrayDeque<>();

    /** Creates a bus with the default history limit. */
    public InMemoryInsightBus() {
        this(DEFAULT_HISTORY_LIMIT, Clock.systemUTC());
    }

    /**
     * Creates a bus.
     *
     * @param theHistoryLimit how many messages to keep, at least 1
     * @param theClock the clock used to stamp messages
     */
    public InMemoryInsightBus(final int theHistoryLimit,
            final Clock theClock) {
        Preconditions.require(theHistoryLimit > 0,
                "History limit must be positive");
        Preconditions.requireNonNull(theClock, "Clock is required");
        this.historyLimit = theHistoryLimit;
        this.clock = theClock;
    }

    /**
     * Registers a tool without handlers so it is counted in statistics
     * and included in broadcasts.
     *
     * @param toolId the tool id
     */
    public void register(final String toolId) {
        Preconditions.requireNonBlank(toolId, "Tool id is required");
        handlers.computeIfAbsent(toolId, id -> new CopyOnWriteArrayList<>());
        stats.computeIfAbsent(toolId, id -> new Counters());
        LOG.info("Registered tool {} on the insight bus", toolId);
    }

    /**
     * Registers a tool and adds a handler for the insights it receives.
     *
     * @param toolId the tool id
     * @param handler the handler
     */
    public void register(final String toolId, final InsightHandler handler) {
        Preconditions.requireNonNull(handler, "Handler is required");
        register(toolId);
        handlers.get(toolId).add(handler);
    }

    /** {@inheritDoc} */
    @Override
    public void shareInsight(final String sourceId, final Insight insight) {
        Preconditions.requireNonBlank(sourceId, "Source id is required");
        Preconditions.requireNonNull(insight, "Insight is required");

        final List<String> recipients = insight.isBroadcast()
                ? broadcastRecipients(sourceId)
                : insight.affects();

        final List<String> failedTools = new ArrayList<>();
        RuntimeException firstFailure = null;
        for (final String recipient : recipients) {
            final InsightMessage message = new InsightMessage(
                    UUID.randomUUID().toString(), sourceId, recipient,
                    "Insight: " + insight.type(), insight, clock.instant());
            record(message);
            final Counters sender = stats.get(sourceId);
            if (sender != null) {
                sender.sent.incrementAndGet();
            }
            try {
                deliver(message);
            } catch (final RuntimeException e) {
                failedTools.add(recipient);
                if (firstFailure == null) {
                    firstFailure = e;
                }
            }
        }

        if (!failedTools.isEmpty()) {
            throw new CollaboratorException("Insight " + insight.type()
                    + " from " + sourceId + " failed on " + failedTools,
                    firstFailure);
        }
    }

    private List<String> broadcastRecipients(final String sourceId) {
        final List<String> recipients = new ArrayList<>();
        for (final String toolId : handlers.keySet()) {
            if (!toolId.equals(sourceId)) {
                recipients.add(toolId);
            }
        }
        return recipients;
    }

    private void deliver(final InsightMessage message) {
        final Counters receiver = stats.get(message.to());
        if (receiver != null) {
            receiver.received.incrementAndGet();
        }
        final List<InsightHandler> toolHandlers = handlers.getOrDefault(
                message.to(), List.of());
        if (toolHandlers.isEmpty()) {
            LOG.debug("No handler for {} on tool {}", message.subject(),
                    message.to());
            return;
        }
        try {
            for (final InsightHandler handler : toolHandlers) {
                handler.onInsight(message);
            }
            if (receiver != null) {
                receiver.processed.incrementAndGet();
            }
        } catch (final RuntimeException e) {
            if (receiver != null) {
                receiver.failed.incrementAndGet();
            }
            LOG.warn("Tool {} failed to handle {}: {}", message.to(),
                    message.subject(), e.getMessage());
            throw e;
        }
    }

    private void record(final InsightMessage message) {
        synchronized (history) {
            history.addLast(message);
            while (history.size() > historyLimit) {
                history.removeFirst();
            }
        }
    }

    /**
     * Returns the message history, oldest first.
     *
     * @return a snapshot of the kept messages
     */
    public List<InsightMessage> history() {
        synchronized (history) {
            return List.copyOf(history);
        }
    }

    /**
     * Returns the messages delivered to one tool, oldest first.
     *
     * @param toolId the receiving tool
     * @return a snapshot of the kept messages sent to the tool
     */
    public List<InsightMessage> historyFor(final String toolId) {
        final List<InsightMessage> result = new ArrayList<>();
        for (final InsightMessage message : history()) {
            if (message.to().equals(toolId)) {
                result.add(message);
            }
        }
        return result;
    }

    /**
     * Returns the counters of a tool.
     *
     * @param toolId the tool id
     * @return the counters, {@link MessageStats#NONE} for unknown tools
     */
    public MessageStats stats(final String toolId) {
        final Counters counters = stats.get(toolId);
        return counters == null ? MessageStats.NONE : counters.snapshot();
    }

    /** Mutable per-tool counters. */
    private static final class Counters {

        private final AtomicLong sent = new AtomicLong();
        private final AtomicLong received = new AtomicLong();
        private final AtomicLong processed = new AtomicLong();
        private final AtomicLong failed = new AtomicLong();

        private MessageStats snapshot() {
            return new MessageStats(sent.get(), received.get(),
                    processed.get(), failed.get());
        }
    }

}
