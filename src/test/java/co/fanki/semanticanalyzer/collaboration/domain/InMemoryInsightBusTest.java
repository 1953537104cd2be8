package co.fanki.semanticanalyzer.collaboration.domain;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Unit tests for {@link InMemoryInsightBus}.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
class InMemoryInsightBusTest {

    private static final Instant NOW = Instant.parse("2026-03-01T10:00:00Z");

    private InMemoryInsightBus bus;

    @BeforeEach
    void setUp() {
        bus = new InMemoryInsightBus(InMemoryInsightBus.DEFAULT_HISTORY_LIMIT,
                Clock.fixed(NOW, ZoneOffset.UTC));
    }

    private static Insight issues(final List<String> affects) {
        return Insight.codeIssues(new CodeIssues(List.of("Magic Numbers"),
                List.of()), 0.7, affects);
    }

    @Test
    void whenSharing_givenAddressedInsight_shouldDeliverToEachAffectedTool() {
        final List<InsightMessage> scanner = new ArrayList<>();
        final List<InsightMessage> reviewer = new ArrayList<>();
        bus.register("semantic-analyzer");
        bus.register("security-scanner", scanner::add);
        bus.register("smart-reviewer", reviewer::add);

        bus.shareInsight("semantic-analyzer",
                issues(List.of("security-scanner", "smart-reviewer")));

        assertEquals(1, scanner.size());
        assertEquals(1, reviewer.size());

        final InsightMessage message = scanner.get(0);
        assertEquals("semantic-analyzer", message.from());
        assertEquals("security-scanner", message.to());
        assertEquals("Insight: code-issues", message.subject());
        assertEquals(NOW, message.timestamp());

        assertEquals(new MessageStats(2, 0, 0, 0),
                bus.stats("semantic-analyzer"));
        assertEquals(new MessageStats(0, 1, 1, 0),
                bus.stats("security-scanner"));
    }

    @Test
    void whenSharing_givenBroadcast_shouldSkipTheSender() {
        final List<InsightMessage> sender = new ArrayList<>();
        final List<InsightMessage> other = new ArrayList<>();
        bus.register("semantic-analyzer", sender::add);
        bus.register("smart-reviewer", other::add);

        bus.shareInsight("semantic-analyzer", issues(List.of()));

        assertTrue(sender.isEmpty());
        assertEquals(1, other.size());
        assertEquals(1, bus.history().size());
    }

    @Test
    void whenSharing_givenUnregisteredRecipient_shouldOnlyRecordIt() {
        bus.shareInsight("semantic-analyzer", issues(List.of("nobody")));

        assertEquals(1, bus.historyFor("nobody").size());
        assertEquals(MessageStats.NONE, bus.stats("nobody"));
    }

    @Test
    void whenSharing_givenFailingHandler_shouldDeliverToOthersAndThrow() {
        final List<InsightMessage> reviewer = new ArrayList<>();
        bus.register("security-scanner", message -> {
            throw new IllegalStateException("scanner crashed");
        });
        bus.register("smart-reviewer", reviewer::add);

        final CollaboratorException exception = assertThrows(
                CollaboratorException.class,
                () -> bus.shareInsight("semantic-analyzer",
                        issues(List.of("security-scanner", "smart-reviewer"))));

        assertTrue(exception.getMessage().contains("security-scanner"));
        assertEquals(CollaboratorException.CODE, exception.getErrorCode());
        assertEquals(1, reviewer.size());
        assertEquals(new MessageStats(0, 1, 0, 1),
                bus.stats("security-scanner"));
    }

    @Test
    void whenSharing_givenMoreMessagesThanLimit_shouldKeepTheNewest() {
        final InMemoryInsightBus small = new InMemoryInsightBus(2,
                Clock.fixed(NOW, ZoneOffset.UTC));

        small.shareInsight("a", issues(List.of("first")));
        small.shareInsight("a", issues(List.of("second")));
        small.shareInsight("a", issues(List.of("third")));

        assertEquals(List.of("second", "third"), small.history().stream()
                .map(InsightMessage::to).toList());
    }

    @Test
    void whenCreating_givenZeroHistoryLimit_shouldFail() {
        assertThrows(IllegalArgumentException.class,
                () -> new InMemoryInsightBus(0, Clock.systemUTC()));
    }

}
