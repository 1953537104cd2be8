package co.fanki.semanticanalyzer.intent.application;

import co.fanki.semanticanalyzer.collaboration.domain.CollaboratorException;
import co.fanki.semanticanalyzer.collaboration.domain.Insight;
import co.fanki.semanticanalyzer.collaboration.domain.InsightBus;
import co.fanki.semanticanalyzer.collaboration.domain.PerformanceTracker;
import co.fanki.semanticanalyzer.collaboration.domain.ToolMetric;
import co.fanki.semanticanalyzer.intent.domain.AnalysisContext;
import co.fanki.semanticanalyzer.intent.domain.CodeIntent;
import co.fanki.semanticanalyzer.intent.domain.IntentExtractor;
import co.fanki.semanticanalyzer.intent.domain.SideEffectType;
import co.fanki.semanticanalyzer.intent.domain.SuggestionSynthesizer;
import co.fanki.semanticanalyzer.intent.domain.extract.IntentExtractors;
import co.fanki.semanticanalyzer.intent.domain.extract.PurposeDetector;
import co.fanki.semanticanalyzer.intent.domain.registry.AnalyzerRegistries;
import co.fanki.semanticanalyzer.parsing.domain.CodeParser;
import co.fanki.semanticanalyzer.parsing.domain.ParseError;
import co.fanki.semanticanalyzer.parsing.domain.ParsedSource;
import co.fanki.semanticanalyzer.parsing.domain.treesitter.TreeSitterCodeParser;
import co.fanki.semanticanalyzer.shared.Diagnostic;
import co.fanki.semanticanalyzer.shared.Severity;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.easymock.Capture;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

import static org.easymock.EasyMock.capture;
import static org.easymock.EasyMock.createMock;
import static org.easymock.EasyMock.eq;
import static org.easymock.EasyMock.expectLastCall;
import static org.easymock.EasyMock.newCapture;
import static org.easymock.EasyMock.replay;
import static org.easymock.EasyMock.verify;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Unit tests for {@link IntentAnalyzer}.
 *
 * <p>Collaborators are mocked and emissions run on the calling thread,
 * so every telemetry record and insight is visible when
 * {@code analyzeIntent} returns.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
class IntentAnalyzerTest {

    private static final Executor SAME_THREAD = Runnable::run;

    private final ObjectMapper objectMapper = new ObjectMapper();

    private PerformanceTracker tracker;
    private InsightBus insightBus;

    @BeforeEach
    void setUp() {
        tracker = createMock(PerformanceTracker.class);
        insightBus = createMock(InsightBus.class);
    }

    private IntentAnalyzer analyzer(final CodeParser parser,
            final IntentExtractors extractors, final Executor executor) {
        return new IntentAnalyzer(parser, extractors,
                new SuggestionSynthesizer(
                        AnalyzerRegistries.defaults().thresholds()),
                tracker, insightBus, executor, objectMapper);
    }

    private IntentAnalyzer analyzer() {
        return analyzer(new TreeSitterCodeParser(),
                IntentExtractors.from(AnalyzerRegistries.defaults()),
                SAME_THREAD);
    }

    @Test
    void whenAnalyzing_givenCleanFunction_shouldTrackSuccessWithoutInsight() {
        final Capture<ToolMetric> metric = newCapture();
        tracker.track(capture(metric));
        expectLastCall();
        replay(tracker, insightBus);

        final CodeIntent intent = analyzer().analyzeIntent(
                "function add(a, b) { return a + b; }",
                AnalysisContext.ofFileName("math.js"));

        verify(tracker, insightBus);
        assertFalse(intent.hasIssues());

        final ToolMetric tracked = metric.getValue();
        assertTrue(tracked.success());
        assertEquals(IntentAnalyzer.TOOL_ID, tracked.toolId());
        assertEquals(IntentAnalyzer.OPERATION, tracked.operation());
        assertEquals("code", tracked.input().type());
        assertEquals(36, tracked.input().size());
        assertEquals("intent", tracked.output().type());
        assertTrue(tracked.output().size() > 0);
        assertEquals(intent.confidence(), tracked.confidence());
    }

    @Test
    void whenAnalyzing_givenHighRiskEffect_shouldShareCodeIssues() {
        final Capture<Insight> insight = newCapture();
        tracker.track(capture(newCapture()));
        expectLastCall();
        insightBus.shareInsight(eq(IntentAnalyzer.TOOL_ID), capture(insight));
        expectLastCall();
        replay(tracker, insightBus);

        final CodeIntent intent = analyzer().analyzeIntent(
                "fetch('https://api.example.com/orders');", null);

        verify(tracker, insightBus);
        assertEquals(Insight.CODE_ISSUES, insight.getValue().type());
        assertEquals(IntentAnalyzer.INSIGHT_AUDIENCE,
                insight.getValue().affects());
        assertEquals(intent.highRiskEffects(),
                insight.getValue().data().riskyEffects());
        assertEquals(SideEffectType.NETWORK, insight.getValue().data()
                .riskyEffects().get(0).type());
    }

    @Test
    void whenAnalyzing_givenFailingTracker_shouldStillReturnIntent() {
        tracker.track(capture(newCapture()));
        expectLastCall().andThrow(new CollaboratorException("tracker down"));
        replay(tracker, insightBus);

        final CodeIntent intent = analyzer().analyzeIntent("const a = 1;",
                AnalysisContext.empty());

        verify(tracker, insightBus);
        assertNotNull(intent);
    }

    @Test
    void whenAnalyzing_givenRejectingExecutor_shouldStillReturnIntent() {
        replay(tracker, insightBus);

        final IntentAnalyzer rejecting = analyzer(new TreeSitterCodeParser(),
                IntentExtractors.from(AnalyzerRegistries.defaults()),
                command -> {
                    throw new RejectedExecutionException("queue full");
                });

        final CodeIntent intent = rejecting.analyzeIntent(
                "window.cache = {};", AnalysisContext.empty());

        verify(tracker, insightBus);
        assertTrue(intent.hasIssues());
    }

    @Test
    void whenAnalyzing_givenFailingExtractor_shouldUseFallbackAndReportIt() {
        tracker.track(capture(newCapture()));
        expectLastCall();
        replay(tracker, insightBus);

        final IntentExtractors defaults = IntentExtractors.from(
                AnalyzerRegistries.defaults());
        final IntentExtractor<String> broken = new IntentExtractor<>() {
            @Override
            public String facet() {
                return "purpose";
            }

            @Override
            public String extract(final ParsedSource source,
                    final AnalysisContext context) {
                throw new IllegalStateException("no purpose today");
            }

            @Override
            public String fallback() {
                return PurposeDetector.UNKNOWN;
            }
        };
        final IntentExtractors extractors = new IntentExtractors(broken,
                defaults.actions(), defaults.dataFlow(),
                defaults.sideEffects(), defaults.dependencies(),
                defaults.complexity(), defaults.patterns(),
                defaults.antiPatterns());

        final CodeIntent intent = analyzer(new TreeSitterCodeParser(),
                extractors, SAME_THREAD).analyzeIntent(
                        "function saveUser(user) { return db.save(user); }",
                        AnalysisContext.empty());

        verify(tracker, insightBus);
        assertEquals(PurposeDetector.UNKNOWN, intent.purpose());
        assertEquals(List.of("db.save"), intent.actions());

        final Diagnostic diagnostic = intent.diagnostics().stream()
                .filter(d -> d.severity() == Severity.ERROR)
                .findFirst().orElseThrow();
        assertEquals("purpose", diagnostic.facet());
        assertTrue(diagnostic.message().contains("no purpose today"));
    }

    @Test
    void whenAnalyzing_givenUnparseableCode_shouldTrackFailureAndRethrow() {
        final Capture<ToolMetric> metric = newCapture();
        tracker.track(capture(metric));
        expectLastCall();
        replay(tracker, insightBus);

        final IntentAnalyzer strict = analyzer(new TreeSitterCodeParser(0),
                IntentExtractors.from(AnalyzerRegistries.defaults()),
                SAME_THREAD);

        assertThrows(ParseError.class, () -> strict.analyzeIntent("}}}}",
                AnalysisContext.empty()));

        verify(tracker, insightBus);
        assertFalse(metric.getValue().success());
        assertNotNull(metric.getValue().error());
        assertEquals(0.0, metric.getValue().confidence());
    }

    @Test
    void whenAnalyzing_givenNullCode_shouldRejectIt() {
        replay(tracker, insightBus);

        assertThrows(IllegalArgumentException.class,
                () -> analyzer().analyzeIntent(null, AnalysisContext.empty()));

        verify(tracker, insightBus);
    }

    @Test
    void whenAnalyzing_givenUnvalidatedPassword_shouldAskForValidation() {
        tracker.track(capture(newCapture()));
        expectLastCall();
        replay(tracker, insightBus);

        final CodeIntent intent = analyzer().analyzeIntent(
                "function f(password) { return password; }",
                AnalysisContext.empty());

        verify(tracker, insightBus);
        assertTrue(intent.suggestions().contains(
                "Add validation for sensitive data inputs"));
        assertTrue(intent.confidence() >= 0
                && intent.confidence() <= CodeIntent.MAX_CONFIDENCE);
        assertEquals(intent.suggestions().stream().distinct().count(),
                intent.suggestions().size());
    }

    @Test
    void whenAnalyzing_givenDeeplyBranchedCode_shouldSuggestBreakingItDown() {
        tracker.track(capture(newCapture()));
        expectLastCall();
        insightBus.shareInsight(eq(IntentAnalyzer.TOOL_ID),
                capture(newCapture()));
        expectLastCall();
        replay(tracker, insightBus);

        final CodeIntent intent = analyzer().analyzeIntent("""
                function route(a, b, c, d, e) {
                  if (a && b && e) {
                    if (c || d) {
                      if (e) {
                        if (a > b) {
                          for (let i = 0; i < a; i++) {
                            while (c) { c = d ? e : (b ? a : e); }
                          }
                        }
                      }
                    }
                  }
                }
                """, AnalysisContext.empty());

        verify(tracker, insightBus);
        assertTrue(intent.complexity().depth() >= 5);
        assertTrue(intent.complexity().cyclomatic() > 10);
        assertTrue(intent.suggestions().contains(
                "Consider breaking down complex functions"));
        assertTrue(intent.antiPatterns().contains(
                "Deep Nesting - simplify logic"));
    }

    @Test
    void whenSerializing_givenAnalyzedIntent_shouldReadBackEqual()
            throws Exception {
        tracker.track(capture(newCapture()));
        expectLastCall();
        insightBus.shareInsight(eq(IntentAnalyzer.TOOL_ID),
                capture(newCapture()));
        expectLastCall();
        replay(tracker, insightBus);

        final CodeIntent intent = analyzer().analyzeIntent("""
                import axios from 'axios';
                // Loads the orders of a customer
                export async function loadOrders(customerId: string) {
                  const response = await axios.get('/orders/' + customerId);
                  return response.data;
                }
                """, AnalysisContext.ofFileName("orders.service.ts"));

        final String json = objectMapper.writeValueAsString(intent);

        assertEquals(intent, objectMapper.readValue(json, CodeIntent.class));
        assertTrue(json.contains("\"category\""));
    }

    @Test
    void whenAnalyzing_givenRequireOfVariable_shouldKeepSideEffects() {
        tracker.track(capture(newCapture()));
        expectLastCall();
        insightBus.shareInsight(eq(IntentAnalyzer.TOOL_ID),
                capture(newCapture()));
        expectLastCall();
        replay(tracker, insightBus);

        final CodeIntent intent = analyzer().analyzeIntent(
                "const plugin = require(name);\n"
                + "fetch('http://x');\n"
                + "fs.writeFileSync('a', 'b');\n",
                AnalysisContext.ofFileName("loader.js"));

        verify(tracker, insightBus);
        assertTrue(intent.sideEffects().stream()
                .anyMatch(e -> e.type() == SideEffectType.NETWORK));
        assertTrue(intent.sideEffects().stream()
                .anyMatch(e -> e.type() == SideEffectType.FILE));
        assertTrue(intent.diagnostics().stream()
                .noneMatch(d -> d.severity() == Severity.ERROR));
    }

    @Test
    void whenAnalyzing_givenSameCodeTwice_shouldProduceEqualIntents() {
        tracker.track(capture(newCapture()));
        expectLastCall().times(2);
        insightBus.shareInsight(eq(IntentAnalyzer.TOOL_ID),
                capture(newCapture()));
        expectLastCall().times(2);
        replay(tracker, insightBus);

        final String code = """
                import axios from 'axios';
                export async function loadOrders(customerId) {
                  if (!customerId) { throw new Error('missing'); }
                  const response = await axios.get('/orders/' + customerId);
                  for (const order of response.data) { console.log(order); }
                  return response.data;
                }
                """;
        final AnalysisContext context =
                AnalysisContext.ofFileName("orders.service.js");
        final IntentAnalyzer analyzer = analyzer();

        final CodeIntent first = analyzer.analyzeIntent(code, context);
        final CodeIntent second = analyzer.analyzeIntent(code, context);

        verify(tracker, insightBus);
        assertEquals(first.purpose(), second.purpose());
        assertEquals(first.patterns(), second.patterns());
        assertEquals(first.antiPatterns(), second.antiPatterns());
        assertEquals(first.complexity(), second.complexity());
        assertEquals(first, second);
    }

}
