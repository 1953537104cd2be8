package co.fanki.semanticanalyzer.intent.application;

import co.fanki.semanticanalyzer.collaboration.domain.CodeIssues;
import co.fanki.semanticanalyzer.collaboration.domain.Insight;
import co.fanki.semanticanalyzer.collaboration.domain.InsightBus;
import co.fanki.semanticanalyzer.collaboration.domain.IoDescriptor;
import co.fanki.semanticanalyzer.collaboration.domain.PerformanceTracker;
import co.fanki.semanticanalyzer.collaboration.domain.ToolMetric;
import co.fanki.semanticanalyzer.intent.domain.AnalysisContext;
import co.fanki.semanticanalyzer.intent.domain.CategoryClassifier;
import co.fanki.semanticanalyzer.intent.domain.CodeIntent;
import co.fanki.semanticanalyzer.intent.domain.ComplexityAnalysis;
import co.fanki.semanticanalyzer.intent.domain.ConfidenceScorer;
import co.fanki.semanticanalyzer.intent.domain.Dependency;
import co.fanki.semanticanalyzer.intent.domain.ExtractionResult;
import co.fanki.semanticanalyzer.intent.domain.IntentCategory;
import co.fanki.semanticanalyzer.intent.domain.IntentExtractor;
import co.fanki.semanticanalyzer.intent.domain.SuggestionSynthesizer;
import co.fanki.semanticanalyzer.intent.domain.extract.DataFlowAnalysis;
import co.fanki.semanticanalyzer.intent.domain.extract.IntentExtractors;
import co.fanki.semanticanalyzer.intent.domain.extract.SideEffectReport;
import co.fanki.semanticanalyzer.parsing.domain.CodeParser;
import co.fanki.semanticanalyzer.parsing.domain.ParsedSource;
import co.fanki.semanticanalyzer.shared.Diagnostic;
import co.fanki.semanticanalyzer.shared.Preconditions;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Executor;

/**
 * Turns a JavaScript or TypeScript code unit into a {@link CodeIntent}.
 *
 * <p>The code is parsed once and every extractor makes its own pass over
 * the tree. An extractor that fails only loses its own facet: the facet
 * takes the extractor fallback and the failure is reported as an error
 * diagnostic. Input that cannot be parsed at all fails the analysis with
 * a {@link co.fanki.semanticanalyzer.parsing.domain.ParseError}.</p>
 *
 * <p>Every analysis, successful or not, is reported to the
 * {@link PerformanceTracker}. Intents with anti-patterns or high risk
 * side effects are also shared on the {@link InsightBus}. Both are sent
 * on the emission executor and their failures are logged and dropped,
 * they never change what the caller gets.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public class IntentAnalyzer {

    private static final Logger LOG = LoggerFactory.getLogger(
            IntentAnalyzer.class);

    /** The id this analyzer reports telemetry and insights under. */
    public static final String TOOL_ID = "semantic-analyzer";

    /** The telemetry operation name of an analysis. */
    public static final String OPERATION = "analyze-intent";

    /** The tools a code-issues insight is addressed to. */
    public static final List<String> INSIGHT_AUDIENCE =
            List.of("security-scanner", "smart-reviewer");

    private final CodeParser parser;
    private final IntentExtractors extractors;
    private final SuggestionSynthesizer synthesizer;
    private final CategoryClassifier classifier = new CategoryClassifier();
    private final ConfidenceScorer scorer = new ConfidenceScorer();
    private final PerformanceTracker tracker;
    private final InsightBus insightBus;
    private final Executor emissionExecutor;
    private final ObjectMapper objectMapper;

    /**
     * Creates an analyzer.
     *
     * @param theParser the parser for the code units
     * @param theExtractors the extractors to run, one per facet
     * @param theSynthesizer derives suggestions from the facets
     * @param theTracker receives the telemetry of every analysis
     * @param theInsightBus receives the code-issues insights
     * @param theEmissionExecutor runs telemetry and insight emissions
     * @param theObjectMapper measures the serialized intent
     */
    public IntentAnalyzer(final CodeParser theParser,
            final IntentExtractors theExtractors,
            final SuggestionSynthesizer theSynthesizer,
            final PerformanceTracker theTracker,
            final InsightBus theInsightBus,
            final Executor theEmissionExecutor,
            final ObjectMapper theObjectMapper) {
        this.parser = Preconditions.requireNonNull(theParser,
                "Parser is required");
        this.extractors = Preconditions.requireNonNull(theExtractors,
                "Extractors are required");
        this.synthesizer = Preconditions.requireNonNull(theSynthesizer,
                "Suggestion synthesizer is required");
        this.tracker = Preconditions.requireNonNull(theTracker,
                "Performance tracker is required");
        this.insightBus = Preconditions.requireNonNull(theInsightBus,
                "Insight bus is required");
        this.emissionExecutor = Preconditions.requireNonNull(
                theEmissionExecutor, "Emission executor is required");
        this.objectMapper = Preconditions.requireNonNull(theObjectMapper,
                "Object mapper is required");
    }

    /**
     * Analyzes a code unit.
     *
     * @param code the source text, never null
     * @param context what the caller knows about the code, null for
     *        nothing
     * @return the intent of the code unit
     * @throws co.fanki.semanticanalyzer.parsing.domain.ParseError if the
     *         code cannot be parsed
     */
    public CodeIntent analyzeIntent(final String code,
            final AnalysisContext context) {
        Preconditions.requireNonNull(code, "Code is required");
        final AnalysisContext ctx = context == null
                ? AnalysisContext.empty() : context;

        final Instant startedAt = Instant.now();
        final long start = System.nanoTime();
        final IoDescriptor input = new IoDescriptor("code", code.length());

        AnalysisPhase phase = AnalysisPhase.IDLE;
        try {
            phase = AnalysisStateMachine.transition(phase,
                    AnalysisPhase.PARSING);
            final ParsedSource source = parser.parse(code, ctx.dialect());

            phase = AnalysisStateMachine.transition(phase,
                    AnalysisPhase.EXTRACTING);
            final List<Diagnostic> diagnostics = new ArrayList<>(
                    source.diagnostics());
            final String purpose = run(extractors.purpose(), source, ctx,
                    diagnostics);
            final List<String> actions = run(extractors.actions(), source,
                    ctx, diagnostics);
            final DataFlowAnalysis dataFlow = run(extractors.dataFlow(),
                    source, ctx, diagnostics);
            final SideEffectReport sideEffects = run(extractors.sideEffects(),
                    source, ctx, diagnostics);
            final List<Dependency> dependencies = run(
                    extractors.dependencies(), source, ctx, diagnostics);
            final ComplexityAnalysis complexity = run(
                    extractors.complexity(), source, ctx, diagnostics);
            final List<String> patterns = run(extractors.patterns(), source,
                    ctx, diagnostics);
            final List<String> antiPatterns = run(extractors.antiPatterns(),
                    source, ctx, diagnostics);

            phase = AnalysisStateMachine.transition(phase,
                    AnalysisPhase.SYNTHESIZING);
            final List<String> suggestions = synthesizer.synthesize(purpose,
                    patterns, complexity, sideEffects, dataFlow.inputs());
            final IntentCategory category = classifier.classify(purpose,
                    patterns);
            final double confidence = scorer.score(source, ctx, purpose,
                    patterns.size());

            final CodeIntent intent = new CodeIntent(purpose, category,
                    actions, dataFlow.inputs(), dataFlow.outputs(),
                    sideEffects.effects(), dependencies, complexity, patterns,
                    antiPatterns, suggestions, confidence, diagnostics);
            phase = AnalysisStateMachine.transition(phase,
                    AnalysisPhase.ASSEMBLED);

            final Duration duration = Duration.ofNanos(
                    System.nanoTime() - start);
            LOG.debug("Analyzed {} ({} chars) in {} ms: {}, confidence {}",
                    describe(ctx), code.length(), duration.toMillis(),
                    purpose, confidence);

            emitSuccess(intent, startedAt, duration, input);
            return intent;

        } catch (final RuntimeException e) {
            if (!phase.isTerminal()) {
                phase = AnalysisStateMachine.transition(phase,
                        AnalysisPhase.FAILED);
            }
            LOG.info("Analysis of {} failed: {}", describe(ctx),
                    e.getMessage());
            final ToolMetric failure = ToolMetric.failure(TOOL_ID, OPERATION,
                    startedAt, Duration.ofNanos(System.nanoTime() - start),
                    input, String.valueOf(e.getMessage()));
            emit("track the failed analysis", () -> tracker.track(failure));
            throw e;
        }
    }

    private <T> T run(final IntentExtractor<T> extractor,
            final ParsedSource source, final AnalysisContext context,
            final List<Diagnostic> diagnostics) {
        final ExtractionResult<T> result = extract(extractor, source,
                context);
        if (!result.isSuccess()) {
            diagnostics.add(result.diagnostic());
        }
        return result.value();
    }

    private static <T> ExtractionResult<T> extract(
            final IntentExtractor<T> extractor, final ParsedSource source,
            final AnalysisContext context) {
        try {
            final T value = extractor.extract(source, context);
            if (value == null) {
                return ExtractionResult.failure(extractor.fallback(),
                        Diagnostic.error(extractor.facet(),
                                "Extractor produced no value"));
            }
            return ExtractionResult.success(value);
        } catch (final RuntimeException | StackOverflowError e) {
            LOG.warn("The {} extractor failed, using its fallback: {}",
                    extractor.facet(), e.toString());
            return ExtractionResult.failure(extractor.fallback(),
                    Diagnostic.error(extractor.facet(),
                            "Extraction failed: " + e));
        }
    }

    private void emitSuccess(final CodeIntent intent, final Instant startedAt,
            final Duration duration, final IoDescriptor input) {
        emit("track the analysis", () -> {
            final IoDescriptor output = new IoDescriptor("intent",
                    serializedLength(intent));
            tracker.track(ToolMetric.success(TOOL_ID, OPERATION, startedAt,
                    duration, input, output, intent.confidence()));
        });
        if (intent.hasIssues()) {
            final Insight insight = Insight.codeIssues(
                    new CodeIssues(intent.antiPatterns(),
                            intent.highRiskEffects()),
                    intent.confidence(), INSIGHT_AUDIENCE);
            emit("share the code issues",
                    () -> insightBus.shareInsight(TOOL_ID, insight));
        }
    }

    private long serializedLength(final CodeIntent intent) {
        try {
            return objectMapper.writeValueAsString(intent).length();
        } catch (final JsonProcessingException e) {
            LOG.warn("Cannot serialize the intent to measure it: {}",
                    e.getMessage());
            return 0;
        }
    }

    /**
     * Runs an emission on the emission executor. Failures, including a
     * rejected submission, are logged and dropped.
     */
    private void emit(final String what, final Runnable emission) {
        try {
            emissionExecutor.execute(() -> {
                try {
                    emission.run();
                } catch (final RuntimeException e) {
                    LOG.warn("Could not {}: {}", what, e.getMessage());
                }
            });
        } catch (final RuntimeException e) {
            LOG.warn("Could not schedule to {}: {}", what, e.getMessage());
        }
    }

    private static String describe(final AnalysisContext context) {
        return context.fileName() == null ? "<anonymous>"
                : context.fileName();
    }

}
