package co.fanki.semanticanalyzer.config;

import co.fanki.semanticanalyzer.collaboration.domain.InMemoryInsightBus;
import co.fanki.semanticanalyzer.collaboration.domain.InMemoryPerformanceTracker;
import co.fanki.semanticanalyzer.collaboration.domain.InsightBus;
import co.fanki.semanticanalyzer.collaboration.domain.PerformanceTracker;
import co.fanki.semanticanalyzer.intent.application.IntentAnalyzer;
import co.fanki.semanticanalyzer.intent.domain.SuggestionSynthesizer;
import co.fanki.semanticanalyzer.intent.domain.extract.IntentExtractors;
import co.fanki.semanticanalyzer.intent.domain.registry.AnalysisThresholds;
import co.fanki.semanticanalyzer.intent.domain.registry.AnalyzerRegistries;
import co.fanki.semanticanalyzer.parsing.domain.CodeParser;
import co.fanki.semanticanalyzer.parsing.domain.treesitter.TreeSitterCodeParser;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Wires the intent analyzer.
 *
 * <p>Limits come from the {@code analyzer.*} properties and default to
 * the built-in values. The in-memory telemetry tracker and insight bus
 * are only created when the host does not provide its own.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
@Configuration
public class AnalyzerConfiguration {

    private static final Logger LOG = LoggerFactory.getLogger(
            AnalyzerConfiguration.class);

    /**
     * Creates the registries from the built-in tables and the configured
     * limits.
     *
     * @param maxActions how many actions are kept
     * @param godObjectMethods methods a class may have
     * @param callbackNesting nested calls allowed
     * @param magicNumbers uncommon numeric literals allowed
     * @param duplicationWindow lines compared for duplication
     * @param parameterList parameters a function may take
     * @param blockNesting block nesting allowed
     * @param unusedVariables unreferenced variables tolerated
     * @param cyclomatic cyclomatic complexity limit
     * @param cognitive cognitive complexity limit
     * @param coupling coupling limit
     * @param parallelAwaits awaits before suggesting parallel execution
     * @return the registries
     */
    @Bean
    public AnalyzerRegistries analyzerRegistries(
            @Value("${analyzer.thresholds.max-actions:10}") final int maxActions,
            @Value("${analyzer.thresholds.god-object-methods:20}") final int godObjectMethods,
            @Value("${analyzer.thresholds.callback-nesting:5}") final int callbackNesting,
            @Value("${analyzer.thresholds.magic-numbers:5}") final int magicNumbers,
            @Value("${analyzer.thresholds.duplication-window:5}") final int duplicationWindow,
            @Value("${analyzer.thresholds.parameter-list:4}") final int parameterList,
            @Value("${analyzer.thresholds.block-nesting:4}") final int blockNesting,
            @Value("${analyzer.thresholds.unused-variables:2}") final int unusedVariables,
            @Value("${analyzer.thresholds.cyclomatic:10}") final int cyclomatic,
            @Value("${analyzer.thresholds.cognitive:15}") final int cognitive,
            @Value("${analyzer.thresholds.coupling:20}") final int coupling,
            @Value("${analyzer.thresholds.parallel-awaits:3}") final int parallelAwaits) {

        final AnalysisThresholds thresholds = new AnalysisThresholds(
                maxActions, godObjectMethods, callbackNesting, magicNumbers,
                duplicationWindow, parameterList, blockNesting,
                unusedVariables, cyclomatic, cognitive, coupling,
                parallelAwaits);

        return AnalyzerRegistries.defaults().withThresholds(thresholds);
    }

    /**
     * Creates the tree-sitter parser.
     *
     * @param maxErrorRatio share of the input syntax errors may cover
     * @return the parser
     */
    @Bean
    @ConditionalOnMissingBean(CodeParser.class)
    public CodeParser codeParser(
            @Value("${analyzer.parser.max-error-ratio:0.5}") final double maxErrorRatio) {
        return new TreeSitterCodeParser(maxErrorRatio);
    }

    /**
     * Creates the extractors over the registries.
     *
     * @param registries the lookup tables and limits
     * @return the extractors
     */
    @Bean
    public IntentExtractors intentExtractors(
            final AnalyzerRegistries registries) {
        return IntentExtractors.from(registries);
    }

    /**
     * Creates the suggestion synthesizer.
     *
     * @param registries the lookup tables and limits
     * @return the synthesizer
     */
    @Bean
    public SuggestionSynthesizer suggestionSynthesizer(
            final AnalyzerRegistries registries) {
        return new SuggestionSynthesizer(registries.thresholds());
    }

    /**
     * Creates the in-memory telemetry tracker.
     *
     * @param capacity how many metrics to keep
     * @return the tracker
     */
    @Bean
    @ConditionalOnMissingBean(PerformanceTracker.class)
    public InMemoryPerformanceTracker performanceTracker(
            @Value("${analyzer.telemetry.capacity:1000}") final int capacity) {
        return new InMemoryPerformanceTracker(capacity);
    }

    /**
     * Creates the in-memory insight bus.
     *
     * @param historyLimit how many messages to keep
     * @return the bus
     */
    @Bean
    @ConditionalOnMissingBean(InsightBus.class)
    public InMemoryInsightBus insightBus(
            @Value("${analyzer.insights.history-limit:1000}") final int historyLimit) {
        return new InMemoryInsightBus(historyLimit, Clock.systemUTC());
    }

    /**
     * Creates the executor telemetry and insights are sent on.
     *
     * <p>Uses daemon threads and a bounded queue. When the queue is full
     * the emission is rejected and dropped by the analyzer.</p>
     *
     * @param threads how many emission threads to run
     * @param queueCapacity how many emissions may wait
     * @return the executor, shut down with the context
     */
    @Bean(destroyMethod = "shutdown")
    public ExecutorService analyzerEmissionExecutor(
            @Value("${analyzer.emission.threads:1}") final int threads,
            @Value("${analyzer.emission.queue-capacity:1000}") final int queueCapacity) {

        final AtomicInteger counter = new AtomicInteger();
        return new ThreadPoolExecutor(threads, threads, 0L,
                TimeUnit.MILLISECONDS, new LinkedBlockingQueue<>(queueCapacity),
                runnable -> {
                    final Thread thread = new Thread(runnable,
                            "analyzer-emission-" + counter.incrementAndGet());
                    thread.setDaemon(true);
                    return thread;
                });
    }

    /**
     * Creates the intent analyzer.
     *
     * @param parser the parser
     * @param extractors the extractors
     * @param synthesizer the suggestion synthesizer
     * @param tracker the telemetry tracker
     * @param insightBus the insight bus
     * @param emissionExecutor the emission executor
     * @param objectMapper the JSON object mapper
     * @return the analyzer
     */
    @Bean
    public IntentAnalyzer intentAnalyzer(
            final CodeParser parser,
            final IntentExtractors extractors,
            final SuggestionSynthesizer synthesizer,
            final PerformanceTracker tracker,
            final InsightBus insightBus,
            @Qualifier("analyzerEmissionExecutor") final ExecutorService emissionExecutor,
            final ObjectMapper objectMapper) {

        LOG.info("Creating intent analyzer with {} and {}",
                tracker.getClass().getSimpleName(),
                insightBus.getClass().getSimpleName());

        return new IntentAnalyzer(parser, extractors, synthesizer, tracker,
                insightBus, emissionExecutor, objectMapper);
    }

}
