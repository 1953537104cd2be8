package co.fanki.semanticanalyzer.intent.domain.extract;

import co.fanki.semanticanalyzer.intent.domain.ComplexityAnalysis;
import co.fanki.semanticanalyzer.intent.domain.Dependency;
import co.fanki.semanticanalyzer.intent.domain.IntentExtractor;
import co.fanki.semanticanalyzer.intent.domain.registry.AnalyzerRegistries;
import co.fanki.semanticanalyzer.shared.Preconditions;

import java.util.List;

/**
 * The set of extractors an analysis runs, one per facet.
 *
 * @param purpose computes the purpose label
 * @param actions collects the call sites
 * @param dataFlow computes inputs and outputs
 * @param sideEffects detects effects outside the code unit
 * @param dependencies collects imported modules
 * @param complexity computes the complexity metrics
 * @param patterns recognizes design patterns
 * @param antiPatterns recognizes anti-patterns
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public record IntentExtractors(
        IntentExtractor<String> purpose,
        IntentExtractor<List<String>> actions,
        IntentExtractor<DataFlowAnalysis> dataFlow,
        IntentExtractor<SideEffectReport> sideEffects,
        IntentExtractor<List<Dependency>> dependencies,
        IntentExtractor<ComplexityAnalysis> complexity,
        IntentExtractor<List<String>> patterns,
        IntentExtractor<List<String>> antiPatterns
) {

    /**
     * Creates the set, validating that no extractor is missing.
     */
    public IntentExtractors {
        Preconditions.requireNonNull(purpose, "Purpose extractor is required");
        Preconditions.requireNonNull(actions, "Action extractor is required");
        Preconditions.requireNonNull(dataFlow,
                "Data flow extractor is required");
        Preconditions.requireNonNull(sideEffects,
                "Side effect extractor is required");
        Preconditions.requireNonNull(dependencies,
                "Dependency extractor is required");
        Preconditions.requireNonNull(complexity,
                "Complexity extractor is required");
        Preconditions.requireNonNull(patterns,
                "Pattern extractor is required");
        Preconditions.requireNonNull(antiPatterns,
                "Anti-pattern extractor is required");
    }

    /**
     * Builds the built-in extractors over the given registries.
     *
     * @param registries the lookup tables and limits
     * @return the extractors
     */
    public static IntentExtractors from(final AnalyzerRegistries registries) {
        Preconditions.requireNonNull(registries, "Registries are required");
        return new IntentExtractors(
                new PurposeDetector(registries.keywords()),
                new ActionExtractor(registries.thresholds().maxActions()),
                new DataFlowAnalyzer(registries.keywords()),
                new SideEffectDetector(registries.keywords()),
                new DependencyExtractor(registries.keywords()),
                new ComplexityAnalyzer(registries.keywords()),
                new PatternDetector(registries.patterns()),
                new AntiPatternDetector(registries.keywords(),
                        registries.thresholds()));
    }

}
