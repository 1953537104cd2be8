package co.fanki.semanticanalyzer.intent.domain;

import co.fanki.semanticanalyzer.intent.domain.extract.PatternDetector;
import co.fanki.semanticanalyzer.intent.domain.extract.SideEffectReport;
import co.fanki.semanticanalyzer.intent.domain.registry.AnalysisThresholds;
import co.fanki.semanticanalyzer.shared.Preconditions;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Turns the extracted facets into improvement suggestions.
 *
 * <p>Rules are evaluated in a fixed order and every matching rule
 * contributes its suggestion once.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public class SuggestionSynthesizer {

    private final AnalysisThresholds thresholds;

    /**
     * Creates a synthesizer.
     *
     * @param theThresholds the limits the rules compare against
     */
    public SuggestionSynthesizer(final AnalysisThresholds theThresholds) {
        this.thresholds = Preconditions.requireNonNull(theThresholds,
                "Thresholds are required");
    }

    /**
     * Derives the suggestions.
     *
     * @param purpose the detected purpose
     * @param patterns the recognized patterns
     * @param complexity the complexity metrics
     * @param sideEffects the side effects and await count
     * @param inputs the input data flows
     * @return the suggestions, distinct and in rule order
     */
    public List<String> synthesize(final String purpose,
            final List<String> patterns, final ComplexityAnalysis complexity,
            final SideEffectReport sideEffects, final List<DataFlow> inputs) {

        final Set<String> suggestions = new LinkedHashSet<>();

        if (complexity.cyclomatic() > thresholds.cyclomatic()) {
            suggestions.add("Consider breaking down complex functions");
        }
        if (complexity.cognitive() > thresholds.cognitive()) {
            suggestions.add("Simplify logic to improve readability");
        }
        if (complexity.coupling() > thresholds.coupling()) {
            suggestions.add("Reduce external dependencies");
        }
        if (purpose.contains("Database")
                && !patterns.contains(PatternDetector.REPOSITORY)) {
            suggestions.add(
                    "Consider using Repository pattern for data access");
        }
        if (sideEffects.awaitCount() > thresholds.parallelAwaits()) {
            suggestions.add(
                    "Consider using Promise.all for parallel async operations");
        }
        if (sideEffects.effects().stream().anyMatch(SideEffect::isHighRisk)) {
            suggestions.add("Add error handling for critical operations");
        }
        if (inputs.stream().anyMatch(DataFlow::lacksRequiredValidation)) {
            suggestions.add("Add validation for sensitive data inputs");
        }
        return List.copyOf(suggestions);
    }

}
