package co.fanki.semanticanalyzer.intent.domain;

import co.fanki.semanticanalyzer.shared.Diagnostic;
import co.fanki.semanticanalyzer.shared.Preconditions;
import co.fanki.semanticanalyzer.shared.ValueObject;

import java.util.List;

/**
 * What a code unit is for and how it behaves, as derived from its syntax
 * tree.
 *
 * <p>Created fresh for every analysis. Holds no reference to the tree or
 * to the analyzer and serializes to JSON as-is.</p>
 *
 * @param purpose the detected purposes joined with {@code " + "}
 * @param category the broad area the code belongs to
 * @param actions the call sites, first ten distinct
 * @param inputs the parameters of named functions
 * @param outputs the returned values
 * @param sideEffects the effects outside the code unit
 * @param dependencies the imported modules, distinct by specifier
 * @param complexity the complexity metrics
 * @param patterns the design patterns recognized
 * @param antiPatterns the anti-patterns recognized
 * @param suggestions the improvement suggestions, distinct
 * @param confidence how much the analysis can be trusted, 0 to 0.95
 * @param diagnostics the non-fatal findings of the analysis
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public record CodeIntent(
        String purpose,
        IntentCategory category,
        List<String> actions,
        List<DataFlow> inputs,
        List<DataFlow> outputs,
        List<SideEffect> sideEffects,
        List<Dependency> dependencies,
        ComplexityAnalysis complexity,
        List<String> patterns,
        List<String> antiPatterns,
        List<String> suggestions,
        double confidence,
        List<Diagnostic> diagnostics
) implements ValueObject {

    /** Highest confidence an analysis can report. */
    public static final double MAX_CONFIDENCE = 0.95;

    /**
     * Creates an intent, validating the required fields.
     */
    public CodeIntent {
        Preconditions.requireNonBlank(purpose, "Purpose is required");
        Preconditions.requireNonNull(category, "Category is required");
        Preconditions.requireNonNull(complexity, "Complexity is required");
        Preconditions.require(confidence >= 0 && confidence <= MAX_CONFIDENCE,
                "Confidence must be between 0 and " + MAX_CONFIDENCE);
        actions = copy(actions);
        inputs = copy(inputs);
        outputs = copy(outputs);
        sideEffects = copy(sideEffects);
        dependencies = copy(dependencies);
        patterns = copy(patterns);
        antiPatterns = copy(antiPatterns);
        suggestions = copy(suggestions);
        diagnostics = copy(diagnostics);
    }

    /**
     * Returns the high risk side effects.
     *
     * @return the effects whose risk is high, in detection order
     */
    public List<SideEffect> highRiskEffects() {
        return sideEffects.stream().filter(SideEffect::isHighRisk).toList();
    }

    /**
     * Checks whether downstream reviewers should hear about this code.
     *
     * @return true if there are anti-patterns or high risk effects
     */
    public boolean hasIssues() {
        return !antiPatterns.isEmpty() || !highRiskEffects().isEmpty();
    }

    private static <T> List<T> copy(final List<T> values) {
        return values == null ? List.of() : List.copyOf(values);
    }

}
