package co.fanki.semanticanalyzer.intent.domain;

import co.fanki.semanticanalyzer.shared.Preconditions;
import co.fanki.semanticanalyzer.shared.ValueObject;

/**
 * Complexity metrics of a code unit.
 *
 * @param cognitive how hard the code is to follow, capped at 100
 * @param cyclomatic the number of independent paths, at least 1
 * @param depth the maximum block nesting
 * @param coupling calls on external receivers, capped at 100
 * @param cohesion the share of related functions, 0 to 100
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public record ComplexityAnalysis(
        int cognitive,
        int cyclomatic,
        int depth,
        int coupling,
        int cohesion
) implements ValueObject {

    /** Upper bound for the capped metrics. */
    public static final int CAP = 100;

    /**
     * Creates the metrics, validating their ranges.
     */
    public ComplexityAnalysis {
        Preconditions.require(cognitive >= 0 && cognitive <= CAP,
                "Cognitive complexity must be between 0 and " + CAP);
        Preconditions.require(cyclomatic >= 1,
                "Cyclomatic complexity must be at least 1");
        Preconditions.requireNonNegative(depth, "Depth must not be negative");
        Preconditions.require(coupling >= 0 && coupling <= CAP,
                "Coupling must be between 0 and " + CAP);
        Preconditions.require(cohesion >= 0 && cohesion <= 100,
                "Cohesion must be between 0 and 100");
    }

    /**
     * Returns the metrics of code without any branching or calls.
     *
     * @return the baseline metrics
     */
    public static ComplexityAnalysis baseline() {
        return new ComplexityAnalysis(0, 1, 0, 0, 100);
    }

}
