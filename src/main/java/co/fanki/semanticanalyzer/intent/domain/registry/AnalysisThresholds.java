package co.fanki.semanticanalyzer.intent.domain.registry;

import co.fanki.semanticanalyzer.shared.Preconditions;

/**
 * Numeric limits of the analysis. Every limit is exclusive: a finding is
 * reported when a measure is strictly greater than its limit.
 *
 * @param maxActions how many actions are kept
 * @param godObjectMethods methods a class may have
 * @param callbackNesting nested calls allowed
 * @param magicNumbers uncommon numeric literals allowed
 * @param duplicationWindow lines in the window compared for duplication
 * @param parameterList parameters a function may take
 * @param blockNesting block nesting allowed
 * @param unusedVariables unreferenced variables tolerated
 * @param cyclomatic cyclomatic complexity before suggesting a split
 * @param cognitive cognitive complexity before suggesting a rewrite
 * @param coupling coupling before suggesting fewer dependencies
 * @param parallelAwaits awaits before suggesting {@code Promise.all}
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public record AnalysisThresholds(
        int maxActions,
        int godObjectMethods,
        int callbackNesting,
        int magicNumbers,
        int duplicationWindow,
        int parameterList,
        int blockNesting,
        int unusedVariables,
        int cyclomatic,
        int cognitive,
        int coupling,
        int parallelAwaits
) {

    private static final AnalysisThresholds DEFAULTS =
            new AnalysisThresholds(10, 20, 5, 5, 5, 4, 4, 2, 10, 15, 20, 3);

    /**
     * Creates the thresholds, rejecting negative values.
     */
    public AnalysisThresholds {
        Preconditions.require(maxActions > 0, "Max actions must be positive");
        Preconditions.require(duplicationWindow > 0,
                "Duplication window must be positive");
        Preconditions.requireNonNegative(godObjectMethods,
                "God object methods must not be negative");
        Preconditions.requireNonNegative(callbackNesting,
                "Callback nesting must not be negative");
        Preconditions.requireNonNegative(magicNumbers,
                "Magic numbers must not be negative");
        Preconditions.requireNonNegative(parameterList,
                "Parameter list must not be negative");
        Preconditions.requireNonNegative(blockNesting,
                "Block nesting must not be negative");
        Preconditions.requireNonNegative(unusedVariables,
                "Unused variables must not be negative");
        Preconditions.requireNonNegative(cyclomatic,
                "Cyclomatic threshold must not be negative");
        Preconditions.requireNonNegative(cognitive,
                "Cognitive threshold must not be negative");
        Preconditions.requireNonNegative(coupling,
                "Coupling threshold must not be negative");
        Preconditions.requireNonNegative(parallelAwaits,
                "Parallel awaits must not be negative");
    }

    /**
     * Returns the built-in thresholds.
     *
     * @return the default thresholds
     */
    public static AnalysisThresholds defaults() {
        return DEFAULTS;
    }

}
