package co.fanki.semanticanalyzer.collaboration.domain;

import co.fanki.semanticanalyzer.shared.Preconditions;
import co.fanki.semanticanalyzer.shared.ValueObject;

import java.util.List;

/**
 * A finding one tool shares with the tools interested in it.
 *
 * @param type the insight kind, e.g. {@code code-issues}
 * @param data the finding
 * @param confidence how sure the sender is, between 0 and 1
 * @param affects the tools the insight is addressed to, empty for all
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public record Insight(
        String type,
        CodeIssues data,
        double confidence,
        List<String> affects
) implements ValueObject {

    /** Insight kind for anti-patterns and risky effects. */
    public static final String CODE_ISSUES = "code-issues";

    /**
     * Creates an insight, validating its fields.
     */
    public Insight {
        Preconditions.requireNonBlank(type, "Insight type is required");
        Preconditions.requireNonNull(data, "Insight data is required");
        Preconditions.require(confidence >= 0 && confidence <= 1,
                "Insight confidence must be between 0 and 1");
        affects = affects == null ? List.of() : List.copyOf(affects);
    }

    /**
     * Creates a {@code code-issues} insight.
     *
     * @param issues the issues found
     * @param confidence the sender confidence
     * @param affects the tools to notify
     * @return the insight
     */
    public static Insight codeIssues(final CodeIssues issues,
            final double confidence, final List<String> affects) {
        return new Insight(CODE_ISSUES, issues, confidence, affects);
    }

    /**
     * Checks whether the insight is addressed to every registered tool.
     *
     * @return true if no tool is named
     */
    public boolean isBroadcast() {
        return affects.isEmpty();
    }

}
