package co.fanki.semanticanalyzer.collaboration.domain;

import co.fanki.semanticanalyzer.intent.domain.SideEffect;
import co.fanki.semanticanalyzer.shared.ValueObject;

import java.util.List;

/**
 * The payload of a {@code code-issues} insight.
 *
 * @param antiPatterns the anti-patterns found in the code unit
 * @param riskyEffects the high risk side effects of the code unit
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public record CodeIssues(
        List<String> antiPatterns,
        List<SideEffect> riskyEffects
) implements ValueObject {

    /** Creates the payload with immutable copies of both lists. */
    public CodeIssues {
        antiPatterns = antiPatterns == null ? List.of()
                : List.copyOf(antiPatterns);
        riskyEffects = riskyEffects == null ? List.of()
                : List.copyOf(riskyEffects);
    }

    /**
     * Checks whether there is anything to report.
     *
     * @return true if there are no anti-patterns and no risky effects
     */
    public boolean isEmpty() {
        return antiPatterns.isEmpty() && riskyEffects.isEmpty();
    }

}
