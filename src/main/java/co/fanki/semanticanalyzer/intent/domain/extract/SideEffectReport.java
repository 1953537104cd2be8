package co.fanki.semanticanalyzer.intent.domain.extract;

import co.fanki.semanticanalyzer.intent.domain.SideEffect;
import co.fanki.semanticanalyzer.shared.Preconditions;

import java.util.List;

/**
 * The side effects of a code unit and how often it awaits.
 *
 * @param effects the effects in detection order
 * @param awaitCount the number of await expressions
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public record SideEffectReport(List<SideEffect> effects, int awaitCount) {

    /**
     * Creates a report, validating the await count.
     */
    public SideEffectReport {
        effects = List.copyOf(effects);
        Preconditions.requireNonNegative(awaitCount,
                "Await count must not be negative");
    }

    /**
     * Returns a report without effects.
     *
     * @return the empty report
     */
    public static SideEffectReport empty() {
        return new SideEffectReport(List.of(), 0);
    }

}
