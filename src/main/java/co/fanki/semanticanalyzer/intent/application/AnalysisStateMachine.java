package co.fanki.semanticanalyzer.intent.application;

import co.fanki.semanticanalyzer.shared.DomainException;

import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

/**
 * Centralizes the valid phase transitions of an intent analysis.
 *
 * <p>Valid transitions:</p>
 * <pre>
 *   IDLE         → PARSING, FAILED
 *   PARSING      → EXTRACTING, FAILED
 *   EXTRACTING   → SYNTHESIZING, FAILED
 *   SYNTHESIZING → ASSEMBLED, FAILED
 * </pre>
 *
 * <p>ASSEMBLED and FAILED are terminal.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public final class AnalysisStateMachine {

    /** Error code of a rejected transition. */
    public static final String INVALID_TRANSITION =
            "ANALYSIS_INVALID_TRANSITION";

    private static final Map<AnalysisPhase, Set<AnalysisPhase>> TRANSITIONS;

    static {
        TRANSITIONS = new EnumMap<>(AnalysisPhase.class);
        TRANSITIONS.put(AnalysisPhase.IDLE,         EnumSet.of(AnalysisPhase.PARSING, AnalysisPhase.FAILED));
        TRANSITIONS.put(AnalysisPhase.PARSING,      EnumSet.of(AnalysisPhase.EXTRACTING, AnalysisPhase.FAILED));
        TRANSITIONS.put(AnalysisPhase.EXTRACTING,   EnumSet.of(AnalysisPhase.SYNTHESIZING, AnalysisPhase.FAILED));
        TRANSITIONS.put(AnalysisPhase.SYNTHESIZING, EnumSet.of(AnalysisPhase.ASSEMBLED, AnalysisPhase.FAILED));
    }

    private AnalysisStateMachine() {
    }

    /**
     * Validates a phase transition and returns the target phase if it is
     * permitted.
     *
     * @param from the current phase
     * @param to the desired phase
     * @return {@code to} when the transition is valid
     * @throws DomainException with code {@value #INVALID_TRANSITION} when
     *         the transition is not permitted
     * @throws NullPointerException if {@code from} or {@code to} is null
     */
    public static AnalysisPhase transition(final AnalysisPhase from,
            final AnalysisPhase to) {
        if (from == null || to == null) {
            throw new NullPointerException("from and to must not be null");
        }
        final Set<AnalysisPhase> allowed = TRANSITIONS.getOrDefault(from,
                EnumSet.noneOf(AnalysisPhase.class));
        if (!allowed.contains(to)) {
            throw new DomainException("Invalid transition: " + from + " → " + to,
                    INVALID_TRANSITION);
        }
        return to;
    }

}
