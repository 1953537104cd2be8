package co.fanki.semanticanalyzer.intent.application;

/**
 * The phases one intent analysis goes through.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public enum AnalysisPhase {

    /** Nothing has run yet. */
    IDLE,

    /** The code is being parsed. */
    PARSING,

    /** The extractors are running over the syntax tree. */
    EXTRACTING,

    /** Suggestions, category and confidence are being derived. */
    SYNTHESIZING,

    /** The intent was assembled. */
    ASSEMBLED,

    /** The analysis was aborted. */
    FAILED;

    /**
     * Checks whether the analysis is over.
     *
     * @return true for ASSEMBLED and FAILED
     */
    public boolean isTerminal() {
        return this == ASSEMBLED || this == FAILED;
    }

}
