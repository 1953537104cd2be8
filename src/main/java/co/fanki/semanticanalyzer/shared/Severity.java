package co.fanki.semanticanalyzer.shared;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * How serious a {@link Diagnostic} is.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public enum Severity {

    /** Informational note, nothing was lost. */
    INFO,

    /** Something was recovered from; the result may be less precise. */
    WARNING,

    /** A facet could not be computed and holds its fallback value. */
    ERROR;

    /**
     * Returns the lowercase label used on the wire.
     *
     * @return the label, never null
     */
    @JsonValue
    public String label() {
        return name().toLowerCase();
    }

    /**
     * Parses a label into a Severity, returning INFO if not recognized.
     *
     * @param value the label to parse
     * @return the matching severity, or INFO
     */
    @JsonCreator
    public static Severity fromString(final String value) {
        if (value == null || value.isBlank()) {
            return INFO;
        }
        try {
            return valueOf(value.toUpperCase().trim());
        } catch (final IllegalArgumentException e) {
            return INFO;
        }
    }

}
