package co.fanki.semanticanalyzer.intent.domain;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Where a value entering or leaving a code unit comes from.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public enum DataSource {

    PARAMETER,
    DATABASE,
    API,
    FILE,
    USER,
    INTERNAL;

    /**
     * Returns the lowercase label used on the wire.
     *
     * @return the label
     */
    @JsonValue
    public String label() {
        return name().toLowerCase();
    }

    /**
     * Parses a label, returning INTERNAL if not recognized.
     *
     * @param value the label to parse
     * @return the matching source, or INTERNAL
     */
    @JsonCreator
    public static DataSource fromString(final String value) {
        if (value == null || value.isBlank()) {
            return INTERNAL;
        }
        try {
            return valueOf(value.toUpperCase().trim());
        } catch (final IllegalArgumentException e) {
            return INTERNAL;
        }
    }

}
