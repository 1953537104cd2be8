package co.fanki.semanticanalyzer.intent.domain;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Risk level of a side effect.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public enum Risk {

    LOW,
    MEDIUM,
    HIGH;

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
     * Parses a label, returning LOW if not recognized.
     *
     * @param value the label to parse
     * @return the matching risk, or LOW
     */
    @JsonCreator
    public static Risk fromString(final String value) {
        if (value == null || value.isBlank()) {
            return LOW;
        }
        try {
            return valueOf(value.toUpperCase().trim());
        } catch (final IllegalArgumentException e) {
            return LOW;
        }
    }

}
