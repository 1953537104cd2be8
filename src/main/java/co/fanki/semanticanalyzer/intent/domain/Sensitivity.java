package co.fanki.semanticanalyzer.intent.domain;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * How sensitive a value is, judged from its name.
 *
 * <p>Declared from least to most sensitive.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public enum Sensitivity {

    /** No sensitive keyword matched. */
    PUBLIC,

    /** Personal data such as an email or phone number. */
    PRIVATE,

    /** Credentials and secrets. */
    SENSITIVE,

    /** Money movement. */
    CRITICAL;

    /**
     * Checks whether a value of this sensitivity needs validation.
     *
     * @return true for SENSITIVE and CRITICAL
     */
    public boolean requiresValidation() {
        return this == SENSITIVE || this == CRITICAL;
    }

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
     * Parses a label, returning PUBLIC if not recognized.
     *
     * @param value the label to parse
     * @return the matching sensitivity, or PUBLIC
     */
    @JsonCreator
    public static Sensitivity fromString(final String value) {
        if (value == null || value.isBlank()) {
            return PUBLIC;
        }
        try {
            return valueOf(value.toUpperCase().trim());
        } catch (final IllegalArgumentException e) {
            return PUBLIC;
        }
    }

}
