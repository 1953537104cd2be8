package co.fanki.semanticanalyzer.intent.domain;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Where an imported module lives.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public enum DependencyType {

    /** A relative path inside the project. */
    INTERNAL,

    /** A package from the registry. */
    EXTERNAL,

    /** A Node.js built-in module. */
    SYSTEM;

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
     * Parses a label, returning EXTERNAL if not recognized.
     *
     * @param value the label to parse
     * @return the matching type, or EXTERNAL
     */
    @JsonCreator
    public static DependencyType fromString(final String value) {
        if (value == null || value.isBlank()) {
            return EXTERNAL;
        }
        try {
            return valueOf(value.toUpperCase().trim());
        } catch (final IllegalArgumentException e) {
            return EXTERNAL;
        }
    }

}
