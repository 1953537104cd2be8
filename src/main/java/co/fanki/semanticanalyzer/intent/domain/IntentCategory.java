package co.fanki.semanticanalyzer.intent.domain;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * The broad area a code unit belongs to.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public enum IntentCategory {

    /** Request handling and business rules. */
    BUSINESS,

    /** Plumbing that does not fit any other category. */
    INFRASTRUCTURE,

    /** Helpers and services shared across features. */
    UTILITY,

    /** Authentication and authorization. */
    SECURITY,

    /** Persistence and data access. */
    DATA;

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
     * Parses a label, returning INFRASTRUCTURE if not recognized.
     *
     * @param value the label to parse
     * @return the matching category, or INFRASTRUCTURE
     */
    @JsonCreator
    public static IntentCategory fromString(final String value) {
        if (value == null || value.isBlank()) {
            return INFRASTRUCTURE;
        }
        try {
            return valueOf(value.toUpperCase().trim());
        } catch (final IllegalArgumentException e) {
            return INFRASTRUCTURE;
        }
    }

}
