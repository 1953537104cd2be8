package co.fanki.semanticanalyzer.intent.domain;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Kind of observable effect a code unit has outside its own scope.
 *
 * <p>Each kind carries a fixed {@link Risk}.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public enum SideEffectType {

    /** A write through a data access object. */
    DATABASE(Risk.MEDIUM),

    /** A filesystem call. */
    FILE(Risk.MEDIUM),

    /** An outgoing network request. */
    NETWORK(Risk.HIGH),

    /** Console output. */
    CONSOLE(Risk.LOW),

    /** A mutation of process wide state such as window or process. */
    GLOBAL(Risk.HIGH),

    /** The code awaits asynchronous work. */
    ASYNC(Risk.LOW);

    private final Risk risk;

    SideEffectType(final Risk theRisk) {
        this.risk = theRisk;
    }

    /**
     * Returns the risk every effect of this kind carries.
     *
     * @return the risk, never null
     */
    public Risk risk() {
        return risk;
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
     * Parses a label.
     *
     * @param value the label to parse
     * @return the matching type
     * @throws IllegalArgumentException if the label is unknown
     */
    @JsonCreator
    public static SideEffectType fromString(final String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Side effect type is required");
        }
        return valueOf(value.toUpperCase().trim());
    }

}
