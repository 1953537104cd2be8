package co.fanki.semanticanalyzer.parsing.domain;

import co.fanki.semanticanalyzer.shared.DomainException;

/**
 * Thrown when a code unit cannot be turned into a usable syntax tree.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public class ParseError extends DomainException {

    private static final long serialVersionUID = 1L;

    /** Error code carried by every parse failure. */
    public static final String CODE = "PARSE_ERROR";

    /**
     * Creates a parse error.
     *
     * @param message the error message
     */
    public ParseError(final String message) {
        super(message, CODE);
    }

    /**
     * Creates a parse error with an underlying cause.
     *
     * @param message the error message
     * @param cause the cause
     */
    public ParseError(final String message, final Throwable cause) {
        super(message, CODE, cause);
    }

}
