package co.fanki.semanticanalyzer.collaboration.domain;

import co.fanki.semanticanalyzer.shared.DomainException;

/**
 * Thrown by telemetry and insight collaborators when they cannot accept
 * a message.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public class CollaboratorException extends DomainException {

    private static final long serialVersionUID = 1L;

    /** Error code carried by every collaborator failure. */
    public static final String CODE = "COLLABORATOR_ERROR";

    /**
     * Creates a collaborator exception.
     *
     * @param message the error message
     */
    public CollaboratorException(final String message) {
        super(message, CODE);
    }

    /**
     * Creates a collaborator exception with an underlying cause.
     *
     * @param message the error message
     * @param cause the cause
     */
    public CollaboratorException(final String message,
            final Throwable cause) {
        super(message, CODE, cause);
    }

}
