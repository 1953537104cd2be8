package co.fanki.semanticanalyzer.shared;

/**
 * A non-fatal finding produced while analysing a code unit.
 *
 * <p>Diagnostics report syntax the parser had to recover from and
 * analysis facets that failed and were replaced by their fallback
 * value.</p>
 *
 * @param facet the part of the analysis that produced it, e.g.
 *        {@code parser} or {@code dataFlow}
 * @param severity how serious the finding is
 * @param message a human readable description
 * @param line the 1-based source line, null when not tied to a line
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public record Diagnostic(
        String facet,
        Severity severity,
        String message,
        Integer line
) implements ValueObject {

    /**
     * Creates a diagnostic, validating the required fields.
     */
    public Diagnostic {
        Preconditions.requireNonBlank(facet, "Diagnostic facet is required");
        Preconditions.requireNonNull(severity,
                "Diagnostic severity is required");
        Preconditions.requireNonNull(message,
                "Diagnostic message is required");
    }

    /**
     * Creates an info diagnostic.
     *
     * @param facet the facet name
     * @param message the message
     * @param line the source line, may be null
     * @return the diagnostic
     */
    public static Diagnostic info(final String facet, final String message,
            final Integer line) {
        return new Diagnostic(facet, Severity.INFO, message, line);
    }

    /**
     * Creates a warning diagnostic.
     *
     * @param facet the facet name
     * @param message the message
     * @param line the source line, may be null
     * @return the diagnostic
     */
    public static Diagnostic warning(final String facet,
            final String message, final Integer line) {
        return new Diagnostic(facet, Severity.WARNING, message, line);
    }

    /**
     * Creates an error diagnostic not tied to a line.
     *
     * @param facet the facet name
     * @param message the message
     * @return the diagnostic
     */
    public static Diagnostic error(final String facet, final String message) {
        return new Diagnostic(facet, Severity.ERROR, message, null);
    }

}
