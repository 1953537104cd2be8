package co.fanki.semanticanalyzer.intent.domain;

import co.fanki.semanticanalyzer.shared.Diagnostic;
import co.fanki.semanticanalyzer.shared.Preconditions;

/**
 * The value one extractor produced, or the fallback it was replaced with
 * and the reason why.
 *
 * @param value the extracted value, or the fallback on failure
 * @param diagnostic the failure, null on success
 * @param <T> the facet type
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public record ExtractionResult<T>(T value, Diagnostic diagnostic) {

    /**
     * Creates a result, validating that there is a value.
     */
    public ExtractionResult {
        Preconditions.requireNonNull(value, "Extraction value is required");
    }

    /**
     * Creates a successful result.
     *
     * @param value the extracted value
     * @param <T> the facet type
     * @return the success result
     */
    public static <T> ExtractionResult<T> success(final T value) {
        return new ExtractionResult<>(value, null);
    }

    /**
     * Creates a failed result.
     *
     * @param fallback the value used in place of the extracted one
     * @param diagnostic why the extraction failed
     * @param <T> the facet type
     * @return the failure result
     */
    public static <T> ExtractionResult<T> failure(final T fallback,
            final Diagnostic diagnostic) {
        Preconditions.requireNonNull(diagnostic,
                "A failed extraction needs a diagnostic");
        return new ExtractionResult<>(fallback, diagnostic);
    }

    /**
     * Checks whether the extraction succeeded.
     *
     * @return true if the value was extracted
     */
    public boolean isSuccess() {
        return diagnostic == null;
    }

}
