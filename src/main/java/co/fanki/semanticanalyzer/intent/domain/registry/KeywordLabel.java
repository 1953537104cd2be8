package co.fanki.semanticanalyzer.intent.domain.registry;

import co.fanki.semanticanalyzer.shared.Preconditions;

/**
 * One row of an ordered lookup table: a keyword and the label it maps to.
 *
 * @param keyword the text to look for
 * @param label the label produced on a match
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public record KeywordLabel(String keyword, String label) {

    /**
     * Creates a row, validating both fields.
     */
    public KeywordLabel {
        Preconditions.requireNonBlank(keyword, "Keyword is required");
        Preconditions.requireNonBlank(label, "Label is required");
    }

    /**
     * Shorthand constructor used by the default tables.
     *
     * @param keyword the keyword
     * @param label the label
     * @return the row
     */
    public static KeywordLabel of(final String keyword, final String label) {
        return new KeywordLabel(keyword, label);
    }

}
