package co.fanki.semanticanalyzer.intent.domain;

import co.fanki.semanticanalyzer.parsing.domain.ParsedSource;

/**
 * One independent pass over a parsed code unit that computes one facet of
 * its {@link CodeIntent}.
 *
 * <p>Extractors never modify the tree and keep no state between calls.
 * When {@link #extract} fails, the facet is replaced by
 * {@link #fallback()} and the failure is reported as a diagnostic.</p>
 *
 * @param <T> the facet type
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public interface IntentExtractor<T> {

    /**
     * Returns the facet name used in diagnostics.
     *
     * @return the facet name, e.g. {@code sideEffects}
     */
    String facet();

    /**
     * Computes the facet.
     *
     * @param source the parsed code unit
     * @param context what the caller knows about the code unit
     * @return the facet value, never null
     */
    T extract(ParsedSource source, AnalysisContext context);

    /**
     * Returns the value used when {@link #extract} fails.
     *
     * @return the fallback value, never null
     */
    T fallback();

}
