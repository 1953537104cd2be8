package co.fanki.semanticanalyzer.intent.domain.registry;

import co.fanki.semanticanalyzer.shared.Preconditions;

/**
 * The lookup tables and limits an analyzer is built with.
 *
 * <p>Registries are immutable and passed to the extractors through their
 * constructors, so two analyzers with different tables can run side by
 * side.</p>
 *
 * @param keywords the keyword tables
 * @param patterns the pattern expressions
 * @param thresholds the numeric limits
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public record AnalyzerRegistries(
        KeywordRegistry keywords,
        PatternRegistry patterns,
        AnalysisThresholds thresholds
) {

    /**
     * Creates the registries, validating that none is missing.
     */
    public AnalyzerRegistries {
        Preconditions.requireNonNull(keywords, "Keywords are required");
        Preconditions.requireNonNull(patterns, "Patterns are required");
        Preconditions.requireNonNull(thresholds, "Thresholds are required");
    }

    /**
     * Returns the built-in registries.
     *
     * @return the default registries
     */
    public static AnalyzerRegistries defaults() {
        return new AnalyzerRegistries(KeywordRegistry.defaults(),
                PatternRegistry.defaults(), AnalysisThresholds.defaults());
    }

    /**
     * Returns a copy with other keyword tables.
     *
     * @param theKeywords the keyword tables
     * @return the new registries
     */
    public AnalyzerRegistries withKeywords(final KeywordRegistry theKeywords) {
        return new AnalyzerRegistries(theKeywords, patterns, thresholds);
    }

    /**
     * Returns a copy with other pattern expressions.
     *
     * @param thePatterns the pattern expressions
     * @return the new registries
     */
    public AnalyzerRegistries withPatterns(final PatternRegistry thePatterns) {
        return new AnalyzerRegistries(keywords, thePatterns, thresholds);
    }

    /**
     * Returns a copy with other limits.
     *
     * @param theThresholds the limits
     * @return the new registries
     */
    public AnalyzerRegistries withThresholds(
            final AnalysisThresholds theThresholds) {
        return new AnalyzerRegistries(keywords, patterns, theThresholds);
    }

}
