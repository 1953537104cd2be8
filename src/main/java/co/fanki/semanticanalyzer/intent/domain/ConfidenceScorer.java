package co.fanki.semanticanalyzer.intent.domain;

import co.fanki.semanticanalyzer.intent.domain.extract.PurposeDetector;
import co.fanki.semanticanalyzer.parsing.domain.AstQueries;
import co.fanki.semanticanalyzer.parsing.domain.JsNode.Comment;
import co.fanki.semanticanalyzer.parsing.domain.JsNode.TypeAnnotation;
import co.fanki.semanticanalyzer.parsing.domain.JsNode.TypeDeclaration;
import co.fanki.semanticanalyzer.parsing.domain.ParsedSource;

/**
 * Scores how much an analysis can be trusted.
 *
 * <p>Starts at 0.5 and adds a bonus for every quality signal: explicit
 * types, comments, a test file, recognized patterns and a resolved
 * purpose. The score never exceeds {@link CodeIntent#MAX_CONFIDENCE}.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public class ConfidenceScorer {

    private static final double BASE = 0.5;
    private static final double TYPES = 0.15;
    private static final double COMMENTS = 0.10;
    private static final double TESTS = 0.10;
    private static final double PER_PATTERN = 0.02;
    private static final double MAX_PATTERNS = 0.10;
    private static final double KNOWN_PURPOSE = 0.10;

    /**
     * Scores an analysis.
     *
     * @param source the parsed code unit
     * @param context what the caller knows about the code unit
     * @param purpose the detected purpose
     * @param patternCount how many patterns were recognized
     * @return the confidence, between 0 and 0.95
     */
    public double score(final ParsedSource source,
            final AnalysisContext context, final String purpose,
            final int patternCount) {
        double confidence = BASE;
        if (AstQueries.contains(source.program(), TypeAnnotation.class)
                || AstQueries.contains(source.program(),
                        TypeDeclaration.class)) {
            confidence += TYPES;
        }
        if (AstQueries.contains(source.program(), Comment.class)) {
            confidence += COMMENTS;
        }
        if (context.isTestFile()) {
            confidence += TESTS;
        }
        confidence += Math.min(MAX_PATTERNS, PER_PATTERN * patternCount);
        if (PurposeDetector.isResolved(purpose)) {
            confidence += KNOWN_PURPOSE;
        }
        final double rounded = Math.round(confidence * 100) / 100.0;
        return Math.max(0, Math.min(CodeIntent.MAX_CONFIDENCE, rounded));
    }

}
