package co.fanki.semanticanalyzer.intent.domain;

import co.fanki.semanticanalyzer.parsing.domain.Dialect;
import co.fanki.semanticanalyzer.parsing.domain.ParsedSource;
import co.fanki.semanticanalyzer.parsing.domain.treesitter.TreeSitterCodeParser;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;

/**
 * Unit tests for {@link ConfidenceScorer}.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
class ConfidenceScorerTest {

    private final TreeSitterCodeParser parser = new TreeSitterCodeParser();

    private final ConfidenceScorer scorer = new ConfidenceScorer();

    private ParsedSource parse(final String code) {
        return parser.parse(code, Dialect.all());
    }

    @Test
    void whenScoring_givenPlainUnknownCode_shouldReturnBase() {
        assertEquals(0.5, scorer.score(parse("run();"),
                AnalysisContext.empty(), "unknown", 0));
    }

    @Test
    void whenScoring_givenGeneralPurpose_shouldNotCountAsResolved() {
        assertEquals(0.5, scorer.score(parse("run();"),
                AnalysisContext.empty(), "General purpose code", 0));
    }

    @Test
    void whenScoring_givenTypesCommentsAndPurpose_shouldAddBonuses() {
        final ParsedSource source = parse("""
                // loads a user
                function load(id: string): User { return find(id); }
                """);

        assertEquals(0.89, scorer.score(source, AnalysisContext.empty(),
                "Database operation", 2));
    }

    @Test
    void whenScoring_givenManyPatterns_shouldCapPatternBonus() {
        assertEquals(0.6, scorer.score(parse("run();"),
                AnalysisContext.empty(), "unknown", 9));
    }

    @Test
    void whenScoring_givenEverySignal_shouldCapAtMaximum() {
        final ParsedSource source = parse("""
                /** spec helper */
                interface Fixture { name: string }
                """);

        assertEquals(CodeIntent.MAX_CONFIDENCE, scorer.score(source,
                AnalysisContext.ofFileName("fixture.spec.ts"),
                "Test suite", 5));
    }

}
