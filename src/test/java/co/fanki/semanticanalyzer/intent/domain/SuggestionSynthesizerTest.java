package co.fanki.semanticanalyzer.intent.domain;

import co.fanki.semanticanalyzer.intent.domain.extract.PatternDetector;
import co.fanki.semanticanalyzer.intent.domain.extract.SideEffectReport;
import co.fanki.semanticanalyzer.intent.domain.registry.AnalysisThresholds;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Unit tests for {@link SuggestionSynthesizer}.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
class SuggestionSynthesizerTest {

    private final SuggestionSynthesizer synthesizer =
            new SuggestionSynthesizer(AnalysisThresholds.defaults());

    private static DataFlow input(final String name,
            final Sensitivity sensitivity, final List<String> validation) {
        return new DataFlow(name, "unknown", DataSource.PARAMETER, validation,
                List.of(), sensitivity);
    }

    @Test
    void whenSynthesizing_givenSimpleCode_shouldSuggestNothing() {
        assertTrue(synthesizer.synthesize("Event handler", List.of(),
                ComplexityAnalysis.baseline(), SideEffectReport.empty(),
                List.of()).isEmpty());
    }

    @Test
    void whenSynthesizing_givenEveryRuleTriggered_shouldKeepRuleOrder() {
        final ComplexityAnalysis complex =
                new ComplexityAnalysis(16, 11, 3, 21, 100);
        final SideEffectReport effects = new SideEffectReport(List.of(
                SideEffect.of(SideEffectType.NETWORK, "request", null),
                SideEffect.of(SideEffectType.ASYNC, "await", null)), 4);

        final List<String> suggestions = synthesizer.synthesize(
                "Database operation", List.of(), complex, effects,
                List.of(input("token", Sensitivity.CRITICAL, List.of())));

        assertEquals(List.of(
                "Consider breaking down complex functions",
                "Simplify logic to improve readability",
                "Reduce external dependencies",
                "Consider using Repository pattern for data access",
                "Consider using Promise.all for parallel async operations",
                "Add error handling for critical operations",
                "Add validation for sensitive data inputs"), suggestions);
    }

    @Test
    void whenSynthesizing_givenMetricsAtThresholds_shouldNotSuggest() {
        final ComplexityAnalysis limit =
                new ComplexityAnalysis(15, 10, 2, 20, 100);
        final SideEffectReport effects = new SideEffectReport(List.of(
                SideEffect.of(SideEffectType.DATABASE, "write", "db.save")),
                3);

        assertTrue(synthesizer.synthesize("Database operation",
                List.of(PatternDetector.REPOSITORY), limit, effects,
                List.of()).isEmpty());
    }

    @Test
    void whenSynthesizing_givenValidatedSensitiveInput_shouldNotAskForIt() {
        final List<String> suggestions = synthesizer.synthesize(
                "Input validation", List.of(), ComplexityAnalysis.baseline(),
                SideEffectReport.empty(), List.of(
                        input("password", Sensitivity.SENSITIVE,
                                List.of("validatePassword")),
                        input("email", Sensitivity.PRIVATE, List.of())));

        assertTrue(suggestions.isEmpty());
    }

}
