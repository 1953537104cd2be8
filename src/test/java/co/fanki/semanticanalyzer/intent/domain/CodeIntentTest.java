package co.fanki.semanticanalyzer.intent.domain;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Unit tests for {@link CodeIntent}.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
class CodeIntentTest {

    private static CodeIntent intent(final List<SideEffect> effects,
            final List<String> antiPatterns, final double confidence) {
        return new CodeIntent("Data access", IntentCategory.DATA, null, null,
                null, effects, null, ComplexityAnalysis.baseline(), null,
                antiPatterns, null, confidence, null);
    }

    @Test
    void whenCreating_givenNullLists_shouldUseEmptyLists() {
        final CodeIntent intent = intent(null, null, 0.5);

        assertTrue(intent.actions().isEmpty());
        assertTrue(intent.diagnostics().isEmpty());
        assertFalse(intent.hasIssues());
    }

    @Test
    void whenCheckingIssues_givenGlobalMutation_shouldReportHighRiskOnly() {
        final SideEffect log = SideEffect.of(SideEffectType.CONSOLE, "log",
                "console");
        final SideEffect global = SideEffect.of(SideEffectType.GLOBAL,
                "mutation", "window.state");

        final CodeIntent intent = intent(List.of(log, global), List.of(), 0.5);

        assertEquals(List.of(global), intent.highRiskEffects());
        assertTrue(intent.hasIssues());
    }

    @Test
    void whenCheckingIssues_givenAntiPatternOnly_shouldHaveIssues() {
        assertTrue(intent(List.of(), List.of("Deep Nesting - simplify logic"),
                0.5).hasIssues());
    }

    @Test
    void whenCreating_givenConfidenceAboveMaximum_shouldFail() {
        assertThrows(IllegalArgumentException.class,
                () -> intent(List.of(), List.of(), 0.96));
    }

}
