package co.fanki.semanticanalyzer.intent.application;

import co.fanki.semanticanalyzer.shared.DomainException;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Unit tests for {@link AnalysisStateMachine}.
 *
 * <p>Walks the analysis phase graph and checks that skipped phases and
 * moves out of a terminal phase are rejected.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
class AnalysisStateMachineTest {

    @Test
    void whenTransitioning_givenIdleToParsing_shouldReturnParsing() {
        final AnalysisPhase result = AnalysisStateMachine.transition(AnalysisPhase.IDLE, AnalysisPhase.PARSING);
        assertEquals(AnalysisPhase.PARSING, result);
    }

    @Test
    void whenTransitioning_givenParsingToExtracting_shouldReturnExtracting() {
        final AnalysisPhase result = AnalysisStateMachine.transition(AnalysisPhase.PARSING, AnalysisPhase.EXTRACTING);
        assertEquals(AnalysisPhase.EXTRACTING, result);
    }

    @Test
    void whenTransitioning_givenExtractingToSynthesizing_shouldReturnSynthesizing() {
        final AnalysisPhase result = AnalysisStateMachine.transition(AnalysisPhase.EXTRACTING, AnalysisPhase.SYNTHESIZING);
        assertEquals(AnalysisPhase.SYNTHESIZING, result);
    }

    @Test
    void whenTransitioning_givenSynthesizingToAssembled_shouldReturnAssembled() {
        final AnalysisPhase result = AnalysisStateMachine.transition(AnalysisPhase.SYNTHESIZING, AnalysisPhase.ASSEMBLED);
        assertEquals(AnalysisPhase.ASSEMBLED, result);
    }

    @Test
    void whenTransitioning_givenParsingToFailed_shouldReturnFailed() {
        final AnalysisPhase result = AnalysisStateMachine.transition(AnalysisPhase.PARSING, AnalysisPhase.FAILED);
        assertEquals(AnalysisPhase.FAILED, result);
    }

    @Test
    void whenTransitioning_givenParsingToSynthesizing_shouldThrowDomainException() {
        final DomainException exception = assertThrows(DomainException.class, () ->
                AnalysisStateMachine.transition(AnalysisPhase.PARSING, AnalysisPhase.SYNTHESIZING));
        assertEquals(AnalysisStateMachine.INVALID_TRANSITION, exception.getErrorCode());
    }

    @Test
    void whenTransitioning_givenAssembledToFailed_shouldThrowDomainException() {
        final DomainException exception = assertThrows(DomainException.class, () ->
                AnalysisStateMachine.transition(AnalysisPhase.ASSEMBLED, AnalysisPhase.FAILED));
        assertEquals(AnalysisStateMachine.INVALID_TRANSITION, exception.getErrorCode());
    }

    @Test
    void whenTransitioning_givenFailedToParsing_shouldThrowDomainException() {
        final DomainException exception = assertThrows(DomainException.class, () ->
                AnalysisStateMachine.transition(AnalysisPhase.FAILED, AnalysisPhase.PARSING));
        assertEquals(AnalysisStateMachine.INVALID_TRANSITION, exception.getErrorCode());
    }

    @Test
    void whenTransitioning_givenNullTo_shouldThrowNullPointerException() {
        assertThrows(NullPointerException.class, () ->
                AnalysisStateMachine.transition(AnalysisPhase.IDLE, null));
    }

    @Test
    void whenCheckingTerminal_givenEachPhase_shouldOnlyFlagEndPhases() {
        assertTrue(AnalysisPhase.ASSEMBLED.isTerminal());
        assertTrue(AnalysisPhase.FAILED.isTerminal());
        assertFalse(AnalysisPhase.IDLE.isTerminal());
        assertFalse(AnalysisPhase.SYNTHESIZING.isTerminal());
    }

}
