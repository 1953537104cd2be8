package co.fanki.semanticanalyzer.shared;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;

/**
 * Unit tests for {@link Diagnostic} and {@link Severity}.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
class DiagnosticTest {

    @Test
    void whenCreatingError_shouldHaveNoLine() {
        final Diagnostic diagnostic = Diagnostic.error("dataFlow", "boom");

        assertEquals(Severity.ERROR, diagnostic.severity());
        assertNull(diagnostic.line());
    }

    @Test
    void whenCreating_givenBlankFacet_shouldThrowException() {
        assertThrows(IllegalArgumentException.class,
                () -> Diagnostic.warning(" ", "message", 1));
    }

    @Test
    void whenParsingSeverity_givenUnknownLabel_shouldDefaultToInfo() {
        assertEquals(Severity.INFO, Severity.fromString("fatal"));
        assertEquals(Severity.WARNING, Severity.fromString("warning"));
        assertEquals("error", Severity.ERROR.label());
    }

}
