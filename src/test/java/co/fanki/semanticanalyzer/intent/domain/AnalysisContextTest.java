package co.fanki.semanticanalyzer.intent.domain;

import co.fanki.semanticanalyzer.parsing.domain.Dialect;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Unit tests for {@link AnalysisContext}.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
class AnalysisContextTest {

    @Test
    void whenCheckingTestFile_givenSpecOrTestName_shouldDetectIt() {
        assertTrue(AnalysisContext.ofFileName("user.spec.ts").isTestFile());
        assertTrue(AnalysisContext.ofFileName("UserTest.js").isTestFile());
        assertFalse(AnalysisContext.ofFileName("user.ts").isTestFile());
        assertFalse(AnalysisContext.empty().isTestFile());
    }

    @Test
    void whenCreating_givenNullDependencies_shouldUseEmptyList() {
        final AnalysisContext context = new AnalysisContext("a.ts",
                "typescript", null);

        assertTrue(context.dependencies().isEmpty());
    }

    @Test
    void whenResolvingDialect_givenJavascriptProjectWithoutName_shouldUseJs() {
        assertEquals(Dialect.forFileName("index.js"),
                new AnalysisContext(null, "JavaScript", null).dialect());
        assertEquals(Dialect.all(), AnalysisContext.empty().dialect());
    }

}
