package co.fanki.semanticanalyzer.intent.domain.extract;

import co.fanki.semanticanalyzer.intent.domain.AnalysisContext;
import co.fanki.semanticanalyzer.intent.domain.registry.AnalysisThresholds;
import co.fanki.semanticanalyzer.intent.domain.registry.KeywordRegistry;
import co.fanki.semanticanalyzer.parsing.domain.Dialect;
import co.fanki.semanticanalyzer.parsing.domain.treesitter.TreeSitterCodeParser;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Unit tests for {@link AntiPatternDetector}.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
class AntiPatternDetectorTest {

    private static final String LONG_PARAMETERS =
            "Long Parameter List - use object parameters";

    private final TreeSitterCodeParser parser = new TreeSitterCodeParser();

    private final AntiPatternDetector detector = new AntiPatternDetector(
            KeywordRegistry.defaults(), AnalysisThresholds.defaults());

    private List<String> detect(final String code) {
        return detector.extract(parser.parse(code, Dialect.forFileName("a.js")),
                AnalysisContext.empty());
    }

    @Test
    void whenDetecting_givenCleanFunction_shouldFindNothing() {
        assertTrue(detect("function add(a, b) { return a + b; }").isEmpty());
    }

    @Test
    void whenDetecting_givenFiveParameters_shouldFindLongParameterList() {
        assertEquals(List.of(LONG_PARAMETERS),
                detect("function make(a, b, c, d, e) { return a; }"));
    }

    @Test
    void whenDetecting_givenSixUncommonNumbers_shouldFindMagicNumbers() {
        final List<String> found = detect("""
                const limits = [3, 7, 42, 99, 1234, 5678];
                console.log(limits, 0, 1, 10, 100);
                """);

        assertEquals(List.of("Magic Numbers - use named constants"), found);
    }

    @Test
    void whenDetecting_givenClassWithManyMethods_shouldFindGodObject() {
        final StringBuilder code = new StringBuilder("class Everything {\n");
        for (int i = 0; i <= 20; i++) {
            code.append("  method").append(i).append("() { return ")
                    .append(i).append("; }\n");
        }
        code.append("}\n");

        assertTrue(detect(code.toString())
                .contains("God Object - too many responsibilities"));
    }

    @Test
    void whenDetecting_givenDeeplyNestedCallbacks_shouldFindCallbackHell() {
        assertTrue(detect(
                "a(() => b(() => c(() => d(() => e(() => f(() => g()))))));")
                .contains("Callback Hell - use async/await"));
    }

    @Test
    void whenDetecting_givenFiveNestedBlocks_shouldFindDeepNesting() {
        assertTrue(detect("""
                function check(a, b, c, d) {
                  if (a) { if (b) { if (c) { if (d) { go(); } } } }
                }
                """).contains("Deep Nesting - simplify logic"));
    }

    @Test
    void whenDetecting_givenRepeatedBlock_shouldFindDuplication() {
        final String block = """
                total = total + price;
                count = count + 1;
                log(total);
                log(count);
                reset(cart);
                """;

        assertTrue(detect(block + "\n" + block)
                .contains("Code Duplication - extract common logic"));
    }

    @Test
    void whenDetecting_givenBlankLines_shouldNotReportDuplication() {
        assertFalse(detect("a();\n\n\n\n\n\n\n\n\n\n\n\nb();")
                .contains("Code Duplication - extract common logic"));
    }

    @Test
    void whenDetecting_givenThreeUnreadVariables_shouldFindUnusedVariables() {
        assertTrue(detect("""
                let first;
                first = load();
                const second = 2;
                const third = 3;
                const used = 4;
                console.log(used);
                """).contains("Unused Variables - remove dead code"));
    }

    @Test
    void whenDetecting_givenTwoUnreadVariables_shouldTolerateThem() {
        assertFalse(detect("""
                const first = load();
                const second = load();
                """).contains("Unused Variables - remove dead code"));
    }

}
