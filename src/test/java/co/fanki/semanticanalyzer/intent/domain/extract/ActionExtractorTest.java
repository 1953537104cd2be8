package co.fanki.semanticanalyzer.intent.domain.extract;

import co.fanki.semanticanalyzer.intent.domain.AnalysisContext;
import co.fanki.semanticanalyzer.parsing.domain.Dialect;
import co.fanki.semanticanalyzer.parsing.domain.treesitter.TreeSitterCodeParser;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

/**
 * Unit tests for {@link ActionExtractor}.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
class ActionExtractorTest {

    private final TreeSitterCodeParser parser = new TreeSitterCodeParser();

    private List<String> actions(final int max, final String code) {
        return new ActionExtractor(max).extract(
                parser.parse(code, Dialect.forFileName("a.js")),
                AnalysisContext.empty());
    }

    @Test
    void whenExtracting_givenRepeatedCalls_shouldKeepFirstOccurrenceOrder() {
        final List<String> actions = actions(10, """
                db.find(id);
                fetch(url);
                db.find(other);
                this.repo.save(user);
                """);

        assertEquals(List.of("db.find", "fetch", "this.repo.save"), actions);
    }

    @Test
    void whenExtracting_givenMoreCallsThanLimit_shouldCap() {
        final StringBuilder code = new StringBuilder();
        for (int i = 0; i < 12; i++) {
            code.append("step").append(i).append("();\n");
        }

        final List<String> actions = actions(10, code.toString());

        assertEquals(10, actions.size());
        assertEquals("step0", actions.get(0));
        assertEquals("step9", actions.get(9));
    }

    @Test
    void whenExtracting_givenNoCalls_shouldReturnEmptyList() {
        assertEquals(List.of(), actions(10, "const a = 1 + 2;"));
    }

    @Test
    void whenCreating_givenZeroLimit_shouldThrowException() {
        assertThrows(IllegalArgumentException.class,
                () -> new ActionExtractor(0));
    }

}
