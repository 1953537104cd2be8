package co.fanki.semanticanalyzer.parsing.domain;

import co.fanki.semanticanalyzer.parsing.domain.JsNode.CallExpression;
import co.fanki.semanticanalyzer.parsing.domain.JsNode.MemberExpression;
import co.fanki.semanticanalyzer.parsing.domain.JsNode.Program;
import co.fanki.semanticanalyzer.parsing.domain.treesitter.TreeSitterCodeParser;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Unit tests for {@link AstQueries}.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
class AstQueriesTest {

    private final CodeParser parser = new TreeSitterCodeParser();

    private Program parse(final String code) {
        return parser.parse(code, Dialect.forFileName("a.js")).program();
    }

    @Test
    void whenRendering_givenMemberCall_shouldRenderDottedChain() {
        final List<CallExpression> calls = AstQueries.collect(
                parse("this.repo.save(user);"), CallExpression.class);

        assertEquals(1, calls.size());
        assertEquals("this.repo.save", AstQueries.render(calls.get(0).callee()));
        assertEquals("save", AstQueries.calleeName(calls.get(0)));
    }

    @Test
    void whenFindingRoot_givenNestedMemberAccess_shouldReturnLeftmostName() {
        final List<MemberExpression> members = AstQueries.collect(
                parse("const port = process.env.PORT;"),
                MemberExpression.class);

        assertEquals("process", AstQueries.rootIdentifier(members.get(0)));
    }

    @Test
    void whenCheckingReferences_givenUsedAndUnusedNames_shouldTellThemApart() {
        final Program program = parse("const a = 1; console.log(a);");

        assertTrue(AstQueries.references(program, "console"));
        assertFalse(AstQueries.references(program, "b"));
    }

    @Test
    void whenReadingString_givenNonStringNode_shouldReturnNull() {
        final List<CallExpression> calls = AstQueries.collect(
                parse("fetch(url);"), CallExpression.class);

        assertNull(AstQueries.stringValue(calls.get(0).arguments().get(0)));
    }

    @Test
    void whenCollecting_givenNullRoot_shouldReturnEmptyList() {
        assertTrue(AstQueries.collect(null, CallExpression.class).isEmpty());
    }

}
