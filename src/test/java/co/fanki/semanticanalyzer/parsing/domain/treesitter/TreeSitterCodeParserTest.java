package co.fanki.semanticanalyzer.parsing.domain.treesitter;

import co.fanki.semanticanalyzer.parsing.domain.AstQueries;
import co.fanki.semanticanalyzer.parsing.domain.Dialect;
import co.fanki.semanticanalyzer.parsing.domain.JsNode.ClassDeclaration;
import co.fanki.semanticanalyzer.parsing.domain.JsNode.Comment;
import co.fanki.semanticanalyzer.parsing.domain.JsNode.FunctionDeclaration;
import co.fanki.semanticanalyzer.parsing.domain.JsNode.FunctionExpression;
import co.fanki.semanticanalyzer.parsing.domain.JsNode.ImportDeclaration;
import co.fanki.semanticanalyzer.parsing.domain.JsNode.JsxElement;
import co.fanki.semanticanalyzer.parsing.domain.JsNode.MethodDefinition;
import co.fanki.semanticanalyzer.parsing.domain.JsNode.TypeDeclaration;
import co.fanki.semanticanalyzer.parsing.domain.ParseError;
import co.fanki.semanticanalyzer.parsing.domain.ParsedSource;
import co.fanki.semanticanalyzer.shared.Severity;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Unit tests for {@link TreeSitterCodeParser}.
 *
 * <p>Parses small JavaScript, TypeScript and TSX snippets with the real
 * grammars and checks the resulting {@code JsNode} tree.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
class TreeSitterCodeParserTest {

    private final TreeSitterCodeParser parser = new TreeSitterCodeParser();

    @Test
    void whenParsing_givenFunctionDeclaration_shouldMapNameAndParameters() {
        final ParsedSource source = parser.parse(
                "function getUser(id) { return db.find(id); }",
                Dialect.forFileName("users.js"));

        final List<FunctionDeclaration> functions = AstQueries.collect(
                source.program(), FunctionDeclaration.class);

        assertEquals(1, functions.size());
        assertEquals("getUser", functions.get(0).name());
        assertEquals(1, functions.get(0).params().size());
        assertEquals("id", functions.get(0).params().get(0).name());
        assertTrue(source.diagnostics().isEmpty());
    }

    @Test
    void whenParsing_givenArrowFunctionBoundToConst_shouldNameIt() {
        final ParsedSource source = parser.parse(
                "const handler = async (req, res) => { res.send('ok'); };",
                Dialect.forFileName("handler.js"));

        final List<FunctionExpression> arrows = AstQueries.collect(
                source.program(), FunctionExpression.class);

        assertEquals(1, arrows.size());
        assertEquals("handler", arrows.get(0).name());
        assertTrue(arrows.get(0).arrow());
        assertTrue(arrows.get(0).async());
    }

    @Test
    void whenParsing_givenTypeScriptInterface_shouldProduceTypeDeclaration() {
        final ParsedSource source = parser.parse(
                "interface User { id: string; email: string }",
                Dialect.forFileName("user.ts"));

        final List<TypeDeclaration> types = AstQueries.collect(
                source.program(), TypeDeclaration.class);

        assertEquals(1, types.size());
        assertEquals("User", types.get(0).name());
    }

    @Test
    void whenParsing_givenClassWithMethods_shouldListMethods() {
        final ParsedSource source = parser.parse("""
                class UserRepository {
                  findAll() { return []; }
                  save(user) { return user; }
                }
                """, Dialect.forFileName("repo.ts"));

        final List<ClassDeclaration> classes = AstQueries.collect(
                source.program(), ClassDeclaration.class);

        assertEquals(1, classes.size());
        assertEquals("UserRepository", classes.get(0).name());
        assertEquals(List.of("findAll", "save"), classes.get(0).methods()
                .stream().map(MethodDefinition::name).toList());
    }

    @Test
    void whenParsing_givenTsxComponent_shouldProduceJsxElement() {
        final ParsedSource source = parser.parse(
                "const App = () => <div className=\"app\">Hello</div>;",
                Dialect.forFileName("App.tsx"));

        assertTrue(AstQueries.contains(source.program(), JsxElement.class));
    }

    @Test
    void whenParsing_givenAngleBracketAssertionWithJsxEnabled_shouldRecover() {
        final ParsedSource source = parser.parse(
                "const n = <number>value;\nexport default n;",
                Dialect.all());

        assertTrue(source.diagnostics().isEmpty());
    }

    @Test
    void whenParsing_givenImport_shouldKeepSpecifierAndLocalNames() {
        final ParsedSource source = parser.parse(
                "import express from 'express';",
                Dialect.forFileName("server.js"));

        final List<ImportDeclaration> imports = AstQueries.collect(
                source.program(), ImportDeclaration.class);

        assertEquals(1, imports.size());
        assertEquals("express", imports.get(0).source());
        assertEquals(List.of("express"), imports.get(0).localNames());
    }

    @Test
    void whenParsing_givenComment_shouldKeepCommentNode() {
        final ParsedSource source = parser.parse(
                "// Loads the user\nfunction load() {}",
                Dialect.forFileName("load.js"));

        assertTrue(AstQueries.contains(source.program(), Comment.class));
    }

    @Test
    void whenParsing_givenRecoverableSyntaxError_shouldReportWarning() {
        final ParsedSource source = parser.parse("""
                function total(items) {
                  const sum = ;
                  return items.length;
                }
                """, Dialect.forFileName("total.js"));

        assertFalse(source.diagnostics().isEmpty());
        assertTrue(source.diagnostics().stream().allMatch(d ->
                "parser".equals(d.facet())
                        && d.severity() == Severity.WARNING));
    }

    @Test
    void whenParsing_givenErrorsAboveTolerance_shouldThrowParseError() {
        final TreeSitterCodeParser strict = new TreeSitterCodeParser(0);

        final ParseError error = assertThrows(ParseError.class,
                () -> strict.parse("}}}}", Dialect.forFileName("x.js")));

        assertEquals(ParseError.CODE, error.getErrorCode());
    }

    @Test
    void whenParsing_givenEmptySource_shouldReturnEmptyProgram() {
        final ParsedSource source = parser.parse("", Dialect.all());

        assertTrue(source.program().body().isEmpty());
    }

    @Test
    void whenCreating_givenRatioAboveOne_shouldThrowException() {
        assertThrows(IllegalArgumentException.class,
                () -> new TreeSitterCodeParser(1.5));
    }

}
