package co.fanki.semanticanalyzer.parsing.domain;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Unit tests for {@link Dialect}.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
class DialectTest {

    @Test
    void whenResolving_givenTsFile_shouldDisableJsx() {
        final Dialect dialect = Dialect.forFileName("service.ts");

        assertTrue(dialect.typeScript());
        assertFalse(dialect.jsx());
    }

    @Test
    void whenResolving_givenTsxFile_shouldEnableEverything() {
        assertEquals(Dialect.all(), Dialect.forFileName("App.TSX"));
    }

    @Test
    void whenResolving_givenJsFile_shouldDisableTypeScript() {
        final Dialect dialect = Dialect.forFileName("index.mjs");

        assertFalse(dialect.typeScript());
        assertTrue(dialect.jsx());
    }

    @Test
    void whenResolving_givenUnknownExtensionAndJavascriptProject_shouldUseJavascript() {
        final Dialect dialect = Dialect.resolve("snippet.txt", "JavaScript");

        assertFalse(dialect.typeScript());
    }

    @Test
    void whenResolving_givenExtensionAndJavascriptProject_shouldPreferExtension() {
        assertTrue(Dialect.resolve("a.ts", "javascript").typeScript());
    }

    @Test
    void whenResolving_givenNothing_shouldEnableEverything() {
        assertEquals(Dialect.all(), Dialect.resolve(null, null));
    }

}
