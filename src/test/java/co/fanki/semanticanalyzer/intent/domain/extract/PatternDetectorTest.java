package co.fanki.semanticanalyzer.intent.domain.extract;

import co.fanki.semanticanalyzer.intent.domain.AnalysisContext;
import co.fanki.semanticanalyzer.intent.domain.registry.PatternRegistry;
import co.fanki.semanticanalyzer.parsing.domain.Dialect;
import co.fanki.semanticanalyzer.parsing.domain.treesitter.TreeSitterCodeParser;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Unit tests for {@link PatternDetector}.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
class PatternDetectorTest {

    private final TreeSitterCodeParser parser = new TreeSitterCodeParser();

    private final PatternDetector detector =
            new PatternDetector(PatternRegistry.defaults());

    private List<String> detect(final String code) {
        return detector.extract(parser.parse(code, Dialect.forFileName("a.ts")),
                AnalysisContext.empty());
    }

    @Test
    void whenDetecting_givenRepositoryWithInjectedDb_shouldFindBoth() {
        final List<String> patterns = detect("""
                class UserRepository {
                  constructor(db) {
                    this.db = db;
                  }
                }
                """);

        assertEquals(List.of(PatternDetector.REPOSITORY,
                "Dependency Injection"), patterns);
    }

    @Test
    void whenDetecting_givenGetInstance_shouldFindSingleton() {
        assertTrue(detect("""
                class Registry {
                  static getInstance() { return Registry.current; }
                }
                """).contains("Singleton"));
    }

    @Test
    void whenDetecting_givenCreateFunction_shouldFindFactory() {
        assertTrue(detect("function createUser(name) { return { name }; }")
                .contains("Factory"));
    }

    @Test
    void whenDetecting_givenEmit_shouldFindObserver() {
        assertTrue(detect("bus.emit('saved', user);")
                .contains("Observer/EventEmitter"));
    }

    @Test
    void whenDetecting_givenWithAndBuild_shouldFindBuilder() {
        assertTrue(detect("const q = new Query().withLimit(5).build();")
                .contains("Builder"));
    }

    @Test
    void whenDetecting_givenNextCall_shouldFindMiddleware() {
        assertTrue(detect("function guard(req, res, next) { next(); }")
                .contains("Middleware"));
    }

    @Test
    void whenDetecting_givenPlainFunction_shouldFindNothing() {
        assertTrue(detect("function add(a, b) { return a + b; }").isEmpty());
    }

}
