package co.fanki.semanticanalyzer.intent.domain.extract;

import co.fanki.semanticanalyzer.intent.domain.AnalysisContext;
import co.fanki.semanticanalyzer.intent.domain.IntentExtractor;
import co.fanki.semanticanalyzer.intent.domain.registry.PatternRegistry;
import co.fanki.semanticanalyzer.parsing.domain.AstQueries;
import co.fanki.semanticanalyzer.parsing.domain.JsNode.ClassDeclaration;
import co.fanki.semanticanalyzer.parsing.domain.JsNode.MethodDefinition;
import co.fanki.semanticanalyzer.parsing.domain.ParsedSource;
import co.fanki.semanticanalyzer.shared.Preconditions;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Predicate;

/**
 * Recognizes common design patterns.
 *
 * <p>Each pattern is an independent check; all of them run, in a fixed
 * order, and every match is reported.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public class PatternDetector implements IntentExtractor<List<String>> {

    /** Label of the repository pattern. */
    public static final String REPOSITORY = "Repository";

    private final PatternRegistry patterns;

    private final List<Check> checks;

    /**
     * Creates a detector.
     *
     * @param thePatterns the pattern expressions, never null
     */
    public PatternDetector(final PatternRegistry thePatterns) {
        this.patterns = Preconditions.requireNonNull(thePatterns,
                "Patterns are required");
        this.checks = List.of(
                new Check("Singleton", this::isSingleton),
                new Check("Factory", this::isFactory),
                new Check("Observer/EventEmitter", this::isObserver),
                new Check(REPOSITORY, this::isRepository),
                new Check("Dependency Injection", this::injectsDependencies),
                new Check("Builder", this::isBuilder),
                new Check("Middleware", this::isMiddleware));
    }

    @Override
    public String facet() {
        return "patterns";
    }

    @Override
    public List<String> extract(final ParsedSource source,
            final AnalysisContext context) {
        final List<String> found = new ArrayList<>();
        for (final Check check : checks) {
            if (check.matches().test(source)) {
                found.add(check.label());
            }
        }
        return found;
    }

    @Override
    public List<String> fallback() {
        return List.of();
    }

    private boolean isSingleton(final ParsedSource source) {
        return patterns.singleton().matcher(source.source()).find();
    }

    private boolean isFactory(final ParsedSource source) {
        for (final FunctionView function : FunctionView.all(
                source.program())) {
            if (function.isNamed()
                    && patterns.factoryName().matcher(function.name())
                    .find()) {
                return true;
            }
        }
        return false;
    }

    private boolean isObserver(final ParsedSource source) {
        return patterns.observer().matcher(source.source()).find();
    }

    private boolean isRepository(final ParsedSource source) {
        for (final ClassDeclaration type : AstQueries.collect(
                source.program(), ClassDeclaration.class)) {
            if (type.name() != null
                    && type.name().contains(patterns.repositoryClassKeyword())) {
                return true;
            }
        }
        return false;
    }

    private boolean injectsDependencies(final ParsedSource source) {
        for (final ClassDeclaration type : AstQueries.collect(
                source.program(), ClassDeclaration.class)) {
            for (final MethodDefinition method : type.methods()) {
                if ("constructor".equals(method.name())
                        && !method.params().isEmpty()) {
                    return true;
                }
            }
        }
        return false;
    }

    private boolean isBuilder(final ParsedSource source) {
        return patterns.builderMarkers().stream()
                .allMatch(marker -> source.source().contains(marker));
    }

    private boolean isMiddleware(final ParsedSource source) {
        return patterns.middlewareMarkers().stream()
                .anyMatch(marker -> source.source().contains(marker));
    }

    /** A labelled pattern check. */
    private record Check(String label, Predicate<ParsedSource> matches) {
    }

}
