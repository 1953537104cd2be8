package co.fanki.semanticanalyzer.intent.domain.extract;

import co.fanki.semanticanalyzer.intent.domain.AnalysisContext;
import co.fanki.semanticanalyzer.intent.domain.Dependency;
import co.fanki.semanticanalyzer.intent.domain.DependencyType;
import co.fanki.semanticanalyzer.intent.domain.IntentExtractor;
import co.fanki.semanticanalyzer.intent.domain.registry.KeywordLabel;
import co.fanki.semanticanalyzer.intent.domain.registry.KeywordRegistry;
import co.fanki.semanticanalyzer.parsing.domain.AstTraversal;
import co.fanki.semanticanalyzer.parsing.domain.JsNode.CallExpression;
import co.fanki.semanticanalyzer.parsing.domain.JsNode.Identifier;
import co.fanki.semanticanalyzer.parsing.domain.JsNode.ImportDeclaration;
import co.fanki.semanticanalyzer.parsing.domain.AstQueries;
import co.fanki.semanticanalyzer.parsing.domain.ParsedSource;
import co.fanki.semanticanalyzer.shared.Preconditions;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Lists the modules a code unit imports, through static imports,
 * re-exports, {@code require} and dynamic {@code import()}.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public class DependencyExtractor implements IntentExtractor<List<Dependency>> {

    private static final Set<String> LOADERS = Set.of("require", "import");

    private static final String GENERAL_DEPENDENCY = "General dependency";

    private final KeywordRegistry keywords;

    /**
     * Creates an extractor.
     *
     * @param theKeywords the keyword tables, never null
     */
    public DependencyExtractor(final KeywordRegistry theKeywords) {
        this.keywords = Preconditions.requireNonNull(theKeywords,
                "Keywords are required");
    }

    @Override
    public String facet() {
        return "dependencies";
    }

    @Override
    public List<Dependency> extract(final ParsedSource source,
            final AnalysisContext context) {
        final Specifiers specifiers = new Specifiers();
        specifiers.traverse(source.program());
        return new ArrayList<>(specifiers.found.values());
    }

    @Override
    public List<Dependency> fallback() {
        return List.of();
    }

    /**
     * Describes one module specifier.
     *
     * @param specifier the specifier as written, never blank
     * @return the dependency
     */
    public Dependency describe(final String specifier) {
        return new Dependency(specifier, typeOf(specifier),
                purposeOf(specifier), KeywordRegistry.containsAny(specifier,
                        keywords.criticalDependencyKeywords()));
    }

    private DependencyType typeOf(final String specifier) {
        if (specifier.startsWith(".")) {
            return DependencyType.INTERNAL;
        }
        if (specifier.startsWith("node:")
                || keywords.nodeBuiltins().contains(specifier)) {
            return DependencyType.SYSTEM;
        }
        return DependencyType.EXTERNAL;
    }

    private String purposeOf(final String specifier) {
        final String lower = specifier.toLowerCase(Locale.ROOT);
        for (final KeywordLabel row : keywords.dependencyPurposes()) {
            if (lower.contains(row.keyword().toLowerCase(Locale.ROOT))) {
                return row.label();
            }
        }
        return GENERAL_DEPENDENCY;
    }

    /** Collects the specifiers of one walk, first seen first. */
    private final class Specifiers extends AstTraversal {

        private final Map<String, Dependency> found = new LinkedHashMap<>();

        @Override
        public void visitImportDeclaration(final ImportDeclaration node) {
            add(node.source());
        }

        @Override
        public void visitCallExpression(final CallExpression node) {
            if (node.callee() instanceof Identifier identifier
                    && LOADERS.contains(identifier.name())
                    && !node.arguments().isEmpty()) {
                add(AstQueries.stringValue(node.arguments().get(0)));
            }
        }

        private void add(final String specifier) {
            if (specifier != null && !specifier.isBlank()
                    && !found.containsKey(specifier)) {
                found.put(specifier, describe(specifier));
            }
        }
    }

}
