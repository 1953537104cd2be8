package co.fanki.semanticanalyzer.intent.domain.extract;

import co.fanki.semanticanalyzer.intent.domain.AnalysisContext;
import co.fanki.semanticanalyzer.intent.domain.IntentExtractor;
import co.fanki.semanticanalyzer.intent.domain.registry.AnalysisThresholds;
import co.fanki.semanticanalyzer.intent.domain.registry.KeywordRegistry;
import co.fanki.semanticanalyzer.parsing.domain.AstQueries;
import co.fanki.semanticanalyzer.parsing.domain.AstTraversal;
import co.fanki.semanticanalyzer.parsing.domain.JsNode;
import co.fanki.semanticanalyzer.parsing.domain.JsNode.AssignmentExpression;
import co.fanki.semanticanalyzer.parsing.domain.JsNode.BlockStatement;
import co.fanki.semanticanalyzer.parsing.domain.JsNode.CallExpression;
import co.fanki.semanticanalyzer.parsing.domain.JsNode.ClassDeclaration;
import co.fanki.semanticanalyzer.parsing.domain.JsNode.Identifier;
import co.fanki.semanticanalyzer.parsing.domain.JsNode.NumericLiteral;
import co.fanki.semanticanalyzer.parsing.domain.JsNode.VariableDeclarator;
import co.fanki.semanticanalyzer.parsing.domain.ParsedSource;
import co.fanki.semanticanalyzer.shared.Preconditions;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.function.Predicate;

/**
 * Recognizes common anti-patterns.
 *
 * <p>Like {@link PatternDetector}, every check runs and every match is
 * reported in a fixed order.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public class AntiPatternDetector implements IntentExtractor<List<String>> {

    private final KeywordRegistry keywords;

    private final AnalysisThresholds thresholds;

    private final List<Check> checks;

    /**
     * Creates a detector.
     *
     * @param theKeywords the keyword tables, never null
     * @param theThresholds the limits, never null
     */
    public AntiPatternDetector(final KeywordRegistry theKeywords,
            final AnalysisThresholds theThresholds) {
        this.keywords = Preconditions.requireNonNull(theKeywords,
                "Keywords are required");
        this.thresholds = Preconditions.requireNonNull(theThresholds,
                "Thresholds are required");
        this.checks = List.of(
                new Check("God Object - too many responsibilities",
                        this::hasGodObject),
                new Check("Callback Hell - use async/await",
                        this::hasCallbackHell),
                new Check("Magic Numbers - use named constants",
                        this::hasMagicNumbers),
                new Check("Code Duplication - extract common logic",
                        this::hasDuplication),
                new Check("Long Parameter List - use object parameters",
                        this::hasLongParameterList),
                new Check("Deep Nesting - simplify logic",
                        this::hasDeepNesting),
                new Check("Unused Variables - remove dead code",
                        this::hasUnusedVariables));
    }

    @Override
    public String facet() {
        return "antiPatterns";
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

    private boolean hasGodObject(final ParsedSource source) {
        return AstQueries.collect(source.program(), ClassDeclaration.class)
                .stream()
                .anyMatch(type -> type.methods().size()
                        > thresholds.godObjectMethods());
    }

    private boolean hasCallbackHell(final ParsedSource source) {
        final NestingDepth calls = new NestingDepth(CallExpression.class);
        calls.traverse(source.program());
        return calls.max > thresholds.callbackNesting();
    }

    private boolean hasDeepNesting(final ParsedSource source) {
        final NestingDepth blocks = new NestingDepth(BlockStatement.class);
        blocks.traverse(source.program());
        return blocks.max > thresholds.blockNesting();
    }

    private boolean hasMagicNumbers(final ParsedSource source) {
        final Set<Double> common = new HashSet<>();
        for (final String number : keywords.commonNumbers()) {
            final Double value = valueOf(number);
            if (value != null) {
                common.add(value);
            }
        }
        int magic = 0;
        for (final NumericLiteral literal : AstQueries.collect(
                source.program(), NumericLiteral.class)) {
            final Double value = valueOf(literal.raw());
            final boolean isCommon = value != null
                    ? common.contains(value)
                    : keywords.commonNumbers().contains(literal.raw());
            if (!isCommon) {
                magic++;
            }
        }
        return magic > thresholds.magicNumbers();
    }

    private boolean hasDuplication(final ParsedSource source) {
        final List<String> lines = source.lines().stream()
                .map(String::trim).toList();
        final int window = thresholds.duplicationWindow();
        final Set<String> seen = new HashSet<>();
        for (int i = 0; i + window <= lines.size(); i++) {
            final List<String> chunk = lines.subList(i, i + window);
            if (chunk.stream().allMatch(String::isEmpty)) {
                continue;
            }
            if (!seen.add(String.join("\n", chunk))) {
                return true;
            }
        }
        return false;
    }

    private boolean hasLongParameterList(final ParsedSource source) {
        return FunctionView.all(source.program()).stream()
                .anyMatch(function -> function.params().size()
                        > thresholds.parameterList());
    }

    private boolean hasUnusedVariables(final ParsedSource source) {
        final Set<String> declared = new LinkedHashSet<>();
        for (final VariableDeclarator declarator : AstQueries.collect(
                source.program(), VariableDeclarator.class)) {
            if (!declarator.destructured() && declarator.name() != null) {
                declared.add(declarator.name());
            }
        }
        final References references = new References();
        references.traverse(source.program());
        declared.removeAll(references.used);
        return declared.size() > thresholds.unusedVariables();
    }

    private static Double valueOf(final String raw) {
        final String number = raw.replace("_", "");
        try {
            if (number.startsWith("0x") || number.startsWith("0X")) {
                return (double) Long.parseLong(number.substring(2), 16);
            }
            return Double.valueOf(number);
        } catch (final NumberFormatException e) {
            return null;
        }
    }

    /** A labelled anti-pattern check. */
    private record Check(String label, Predicate<ParsedSource> matches) {
    }

    /** Measures how deep nodes of one kind nest inside each other. */
    private static final class NestingDepth extends AstTraversal {

        private final Class<? extends JsNode> kind;

        private int depth;

        private int max;

        private NestingDepth(final Class<? extends JsNode> theKind) {
            this.kind = theKind;
        }

        @Override
        protected void enter(final JsNode node) {
            if (kind.isInstance(node)) {
                depth++;
                max = Math.max(max, depth);
            }
        }

        @Override
        protected void leave(final JsNode node) {
            if (kind.isInstance(node)) {
                depth--;
            }
        }
    }

    /** Collects the names read anywhere in the tree. */
    private static final class References extends AstTraversal {

        private final Set<String> used = new HashSet<>();

        @Override
        public void visitIdentifier(final Identifier node) {
            if (parent() instanceof AssignmentExpression assignment
                    && "=".equals(assignment.operator())
                    && assignment.left() == node) {
                return;
            }
            used.add(node.name());
        }
    }

}
