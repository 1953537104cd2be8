package co.fanki.semanticanalyzer.intent.domain.extract;

import co.fanki.semanticanalyzer.intent.domain.AnalysisContext;
import co.fanki.semanticanalyzer.intent.domain.ComplexityAnalysis;
import co.fanki.semanticanalyzer.intent.domain.IntentExtractor;
import co.fanki.semanticanalyzer.intent.domain.registry.KeywordRegistry;
import co.fanki.semanticanalyzer.parsing.domain.AstTraversal;
import co.fanki.semanticanalyzer.parsing.domain.JsNode;
import co.fanki.semanticanalyzer.parsing.domain.JsNode.BlockStatement;
import co.fanki.semanticanalyzer.parsing.domain.JsNode.CallExpression;
import co.fanki.semanticanalyzer.parsing.domain.JsNode.CatchClause;
import co.fanki.semanticanalyzer.parsing.domain.JsNode.ClassDeclaration;
import co.fanki.semanticanalyzer.parsing.domain.JsNode.ConditionalExpression;
import co.fanki.semanticanalyzer.parsing.domain.JsNode.ForStatement;
import co.fanki.semanticanalyzer.parsing.domain.JsNode.FunctionDeclaration;
import co.fanki.semanticanalyzer.parsing.domain.JsNode.FunctionExpression;
import co.fanki.semanticanalyzer.parsing.domain.JsNode.Identifier;
import co.fanki.semanticanalyzer.parsing.domain.JsNode.IfStatement;
import co.fanki.semanticanalyzer.parsing.domain.JsNode.LogicalExpression;
import co.fanki.semanticanalyzer.parsing.domain.JsNode.MemberExpression;
import co.fanki.semanticanalyzer.parsing.domain.JsNode.SwitchCase;
import co.fanki.semanticanalyzer.parsing.domain.JsNode.SwitchStatement;
import co.fanki.semanticanalyzer.parsing.domain.JsNode.TryStatement;
import co.fanki.semanticanalyzer.parsing.domain.JsNode.WhileStatement;
import co.fanki.semanticanalyzer.parsing.domain.ParsedSource;
import co.fanki.semanticanalyzer.shared.Preconditions;

/**
 * Measures cognitive and cyclomatic complexity, nesting depth, coupling
 * and cohesion in a single walk.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public class ComplexityAnalyzer implements IntentExtractor<ComplexityAnalysis> {

    private final KeywordRegistry keywords;

    private final FunctionRelatedness relatedness;

    /**
     * Creates an analyzer that treats every function as related.
     *
     * @param theKeywords the keyword tables, never null
     */
    public ComplexityAnalyzer(final KeywordRegistry theKeywords) {
        this(theKeywords, FunctionRelatedness.PERMISSIVE);
    }

    /**
     * Creates an analyzer.
     *
     * @param theKeywords the keyword tables, never null
     * @param theRelatedness decides which functions count as cohesive
     */
    public ComplexityAnalyzer(final KeywordRegistry theKeywords,
            final FunctionRelatedness theRelatedness) {
        this.keywords = Preconditions.requireNonNull(theKeywords,
                "Keywords are required");
        this.relatedness = Preconditions.requireNonNull(theRelatedness,
                "Function relatedness is required");
    }

    @Override
    public String facet() {
        return "complexity";
    }

    @Override
    public ComplexityAnalysis extract(final ParsedSource source,
            final AnalysisContext context) {
        final Metrics metrics = new Metrics(source);
        metrics.traverse(source.program());

        final int cohesion = metrics.functions == 0 ? 100
                : (int) Math.round(metrics.related * 100.0
                        / metrics.functions);
        return new ComplexityAnalysis(
                Math.min(metrics.cognitive, ComplexityAnalysis.CAP),
                metrics.cyclomatic,
                metrics.maxDepth,
                Math.min(metrics.coupling, ComplexityAnalysis.CAP),
                cohesion);
    }

    @Override
    public ComplexityAnalysis fallback() {
        return ComplexityAnalysis.baseline();
    }

    private static boolean opensBlock(final JsNode node) {
        return node instanceof BlockStatement
                || node instanceof SwitchStatement
                || node instanceof ClassDeclaration;
    }

    /** Accumulates the metrics of one walk. */
    private final class Metrics extends AstTraversal {

        private final ParsedSource source;

        private int cognitive;
        private int cyclomatic = 1;
        private int depth;
        private int maxDepth;
        private int coupling;
        private int functions;
        private int related;

        private Metrics(final ParsedSource theSource) {
            this.source = theSource;
        }

        @Override
        protected void enter(final JsNode node) {
            if (opensBlock(node)) {
                depth++;
                maxDepth = Math.max(maxDepth, depth);
            }
        }

        @Override
        protected void leave(final JsNode node) {
            if (opensBlock(node)) {
                depth--;
            }
        }

        @Override
        public void visitIfStatement(final IfStatement node) {
            cognitive += node.alternate() == null ? 1 : 2;
            cyclomatic++;
        }

        @Override
        public void visitForStatement(final ForStatement node) {
            cognitive += 2;
            cyclomatic++;
        }

        @Override
        public void visitWhileStatement(final WhileStatement node) {
            cognitive += 2;
            cyclomatic++;
        }

        @Override
        public void visitSwitchStatement(final SwitchStatement node) {
            cognitive += 2;
        }

        @Override
        public void visitSwitchCase(final SwitchCase node) {
            if (!node.isDefault()) {
                cyclomatic++;
            }
        }

        @Override
        public void visitTryStatement(final TryStatement node) {
            cognitive += 2;
        }

        @Override
        public void visitCatchClause(final CatchClause node) {
            cyclomatic++;
        }

        @Override
        public void visitConditionalExpression(
                final ConditionalExpression node) {
            cognitive++;
            cyclomatic++;
        }

        @Override
        public void visitLogicalExpression(final LogicalExpression node) {
            if ("&&".equals(node.operator()) || "||".equals(node.operator())) {
                cyclomatic++;
            }
        }

        @Override
        public void visitCallExpression(final CallExpression node) {
            if (node.callee() instanceof MemberExpression member
                    && !isBuiltIn(member.object())) {
                coupling++;
            }
        }

        @Override
        public void visitFunctionDeclaration(final FunctionDeclaration node) {
            countFunction(node);
        }

        @Override
        public void visitFunctionExpression(final FunctionExpression node) {
            if (node.arrow()) {
                countFunction(node);
            }
        }

        private void countFunction(final JsNode node) {
            functions++;
            if (relatedness.isRelated(node, source)) {
                related++;
            }
        }

        private boolean isBuiltIn(final JsNode receiver) {
            return receiver instanceof Identifier identifier
                    && keywords.couplingExclusions().contains(
                            identifier.name());
        }
    }

}
