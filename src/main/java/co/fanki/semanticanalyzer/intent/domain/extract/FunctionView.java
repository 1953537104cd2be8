package co.fanki.semanticanalyzer.intent.domain.extract;

import co.fanki.semanticanalyzer.parsing.domain.AstQueries;
import co.fanki.semanticanalyzer.parsing.domain.JsNode;
import co.fanki.semanticanalyzer.parsing.domain.JsNode.FunctionDeclaration;
import co.fanki.semanticanalyzer.parsing.domain.JsNode.FunctionExpression;
import co.fanki.semanticanalyzer.parsing.domain.JsNode.MethodDefinition;
import co.fanki.semanticanalyzer.parsing.domain.JsNode.Parameter;

import java.util.ArrayList;
import java.util.List;

/**
 * Uniform view over the three function-like node kinds: declarations,
 * methods and function or arrow expressions.
 *
 * @param node the underlying node
 * @param name the declared or bound name, null for anonymous functions
 * @param params the parameters
 * @param body the body, a block or an expression, null for signatures
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
record FunctionView(JsNode node, String name, List<Parameter> params,
        JsNode body) {

    /**
     * Creates a view of a node.
     *
     * @param node the node to look at
     * @return the view, or null if the node is not function-like
     */
    static FunctionView of(final JsNode node) {
        if (node instanceof FunctionDeclaration declaration) {
            return new FunctionView(node, declaration.name(),
                    declaration.params(), declaration.body());
        }
        if (node instanceof MethodDefinition method) {
            return new FunctionView(node, method.name(), method.params(),
                    method.body());
        }
        if (node instanceof FunctionExpression expression) {
            return new FunctionView(node, expression.name(),
                    expression.params(), expression.body());
        }
        return null;
    }

    /**
     * Collects every function-like node under a root in source order.
     *
     * @param root the subtree root
     * @return the views, never null
     */
    static List<FunctionView> all(final JsNode root) {
        final List<FunctionView> result = new ArrayList<>();
        for (final JsNode node : AstQueries.collect(root, JsNode.class)) {
            final FunctionView view = of(node);
            if (view != null) {
                result.add(view);
            }
        }
        return result;
    }

    /**
     * Checks whether the function has a name.
     *
     * @return true for named functions
     */
    boolean isNamed() {
        return name != null && !name.isBlank();
    }

}
