package co.fanki.semanticanalyzer.parsing.domain;

import co.fanki.semanticanalyzer.parsing.domain.JsNode.CallExpression;
import co.fanki.semanticanalyzer.parsing.domain.JsNode.Identifier;
import co.fanki.semanticanalyzer.parsing.domain.JsNode.MemberExpression;
import co.fanki.semanticanalyzer.parsing.domain.JsNode.StringLiteral;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * Small structural queries over {@link JsNode} trees shared by the
 * extractors.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public final class AstQueries {

    private AstQueries() {
    }

    /**
     * Collects every node of the given kind under a root, root included,
     * in source order.
     *
     * @param root the subtree root, may be null
     * @param type the node kind to collect
     * @param <T> the node kind
     * @return the matching nodes, never null
     */
    public static <T extends JsNode> List<T> collect(final JsNode root,
            final Class<T> type) {
        final List<T> result = new ArrayList<>();
        if (root == null) {
            return result;
        }
        final Deque<JsNode> stack = new ArrayDeque<>();
        stack.push(root);
        while (!stack.isEmpty()) {
            final JsNode node = stack.pop();
            if (type.isInstance(node)) {
                result.add(type.cast(node));
            }
            final List<JsNode> children = node.children();
            for (int i = children.size() - 1; i >= 0; i--) {
                stack.push(children.get(i));
            }
        }
        return result;
    }

    /**
     * Checks whether a subtree contains a node of the given kind.
     *
     * @param root the subtree root, may be null
     * @param type the node kind to look for
     * @return true if at least one node matches
     */
    public static boolean contains(final JsNode root,
            final Class<? extends JsNode> type) {
        return !collect(root, type).isEmpty();
    }

    /**
     * Checks whether a subtree references the given identifier.
     *
     * @param root the subtree root, may be null
     * @param name the identifier name
     * @return true if an identifier with that name appears
     */
    public static boolean references(final JsNode root, final String name) {
        for (final Identifier identifier : collect(root, Identifier.class)) {
            if (identifier.name().equals(name)) {
                return true;
            }
        }
        return false;
    }

    /**
     * Renders a callee or member chain as dotted text, e.g.
     * {@code this.repo.save} or {@code fetch}.
     *
     * @param node the expression to render
     * @return the rendered chain, or null if the expression is not a
     *         name, member access or call chain
     */
    public static String render(final JsNode node) {
        if (node instanceof Identifier identifier) {
            return identifier.name();
        }
        if (node instanceof MemberExpression member) {
            final String object = render(member.object());
            if (object == null) {
                return null;
            }
            return member.computed()
                    ? object + "[" + member.property() + "]"
                    : object + "." + member.property();
        }
        if (node instanceof CallExpression call) {
            final String callee = render(call.callee());
            return callee == null ? null : callee + "()";
        }
        return null;
    }

    /**
     * Returns the simple name a call targets: the identifier for
     * {@code fn()}, the property for {@code obj.fn()}.
     *
     * @param call the call expression
     * @return the called name, or null for other callee shapes
     */
    public static String calleeName(final CallExpression call) {
        final JsNode callee = call.callee();
        if (callee instanceof Identifier identifier) {
            return identifier.name();
        }
        if (callee instanceof MemberExpression member
                && !member.computed()) {
            return member.property();
        }
        return null;
    }

    /**
     * Follows member accesses and calls down to the leftmost identifier,
     * e.g. {@code process} for {@code process.env.PORT}.
     *
     * @param node the expression
     * @return the root identifier name, or null if there is none
     */
    public static String rootIdentifier(final JsNode node) {
        JsNode current = node;
        while (true) {
            if (current instanceof Identifier identifier) {
                return identifier.name();
            } else if (current instanceof MemberExpression member) {
                current = member.object();
            } else if (current instanceof CallExpression call) {
                current = call.callee();
            } else {
                return null;
            }
        }
    }

    /**
     * Returns the value of a string literal argument.
     *
     * @param node the node to inspect, may be null
     * @return the unquoted value, or null if the node is not a string
     */
    public static String stringValue(final JsNode node) {
        if (node instanceof StringLiteral literal) {
            return literal.value();
        }
        return null;
    }

}
