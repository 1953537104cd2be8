package co.fanki.semanticanalyzer.parsing.domain;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;

/**
 * Pre-order walk over a {@link JsNode} tree.
 *
 * <p>Nodes are visited in source order: a node is dispatched to its
 * visitor method before any of its children. The walk is iterative, so
 * deeply nested input does not exhaust the call stack.</p>
 *
 * <p>While a visitor method runs, {@link #parent()} and
 * {@link #ancestors()} describe the path from the visited node up to the
 * root, excluding the node itself. Subclasses that need to track nesting
 * override {@link #enter(JsNode)} and {@link #leave(JsNode)}.</p>
 *
 * <p>Instances keep per-walk state and are meant to be created for a
 * single walk.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public abstract class AstTraversal implements JsNodeVisitor {

    private final Deque<JsNode> path = new ArrayDeque<>();

    /**
     * Walks the tree rooted at the given node.
     *
     * @param root the node to start from, never null
     */
    public final void traverse(final JsNode root) {
        final Deque<Frame> stack = new ArrayDeque<>();
        stack.push(new Frame(root, false));

        while (!stack.isEmpty()) {
            final Frame frame = stack.pop();
            if (frame.exiting()) {
                path.pop();
                leave(frame.node());
                continue;
            }
            final JsNode node = frame.node();
            enter(node);
            node.accept(this);
            path.push(node);
            stack.push(new Frame(node, true));

            final List<JsNode> children = node.children();
            for (int i = children.size() - 1; i >= 0; i--) {
                stack.push(new Frame(children.get(i), false));
            }
        }
    }

    /**
     * Called before a node is dispatched to its visitor method.
     *
     * @param node the node about to be visited
     */
    protected void enter(final JsNode node) {
    }

    /**
     * Called after all the children of a node have been visited.
     *
     * @param node the node being left
     */
    protected void leave(final JsNode node) {
    }

    /**
     * Returns the parent of the node being visited.
     *
     * @return the parent, or null for the root
     */
    protected JsNode parent() {
        return path.peek();
    }

    /**
     * Returns the ancestors of the node being visited, nearest first.
     *
     * @return the ancestor chain
     */
    protected Iterable<JsNode> ancestors() {
        return path;
    }

    /**
     * Finds the nearest ancestor of the given kind.
     *
     * @param type the node kind to look for
     * @param <T> the node kind
     * @return the nearest matching ancestor, or null
     */
    protected <T extends JsNode> T nearest(final Class<T> type) {
        final Iterator<JsNode> it = path.iterator();
        while (it.hasNext()) {
            final JsNode candidate = it.next();
            if (type.isInstance(candidate)) {
                return type.cast(candidate);
            }
        }
        return null;
    }

    /** A pending visit or a pending exit of a node. */
    private record Frame(JsNode node, boolean exiting) {
    }

}
