package im.arun.newick.tree;

import im.arun.newick.model.Node;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.function.Consumer;
import java.util.function.Predicate;

/**
 * Iterative traversals over a subtree and the visit primitive built on them.
 *
 * <p>Neither traversal recurses, so the depth of a tree is bounded by heap
 * rather than by the call stack.
 */
public final class TreeWalker {

    private TreeWalker() {}

    public static Iterable<Node> walk(Node root) {
        return walk(root, TraversalOrder.PREORDER);
    }

    public static Iterable<Node> walk(Node root, TraversalOrder order) {
        if (order == TraversalOrder.POSTORDER) {
            return () -> new PostOrderIterator(root);
        }
        return () -> new PreOrderIterator(root);
    }

    /**
     * Run {@code action} on every node of the subtree in pre-order.
     */
    public static void visit(Node root, Consumer<Node> action) {
        visit(root, action, n -> true, TraversalOrder.PREORDER);
    }

    public static void visit(Node root, Consumer<Node> action, Predicate<Node> predicate) {
        visit(root, action, predicate, TraversalOrder.PREORDER);
    }

    /**
     * Run {@code action} on every node accepted by {@code predicate}. The
     * predicate is evaluated against the live tree when the node is reached.
     */
    public static void visit(Node root, Consumer<Node> action, Predicate<Node> predicate,
                             TraversalOrder order) {
        for (Node n : walk(root, order)) {
            if (predicate.test(n)) {
                action.accept(n);
            }
        }
    }

    /**
     * Pre-order iterator. The children of a node are pushed only when the
     * next node is requested, so the caller may restructure the node it was
     * just handed and the walk follows the new children.
     */
    static final class PreOrderIterator implements Iterator<Node> {
        private final Deque<Node> stack = new ArrayDeque<>();
        private Node last;

        PreOrderIterator(Node root) {
            stack.push(root);
        }

        @Override
        public boolean hasNext() {
            expandLast();
            return !stack.isEmpty();
        }

        @Override
        public Node next() {
            expandLast();
            if (stack.isEmpty()) {
                throw new NoSuchElementException();
            }
            last = stack.pop();
            return last;
        }

        private void expandLast() {
            if (last == null) {
                return;
            }
            List<Node> children = last.getChildren();
            for (int i = children.size() - 1; i >= 0; i--) {
                stack.push(children.get(i));
            }
            last = null;
        }
    }

    /**
     * Post-order iterator over a frontier stack. Each entered node gets its own
     * queue of pending children, copied at the moment it is entered; a node is
     * yielded once that queue is empty and is then dropped from its parent's
     * queue. Removing or moving already-yielded nodes is therefore safe.
     */
    static final class PostOrderIterator implements Iterator<Node> {
        private final Deque<Frame> stack = new ArrayDeque<>();

        PostOrderIterator(Node root) {
            stack.push(new Frame(root));
        }

        @Override
        public boolean hasNext() {
            return !stack.isEmpty();
        }

        @Override
        public Node next() {
            if (stack.isEmpty()) {
                throw new NoSuchElementException();
            }
            while (true) {
                Frame top = stack.peek();
                if (top.pending.isEmpty()) {
                    stack.pop();
                    if (!stack.isEmpty()) {
                        stack.peek().pending.pollFirst();
                    }
                    return top.node;
                }
                stack.push(new Frame(top.pending.peekFirst()));
            }
        }

        private static final class Frame {
            final Node node;
            final Deque<Node> pending;

            Frame(Node node) {
                this.node = node;
                this.pending = new ArrayDeque<>(node.getChildren());
            }
        }
    }
}
