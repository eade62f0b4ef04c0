package im.arun.newick.format;

import im.arun.newick.model.Forest;
import im.arun.newick.model.Node;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;

/**
 * Writes nodes and forests in the Newick format.
 */
public final class NewickWriter {

    private NewickWriter() {}

    /**
     * Newick text of the subtree rooted at {@code node}, without the closing {@code ;}.
     * Produces {@code (child1,child2,...)name[comment]:length}.
     */
    public static String toNewick(Node node) {
        StringBuilder sb = new StringBuilder();
        Deque<Frame> stack = new ArrayDeque<>();
        stack.push(new Frame(node));

        while (!stack.isEmpty()) {
            Frame frame = stack.peek();
            List<Node> children = frame.node.getChildren();
            if (!children.isEmpty()) {
                if (frame.next == 0) {
                    sb.append('(');
                }
                if (frame.next < children.size()) {
                    if (frame.next > 0) {
                        sb.append(',');
                    }
                    stack.push(new Frame(children.get(frame.next++)));
                    continue;
                }
                sb.append(')');
            }
            appendLabel(sb, frame.node);
            stack.pop();
        }
        return sb.toString();
    }

    /**
     * All trees of the forest, separated by {@code ;\n} and ending with {@code ;}.
     */
    public static String toNewick(Forest forest) {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < forest.size(); i++) {
            if (i > 0) {
                sb.append(";\n");
            }
            sb.append(toNewick(forest.get(i)));
        }
        return sb.append(';').toString();
    }

    private static void appendLabel(StringBuilder sb, Node node) {
        if (node.getName() != null) {
            sb.append(node.getName());
        }
        if (node.getComment() != null) {
            sb.append('[').append(node.getComment()).append(']');
        }
        if (node.getLength() != null) {
            sb.append(':').append(node.getLength().toPlainString());
        }
    }

    private static final class Frame {
        final Node node;
        int next;

        Frame(Node node) {
            this.node = node;
        }
    }
}
