package im.arun.newick.model;

import im.arun.newick.format.NewickWriter;
import im.arun.newick.tree.TraversalOrder;
import im.arun.newick.tree.TreeWalker;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.Setter;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/**
 * A node of a Newick tree. A node may be a whole tree, a subtree or a leaf.
 *
 * <p>A node has an optional name, an optional branch length to its parent, an
 * optional comment and an ordered list of children. The parent reference is
 * null exactly for the root of a tree. Children are only ever changed through
 * the methods of this class so that every child's parent points back here.
 */
@Getter
public class Node {

    @Setter
    private String name;

    @Setter
    private BigDecimal length;

    @Setter
    private String comment;

    private Node parent;

    @Getter(AccessLevel.NONE)
    private final List<Node> children = new ArrayList<>();

    public Node() {
    }

    public Node(String name) {
        this.name = name;
    }

    public Node(String name, BigDecimal length) {
        this.name = name;
        this.length = length;
    }

    public Node(String name, BigDecimal length, String comment) {
        this.name = name;
        this.length = length;
        this.comment = comment;
    }

    /**
     * Read-only view of the children, in order.
     */
    public List<Node> getChildren() {
        return Collections.unmodifiableList(children);
    }

    public int getChildCount() {
        return children.size();
    }

    /**
     * Append a child. A node that already has a parent is detached from it first.
     */
    public Node addChild(Node child) {
        insertChild(children.size(), child);
        return this;
    }

    public void insertChild(int index, Node child) {
        requireNotAncestor(child);
        child.detach();
        children.add(index, child);
        child.parent = this;
    }

    /**
     * Remove a child by identity.
     *
     * @return true if the node was a child of this node
     */
    public boolean removeChild(Node child) {
        for (int i = 0; i < children.size(); i++) {
            if (children.get(i) == child) {
                children.remove(i);
                child.parent = null;
                return true;
            }
        }
        return false;
    }

    /**
     * Remove and return the last child, or null when there are none.
     */
    public Node removeLastChild() {
        if (children.isEmpty()) {
            return null;
        }
        Node last = children.remove(children.size() - 1);
        last.parent = null;
        return last;
    }

    /**
     * Put {@code replacement} at the position held by {@code existing}.
     *
     * @return false if {@code existing} is not a child of this node
     */
    public boolean replaceChild(Node existing, Node replacement) {
        int index = indexOf(existing);
        if (index < 0) {
            return false;
        }
        if (replacement == existing) {
            return true;
        }
        requireNotAncestor(replacement);
        replacement.detach();
        index = indexOf(existing);
        children.set(index, replacement);
        existing.parent = null;
        replacement.parent = this;
        return true;
    }

    public void clearChildren() {
        for (Node child : children) {
            child.parent = null;
        }
        children.clear();
    }

    /**
     * Remove this node from its parent's children, if it has a parent.
     */
    public void detach() {
        if (parent != null) {
            parent.removeChild(this);
        }
    }

    private void requireNotAncestor(Node child) {
        for (Node n = this; n != null; n = n.parent) {
            if (n == child) {
                throw new IllegalArgumentException(
                    child == this ? "A node cannot be its own child" : "Adding " + child + " would create a cycle");
            }
        }
    }

    private int indexOf(Node child) {
        for (int i = 0; i < children.size(); i++) {
            if (children.get(i) == child) {
                return i;
            }
        }
        return -1;
    }

    public boolean isLeaf() {
        return children.isEmpty();
    }

    public boolean isRoot() {
        return parent == null;
    }

    /**
     * True when every node of the subtree has either zero or two children.
     */
    public boolean isBinary() {
        for (Node n : walk()) {
            if (n.getChildCount() != 0 && n.getChildCount() != 2) {
                return false;
            }
        }
        return true;
    }

    public Iterable<Node> walk() {
        return TreeWalker.walk(this);
    }

    public Iterable<Node> walk(TraversalOrder order) {
        return TreeWalker.walk(this, order);
    }

    /**
     * All leaves of the subtree rooted here, in walk order.
     */
    public List<Node> getLeaves() {
        List<Node> leaves = new ArrayList<>();
        for (Node n : walk()) {
            if (n.isLeaf()) {
                leaves.add(n);
            }
        }
        return leaves;
    }

    public List<String> getLeafNames() {
        return getLeaves().stream().map(Node::getName).collect(Collectors.toList());
    }

    /**
     * First node of the subtree with the given name, or null if there is none.
     */
    public Node getNode(String label) {
        for (Node n : walk()) {
            if (label == null ? n.getName() == null : label.equals(n.getName())) {
                return n;
            }
        }
        return null;
    }

    public String toNewick() {
        return NewickWriter.toNewick(this);
    }

    @Override
    public String toString() {
        return "Node(\"" + name + "\")";
    }
}
