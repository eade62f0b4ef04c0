package im.arun.newick.tree;

import im.arun.newick.config.NewickConfig;
import im.arun.newick.model.Node;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Set;

/**
 * Structural transformations applied in place to the subtree rooted at a node.
 */
public final class TreeTransformer {
    private static final Logger logger = LoggerFactory.getLogger(TreeTransformer.class);

    private TreeTransformer() {}

    /**
     * Remove the given nodes, or with {@code inverse} every leaf that is not
     * one of them. Nodes are matched by identity. The root is never removed.
     *
     * @param root Subtree to prune
     * @param nodes Nodes to remove, or to keep when inverse is set
     * @param inverse Remove leaves not in {@code nodes} instead
     */
    public static void prune(Node root, Collection<Node> nodes, boolean inverse) {
        Set<Node> targets = Collections.newSetFromMap(new IdentityHashMap<>());
        targets.addAll(nodes);

        int[] removed = {0};
        TreeWalker.visit(root,
            n -> {
                n.detach();
                removed[0]++;
            },
            n -> n != root && n.getParent() != null
                && ((!inverse && targets.contains(n)) || (inverse && n.isLeaf() && !targets.contains(n))),
            TraversalOrder.POSTORDER);

        logger.debug("Pruned {} node(s) (inverse={})", removed[0], inverse);
    }

    public static void prune(Node root, Collection<Node> nodes) {
        prune(root, nodes, false);
    }

    /**
     * Same as {@link #prune(Node, Collection, boolean)} with nodes selected by name.
     */
    public static void pruneByNames(Node root, Collection<String> names, boolean inverse) {
        List<Node> matching = new ArrayList<>();
        for (Node n : TreeWalker.walk(root)) {
            if (n.getName() != null && names.contains(n.getName())) {
                matching.add(n);
            }
        }
        prune(root, matching, inverse);
    }

    public static void pruneByNames(Node root, Collection<String> names) {
        pruneByNames(root, names, false);
    }

    /**
     * Make every node with more than two children binary. A new unnamed node
     * of length zero takes all children but the first, which leaves the
     * original node with its first child and the new node. The walk then
     * descends into the new node, so wide polytomies resolve into a chain.
     */
    public static void resolvePolytomies(Node root) {
        int[] inserted = {0};
        TreeWalker.visit(root, n -> {
            Node synthetic = new Node(null, BigDecimal.ZERO);
            List<Node> moved = new ArrayList<>();
            while (n.getChildCount() > 1) {
                moved.add(n.removeLastChild());
            }
            Collections.reverse(moved);
            for (Node child : moved) {
                synthetic.addChild(child);
            }
            n.addChild(synthetic);
            inserted[0]++;
        }, n -> n.getChildCount() > 2);

        logger.debug("Resolved polytomies with {} inserted node(s)", inserted[0]);
    }

    /**
     * Remove every node that has a single child and attach the child to the
     * removed node's parent in its place. When the root itself has a single
     * child, the child's children (and length) are moved onto the root object.
     *
     * @param root Subtree to collapse
     * @param preserveLengths Add the length of a removed node to its child
     */
    public static void removeRedundantNodes(Node root, boolean preserveLengths) {
        int collapsed = 0;
        for (Node n : TreeWalker.walk(root, TraversalOrder.POSTORDER)) {
            while (n != root && n.getParent() != null && n.getParent().getChildCount() == 1) {
                Node father = n.getParent();
                Node grandfather = father == root ? null : father.getParent();
                if (preserveLengths) {
                    n.setLength(sum(n.getLength(), father.getLength()));
                }

                if (grandfather != null) {
                    grandfather.replaceChild(father, n);
                } else {
                    List<Node> grandchildren = new ArrayList<>(n.getChildren());
                    father.clearChildren();
                    for (Node grandchild : grandchildren) {
                        father.addChild(grandchild);
                    }
                    if (preserveLengths) {
                        father.setLength(n.getLength());
                    }
                }
                collapsed++;
            }
        }

        logger.debug("Removed {} redundant node(s)", collapsed);
    }

    public static void removeRedundantNodes(Node root) {
        removeRedundantNodes(root, true);
    }

    public static void removeRedundantNodes(Node root, NewickConfig config) {
        removeRedundantNodes(root, config.isPreserveLengths());
    }

    public static void removeNames(Node root) {
        TreeWalker.visit(root, n -> n.setName(null));
    }

    public static void removeInternalNames(Node root) {
        TreeWalker.visit(root, n -> n.setName(null), n -> !n.isLeaf());
    }

    public static void removeLeafNames(Node root) {
        TreeWalker.visit(root, n -> n.setName(null), Node::isLeaf);
    }

    public static void removeLengths(Node root) {
        TreeWalker.visit(root, n -> n.setLength(null));
    }

    private static BigDecimal sum(BigDecimal a, BigDecimal b) {
        if (a == null) {
            return b;
        }
        if (b == null) {
            return a;
        }
        return a.add(b);
    }
}
