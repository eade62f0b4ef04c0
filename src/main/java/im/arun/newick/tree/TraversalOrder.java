package im.arun.newick.tree;

/**
 * Order in which {@link TreeWalker} yields the nodes of a subtree.
 */
public enum TraversalOrder {
    /**
     * A node first, then the full traversal of each child in child order.
     * This is a depth-first order; it is not level-by-level.
     */
    PREORDER,

    /**
     * A node only after all of its descendants.
     */
    POSTORDER
}
