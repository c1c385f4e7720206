package org.pragmatica.restyle.zipper;

/**
 * Traversal control returned by a visit function.
 */
public enum Command {
    /**
     * Advance to the next node in depth-first pre-order, descending into the current one.
     */
    CONTINUE,

    /**
     * Advance past the current node's subtree.
     */
    SKIP,

    /**
     * Stop the traversal and reassemble the tree.
     */
    HALT
}
