package org.pragmatica.restyle.rule;

import org.pragmatica.restyle.tree.Labels;
import org.pragmatica.restyle.tree.Meta;
import org.pragmatica.restyle.tree.Node;
import org.pragmatica.restyle.tree.Nodes;
import org.pragmatica.restyle.zipper.Zipper;

import java.util.List;
import java.util.Optional;

/**
 * Locating places where sibling statements can be inserted.
 */
public final class Blocks {
    private Blocks() {}

    /**
     * The focus itself, wrapped in a {@code __block__} when needed, if it sits where statements
     * live: inside a block, as the body of a clause or keyword section, or at the top level.
     * Empty when the focus is an argument, an operand or similar.
     */
    public static Optional<Zipper> ensureBlockParent(Zipper zipper) {
        var parent = zipper.up();
        if (parent.isEmpty() || isStatementSlot(parent.get().node())) {
            return Optional.of(findNearestBlock(zipper));
        }
        return Optional.empty();
    }

    /**
     * The nearest zipper, the focus or one of its ancestors, whose node is a direct child of a
     * {@code __block__}. An only-child statement is wrapped in a new block first.
     */
    public static Zipper findNearestBlock(Zipper zipper) {
        var current = zipper;
        while (true) {
            var parent = current.up();
            if (parent.isEmpty()) {
                return wrapInBlock(current);
            }
            var parentNode = parent.get().node();
            if (Nodes.isForm(parentNode, Labels.BLOCK)) {
                return current;
            }
            if (isStatementSlot(parentNode)) {
                return wrapInBlock(current);
            }
            current = parent.get();
        }
    }

    private static boolean isStatementSlot(Node parent) {
        return Nodes.isForm(parent, Labels.BLOCK) || Nodes.isForm(parent, Labels.ARROW) || parent instanceof Node.Pair;
    }

    private static Zipper wrapInBlock(Zipper zipper) {
        var node = zipper.node();
        var meta = node.line()
                       .map(line -> Meta.line(line))
                       .orElse(Meta.EMPTY);
        return zipper.replace(Node.Form.of(Labels.BLOCK, meta, List.of(node)))
                     .down()
                     .orElseThrow();
    }
}
