package org.pragmatica.restyle.tree;

import java.util.Optional;
import java.util.function.UnaryOperator;

/**
 * Line-number arithmetic over whole subtrees.
 *
 * <p>Line numbers drive comment placement in the printer, so rewrites that move code must
 * treat them as data to reassign rather than incidental metadata.
 */
public final class Lines {
    private Lines() {}

    public static Optional<Integer> line(Node node) {
        return node.line();
    }

    /**
     * Recursively set every line in the subtree to {@code line} and drop {@link Meta#NEWLINES}.
     */
    public static Node setLine(Node node, int line) {
        return setLine(node, line, true);
    }

    public static Node setLine(Node node, int line, boolean deleteNewlines) {
        return Nodes.updateAllMeta(node, meta -> {
            var updated = meta.mapLines(current -> line);
            return deleteNewlines
                   ? updated.without(Meta.NEWLINES)
                   : updated;
        }, current -> line);
    }

    /**
     * Recursively add {@code delta} to every line in the subtree.
     */
    public static Node shiftLine(Node node, int delta) {
        if (delta == 0) {
            return node;
        }
        UnaryOperator<Integer> shift = current -> current + delta;
        return Nodes.updateAllMeta(node, meta -> meta.mapLines(shift), shift);
    }

    /**
     * Add {@code delta} to every line after {@code line}, leaving earlier lines alone.
     */
    public static Node shiftLinesAfter(Node node, int line, int delta) {
        if (delta == 0) {
            return node;
        }
        UnaryOperator<Integer> shift = current -> current > line
                                                  ? current + delta
                                                  : current;
        return Nodes.updateAllMeta(node, meta -> meta.mapLines(shift), shift);
    }

    /**
     * The last line a node occupies: its {@link Meta#END_LINE} when recorded, otherwise the
     * largest line found anywhere in the subtree (0 when the subtree carries no lines).
     */
    public static int maxLine(Node node) {
        if (node instanceof Node.Form form && form.meta().endLine().isPresent()) {
            return form.meta().endLine().get();
        }
        if (node instanceof Node.Apply apply && apply.meta().endLine().isPresent()) {
            return apply.meta().endLine().get();
        }
        int max = node.line().orElse(0);
        for (var child : node.children()) {
            max = Math.max(max, maxLine(child));
        }
        return max;
    }

    /**
     * The first line a node occupies: its own line, or the smallest line of its subtree.
     */
    public static int minLine(Node node) {
        var own = node.line();
        if (own.isPresent()) {
            return own.get();
        }
        int min = Integer.MAX_VALUE;
        for (var child : node.children()) {
            int childMin = minLine(child);
            if (childMin > 0) {
                min = Math.min(min, childMin);
            }
        }
        return min == Integer.MAX_VALUE ? 0 : min;
    }

    /**
     * Number of newlines recorded after a statement, 0 when unknown.
     */
    public static int newlines(Node node) {
        return meta(node).flatMap(Meta::newlines)
                         .orElse(0);
    }

    public static Node withNewlines(Node node, int newlines) {
        if (node instanceof Node.Form form) {
            return form.withMeta(form.meta().with(Meta.NEWLINES, newlines));
        }
        if (node instanceof Node.Apply apply) {
            return apply.withMeta(apply.meta().with(Meta.NEWLINES, newlines));
        }
        return node;
    }

    /**
     * Metadata of a node: its own for forms, the key's for a keyword pair.
     */
    public static Optional<Meta> meta(Node node) {
        if (node instanceof Node.Form form) {
            return Optional.of(form.meta());
        }
        if (node instanceof Node.Apply apply) {
            return Optional.of(apply.meta());
        }
        if (node instanceof Node.Pair pair) {
            return meta(pair.left());
        }
        return Optional.empty();
    }
}
