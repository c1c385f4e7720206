package org.pragmatica.restyle.tree;

import com.google.common.collect.ImmutableList;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.function.UnaryOperator;

/**
 * Structural helpers over {@link Node} values.
 */
public final class Nodes {
    private Nodes() {}

    /**
     * Rebuild the tree top-down, applying {@code fn} to each node before descending into the result.
     */
    public static Node prewalk(Node node, UnaryOperator<Node> fn) {
        var updated = fn.apply(node);
        var children = updated.children();
        if (children.isEmpty()) {
            return updated;
        }
        var walked = new ArrayList<Node>(children.size());
        boolean changed = false;
        for (var child : children) {
            var next = prewalk(child, fn);
            changed |= next != child;
            walked.add(next);
        }
        return changed
               ? updated.withChildren(walked)
               : updated;
    }

    /**
     * Apply {@code metaFn} to the metadata of every form in the subtree and {@code lineFn} to
     * every known leaf line.
     */
    public static Node updateAllMeta(Node node, UnaryOperator<Meta> metaFn, UnaryOperator<Integer> lineFn) {
        return prewalk(node, current -> {
            if (current instanceof Node.Form form) {
                return form.withMeta(metaFn.apply(form.meta()));
            }
            if (current instanceof Node.Apply apply) {
                return apply.withMeta(metaFn.apply(apply.meta()));
            }
            if (current instanceof Node.Leaf leaf && leaf.line().isPresent()) {
                return leaf.withLine(leaf.line().map(lineFn));
            }
            return current;
        });
    }

    /**
     * Strip every piece of metadata, leaving only shape, labels and literal text.
     */
    public static Node withoutMeta(Node node) {
        return prewalk(node, current -> {
            if (current instanceof Node.Form form) {
                return form.withMeta(Meta.EMPTY);
            }
            if (current instanceof Node.Apply apply) {
                return apply.withMeta(Meta.EMPTY);
            }
            if (current instanceof Node.Leaf leaf) {
                return leaf.withLine(Optional.empty());
            }
            return current;
        });
    }

    /**
     * Structural equality ignoring metadata (lines, newlines, formatting hints).
     */
    public static boolean equivalent(Node left, Node right) {
        return withoutMeta(left).equals(withoutMeta(right));
    }

    /**
     * Count every node reachable from {@code node}, including itself.
     */
    public static int size(Node node) {
        int count = 1;
        for (var child : node.children()) {
            count += size(child);
        }
        return count;
    }

    public static boolean isForm(Node node, String label) {
        return node instanceof Node.Form form && form.is(label);
    }

    /**
     * Segments of a qualified reference such as {@code Foo.Bar}, if the node is one.
     */
    public static Optional<List<String>> aliasSegments(Node node) {
        if (!(node instanceof Node.Form form) || !form.is(Labels.ALIASES)) {
            return Optional.empty();
        }
        var segments = new ArrayList<String>(form.args().size());
        for (var arg : form.args()) {
            if (!(arg instanceof Node.Leaf leaf) || leaf.kind() != Node.Leaf.Kind.ATOM) {
                return Optional.empty();
            }
            segments.add(leaf.text());
        }
        return Optional.of(segments);
    }

    public static Node.Form aliases(Meta meta, List<String> segments) {
        var args = ImmutableList.<Node>builderWithExpectedSize(segments.size());
        segments.forEach(segment -> args.add(Node.Leaf.atom(segment)));
        return new Node.Form(Labels.ALIASES, meta, args.build());
    }

    /**
     * Look up a keyword entry such as {@code do:} in a keyword list.
     */
    public static Optional<Node> keyword(Node keywordList, String key) {
        if (!(keywordList instanceof Node.Sequence sequence)) {
            return Optional.empty();
        }
        for (var item : sequence.items()) {
            if (item instanceof Node.Pair pair && pair.left() instanceof Node.Leaf leaf && leaf.isAtom(key)) {
                return Optional.of(pair.right());
            }
        }
        return Optional.empty();
    }

    /**
     * Statements of a body: the arguments of a {@code __block__}, or the single node itself.
     */
    public static List<Node> statements(Node body) {
        if (isForm(body, Labels.BLOCK)) {
            return body.children();
        }
        return List.of(body);
    }
}
