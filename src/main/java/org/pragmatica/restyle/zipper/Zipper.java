package org.pragmatica.restyle.zipper;

import com.google.common.collect.ImmutableList;
import org.pragmatica.restyle.tree.Labels;
import org.pragmatica.restyle.tree.Meta;
import org.pragmatica.restyle.tree.Node;

import java.util.ArrayDeque;
import java.util.List;
import java.util.Optional;
import java.util.function.BiFunction;
import java.util.function.Function;
import java.util.function.Predicate;
import java.util.function.UnaryOperator;

/**
 * Purely functional cursor over an immutable {@link Node} tree (Huet's zipper).
 *
 * <p>A zipper is the current node, the <em>focus</em>, plus a breadcrumb describing how to
 * rebuild everything above it. Every operation returns a new zipper; nothing is mutated.
 * Navigation that has no target returns {@link Optional#empty()}, while sibling edits and
 * removal at the root are programmer errors and throw {@link ZipperMisuseException}.
 *
 * <p>Example:
 * <pre>{@code
 * var root = Zipper.zip(tree)
 *                  .down()
 *                  .flatMap(Zipper::right)
 *                  .map(z -> z.replace(replacement))
 *                  .map(Zipper::root)
 *                  .orElse(tree);
 * }</pre>
 */
public final class Zipper {
    private final Node node;
    private final Path path;

    private Zipper(Node node, Path path) {
        this.node = node;
        this.path = path;
    }

    /**
     * Create a zipper focused on the root of {@code tree}.
     */
    public static Zipper zip(Node tree) {
        return new Zipper(tree, null);
    }

    /**
     * The focus.
     */
    public Node node() {
        return node;
    }

    public boolean isRoot() {
        return path == null;
    }

    /**
     * Children of the focus.
     */
    public List<Node> children() {
        return node.children();
    }

    /**
     * Rebuild {@code node} with new children, keeping its label and metadata.
     */
    public static Node replaceChildren(Node node, List<Node> children) {
        return node.withChildren(children);
    }

    // === Vertical navigation ===

    /**
     * Focus the first child, or empty when the focus has no children.
     */
    public Optional<Zipper> down() {
        var children = node.children();
        if (children.isEmpty()) {
            return Optional.empty();
        }
        var right = Siblings.of(children.subList(1, children.size()));
        return Optional.of(new Zipper(children.get(0), new Path(this, Siblings.EMPTY, right)));
    }

    /**
     * Focus the parent, rebuilt from the current siblings, or empty at the root.
     */
    public Optional<Zipper> up() {
        if (path == null) {
            return Optional.empty();
        }
        var children = path.left().reverseOnto(path.right().push(node)).toList();
        var parent = path.parent();
        return Optional.of(new Zipper(parent.node.withChildren(children), parent.path));
    }

    /**
     * Walk all the way up.
     */
    public Zipper top() {
        var current = this;
        while (current.path != null) {
            current = current.up().orElseThrow();
        }
        return current;
    }

    /**
     * Walk all the way up and return the root node.
     */
    public Node root() {
        return top().node;
    }

    // === Horizontal navigation ===

    public Optional<Zipper> left() {
        if (path == null || path.left().isEmpty()) {
            return Optional.empty();
        }
        var left = path.left();
        return Optional.of(new Zipper(left.head(), new Path(path.parent(), left.tail(), path.right().push(node))));
    }

    public Optional<Zipper> right() {
        if (path == null || path.right().isEmpty()) {
            return Optional.empty();
        }
        var right = path.right();
        return Optional.of(new Zipper(right.head(), new Path(path.parent(), path.left().push(node), right.tail())));
    }

    /**
     * Focus the leftmost sibling, or this zipper when already there.
     */
    public Zipper leftmost() {
        if (path == null || path.left().isEmpty()) {
            return this;
        }
        var all = path.left().reverseOnto(path.right().push(node));
        return new Zipper(all.head(), new Path(path.parent(), Siblings.EMPTY, all.tail()));
    }

    /**
     * Focus the rightmost sibling, or this zipper when already there.
     */
    public Zipper rightmost() {
        if (path == null || path.right().isEmpty()) {
            return this;
        }
        var all = path.right().reverseOnto(path.left().push(node));
        return new Zipper(all.head(), new Path(path.parent(), all.tail(), Siblings.EMPTY));
    }

    // === Editing ===

    /**
     * Replace the focus, keeping the breadcrumb.
     */
    public Zipper replace(Node replacement) {
        return new Zipper(replacement, path);
    }

    public Zipper update(UnaryOperator<Node> fn) {
        return new Zipper(fn.apply(node), path);
    }

    /**
     * Apply {@code fn} to the whole tree and focus the same position in the result. {@code fn}
     * must keep the tree's shape along the path to the focus.
     */
    public Zipper updateTree(UnaryOperator<Node> fn) {
        var indices = new ArrayDeque<Integer>();
        var current = this;
        while (current.path != null) {
            indices.push(current.path.left().size());
            current = current.up().orElseThrow();
        }
        var result = zip(fn.apply(current.node));
        for (int index : indices) {
            result = result.down().orElseThrow();
            for (int i = 0; i < index; i++) {
                result = result.right().orElseThrow();
            }
        }
        return result;
    }

    /**
     * Remove the focus, returning the zipper that precedes it in a depth-first walk.
     *
     * @throws ZipperMisuseException at the root
     */
    public Zipper remove() {
        if (path == null) {
            throw new ZipperMisuseException("Cannot remove the top level node.");
        }
        if (!path.left().isEmpty()) {
            var left = path.left();
            return new Zipper(left.head(), path.withLeft(left.tail())).prevDown();
        }
        var parent = path.parent();
        return new Zipper(parent.node.withChildren(path.right().toList()), parent.path);
    }

    /**
     * Insert {@code sibling} immediately left of the focus without moving.
     */
    public Zipper insertLeft(Node sibling) {
        var current = requireParent();
        return new Zipper(node, current.withLeft(current.left().push(sibling)));
    }

    /**
     * Insert {@code sibling} immediately right of the focus without moving.
     */
    public Zipper insertRight(Node sibling) {
        var current = requireParent();
        return new Zipper(node, current.withRight(current.right().push(sibling)));
    }

    /**
     * Insert many siblings to the left, keeping their order.
     */
    public Zipper prependSiblings(List<Node> siblings) {
        var current = requireParent();
        return new Zipper(node, current.withLeft(Siblings.of(siblings).reverseOnto(current.left())));
    }

    /**
     * Insert many siblings to the right, keeping their order.
     */
    public Zipper insertSiblings(List<Node> siblings) {
        var current = requireParent();
        return new Zipper(node, current.withRight(current.right().prependAll(siblings)));
    }

    /**
     * Insert {@code child} as the first child of the focus without moving.
     */
    public Zipper insertChild(Node child) {
        return new Zipper(addChild(node, child, true), path);
    }

    /**
     * Insert {@code child} as the last child of the focus without moving.
     */
    public Zipper appendChild(Node child) {
        return new Zipper(addChild(node, child, false), path);
    }

    private static Node addChild(Node parent, Node child, boolean first) {
        if (parent instanceof Node.Pair pair) {
            var elements = first
                           ? List.of(child, pair.left(), pair.right())
                           : List.of(pair.left(), pair.right(), child);
            return Node.Form.of(Labels.TUPLE, Meta.EMPTY, elements);
        }
        if (parent instanceof Node.Apply apply) {
            return Node.Apply.of(apply.target(), apply.meta(), withAdded(apply.args(), child, first));
        }
        if (parent instanceof Node.Form form) {
            return Node.Form.of(form.label(), form.meta(), withAdded(form.args(), child, first));
        }
        if (parent instanceof Node.Sequence sequence) {
            return Node.Sequence.of(withAdded(sequence.items(), child, first));
        }
        throw new IllegalArgumentException("Cannot add children to " + parent);
    }

    private static List<Node> withAdded(List<Node> nodes, Node child, boolean first) {
        var builder = ImmutableList.<Node>builderWithExpectedSize(nodes.size() + 1);
        if (first) {
            builder.add(child);
        }
        builder.addAll(nodes);
        if (!first) {
            builder.add(child);
        }
        return builder.build();
    }

    private Path requireParent() {
        if (path == null) {
            throw new ZipperMisuseException("Can't insert siblings at the top level.");
        }
        return path;
    }

    // === Pre-order walking ===

    /**
     * Next node in depth-first pre-order, or empty after the last node of the whole tree.
     */
    public Optional<Zipper> next() {
        var down = down();
        return down.isPresent()
               ? down
               : skip();
    }

    /**
     * Next sibling, or the nearest ancestor's next sibling; skips the focus' subtree.
     */
    public Optional<Zipper> skip() {
        return skip(Direction.NEXT);
    }

    public Optional<Zipper> skip(Direction direction) {
        var sibling = direction == Direction.NEXT
                      ? right()
                      : left();
        if (sibling.isPresent()) {
            return sibling;
        }
        var current = this;
        while (true) {
            var parent = current.up();
            if (parent.isEmpty()) {
                return Optional.empty();
            }
            current = parent.get();
            var parentSibling = direction == Direction.NEXT
                                ? current.right()
                                : current.left();
            if (parentSibling.isPresent()) {
                return parentSibling;
            }
        }
    }

    /**
     * Previous node in depth-first pre-order, or empty before the root.
     */
    public Optional<Zipper> prev() {
        var left = left();
        if (left.isPresent()) {
            return Optional.of(left.get().prevDown());
        }
        return up();
    }

    // rightmost-deepest descendant
    private Zipper prevDown() {
        var current = this;
        var down = current.down();
        while (down.isPresent()) {
            current = down.get().rightmost();
            down = current.down();
        }
        return current;
    }

    // === Traversal ===

    /**
     * Visit every node of the focus' subtree in depth-first pre-order.
     * The returned zipper keeps this zipper's breadcrumb.
     */
    public Zipper traverse(UnaryOperator<Zipper> fn) {
        return traverseWhile(zipper -> Move.cont(fn.apply(zipper)));
    }

    /**
     * Visit every node of the focus' subtree in depth-first pre-order, threading an accumulator.
     */
    public <A> Visit<A> traverse(A acc, BiFunction<Zipper, A, Visit<A>> fn) {
        return traverseWhile(acc, (zipper, current) -> {
            var visit = fn.apply(zipper, current);
            return Visit.cont(visit.zipper(), visit.acc());
        });
    }

    /**
     * Pre-order traversal controlled by the returned {@link Command}.
     */
    public Zipper traverseWhile(Function<Zipper, Move> fn) {
        return traverseWhile((Void) null, (zipper, unused) -> {
            var move = fn.apply(zipper);
            return new Visit<Void>(move.command(), move.zipper(), null);
        }).zipper();
    }

    /**
     * Pre-order traversal with an accumulator, controlled by the returned {@link Command}.
     * The result's command is {@link Command#HALT} when the visit function halted.
     */
    public <A> Visit<A> traverseWhile(A acc, BiFunction<Zipper, A, Visit<A>> fn) {
        var current = new Zipper(node, null);
        var state = acc;
        while (true) {
            var visit = fn.apply(current, state);
            state = visit.acc();
            var visited = visit.zipper();
            if (visit.command() == Command.HALT) {
                return new Visit<>(Command.HALT, reattach(visited.top()), state);
            }
            var following = visit.command() == Command.SKIP
                            ? visited.skip()
                            : visited.next();
            if (following.isEmpty()) {
                return new Visit<>(Command.CONTINUE, reattach(visited.top()), state);
            }
            current = following.get();
        }
    }

    private Zipper reattach(Zipper detachedTop) {
        return new Zipper(detachedTop.node, path);
    }

    // === Search ===

    /**
     * First zipper, starting at this one, whose focus satisfies {@code predicate}.
     */
    public Optional<Zipper> find(Predicate<Node> predicate) {
        return find(Direction.NEXT, predicate);
    }

    public Optional<Zipper> find(Direction direction, Predicate<Node> predicate) {
        var current = Optional.of(this);
        while (current.isPresent()) {
            var zipper = current.get();
            if (predicate.test(zipper.node)) {
                return current;
            }
            current = direction == Direction.NEXT
                      ? zipper.next()
                      : zipper.prev();
        }
        return Optional.empty();
    }

    /**
     * Whether any node of the focus' subtree satisfies {@code predicate}.
     */
    public boolean anyMatch(Predicate<Node> predicate) {
        var current = Optional.of(new Zipper(node, null));
        while (current.isPresent()) {
            var zipper = current.get();
            if (predicate.test(zipper.node)) {
                return true;
            }
            current = zipper.next();
        }
        return false;
    }

    @Override
    public String toString() {
        return "Zipper[" + node + (path == null
                                   ? ", root]"
                                   : ", depth " + depth() + "]");
    }

    private int depth() {
        int depth = 0;
        for (var current = path; current != null; current = current.parent().path) {
            depth++;
        }
        return depth;
    }
}
