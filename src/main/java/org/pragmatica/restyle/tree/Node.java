package org.pragmatica.restyle.tree;

import com.google.common.collect.ImmutableList;

import java.util.List;
import java.util.Optional;

import static com.google.common.base.Preconditions.checkArgument;

/**
 * Immutable syntax tree node. Every edit produces a new node value.
 *
 * <p>Children extraction and reconstruction obey the round-trip law
 * {@code n.withChildren(n.children()).equals(n)}.
 */
public sealed interface Node {
    /**
     * Ordered children of this node. Leaves have none.
     */
    List<Node> children();

    /**
     * Label-preserving inverse of {@link #children()}.
     *
     * @throws IllegalArgumentException if the shape cannot hold the given children
     */
    Node withChildren(List<Node> children);

    /**
     * Source line of this node, when known.
     */
    Optional<Integer> line();

    /**
     * Labeled form: an atom label, metadata and argument nodes. Children are the arguments.
     */
    record Form(String label, Meta meta, ImmutableList<Node> args) implements Node {
        public static Form of(String label, Meta meta, List<? extends Node> args) {
            return new Form(label, meta, ImmutableList.copyOf(args));
        }

        public static Form of(String label, int line, Node... args) {
            return new Form(label, Meta.line(line), ImmutableList.copyOf(args));
        }

        @Override
        public List<Node> children() {
            return args;
        }

        @Override
        public Node withChildren(List<Node> children) {
            return new Form(label, meta, ImmutableList.copyOf(children));
        }

        @Override
        public Optional<Integer> line() {
            return meta.line();
        }

        public Form withMeta(Meta newMeta) {
            return new Form(label, newMeta, args);
        }

        public boolean is(String expected) {
            return label.equals(expected);
        }
    }

    /**
     * Form whose label is itself a node, e.g. the {@code Foo.bar} in {@code Foo.bar(x)}.
     * Children are {@code [target | args]}.
     */
    record Apply(Node target, Meta meta, ImmutableList<Node> args) implements Node {
        public static Apply of(Node target, Meta meta, List<? extends Node> args) {
            return new Apply(target, meta, ImmutableList.copyOf(args));
        }

        @Override
        public List<Node> children() {
            return ImmutableList.<Node>builderWithExpectedSize(args.size() + 1)
                                .add(target)
                                .addAll(args)
                                .build();
        }

        @Override
        public Node withChildren(List<Node> children) {
            checkArgument(!children.isEmpty(), "Apply node requires a target child");
            return new Apply(children.get(0), meta, ImmutableList.copyOf(children.subList(1, children.size())));
        }

        @Override
        public Optional<Integer> line() {
            return meta.line();
        }

        public Apply withMeta(Meta newMeta) {
            return new Apply(target, newMeta, args);
        }
    }

    /**
     * Unlabeled 2-tuple, e.g. a keyword entry {@code do: body}.
     */
    record Pair(Node left, Node right) implements Node {
        @Override
        public List<Node> children() {
            return List.of(left, right);
        }

        /**
         * Two children rebuild the pair, any other count widens it to a tuple form.
         */
        @Override
        public Node withChildren(List<Node> children) {
            if (children.size() == 2) {
                return new Pair(children.get(0), children.get(1));
            }
            return Form.of(Labels.TUPLE, Meta.EMPTY, children);
        }

        @Override
        public Optional<Integer> line() {
            return left.line();
        }
    }

    /**
     * Plain ordered sequence of sibling nodes with no wrapping label (a list literal or keyword list).
     */
    record Sequence(ImmutableList<Node> items) implements Node {
        public static final Sequence EMPTY = new Sequence(ImmutableList.of());

        public static Sequence of(List<? extends Node> items) {
            return new Sequence(ImmutableList.copyOf(items));
        }

        public static Sequence of(Node... items) {
            return new Sequence(ImmutableList.copyOf(items));
        }

        @Override
        public List<Node> children() {
            return items;
        }

        @Override
        public Node withChildren(List<Node> children) {
            return Sequence.of(children);
        }

        @Override
        public Optional<Integer> line() {
            return items.isEmpty()
                   ? Optional.empty()
                   : items.get(0).line();
        }
    }

    /**
     * Opaque atomic value. The literal source text is kept verbatim so numeric base and
     * string delimiters survive printing.
     */
    record Leaf(Kind kind, String text, Optional<Integer> line) implements Node {
        public enum Kind {
            NUMBER,
            STRING,
            ATOM,
            BOOLEAN,
            NIL,
            IDENTIFIER
        }

        public static Leaf atom(String name, int line) {
            return new Leaf(Kind.ATOM, name, Optional.of(line));
        }

        public static Leaf atom(String name) {
            return new Leaf(Kind.ATOM, name, Optional.empty());
        }

        public static Leaf identifier(String name, int line) {
            return new Leaf(Kind.IDENTIFIER, name, Optional.of(line));
        }

        public static Leaf number(String text, int line) {
            return new Leaf(Kind.NUMBER, text, Optional.of(line));
        }

        public static Leaf bool(boolean value, int line) {
            return new Leaf(Kind.BOOLEAN, String.valueOf(value), Optional.of(line));
        }

        @Override
        public List<Node> children() {
            return List.of();
        }

        @Override
        public Node withChildren(List<Node> children) {
            checkArgument(children.isEmpty(), "Leaf %s cannot hold children", text);
            return this;
        }

        public Leaf withLine(Optional<Integer> newLine) {
            return new Leaf(kind, text, newLine);
        }

        public boolean isAtom(String name) {
            return kind == Kind.ATOM && text.equals(name);
        }

        public boolean isBoolean(boolean value) {
            return kind == Kind.BOOLEAN && text.equals(String.valueOf(value));
        }
    }
}
