package org.pragmatica.restyle.tree;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class NodeTest {

    private static final Node A = Node.Leaf.atom("a");
    private static final Node B = Node.Leaf.atom("b");

    @Test
    void withChildren_ofOwnChildren_returnsEqualNode() {
        var nodes = List.<Node>of(
            Node.Form.of("foo", 1, A, B),
            Node.Apply.of(Node.Form.of(Labels.DOT, 1, A, B), Meta.line(1), List.of(A)),
            new Node.Pair(A, B),
            Node.Sequence.of(A, B),
            Node.Leaf.number("42", 1)
        );

        for (var node : nodes) {
            assertEquals(node, node.withChildren(node.children()));
        }
    }

    @Test
    void apply_childrenStartWithTarget() {
        var target = Node.Form.of(Labels.DOT, 1, A, B);
        var apply = Node.Apply.of(target, Meta.line(1), List.of(B));

        assertEquals(List.of(target, B), apply.children());
    }

    @Test
    void apply_withoutChildren_throws() {
        var apply = Node.Apply.of(A, Meta.EMPTY, List.of());

        assertThrows(IllegalArgumentException.class, () -> apply.withChildren(List.of()));
    }

    @Test
    void pair_withThreeChildren_becomesTuple() {
        var widened = new Node.Pair(A, B).withChildren(List.of(A, B, A));

        assertInstanceOf(Node.Form.class, widened);
        assertTrue(Nodes.isForm(widened, Labels.TUPLE));
        assertEquals(3, widened.children().size());
    }

    @Test
    void leaf_withChildren_throws() {
        assertThrows(IllegalArgumentException.class, () -> A.withChildren(List.of(B)));
        assertSame(A, A.withChildren(List.of()));
    }

    @Test
    void line_comesFromMetaOrLeaf() {
        assertEquals(7, Node.Form.of("foo", 7).line().orElseThrow());
        assertEquals(3, Node.Leaf.identifier("x", 3).line().orElseThrow());
        assertTrue(Node.Sequence.EMPTY.line().isEmpty());
        assertEquals(4, new Node.Pair(Node.Leaf.atom("do", 4), A).line().orElseThrow());
    }

    @Test
    void leaf_predicates() {
        assertTrue(Node.Leaf.atom("do").isAtom("do"));
        assertFalse(Node.Leaf.identifier("do", 1).isAtom("do"));
        assertTrue(Node.Leaf.bool(true, 1).isBoolean(true));
        assertFalse(Node.Leaf.bool(true, 1).isBoolean(false));
    }
}
