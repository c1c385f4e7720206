package org.pragmatica.restyle.zipper;

import org.junit.jupiter.api.Test;
import org.pragmatica.restyle.tree.Labels;
import org.pragmatica.restyle.tree.Meta;
import org.pragmatica.restyle.tree.Node;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ZipperTest {

    private static final Node A = Node.Leaf.atom("a");
    private static final Node B = Node.Leaf.atom("b");
    private static final Node C = Node.Leaf.atom("c");
    private static final Node X = Node.Leaf.atom("x");

    private static Node form(String label, Node... args) {
        return Node.Form.of(label, Meta.EMPTY, List.of(args));
    }

    // f(g(a), b)
    private static final Node TREE = form("f", form("g", A), B);

    private static String label(Node node) {
        if (node instanceof Node.Form form) {
            return form.label();
        }
        return ((Node.Leaf) node).text();
    }

    // === Navigation ===

    @Test
    void zip_focusesRoot() {
        var zipper = Zipper.zip(TREE);

        assertThat(zipper.node()).isEqualTo(TREE);
        assertThat(zipper.isRoot()).isTrue();
        assertThat(zipper.up()).isEmpty();
    }

    @Test
    void down_atLeaf_returnsEmpty() {
        assertThat(Zipper.zip(A).down()).isEmpty();
    }

    @Test
    void down_focusesFirstChild() {
        var child = Zipper.zip(TREE).down().orElseThrow();

        assertThat(label(child.node())).isEqualTo("g");
        assertThat(child.isRoot()).isFalse();
    }

    @Test
    void right_and_left_moveAmongSiblings() {
        var first = Zipper.zip(form("f", A, B, C)).down().orElseThrow();

        var third = first.right().flatMap(Zipper::right).orElseThrow();
        assertThat(third.node()).isEqualTo(C);
        assertThat(third.right()).isEmpty();
        assertThat(third.left().orElseThrow().node()).isEqualTo(B);
        assertThat(first.left()).isEmpty();
    }

    @Test
    void up_withoutEdits_rebuildsEqualTree() {
        var root = Zipper.zip(TREE)
                         .down()
                         .flatMap(Zipper::down)
                         .flatMap(Zipper::up)
                         .flatMap(Zipper::up)
                         .orElseThrow();

        assertThat(root.node()).isEqualTo(TREE);
    }

    @Test
    void leftmost_and_rightmost_jumpToEnds() {
        var middle = Zipper.zip(form("f", A, B, C)).down().flatMap(Zipper::right).orElseThrow();

        assertThat(middle.leftmost().node()).isEqualTo(A);
        assertThat(middle.rightmost().node()).isEqualTo(C);
        assertThat(middle.leftmost().root()).isEqualTo(form("f", A, B, C));
        assertThat(Zipper.zip(A).leftmost().node()).isEqualTo(A);
    }

    // === Editing ===

    @Test
    void replace_isVisibleAtRoot() {
        var root = Zipper.zip(TREE)
                         .down()
                         .flatMap(Zipper::right)
                         .map(zipper -> zipper.replace(X))
                         .map(Zipper::root)
                         .orElseThrow();

        assertThat(root).isEqualTo(form("f", form("g", A), X));
    }

    @Test
    void update_appliesFunctionToFocus() {
        var root = Zipper.zip(TREE)
                         .down()
                         .map(zipper -> zipper.update(node -> form("h", node)))
                         .map(Zipper::root)
                         .orElseThrow();

        assertThat(root).isEqualTo(form("f", form("h", form("g", A)), B));
    }

    @Test
    void remove_atRoot_throws() {
        assertThatThrownBy(() -> Zipper.zip(TREE).remove())
            .isInstanceOf(IllegalStateException.class);
    }

    @Test
    void remove_middleChild_focusesPreviousNode() {
        var middle = Zipper.zip(form("f", A, B, C)).down().flatMap(Zipper::right).orElseThrow();

        var removed = middle.remove();

        assertThat(removed.node()).isEqualTo(A);
        assertThat(removed.root()).isEqualTo(form("f", A, C));
    }

    @Test
    void remove_afterSubtree_focusesDeepestRightmostDescendant() {
        var last = Zipper.zip(TREE).down().flatMap(Zipper::right).orElseThrow();

        var removed = last.remove();

        assertThat(removed.node()).isEqualTo(A);
        assertThat(removed.root()).isEqualTo(form("f", form("g", A)));
    }

    @Test
    void remove_firstChild_focusesParent() {
        var first = Zipper.zip(form("f", A, B)).down().orElseThrow();

        var removed = first.remove();

        assertThat(removed.node()).isEqualTo(form("f", B));
        assertThat(removed.isRoot()).isTrue();
    }

    @Test
    void updateTree_keepsFocusPosition() {
        var a = Zipper.zip(TREE).down().flatMap(Zipper::down).orElseThrow();

        var updated = a.updateTree(root -> form("f", form("g", A), X));

        assertThat(updated.node()).isEqualTo(A);
        assertThat(updated.up().map(parent -> label(parent.node()))).contains("g");
        assertThat(updated.root()).isEqualTo(form("f", form("g", A), X));
    }

    @Test
    void insertLeft_and_insertRight_keepFocus() {
        var middle = Zipper.zip(form("f", A, C)).down().orElseThrow();

        var edited = middle.insertRight(B).insertLeft(X);

        assertThat(edited.node()).isEqualTo(A);
        assertThat(edited.root()).isEqualTo(form("f", X, A, B, C));
    }

    @Test
    void insertSiblings_keepsOrder() {
        var first = Zipper.zip(form("f", A)).down().orElseThrow();

        var root = first.insertSiblings(List.of(B, C))
                        .prependSiblings(List.of(X, X))
                        .root();

        assertThat(root).isEqualTo(form("f", X, X, A, B, C));
    }

    @Test
    void insertLeft_atRoot_throws() {
        assertThatThrownBy(() -> Zipper.zip(TREE).insertLeft(X))
            .isInstanceOf(IllegalStateException.class);
        assertThatThrownBy(() -> Zipper.zip(TREE).insertSiblings(List.of(X)))
            .isInstanceOf(IllegalStateException.class);
    }

    @Test
    void insertChild_and_appendChild_addAtEnds() {
        var root = Zipper.zip(form("f", B))
                         .insertChild(A)
                         .appendChild(C)
                         .root();

        assertThat(root).isEqualTo(form("f", A, B, C));
    }

    @Test
    void appendChild_onPair_widensToTuple() {
        var pair = new Node.Pair(A, B);

        var widened = Zipper.zip(pair).appendChild(C).node();

        assertThat(widened).isEqualTo(Node.Form.of(Labels.TUPLE, Meta.EMPTY, List.of(A, B, C)));
    }

    @Test
    void appendChild_onLeaf_throws() {
        assertThatThrownBy(() -> Zipper.zip(A).appendChild(B))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void replaceChildren_keepsLabelAndMeta() {
        var original = Node.Form.of("f", Meta.line(3), List.of(A));

        var replaced = Zipper.replaceChildren(original, List.of(B, C));

        assertThat(replaced).isEqualTo(Node.Form.of("f", Meta.line(3), List.of(B, C)));
    }

    // === Pre-order walking ===

    @Test
    void next_walksInPreOrder() {
        var labels = new ArrayList<String>();
        var current = Optional.of(Zipper.zip(TREE));
        while (current.isPresent()) {
            labels.add(label(current.get().node()));
            current = current.get().next();
        }

        assertThat(labels).containsExactly("f", "g", "a", "b");
    }

    @Test
    void prev_walksBackwards() {
        var last = Zipper.zip(TREE).down().flatMap(Zipper::right).orElseThrow();

        assertThat(last.prev().map(Zipper::node)).contains(A);
        assertThat(Zipper.zip(TREE).prev()).isEmpty();
    }

    @Test
    void skip_jumpsOverSubtree() {
        var g = Zipper.zip(TREE).down().orElseThrow();

        assertThat(g.skip().map(Zipper::node)).contains(B);
        assertThat(g.skip().flatMap(Zipper::skip)).isEmpty();
    }

    // === Traversal ===

    @Test
    void skipBackwards_climbsToAncestorsLeftSibling() {
        // f(a, g(b, c))
        var tree = form("f", A, form("g", B, C));
        var b = Zipper.zip(tree).down().flatMap(Zipper::right).flatMap(Zipper::down).orElseThrow();
        var c = b.right().orElseThrow();

        assertThat(c.skip(Direction.PREV).map(Zipper::node)).contains(B);
        assertThat(b.skip(Direction.PREV).map(Zipper::node)).contains(A);
        assertThat(b.skip(Direction.PREV).flatMap(a -> a.skip(Direction.PREV))).isEmpty();
    }

    @Test
    void traverse_visitsEveryNode() {
        var visit = Zipper.zip(TREE).traverse(0, (zipper, count) -> Visit.cont(zipper, count + 1));

        assertThat(visit.acc()).isEqualTo(4);
        assertThat(visit.zipper().node()).isEqualTo(TREE);
    }

    @Test
    void traverseWhile_skip_doesNotDescend() {
        var visit = Zipper.zip(TREE).traverseWhile(new ArrayList<String>(), (zipper, seen) -> {
            seen.add(label(zipper.node()));
            return label(zipper.node()).equals("g")
                   ? Visit.skip(zipper, seen)
                   : Visit.cont(zipper, seen);
        });

        assertThat(visit.acc()).containsExactly("f", "g", "b");
        assertThat(visit.command()).isEqualTo(Command.CONTINUE);
    }

    @Test
    void traverseWhile_halt_stopsAndReassembles() {
        var visit = Zipper.zip(TREE).traverseWhile(0, (zipper, count) -> {
            if (zipper.node().equals(A)) {
                return Visit.halt(zipper.replace(X), count + 1);
            }
            return Visit.cont(zipper, count + 1);
        });

        assertThat(visit.command()).isEqualTo(Command.HALT);
        assertThat(visit.acc()).isEqualTo(3);
        assertThat(visit.zipper().root()).isEqualTo(form("f", form("g", X), B));
    }

    @Test
    void traverse_onSubtree_staysInSubtreeAndKeepsPath() {
        var g = Zipper.zip(form("f", form("g", A, A), A)).down().orElseThrow();

        var traversed = g.traverse(zipper -> zipper.node().equals(A)
                                             ? zipper.replace(X)
                                             : zipper);

        assertThat(traversed.isRoot()).isFalse();
        assertThat(traversed.root()).isEqualTo(form("f", form("g", X, X), A));
    }

    @Test
    void traverseWhile_replacementIsVisitedNext() {
        // rewriting a node to a form descends into the new children
        var visit = Zipper.zip(form("f", A)).traverseWhile(0, (zipper, count) -> {
            if (zipper.node().equals(A)) {
                return Visit.cont(zipper.replace(form("g", B)), count + 1);
            }
            return Visit.cont(zipper, count + 1);
        });

        assertThat(visit.acc()).isEqualTo(3);
        assertThat(visit.zipper().root()).isEqualTo(form("f", form("g", B)));
    }

    @Test
    void traverseWhile_withMoves_usesCommands() {
        var result = Zipper.zip(TREE).traverseWhile(zipper -> label(zipper.node()).equals("g")
                                                             ? Move.skip(zipper.replace(X))
                                                             : Move.cont(zipper));

        assertThat(result.root()).isEqualTo(form("f", X, B));
    }

    // === Search ===

    @Test
    void find_returnsFirstMatchInPreOrder() {
        var found = Zipper.zip(TREE).find(node -> node instanceof Node.Leaf);

        assertThat(found.map(Zipper::node)).contains(A);
    }

    @Test
    void find_backwards_walksPrev() {
        var last = Zipper.zip(TREE).down().flatMap(Zipper::right).orElseThrow();

        var found = last.find(Direction.PREV, node -> node instanceof Node.Form form && form.is("g"));

        assertThat(found.map(zipper -> label(zipper.node()))).contains("g");
    }

    @Test
    void find_withoutMatch_returnsEmpty() {
        assertThat(Zipper.zip(TREE).find(node -> node.equals(X))).isEmpty();
    }

    @Test
    void anyMatch_checksOnlySubtree() {
        var g = Zipper.zip(TREE).down().orElseThrow();

        assertThat(g.anyMatch(node -> node.equals(A))).isTrue();
        assertThat(g.anyMatch(node -> node.equals(B))).isFalse();
    }
}
