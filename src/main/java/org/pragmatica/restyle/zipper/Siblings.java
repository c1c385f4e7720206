package org.pragmatica.restyle.zipper;

import org.pragmatica.restyle.tree.Node;

import java.util.ArrayList;
import java.util.List;

/**
 * Persistent singly-linked list of sibling nodes. Push and pop are O(1) and share structure,
 * which keeps {@link Zipper#left()} and {@link Zipper#right()} constant time.
 */
final class Siblings {
    static final Siblings EMPTY = new Siblings(null, null, 0);

    private final Node head;
    private final Siblings tail;
    private final int size;

    private Siblings(Node head, Siblings tail, int size) {
        this.head = head;
        this.tail = tail;
        this.size = size;
    }

    static Siblings of(List<Node> nodes) {
        var result = EMPTY;
        for (int i = nodes.size() - 1; i >= 0; i--) {
            result = result.push(nodes.get(i));
        }
        return result;
    }

    Siblings push(Node node) {
        return new Siblings(node, this, size + 1);
    }

    boolean isEmpty() {
        return size == 0;
    }

    int size() {
        return size;
    }

    Node head() {
        if (isEmpty()) {
            throw new IllegalStateException("No siblings");
        }
        return head;
    }

    Siblings tail() {
        if (isEmpty()) {
            throw new IllegalStateException("No siblings");
        }
        return tail;
    }

    /**
     * Push every element of this list onto {@code onto}, reversing it: {@code [a, b] onto [c]} gives {@code [b, a, c]}.
     */
    Siblings reverseOnto(Siblings onto) {
        var result = onto;
        for (var current = this; !current.isEmpty(); current = current.tail) {
            result = result.push(current.head);
        }
        return result;
    }

    /**
     * Prepend {@code nodes} in order: {@code [a, b] prepended to [c]} gives {@code [a, b, c]}.
     */
    Siblings prependAll(List<Node> nodes) {
        var result = this;
        for (int i = nodes.size() - 1; i >= 0; i--) {
            result = result.push(nodes.get(i));
        }
        return result;
    }

    List<Node> toList() {
        var result = new ArrayList<Node>(size);
        for (var current = this; !current.isEmpty(); current = current.tail) {
            result.add(current.head);
        }
        return result;
    }
}
