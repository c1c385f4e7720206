package org.pragmatica.restyle.codec;

import com.google.common.collect.ImmutableList;
import org.pragmatica.restyle.comment.Comment;
import org.pragmatica.restyle.tree.Node;

import java.util.List;

/**
 * A parsed source: the tree and its comment ledger, ordered by line.
 */
public record Document(Node tree, ImmutableList<Comment> comments) {
    public static Document of(Node tree, List<Comment> comments) {
        return new Document(tree, ImmutableList.copyOf(comments));
    }
}
