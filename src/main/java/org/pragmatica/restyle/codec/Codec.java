package org.pragmatica.restyle.codec;

import org.pragmatica.restyle.comment.Comment;
import org.pragmatica.restyle.tree.Node;

import java.util.List;

/**
 * Conversion between source text and the tree model.
 *
 * <p>Implementations must keep comments out of the tree and report their lines in the ledger,
 * and must place comments purely by line number when printing.
 */
public interface Codec {
    /**
     * Parse source text.
     *
     * @throws org.pragmatica.restyle.error.RestyleException carrying a
     *         {@link org.pragmatica.restyle.error.RestyleError.SyntaxError} when the text is invalid
     */
    Document parse(String text, String file);

    String print(Node tree, List<Comment> comments, PrintOptions options);

    default String print(Document document, PrintOptions options) {
        return print(document.tree(), document.comments(), options);
    }
}
