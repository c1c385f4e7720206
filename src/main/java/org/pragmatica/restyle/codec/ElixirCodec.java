package org.pragmatica.restyle.codec;

import org.pragmatica.restyle.comment.Comment;
import org.pragmatica.restyle.tree.Node;

import java.util.List;

/**
 * Codec for the Elixir subset the built-in rules operate on: modules and function definitions,
 * calls with and without parentheses, {@code do ... end} blocks with {@code else} sections and
 * {@code ->} clauses, operators, literals, lists, tuples and keyword lists.
 */
public final class ElixirCodec implements Codec {
    public static final ElixirCodec INSTANCE = new ElixirCodec();

    private ElixirCodec() {}

    @Override
    public Document parse(String text, String file) {
        var lexed = Lexer.tokenize(text);
        var tree = SourceParser.parse(lexed.tokens(), file);
        return Document.of(tree, lexed.comments());
    }

    @Override
    public String print(Node tree, List<Comment> comments, PrintOptions options) {
        return SourcePrinter.print(tree, comments, options);
    }
}
