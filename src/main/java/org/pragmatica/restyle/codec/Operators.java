package org.pragmatica.restyle.codec;

import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;

import java.util.List;
import java.util.Optional;

/**
 * Operator table shared by the parser and the printer. Higher precedence binds tighter.
 */
final class Operators {
    private Operators() {}

    record Binary(int precedence, boolean rightAssociative) {}

    static final int UNARY_PRECEDENCE = 20;

    // longest first, so the lexer can match greedily
    static final List<String> SYMBOLS = List.of(
        "===", "!==", "\\\\",
        "|>", "<>", "++", "--", "..", "==", "!=", "=~", "<=", ">=", "<-", "->", "&&", "||", "::",
        "=", "<", ">", "+", "-", "*", "/", "!", "@", "|", "&", "^");

    static final ImmutableSet<String> WORDS = ImmutableSet.of("and", "or", "not", "in", "when");

    private static final ImmutableMap<String, Binary> BINARY = ImmutableMap.<String, Binary>builder()
        .put("<-", new Binary(1, false))
        .put("\\\\", new Binary(1, false))
        .put("when", new Binary(2, true))
        .put("::", new Binary(3, true))
        .put("|", new Binary(4, true))
        .put("=", new Binary(5, true))
        .put("||", new Binary(6, false))
        .put("or", new Binary(6, false))
        .put("&&", new Binary(7, false))
        .put("and", new Binary(7, false))
        .put("==", new Binary(8, false))
        .put("!=", new Binary(8, false))
        .put("===", new Binary(8, false))
        .put("!==", new Binary(8, false))
        .put("=~", new Binary(8, false))
        .put("<", new Binary(9, false))
        .put(">", new Binary(9, false))
        .put("<=", new Binary(9, false))
        .put(">=", new Binary(9, false))
        .put("|>", new Binary(10, false))
        .put("in", new Binary(11, false))
        .put("++", new Binary(12, true))
        .put("--", new Binary(12, true))
        .put("<>", new Binary(12, true))
        .put("..", new Binary(12, true))
        .put("+", new Binary(13, false))
        .put("-", new Binary(13, false))
        .put("*", new Binary(14, false))
        .put("/", new Binary(14, false))
        .build();

    private static final ImmutableSet<String> UNARY = ImmutableSet.of("!", "-", "+", "not", "@", "^", "&");

    static Optional<Binary> binary(String symbol) {
        return Optional.ofNullable(BINARY.get(symbol));
    }

    static boolean isUnary(String symbol) {
        return UNARY.contains(symbol);
    }

    static boolean isWord(String symbol) {
        return WORDS.contains(symbol);
    }
}
