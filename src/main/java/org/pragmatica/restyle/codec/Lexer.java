package org.pragmatica.restyle.codec;

import com.google.common.collect.ImmutableSet;
import org.pragmatica.restyle.comment.Comment;

import java.util.ArrayList;
import java.util.List;

/**
 * Lexer for the source language. Comments are collected into a separate ledger instead of
 * becoming tokens.
 */
final class Lexer {
    private static final int MAX_INPUT_SIZE = 10_000_000;
    private static final int DEFAULT_TOKEN_CAPACITY = 32;
    private static final String DECIMAL_DIGITS = "0123456789";
    private static final String HEX_DIGITS = "0123456789abcdef";
    private static final String OCTAL_DIGITS = "01234567";
    private static final String BINARY_DIGITS = "01";

    private static final ImmutableSet<String> KEYWORDS = ImmutableSet.of(
        "do", "end", "else", "after", "rescue", "catch", "true", "false", "nil");

    record Result(List<Token> tokens, List<Comment> comments) {}

    private final String input;
    private final List<Token> tokens = new ArrayList<>();
    private final List<Comment> comments = new ArrayList<>();
    private int pos;
    private int line;
    private int column;

    private Lexer(String input) {
        this.input = input;
        this.pos = 0;
        this.line = 1;
        this.column = 1;
    }

    static Result tokenize(String input) {
        if (input.length() > MAX_INPUT_SIZE) {
            throw new IllegalArgumentException("Source input exceeds maximum size of " + MAX_INPUT_SIZE + " characters");
        }
        return new Lexer(input).tokenizeAll();
    }

    private Result tokenizeAll() {
        while (true) {
            boolean spaced = skipBlanks();
            if (isAtEnd()) {
                break;
            }
            char c = peek();
            if (c == '\n' || c == '#') {
                scanLineBreaks();
                continue;
            }
            var token = nextToken(spaced);
            tokens.add(token);
            if (token instanceof Token.Error) {
                break;
            }
        }
        tokens.add(new Token.Eof(line, column, false));
        return new Result(List.copyOf(tokens), List.copyOf(comments));
    }

    // A run of newlines and comment lines becomes at most one Newline token.
    private void scanLineBreaks() {
        int startLine = line;
        int startColumn = column;
        int newlines = 0;
        int beforeFirstComment = -1;
        int sinceLast = 0;
        while (!isAtEnd()) {
            skipBlanks();
            if (isAtEnd()) {
                break;
            }
            char c = peek();
            if (c == '\n') {
                advance();
                newlines++;
                sinceLast++;
            } else if (c == '#') {
                if (beforeFirstComment < 0) {
                    beforeFirstComment = newlines;
                }
                int commentLine = line;
                var sb = new StringBuilder(DEFAULT_TOKEN_CAPACITY);
                while (!isAtEnd() && peek() != '\n') {
                    sb.append(advance());
                }
                comments.add(new Comment(sb.toString().stripTrailing(), commentLine, sinceLast));
                sinceLast = 0;
            } else {
                break;
            }
        }
        if (newlines > 0 && !tokens.isEmpty()) {
            int count = beforeFirstComment >= 0
                        ? Math.max(1, beforeFirstComment)
                        : newlines;
            tokens.add(new Token.Newline(startLine, startColumn, false, count));
        }
    }

    private Token nextToken(boolean spaced) {
        int startLine = line;
        int startColumn = column;
        char c = peek();
        if (isLower(c) || c == '_') {
            return scanWord(startLine, startColumn, spaced);
        }
        if (isUpper(c)) {
            return new Token.Alias(startLine, startColumn, spaced, scanName());
        }
        if (isDigit(c)) {
            return scanNumber(startLine, startColumn, spaced);
        }
        if (c == '"') {
            return scanString(startLine, startColumn, spaced);
        }
        if (c == ':' && pos + 1 < input.length() && input.charAt(pos + 1) != ':') {
            return scanAtom(startLine, startColumn, spaced);
        }
        if ("()[]{},;".indexOf(c) >= 0) {
            advance();
            return new Token.Punct(startLine, startColumn, spaced, c);
        }
        if (c == '.' && !input.startsWith("..", pos)) {
            advance();
            return new Token.Punct(startLine, startColumn, spaced, '.');
        }
        for (var symbol : Operators.SYMBOLS) {
            if (input.startsWith(symbol, pos)) {
                for (int i = 0; i < symbol.length(); i++) {
                    advance();
                }
                return new Token.Operator(startLine, startColumn, spaced, symbol);
            }
        }
        advance();
        return new Token.Error(startLine, startColumn, spaced, "character '" + c + "'");
    }

    private Token scanWord(int startLine, int startColumn, boolean spaced) {
        var name = scanName();
        if (!isAtEnd() && peek() == ':' && !input.startsWith("::", pos)
            && (pos + 1 >= input.length() || Character.isWhitespace(input.charAt(pos + 1)))) {
            advance();
            return new Token.KeywordKey(startLine, startColumn, spaced, name);
        }
        if (KEYWORDS.contains(name)) {
            return new Token.Keyword(startLine, startColumn, spaced, name);
        }
        if (Operators.isWord(name)) {
            return new Token.Operator(startLine, startColumn, spaced, name);
        }
        return new Token.Identifier(startLine, startColumn, spaced, name);
    }

    private String scanName() {
        var sb = new StringBuilder(DEFAULT_TOKEN_CAPACITY);
        while (!isAtEnd() && isNamePart(peek())) {
            sb.append(advance());
        }
        if (!isAtEnd() && (peek() == '?' || peek() == '!') && !input.startsWith("!=", pos)) {
            sb.append(advance());
        }
        return sb.toString();
    }

    private Token scanNumber(int startLine, int startColumn, boolean spaced) {
        var sb = new StringBuilder(DEFAULT_TOKEN_CAPACITY);
        if (peek() == '0' && pos + 1 < input.length() && "xob".indexOf(input.charAt(pos + 1)) >= 0) {
            sb.append(advance());
            char base = advance();
            sb.append(base);
            while (!isAtEnd() && (Character.isLetterOrDigit(peek()) || peek() == '_')) {
                sb.append(advance());
            }
            var digits = base == 'x'
                         ? HEX_DIGITS
                         : base == 'o'
                           ? OCTAL_DIGITS
                           : BINARY_DIGITS;
            return number(startLine, startColumn, spaced, sb.toString(), isWellFormed(sb.substring(2), digits));
        }
        boolean valid = scanDigits(sb);
        if (!isAtEnd() && peek() == '.' && pos + 1 < input.length() && isDigit(input.charAt(pos + 1))) {
            sb.append(advance());
            valid &= scanDigits(sb);
            if (!isAtEnd() && (peek() == 'e' || peek() == 'E')) {
                sb.append(advance());
                if (!isAtEnd() && (peek() == '-' || peek() == '+')) {
                    sb.append(advance());
                }
                valid &= scanDigits(sb);
            }
        }
        return number(startLine, startColumn, spaced, sb.toString(), valid);
    }

    private static Token number(int startLine, int startColumn, boolean spaced, String text, boolean valid) {
        return valid
               ? new Token.Number(startLine, startColumn, spaced, text)
               : new Token.Error(startLine, startColumn, spaced, "malformed number '" + text + "'");
    }

    private boolean scanDigits(StringBuilder sb) {
        int start = sb.length();
        while (!isAtEnd() && (isDigit(peek()) || peek() == '_')) {
            sb.append(advance());
        }
        return isWellFormed(sb.substring(start), DECIMAL_DIGITS);
    }

    // at least one digit, underscores only between digits
    private static boolean isWellFormed(String digits, String allowed) {
        if (digits.isEmpty() || digits.startsWith("_") || digits.endsWith("_") || digits.contains("__")) {
            return false;
        }
        for (int i = 0; i < digits.length(); i++) {
            char ch = Character.toLowerCase(digits.charAt(i));
            if (ch != '_' && allowed.indexOf(ch) < 0) {
                return false;
            }
        }
        return true;
    }

    private Token scanString(int startLine, int startColumn, boolean spaced) {
        if (input.startsWith("\"\"\"", pos)) {
            return scanHeredoc(startLine, startColumn, spaced);
        }
        var sb = new StringBuilder(DEFAULT_TOKEN_CAPACITY);
        sb.append(advance());
        while (!isAtEnd() && peek() != '"') {
            if (peek() == '\\' && pos + 1 < input.length()) {
                sb.append(advance());
            }
            sb.append(advance());
        }
        if (isAtEnd()) {
            return new Token.Error(startLine, startColumn, spaced, "unterminated string");
        }
        sb.append(advance());
        return new Token.Str(startLine, startColumn, spaced, sb.toString());
    }

    private Token scanHeredoc(int startLine, int startColumn, boolean spaced) {
        var sb = new StringBuilder(DEFAULT_TOKEN_CAPACITY);
        for (int i = 0; i < 3; i++) {
            sb.append(advance());
        }
        while (!isAtEnd()) {
            if (input.startsWith("\"\"\"", pos)) {
                for (int i = 0; i < 3; i++) {
                    sb.append(advance());
                }
                return new Token.Str(startLine, startColumn, spaced, sb.toString());
            }
            sb.append(advance());
        }
        return new Token.Error(startLine, startColumn, spaced, "unterminated heredoc");
    }

    private Token scanAtom(int startLine, int startColumn, boolean spaced) {
        advance();
        // skip :
        if (isAtEnd()) {
            return new Token.Error(startLine, startColumn, spaced, "character ':'");
        }
        if (peek() == '"') {
            var quoted = scanString(startLine, startColumn, spaced);
            if (quoted instanceof Token.Str str) {
                return new Token.Atom(startLine, startColumn, spaced, str.text());
            }
            return quoted;
        }
        if (!isNamePart(peek())) {
            return new Token.Error(startLine, startColumn, spaced, "character ':'");
        }
        return new Token.Atom(startLine, startColumn, spaced, scanName());
    }

    // spaces, tabs and carriage returns; reports whether any were skipped
    private boolean skipBlanks() {
        boolean skipped = false;
        while (!isAtEnd()) {
            char c = peek();
            if (c == ' ' || c == '\t' || c == '\r') {
                advance();
                skipped = true;
            } else if (c == '\\' && pos + 1 < input.length() && input.charAt(pos + 1) == '\n') {
                // explicit line continuation
                advance();
                advance();
                skipped = true;
            } else {
                break;
            }
        }
        return skipped;
    }

    private boolean isAtEnd() {
        return pos >= input.length();
    }

    private char peek() {
        return input.charAt(pos);
    }

    private char advance() {
        char c = input.charAt(pos++);
        if (c == '\n') {
            line++;
            column = 1;
        } else {
            column++;
        }
        return c;
    }

    private static boolean isLower(char c) {
        return c >= 'a' && c <= 'z';
    }

    private static boolean isUpper(char c) {
        return c >= 'A' && c <= 'Z';
    }

    private static boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }

    private static boolean isNamePart(char c) {
        return isLower(c) || isUpper(c) || isDigit(c) || c == '_';
    }
}
