package org.pragmatica.restyle.codec;

import org.pragmatica.restyle.error.RestyleError;

/**
 * Tokens of the source language. {@code spaced} is true when whitespace precedes the token
 * on its line, which separates {@code foo(x)} from {@code foo (x)}.
 */
sealed interface Token {
    int line();

    int column();

    boolean spaced();

    String describe();

    // Names and literals
    record Identifier(int line, int column, boolean spaced, String name) implements Token {
        @Override
        public String describe() {
            return "identifier '" + name + "'";
        }
    }

    // Foo
    record Alias(int line, int column, boolean spaced, String name) implements Token {
        @Override
        public String describe() {
            return "alias '" + name + "'";
        }
    }

    // :name or :"quoted name"
    record Atom(int line, int column, boolean spaced, String name) implements Token {
        @Override
        public String describe() {
            return "atom ':" + name + "'";
        }
    }

    // name:
    record KeywordKey(int line, int column, boolean spaced, String name) implements Token {
        @Override
        public String describe() {
            return "keyword '" + name + ":'";
        }
    }

    record Number(int line, int column, boolean spaced, String text) implements Token {
        @Override
        public String describe() {
            return "number " + text;
        }
    }

    // raw text including delimiters
    record Str(int line, int column, boolean spaced, String text) implements Token {
        @Override
        public String describe() {
            return "string";
        }
    }

    // do end else after rescue catch true false nil
    record Keyword(int line, int column, boolean spaced, String word) implements Token {
        @Override
        public String describe() {
            return "'" + word + "'";
        }
    }

    // Operators, including word operators (and, or, not, in, when)
    record Operator(int line, int column, boolean spaced, String symbol) implements Token {
        @Override
        public String describe() {
            return "'" + symbol + "'";
        }
    }

    // ( ) [ ] { } , ; .
    record Punct(int line, int column, boolean spaced, char symbol) implements Token {
        @Override
        public String describe() {
            return "'" + symbol + "'";
        }
    }

    /**
     * End of line. {@code count} is the number of newlines before the next token or comment.
     */
    record Newline(int line, int column, boolean spaced, int count) implements Token {
        @Override
        public String describe() {
            return "end of line";
        }
    }

    record Eof(int line, int column, boolean spaced) implements Token {
        @Override
        public String describe() {
            return RestyleError.SyntaxError.END_OF_INPUT;
        }
    }

    record Error(int line, int column, boolean spaced, String message) implements Token {
        @Override
        public String describe() {
            return message;
        }
    }
}
