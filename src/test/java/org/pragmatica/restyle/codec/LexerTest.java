package org.pragmatica.restyle.codec;

import org.junit.jupiter.api.Test;
import org.pragmatica.restyle.comment.Comment;

import static org.assertj.core.api.Assertions.assertThat;

class LexerTest {

    @Test
    void tokenize_call_separatesNamesAndPunctuation() {
        var tokens = Lexer.tokenize("foo(x, :ok)").tokens();

        assertThat(tokens).hasSize(7);
        assertThat(tokens.get(0)).isEqualTo(new Token.Identifier(1, 1, false, "foo"));
        assertThat(tokens.get(1)).isEqualTo(new Token.Punct(1, 4, false, '('));
        assertThat(tokens.get(4)).isEqualTo(new Token.Atom(1, 8, true, "ok"));
        assertThat(tokens.get(6)).isInstanceOf(Token.Eof.class);
    }

    @Test
    void tokenize_keywordKey_requiresFollowingSpace() {
        var tokens = Lexer.tokenize("do: 1").tokens();

        assertThat(tokens.get(0)).isEqualTo(new Token.KeywordKey(1, 1, false, "do"));
        assertThat(tokens.get(1)).isEqualTo(new Token.Number(1, 5, true, "1"));
    }

    @Test
    void tokenize_wordsAndOperators() {
        var tokens = Lexer.tokenize("a |> b when not c").tokens();

        assertThat(tokens.get(1)).isEqualTo(new Token.Operator(1, 3, true, "|>"));
        assertThat(tokens.get(3)).isEqualTo(new Token.Operator(1, 8, true, "when"));
        assertThat(tokens.get(4)).isEqualTo(new Token.Operator(1, 13, true, "not"));
    }

    @Test
    void tokenize_numbersKeepLiteralText() {
        var tokens = Lexer.tokenize("1_000 0x1F 3.14e-2").tokens();

        assertThat(tokens.get(0)).isEqualTo(new Token.Number(1, 1, false, "1_000"));
        assertThat(tokens.get(1)).isEqualTo(new Token.Number(1, 7, true, "0x1F"));
        assertThat(tokens.get(2)).isEqualTo(new Token.Number(1, 12, true, "3.14e-2"));
    }

    @Test
    void tokenize_malformedNumbers_areErrors() {
        for (var source : new String[]{"0x", "1_", "1__0", "0b102", "1.5_"}) {
            var token = Lexer.tokenize(source).tokens().get(0);

            assertThat(token).as(source).isInstanceOf(Token.Error.class);
            assertThat(token.describe()).as(source).startsWith("malformed number");
        }
    }

    @Test
    void tokenize_collectsCommentsOutsideTokenStream() {
        var result = Lexer.tokenize("# first\nfoo # trailing\n\n# spaced\nbar\n");

        assertThat(result.comments()).extracting(Comment::text).containsExactly("# first", "# trailing", "# spaced");
        assertThat(result.comments()).extracting(Comment::line).containsExactly(1, 2, 4);
        assertThat(result.comments()).extracting(Comment::previousEolCount).containsExactly(0, 0, 2);
        assertThat(result.tokens()).noneMatch(token -> token instanceof Token.Error);
    }

    @Test
    void tokenize_newlineCount_stopsAtFirstComment() {
        var tokens = Lexer.tokenize("foo\n\n\nbar\n# note\nbaz").tokens();

        assertThat(tokens.get(1)).isInstanceOf(Token.Newline.class);
        assertThat(((Token.Newline) tokens.get(1)).count()).isEqualTo(3);
        assertThat(((Token.Newline) tokens.get(3)).count()).isEqualTo(1);
    }

    @Test
    void tokenize_strings_keepDelimiters() {
        var tokens = Lexer.tokenize("\"a \\\"quoted\\\" word\"").tokens();

        assertThat(tokens.get(0)).isEqualTo(new Token.Str(1, 1, false, "\"a \\\"quoted\\\" word\""));
    }

    @Test
    void tokenize_unterminatedString_producesError() {
        var tokens = Lexer.tokenize("foo(\"oops").tokens();

        assertThat(tokens).anyMatch(token -> token instanceof Token.Error error && error.message().equals("unterminated string"));
    }
}
