package org.pragmatica.restyle.codec;

import com.google.common.collect.ImmutableSet;
import org.pragmatica.restyle.error.RestyleError;
import org.pragmatica.restyle.error.RestyleException;
import org.pragmatica.restyle.tree.Labels;
import org.pragmatica.restyle.tree.Lines;
import org.pragmatica.restyle.tree.Meta;
import org.pragmatica.restyle.tree.Node;
import org.pragmatica.restyle.tree.Nodes;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Recursive-descent parser from tokens to the tree model.
 *
 * <p>A {@code do ... end} block attaches to the outermost call without parentheses:
 * in {@code case x do} the block belongs to {@code case}, not to {@code x}.
 */
final class SourceParser {
    private static final ImmutableSet<String> SECTION_WORDS = ImmutableSet.of("else", "after", "rescue", "catch");

    private final List<Token> tokens;
    private final String file;
    private int pos;
    // > 0 while parsing the arguments of a call without parentheses
    private int noDoDepth;

    private record Body(List<Node> statements, List<Node> clauses) {}

    private record DoBlock(Node.Sequence sections, int endLine) {}

    private record ArgList(List<Node> args, boolean trailingKeywords) {}

    private SourceParser(List<Token> tokens, String file) {
        this.tokens = tokens;
        this.file = file;
        this.pos = 0;
        this.noDoDepth = 0;
    }

    static Node parse(List<Token> tokens, String file) {
        for (var token : tokens) {
            if (token instanceof Token.Error error) {
                throw syntaxError(file, error, "valid token");
            }
        }
        return new SourceParser(tokens, file).parseProgram();
    }

    private Node parseProgram() {
        var body = parseBody(false);
        if (!(peek() instanceof Token.Eof)) {
            throw error(peek(), "end of input");
        }
        return block(body.statements());
    }

    // === Statements ===

    private Body parseBody(boolean allowClauses) {
        var statements = new ArrayList<Node>();
        var clauses = new ArrayList<Node>();
        List<Node> patterns = null;
        List<Node> clauseBody = null;
        int clauseLine = 0;
        skipSeparators();
        while (!atBodyEnd()) {
            var start = peek();
            var expr = parseExpression();
            if (allowClauses && (isPunct(peek(), ',') || isOperator(peek(), "->"))) {
                if (patterns == null && !statements.isEmpty()) {
                    throw error(start, "statement");
                }
                var heads = new ArrayList<Node>();
                heads.add(expr);
                while (matchPunct(',')) {
                    skipNewlines();
                    heads.add(parseExpression());
                }
                var arrow = expectOperator("->");
                if (patterns != null) {
                    clauses.add(clause(patterns, clauseLine, clauseBody));
                }
                patterns = heads;
                clauseBody = new ArrayList<>();
                clauseLine = arrow.line();
                skipSeparators();
                continue;
            }
            var statement = withTrailingNewlines(expr);
            if (clauseBody != null) {
                clauseBody.add(statement);
            } else {
                statements.add(statement);
            }
        }
        if (patterns != null) {
            clauses.add(clause(patterns, clauseLine, clauseBody));
        }
        return new Body(statements, clauses);
    }

    // a statement ends at a newline, a semicolon or the end of its body
    private Node withTrailingNewlines(Node statement) {
        int newlines = 0;
        while (true) {
            var token = peek();
            if (token instanceof Token.Newline newline) {
                newlines += newline.count();
                advance();
            } else if (isPunct(token, ';')) {
                newlines = Math.max(newlines, 1);
                advance();
            } else {
                break;
            }
        }
        if (newlines == 0 && !atBodyEnd()) {
            throw error(peek(), "end of expression");
        }
        return newlines > 0
               ? Lines.withNewlines(statement, newlines)
               : statement;
    }

    private static Node clause(List<Node> patterns, int line, List<Node> body) {
        return Node.Form.of(Labels.ARROW, Meta.line(line), List.of(Node.Sequence.of(patterns), block(body)));
    }

    private static Node block(List<Node> statements) {
        if (statements.size() == 1) {
            return statements.get(0);
        }
        return Node.Form.of(Labels.BLOCK, Meta.EMPTY, statements);
    }

    private boolean atBodyEnd() {
        var token = peek();
        if (token instanceof Token.Eof) {
            return true;
        }
        return token instanceof Token.Keyword keyword
               && (keyword.word().equals("end") || SECTION_WORDS.contains(keyword.word()));
    }

    private DoBlock parseDoBlock() {
        var doToken = expectKeyword("do");
        int saved = noDoDepth;
        noDoDepth = 0;
        try {
            var sections = new ArrayList<Node>();
            var section = "do";
            int sectionLine = doToken.line();
            while (true) {
                var body = parseBody(true);
                Node content = body.clauses().isEmpty()
                               ? block(body.statements())
                               : Node.Sequence.of(body.clauses());
                sections.add(new Node.Pair(Node.Leaf.atom(section, sectionLine), content));
                var next = peek();
                if (next instanceof Token.Keyword keyword && SECTION_WORDS.contains(keyword.word())) {
                    advance();
                    section = keyword.word();
                    sectionLine = keyword.line();
                    continue;
                }
                var end = expectKeyword("end");
                return new DoBlock(Node.Sequence.of(sections), end.line());
            }
        } finally {
            noDoDepth = saved;
        }
    }

    // === Expressions ===

    private Node parseExpression() {
        return parseBinary(0);
    }

    private Node parseBinary(int minPrecedence) {
        var left = parseUnary();
        while (true) {
            if (peek() instanceof Token.Newline && isOperator(peekAt(1), "|>")) {
                advance();
            }
            if (!(peek() instanceof Token.Operator operator)) {
                return left;
            }
            var binary = Operators.binary(operator.symbol());
            if (binary.isEmpty() || binary.get().precedence() < minPrecedence) {
                return left;
            }
            advance();
            skipNewlines();
            int next = binary.get().rightAssociative()
                       ? binary.get().precedence()
                       : binary.get().precedence() + 1;
            var right = parseBinary(next);
            left = Node.Form.of(operator.symbol(), Meta.line(operator.line()), List.of(left, right));
        }
    }

    private Node parseUnary() {
        var token = peek();
        if (token instanceof Token.Operator operator && Operators.isUnary(operator.symbol())) {
            advance();
            var operand = operator.symbol().equals("&")
                          ? parseBinary(6)
                          : parseUnary();
            return Node.Form.of(operator.symbol(), Meta.line(operator.line()), List.of(operand));
        }
        return parsePostfix(parsePrimary());
    }

    private Node parsePostfix(Node primary) {
        var current = primary;
        while (isPunct(peek(), '.')) {
            var dot = peek();
            var member = peekAt(1);
            if (member instanceof Token.Alias alias && Nodes.aliasSegments(current).isPresent()) {
                advance();
                advance();
                var segments = new ArrayList<>(Nodes.aliasSegments(current).get());
                segments.add(alias.name());
                current = Nodes.aliases(((Node.Form) current).meta(), segments);
            } else if (member instanceof Token.Identifier identifier) {
                advance();
                advance();
                var target = Node.Form.of(Labels.DOT, Meta.line(dot.line()), List.of(current, Node.Leaf.atom(identifier.name())));
                current = remoteCall(target, identifier);
            } else if (isPunct(member, '{')) {
                advance();
                advance();
                var target = Node.Form.of(Labels.DOT, Meta.line(dot.line()), List.of(current, Node.Leaf.atom(Labels.TUPLE)));
                var items = parseArgList('}');
                current = Node.Apply.of(target, Meta.line(dot.line()), items.args());
            } else if (isPunct(member, '(')) {
                advance();
                advance();
                var target = Node.Form.of(Labels.DOT, Meta.line(dot.line()), List.of(current));
                var args = parseArgList(')');
                current = Node.Apply.of(target, Meta.line(dot.line()).with(Meta.PARENS, true), args.args());
            } else {
                throw error(member, "name after '.'");
            }
        }
        return current;
    }

    private Node remoteCall(Node.Form target, Token.Identifier name) {
        var meta = Meta.line(name.line());
        List<Node> args = List.of();
        var next = peek();
        if (isPunct(next, '(') && !next.spaced()) {
            advance();
            args = parseArgList(')').args();
            meta = meta.with(Meta.PARENS, true);
        } else if (canStartNoParenArg()) {
            args = parseNoParenArgs();
        }
        if (noDoDepth == 0 && isKeyword(peek(), "do")) {
            var doBlock = parseDoBlock();
            var withBlock = new ArrayList<>(args);
            withBlock.add(doBlock.sections());
            return Node.Apply.of(target, meta.with(Meta.END_LINE, doBlock.endLine()), withBlock);
        }
        return Node.Apply.of(target, meta, args);
    }

    private Node parsePrimary() {
        var token = peek();
        if (token instanceof Token.Identifier identifier) {
            advance();
            return parseCallOrIdentifier(identifier);
        }
        if (token instanceof Token.Alias alias) {
            advance();
            return Nodes.aliases(Meta.line(alias.line()), List.of(alias.name()));
        }
        if (token instanceof Token.Atom atom) {
            advance();
            return Node.Leaf.atom(atom.name(), atom.line());
        }
        if (token instanceof Token.Number number) {
            advance();
            return Node.Leaf.number(number.text(), number.line());
        }
        if (token instanceof Token.Str str) {
            advance();
            return new Node.Leaf(Node.Leaf.Kind.STRING, str.text(), Optional.of(str.line()));
        }
        if (token instanceof Token.Keyword keyword) {
            switch (keyword.word()) {
                case "true", "false" -> {
                    advance();
                    return Node.Leaf.bool(Boolean.parseBoolean(keyword.word()), keyword.line());
                }
                case "nil" -> {
                    advance();
                    return new Node.Leaf(Node.Leaf.Kind.NIL, "nil", Optional.of(keyword.line()));
                }
                default -> throw error(token, "expression");
            }
        }
        if (isPunct(token, '(')) {
            advance();
            int saved = noDoDepth;
            noDoDepth = 0;
            try {
                skipNewlines();
                var inner = parseExpression();
                skipNewlines();
                expectPunct(')');
                return inner;
            } finally {
                noDoDepth = saved;
            }
        }
        if (isPunct(token, '[')) {
            advance();
            var items = parseArgList(']');
            if (items.trailingKeywords()) {
                var flattened = new ArrayList<>(items.args().subList(0, items.args().size() - 1));
                flattened.addAll(items.args().get(items.args().size() - 1).children());
                return Node.Sequence.of(flattened);
            }
            return Node.Sequence.of(items.args());
        }
        if (isPunct(token, '{')) {
            advance();
            var items = parseArgList('}').args();
            if (items.size() == 2) {
                return new Node.Pair(items.get(0), items.get(1));
            }
            return Node.Form.of(Labels.TUPLE, Meta.line(token.line()), items);
        }
        throw error(token, "expression");
    }

    private Node parseCallOrIdentifier(Token.Identifier identifier) {
        var next = peek();
        if (isPunct(next, '(') && !next.spaced()) {
            advance();
            var args = parseArgList(')').args();
            return finishCall(identifier, args, true);
        }
        if (canStartNoParenArg()) {
            return finishCall(identifier, parseNoParenArgs(), false);
        }
        if (noDoDepth == 0 && isKeyword(next, "do")) {
            return finishCall(identifier, List.of(), false);
        }
        return Node.Leaf.identifier(identifier.name(), identifier.line());
    }

    private Node finishCall(Token.Identifier name, List<Node> args, boolean parens) {
        var meta = Meta.line(name.line());
        if (parens) {
            meta = meta.with(Meta.PARENS, true);
        }
        if (noDoDepth == 0 && isKeyword(peek(), "do")) {
            var doBlock = parseDoBlock();
            var withBlock = new ArrayList<>(args);
            withBlock.add(doBlock.sections());
            return Node.Form.of(name.name(), meta.with(Meta.END_LINE, doBlock.endLine()), withBlock);
        }
        return Node.Form.of(name.name(), meta, args);
    }

    // === Arguments ===

    private ArgList parseArgList(char close) {
        int saved = noDoDepth;
        noDoDepth = 0;
        try {
            var args = new ArrayList<Node>();
            skipNewlines();
            if (matchPunct(close)) {
                return new ArgList(args, false);
            }
            while (true) {
                if (peek() instanceof Token.KeywordKey) {
                    args.add(parseKeywords());
                    skipNewlines();
                    matchPunct(',');
                    skipNewlines();
                    expectPunct(close);
                    return new ArgList(args, true);
                }
                args.add(parseExpression());
                skipNewlines();
                if (matchPunct(',')) {
                    skipNewlines();
                    if (matchPunct(close)) {
                        return new ArgList(args, false);
                    }
                    continue;
                }
                expectPunct(close);
                return new ArgList(args, false);
            }
        } finally {
            noDoDepth = saved;
        }
    }

    private List<Node> parseNoParenArgs() {
        noDoDepth++;
        try {
            var args = new ArrayList<Node>();
            while (true) {
                if (peek() instanceof Token.KeywordKey) {
                    args.add(parseKeywords());
                    return args;
                }
                args.add(parseExpression());
                if (!matchPunct(',')) {
                    return args;
                }
                skipNewlines();
            }
        } finally {
            noDoDepth--;
        }
    }

    private Node parseKeywords() {
        var pairs = new ArrayList<Node>();
        while (true) {
            if (!(peek() instanceof Token.KeywordKey key)) {
                throw error(peek(), "keyword");
            }
            advance();
            skipNewlines();
            var value = parseExpression();
            pairs.add(new Node.Pair(Node.Leaf.atom(key.name(), key.line()), value));
            int lookahead = 0;
            if (!isPunct(peekAt(lookahead), ',')) {
                return Node.Sequence.of(pairs);
            }
            lookahead++;
            while (peekAt(lookahead) instanceof Token.Newline) {
                lookahead++;
            }
            if (!(peekAt(lookahead) instanceof Token.KeywordKey)) {
                return Node.Sequence.of(pairs);
            }
            for (int i = 0; i < lookahead; i++) {
                advance();
            }
        }
    }

    private boolean canStartNoParenArg() {
        var token = peek();
        if (!token.spaced()) {
            return false;
        }
        if (token instanceof Token.Identifier
            || token instanceof Token.Alias
            || token instanceof Token.Atom
            || token instanceof Token.Number
            || token instanceof Token.Str
            || token instanceof Token.KeywordKey) {
            return true;
        }
        if (token instanceof Token.Keyword keyword) {
            return keyword.word().equals("true") || keyword.word().equals("false") || keyword.word().equals("nil");
        }
        if (token instanceof Token.Punct punct) {
            return punct.symbol() == '[' || punct.symbol() == '{' || punct.symbol() == '(';
        }
        if (token instanceof Token.Operator operator) {
            var symbol = operator.symbol();
            if (symbol.equals("-") || symbol.equals("+")) {
                // `foo -1` is a call, `foo - 1` is arithmetic
                return !peekAt(1).spaced();
            }
            return symbol.equals("!") || symbol.equals("@") || symbol.equals("not") || symbol.equals("^") || symbol.equals("&");
        }
        return false;
    }

    // === Token access ===

    private Token peek() {
        return peekAt(0);
    }

    private Token peekAt(int offset) {
        int index = Math.min(pos + offset, tokens.size() - 1);
        return tokens.get(index);
    }

    private void advance() {
        if (pos < tokens.size() - 1) {
            pos++;
        }
    }

    private void skipNewlines() {
        while (peek() instanceof Token.Newline) {
            advance();
        }
    }

    private void skipSeparators() {
        while (peek() instanceof Token.Newline || isPunct(peek(), ';')) {
            advance();
        }
    }

    private boolean matchPunct(char symbol) {
        if (isPunct(peek(), symbol)) {
            advance();
            return true;
        }
        return false;
    }

    private void expectPunct(char symbol) {
        if (!matchPunct(symbol)) {
            throw error(peek(), "'" + symbol + "'");
        }
    }

    private Token expectOperator(String symbol) {
        var token = peek();
        if (!isOperator(token, symbol)) {
            throw error(token, "'" + symbol + "'");
        }
        advance();
        return token;
    }

    private Token expectKeyword(String word) {
        var token = peek();
        if (!isKeyword(token, word)) {
            throw error(token, "'" + word + "'");
        }
        advance();
        return token;
    }

    private static boolean isPunct(Token token, char symbol) {
        return token instanceof Token.Punct punct && punct.symbol() == symbol;
    }

    private static boolean isOperator(Token token, String symbol) {
        return token instanceof Token.Operator operator && operator.symbol().equals(symbol);
    }

    private static boolean isKeyword(Token token, String word) {
        return token instanceof Token.Keyword keyword && keyword.word().equals(word);
    }

    private RestyleException error(Token token, String expected) {
        return syntaxError(file, token, expected);
    }

    private static RestyleException syntaxError(String file, Token token, String expected) {
        return new RestyleException(new RestyleError.SyntaxError(file, token.line(), token.column(), token.describe(), expected));
    }
}
