package org.pragmatica.restyle.codec;

import com.google.common.collect.ImmutableList;
import org.pragmatica.restyle.comment.Comment;
import org.pragmatica.restyle.comment.Comments;
import org.pragmatica.restyle.tree.Labels;
import org.pragmatica.restyle.tree.Lines;
import org.pragmatica.restyle.tree.Meta;
import org.pragmatica.restyle.tree.Node;
import org.pragmatica.restyle.tree.Nodes;

import java.util.List;
import java.util.Optional;

/**
 * Prints a tree back to source text, weaving in comments by line number.
 *
 * <p>Each statement starts on its own line. A comment is printed on its own line before the
 * first statement, section keyword or {@code end} whose line is not smaller than the comment's.
 * Blank lines come from the {@link Meta#NEWLINES} of statements and from the newline count
 * recorded before comments; at most one blank line separates two printed lines, and never at
 * the start of a body.
 */
final class SourcePrinter {
    private static final String INDENT = "  ";

    private final ImmutableList<Comment> comments;
    private final int lineLength;
    private StringBuilder out = new StringBuilder();
    private int indent;
    private int nextComment;
    private int lastCommentLine;
    private boolean pendingBlank;
    // while measuring, nothing is broken across lines
    private boolean flat;

    private SourcePrinter(ImmutableList<Comment> comments, int lineLength) {
        this.comments = comments;
        this.lineLength = lineLength;
    }

    static String print(Node tree, List<Comment> comments, PrintOptions options) {
        return new SourcePrinter(Comments.sorted(comments), options.lineLength()).program(tree);
    }

    private String program(Node tree) {
        statements(Nodes.statements(tree));
        flushComments(Integer.MAX_VALUE, out.length() == 0);
        if (out.length() == 0) {
            return "";
        }
        return out.append('\n').toString();
    }

    // === Layout ===

    private void statements(List<Node> statements) {
        boolean first = true;
        for (var statement : statements) {
            int line = Lines.minLine(statement);
            boolean flushed = line > 0 && flushComments(line, first);
            if ((!first && pendingBlank) || (flushed && lastCommentLine < line - 1)) {
                blank();
            }
            pendingBlank = false;
            newline();
            write(statement);
            pendingBlank = Lines.newlines(statement) >= 2;
            first = false;
        }
    }

    private void clauses(List<Node> clauses) {
        boolean first = true;
        for (var item : clauses) {
            var clause = (Node.Form) item;
            int line = Lines.minLine(clause);
            boolean flushed = line > 0 && flushComments(line, first);
            if ((!first && pendingBlank) || (flushed && lastCommentLine < line - 1)) {
                blank();
            }
            pendingBlank = false;
            newline();
            writeJoined(clause.args().get(0).children(), false);
            out.append(" ->");
            var body = Nodes.statements(clause.args().get(1));
            var inline = inlineClauseBody(clause, body);
            if (inline.isPresent()) {
                out.append(' ').append(inline.get());
                pendingBlank = Lines.newlines(body.get(0)) >= 2;
            } else {
                indent++;
                statements(body);
                indent--;
            }
            first = false;
        }
    }

    private Optional<String> inlineClauseBody(Node.Form clause, List<Node> body) {
        if (body.size() != 1 || !isFlat(body.get(0))) {
            return Optional.empty();
        }
        var statement = body.get(0);
        if (Lines.minLine(statement) != clause.line().orElse(-1)) {
            return Optional.empty();
        }
        if (nextComment < comments.size() && comments.get(nextComment).line() <= Lines.maxLine(statement)) {
            return Optional.empty();
        }
        var text = renderFlat(statement);
        return column() + 1 + text.length() <= lineLength
               ? Optional.of(text)
               : Optional.empty();
    }

    private void section(Node content) {
        if (content instanceof Node.Sequence sequence && !sequence.items().isEmpty()
            && sequence.items().stream().allMatch(item -> Nodes.isForm(item, Labels.ARROW))) {
            clauses(sequence.items());
            return;
        }
        statements(Nodes.statements(content));
    }

    /**
     * Print comments with line up to {@code upTo}. Returns whether anything was printed.
     */
    private boolean flushComments(int upTo, boolean bodyStart) {
        boolean any = false;
        while (nextComment < comments.size() && comments.get(nextComment).line() <= upTo) {
            var comment = comments.get(nextComment++);
            boolean atStart = bodyStart && !any;
            if (!atStart && (pendingBlank || comment.previousEolCount() >= 2)) {
                blank();
            }
            pendingBlank = false;
            newline();
            out.append(comment.text());
            lastCommentLine = comment.line();
            any = true;
        }
        return any;
    }

    private void newline() {
        if (out.length() > 0) {
            out.append('\n');
        }
        out.append(INDENT.repeat(indent));
    }

    private void blank() {
        if (out.length() > 0) {
            out.append('\n');
        }
    }

    private int column() {
        return out.length() - (out.lastIndexOf("\n") + 1);
    }

    private String renderFlat(Node node) {
        return renderFlat(() -> write(node));
    }

    private String renderFlat(Runnable writer) {
        var savedOut = out;
        var savedFlat = flat;
        out = new StringBuilder();
        flat = true;
        try {
            writer.run();
            return out.toString();
        } finally {
            out = savedOut;
            flat = savedFlat;
        }
    }

    // === Expressions ===

    private void write(Node node) {
        if (node instanceof Node.Leaf leaf) {
            writeLeaf(leaf);
        } else if (node instanceof Node.Sequence sequence) {
            writeList(sequence);
        } else if (node instanceof Node.Pair pair) {
            out.append('{');
            writeJoined(pair.children(), false);
            out.append('}');
        } else if (node instanceof Node.Apply apply) {
            writeApply(apply);
        } else {
            writeForm((Node.Form) node);
        }
    }

    private void writeLeaf(Node.Leaf leaf) {
        if (leaf.kind() == Node.Leaf.Kind.ATOM) {
            out.append(':');
        }
        out.append(leaf.text());
    }

    private void writeList(Node.Sequence sequence) {
        if (!flat && hasPendingCommentWithin(sequence)) {
            writeBrokenList(sequence.items());
            return;
        }
        out.append('[');
        if (isKeywordList(sequence)) {
            writeKeywords(sequence.items());
        } else {
            writeJoined(sequence.items(), false);
        }
        out.append(']');
    }

    // one item per line, comments above the item they precede
    private void writeBrokenList(List<Node> items) {
        boolean keywords = isKeywordList(Node.Sequence.of(items));
        out.append('[');
        indent++;
        for (int i = 0; i < items.size(); i++) {
            var item = items.get(i);
            int line = Lines.minLine(item);
            if (line > 0) {
                flushComments(line, i == 0);
            }
            newline();
            if (keywords) {
                var pair = (Node.Pair) item;
                out.append(((Node.Leaf) pair.left()).text()).append(": ");
                write(pair.right());
            } else {
                write(item);
            }
            if (i < items.size() - 1) {
                out.append(',');
            }
        }
        indent--;
        newline();
        out.append(']');
    }

    private boolean hasPendingCommentWithin(Node node) {
        int last = Lines.maxLine(node);
        return last > 0 && nextComment < comments.size() && comments.get(nextComment).line() <= last;
    }

    private void writeKeywords(List<Node> pairs) {
        for (int i = 0; i < pairs.size(); i++) {
            if (i > 0) {
                out.append(", ");
            }
            var pair = (Node.Pair) pairs.get(i);
            out.append(((Node.Leaf) pair.left()).text()).append(": ");
            write(pair.right());
        }
    }

    // Trailing keyword lists of calls print without brackets.
    private void writeJoined(List<Node> items, boolean bareKeywords) {
        for (int i = 0; i < items.size(); i++) {
            if (i > 0) {
                out.append(", ");
            }
            var item = items.get(i);
            if (bareKeywords && i == items.size() - 1 && isKeywordList(item)) {
                writeKeywords(item.children());
            } else {
                write(item);
            }
        }
    }

    private void writeForm(Node.Form form) {
        var label = form.label();
        var args = form.args();
        if (form.is(Labels.ALIASES)) {
            for (int i = 0; i < args.size(); i++) {
                if (i > 0) {
                    out.append('.');
                }
                if (args.get(i) instanceof Node.Leaf leaf && leaf.kind() == Node.Leaf.Kind.ATOM) {
                    out.append(leaf.text());
                } else {
                    write(args.get(i));
                }
            }
            return;
        }
        if (form.is(Labels.TUPLE)) {
            out.append('{');
            writeJoined(args, false);
            out.append('}');
            return;
        }
        if (form.is(Labels.BLOCK)) {
            writeInlineBlock(args);
            return;
        }
        if (form.is(Labels.DOT)) {
            write(args.get(0));
            out.append('.');
            if (args.size() > 1) {
                out.append(((Node.Leaf) args.get(1)).text());
            }
            return;
        }
        if (form.is(Labels.ARROW)) {
            writeJoined(args.get(0).children(), false);
            out.append(" -> ");
            write(args.get(1));
            return;
        }
        if (args.size() == 2) {
            var binary = Operators.binary(label);
            if (binary.isPresent()) {
                writeBinary(form, binary.get());
                return;
            }
        }
        if (args.size() == 1 && Operators.isUnary(label)) {
            writeUnary(label, args.get(0));
            return;
        }
        writeCall(label, form.meta(), args, true);
    }

    private void writeInlineBlock(List<Node> statements) {
        if (statements.isEmpty()) {
            out.append("nil");
            return;
        }
        out.append('(');
        for (int i = 0; i < statements.size(); i++) {
            if (i > 0) {
                out.append("; ");
            }
            write(statements.get(i));
        }
        out.append(')');
    }

    private void writeBinary(Node.Form form, Operators.Binary operator) {
        if (form.is("|>") && !flat && isFlat(form)) {
            var text = renderFlat(form);
            if (column() + text.length() > lineLength) {
                writeBrokenPipeline(form);
                return;
            }
        }
        writeOperand(form.args().get(0), operator, false);
        if (form.is("..")) {
            out.append("..");
        } else {
            out.append(' ').append(form.label()).append(' ');
        }
        writeOperand(form.args().get(1), operator, true);
    }

    private void writeBrokenPipeline(Node.Form form) {
        var left = form.args().get(0);
        if (Nodes.isForm(left, "|>")) {
            writeBrokenPipeline((Node.Form) left);
        } else {
            write(left);
        }
        newline();
        out.append("|> ");
        writeOperand(form.args().get(1), Operators.binary("|>").orElseThrow(), true);
    }

    private void writeOperand(Node operand, Operators.Binary parent, boolean right) {
        var inner = binaryOf(operand);
        boolean wrap = inner.isPresent()
                       && (inner.get().precedence() < parent.precedence()
                           || (inner.get().precedence() == parent.precedence() && right != parent.rightAssociative()));
        if (wrap) {
            out.append('(');
            write(operand);
            out.append(')');
        } else {
            write(operand);
        }
    }

    private void writeUnary(String operator, Node operand) {
        out.append(operator);
        if (operator.equals("not")) {
            out.append(' ');
        }
        // &fun/arity
        if (operator.equals("&") && operand instanceof Node.Form form && form.is("/") && form.args().size() == 2) {
            write(form.args().get(0));
            out.append('/');
            write(form.args().get(1));
            return;
        }
        if (binaryOf(operand).isPresent()) {
            out.append('(');
            write(operand);
            out.append(')');
        } else {
            write(operand);
        }
    }

    private void writeApply(Node.Apply apply) {
        var target = apply.target();
        var args = apply.args();
        if (target instanceof Node.Form dot && dot.is(Labels.DOT)) {
            if (dot.args().size() == 1) {
                write(dot.args().get(0));
                out.append(".(");
                writeJoined(args, true);
                out.append(')');
                return;
            }
            if (dot.args().size() == 2 && dot.args().get(1) instanceof Node.Leaf name) {
                write(dot.args().get(0));
                if (name.isAtom(Labels.TUPLE)) {
                    out.append(".{");
                    writeJoined(args, false);
                    out.append('}');
                    return;
                }
                out.append('.');
                writeCall(name.text(), apply.meta(), args, false);
                return;
            }
        }
        write(target);
        out.append('(');
        writeJoined(args, true);
        out.append(')');
    }

    private void writeCall(String name, Meta meta, List<Node> args, boolean emptyParens) {
        var block = doBlockOf(meta, args);
        var plainArgs = block.isPresent()
                        ? args.subList(0, args.size() - 1)
                        : args;
        boolean parens = meta.flag(Meta.PARENS) || (block.isEmpty() && emptyParens && args.isEmpty());
        out.append(name);
        if (parens) {
            if (block.isEmpty() && !plainArgs.isEmpty() && plainArgs.stream().allMatch(SourcePrinter::isFlat)) {
                var text = renderFlat(() -> writeJoined(plainArgs, true));
                if (!flat && column() + text.length() + 2 > lineLength) {
                    writeBrokenArgs(plainArgs);
                    return;
                }
                out.append('(').append(text).append(')');
                return;
            }
            out.append('(');
            writeJoined(plainArgs, true);
            out.append(')');
        } else if (!plainArgs.isEmpty()) {
            out.append(' ');
            writeJoined(plainArgs, true);
        }
        if (block.isPresent()) {
            writeDoBlock(block.get(), meta.endLine().orElse(0));
        }
    }

    private void writeBrokenArgs(List<Node> args) {
        out.append('(');
        indent++;
        for (int i = 0; i < args.size(); i++) {
            newline();
            var arg = args.get(i);
            if (i == args.size() - 1 && isKeywordList(arg)) {
                writeKeywords(arg.children());
            } else {
                write(arg);
            }
            if (i < args.size() - 1) {
                out.append(',');
            }
        }
        indent--;
        newline();
        out.append(')');
    }

    private void writeDoBlock(Node.Sequence block, int endLine) {
        out.append(" do");
        int mark = out.length();
        boolean first = true;
        for (var item : block.items()) {
            var section = (Node.Pair) item;
            var key = (Node.Leaf) section.left();
            if (!first) {
                indent++;
                flushComments(key.line().orElse(0) - 1, out.length() == mark);
                indent--;
                pendingBlank = false;
                newline();
                out.append(key.text());
                mark = out.length();
            }
            indent++;
            section(section.right());
            indent--;
            pendingBlank = false;
            first = false;
        }
        indent++;
        flushComments(endLine - 1, out.length() == mark);
        indent--;
        pendingBlank = false;
        newline();
        out.append("end");
    }

    // === Shape queries ===

    private static Optional<Operators.Binary> binaryOf(Node node) {
        if (node instanceof Node.Form form && form.args().size() == 2) {
            return Operators.binary(form.label());
        }
        return Optional.empty();
    }

    private static boolean isKeywordList(Node node) {
        if (!(node instanceof Node.Sequence sequence) || sequence.items().isEmpty()) {
            return false;
        }
        for (var item : sequence.items()) {
            if (!(item instanceof Node.Pair pair)
                || !(pair.left() instanceof Node.Leaf leaf)
                || leaf.kind() != Node.Leaf.Kind.ATOM) {
                return false;
            }
        }
        return true;
    }

    /**
     * The {@code do}/{@code else}/... sections of a call written with a {@code do ... end} block.
     */
    static Optional<Node.Sequence> doBlockOf(Meta meta, List<Node> args) {
        if (meta.endLine().isEmpty() || args.isEmpty()) {
            return Optional.empty();
        }
        if (!(args.get(args.size() - 1) instanceof Node.Sequence sections) || !isKeywordList(sections)) {
            return Optional.empty();
        }
        var firstKey = (Node.Leaf) ((Node.Pair) sections.items().get(0)).left();
        return firstKey.isAtom(Labels.DO)
               ? Optional.of(sections)
               : Optional.empty();
    }

    private static boolean isFlat(Node node) {
        if (node instanceof Node.Form form && doBlockOf(form.meta(), form.args()).isPresent()) {
            return false;
        }
        if (node instanceof Node.Apply apply && doBlockOf(apply.meta(), apply.args()).isPresent()) {
            return false;
        }
        for (var child : node.children()) {
            if (!isFlat(child)) {
                return false;
            }
        }
        return true;
    }
}
