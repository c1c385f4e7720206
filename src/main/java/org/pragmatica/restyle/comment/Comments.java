package org.pragmatica.restyle.comment;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.Range;
import org.pragmatica.restyle.tree.Lines;
import org.pragmatica.restyle.tree.Node;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Comment ledger operations. The ledger is an ordered-by-line list of comments kept
 * outside the tree; these operations keep it consistent as rewrites move, collapse or
 * reorder nodes.
 *
 * <p>The printer places comments purely by comparing line numbers, so a rewrite that
 * changes line spans or sibling order must move the affected comments explicitly.
 * Comments that cannot be attributed to a node keep their line and may print next to a
 * neighbouring statement.
 */
public final class Comments {
    private Comments() {}

    private static final Comparator<Comment> BY_LINE = Comparator.comparingInt(Comment::line);

    /**
     * A line range and the delta to apply to comments inside it.
     */
    public record Shift(Range<Integer> range, int delta) {
        public static Shift of(int first, int last, int delta) {
            return new Shift(Range.closed(first, last), delta);
        }
    }

    /**
     * Comments split into those belonging to a line span and the rest, both ordered by line.
     */
    public record Split(ImmutableList<Comment> matching, ImmutableList<Comment> rest) {}

    /**
     * Result of reordering a sibling list: nodes with reassigned lines and the updated ledger.
     */
    public record Reordered(ImmutableList<Node> nodes, ImmutableList<Comment> comments) {}

    /**
     * The contiguous run of comments ending on {@code line} or the line above it, in source order.
     *
     * <pre>
     * 1 # not related
     * 2
     * 3 # 1
     * 4 # 2
     * 5 code # 3
     * </pre>
     * {@code preceding(comments, 5)} is {@code [# 1, # 2, # 3]}.
     */
    public static List<Comment> preceding(List<Comment> comments, int line) {
        var result = new ArrayList<Comment>();
        int expected = -1;
        for (int i = comments.size() - 1; i >= 0; i--) {
            var comment = comments.get(i);
            if (result.isEmpty()) {
                if (comment.line() == line || comment.line() == line - 1) {
                    result.add(comment);
                    expected = comment.line() - 1;
                }
                continue;
            }
            if (comment.line() != expected) {
                break;
            }
            result.add(comment);
            expected--;
        }
        return ImmutableList.copyOf(result).reverse();
    }

    /**
     * Move every comment inside {@code range} to the range's first line.
     */
    public static ImmutableList<Comment> displace(List<Comment> comments, Range<Integer> range) {
        int first = range.lowerEndpoint();
        var result = ImmutableList.<Comment>builderWithExpectedSize(comments.size());
        for (var comment : comments) {
            result.add(range.contains(comment.line())
                       ? comment.withLine(first)
                       : comment);
        }
        return result.build();
    }

    /**
     * Add {@code delta} to every comment line inside {@code range}.
     */
    public static ImmutableList<Comment> shift(List<Comment> comments, Range<Integer> range, int delta) {
        return shift(comments, List.of(new Shift(range, delta)));
    }

    /**
     * Apply several shifts in a single pass, so a comment moves at most once. Swapping two regions
     * with two separate passes would otherwise move region A onto B and then everything back.
     * The first matching shift wins; lines are clamped to 1 and the ledger is re-sorted.
     */
    public static ImmutableList<Comment> shift(List<Comment> comments, List<Shift> shifts) {
        var result = new ArrayList<Comment>(comments.size());
        for (var comment : comments) {
            var moved = comment;
            for (var shift : shifts) {
                if (shift.range().contains(comment.line())) {
                    moved = comment.withLine(Math.max(comment.line() + shift.delta(), 1));
                    break;
                }
            }
            result.add(moved);
        }
        result.sort(BY_LINE);
        return ImmutableList.copyOf(result);
    }

    /**
     * All comments on lines {@code start..last}, plus the contiguous run of comments directly above
     * {@code start}.
     *
     * <pre>
     * 1 code
     * 2 # a
     * 3 # b
     * 4 code # c
     * 5 # d
     * 6 code
     * 7 # e
     * </pre>
     * {@code forLines(comments, 4, 6)} matches {@code a, b, c, d}.
     */
    public static Split forLines(List<Comment> comments, int start, int last) {
        var matching = new ArrayList<Comment>();
        var after = new ArrayList<Comment>();
        int i = comments.size() - 1;
        int top = start;
        for (; i >= 0; i--) {
            var comment = comments.get(i);
            int line = comment.line();
            if (line > last) {
                after.add(comment);
            } else if (line >= top) {
                matching.add(comment);
            } else if (line == top - 1) {
                matching.add(comment);
                top = line;
            } else {
                break;
            }
        }
        var rest = ImmutableList.<Comment>builderWithExpectedSize(comments.size() - matching.size());
        rest.addAll(comments.subList(0, i + 1));
        rest.addAll(ImmutableList.copyOf(after).reverse());
        return new Split(ImmutableList.copyOf(matching).reverse(), rest.build());
    }

    /**
     * {@link #forLines} over the lines a node spans.
     */
    public static Split forNode(Node node, List<Comment> comments) {
        int first = Lines.minLine(node);
        return forLines(comments, first, Math.max(first, Lines.maxLine(node)));
    }

    /**
     * Reassign lines after reordering siblings.
     *
     * <p>Each node takes its comments (inside its span and the run directly above it) along.
     * The first node, including its leading comments, starts at {@code firstLine}; every following
     * node starts after the previous one's last line plus its recorded newlines, so lines strictly
     * increase in the new order. Comments belonging to no node keep their lines.
     */
    public static Reordered orderLineMetaAndComments(List<Node> nodes, List<Comment> comments, int firstLine) {
        var remaining = ImmutableList.copyOf(comments);
        var moved = new ArrayList<Comment>();
        var result = ImmutableList.<Node>builderWithExpectedSize(nodes.size());
        int start = firstLine;
        for (var node : nodes) {
            int line = Lines.minLine(node);
            int lastLine = Math.max(line, Lines.maxLine(node));
            var split = forLines(remaining, line, lastLine);
            remaining = split.rest();
            int lineWithComments = split.matching().isEmpty()
                                   ? line
                                   : split.matching().get(0).line();
            int delta = start - lineWithComments;
            result.add(Lines.shiftLine(node, delta));
            for (var comment : split.matching()) {
                moved.add(comment.withLine(comment.line() + delta));
            }
            start = lastLine + delta + Math.max(Lines.newlines(node), 1);
        }
        var ledger = new ArrayList<Comment>(remaining);
        ledger.addAll(moved);
        ledger.sort(BY_LINE);
        return new Reordered(result.build(), ImmutableList.copyOf(ledger));
    }

    /**
     * Order a ledger by line; equal lines keep their relative order.
     */
    public static ImmutableList<Comment> sorted(List<Comment> comments) {
        var result = new ArrayList<>(comments);
        result.sort(BY_LINE);
        return ImmutableList.copyOf(result);
    }
}
