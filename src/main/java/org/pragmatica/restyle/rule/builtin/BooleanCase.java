package org.pragmatica.restyle.rule.builtin;

import com.google.common.collect.Range;
import org.pragmatica.restyle.comment.Comment;
import org.pragmatica.restyle.comment.Comments;
import org.pragmatica.restyle.rule.Rule;
import org.pragmatica.restyle.rule.RuleContext;
import org.pragmatica.restyle.tree.Labels;
import org.pragmatica.restyle.tree.Lines;
import org.pragmatica.restyle.tree.Meta;
import org.pragmatica.restyle.tree.Node;
import org.pragmatica.restyle.tree.Nodes;
import org.pragmatica.restyle.zipper.Visit;
import org.pragmatica.restyle.zipper.Zipper;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Rewrites a two-clause {@code case} over a boolean into an {@code if}:
 *
 * <pre>
 * case valid? do          if valid? do
 *   true -> :ok       =>    :ok
 *   false -> :error       else
 * end                       :error
 *                         end
 * </pre>
 * The clause pairs {@code true/false}, {@code true/_} and {@code false/true} are recognized.
 * An {@code if} whose {@code else} body is empty or {@code nil} loses the {@code else}.
 */
public final class BooleanCase implements Rule {
    public static final String NAME = "booleanCase";

    private static final String CASE = "case";
    private static final String IF = "if";
    private static final String WILDCARD = "_";

    private record Branch(Node.Leaf keyword, Node body) {}

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public Visit<RuleContext> run(Zipper zipper, RuleContext context) {
        var node = zipper.node();
        if (Nodes.isForm(node, CASE)) {
            return rewriteCase(zipper, (Node.Form) node, context);
        }
        if (Nodes.isForm(node, IF)) {
            return tidyIf(zipper, (Node.Form) node, context);
        }
        return Visit.cont(zipper, context);
    }

    private Visit<RuleContext> rewriteCase(Zipper zipper, Node.Form caseForm, RuleContext context) {
        if (caseForm.args().size() != 2) {
            return Visit.cont(zipper, context);
        }
        var clauses = Nodes.keyword(caseForm.args().get(1), Labels.DO)
                           .filter(Node.Sequence.class::isInstance)
                           .map(Node::children)
                           .filter(items -> items.size() == 2 && items.stream().allMatch(item -> Nodes.isForm(item, Labels.ARROW)));
        if (clauses.isEmpty()) {
            return Visit.cont(zipper, context);
        }
        var first = (Node.Form) clauses.get().get(0);
        var second = (Node.Form) clauses.get().get(1);
        var firstPattern = singlePattern(first);
        var secondPattern = singlePattern(second);
        if (firstPattern.isEmpty() || secondPattern.isEmpty()) {
            return Visit.cont(zipper, context);
        }
        var head = caseForm.args().get(0);
        var a = first.args().get(1);
        var b = second.args().get(1);
        if (isBoolean(firstPattern.get(), true) && (isBoolean(secondPattern.get(), false) || isWildcard(secondPattern.get()))) {
            return ifAst(zipper, caseForm, head, a, b, context);
        }
        if (isBoolean(firstPattern.get(), false) && isBoolean(secondPattern.get(), true)) {
            return ifAst(zipper, caseForm, head, b, a, context);
        }
        return Visit.cont(zipper, context);
    }

    private Visit<RuleContext> tidyIf(Zipper zipper, Node.Form ifForm, RuleContext context) {
        if (ifForm.args().size() != 2 || !(ifForm.args().get(1) instanceof Node.Sequence sections)
            || sections.items().size() != 2) {
            return Visit.cont(zipper, context);
        }
        if (!(sections.items().get(0) instanceof Node.Pair doPair)
            || !(sections.items().get(1) instanceof Node.Pair elsePair)
            || !(doPair.left() instanceof Node.Leaf doKey) || !doKey.isAtom(Labels.DO)
            || !(elsePair.left() instanceof Node.Leaf elseKey) || !elseKey.isAtom(Labels.ELSE)) {
            return Visit.cont(zipper, context);
        }
        var elseBody = elsePair.right();
        boolean emptyElse = Nodes.isForm(elseBody, Labels.BLOCK) && elseBody.children().isEmpty();
        boolean nilElse = elseBody instanceof Node.Leaf leaf && leaf.kind() == Node.Leaf.Kind.NIL;
        if (emptyElse || nilElse) {
            var withoutElse = ifForm.withChildren(List.of(ifForm.args().get(0), Node.Sequence.of(doPair)));
            return Visit.cont(zipper.replace(withoutElse), context);
        }
        int maxElseLine = Lines.maxLine(elseBody);
        if (maxElseLine > 0 && Lines.maxLine(doPair.right()) > maxElseLine) {
            // branches were swapped by an earlier rewrite; put lines back in order
            return ifAst(zipper, ifForm, ifForm.args().get(0), new Branch(doKey, doPair.right()), new Branch(elseKey, elseBody), context);
        }
        return Visit.cont(zipper, context);
    }

    private Visit<RuleContext> ifAst(Zipper zipper, Node.Form original, Node head, Node doBody, Node elseBody, RuleContext context) {
        return ifAst(zipper, original, head, new Branch(Node.Leaf.atom(Labels.DO), doBody), new Branch(Node.Leaf.atom(Labels.ELSE), elseBody), context);
    }

    /**
     * Build the {@code if} and renumber both branches and their comments so that the do branch
     * comes first, then the {@code else} keyword, then the else branch.
     */
    private Visit<RuleContext> ifAst(Zipper zipper, Node.Form original, Node head, Branch doBranch, Branch elseBranch, RuleContext context) {
        int line = original.line().orElseGet(() -> Lines.minLine(head));
        var doBody = withoutNewlines(doBranch.body());
        var elseBody = withoutNewlines(elseBranch.body());
        int maxDoLine = Lines.maxLine(doBody);
        int maxElseLine = Lines.maxLine(elseBody);

        Node shiftedDo = doBody;
        Node shiftedElse = elseBody;
        List<Comment> comments = context.comments();
        if (maxDoLine > 0 && maxElseLine > 0) {
            if (maxDoLine >= maxElseLine) {
                // the branches swap places: else moves down by the do size, do moves up by the else size
                int elseSize = maxElseLine - line;
                int doSize = maxDoLine - maxElseLine;
                shiftedDo = Lines.shiftLine(doBody, -elseSize);
                shiftedElse = Lines.shiftLine(elseBody, doSize);
                var shifts = new ArrayList<Comments.Shift>();
                if (line <= maxElseLine) {
                    shifts.add(Comments.Shift.of(line, maxElseLine, doSize));
                }
                if (maxElseLine < maxDoLine) {
                    shifts.add(Comments.Shift.of(maxElseLine + 1, maxDoLine, -elseSize));
                }
                comments = Comments.shift(comments, shifts);
            } else {
                // make room for the else keyword
                shiftedElse = Lines.shiftLine(elseBody, 1);
                comments = Comments.shift(comments, Range.closed(maxDoLine + 1, maxElseLine), 1);
            }
        }
        int elseLine = Math.max(Lines.maxLine(shiftedDo), line) + 1;
        var doKey = doBranch.keyword().withLine(Optional.of(line));
        var elseKey = elseBranch.keyword().withLine(Optional.of(elseLine));

        var meta = original.meta().with(Meta.LINE, line);
        if (original.meta().endLine().isEmpty()) {
            meta = meta.without(Meta.END_LINE);
        }
        var ifForm = Node.Form.of(IF, meta, List.of(head, Node.Sequence.of(new Node.Pair(doKey, shiftedDo), new Node.Pair(elseKey, shiftedElse))));
        // re-dispatch: the new if may itself be tidied
        return run(zipper.replace(ifForm), context.withComments(comments));
    }

    private static Node withoutNewlines(Node body) {
        if (body instanceof Node.Form form) {
            return form.withMeta(form.meta().without(Meta.NEWLINES));
        }
        if (body instanceof Node.Apply apply) {
            return apply.withMeta(apply.meta().without(Meta.NEWLINES));
        }
        return body;
    }

    private static Optional<Node> singlePattern(Node.Form clause) {
        var patterns = clause.args().get(0).children();
        return patterns.size() == 1
               ? Optional.of(patterns.get(0))
               : Optional.empty();
    }

    private static boolean isBoolean(Node node, boolean value) {
        return node instanceof Node.Leaf leaf && leaf.isBoolean(value);
    }

    private static boolean isWildcard(Node node) {
        return node instanceof Node.Leaf leaf && leaf.kind() == Node.Leaf.Kind.IDENTIFIER && leaf.text().equals(WILDCARD);
    }
}
