package org.pragmatica.restyle.rule.builtin;

import org.pragmatica.restyle.rule.Rule;
import org.pragmatica.restyle.rule.RuleContext;
import org.pragmatica.restyle.tree.Node;
import org.pragmatica.restyle.zipper.Visit;
import org.pragmatica.restyle.zipper.Zipper;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Acts on directive comments. {@code # restyle:sort} sorts the list literal of the first form
 * starting at or below the directive's line:
 *
 * <pre>
 * # restyle:sort
 * &#64;roles [:user, :admin, :guest]
 * </pre>
 * becomes {@code @roles [:admin, :guest, :user]}. Sorting looks through {@code @attr value}
 * and the right-hand side of {@code =}.
 *
 * <p>The whole tree is handled on the first visit, after which the traversal halts.
 */
public final class CommentDirectives implements Rule {
    public static final String NAME = "commentDirectives";
    public static final String SORT = "# restyle:sort";

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public Visit<RuleContext> run(Zipper zipper, RuleContext context) {
        var current = zipper;
        for (var comment : context.comments()) {
            if (!comment.text().equals(SORT)) {
                continue;
            }
            int line = comment.line();
            var found = current.find(node -> formLine(node) >= line);
            if (found.isPresent()) {
                current = found.get().update(CommentDirectives::sort);
            }
        }
        return Visit.halt(current, context);
    }

    private static int formLine(Node node) {
        if (node instanceof Node.Form form) {
            return form.meta().line().orElse(-1);
        }
        if (node instanceof Node.Apply apply) {
            return apply.meta().line().orElse(-1);
        }
        return -1;
    }

    private static Node sort(Node node) {
        if (node instanceof Node.Sequence sequence) {
            var items = new ArrayList<>(sequence.items());
            items.sort(Comparator.comparing(CommentDirectives::sortKey));
            return Node.Sequence.of(items);
        }
        if (node instanceof Node.Form form && form.is("=") && form.args().size() == 2) {
            return form.withChildren(List.of(form.args().get(0), sort(form.args().get(1))));
        }
        if (node instanceof Node.Form form && form.is("@") && form.args().size() == 1
            && form.args().get(0) instanceof Node.Form attribute && attribute.args().size() == 1) {
            return form.withChildren(List.of(attribute.withChildren(List.of(sort(attribute.args().get(0))))));
        }
        return node;
    }

    // Leaves sort by their text, keyword entries by key, other shapes by their parts
    private static String sortKey(Node node) {
        if (node instanceof Node.Leaf leaf) {
            return leaf.text();
        }
        var key = new StringBuilder();
        if (node instanceof Node.Form form) {
            key.append(form.label());
        }
        for (var child : node.children()) {
            key.append(' ').append(sortKey(child));
        }
        return key.toString();
    }
}
