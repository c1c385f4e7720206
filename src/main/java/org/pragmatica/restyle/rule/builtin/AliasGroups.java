package org.pragmatica.restyle.rule.builtin;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.Range;
import org.pragmatica.restyle.comment.Comments;
import org.pragmatica.restyle.rule.Blocks;
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
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Organizes each contiguous group of {@code alias} directives in a block:
 * <ul>
 *   <li>multi-aliases are expanded, {@code alias Foo.{Bar, Baz}} becoming two directives;</li>
 *   <li>single-segment aliases such as {@code alias Foo} are dropped;</li>
 *   <li>directives are sorted and de-duplicated ignoring case;</li>
 *   <li>the group is followed by a blank line.</li>
 * </ul>
 * Comments above or beside a directive travel with it.
 */
public final class AliasGroups implements Rule {
    public static final String NAME = "aliasGroups";

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public Visit<RuleContext> run(Zipper zipper, RuleContext context) {
        var node = zipper.node();
        if (Nodes.isForm(node, Labels.BLOCK)) {
            return organize(zipper, context);
        }
        if (isMultiAlias(node) && !hasBlockParent(zipper)) {
            return Blocks.ensureBlockParent(zipper)
                         .flatMap(Zipper::up)
                         .map(block -> organize(block, context))
                         .orElseGet(() -> Visit.cont(zipper, context));
        }
        return Visit.cont(zipper, context);
    }

    private static Visit<RuleContext> organize(Zipper blockZipper, RuleContext context) {
        var current = blockZipper;
        var children = current.node().children();
        var comments = context.comments();
        boolean changed = false;
        int i = 0;
        while (i < children.size()) {
            if (!isAlias(children.get(i))) {
                i++;
                continue;
            }
            int end = i;
            while (end < children.size() && isAlias(children.get(end))) {
                end++;
            }
            var group = children.subList(i, end);
            var organized = expandAndSort(group);
            if (organized.equals(group)) {
                i = end;
                continue;
            }
            int first = Lines.minLine(group.get(0));
            int last = group.stream().mapToInt(Lines::maxLine).max().orElse(first);
            var leading = Comments.forLines(comments, first, first).matching();
            int firstLine = leading.isEmpty()
                            ? first
                            : Math.min(first, leading.get(0).line());
            // comments below the group are never claimed by its directives
            var below = comments.stream().filter(comment -> comment.line() > last).collect(Collectors.toList());
            var above = comments.stream().filter(comment -> comment.line() <= last).collect(Collectors.toList());
            var reordered = Comments.orderLineMetaAndComments(organized, above, firstLine);
            int growth = reordered.nodes().isEmpty()
                         ? 0
                         : Math.max(0, Lines.maxLine(reordered.nodes().get(reordered.nodes().size() - 1)) - last);
            if (growth > 0) {
                current = current.updateTree(tree -> Lines.shiftLinesAfter(tree, last, growth));
                below = Comments.shift(below, Range.greaterThan(last), growth);
            }
            var merged = new ArrayList<>(reordered.comments());
            merged.addAll(below);
            comments = Comments.sorted(merged);

            var updated = new ArrayList<Node>(current.node().children().size());
            updated.addAll(current.node().children().subList(0, i));
            updated.addAll(reordered.nodes());
            updated.addAll(current.node().children().subList(end, current.node().children().size()));
            current = current.replace(current.node().withChildren(updated));
            children = current.node().children();
            changed = true;
            i += reordered.nodes().size();
        }
        if (!changed) {
            return Visit.cont(blockZipper, context);
        }
        return Visit.cont(current, context.withComments(comments));
    }

    private static List<Node> expandAndSort(List<Node> directives) {
        var byKey = new LinkedHashMap<String, Node>();
        for (var directive : directives) {
            for (var expanded : expand(directive)) {
                byKey.putIfAbsent(sortKey(expanded), expanded);
            }
        }
        var entries = new ArrayList<>(byKey.entrySet());
        entries.sort(Map.Entry.comparingByKey());
        var sorted = new ArrayList<Node>(entries.size());
        for (int i = 0; i < entries.size(); i++) {
            sorted.add(Lines.withNewlines(entries.get(i).getValue(), i == entries.size() - 1 ? 2 : 1));
        }
        return sorted;
    }

    private static List<Node> expand(Node directive) {
        var form = (Node.Form) directive;
        var target = form.args().get(0);
        if (form.args().size() == 1 && Nodes.aliasSegments(target).map(List::size).orElse(0) == 1) {
            return List.of();
        }
        if (!isMultiAlias(directive)) {
            return List.of(directive);
        }
        var apply = (Node.Apply) target;
        var base = Nodes.aliasSegments(apply.target().children().get(0)).orElseThrow();
        var expanded = ImmutableList.<Node>builder();
        for (var right : apply.args()) {
            var segments = Nodes.aliasSegments(right);
            if (segments.isEmpty()) {
                return List.of(directive);
            }
            var path = new ArrayList<>(base);
            path.addAll(segments.get());
            int line = right.line().or(form::line).orElse(0);
            expanded.add(Node.Form.of(Labels.ALIAS, Meta.line(line), List.of(Nodes.aliases(Meta.line(line), path))));
        }
        return expanded.build();
    }

    private static String sortKey(Node directive) {
        var form = (Node.Form) directive;
        var key = new StringBuilder();
        key.append(Nodes.aliasSegments(form.args().get(0))
                        .map(segments -> String.join(".", segments))
                        .orElseGet(() -> Nodes.withoutMeta(form.args().get(0)).toString()));
        if (form.args().size() > 1) {
            Nodes.keyword(form.args().get(1), Labels.AS)
                 .flatMap(Nodes::aliasSegments)
                 .ifPresent(as -> key.append(", as: ").append(String.join(".", as)));
        }
        return key.toString().toLowerCase(Locale.ROOT);
    }

    private static boolean isAlias(Node node) {
        return node instanceof Node.Form form && form.is(Labels.ALIAS) && !form.args().isEmpty()
               && (Nodes.aliasSegments(form.args().get(0)).isPresent() || isMultiAlias(node));
    }

    // alias Foo.{Bar, Baz}
    private static boolean isMultiAlias(Node node) {
        return node instanceof Node.Form form
               && form.is(Labels.ALIAS)
               && form.args().size() == 1
               && form.args().get(0) instanceof Node.Apply apply
               && apply.target() instanceof Node.Form dot
               && dot.is(Labels.DOT)
               && dot.args().size() == 2
               && Nodes.aliasSegments(dot.args().get(0)).isPresent()
               && dot.args().get(1) instanceof Node.Leaf leaf
               && leaf.isAtom(Labels.TUPLE);
    }

    private static boolean hasBlockParent(Zipper zipper) {
        return zipper.up()
                     .map(parent -> Nodes.isForm(parent.node(), Labels.BLOCK))
                     .orElse(false);
    }
}
