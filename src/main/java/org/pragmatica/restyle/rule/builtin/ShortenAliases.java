package org.pragmatica.restyle.rule.builtin;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import org.pragmatica.restyle.RestyleConfig;
import org.pragmatica.restyle.alias.AliasEnv;
import org.pragmatica.restyle.rule.Rule;
import org.pragmatica.restyle.rule.RuleContext;
import org.pragmatica.restyle.tree.Labels;
import org.pragmatica.restyle.tree.Node;
import org.pragmatica.restyle.tree.Nodes;
import org.pragmatica.restyle.zipper.Visit;
import org.pragmatica.restyle.zipper.Zipper;

import java.util.ArrayList;
import java.util.List;

/**
 * Rewrites qualified references to use aliases that are in scope:
 *
 * <pre>
 * alias MyApp.Accounts.User
 * MyApp.Accounts.User.new()
 * </pre>
 * becomes {@code User.new()}. Aliases declared in a block are visible in the statements after
 * them and in every nested block. References rooted at an excluded name are left alone.
 */
public final class ShortenAliases implements Rule {
    public static final String NAME = "shortenAliases";

    private static final String DEFMODULE = "defmodule";

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public Visit<RuleContext> run(Zipper zipper, RuleContext context) {
        if (!Nodes.isForm(zipper.node(), Labels.BLOCK)) {
            return Visit.cont(zipper, context);
        }
        var env = inheritedEnv(zipper);
        var block = zipper.node();
        var statements = new ArrayList<Node>(block.children().size());
        boolean changed = false;
        for (var statement : block.children()) {
            if (Nodes.isForm(statement, Labels.ALIAS)) {
                env = env.define(statement);
                statements.add(statement);
                continue;
            }
            var shortened = env.isEmpty()
                            ? statement
                            : shorten(statement, env.invert(), env, context.config());
            changed |= shortened != statement;
            statements.add(shortened);
        }
        return changed
               ? Visit.cont(zipper.replace(block.withChildren(statements)), context)
               : Visit.cont(zipper, context);
    }

    // Aliases declared before this block inside every enclosing block
    private static AliasEnv inheritedEnv(Zipper block) {
        var scopes = new ArrayList<List<Node>>();
        var current = block;
        var parent = current.up();
        while (parent.isPresent()) {
            if (Nodes.isForm(parent.get().node(), Labels.BLOCK)) {
                scopes.add(leftSiblings(current));
            }
            current = parent.get();
            parent = current.up();
        }
        var env = AliasEnv.EMPTY;
        for (int i = scopes.size() - 1; i >= 0; i--) {
            for (var sibling : scopes.get(i)) {
                if (Nodes.isForm(sibling, Labels.ALIAS)) {
                    env = env.define(sibling);
                }
            }
        }
        return env;
    }

    private static List<Node> leftSiblings(Zipper zipper) {
        var siblings = new ArrayList<Node>();
        var left = zipper.left();
        while (left.isPresent()) {
            siblings.add(0, left.get().node());
            left = left.get().left();
        }
        return siblings;
    }

    // Nested blocks and alias directives are left for their own visit.
    private static Node shorten(Node node,
                                ImmutableMap<ImmutableList<String>, String> inverted,
                                AliasEnv env,
                                RestyleConfig config) {
        if (Nodes.isForm(node, Labels.BLOCK) || Nodes.isForm(node, Labels.ALIAS)) {
            return node;
        }
        var segments = Nodes.aliasSegments(node);
        if (segments.isPresent()) {
            return shortenReference((Node.Form) node, segments.get(), inverted, env, config);
        }
        var children = node.children();
        if (children.isEmpty()) {
            return node;
        }
        var updated = new ArrayList<Node>(children.size());
        boolean changed = false;
        for (int i = 0; i < children.size(); i++) {
            var child = children.get(i);
            // a module's own name is never rewritten
            var next = i == 0 && Nodes.isForm(node, DEFMODULE)
                       ? child
                       : shorten(child, inverted, env, config);
            changed |= next != child;
            updated.add(next);
        }
        return changed
               ? node.withChildren(updated)
               : node;
    }

    private static Node shortenReference(Node.Form reference,
                                         List<String> segments,
                                         ImmutableMap<ImmutableList<String>, String> inverted,
                                         AliasEnv env,
                                         RestyleConfig config) {
        var expanded = env.expand(segments);
        if (expanded.isEmpty() || config.isExcluded(expanded.get(0))) {
            return reference;
        }
        // longest aliased prefix wins
        for (int length = expanded.size(); length >= 1; length--) {
            var shortName = inverted.get(ImmutableList.copyOf(expanded.subList(0, length)));
            if (shortName == null) {
                continue;
            }
            var shortened = new ArrayList<String>(expanded.size() - length + 1);
            shortened.add(shortName);
            shortened.addAll(expanded.subList(length, expanded.size()));
            if (shortened.equals(segments)) {
                return reference;
            }
            return Nodes.aliases(reference.meta(), shortened);
        }
        return reference;
    }
}
