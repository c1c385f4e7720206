package org.pragmatica.restyle.alias;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import org.pragmatica.restyle.tree.Labels;
import org.pragmatica.restyle.tree.Node;
import org.pragmatica.restyle.tree.Nodes;

import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Lexical alias state for one scope: a map from a short name to the fully qualified path it
 * denotes. Given {@code alias Foo.Bar} the environment holds {@code Bar -> [Foo, Bar]}.
 *
 * <p>This approximates what a compiler would track; directives it cannot read with certainty
 * ({@code alias __MODULE__}, computed names) leave the environment unchanged.
 */
public final class AliasEnv {
    public static final AliasEnv EMPTY = new AliasEnv(ImmutableMap.of());

    private final ImmutableMap<String, ImmutableList<String>> aliases;

    private AliasEnv(ImmutableMap<String, ImmutableList<String>> aliases) {
        this.aliases = aliases;
    }

    public static AliasEnv of(Map<String, List<String>> aliases) {
        var builder = ImmutableMap.<String, ImmutableList<String>>builder();
        aliases.forEach((as, path) -> builder.put(as, ImmutableList.copyOf(path)));
        return new AliasEnv(builder.build());
    }

    public static AliasEnv define(List<Node> directives) {
        return EMPTY.defineAll(directives);
    }

    /**
     * Fold alias directives into the environment, in order.
     */
    public AliasEnv defineAll(List<Node> directives) {
        var env = this;
        for (var directive : directives) {
            env = env.define(directive);
        }
        return env;
    }

    /**
     * Fold one directive into the environment. The aliased path is itself expanded, so
     * {@code alias A.B} followed by {@code alias B.C} defines {@code C -> [A, B, C]}.
     */
    public AliasEnv define(Node directive) {
        return readDirective(directive).map(definition -> put(definition.as(), expand(definition.path())))
                                       .orElse(this);
    }

    private AliasEnv put(String as, List<String> path) {
        var builder = new LinkedHashMap<String, ImmutableList<String>>(aliases);
        builder.put(as, ImmutableList.copyOf(path));
        return new AliasEnv(ImmutableMap.copyOf(builder));
    }

    private record Definition(List<String> path, String as) {}

    private static Optional<Definition> readDirective(Node directive) {
        if (!(directive instanceof Node.Form form) || !form.is(Labels.ALIAS) || form.args().isEmpty()) {
            return Optional.empty();
        }
        var path = Nodes.aliasSegments(form.args().get(0));
        if (path.isEmpty() || path.get().isEmpty()) {
            return Optional.empty();
        }
        if (form.args().size() == 1) {
            var segments = path.get();
            return Optional.of(new Definition(segments, segments.get(segments.size() - 1)));
        }
        if (form.args().size() == 2) {
            return Nodes.keyword(form.args().get(1), Labels.AS)
                        .flatMap(Nodes::aliasSegments)
                        .filter(as -> as.size() == 1)
                        .map(as -> new Definition(path.get(), as.get(0)));
        }
        return Optional.empty();
    }

    /**
     * Lengthen a path whose head is a defined short name: with {@code Foo -> [Bar, Baz, Foo]},
     * {@code [Foo, Woo]} expands to {@code [Bar, Baz, Foo, Woo]}. Other paths are returned as is.
     */
    public List<String> expand(List<String> path) {
        if (path.isEmpty()) {
            return path;
        }
        var dealiased = aliases.get(path.get(0));
        if (dealiased == null) {
            return path;
        }
        return ImmutableList.<String>builder()
                            .addAll(dealiased)
                            .addAll(path.subList(1, path.size()))
                            .build();
    }

    /**
     * Expand every qualified reference in a subtree.
     */
    public Node expandAst(Node ast) {
        if (aliases.isEmpty()) {
            return ast;
        }
        return Nodes.prewalk(ast, node -> {
            if (node instanceof Node.Form form) {
                var segments = Nodes.aliasSegments(form);
                if (segments.isPresent()) {
                    var expanded = expand(segments.get());
                    if (!expanded.equals(segments.get())) {
                        return Nodes.aliases(form.meta(), expanded);
                    }
                }
            }
            return node;
        });
    }

    /**
     * Map each aliased path back to the short name that denotes it. When several short names
     * denote the same path, names given explicitly with {@code as:} win over the default
     * (the path's last segment), and among those the lexicographically last one is kept.
     */
    public ImmutableMap<ImmutableList<String>, String> invert() {
        var result = new HashMap<ImmutableList<String>, String>();
        aliases.forEach((as, path) -> result.merge(path, as, (current, candidate) -> preferred(path, current, candidate)));
        return ImmutableMap.copyOf(result);
    }

    private static String preferred(List<String> path, String current, String candidate) {
        var defaultName = path.get(path.size() - 1);
        boolean currentIsDefault = current.equals(defaultName);
        boolean candidateIsDefault = candidate.equals(defaultName);
        if (currentIsDefault != candidateIsDefault) {
            return currentIsDefault
                   ? candidate
                   : current;
        }
        return current.compareTo(candidate) >= 0
               ? current
               : candidate;
    }

    public Optional<List<String>> lookup(String as) {
        return Optional.ofNullable(aliases.get(as));
    }

    public boolean isEmpty() {
        return aliases.isEmpty();
    }

    public ImmutableMap<String, ImmutableList<String>> asMap() {
        return aliases;
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof AliasEnv other && aliases.equals(other.aliases);
    }

    @Override
    public int hashCode() {
        return aliases.hashCode();
    }

    @Override
    public String toString() {
        return "AliasEnv" + aliases;
    }
}
