package org.pragmatica.restyle.alias;

import com.google.common.collect.ImmutableList;
import org.junit.jupiter.api.Test;
import org.pragmatica.restyle.tree.Labels;
import org.pragmatica.restyle.tree.Meta;
import org.pragmatica.restyle.tree.Node;
import org.pragmatica.restyle.tree.Nodes;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class AliasEnvTest {

    private static Node alias(String... segments) {
        return Node.Form.of(Labels.ALIAS, Meta.line(1), List.of(Nodes.aliases(Meta.EMPTY, List.of(segments))));
    }

    private static Node aliasAs(String as, String... segments) {
        var options = Node.Sequence.of(new Node.Pair(Node.Leaf.atom(Labels.AS), Nodes.aliases(Meta.EMPTY, List.of(as))));
        return Node.Form.of(Labels.ALIAS, Meta.line(1), List.of(Nodes.aliases(Meta.EMPTY, List.of(segments)), options));
    }

    @Test
    void define_usesLastSegmentAsShortName() {
        var env = AliasEnv.define(List.of(alias("Foo", "Bar", "Baz")));

        assertThat(env.lookup("Baz")).contains(List.of("Foo", "Bar", "Baz"));
    }

    @Test
    void define_withAs_usesGivenName() {
        var env = AliasEnv.define(List.of(aliasAs("Q", "Foo", "Bar")));

        assertThat(env.lookup("Q")).contains(List.of("Foo", "Bar"));
        assertThat(env.lookup("Bar")).isEmpty();
    }

    @Test
    void define_expandsAgainstEarlierDefinitions() {
        var env = AliasEnv.define(List.of(alias("A", "B"), alias("B", "C")));

        assertThat(env.lookup("C")).contains(List.of("A", "B", "C"));
    }

    @Test
    void define_ignoresNonAliasNodes() {
        var env = AliasEnv.EMPTY.define(Node.Form.of("import", 1, Nodes.aliases(Meta.EMPTY, List.of("Foo"))));

        assertThat(env.isEmpty()).isTrue();
    }

    @Test
    void expand_replacesDefinedHead() {
        var env = AliasEnv.of(Map.of("Foo", List.of("Bar", "Baz", "Foo")));

        assertThat(env.expand(List.of("Foo", "Woo"))).containsExactly("Bar", "Baz", "Foo", "Woo");
        assertThat(env.expand(List.of("Other", "Foo"))).containsExactly("Other", "Foo");
    }

    @Test
    void expand_isIdempotent() {
        var env = AliasEnv.of(Map.of("Foo", List.of("Bar", "Baz", "Foo")));
        var path = List.of("Foo", "Woo");

        assertThat(env.expand(env.expand(path))).isEqualTo(env.expand(path));
    }

    @Test
    void expandAst_rewritesNestedReferences() {
        var env = AliasEnv.of(Map.of("User", List.of("MyApp", "User")));
        var call = Node.Form.of("foo", 1, Nodes.aliases(Meta.line(1), List.of("User", "Query")));

        var expanded = env.expandAst(call);

        assertThat(expanded).isEqualTo(Node.Form.of("foo", 1, Nodes.aliases(Meta.line(1), List.of("MyApp", "User", "Query"))));
    }

    @Test
    void invert_mapsPathToShortName() {
        var env = AliasEnv.define(List.of(alias("MyApp", "Accounts", "User")));

        assertThat(env.invert()).containsEntry(ImmutableList.of("MyApp", "Accounts", "User"), "User");
    }

    @Test
    void invert_prefersExplicitAsOverDefault() {
        var env = AliasEnv.of(Map.of("User", List.of("MyApp", "User"), "U", List.of("MyApp", "User")));

        assertThat(env.invert()).containsEntry(ImmutableList.of("MyApp", "User"), "U");
    }

    @Test
    void invert_keepsLexicographicallyLastAmongEquals() {
        var env = AliasEnv.of(Map.of("Alpha", List.of("MyApp", "User"), "Omega", List.of("MyApp", "User")));

        assertThat(env.invert()).containsEntry(ImmutableList.of("MyApp", "User"), "Omega");
    }
}
