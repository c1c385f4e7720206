package org.pragmatica.restyle.rule.builtin;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class CommentDirectivesTest {

    private static final CommentDirectives RULE = new CommentDirectives();

    private static String apply(String source) {
        return RuleFixture.apply(RULE, source);
    }

    @Test
    void sort_attributeList() {
        var result = apply("""
            # restyle:sort
            @roles [:user, :admin, :guest]
            """);

        assertThat(result).isEqualTo("""
            # restyle:sort
            @roles [:admin, :guest, :user]
            """);
    }

    @Test
    void sort_assignmentRightHandSide() {
        assertThat(apply("# restyle:sort\nroles = [:c, :a, :b]\n")).isEqualTo("# restyle:sort\nroles = [:a, :b, :c]\n");
    }

    @Test
    void sort_findsFormBelowDirectiveInsideModule() {
        var result = apply("""
            defmodule Foo do
              @first [:b, :a]
              # restyle:sort
              @roles [:user, :admin]
            end
            """);

        assertThat(result).isEqualTo("""
            defmodule Foo do
              @first [:b, :a]
              # restyle:sort
              @roles [:admin, :user]
            end
            """);
    }

    @Test
    void sort_keywordListByKey() {
        assertThat(apply("# restyle:sort\nopts = [timeout: 5, async: true]\n"))
            .isEqualTo("# restyle:sort\nopts = [async: true, timeout: 5]\n");
    }

    @Test
    void withoutDirective_nothingChanges() {
        var source = "# just a note\nroles = [:c, :a, :b]\n";

        assertThat(apply(source)).isEqualTo(source);
    }
}
