package org.pragmatica.restyle.rule.builtin;

import org.junit.jupiter.api.Test;
import org.pragmatica.restyle.RestyleConfig;

import static org.assertj.core.api.Assertions.assertThat;

class ShortenAliasesTest {

    private static final ShortenAliases RULE = new ShortenAliases();

    private static String apply(String source) {
        return RuleFixture.apply(RULE, source);
    }

    @Test
    void reference_isShortenedAfterAlias() {
        var result = apply("""
            defmodule MyApp.Web do
              alias MyApp.Accounts.User

              def show, do: MyApp.Accounts.User.get()
            end
            """);

        assertThat(result).isEqualTo("""
            defmodule MyApp.Web do
              alias MyApp.Accounts.User

              def show, do: User.get()
            end
            """);
        assertThat(apply(result)).isEqualTo(result);
    }

    @Test
    void aliasIsVisibleInNestedBlocks() {
        var result = apply("""
            defmodule MyApp.Web do
              alias MyApp.Accounts.User

              def show(id) do
                log(id)
                MyApp.Accounts.User.get(id)
              end
            end
            """);

        assertThat(result).contains("    User.get(id)\n");
    }

    @Test
    void referenceBeforeAlias_isKept() {
        var source = """
            defmodule MyApp.Web do
              def first, do: MyApp.Accounts.User.get()
              alias MyApp.Accounts.User
            end
            """;

        assertThat(apply(source)).isEqualTo(source);
    }

    @Test
    void longerPath_keepsTail() {
        var result = apply("""
            defmodule MyApp.Web do
              alias MyApp.Accounts

              def query, do: MyApp.Accounts.User.Query.all()
            end
            """);

        assertThat(result).contains("def query, do: Accounts.User.Query.all()");
    }

    @Test
    void aliasWithAs_usesGivenName() {
        var result = apply("""
            defmodule MyApp.Web do
              alias MyApp.Accounts.User, as: Account

              def show, do: MyApp.Accounts.User.get()
            end
            """);

        assertThat(result).contains("def show, do: Account.get()");
    }

    @Test
    void excludedRoot_isNotShortened() {
        var config = RestyleConfig.builder()
                                  .aliasExcludes("Elixir.MyApp")
                                  .build();
        var source = """
            defmodule MyApp.Web do
              alias MyApp.Accounts.User

              def show, do: MyApp.Accounts.User.get()
            end
            """;

        assertThat(RuleFixture.apply(RULE, config, source)).isEqualTo(source);
    }

    @Test
    void moduleName_isNeverShortened() {
        var source = """
            defmodule Outer do
              alias MyApp.Inner

              defmodule MyApp.Inner do
                def x, do: 1
              end
            end
            """;

        assertThat(apply(source)).isEqualTo(source);
    }
}
