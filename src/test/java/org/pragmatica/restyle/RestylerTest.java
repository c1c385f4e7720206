package org.pragmatica.restyle;

import org.junit.jupiter.api.Test;
import org.pragmatica.restyle.error.RestyleError;
import org.pragmatica.restyle.error.RestyleException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.assertThrows;

class RestylerTest {
    private static final String FILE = "lib/my_app/web.ex";

    private static final String SOURCE = """
        defmodule MyApp.Web do
          alias MyApp.Repo
          # accounts
          alias MyApp.Accounts.User

          @limit 10000

          def show(id, admin?) do
            user = MyApp.Accounts.User.get(id)

            case admin? do
              true ->
                {:ok, user}
              false ->
                {:error, :forbidden}
            end
          end
        end
        """;

    private static final String EXPECTED = """
        defmodule MyApp.Web do
          # accounts
          alias MyApp.Accounts.User
          alias MyApp.Repo

          @limit 10_000

          def show(id, admin?) do
            user = User.get(id)

            if admin? do
              {:ok, user}
            else
              {:error, :forbidden}
            end
          end
        end
        """;

    @Test
    void format_runsAllRules() {
        assertThat(Restyler.create().format(SOURCE, FILE)).isEqualTo(EXPECTED);
    }

    @Test
    void format_isIdempotent() {
        assertThat(Restyler.create().format(EXPECTED, FILE)).isEqualTo(EXPECTED);
    }

    @Test
    void builder_limitsRules() {
        var restyler = Restyler.builder()
                               .rules("numberLiterals")
                               .build();

        var result = restyler.format(SOURCE, FILE);

        assertThat(result).contains("@limit 10_000")
                          .contains("alias MyApp.Repo\n  # accounts\n")
                          .contains("case admin? do");
        assertThat(restyler.pipeline().rules()).hasSize(1);
    }

    @Test
    void builder_unknownRule_isRejected() {
        assertThatThrownBy(() -> Restyler.builder().rules("noSuchRule").build())
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void rewrite_keepsComments() {
        var document = Restyler.create().rewrite(SOURCE, FILE);

        assertThat(document.comments()).hasSize(1);
        assertThat(document.comments().get(0).line()).isEqualTo(2);
    }

    @Test
    void format_reportsSyntaxErrors() {
        var exception = assertThrows(RestyleException.class, () -> Restyler.create().format("defmodule Broken do\n", "lib/broken.ex"));

        assertThat(exception.error()).isInstanceOf(RestyleError.SyntaxError.class);
        assertThat(exception.getMessage()).startsWith("lib/broken.ex:");
    }
}
