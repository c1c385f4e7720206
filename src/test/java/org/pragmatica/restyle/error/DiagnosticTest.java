package org.pragmatica.restyle.error;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class DiagnosticTest {

    private static final String SOURCE = """
        defmodule Foo do
          bar(1, 2))
        end
        """;

    @Test
    void format_pointsAtColumn() {
        var diagnostic = Diagnostic.error("unexpected ')'", 2, 12, 1)
                                   .withLabel("expected end of expression")
                                   .withHelp("remove the extra closing delimiter");

        var formatted = diagnostic.format(SOURCE, "lib/foo.ex");

        assertTrue(formatted.startsWith("error: unexpected ')'\n"));
        assertTrue(formatted.contains("  --> lib/foo.ex:2:12\n"));
        assertTrue(formatted.contains("2 |   bar(1, 2))\n"));
        assertTrue(formatted.contains("  |            ^ expected end of expression\n"));
        assertTrue(formatted.contains("  = help: remove the extra closing delimiter\n"));
    }

    @Test
    void syntaxError_formatsAgainstSource() {
        var error = new RestyleError.SyntaxError("lib/foo.ex", 2, 12, "')'", "end of expression");

        assertEquals("lib/foo.ex:2:12: unexpected ')', expected end of expression", error.message());
        assertTrue(error.format(SOURCE).contains("^^^ expected end of expression"));
    }

    @Test
    void syntaxError_atEndOfInput_suggestsMissingEnd() {
        var error = new RestyleError.SyntaxError("lib/foo.ex", 3, 1, "end of input", "end");

        assertTrue(error.format("defmodule Foo do\n  bar()\n").contains("= help: check for a missing `end` or closing delimiter"));
    }

    @Test
    void restyleException_carriesRuleFailureCause() {
        var cause = new IllegalStateException("boom");
        var exception = new RestyleException(new RestyleError.RuleFailure("booleanCase", "lib/foo.ex", cause));

        assertSame(cause, exception.getCause());
        assertTrue(exception.getMessage().contains("booleanCase"));
        assertTrue(exception.getMessage().contains("lib/foo.ex"));
    }
}
