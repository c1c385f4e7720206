package org.pragmatica.restyle.error;

/**
 * Failures surfaced to callers of the rewrite pipeline.
 */
public sealed interface RestyleError {
    String message();

    /**
     * Source text could not be parsed. Nothing is produced for the input.
     */
    record SyntaxError(
    String file,
    int line,
    int column,
    String found,
    String expected) implements RestyleError {
        public static final String END_OF_INPUT = "end of input";

        @Override
        public String message() {
            return file + ":" + line + ":" + column + ": unexpected " + found + ", expected " + expected;
        }

        /**
         * Caret-style rendering of this error against its source text.
         */
        public String format(String source) {
            var diagnostic = Diagnostic.error("unexpected " + found, line, column, Math.max(1, found.length()))
                                       .withLabel("expected " + expected);
            if (found.equals(END_OF_INPUT)) {
                diagnostic = diagnostic.withHelp("check for a missing `end` or closing delimiter");
            }
            return diagnostic.format(source, file);
        }
    }

    /**
     * A rule's traversal threw. The rule's work is abandoned as a whole.
     */
    record RuleFailure(
    String rule,
    String file,
    Throwable cause) implements RestyleError {
        @Override
        public String message() {
            return "Error running rule " + rule + " on " + file + ": " + cause;
        }
    }
}
