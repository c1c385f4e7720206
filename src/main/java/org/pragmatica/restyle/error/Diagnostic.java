package org.pragmatica.restyle.error;

import java.util.ArrayList;
import java.util.List;

/**
 * Compiler-style rendering of a source error.
 *
 * <p>Example output:
 * <pre>
 * error: unexpected ')'
 *   --> lib/foo.ex:3:15
 *    |
 *  3 |     bar(1, 2))
 *    |               ^ expected end of expression
 *    |
 *    = help: remove the extra closing delimiter
 * </pre>
 *
 * @param message  primary message
 * @param line     1-based line of the error
 * @param column   1-based column of the error
 * @param width    number of columns to underline
 * @param label    text printed after the underline, may be empty
 * @param notes    trailing notes
 */
public record Diagnostic(
    String message,
    int line,
    int column,
    int width,
    String label,
    List<String> notes
) {
    public static Diagnostic error(String message, int line, int column, int width) {
        return new Diagnostic(message, line, column, width, "", List.of());
    }

    public Diagnostic withLabel(String newLabel) {
        return new Diagnostic(message, line, column, width, newLabel, notes);
    }

    public Diagnostic withHelp(String help) {
        var newNotes = new ArrayList<>(notes);
        newNotes.add("help: " + help);
        return new Diagnostic(message, line, column, width, label, List.copyOf(newNotes));
    }

    public String format(String source, String filename) {
        var sb = new StringBuilder();
        var lines = source.split("\n", -1);

        sb.append("error: ").append(message).append("\n");
        sb.append("  --> ");
        if (filename != null) {
            sb.append(filename).append(":");
        }
        sb.append(line).append(":").append(column).append("\n");

        int gutterWidth = String.valueOf(line).length();
        var gutter = " ".repeat(gutterWidth + 1);
        sb.append(gutter).append("|\n");

        if (line >= 1 && line <= lines.length) {
            sb.append(String.format("%" + gutterWidth + "d", line))
              .append(" | ")
              .append(lines[line - 1])
              .append("\n");
            sb.append(gutter).append("| ")
              .append(" ".repeat(Math.max(0, column - 1)))
              .append("^".repeat(Math.max(1, width)));
            if (!label.isEmpty()) {
                sb.append(" ").append(label);
            }
            sb.append("\n");
        }

        sb.append(gutter).append("|\n");
        for (var note : notes) {
            sb.append(gutter).append("= ").append(note).append("\n");
        }
        return sb.toString();
    }
}
