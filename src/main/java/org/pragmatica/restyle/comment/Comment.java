package org.pragmatica.restyle.comment;

/**
 * A source comment, anchored to the tree only by its line number.
 *
 * @param text             comment text including the leading {@code #}
 * @param line             1-based source line
 * @param previousEolCount newlines between the previous token and this comment (2+ means a blank line precedes it)
 */
public record Comment(String text, int line, int previousEolCount) {
    public static Comment at(int line, String text) {
        return new Comment(text, line, 1);
    }

    public Comment withLine(int newLine) {
        return new Comment(text, newLine, previousEolCount);
    }
}
