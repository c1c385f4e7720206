package org.pragmatica.restyle.tree;

/**
 * Well-known {@link Node.Form} labels.
 */
public final class Labels {
    private Labels() {}

    public static final String BLOCK = "__block__";
    public static final String ALIASES = "__aliases__";
    public static final String TUPLE = "{}";
    public static final String DOT = ".";
    public static final String ARROW = "->";
    public static final String ALIAS = "alias";
    public static final String CASE = "case";
    public static final String IF = "if";

    public static final String DO = "do";
    public static final String ELSE = "else";
    public static final String AS = "as";
}
