package org.pragmatica.restyle.rule.builtin;

import org.pragmatica.restyle.rule.Rule;
import org.pragmatica.restyle.tree.Node;

/**
 * Groups the digits of large decimal numbers with underscores: {@code 1000000} and the
 * misplaced {@code 100_000_0} both become {@code 1_000_000}, {@code 12345.678} becomes
 * {@code 12_345.678}. Hex, octal and binary literals and numbers below 10 000 are untouched.
 */
public final class NumberLiterals {
    public static final String NAME = "numberLiterals";

    public static final Rule RULE = Rule.lift(NAME, NumberLiterals::delimit);

    private static final int MIN_DIGITS = 5;

    private NumberLiterals() {}

    static Node delimit(Node node) {
        if (!(node instanceof Node.Leaf leaf) || leaf.kind() != Node.Leaf.Kind.NUMBER) {
            return node;
        }
        var text = leaf.text();
        if (text.startsWith("0x") || text.startsWith("0o") || text.startsWith("0b")) {
            return node;
        }
        int dot = text.indexOf('.');
        var integerPart = dot < 0
                          ? text
                          : text.substring(0, dot);
        var delimited = delimit(integerPart);
        if (delimited.equals(integerPart)) {
            return node;
        }
        var rest = dot < 0
                   ? ""
                   : text.substring(dot);
        return new Node.Leaf(Node.Leaf.Kind.NUMBER, delimited + rest, leaf.line());
    }

    static String delimit(String digits) {
        var plain = digits.replace("_", "");
        var significant = plain.replaceFirst("^0+(?=\\d)", "");
        if (significant.length() < MIN_DIGITS) {
            return digits;
        }
        var sb = new StringBuilder(plain.length() + plain.length() / 3);
        for (int i = 0; i < plain.length(); i++) {
            if (i > 0 && (plain.length() - i) % 3 == 0) {
                sb.append('_');
            }
            sb.append(plain.charAt(i));
        }
        return sb.toString();
    }
}
