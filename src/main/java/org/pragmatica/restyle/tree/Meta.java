package org.pragmatica.restyle.tree;

import com.google.common.collect.ImmutableMap;

import java.util.Map;
import java.util.Optional;
import java.util.function.UnaryOperator;

/**
 * Ordered, immutable key/value metadata attached to a {@link Node.Form} or {@link Node.Apply}.
 *
 * <p>Well-known keys:
 * <ul>
 *   <li>{@link #LINE} - source line of the node</li>
 *   <li>{@link #END_LINE} - line of the closing {@code end} keyword or bracket</li>
 *   <li>{@link #NEWLINES} - number of newlines following the node as a statement</li>
 *   <li>{@link #PARENS} - whether a call was written with parentheses</li>
 * </ul>
 */
public record Meta(ImmutableMap<String, Object> entries) {
    public static final String LINE = "line";
    public static final String END_LINE = "end_line";
    public static final String NEWLINES = "newlines";
    public static final String PARENS = "parens";

    public static final Meta EMPTY = new Meta(ImmutableMap.of());

    public static Meta of(Map<String, Object> entries) {
        return new Meta(ImmutableMap.copyOf(entries));
    }

    public static Meta line(int line) {
        return EMPTY.with(LINE, line);
    }

    public Optional<Object> get(String key) {
        return Optional.ofNullable(entries.get(key));
    }

    public Optional<Integer> getInt(String key) {
        return get(key).filter(Integer.class::isInstance)
                       .map(Integer.class::cast);
    }

    public boolean flag(String key) {
        return Boolean.TRUE.equals(entries.get(key));
    }

    public Optional<Integer> line() {
        return getInt(LINE);
    }

    public Optional<Integer> endLine() {
        return getInt(END_LINE);
    }

    public Optional<Integer> newlines() {
        return getInt(NEWLINES);
    }

    /**
     * Put a value, replacing an existing entry in place so key order is kept.
     */
    public Meta with(String key, Object value) {
        var builder = ImmutableMap.<String, Object>builder();
        builder.putAll(entries);
        builder.put(key, value);
        return new Meta(builder.buildKeepingLast());
    }

    public Meta without(String key) {
        if (!entries.containsKey(key)) {
            return this;
        }
        var builder = ImmutableMap.<String, Object>builder();
        entries.forEach((k, v) -> {
            if (!k.equals(key)) {
                builder.put(k, v);
            }
        });
        return new Meta(builder.build());
    }

    /**
     * Rewrite every integer-valued line entry ({@link #LINE} and {@link #END_LINE}).
     */
    public Meta mapLines(UnaryOperator<Integer> fn) {
        var result = this;
        for (var key : new String[]{LINE, END_LINE}) {
            var current = result.getInt(key);
            if (current.isPresent()) {
                result = result.with(key, fn.apply(current.get()));
            }
        }
        return result;
    }

    public boolean isEmpty() {
        return entries.isEmpty();
    }

    @Override
    public String toString() {
        return entries.toString();
    }
}
