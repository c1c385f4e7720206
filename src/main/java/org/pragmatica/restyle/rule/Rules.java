package org.pragmatica.restyle.rule;

import com.google.common.collect.ImmutableList;
import org.pragmatica.restyle.rule.builtin.AliasGroups;
import org.pragmatica.restyle.rule.builtin.BooleanCase;
import org.pragmatica.restyle.rule.builtin.CommentDirectives;
import org.pragmatica.restyle.rule.builtin.NumberLiterals;
import org.pragmatica.restyle.rule.builtin.ShortenAliases;

import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * The built-in rules in the order they run.
 */
public final class Rules {
    private Rules() {}

    public static final ImmutableList<Rule> BUILTIN = ImmutableList.of(
        new CommentDirectives(),
        new AliasGroups(),
        new ShortenAliases(),
        new BooleanCase(),
        NumberLiterals.RULE
    );

    public static Optional<Rule> byName(String name) {
        return BUILTIN.stream()
                      .filter(rule -> rule.name().equals(name))
                      .findFirst();
    }

    /**
     * The built-in rules named in {@code names}, in declared order. All rules when empty.
     *
     * @throws IllegalArgumentException if a name is not a built-in rule
     */
    public static ImmutableList<Rule> select(Optional<? extends List<String>> names) {
        if (names.isEmpty()) {
            return BUILTIN;
        }
        var unknown = names.get()
                           .stream()
                           .filter(name -> byName(name).isEmpty())
                           .collect(Collectors.toList());
        if (!unknown.isEmpty()) {
            throw new IllegalArgumentException("Unknown rules " + unknown + ", expected any of " + names());
        }
        return BUILTIN.stream()
                      .filter(rule -> names.get().contains(rule.name()))
                      .collect(ImmutableList.toImmutableList());
    }

    public static List<String> names() {
        return BUILTIN.stream()
                      .map(Rule::name)
                      .collect(Collectors.toList());
    }
}
