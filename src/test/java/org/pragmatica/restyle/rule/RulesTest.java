package org.pragmatica.restyle.rule;

import org.junit.jupiter.api.Test;
import org.pragmatica.restyle.rule.builtin.AliasGroups;
import org.pragmatica.restyle.rule.builtin.BooleanCase;
import org.pragmatica.restyle.rule.builtin.CommentDirectives;
import org.pragmatica.restyle.rule.builtin.NumberLiterals;
import org.pragmatica.restyle.rule.builtin.ShortenAliases;

import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RulesTest {

    @Test
    void builtin_runInDeclaredOrder() {
        assertThat(Rules.names()).containsExactly(
            CommentDirectives.NAME,
            AliasGroups.NAME,
            ShortenAliases.NAME,
            BooleanCase.NAME,
            NumberLiterals.NAME
        );
    }

    @Test
    void byName_findsBuiltin() {
        assertThat(Rules.byName(BooleanCase.NAME)).containsInstanceOf(BooleanCase.class);
        assertThat(Rules.byName("missing")).isEmpty();
    }

    @Test
    void select_withoutNames_returnsAll() {
        assertThat(Rules.select(Optional.empty())).isEqualTo(Rules.BUILTIN);
    }

    @Test
    void select_keepsDeclaredOrder() {
        var selected = Rules.select(Optional.of(List.of(NumberLiterals.NAME, AliasGroups.NAME)));

        assertThat(selected).extracting(Rule::name)
                            .containsExactly(AliasGroups.NAME, NumberLiterals.NAME);
    }

    @Test
    void select_rejectsUnknownNames() {
        assertThatThrownBy(() -> Rules.select(Optional.of(List.of("aliasGroups", "tidyPipes"))))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("tidyPipes")
            .hasMessageContaining(ShortenAliases.NAME);
    }
}
