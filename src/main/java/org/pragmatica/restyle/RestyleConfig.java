package org.pragmatica.restyle;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import org.pragmatica.restyle.codec.PrintOptions;
import org.pragmatica.restyle.error.FailureMode;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

import static com.google.common.base.Preconditions.checkArgument;

/**
 * Pipeline configuration options.
 *
 * @param lineLength    maximum printed line width
 * @param onError       what to do when a rule fails
 * @param aliasExcludes root module names whose references are never shortened
 * @param enabledRules  when present, only these built-in rules run, in their declared order
 */
public record RestyleConfig(
    int lineLength,
    FailureMode onError,
    ImmutableSet<String> aliasExcludes,
    Optional<ImmutableList<String>> enabledRules
) {
    private static final String ELIXIR_PREFIX = "Elixir.";

    /**
     * Standard library roots, always excluded from alias shortening.
     */
    public static final ImmutableSet<String> STDLIB = ImmutableSet.of(
        "Access", "Agent", "Application", "Atom", "Base", "Behaviour", "Bitwise", "Code", "Date", "DateTime",
        "Dict", "Ecto", "Enum", "Exception", "File", "Float", "GenEvent", "GenServer", "HashDict", "HashSet",
        "Integer", "IO", "Kernel", "Keyword", "List", "Macro", "Map", "MapSet", "Module", "NaiveDateTime", "Node",
        "Oban", "OptionParser", "Path", "Port", "Process", "Protocol", "Range", "Record", "Regex", "Registry",
        "Set", "Stream", "String", "StringIO", "Supervisor", "System", "Task", "Time", "Tuple", "URI", "Version");

    public static final RestyleConfig DEFAULT = new RestyleConfig(
        PrintOptions.DEFAULT_LINE_LENGTH,
        FailureMode.LOG,
        STDLIB,
        Optional.empty()
    );

    public RestyleConfig {
        checkArgument(lineLength > 0, "lineLength must be positive: %s", lineLength);
    }

    public PrintOptions printOptions() {
        return new PrintOptions(lineLength);
    }

    public boolean isExcluded(String rootName) {
        return aliasExcludes.contains(rootName);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private int lineLength = PrintOptions.DEFAULT_LINE_LENGTH;
        private FailureMode onError = FailureMode.LOG;
        private final ImmutableSet.Builder<String> aliasExcludes = ImmutableSet.<String>builder().addAll(STDLIB);
        private ImmutableList<String> enabledRules;

        private Builder() {}

        public Builder lineLength(int length) {
            this.lineLength = length;
            return this;
        }

        public Builder onError(FailureMode mode) {
            this.onError = mode;
            return this;
        }

        /**
         * Add root names to exclude from alias shortening. An {@code Elixir.} prefix is dropped.
         */
        public Builder aliasExcludes(Collection<String> names) {
            for (var name : names) {
                aliasExcludes.add(name.startsWith(ELIXIR_PREFIX)
                                  ? name.substring(ELIXIR_PREFIX.length())
                                  : name);
            }
            return this;
        }

        public Builder aliasExcludes(String... names) {
            return aliasExcludes(List.of(names));
        }

        public Builder enabledRules(Collection<String> names) {
            this.enabledRules = ImmutableList.copyOf(names);
            return this;
        }

        public Builder enabledRules(String... names) {
            return enabledRules(List.of(names));
        }

        public RestyleConfig build() {
            return new RestyleConfig(lineLength, onError, aliasExcludes.build(), Optional.ofNullable(enabledRules));
        }
    }
}
