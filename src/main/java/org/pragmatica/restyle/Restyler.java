package org.pragmatica.restyle;

import org.pragmatica.restyle.codec.Codec;
import org.pragmatica.restyle.codec.Document;
import org.pragmatica.restyle.codec.ElixirCodec;
import org.pragmatica.restyle.error.FailureMode;

import java.util.Collection;

/**
 * Entry point for rewriting source text.
 *
 * <p>Example usage:
 * <pre>{@code
 * var restyler = Restyler.builder()
 *                        .lineLength(98)
 *                        .aliasExcludes("Phoenix")
 *                        .build();
 *
 * var formatted = restyler.format(source, "lib/my_app.ex");
 * }</pre>
 * Parsing failures surface as a {@link org.pragmatica.restyle.error.RestyleException} carrying a
 * {@link org.pragmatica.restyle.error.RestyleError.SyntaxError}.
 */
public final class Restyler {
    private final Codec codec;
    private final Pipeline pipeline;
    private final RestyleConfig config;

    private Restyler(Codec codec, Pipeline pipeline, RestyleConfig config) {
        this.codec = codec;
        this.pipeline = pipeline;
        this.config = config;
    }

    public static Restyler create() {
        return create(RestyleConfig.DEFAULT);
    }

    public static Restyler create(RestyleConfig config) {
        return create(config, Pipeline.create(config));
    }

    /**
     * Restyler running a custom pipeline.
     */
    public static Restyler create(RestyleConfig config, Pipeline pipeline) {
        return new Restyler(ElixirCodec.INSTANCE, pipeline, config);
    }

    public RestyleConfig config() {
        return config;
    }

    public Pipeline pipeline() {
        return pipeline;
    }

    /**
     * Parse, run every rule and print.
     */
    public String format(String text, String file) {
        return codec.print(rewrite(text, file), config.printOptions());
    }

    /**
     * Parse and run every rule without printing.
     */
    public Document rewrite(String text, String file) {
        return pipeline.run(codec.parse(text, file), file);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private final RestyleConfig.Builder config = RestyleConfig.builder();

        private Builder() {}

        public Builder lineLength(int length) {
            config.lineLength(length);
            return this;
        }

        public Builder onError(FailureMode mode) {
            config.onError(mode);
            return this;
        }

        public Builder aliasExcludes(String... names) {
            config.aliasExcludes(names);
            return this;
        }

        public Builder aliasExcludes(Collection<String> names) {
            config.aliasExcludes(names);
            return this;
        }

        public Builder rules(String... names) {
            config.enabledRules(names);
            return this;
        }

        public Builder rules(Collection<String> names) {
            config.enabledRules(names);
            return this;
        }

        public Restyler build() {
            return create(config.build());
        }
    }
}
