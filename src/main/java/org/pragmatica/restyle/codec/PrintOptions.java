package org.pragmatica.restyle.codec;

import static com.google.common.base.Preconditions.checkArgument;

/**
 * Printer settings.
 *
 * @param lineLength preferred maximum line width; calls and pipelines that would exceed it are broken up
 */
public record PrintOptions(int lineLength) {
    public static final int DEFAULT_LINE_LENGTH = 122;

    public static final PrintOptions DEFAULT = new PrintOptions(DEFAULT_LINE_LENGTH);

    public PrintOptions {
        checkArgument(lineLength > 0, "lineLength must be positive: %s", lineLength);
    }
}
