package org.pragmatica.restyle.zipper;

/**
 * Result of visiting one node with an accumulator: what to do next, the possibly edited
 * zipper, and the updated accumulator.
 */
public record Visit<A>(Command command, Zipper zipper, A acc) {
    public static <A> Visit<A> cont(Zipper zipper, A acc) {
        return new Visit<>(Command.CONTINUE, zipper, acc);
    }

    public static <A> Visit<A> skip(Zipper zipper, A acc) {
        return new Visit<>(Command.SKIP, zipper, acc);
    }

    public static <A> Visit<A> halt(Zipper zipper, A acc) {
        return new Visit<>(Command.HALT, zipper, acc);
    }
}
