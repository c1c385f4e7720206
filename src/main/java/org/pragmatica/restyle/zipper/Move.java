package org.pragmatica.restyle.zipper;

/**
 * Result of visiting one node without an accumulator.
 */
public record Move(Command command, Zipper zipper) {
    public static Move cont(Zipper zipper) {
        return new Move(Command.CONTINUE, zipper);
    }

    public static Move skip(Zipper zipper) {
        return new Move(Command.SKIP, zipper);
    }

    public static Move halt(Zipper zipper) {
        return new Move(Command.HALT, zipper);
    }
}
