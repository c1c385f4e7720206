package org.pragmatica.restyle.zipper;

/**
 * Structural edit the focus cannot support, such as removing the root or inserting siblings
 * next to it.
 */
public final class ZipperMisuseException extends IllegalStateException {
    public ZipperMisuseException(String message) {
        super(message);
    }
}
