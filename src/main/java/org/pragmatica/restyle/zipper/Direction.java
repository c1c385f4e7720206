package org.pragmatica.restyle.zipper;

/**
 * Direction of a pre-order walk.
 */
public enum Direction {
    NEXT,
    PREV
}
