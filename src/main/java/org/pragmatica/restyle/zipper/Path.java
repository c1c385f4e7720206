package org.pragmatica.restyle.zipper;

/**
 * Breadcrumb of a non-root focus: the parent zipper by value, the left siblings nearest-first
 * and the right siblings in order. The parent node is rebuilt from these on {@link Zipper#up()}.
 */
record Path(Zipper parent, Siblings left, Siblings right) {
    Path withLeft(Siblings newLeft) {
        return new Path(parent, newLeft, right);
    }

    Path withRight(Siblings newRight) {
        return new Path(parent, left, newRight);
    }
}
