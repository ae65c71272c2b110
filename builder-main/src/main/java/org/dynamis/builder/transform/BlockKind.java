package org.dynamis.builder.transform;

import org.dynamis.builder.capability.Combinator;

/**
 * Where a block sits. Only {@link #BODY} is top level; every other kind hands its combined
 * result to an enclosing block.
 */
public enum BlockKind {

    BODY("a builder body", Combinator.BLOCK),
    DO("a nested block", Combinator.DO),
    BRANCH("a conditional branch", Combinator.BLOCK),
    LOOP("a for-each loop body", Combinator.BLOCK);

    private final String construct;
    private final Combinator combinator;

    BlockKind(String construct, Combinator combinator) {
        this.construct = construct;
        this.combinator = combinator;
    }

    public String construct() {
        return construct;
    }

    /** The combinator that folds this block's partial results into one value. */
    public Combinator combinator() {
        return combinator;
    }

    public boolean isNested() {
        return this != BODY;
    }
}
