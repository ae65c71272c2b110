package org.dynamis.builder.classify;

/**
 * How the transform treats one statement of a builder body.
 */
public enum StatementKind {

    /** Local variable, class or record declaration; emitted unchanged, contributes nothing. */
    DECLARATION,

    /** An expression statement whose value becomes a partial result. */
    EXPRESSION,

    /** Assignment or increment; contributes the "no value" result. */
    ASSIGNMENT,

    /** {@code if} / {@code else if} chain or {@code switch}. */
    SELECTION,

    /** A nested block, combined with {@code buildDo}. */
    DO,

    /** An enhanced {@code for} loop, combined with {@code buildArray}. */
    FOR_IN,

    THROW,

    /** Empty statements and assertions. */
    DIAGNOSTIC,

    /** Non-local control transfer and error handling; rejects the whole body. */
    ILLEGAL;

    public boolean isPassThrough() {
        return this == DECLARATION || this == THROW || this == DIAGNOSTIC;
    }
}
