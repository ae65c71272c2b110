package org.dynamis.builder;

import com.github.javaparser.ast.stmt.BlockStmt;
import org.dynamis.builder.types.TypeRef;

/**
 * Outcome of transforming one body.
 *
 * @param status     whether the body was rewritten
 * @param body       the rewritten body, or an unchanged copy of the input
 * @param resultType statically known type of the returned value, {@link TypeRef#UNKNOWN} if not rewritten
 */
public record TransformResult(Status status, BlockStmt body, TypeRef resultType) {

    public enum Status {
        /** Rewritten to return the combined result. */
        TRANSFORMED,
        /** No statement produced a result; body unchanged. */
        IGNORED,
        /** The body returns explicitly; transform not applied. */
        SUPPRESSED
    }

    public boolean isTransformed() {
        return status == Status.TRANSFORMED;
    }
}
