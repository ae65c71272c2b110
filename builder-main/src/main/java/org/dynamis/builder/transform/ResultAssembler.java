package org.dynamis.builder.transform;

import java.util.List;

import com.github.javaparser.ast.stmt.BlockStmt;
import com.github.javaparser.ast.stmt.ReturnStmt;
import org.dynamis.builder.TransformResult;
import org.dynamis.builder.capability.Capability;
import org.dynamis.builder.capability.Combinator;
import org.dynamis.builder.types.TypeRef;

/**
 * Turns the outermost block's combined value into the function's return statement, passing it
 * through {@code buildFinalResult} when the builder declares one.
 */
public final class ResultAssembler {

    private final TransformContext context;

    public ResultAssembler(TransformContext context) {
        this.context = context;
    }

    public TransformResult assemble(BlockStmt original, BlockResult body) {
        if (body.isIgnored()) {
            return new TransformResult(TransformResult.Status.IGNORED, original.clone(), TypeRef.UNKNOWN);
        }
        TypeRef resultType = body.combinedType();
        boolean finalize = context.has(Capability.FINAL_RESULT);
        if (finalize) {
            resultType = context.resolve(Combinator.FINAL_RESULT, List.of(resultType), original);
        }
        BlockStmt lowered = new BlockStmt(body.statementsThen(
                value -> new ReturnStmt(finalize ? context.call(Combinator.FINAL_RESULT, value) : value)));
        return new TransformResult(TransformResult.Status.TRANSFORMED, lowered, resultType);
    }
}
