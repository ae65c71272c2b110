package org.dynamis.builder.transform;

import com.github.javaparser.ast.expr.NameExpr;
import org.dynamis.builder.types.TypeRef;

/**
 * A local declared by the transform that holds one statement's or nested block's contribution
 * to its enclosing block.
 */
public record PartialResult(String name, TypeRef type) {

    public NameExpr reference() {
        return new NameExpr(name);
    }
}
