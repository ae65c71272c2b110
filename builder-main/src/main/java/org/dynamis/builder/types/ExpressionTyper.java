package org.dynamis.builder.types;

import com.github.javaparser.ast.expr.Expression;

/**
 * Types one statement expression from local information only: the expression itself and the
 * declarations it refers to. Never consulted with knowledge of how the value is combined later.
 */
public interface ExpressionTyper {

    /** Types every expression as {@link TypeRef#UNKNOWN}; combinator checks then defer to javac. */
    ExpressionTyper UNTYPED = (expression, scope) -> TypeRef.UNKNOWN;

    TypeRef typeOf(Expression expression, TypingScope scope);
}
