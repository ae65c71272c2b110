package org.dynamis.builder.types;

import java.util.HashSet;
import java.util.Set;

import com.github.javaparser.ast.Node;
import com.github.javaparser.ast.expr.Expression;
import com.github.javaparser.ast.expr.NameExpr;
import com.github.javaparser.ast.nodeTypes.NodeWithTypeParameters;
import com.github.javaparser.ast.type.TypeParameter;
import com.github.javaparser.resolution.types.ResolvedType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Types a statement expression with the symbol solver of its compilation unit, as javac would type
 * it standing alone. Whatever the solver cannot type, such as a call to an unknown method or a type
 * variable declared outside the enclosing function, is {@link TypeRef#UNKNOWN}.
 * <p>
 * Expressions outside any solver-attached unit fall back to the locals of the {@link TypingScope}.
 */
public class SymbolSolverTyper implements ExpressionTyper {

    private static final Logger LOG = LoggerFactory.getLogger(SymbolSolverTyper.class);

    @Override
    public TypeRef typeOf(Expression expression, TypingScope scope) {
        if (!TypeResolution.isAttached(expression)) {
            return expression instanceof NameExpr name ? scope.lookup(name.getNameAsString()) : TypeRef.UNKNOWN;
        }
        ResolvedType resolved;
        try {
            resolved = expression.calculateResolvedType();
        } catch (RuntimeException e) {
            // the solver signals any failure unchecked; javac reports the real error
            LOG.debug("Cannot type '{}': {}", expression, e.getMessage());
            return TypeRef.UNKNOWN;
        }
        return inScope(resolved, typeVariablesAround(expression)) ? TypeRef.of(resolved) : TypeRef.UNKNOWN;
    }

    private static boolean inScope(ResolvedType type, Set<String> typeVariables) {
        if (type.isTypeVariable()) {
            return typeVariables.contains(type.asTypeParameter().getName());
        }
        if (type.isArray()) {
            return inScope(type.asArrayType().getComponentType(), typeVariables);
        }
        if (type.isWildcard()) {
            return !type.asWildcard().isBounded() || inScope(type.asWildcard().getBoundedType(), typeVariables);
        }
        if (type.isReferenceType()) {
            for (ResolvedType argument : type.asReferenceType().typeParametersValues()) {
                if (!inScope(argument, typeVariables)) {
                    return false;
                }
            }
        }
        return true;
    }

    private static Set<String> typeVariablesAround(Node node) {
        Set<String> names = new HashSet<>();
        for (Node current = node; current != null; current = current.getParentNode().orElse(null)) {
            if (current instanceof NodeWithTypeParameters<?> declaration) {
                for (TypeParameter parameter : declaration.getTypeParameters()) {
                    names.add(parameter.getNameAsString());
                }
            }
        }
        return names;
    }
}
