package org.dynamis.builder.transform;

import java.util.function.Function;

import com.github.javaparser.ast.NodeList;
import com.github.javaparser.ast.expr.Expression;
import com.github.javaparser.ast.expr.NameExpr;
import com.github.javaparser.ast.expr.VariableDeclarationExpr;
import com.github.javaparser.ast.body.VariableDeclarator;
import com.github.javaparser.ast.stmt.ExpressionStmt;
import com.github.javaparser.ast.stmt.Statement;
import org.dynamis.builder.types.TypeRef;

/**
 * The rewritten statements of one block plus, unless the block is ignored, the expression that
 * combines its partial results. The expression is only valid after the statements, in the same scope.
 */
public final class BlockResult {

    private final NodeList<Statement> statements;
    private final Expression combined;
    private final TypeRef combinedType;
    private final boolean completesNormally;

    private BlockResult(NodeList<Statement> statements, Expression combined, TypeRef combinedType,
                        boolean completesNormally) {
        this.statements = statements;
        this.combined = combined;
        this.combinedType = combinedType;
        this.completesNormally = completesNormally;
    }

    static BlockResult ignored(NodeList<Statement> statements, boolean completesNormally) {
        return new BlockResult(statements, null, TypeRef.UNKNOWN, completesNormally);
    }

    static BlockResult combined(NodeList<Statement> statements, Expression combined, TypeRef combinedType) {
        return new BlockResult(statements, combined, combinedType, true);
    }

    /** True when the block contributes nothing to its parent. */
    public boolean isIgnored() {
        return combined == null;
    }

    /** False when the block always ends in a {@code throw}. */
    public boolean completesNormally() {
        return completesNormally;
    }

    public NodeList<Statement> statements() {
        return statements;
    }

    public Expression combined() {
        if (combined == null) {
            throw new IllegalStateException("Ignored block has no combined result");
        }
        return combined;
    }

    public TypeRef combinedType() {
        return combinedType;
    }

    /**
     * The block's statements followed by {@code consumer} applied to the combined value. When the
     * combined value is the local declared by the last statement, that declaration is folded into
     * the consuming statement instead.
     */
    public NodeList<Statement> statementsThen(Function<Expression, Statement> consumer) {
        NodeList<Statement> result = new NodeList<>();
        for (Statement statement : statements) {
            result.add(statement.clone());
        }
        Expression value = combined().clone();
        if (combined instanceof NameExpr name && !result.isEmpty()) {
            Expression initializer = trailingInitializer(result.get(result.size() - 1), name.getNameAsString());
            if (initializer != null) {
                result.remove(result.size() - 1);
                value = initializer.clone();
            }
        }
        result.add(consumer.apply(value));
        return result;
    }

    private static Expression trailingInitializer(Statement last, String name) {
        if (!(last instanceof ExpressionStmt expressionStmt)
            || !(expressionStmt.getExpression() instanceof VariableDeclarationExpr declaration)
            || declaration.getVariables().size() != 1) {
            return null;
        }
        VariableDeclarator variable = declaration.getVariable(0);
        if (!variable.getNameAsString().equals(name)) {
            return null;
        }
        return variable.getInitializer().orElse(null);
    }
}
