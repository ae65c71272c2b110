package org.dynamis.builder.classify;

import com.github.javaparser.ast.expr.AssignExpr;
import com.github.javaparser.ast.expr.Expression;
import com.github.javaparser.ast.expr.UnaryExpr;
import com.github.javaparser.ast.expr.VariableDeclarationExpr;
import com.github.javaparser.ast.stmt.AssertStmt;
import com.github.javaparser.ast.stmt.BlockStmt;
import com.github.javaparser.ast.stmt.BreakStmt;
import com.github.javaparser.ast.stmt.ContinueStmt;
import com.github.javaparser.ast.stmt.DoStmt;
import com.github.javaparser.ast.stmt.EmptyStmt;
import com.github.javaparser.ast.stmt.ExpressionStmt;
import com.github.javaparser.ast.stmt.ForEachStmt;
import com.github.javaparser.ast.stmt.ForStmt;
import com.github.javaparser.ast.stmt.IfStmt;
import com.github.javaparser.ast.stmt.LabeledStmt;
import com.github.javaparser.ast.stmt.LocalClassDeclarationStmt;
import com.github.javaparser.ast.stmt.LocalRecordDeclarationStmt;
import com.github.javaparser.ast.stmt.ReturnStmt;
import com.github.javaparser.ast.stmt.Statement;
import com.github.javaparser.ast.stmt.SwitchStmt;
import com.github.javaparser.ast.stmt.SynchronizedStmt;
import com.github.javaparser.ast.stmt.ThrowStmt;
import com.github.javaparser.ast.stmt.TryStmt;
import com.github.javaparser.ast.stmt.WhileStmt;
import com.github.javaparser.ast.stmt.YieldStmt;
import org.dynamis.builder.IllegalStatementException;
import org.dynamis.builder.parser.util.AstUtils;

/**
 * Sorts statements into the {@link StatementKind}s the transform handles. Purely syntactic: a
 * call is an {@link StatementKind#EXPRESSION} here even when it turns out to return {@code void}.
 */
public class StatementClassifier {

    public StatementKind classify(Statement statement) {
        if (statement instanceof ExpressionStmt expressionStmt) {
            return classifyExpression(expressionStmt.getExpression());
        }
        if (statement instanceof IfStmt || statement instanceof SwitchStmt) {
            return StatementKind.SELECTION;
        }
        if (statement instanceof BlockStmt) {
            return StatementKind.DO;
        }
        if (statement instanceof ForEachStmt) {
            return StatementKind.FOR_IN;
        }
        if (statement instanceof ThrowStmt) {
            return StatementKind.THROW;
        }
        if (statement instanceof LocalClassDeclarationStmt || statement instanceof LocalRecordDeclarationStmt) {
            return StatementKind.DECLARATION;
        }
        if (statement instanceof EmptyStmt || statement instanceof AssertStmt) {
            return StatementKind.DIAGNOSTIC;
        }
        return StatementKind.ILLEGAL;
    }

    private static StatementKind classifyExpression(Expression expression) {
        if (expression instanceof VariableDeclarationExpr) {
            return StatementKind.DECLARATION;
        }
        if (expression instanceof AssignExpr) {
            return StatementKind.ASSIGNMENT;
        }
        if (expression instanceof UnaryExpr unary && isIncrement(unary)) {
            return StatementKind.ASSIGNMENT;
        }
        return StatementKind.EXPRESSION;
    }

    private static boolean isIncrement(UnaryExpr unary) {
        switch (unary.getOperator()) {
            case PREFIX_INCREMENT:
            case PREFIX_DECREMENT:
            case POSTFIX_INCREMENT:
            case POSTFIX_DECREMENT:
                return true;
            default:
                return false;
        }
    }

    public IllegalStatementException illegal(Statement statement) {
        return new IllegalStatementException(constructName(statement), AstUtils.describe(statement));
    }

    static String constructName(Statement statement) {
        if (statement instanceof ReturnStmt) {
            return "return";
        }
        if (statement instanceof BreakStmt) {
            return "break";
        }
        if (statement instanceof ContinueStmt) {
            return "continue";
        }
        if (statement instanceof YieldStmt) {
            return "yield";
        }
        if (statement instanceof TryStmt) {
            return "try";
        }
        if (statement instanceof WhileStmt) {
            return "while";
        }
        if (statement instanceof DoStmt) {
            return "do-while";
        }
        if (statement instanceof ForStmt) {
            return "for";
        }
        if (statement instanceof LabeledStmt) {
            return "labeled statement";
        }
        if (statement instanceof SynchronizedStmt) {
            return "synchronized";
        }
        return statement.getClass().getSimpleName();
    }
}
