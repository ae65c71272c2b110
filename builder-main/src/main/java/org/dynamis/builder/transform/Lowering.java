package org.dynamis.builder.transform;

import com.github.javaparser.StaticJavaParser;
import com.github.javaparser.ast.NodeList;
import com.github.javaparser.ast.body.VariableDeclarator;
import com.github.javaparser.ast.expr.AssignExpr;
import com.github.javaparser.ast.expr.CastExpr;
import com.github.javaparser.ast.expr.Expression;
import com.github.javaparser.ast.expr.MethodCallExpr;
import com.github.javaparser.ast.expr.NameExpr;
import com.github.javaparser.ast.expr.NullLiteralExpr;
import com.github.javaparser.ast.expr.ObjectCreationExpr;
import com.github.javaparser.ast.expr.VariableDeclarationExpr;
import com.github.javaparser.ast.stmt.ExpressionStmt;
import com.github.javaparser.ast.type.ClassOrInterfaceType;
import com.github.javaparser.ast.type.Type;
import com.github.javaparser.ast.type.VarType;
import org.dynamis.builder.types.TypeRef;

/**
 * Node factories for the statements the transform emits.
 */
final class Lowering {

    private Lowering() {
    }

    /** {@code var name = value;} */
    static ExpressionStmt declare(String name, Expression value) {
        return new ExpressionStmt(new VariableDeclarationExpr(new VariableDeclarator(new VarType(), name, value)));
    }

    /** {@code Type name;} or {@code Type name = null;} */
    static ExpressionStmt declareSlot(String name, Type type, boolean initiallyAbsent) {
        VariableDeclarator variable = initiallyAbsent
                ? new VariableDeclarator(type, name, new NullLiteralExpr())
                : new VariableDeclarator(type, name);
        return new ExpressionStmt(new VariableDeclarationExpr(variable));
    }

    static ExpressionStmt assign(String name, Expression value) {
        return new ExpressionStmt(new AssignExpr(new NameExpr(name), value, AssignExpr.Operator.ASSIGN));
    }

    /** {@code java.util.List<E> name = new java.util.ArrayList<>();} */
    static ExpressionStmt declareList(String name, TypeRef elementType) {
        ClassOrInterfaceType arrayList = StaticJavaParser.parseClassOrInterfaceType("java.util.ArrayList");
        arrayList.setDiamondOperator();
        ObjectCreationExpr creation = new ObjectCreationExpr(null, arrayList, new NodeList<>());
        VariableDeclarator variable = new VariableDeclarator(TypeRef.listOf(elementType).toType(), name, creation);
        return new ExpressionStmt(new VariableDeclarationExpr(variable));
    }

    static ExpressionStmt append(String list, Expression value) {
        return new ExpressionStmt(new MethodCallExpr(new NameExpr(list), "add", new NodeList<>(value)));
    }

    /** The value lifted for statements that produce nothing: {@code (Void) null}. */
    static Expression noValue() {
        return new CastExpr(StaticJavaParser.parseClassOrInterfaceType("Void"), new NullLiteralExpr());
    }
}
