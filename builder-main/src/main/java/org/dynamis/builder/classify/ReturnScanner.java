package org.dynamis.builder.classify;

import com.github.javaparser.ast.Node;
import com.github.javaparser.ast.body.BodyDeclaration;
import com.github.javaparser.ast.expr.LambdaExpr;
import com.github.javaparser.ast.stmt.LocalClassDeclarationStmt;
import com.github.javaparser.ast.stmt.LocalRecordDeclarationStmt;
import com.github.javaparser.ast.stmt.ReturnStmt;
import com.github.javaparser.ast.stmt.Statement;
import org.dynamis.builder.parser.util.AstUtils;

/**
 * Pre-scan that decides whether a body returns explicitly. Such a body is left to ordinary
 * compilation instead of being transformed. Returns inside lambdas, local and anonymous classes
 * belong to those and are not counted.
 */
public final class ReturnScanner {

    private ReturnScanner() {
    }

    public static boolean hasNonLocalReturn(Statement body) {
        return AstUtils.hasChildOfType(body, ReturnStmt.class, ReturnScanner::sameFunction);
    }

    private static boolean sameFunction(Node node) {
        return !(node instanceof LambdaExpr
                 || node instanceof BodyDeclaration
                 || node instanceof LocalClassDeclarationStmt
                 || node instanceof LocalRecordDeclarationStmt);
    }
}
