package org.dynamis.builder.classify;

import com.github.javaparser.ast.stmt.BlockStmt;
import com.github.javaparser.ast.stmt.ContinueStmt;
import com.github.javaparser.ast.stmt.Statement;
import org.dynamis.builder.IllegalStatementException;
import org.dynamis.builder.parser.BuilderSourceParser;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class StatementClassifierTest {

    private final StatementClassifier classifier = new StatementClassifier();

    private static Statement statement(String body) {
        BlockStmt block = new BuilderSourceParser().parseBlock("{ " + body + " }");
        return block.getStatement(0);
    }

    private StatementKind classify(String body) {
        return classifier.classify(statement(body));
    }

    @Test
    void declarations() {
        assertThat(classify("int x = 1;")).isEqualTo(StatementKind.DECLARATION);
        assertThat(classify("var s = \"a\";")).isEqualTo(StatementKind.DECLARATION);
        assertThat(classify("class Local {}")).isEqualTo(StatementKind.DECLARATION);
        assertThat(classify("record Pair(int a, int b) {}")).isEqualTo(StatementKind.DECLARATION);
    }

    @Test
    void expressionsAndAssignments() {
        assertThat(classify("header(\"a\");")).isEqualTo(StatementKind.EXPRESSION);
        assertThat(classify("new Paragraph();")).isEqualTo(StatementKind.EXPRESSION);
        assertThat(classify("x = 2;")).isEqualTo(StatementKind.ASSIGNMENT);
        assertThat(classify("x += 2;")).isEqualTo(StatementKind.ASSIGNMENT);
        assertThat(classify("x++;")).isEqualTo(StatementKind.ASSIGNMENT);
        assertThat(classify("--x;")).isEqualTo(StatementKind.ASSIGNMENT);
    }

    @Test
    void structuredStatements() {
        assertThat(classify("if (a) { b(); }")).isEqualTo(StatementKind.SELECTION);
        assertThat(classify("switch (n) { default: b(); }")).isEqualTo(StatementKind.SELECTION);
        assertThat(classify("{ b(); }")).isEqualTo(StatementKind.DO);
        assertThat(classify("for (String s : items) { b(s); }")).isEqualTo(StatementKind.FOR_IN);
    }

    @Test
    void passThroughStatements() {
        assertThat(classify("throw new IllegalStateException();")).isEqualTo(StatementKind.THROW);
        assertThat(classify(";")).isEqualTo(StatementKind.DIAGNOSTIC);
        assertThat(classify("assert x > 0;")).isEqualTo(StatementKind.DIAGNOSTIC);
        assertThat(StatementKind.THROW.isPassThrough()).isTrue();
        assertThat(StatementKind.EXPRESSION.isPassThrough()).isFalse();
    }

    @Test
    void controlTransfer_isIllegal() {
        assertThat(classify("return;")).isEqualTo(StatementKind.ILLEGAL);
        assertThat(classify("while (true) { b(); }")).isEqualTo(StatementKind.ILLEGAL);
        assertThat(classify("for (int i = 0; i < 3; i++) { b(); }")).isEqualTo(StatementKind.ILLEGAL);
        assertThat(classify("try { b(); } catch (RuntimeException e) { c(); }")).isEqualTo(StatementKind.ILLEGAL);
        assertThat(classify("synchronized (this) { b(); }")).isEqualTo(StatementKind.ILLEGAL);
    }

    @Test
    void illegal_namesTheConstruct() {
        IllegalStatementException ex = classifier.illegal(statement("do { b(); } while (x);"));

        assertThat(ex.getConstruct()).isEqualTo("do-while");
        assertThat(ex.getNodeDescription()).contains("line 1");
    }

    @Test
    void unparsedStatement_hasNoPosition() {
        IllegalStatementException ex = classifier.illegal(new ContinueStmt());

        assertThat(ex.getConstruct()).isEqualTo("continue");
        assertThat(ex.getNodeDescription()).isEqualTo("continue;");
    }
}
