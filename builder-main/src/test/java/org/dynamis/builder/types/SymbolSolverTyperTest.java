package org.dynamis.builder.types;

import java.util.List;

import com.github.javaparser.StaticJavaParser;
import com.github.javaparser.ast.CompilationUnit;
import com.github.javaparser.ast.body.MethodDeclaration;
import com.github.javaparser.ast.body.VariableDeclarator;
import com.github.javaparser.ast.expr.Expression;
import com.github.javaparser.ast.stmt.ExpressionStmt;
import org.dynamis.builder.parser.BuilderSourceParser;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class SymbolSolverTyperTest {

    private static final String SOURCE =
            "package dsl;\n" +
            "import java.util.List;\n" +
            "import static dsl.Tags.footer;\n" +
            "class Page {\n" +
            "    static final int WIDTH = 80;\n" +
            "    static Header title(String text) { return null; }\n" +
            "    static <T> T same(T value) { return value; }\n" +
            "    <E> void render(int n, Header header, List<String> items, E element) {\n" +
            "        Object sum = n + 1;\n" +
            "        Object wide = n + 1L;\n" +
            "        Object text = \"n=\" + n;\n" +
            "        Object compare = n > 2;\n" +
            "        Object cast = (Object) header;\n" +
            "        Object titled = title(\"x\");\n" +
            "        Object qualified = Page.title(\"x\");\n" +
            "        Object label = header.label();\n" +
            "        Object footer = footer();\n" +
            "        Object width = Page.WIDTH;\n" +
            "        Object created = new Header();\n" +
            "        Object list = new java.util.ArrayList<String>();\n" +
            "        Object counted = new int[3];\n" +
            "        Object size = items.size();\n" +
            "        Object first = items.get(0);\n" +
            "        Object generic = same(header);\n" +
            "        Object buffer = new StringBuffer(\"x\");\n" +
            "        Object own = element;\n" +
            "        Object undeclared = missing(1);\n" +
            "        System.out.println(\"x\");\n" +
            "        title(\"y\");\n" +
            "    }\n" +
            "}\n" +
            "class Tags {\n" +
            "    static Footer footer() { return null; }\n" +
            "}\n" +
            "class Footer {}\n" +
            "class Node {}\n" +
            "class Header extends Node {\n" +
            "    String label() { return null; }\n" +
            "}\n";

    private final SymbolSolverTyper typer = new SymbolSolverTyper();
    private MethodDeclaration render;

    @BeforeEach
    void setUp() {
        CompilationUnit unit = new BuilderSourceParser().parseCompilationUnit(SOURCE);
        SourceIndex.of(List.of(unit));
        render = unit.getType(0).getMethodsByName("render").get(0);
    }

    /** Type of the initializer of local {@code name}, the declared {@code Object} playing no part. */
    private TypeRef initializerOf(String name) {
        Expression initializer = render.findFirst(VariableDeclarator.class, v -> v.getNameAsString().equals(name))
                .flatMap(VariableDeclarator::getInitializer)
                .orElseThrow();
        return typer.typeOf(initializer, TypingScope.root());
    }

    private TypeRef statement(int index) {
        ExpressionStmt statement = render.getBody().orElseThrow().getStatement(index).asExpressionStmt();
        return typer.typeOf(statement.getExpression(), TypingScope.root());
    }

    @Test
    void literalsAndOperators() {
        assertThat(initializerOf("sum")).isEqualTo(TypeRef.of("int"));
        assertThat(initializerOf("wide")).isEqualTo(TypeRef.of("long"));
        assertThat(initializerOf("text")).isEqualTo(TypeRef.of("String"));
        assertThat(initializerOf("compare")).isEqualTo(TypeRef.of("boolean"));
        assertThat(initializerOf("cast")).isEqualTo(TypeRef.of("Object"));
    }

    @Test
    void declaredMethods() {
        assertThat(initializerOf("titled")).isEqualTo(TypeRef.of("Header"));
        assertThat(initializerOf("qualified")).isEqualTo(TypeRef.of("Header"));
        assertThat(initializerOf("label")).isEqualTo(TypeRef.of("String"));
        assertThat(initializerOf("footer")).isEqualTo(TypeRef.of("Footer"));
    }

    @Test
    void fieldsAndCreations() {
        assertThat(initializerOf("width")).isEqualTo(TypeRef.of("int"));
        assertThat(initializerOf("created")).isEqualTo(TypeRef.of("Header"));
        assertThat(initializerOf("list")).isEqualTo(TypeRef.of("java.util.ArrayList<String>"));
        assertThat(initializerOf("counted")).isEqualTo(TypeRef.of("int[]"));
    }

    @Test
    void platformMembers_areResolved() {
        assertThat(initializerOf("size")).isEqualTo(TypeRef.of("int"));
        assertThat(initializerOf("first")).isEqualTo(TypeRef.of("String"));
        assertThat(initializerOf("buffer")).isEqualTo(TypeRef.of("StringBuffer"));
        assertThat(initializerOf("buffer").resolved()).isPresent();
    }

    @Test
    void genericCalls_areInferredFromTheirArguments() {
        assertThat(initializerOf("generic")).isEqualTo(TypeRef.of("Header"));
        assertThat(initializerOf("own")).isEqualTo(TypeRef.of("E"));
    }

    // 1. Statements the block transformer sees

    @Test
    void voidCalls_areVoidWhereverTheyAreDeclared() {
        assertThat(statement(19).isVoid()).isTrue();
        assertThat(statement(20)).isEqualTo(TypeRef.of("Header"));
    }

    @Test
    void unknownWhereTheSolverStops() {
        assertThat(initializerOf("undeclared").isUnknown()).isTrue();
    }

    @Test
    void detachedExpressions_fallBackToTheScope() {
        TypingScope scope = TypingScope.root();
        scope.declare("n", TypeRef.of("int"));

        assertThat(typer.typeOf(StaticJavaParser.parseExpression("n"), scope)).isEqualTo(TypeRef.of("int"));
        assertThat(typer.typeOf(StaticJavaParser.parseExpression("n + 1"), scope).isUnknown()).isTrue();
    }
}
