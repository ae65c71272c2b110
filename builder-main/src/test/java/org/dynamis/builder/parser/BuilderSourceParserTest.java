package org.dynamis.builder.parser;

import java.io.StringReader;

import com.github.javaparser.ast.CompilationUnit;
import com.github.javaparser.ast.stmt.BlockStmt;
import org.dynamis.builder.BuilderParseException;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class BuilderSourceParserTest {

    private final BuilderSourceParser parser = new BuilderSourceParser();

    @Test
    void parsesJava17Constructs() {
        CompilationUnit unit = parser.parseCompilationUnit(
                "record Point(int x, int y) {\n" +
                "    String kind(Object o) { return o instanceof Point p ? \"point\" : \"other\"; }\n" +
                "}");

        assertThat(unit.getType(0).getNameAsString()).isEqualTo("Point");
    }

    @Test
    void parsesFromReader() {
        CompilationUnit unit = parser.parseCompilationUnit(new StringReader("package a; class B {}"));

        assertThat(unit.getPackageDeclaration()).isPresent();
    }

    @Test
    void parsesBodies() {
        BlockStmt block = parser.parseBlock("{ header(\"a\"); if (x) { p(); } }");

        assertThat(block.getStatements()).hasSize(2);
    }

    @Test
    void reportsPositionOfFirstProblem() {
        assertThatThrownBy(() -> parser.parseBlock("{ header(\"a\") }"))
            .isInstanceOf(BuilderParseException.class)
            .satisfies(e -> assertThat(((BuilderParseException) e).getLine()).isEqualTo(1));
    }
}
