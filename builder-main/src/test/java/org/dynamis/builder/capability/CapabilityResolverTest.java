package org.dynamis.builder.capability;

import com.github.javaparser.ast.CompilationUnit;
import com.github.javaparser.ast.body.TypeDeclaration;
import org.dynamis.builder.parser.BuilderSourceParser;
import org.dynamis.builder.types.TypeRef;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CapabilityResolverTest {

    private static TypeDeclaration<?> type(String source) {
        CompilationUnit unit = new BuilderSourceParser().parseCompilationUnit(source);
        return unit.getType(0);
    }

    @Test
    void detectsStaticCombinators() {
        TypeDeclaration<?> builder = type(
                "package dsl;\n" +
                "class Html {\n" +
                "    static Node buildBlock(Node... nodes) { return null; }\n" +
                "    static Node buildExpression(Node node) { return node; }\n" +
                "    static Node buildExpression(String text) { return null; }\n" +
                "    static Node buildOptional(Node node) { return node; }\n" +
                "    static Node buildArray(java.util.List<Node> nodes) { return null; }\n" +
                "}");

        BuilderCapabilities capabilities = new CapabilityResolver().resolve(builder);

        assertThat(capabilities.builderName()).isEqualTo("dsl.Html");
        assertThat(capabilities.present())
                .containsExactlyInAnyOrder(Capability.BLOCK, Capability.EXPRESSION, Capability.OPTIONAL, Capability.ARRAY);
        assertThat(capabilities.overloads(Combinator.EXPRESSION)).hasSize(2);
        assertThat(capabilities.overloads(Combinator.BLOCK).get(0).varArgs()).isTrue();
        assertThat(capabilities.overloads(Combinator.BLOCK).get(0).parameterTypeAt(3)).isEqualTo(TypeRef.of("Node"));
    }

    @Test
    void ignoresInstanceMethodsAndWrongShapes() {
        TypeDeclaration<?> builder = type(
                "class Html {\n" +
                "    Node buildBlock(Node... nodes) { return null; }\n" +
                "    static Node buildOptional(Node a, Node b) { return a; }\n" +
                "    static Node buildFinalResult(Node... nodes) { return null; }\n" +
                "}");

        assertThat(new CapabilityResolver().resolve(builder).present()).isEmpty();
    }

    @Test
    void eitherNeedsBothHalves() {
        BuilderCapabilities firstOnly = new CapabilityResolver().resolve(type(
                "class Html {\n" +
                "    static Node buildEitherFirst(Node node) { return node; }\n" +
                "}"));

        assertThat(firstOnly.has(Capability.EITHER)).isFalse();
        assertThat(firstOnly.overloads(Combinator.EITHER_FIRST)).hasSize(1);
    }

    @Test
    void resolvesOncePerBuilderType() {
        CapabilityResolver resolver = new CapabilityResolver();
        TypeDeclaration<?> builder = type("class Html { static Node buildBlock(Node... n) { return null; } }");

        BuilderCapabilities first = resolver.resolve(builder);
        BuilderCapabilities second = resolver.resolve(builder);

        assertThat(second).isSameAs(first);
        assertThat(resolver.cacheSize()).isEqualTo(1);
        resolver.clear();
        assertThat(resolver.cacheSize()).isZero();
    }

    @Test
    void builderRejectsMismatchedShape() {
        CombinatorSignature variadic = CombinatorSignature.of(
                type("class A { static int f(int... xs) { return 0; } }").getMethodsByName("f").get(0));

        assertThatThrownBy(() -> BuilderCapabilities.builder("A").with(Combinator.OPTIONAL, variadic))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
