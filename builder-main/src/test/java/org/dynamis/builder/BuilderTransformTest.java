package org.dynamis.builder;

import com.github.javaparser.ast.CompilationUnit;
import com.github.javaparser.ast.stmt.BlockStmt;
import org.dynamis.builder.capability.BuilderCapabilities;
import org.dynamis.builder.capability.Capability;
import org.dynamis.builder.capability.CapabilityResolver;
import org.dynamis.builder.parser.BuilderSourceParser;
import org.dynamis.builder.types.TypeResolution;
import org.dynamis.builder.types.TypeRef;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class BuilderTransformTest {

    private static final BuilderSourceParser PARSER = new BuilderSourceParser();

    private static final String HTML_BUILDER =
            "class HtmlBuilder {\n" +
            "    static Html buildExpression(Html node) { return node; }\n" +
            "    static Html buildBlock(Html... nodes) { return null; }\n" +
            "    static Html buildOptional(Html node) { return node; }\n" +
            "    static Html buildArray(java.util.List<Html> nodes) { return null; }\n" +
            "    static Html buildDo(Html... nodes) { return null; }\n" +
            "}";

    private static final String EITHER_BUILDER =
            "class HtmlBuilder {\n" +
            "    static Html buildExpression(Html node) { return node; }\n" +
            "    static Html buildBlock(Html... nodes) { return null; }\n" +
            "    static Html buildOptional(Html node) { return node; }\n" +
            "    static Html buildEitherFirst(Html node) { return node; }\n" +
            "    static Html buildEitherSecond(Html node) { return node; }\n" +
            "    static Html buildLimitedAvailability(Html node) { return node; }\n" +
            "    static Html buildFinalResult(Html node) { return node; }\n" +
            "}";

    private static final String MINIMAL_BUILDER =
            "class HtmlBuilder {\n" +
            "    static Html buildBlock(Object... nodes) { return null; }\n" +
            "}";

    private final BuilderTransform transform = new BuilderTransform();

    private static BuilderCapabilities capabilities(String source) {
        CompilationUnit unit = PARSER.parseCompilationUnit(source);
        return new CapabilityResolver().resolve(unit.getType(0));
    }

    private TransformResult transform(String builder, String body) {
        return transform.transform(PARSER.parseBlock(body), capabilities(builder), false);
    }

    private static void assertLowered(TransformResult result, String expected) {
        assertThat(result.status()).isEqualTo(TransformResult.Status.TRANSFORMED);
        assertThat(result.body().toString()).isEqualTo(PARSER.parseBlock(expected).toString());
    }

    @Test
    void singleStatement_isLiftedAndCombined() {
        TransformResult result = transform(HTML_BUILDER, "{ header(\"a\"); }");

        assertLowered(result,
                      "{\n" +
                      "    var __builder0 = HtmlBuilder.buildExpression(header(\"a\"));\n" +
                      "    return HtmlBuilder.buildBlock(__builder0);\n" +
                      "}");
        assertThat(result.resultType()).isEqualTo(TypeRef.of("Html"));
    }

    @Test
    void conditionalWithoutEither_usesOptionalSlot() {
        TransformResult result = transform(HTML_BUILDER,
                                           "{ if (useTitle) { header(\"chapter 1\"); } paragraph(\"intro\"); }");

        assertLowered(result,
                      "{\n" +
                      "    Html __builder1 = null;\n" +
                      "    if (useTitle) {\n" +
                      "        __builder1 = HtmlBuilder.buildExpression(header(\"chapter 1\"));\n" +
                      "    }\n" +
                      "    var __builder2 = HtmlBuilder.buildOptional(__builder1);\n" +
                      "    var __builder3 = HtmlBuilder.buildExpression(paragraph(\"intro\"));\n" +
                      "    return HtmlBuilder.buildBlock(__builder2, __builder3);\n" +
                      "}");
    }

    @Test
    void ifElseWithoutEither_givesOneOptionalPerBranch() {
        TransformResult result = transform(HTML_BUILDER, "{ if (a) { header(\"x\"); } else { footer(\"y\"); } }");

        assertLowered(result,
                      "{\n" +
                      "    Html __builder2 = null;\n" +
                      "    Html __builder3 = null;\n" +
                      "    if (a) {\n" +
                      "        __builder2 = HtmlBuilder.buildExpression(header(\"x\"));\n" +
                      "    } else {\n" +
                      "        __builder3 = HtmlBuilder.buildExpression(footer(\"y\"));\n" +
                      "    }\n" +
                      "    var __builder4 = HtmlBuilder.buildOptional(__builder2);\n" +
                      "    var __builder5 = HtmlBuilder.buildOptional(__builder3);\n" +
                      "    return HtmlBuilder.buildBlock(__builder4, __builder5);\n" +
                      "}");
    }

    @Test
    void threeWayEither_injectsThroughBalancedTree() {
        TransformResult result = transform(EITHER_BUILDER,
                                           "{ if (a) { header(\"x\"); } else if (b) { paragraph(\"y\"); } else { footer(\"z\"); } }");

        assertLowered(result,
                      "{\n" +
                      "    Html __builder3;\n" +
                      "    if (a) {\n" +
                      "        __builder3 = HtmlBuilder.buildEitherFirst(HtmlBuilder.buildExpression(header(\"x\")));\n" +
                      "    } else if (b) {\n" +
                      "        __builder3 = HtmlBuilder.buildEitherSecond(HtmlBuilder.buildEitherFirst(" +
                      "HtmlBuilder.buildExpression(paragraph(\"y\"))));\n" +
                      "    } else {\n" +
                      "        __builder3 = HtmlBuilder.buildEitherSecond(HtmlBuilder.buildEitherSecond(" +
                      "HtmlBuilder.buildExpression(footer(\"z\"))));\n" +
                      "    }\n" +
                      "    return HtmlBuilder.buildFinalResult(HtmlBuilder.buildBlock(__builder3));\n" +
                      "}");
    }

    @Test
    void eitherWithMissingElse_wrapsSharedSlotInOptional() {
        TransformResult result = transform(EITHER_BUILDER, "{ if (a) { header(\"x\"); } }");

        assertLowered(result,
                      "{\n" +
                      "    Html __builder1 = null;\n" +
                      "    if (a) {\n" +
                      "        __builder1 = HtmlBuilder.buildExpression(header(\"x\"));\n" +
                      "    }\n" +
                      "    var __builder2 = HtmlBuilder.buildOptional(__builder1);\n" +
                      "    return HtmlBuilder.buildFinalResult(HtmlBuilder.buildBlock(__builder2));\n" +
                      "}");
    }

    @Test
    void availabilityCheck_wrapsThenBranchInLimitedAvailability() {
        TransformResult result = transform(EITHER_BUILDER,
                                           "{ if (isAvailable(\"grid\")) { grid(); } else { table(); } }");

        assertLowered(result,
                      "{\n" +
                      "    Html __builder2;\n" +
                      "    if (isAvailable(\"grid\")) {\n" +
                      "        __builder2 = HtmlBuilder.buildEitherFirst(HtmlBuilder.buildLimitedAvailability(" +
                      "HtmlBuilder.buildExpression(grid())));\n" +
                      "    } else {\n" +
                      "        __builder2 = HtmlBuilder.buildEitherSecond(HtmlBuilder.buildExpression(table()));\n" +
                      "    }\n" +
                      "    return HtmlBuilder.buildFinalResult(HtmlBuilder.buildBlock(__builder2));\n" +
                      "}");
    }

    @Test
    void forEachLoop_collectsIterationsIntoArray() {
        TransformResult result = transform(HTML_BUILDER, "{ for (String item : items) { paragraph(item); } }");

        assertLowered(result,
                      "{\n" +
                      "    java.util.List<Html> __builder1 = new java.util.ArrayList<>();\n" +
                      "    for (String item : items) {\n" +
                      "        var __builder0 = HtmlBuilder.buildExpression(paragraph(item));\n" +
                      "        __builder1.add(HtmlBuilder.buildBlock(__builder0));\n" +
                      "    }\n" +
                      "    var __builder2 = HtmlBuilder.buildArray(__builder1);\n" +
                      "    return HtmlBuilder.buildBlock(__builder2);\n" +
                      "}");
    }

    @Test
    void nestedBlock_combinesWithBuildDo() {
        TransformResult result = transform(HTML_BUILDER, "{ { header(\"a\"); paragraph(\"b\"); } }");

        assertLowered(result,
                      "{\n" +
                      "    Html __builder2;\n" +
                      "    {\n" +
                      "        var __builder0 = HtmlBuilder.buildExpression(header(\"a\"));\n" +
                      "        var __builder1 = HtmlBuilder.buildExpression(paragraph(\"b\"));\n" +
                      "        __builder2 = HtmlBuilder.buildDo(__builder0, __builder1);\n" +
                      "    }\n" +
                      "    return HtmlBuilder.buildBlock(__builder2);\n" +
                      "}");
    }

    @Test
    void switchStatement_keepsBreaksAndSlotsPerCase() {
        TransformResult result = transform(HTML_BUILDER,
                                           "{ switch (level) { case 1: header(\"a\"); break; default: paragraph(\"b\"); } }");

        assertLowered(result,
                      "{\n" +
                      "    Html __builder2 = null;\n" +
                      "    Html __builder3 = null;\n" +
                      "    switch (level) {\n" +
                      "        case 1:\n" +
                      "            __builder2 = HtmlBuilder.buildExpression(header(\"a\"));\n" +
                      "            break;\n" +
                      "        default:\n" +
                      "            __builder3 = HtmlBuilder.buildExpression(paragraph(\"b\"));\n" +
                      "    }\n" +
                      "    var __builder4 = HtmlBuilder.buildOptional(__builder2);\n" +
                      "    var __builder5 = HtmlBuilder.buildOptional(__builder3);\n" +
                      "    return HtmlBuilder.buildBlock(__builder4, __builder5);\n" +
                      "}");
    }

    @Test
    void arrowSwitch_withEither_sharesOneSlot() {
        TransformResult result = transform(EITHER_BUILDER,
                                           "{ switch (level) { case 1 -> header(\"a\"); default -> paragraph(\"b\"); } }");

        assertLowered(result,
                      "{\n" +
                      "    Html __builder2;\n" +
                      "    switch (level) {\n" +
                      "        case 1 -> {\n" +
                      "            __builder2 = HtmlBuilder.buildEitherFirst(HtmlBuilder.buildExpression(header(\"a\")));\n" +
                      "        }\n" +
                      "        default -> {\n" +
                      "            __builder2 = HtmlBuilder.buildEitherSecond(HtmlBuilder.buildExpression(paragraph(\"b\")));\n" +
                      "        }\n" +
                      "    }\n" +
                      "    return HtmlBuilder.buildFinalResult(HtmlBuilder.buildBlock(__builder2));\n" +
                      "}");
    }

    @Test
    void declarationsAndAssignments_passThrough() {
        TransformResult result = transform(MINIMAL_BUILDER, "{ int n = 1; n = 2; node(n); }");

        assertLowered(result,
                      "{\n" +
                      "    int n = 1;\n" +
                      "    n = 2;\n" +
                      "    var __builder0 = (Void) null;\n" +
                      "    var __builder1 = node(n);\n" +
                      "    return HtmlBuilder.buildBlock(__builder0, __builder1);\n" +
                      "}");
    }

    @Test
    void assignmentLifting_canBeSwitchedOff() {
        BuilderTransform noLifting = new BuilderTransform(
                (expression, scope) -> TypeRef.UNKNOWN, TypeResolution.jdk(),
                TransformOptions.builder().liftAssignments(false).build());

        TransformResult result = noLifting.transform(PARSER.parseBlock("{ int n = 1; n = 2; node(n); }"),
                                                     capabilities(MINIMAL_BUILDER), false);

        assertLowered(result,
                      "{\n" +
                      "    int n = 1;\n" +
                      "    n = 2;\n" +
                      "    var __builder0 = node(n);\n" +
                      "    return HtmlBuilder.buildBlock(__builder0);\n" +
                      "}");
    }

    @Test
    void generatedNames_skipIdentifiersInTheBody() {
        TransformResult result = transform(MINIMAL_BUILDER, "{ var __builder0 = 1; node(__builder0); }");

        assertLowered(result,
                      "{\n" +
                      "    var __builder0 = 1;\n" +
                      "    var __builder1 = node(__builder0);\n" +
                      "    return HtmlBuilder.buildBlock(__builder1);\n" +
                      "}");
    }

    @Test
    void emptyBody_isIgnoredAndUnchanged() {
        BlockStmt body = PARSER.parseBlock("{ int unused = 1; }");

        TransformResult result = transform.transform(body, capabilities(HTML_BUILDER), false);

        assertThat(result.status()).isEqualTo(TransformResult.Status.IGNORED);
        assertThat(result.body().toString()).isEqualTo(body.toString());
        assertThat(result.body()).isNotSameAs(body);
    }

    @Test
    void selectionWithoutProducingBranches_isEmittedUnchanged() {
        TransformResult result = transform(HTML_BUILDER,
                                           "{ if (a) { int x = 1; } else { throw new IllegalStateException(); } node(); }");

        assertLowered(result,
                      "{\n" +
                      "    if (a) { int x = 1; } else { throw new IllegalStateException(); }\n" +
                      "    var __builder0 = HtmlBuilder.buildExpression(node());\n" +
                      "    return HtmlBuilder.buildBlock(__builder0);\n" +
                      "}");
    }

    @Test
    void bodyEndingInThrow_isIgnored() {
        TransformResult result = transform(HTML_BUILDER, "{ node(); throw new IllegalStateException(); }");

        assertThat(result.status()).isEqualTo(TransformResult.Status.IGNORED);
    }

    @Test
    void explicitReturn_suppressesTheTransform() {
        BlockStmt body = PARSER.parseBlock("{ header(\"a\"); return null; }");

        TransformResult result = transform.transform(body, capabilities(HTML_BUILDER), true);

        assertThat(result.status()).isEqualTo(TransformResult.Status.SUPPRESSED);
        assertThat(result.body().toString()).isEqualTo(body.toString());
    }

    @Test
    void returnWithoutSuppression_isIllegal() {
        assertThatThrownBy(() -> transform(HTML_BUILDER, "{ header(\"a\"); if (done) { return; } }"))
                .isInstanceOf(IllegalStatementException.class)
                .hasMessageContaining("'return' is not allowed");
    }

    @Test
    void tryStatement_isIllegal() {
        assertThatThrownBy(() -> transform(HTML_BUILDER, "{ try { header(\"a\"); } finally { close(); } }"))
                .isInstanceOf(IllegalStatementException.class);
    }

    @Test
    void switchFallThrough_isIllegal() {
        assertThatThrownBy(() -> transform(HTML_BUILDER,
                                           "{ switch (n) { case 1: header(\"a\"); case 2: paragraph(\"b\"); } }"))
                .isInstanceOf(IllegalStatementException.class)
                .hasMessageContaining("fall-through");
    }

    @Test
    void loopWithoutBuildArray_reportsMissingCapability() {
        assertThatThrownBy(() -> transform(MINIMAL_BUILDER, "{ for (String s : items) { node(s); } }"))
                .isInstanceOf(MissingCapabilityException.class)
                .satisfies(e -> assertThat(((MissingCapabilityException) e).getCapability())
                        .isEqualTo(Capability.ARRAY));
    }

    @Test
    void skippableBranchWithoutOptional_reportsMissingCapability() {
        assertThatThrownBy(() -> transform(MINIMAL_BUILDER, "{ if (a) { node(); } }"))
                .isInstanceOf(MissingCapabilityException.class)
                .satisfies(e -> assertThat(((MissingCapabilityException) e).getCapability())
                        .isEqualTo(Capability.OPTIONAL));
    }

    @Test
    void producingNestedBlockWithoutBuildDo_reportsMissingCapability() {
        assertThatThrownBy(() -> transform(MINIMAL_BUILDER, "{ { node(); } }"))
                .isInstanceOf(MissingCapabilityException.class)
                .hasMessageContaining("buildDo");
    }

    @Test
    void nonProducingNestedBlock_needsNoBuildDo() {
        TransformResult result = transform(MINIMAL_BUILDER, "{ { int x = 1; } node(); }");

        assertLowered(result,
                      "{\n" +
                      "    { int x = 1; }\n" +
                      "    var __builder0 = node();\n" +
                      "    return HtmlBuilder.buildBlock(__builder0);\n" +
                      "}");
    }

    @Test
    void inputBody_isNeverModified() {
        BlockStmt body = PARSER.parseBlock("{ if (a) { header(\"x\"); } for (String s : items) { paragraph(s); } }");
        String before = body.toString();

        transform.transform(body, capabilities(HTML_BUILDER), false);

        assertThat(body.toString()).isEqualTo(before);
    }
}
