package org.dynamis.builder.benchmark.domain;

import java.util.List;

import org.dynamis.builder.compiler.FunctionBinding;

/**
 * A small markup builder and the page functions written against it, as source text.
 */
public final class MarkupSources {

    public static final String BUILDER =
            "package markup;\n" +
            "public final class Markup {\n" +
            "    public static String buildExpression(String text) { return text; }\n" +
            "    public static String buildExpression(Void nothing) { return \"\"; }\n" +
            "    public static String buildBlock(String... parts) { return String.join(\"\", parts); }\n" +
            "    public static String buildDo(String... parts) { return String.join(\"\", parts); }\n" +
            "    public static String buildOptional(String part) { return part == null ? \"\" : part; }\n" +
            "    public static String buildEitherFirst(String part) { return part; }\n" +
            "    public static String buildEitherSecond(String part) { return part; }\n" +
            "    public static String buildArray(java.util.List<String> parts) { return String.join(\"\", parts); }\n" +
            "    public static String buildLimitedAvailability(String part) { return part; }\n" +
            "    public static String buildFinalResult(String page) { return \"<html>\" + page + \"</html>\"; }\n" +
            "}\n";

    public static final String PAGES =
            "package markup;\n" +
            "public final class Pages {\n" +
            "    static String text(String value) { return value; }\n" +
            "    public static String straight(String title) {\n" +
            "        text(\"<h1>\");\n" +
            "        text(title);\n" +
            "        text(\"</h1>\");\n" +
            "        text(\"<p>body</p>\");\n" +
            "    }\n" +
            "    public static String branching(int level) {\n" +
            "        if (level == 0) {\n" +
            "            text(\"<p>zero</p>\");\n" +
            "        } else if (level == 1) {\n" +
            "            text(\"<p>one</p>\");\n" +
            "        } else if (level == 2) {\n" +
            "            text(\"<p>two</p>\");\n" +
            "        } else if (level == 3) {\n" +
            "            text(\"<p>three</p>\");\n" +
            "        } else {\n" +
            "            text(\"<p>many</p>\");\n" +
            "        }\n" +
            "        text(\"<hr/>\");\n" +
            "    }\n" +
            "    public static String listing(java.util.List<String> items) {\n" +
            "        text(\"<ul>\");\n" +
            "        for (String item : items) {\n" +
            "            text(\"<li>\");\n" +
            "            text(item);\n" +
            "            text(\"</li>\");\n" +
            "        }\n" +
            "        text(\"</ul>\");\n" +
            "    }\n" +
            "}\n";

    public static final List<FunctionBinding> BINDINGS = List.of(
            FunctionBinding.of("markup.Pages", "straight", "markup.Markup"),
            FunctionBinding.of("markup.Pages", "branching", "markup.Markup"),
            FunctionBinding.of("markup.Pages", "listing", "markup.Markup"));

    private MarkupSources() {
    }
}
