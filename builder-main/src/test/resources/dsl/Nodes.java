package dsl;

import java.util.ArrayList;
import java.util.List;

public final class Nodes {

    private Nodes() {
    }

    public static class Header {
    }

    public static class Paragraph {
    }

    static Header header() {
        return new Header();
    }

    static Paragraph paragraph() {
        return new Paragraph();
    }

    @SafeVarargs
    public static <C> List<C> buildBlock(C... parts) {
        return new ArrayList<>(List.of(parts));
    }

    public static <T> T buildExpression(T value) {
        return value;
    }

    public static <T> T buildEitherFirst(T value) {
        return value;
    }

    public static <T> T buildEitherSecond(T value) {
        return value;
    }

    public static List<Object> mixed() {
        header();
        paragraph();
    }

    public static Object branches(boolean flag) {
        if (flag) {
            header();
        } else {
            paragraph();
        }
    }

    public static List<Header> headers() {
        header();
        header();
    }
}
