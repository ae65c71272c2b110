package org.dynamis.builder.transform;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.function.UnaryOperator;

/**
 * Binary tree whose leaves are the result-producing branches of one selection, in source order.
 * The left subtree of every node holds {@code floor(n / 2)} leaves, so paths are at most
 * {@code ceil(log2 n)} steps long.
 */
public final class InjectionTree {

    public enum Step {
        LEFT,
        RIGHT
    }

    private final List<List<Step>> paths;

    private InjectionTree(List<List<Step>> paths) {
        this.paths = paths;
    }

    public static InjectionTree balanced(int leaves) {
        if (leaves < 1) {
            throw new IllegalArgumentException("An injection tree needs at least one leaf, got " + leaves);
        }
        List<List<Step>> paths = new ArrayList<>(leaves);
        collect(leaves, new ArrayList<>(), paths);
        return new InjectionTree(Collections.unmodifiableList(paths));
    }

    private static void collect(int leaves, List<Step> prefix, List<List<Step>> paths) {
        if (leaves == 1) {
            paths.add(List.copyOf(prefix));
            return;
        }
        int left = leaves / 2;
        prefix.add(Step.LEFT);
        collect(left, prefix, paths);
        prefix.set(prefix.size() - 1, Step.RIGHT);
        collect(leaves - left, prefix, paths);
        prefix.remove(prefix.size() - 1);
    }

    public int leafCount() {
        return paths.size();
    }

    /** Steps from the root to {@code leaf}; empty for a single-leaf tree. */
    public List<Step> path(int leaf) {
        return paths.get(leaf);
    }

    /**
     * Folds the path to {@code leaf} right-to-left over {@code value}: the step nearest the leaf
     * wraps first.
     */
    public <T> T inject(int leaf, T value, UnaryOperator<T> left, UnaryOperator<T> right) {
        List<Step> path = path(leaf);
        T result = value;
        for (int i = path.size() - 1; i >= 0; i--) {
            result = path.get(i) == Step.LEFT ? left.apply(result) : right.apply(result);
        }
        return result;
    }
}
