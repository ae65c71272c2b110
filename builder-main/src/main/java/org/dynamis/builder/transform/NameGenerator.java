package org.dynamis.builder.transform;

import java.util.HashSet;
import java.util.Set;

import com.github.javaparser.ast.Node;
import com.github.javaparser.ast.expr.SimpleName;

/**
 * Hands out the names of transform-declared locals: {@code prefix0}, {@code prefix1}, ...,
 * skipping any identifier the body already uses.
 */
public final class NameGenerator {

    private final String prefix;
    private final Set<String> taken;
    private int next;

    private NameGenerator(String prefix, Set<String> taken) {
        this.prefix = prefix;
        this.taken = taken;
    }

    public static NameGenerator forBody(Node body, String prefix) {
        Set<String> taken = new HashSet<>();
        for (SimpleName name : body.findAll(SimpleName.class)) {
            taken.add(name.getIdentifier());
        }
        return new NameGenerator(prefix, taken);
    }

    public String next() {
        String name;
        do {
            name = prefix + next++;
        } while (!taken.add(name));
        return name;
    }
}
