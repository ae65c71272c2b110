package org.dynamis.builder.types;

import java.util.HashMap;
import java.util.Map;

/**
 * Lexically nested variable types visible to one statement. Each nested block gets a child
 * scope, so a binding never leaks past the block that declares it.
 */
public final class TypingScope {

    private final TypingScope parent;
    private final Map<String, TypeRef> variables = new HashMap<>();

    private TypingScope(TypingScope parent) {
        this.parent = parent;
    }

    public static TypingScope root() {
        return new TypingScope(null);
    }

    public static TypingScope of(Map<String, TypeRef> variables) {
        TypingScope scope = root();
        variables.forEach(scope::declare);
        return scope;
    }

    public TypingScope child() {
        return new TypingScope(this);
    }

    public void declare(String name, TypeRef type) {
        variables.put(name, type);
    }

    public boolean isDeclared(String name) {
        for (TypingScope scope = this; scope != null; scope = scope.parent) {
            if (scope.variables.containsKey(name)) {
                return true;
            }
        }
        return false;
    }

    public TypeRef lookup(String name) {
        for (TypingScope scope = this; scope != null; scope = scope.parent) {
            TypeRef type = scope.variables.get(name);
            if (type != null) {
                return type;
            }
        }
        return TypeRef.UNKNOWN;
    }
}
