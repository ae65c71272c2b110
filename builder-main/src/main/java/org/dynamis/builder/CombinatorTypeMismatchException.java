package org.dynamis.builder;

import java.util.List;

import org.dynamis.builder.capability.Combinator;
import org.dynamis.builder.types.TypeRef;

public class CombinatorTypeMismatchException extends BuilderTransformException {

    private final Combinator combinator;
    private final List<TypeRef> argumentTypes;

    public CombinatorTypeMismatchException(Combinator combinator, List<TypeRef> argumentTypes, String detail, String nodeDescription) {
        super("'" + combinator.methodName() + "' cannot accept " + TypeRef.describe(argumentTypes)
              + (detail == null ? "" : ": " + detail), nodeDescription);
        this.combinator = combinator;
        this.argumentTypes = List.copyOf(argumentTypes);
    }

    public Combinator getCombinator() {
        return combinator;
    }

    public List<TypeRef> getArgumentTypes() {
        return argumentTypes;
    }
}
