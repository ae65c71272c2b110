package org.dynamis.builder;

import java.util.List;

import org.dynamis.builder.capability.Combinator;
import org.dynamis.builder.types.TypeRef;

public class UnresolvableOverloadException extends BuilderTransformException {

    private final String builderName;
    private final Combinator combinator;
    private final List<TypeRef> argumentTypes;

    public UnresolvableOverloadException(String builderName, Combinator combinator, List<TypeRef> argumentTypes,
                                         String detail, String nodeDescription) {
        super("No applicable overload of '" + builderName + "." + combinator.methodName() + "' for "
              + TypeRef.describe(argumentTypes) + ": " + detail, nodeDescription);
        this.builderName = builderName;
        this.combinator = combinator;
        this.argumentTypes = List.copyOf(argumentTypes);
    }

    public String getBuilderName() {
        return builderName;
    }

    public Combinator getCombinator() {
        return combinator;
    }

    public List<TypeRef> getArgumentTypes() {
        return argumentTypes;
    }
}
