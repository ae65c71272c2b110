package org.dynamis.builder.capability;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

import com.github.javaparser.ast.body.MethodDeclaration;
import com.github.javaparser.ast.body.Parameter;
import com.github.javaparser.ast.type.TypeParameter;
import org.dynamis.builder.types.TypeRef;

/**
 * Declared shape of one combinator overload. For a varargs method the last parameter type is the
 * element type, not the array type. Types are resolved when the builder's source has a symbol
 * solver attached.
 */
public record CombinatorSignature(String methodName,
                                  List<String> typeParameters,
                                  List<TypeRef> parameterTypes,
                                  boolean varArgs,
                                  TypeRef returnType) {

    public CombinatorSignature {
        typeParameters = List.copyOf(typeParameters);
        parameterTypes = List.copyOf(parameterTypes);
    }

    public static CombinatorSignature of(MethodDeclaration method) {
        List<String> typeParameters = new ArrayList<>();
        for (TypeParameter typeParameter : method.getTypeParameters()) {
            typeParameters.add(typeParameter.getNameAsString());
        }
        List<TypeRef> parameterTypes = new ArrayList<>();
        boolean varArgs = false;
        for (Parameter parameter : method.getParameters()) {
            parameterTypes.add(TypeRef.resolving(parameter.getType()));
            varArgs = parameter.isVarArgs();
        }
        return new CombinatorSignature(method.getNameAsString(), typeParameters, parameterTypes, varArgs,
                                       TypeRef.resolving(method.getType()));
    }

    public boolean acceptsArity(int arity) {
        int declared = parameterTypes.size();
        return varArgs ? arity >= declared - 1 : arity == declared;
    }

    /** Declared type the argument at {@code position} is checked against. */
    public TypeRef parameterTypeAt(int position) {
        int last = parameterTypes.size() - 1;
        return varArgs && position >= last ? parameterTypes.get(last) : parameterTypes.get(position);
    }

    public String describe() {
        String parameters = parameterTypes.stream()
                .map(TypeRef::asString)
                .collect(Collectors.joining(", "));
        if (varArgs) {
            parameters += "...";
        }
        return returnType.asString() + " " + methodName + "(" + parameters + ")";
    }
}
