package org.dynamis.builder.types;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Collectors;

import com.github.javaparser.ParseProblemException;
import com.github.javaparser.StaticJavaParser;
import com.github.javaparser.ast.NodeList;
import com.github.javaparser.ast.type.ArrayType;
import com.github.javaparser.ast.type.ClassOrInterfaceType;
import com.github.javaparser.ast.type.PrimitiveType;
import com.github.javaparser.ast.type.Type;
import com.github.javaparser.ast.type.VoidType;
import com.github.javaparser.ast.type.WildcardType;
import com.github.javaparser.resolution.types.ResolvedType;

/**
 * Statically known type of a value produced or consumed by the transform. Wraps a JavaParser
 * {@link Type}; {@link #UNKNOWN} stands for a type that cannot be derived from local information
 * and is accepted wherever a type is required, leaving the final word to javac.
 * <p>
 * Names are compared by their simple (unqualified) form, so {@code java.util.List<String>}
 * and {@code List<String>} are the same type. A reference that came out of the symbol solver
 * also keeps the {@link ResolvedType}, which {@link TypeResolution} prefers for subtype checks.
 */
public final class TypeRef {

    private static final Map<String, String> BOXES = Map.of(
            "int", "Integer",
            "long", "Long",
            "double", "Double",
            "float", "Float",
            "boolean", "Boolean",
            "byte", "Byte",
            "char", "Character",
            "short", "Short");

    public static final TypeRef UNKNOWN = new TypeRef(null, null);

    /** The "no value" type produced by assignments and void calls. */
    public static final TypeRef VOID_VALUE = of("Void");

    public static final TypeRef OBJECT = of("Object");

    private final Type type;
    private final ResolvedType resolved;

    private TypeRef(Type type) {
        this(type, null);
    }

    private TypeRef(Type type, ResolvedType resolved) {
        this.type = type;
        this.resolved = resolved;
    }

    public static TypeRef of(Type type) {
        return type == null ? UNKNOWN : new TypeRef(type.clone());
    }

    /**
     * Source form of a solver type. Null, lambda and wildcard types, and the types of anonymous
     * classes, have no usable source form and come back as {@link #UNKNOWN}.
     */
    public static TypeRef of(ResolvedType resolved) {
        if (resolved.isVoid()) {
            return new TypeRef(new VoidType(), resolved);
        }
        if (!(resolved.isPrimitive() || resolved.isReferenceType() || resolved.isArray()
              || resolved.isTypeVariable())) {
            return UNKNOWN;
        }
        try {
            return new TypeRef(StaticJavaParser.parseType(resolved.describe()), resolved);
        } catch (ParseProblemException e) {
            return UNKNOWN;
        }
    }

    /**
     * A declared type, resolved when its compilation unit has a symbol solver attached. Types the
     * solver cannot place keep their source form only.
     */
    public static TypeRef resolving(Type type) {
        if (type.isVarType() || !TypeResolution.isAttached(type)) {
            return of(type);
        }
        try {
            return new TypeRef(type.clone(), type.resolve());
        } catch (RuntimeException e) {
            // unsolved or unsupported by the solver
            return of(type);
        }
    }

    public static TypeRef of(String source) {
        return new TypeRef(StaticJavaParser.parseType(source));
    }

    public static TypeRef listOf(TypeRef element) {
        ClassOrInterfaceType list = StaticJavaParser.parseClassOrInterfaceType("java.util.List");
        list.setTypeArguments(new NodeList<>(element.boxed().toTypeOr(TypeRef.OBJECT)));
        return new TypeRef(list);
    }

    public Optional<ResolvedType> resolved() {
        return Optional.ofNullable(resolved);
    }

    /** Name as written, without type arguments: {@code java.util.List} for {@code java.util.List<String>}. */
    String writtenName() {
        if (type != null && type.isClassOrInterfaceType()) {
            return type.asClassOrInterfaceType().getNameWithScope();
        }
        return erasure();
    }

    public boolean isUnknown() {
        return type == null;
    }

    public boolean isKnown() {
        return type != null;
    }

    /** True for the primitive {@code void} of a call that yields nothing. */
    public boolean isVoid() {
        return type != null && type.isVoidType();
    }

    public boolean isPrimitive() {
        return type != null && type.isPrimitiveType();
    }

    public boolean isArray() {
        return type != null && type.isArrayType();
    }

    public TypeRef componentType() {
        return isArray() ? new TypeRef(type.asArrayType().getComponentType().clone()) : UNKNOWN;
    }

    public TypeRef boxed() {
        if (!isPrimitive()) {
            return this;
        }
        return of(BOXES.get(type.asPrimitiveType().asString()));
    }

    /**
     * The erased, unqualified name: {@code List} for {@code java.util.List<String>},
     * {@code int[]} for an int array, {@code ?} for an unknown type.
     */
    public String erasure() {
        if (type == null) {
            return "?";
        }
        if (type.isArrayType()) {
            return componentType().erasure() + "[]";
        }
        if (type.isClassOrInterfaceType()) {
            return type.asClassOrInterfaceType().getNameAsString();
        }
        if (type.isWildcardType()) {
            return type.asWildcardType().getExtendedType().map(t -> of(t).erasure()).orElse("Object");
        }
        return type.asString();
    }

    public List<TypeRef> typeArguments() {
        if (type == null || !type.isClassOrInterfaceType()) {
            return List.of();
        }
        return type.asClassOrInterfaceType().getTypeArguments()
                .map(args -> args.stream().map(TypeRef::of).collect(Collectors.toList()))
                .orElse(List.of());
    }

    public boolean isWildcard() {
        return type != null && type.isWildcardType();
    }

    /** The upper bound of a wildcard, {@link #UNKNOWN} for an unbounded one. */
    public TypeRef wildcardBound() {
        if (!isWildcard()) {
            return this;
        }
        WildcardType wildcard = type.asWildcardType();
        return wildcard.getExtendedType().map(TypeRef::of).orElse(UNKNOWN);
    }

    public boolean isTypeVariable(Collection<String> typeVariables) {
        if (type == null || !type.isClassOrInterfaceType()) {
            return false;
        }
        ClassOrInterfaceType classType = type.asClassOrInterfaceType();
        return classType.getScope().isEmpty()
               && classType.getTypeArguments().isEmpty()
               && typeVariables.contains(classType.getNameAsString());
    }

    public boolean mentions(Collection<String> typeVariables) {
        if (type == null || typeVariables.isEmpty()) {
            return false;
        }
        if (isTypeVariable(typeVariables)) {
            return true;
        }
        if (isArray()) {
            return componentType().mentions(typeVariables);
        }
        if (isWildcard()) {
            return wildcardBound().mentions(typeVariables);
        }
        for (TypeRef argument : typeArguments()) {
            if (argument.mentions(typeVariables)) {
                return true;
            }
        }
        return false;
    }

    /**
     * Replaces bound type variables. A variable left unbound turns the whole type into
     * {@link #UNKNOWN} when it is the type itself, or erases the type arguments around it.
     */
    public TypeRef substitute(Map<String, TypeRef> bindings, Collection<String> typeVariables) {
        if (type == null || typeVariables.isEmpty()) {
            return this;
        }
        if (isTypeVariable(typeVariables)) {
            TypeRef bound = bindings.get(type.asClassOrInterfaceType().getNameAsString());
            return bound == null ? UNKNOWN : bound;
        }
        if (isArray()) {
            TypeRef component = componentType().substitute(bindings, typeVariables);
            return component.isUnknown() ? UNKNOWN : new TypeRef(new ArrayType(component.type.clone()));
        }
        if (!type.isClassOrInterfaceType() || typeArguments().isEmpty()) {
            return this;
        }
        ClassOrInterfaceType copy = type.asClassOrInterfaceType().clone();
        NodeList<Type> arguments = new NodeList<>();
        for (TypeRef argument : typeArguments()) {
            TypeRef replaced = argument.substitute(bindings, typeVariables);
            if (replaced.isUnknown()) {
                copy.removeTypeArguments();
                return new TypeRef(copy);
            }
            arguments.add(replaced.boxed().type.clone());
        }
        copy.setTypeArguments(arguments);
        return new TypeRef(copy);
    }

    /** Same type modulo package qualification. Unknown types are only equal to each other. */
    public boolean sameAs(TypeRef other) {
        return normalized().equals(other.normalized());
    }

    private String normalized() {
        if (type == null) {
            return "?";
        }
        if (type.isArrayType()) {
            return componentType().normalized() + "[]";
        }
        if (type.isWildcardType()) {
            WildcardType wildcard = type.asWildcardType();
            if (wildcard.getExtendedType().isPresent()) {
                return "? extends " + of(wildcard.getExtendedType().get()).normalized();
            }
            if (wildcard.getSuperType().isPresent()) {
                return "? super " + of(wildcard.getSuperType().get()).normalized();
            }
            return "?";
        }
        List<TypeRef> arguments = typeArguments();
        if (arguments.isEmpty()) {
            return erasure();
        }
        List<String> names = new ArrayList<>();
        for (TypeRef argument : arguments) {
            names.add(argument.normalized());
        }
        return erasure() + "<" + String.join(",", names) + ">";
    }

    public Type toType() {
        if (type == null) {
            throw new IllegalStateException("Unknown type has no source form");
        }
        return type.clone();
    }

    public Type toTypeOr(TypeRef fallback) {
        return isUnknown() ? fallback.toType() : toType();
    }

    public String asString() {
        return type == null ? "<unknown>" : type.asString();
    }

    public static String describe(List<TypeRef> types) {
        return types.stream().map(TypeRef::asString).collect(Collectors.joining(", ", "(", ")"));
    }

    static boolean isPrimitiveName(String name) {
        return BOXES.containsKey(name);
    }

    static String boxName(String name) {
        return BOXES.getOrDefault(name, name);
    }

    static PrimitiveType.Primitive primitiveKind(TypeRef ref) {
        return ref.isPrimitive() ? ref.type.asPrimitiveType().getType() : null;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        return sameAs((TypeRef) o);
    }

    @Override
    public int hashCode() {
        return Objects.hash(normalized());
    }

    @Override
    public String toString() {
        return asString();
    }
}
