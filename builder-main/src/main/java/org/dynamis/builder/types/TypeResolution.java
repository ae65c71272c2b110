package org.dynamis.builder.types;

import java.util.List;
import java.util.Optional;

import com.github.javaparser.ast.Node;
import com.github.javaparser.resolution.TypeSolver;
import com.github.javaparser.resolution.UnsolvedSymbolException;
import com.github.javaparser.resolution.declarations.ResolvedReferenceTypeDeclaration;
import com.github.javaparser.resolution.types.ResolvedType;
import com.github.javaparser.symbolsolver.resolution.typesolvers.ReflectionTypeSolver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Subtype questions about {@link TypeRef}s, answered by a JavaParser {@link TypeSolver}.
 * Two solver types are compared with {@link ResolvedType#isAssignableBy}; named types are looked
 * up in the solver and compared by declaration. A name the solver does not know leaves the
 * question open, which counts as assignable: javac has the final word on such calls.
 */
public final class TypeResolution {

    private static final Logger LOG = LoggerFactory.getLogger(TypeResolution.class);

    private static final TypeResolution JDK = new TypeResolution(new ReflectionTypeSolver());

    private final TypeSolver typeSolver;

    public TypeResolution(TypeSolver typeSolver) {
        this.typeSolver = typeSolver;
    }

    /** Platform classes only. */
    public static TypeResolution jdk() {
        return JDK;
    }

    public TypeSolver typeSolver() {
        return typeSolver;
    }

    /** True when {@code node} belongs to a compilation unit with a symbol solver injected. */
    public static boolean isAttached(Node node) {
        return node.findCompilationUnit()
                .map(unit -> unit.containsData(Node.SYMBOL_RESOLVER_KEY))
                .orElse(false);
    }

    /** Whether a value of type {@code argument} may be passed where {@code parameter} is declared. */
    public boolean isAssignable(TypeRef parameter, TypeRef argument) {
        Optional<ResolvedType> expected = parameter.resolved();
        Optional<ResolvedType> actual = argument.resolved();
        if (expected.isPresent() && actual.isPresent()) {
            try {
                return expected.get().isAssignableBy(actual.get());
            } catch (UnsolvedSymbolException | UnsupportedOperationException e) {
                LOG.debug("Comparing {} and {} by declaration: {}", parameter, argument, e.getMessage());
            }
        }
        return isSubtype(argument, parameter);
    }

    /**
     * Subtyping of the erased types: {@code ArrayList<Header>} is a subtype of {@code List<C>}
     * here whatever {@code C} turns out to be.
     */
    public boolean isSubtype(TypeRef sub, TypeRef sup) {
        TypeRef boxedSub = sub.boxed();
        TypeRef boxedSup = sup.boxed();
        if ("Object".equals(boxedSup.erasure()) || boxedSub.erasure().equals(boxedSup.erasure())) {
            return true;
        }
        Optional<ResolvedReferenceTypeDeclaration> subDeclaration = declaration(boxedSub);
        Optional<ResolvedReferenceTypeDeclaration> supDeclaration = declaration(boxedSup);
        if (subDeclaration.isEmpty() || supDeclaration.isEmpty()) {
            LOG.debug("No declaration for {} or {}, leaving the check to javac", sub, sup);
            return true;
        }
        return supDeclaration.get().isAssignableBy(subDeclaration.get());
    }

    private Optional<ResolvedReferenceTypeDeclaration> declaration(TypeRef type) {
        if (type.isArray() || type.isUnknown()) {
            return Optional.empty();
        }
        Optional<ResolvedType> resolved = type.resolved();
        String name = resolved.isPresent() && resolved.get().isReferenceType()
                ? resolved.get().asReferenceType().getQualifiedName()
                : type.writtenName();
        for (String candidate : candidates(name)) {
            if (typeSolver.hasType(candidate)) {
                return Optional.of(typeSolver.solveType(candidate));
            }
        }
        return Optional.empty();
    }

    private static List<String> candidates(String name) {
        return name.indexOf('.') < 0 ? List.of(name, "java.lang." + name) : List.of(name);
    }
}
