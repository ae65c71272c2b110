package org.dynamis.builder.types;

import java.util.Collection;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import com.github.javaparser.ast.CompilationUnit;
import com.github.javaparser.ast.body.TypeDeclaration;
import com.github.javaparser.resolution.declarations.ResolvedReferenceTypeDeclaration;
import com.github.javaparser.symbolsolver.JavaSymbolSolver;
import com.github.javaparser.symbolsolver.resolution.typesolvers.CombinedTypeSolver;
import com.github.javaparser.symbolsolver.resolution.typesolvers.MemoryTypeSolver;
import com.github.javaparser.symbolsolver.resolution.typesolvers.ReflectionTypeSolver;

/**
 * Declarations of the source types taking part in one compilation, looked up by simple or
 * fully qualified name. Every unit gets a {@link JavaSymbolSolver} over the platform classes and
 * the indexed declarations, so expressions and declared types in these sources resolve against
 * each other.
 */
public final class SourceIndex {

    private final List<CompilationUnit> units;
    private final Map<String, TypeDeclaration<?>> byQualifiedName = new LinkedHashMap<>();
    private final Map<String, TypeDeclaration<?>> bySimpleName = new HashMap<>();
    private final TypeResolution resolution;

    private SourceIndex(Collection<CompilationUnit> units) {
        this.units = List.copyOf(units);
        MemoryTypeSolver declared = new MemoryTypeSolver();
        CombinedTypeSolver typeSolver = new CombinedTypeSolver(new ReflectionTypeSolver(), declared);
        JavaSymbolSolver symbolSolver = new JavaSymbolSolver(typeSolver);
        for (CompilationUnit unit : this.units) {
            symbolSolver.inject(unit);
        }
        for (CompilationUnit unit : this.units) {
            for (TypeDeclaration<?> type : unit.findAll(TypeDeclaration.class)) {
                String qualifiedName = type.getFullyQualifiedName().orElse(type.getNameAsString());
                byQualifiedName.put(qualifiedName, type);
                boolean firstOfName = bySimpleName.putIfAbsent(type.getNameAsString(), type) == null;
                if (type.isTopLevelType() || type.isNestedType()) {
                    ResolvedReferenceTypeDeclaration resolved = type.resolve();
                    declared.addDeclaration(qualifiedName, resolved);
                    if (firstOfName) {
                        declared.addDeclaration(type.getNameAsString(), resolved);
                    }
                }
            }
        }
        this.resolution = new TypeResolution(typeSolver);
    }

    public static SourceIndex of(Collection<CompilationUnit> units) {
        return new SourceIndex(units);
    }

    public static SourceIndex empty() {
        return new SourceIndex(List.of());
    }

    public List<CompilationUnit> units() {
        return units;
    }

    public TypeResolution resolution() {
        return resolution;
    }

    public Optional<TypeDeclaration<?>> find(String name) {
        TypeDeclaration<?> type = byQualifiedName.get(name);
        if (type == null) {
            int dot = name.lastIndexOf('.');
            type = bySimpleName.get(dot < 0 ? name : name.substring(dot + 1));
        }
        return Optional.ofNullable(type);
    }
}
