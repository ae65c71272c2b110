package org.dynamis.builder.capability;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

import com.github.javaparser.ast.body.MethodDeclaration;
import com.github.javaparser.ast.body.TypeDeclaration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Finds the combinators a builder type declares by structural lookup: a static method with the
 * combinator's name and parameter shape. Applicability to concrete argument types is not checked
 * here; that happens per call site in {@link org.dynamis.builder.types.CombinatorCallResolver}.
 * <p>
 * Results are cached by the builder's qualified name. The cache only ever holds immutable
 * {@link BuilderCapabilities}, so one resolver can serve concurrent transforms.
 */
public class CapabilityResolver {

    private static final Logger LOG = LoggerFactory.getLogger(CapabilityResolver.class);

    private final Map<String, BuilderCapabilities> cache = new ConcurrentHashMap<>();

    public BuilderCapabilities resolve(TypeDeclaration<?> builderType) {
        String name = builderType.getFullyQualifiedName().orElse(builderType.getNameAsString());
        BuilderCapabilities cached = cache.get(name);
        if (cached != null) {
            LOG.debug("Capability cache hit for {}", name);
            return cached;
        }
        return cache.computeIfAbsent(name, n -> scan(n, builderType));
    }

    public int cacheSize() {
        return cache.size();
    }

    public void clear() {
        cache.clear();
    }

    private static BuilderCapabilities scan(String name, TypeDeclaration<?> builderType) {
        BuilderCapabilities.Builder builder = BuilderCapabilities.builder(name);
        for (Combinator combinator : Combinator.values()) {
            for (MethodDeclaration method : builderType.getMethodsByName(combinator.methodName())) {
                if (!method.isStatic()) {
                    LOG.debug("Ignoring {}.{}: combinators must be static", name, method.getDeclarationAsString());
                    continue;
                }
                CombinatorSignature signature = CombinatorSignature.of(method);
                if (!combinator.matchesShape(signature)) {
                    LOG.debug("Ignoring {}.{}: not the shape of {}", name, signature.describe(), combinator.methodName());
                    continue;
                }
                builder.with(combinator, signature);
            }
        }
        BuilderCapabilities capabilities = builder.build();
        LOG.debug("Resolved {}", capabilities);
        return capabilities;
    }
}
