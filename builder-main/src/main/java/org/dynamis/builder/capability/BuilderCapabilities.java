package org.dynamis.builder.capability;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Which combinators one builder type supplies, with every overload found for each. Immutable;
 * computed once per builder type by {@link CapabilityResolver} and shared between transforms.
 */
public final class BuilderCapabilities {

    private final String builderName;
    private final Map<Combinator, List<CombinatorSignature>> overloads;

    private BuilderCapabilities(String builderName, Map<Combinator, List<CombinatorSignature>> overloads) {
        this.builderName = builderName;
        EnumMap<Combinator, List<CombinatorSignature>> copy = new EnumMap<>(Combinator.class);
        overloads.forEach((combinator, signatures) -> {
            if (!signatures.isEmpty()) {
                copy.put(combinator, List.copyOf(signatures));
            }
        });
        this.overloads = Collections.unmodifiableMap(copy);
    }

    public static Builder builder(String builderName) {
        return new Builder(builderName);
    }

    /** The name generated combinator calls are qualified with. */
    public String builderName() {
        return builderName;
    }

    public boolean has(Capability capability) {
        for (Combinator combinator : capability.combinators()) {
            if (!overloads.containsKey(combinator)) {
                return false;
            }
        }
        return true;
    }

    public Set<Capability> present() {
        Set<Capability> present = EnumSet.noneOf(Capability.class);
        for (Capability capability : Capability.values()) {
            if (has(capability)) {
                present.add(capability);
            }
        }
        return present;
    }

    public List<CombinatorSignature> overloads(Combinator combinator) {
        return overloads.getOrDefault(combinator, List.of());
    }

    @Override
    public String toString() {
        return "BuilderCapabilities{" +
               "builderName='" + builderName + '\'' +
               ", present=" + present() +
               '}';
    }

    public static final class Builder {

        private final String builderName;
        private final Map<Combinator, List<CombinatorSignature>> overloads = new EnumMap<>(Combinator.class);

        private Builder(String builderName) {
            this.builderName = builderName;
        }

        public Builder with(Combinator combinator, CombinatorSignature signature) {
            if (!combinator.matchesShape(signature)) {
                throw new IllegalArgumentException("'" + signature.describe() + "' does not have the shape of "
                                                   + combinator.methodName());
            }
            overloads.computeIfAbsent(combinator, c -> new ArrayList<>()).add(signature);
            return this;
        }

        public BuilderCapabilities build() {
            return new BuilderCapabilities(builderName, overloads);
        }
    }
}
