package org.dynamis.builder.types;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import org.dynamis.builder.CombinatorTypeMismatchException;
import org.dynamis.builder.MissingCapabilityException;
import org.dynamis.builder.UnresolvableOverloadException;
import org.dynamis.builder.capability.BuilderCapabilities;
import org.dynamis.builder.capability.Combinator;
import org.dynamis.builder.capability.CombinatorSignature;

/**
 * Resolves one combinator call against the overloads the builder declares, once every argument
 * already has its own fixed type. Argument types are never adjusted to fit a signature: a call
 * the declared overloads cannot accept fails.
 * <p>
 * Fixed-arity overloads are tried before varargs ones. A method type variable binds to exactly
 * one type per call, so {@code <C> X buildBlock(C... parts)} rejects parts of different types.
 */
public class CombinatorCallResolver {

    private final TypeResolution types;

    public CombinatorCallResolver(TypeResolution types) {
        this.types = types;
    }

    public TypeRef resolve(BuilderCapabilities capabilities, Combinator combinator, List<TypeRef> arguments,
                           String nodeDescription) {
        List<CombinatorSignature> overloads = capabilities.overloads(combinator);
        if (overloads.isEmpty()) {
            throw new MissingCapabilityException(capabilities.builderName(), combinator.capability(),
                                                 "a call to " + combinator.methodName(), nodeDescription);
        }
        List<CombinatorSignature> byArity = overloads.stream()
                .filter(signature -> signature.acceptsArity(arguments.size()))
                .collect(Collectors.toList());
        if (byArity.isEmpty()) {
            throw new UnresolvableOverloadException(capabilities.builderName(), combinator, arguments,
                                                    "no overload takes " + arguments.size() + " argument(s)",
                                                    nodeDescription);
        }

        List<Candidate> applicable = applicable(byArity, arguments, false);
        if (applicable.isEmpty()) {
            applicable = applicable(byArity, arguments, true);
        }
        if (applicable.isEmpty()) {
            String declared = byArity.stream().map(CombinatorSignature::describe).collect(Collectors.joining("; "));
            throw new CombinatorTypeMismatchException(combinator, arguments, "declared " + declared, nodeDescription);
        }

        int best = applicable.stream().mapToInt(Candidate::score).max().orElse(0);
        TypeRef result = null;
        for (Candidate candidate : applicable) {
            if (candidate.score() != best) {
                continue;
            }
            if (result == null) {
                result = candidate.resultType();
            } else if (!result.sameAs(candidate.resultType())) {
                throw new UnresolvableOverloadException(capabilities.builderName(), combinator, arguments,
                                                        "ambiguous between overloads returning " + result.asString()
                                                        + " and " + candidate.resultType().asString(),
                                                        nodeDescription);
            }
        }
        return result;
    }

    private List<Candidate> applicable(List<CombinatorSignature> signatures, List<TypeRef> arguments, boolean varArgs) {
        List<Candidate> candidates = new ArrayList<>();
        for (CombinatorSignature signature : signatures) {
            if (signature.varArgs() != varArgs) {
                continue;
            }
            Map<String, TypeRef> bindings = new HashMap<>();
            boolean accepted = true;
            int score = 0;
            for (int i = 0; i < arguments.size() && accepted; i++) {
                TypeRef parameter = signature.parameterTypeAt(i);
                TypeRef argument = arguments.get(i);
                accepted = unify(parameter, argument, signature.typeParameters(), bindings);
                if (exact(parameter, argument, signature.typeParameters())) {
                    score++;
                }
            }
            if (accepted) {
                TypeRef resultType = signature.returnType().substitute(bindings, signature.typeParameters());
                candidates.add(new Candidate(signature, resultType, score));
            }
        }
        return candidates;
    }

    boolean unify(TypeRef parameter, TypeRef argument, List<String> typeVariables, Map<String, TypeRef> bindings) {
        if (argument.isUnknown() || parameter.isUnknown()) {
            return true;
        }
        if (parameter.isTypeVariable(typeVariables)) {
            String variable = parameter.erasure();
            TypeRef value = argument.boxed();
            TypeRef bound = bindings.putIfAbsent(variable, value);
            return bound == null || bound.sameAs(value);
        }
        if (!parameter.mentions(typeVariables)) {
            return assignable(argument, parameter);
        }
        if (parameter.isArray()) {
            return argument.isArray()
                   && unify(parameter.componentType(), argument.componentType(), typeVariables, bindings);
        }
        if (!types.isSubtype(argument, parameter)) {
            return false;
        }
        List<TypeRef> parameterArguments = parameter.typeArguments();
        List<TypeRef> argumentArguments = argument.typeArguments();
        if (argumentArguments.isEmpty() || parameterArguments.size() != argumentArguments.size()) {
            return true;
        }
        for (int i = 0; i < parameterArguments.size(); i++) {
            TypeRef expected = parameterArguments.get(i);
            TypeRef actual = argumentArguments.get(i);
            if (expected.isWildcard()) {
                TypeRef bound = expected.wildcardBound();
                if (bound.isKnown() && !unify(bound, actual, typeVariables, bindings)) {
                    return false;
                }
            } else if (!unify(expected, actual, typeVariables, bindings)) {
                return false;
            }
        }
        return true;
    }

    boolean assignable(TypeRef argument, TypeRef parameter) {
        if (argument.isUnknown() || parameter.isUnknown()) {
            return true;
        }
        if (argument.isPrimitive() && parameter.isPrimitive()) {
            return argument.sameAs(parameter);
        }
        if ("Object".equals(parameter.boxed().erasure())) {
            return true;
        }
        if (argument.resolved().isPresent() && parameter.resolved().isPresent()) {
            return types.isAssignable(parameter, argument);
        }
        if (argument.isArray() || parameter.isArray()) {
            return argument.isArray() && parameter.isArray()
                   && assignable(argument.componentType(), parameter.componentType());
        }
        if (!types.isSubtype(argument, parameter)) {
            return false;
        }
        List<TypeRef> expected = parameter.typeArguments();
        List<TypeRef> actual = argument.typeArguments();
        boolean sameClass = argument.boxed().erasure().equals(parameter.boxed().erasure());
        if (!sameClass || expected.isEmpty() || actual.size() != expected.size()) {
            return true;
        }
        for (int i = 0; i < expected.size(); i++) {
            TypeRef want = expected.get(i);
            TypeRef have = actual.get(i);
            if (want.isWildcard()) {
                if (want.wildcardBound().isKnown() && !assignable(have, want.wildcardBound())) {
                    return false;
                }
            } else if (!want.sameAs(have)) {
                return false;
            }
        }
        return true;
    }

    private static boolean exact(TypeRef parameter, TypeRef argument, List<String> typeVariables) {
        return argument.isKnown()
               && !parameter.isTypeVariable(typeVariables)
               && parameter.boxed().erasure().equals(argument.boxed().erasure());
    }

    private record Candidate(CombinatorSignature signature, TypeRef resultType, int score) {
    }
}
