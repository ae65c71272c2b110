package org.dynamis.builder.transform;

import java.util.List;

import com.github.javaparser.StaticJavaParser;
import com.github.javaparser.ast.Node;
import com.github.javaparser.ast.NodeList;
import com.github.javaparser.ast.expr.Expression;
import com.github.javaparser.ast.expr.MethodCallExpr;
import com.github.javaparser.ast.type.Type;
import org.dynamis.builder.MissingCapabilityException;
import org.dynamis.builder.TransformOptions;
import org.dynamis.builder.capability.BuilderCapabilities;
import org.dynamis.builder.capability.Capability;
import org.dynamis.builder.capability.Combinator;
import org.dynamis.builder.capability.CombinatorSignature;
import org.dynamis.builder.classify.StatementClassifier;
import org.dynamis.builder.parser.util.AstUtils;
import org.dynamis.builder.types.CombinatorCallResolver;
import org.dynamis.builder.types.ExpressionTyper;
import org.dynamis.builder.types.TypeRef;
import org.dynamis.builder.types.TypingScope;

/**
 * State shared by every block of one transform pass.
 */
public final class TransformContext {

    private final BuilderCapabilities capabilities;
    private final TransformOptions options;
    private final ExpressionTyper typer;
    private final CombinatorCallResolver callResolver;
    private final StatementClassifier classifier;
    private final NameGenerator names;
    private final Expression builderReference;

    public TransformContext(BuilderCapabilities capabilities, TransformOptions options, ExpressionTyper typer,
                            CombinatorCallResolver callResolver, StatementClassifier classifier, NameGenerator names) {
        this.capabilities = capabilities;
        this.options = options;
        this.typer = typer;
        this.callResolver = callResolver;
        this.classifier = classifier;
        this.names = names;
        this.builderReference = StaticJavaParser.parseExpression(capabilities.builderName());
    }

    public BuilderCapabilities capabilities() {
        return capabilities;
    }

    public TransformOptions options() {
        return options;
    }

    public StatementClassifier classifier() {
        return classifier;
    }

    public NameGenerator names() {
        return names;
    }

    public boolean has(Capability capability) {
        return capabilities.has(capability);
    }

    public void require(Capability capability, String construct, Node origin) {
        if (!capabilities.has(capability)) {
            throw new MissingCapabilityException(capabilities.builderName(), capability, construct,
                                                 AstUtils.describe(origin));
        }
    }

    public TypeRef typeOf(Expression expression, TypingScope scope) {
        return typer.typeOf(expression, scope);
    }

    /**
     * Result type of calling {@code combinator} on arguments of the given types. With type checking
     * off only the combinator's presence is checked and the result is unknown.
     */
    public TypeRef resolve(Combinator combinator, List<TypeRef> arguments, Node origin) {
        if (!options.typeCheck()) {
            require(combinator.capability(), "a call to " + combinator.methodName(), origin);
            return TypeRef.UNKNOWN;
        }
        return callResolver.resolve(capabilities, combinator, arguments, AstUtils.describe(origin));
    }

    public MethodCallExpr call(Combinator combinator, Expression... arguments) {
        return call(combinator, new NodeList<>(arguments));
    }

    public MethodCallExpr call(Combinator combinator, NodeList<Expression> arguments) {
        return new MethodCallExpr(builderReference.clone(), combinator.methodName(), arguments);
    }

    /**
     * Declared type of a local assigned before it is read. Falls back to the concrete parameter type
     * of the combinator that consumes the local, then the concrete return type of the one that
     * produces it, then {@code Object}.
     */
    public Type slotType(TypeRef resolved, Combinator consumer, Combinator producer) {
        if (resolved.isKnown() && !resolved.isVoid()) {
            return resolved.boxed().toType();
        }
        if (consumer != null) {
            TypeRef parameter = soleConcrete(consumer, true);
            if (parameter.isKnown()) {
                return parameter.toType();
            }
        }
        if (producer != null) {
            TypeRef returned = soleConcrete(producer, false);
            if (returned.isKnown()) {
                return returned.toType();
            }
        }
        return TypeRef.OBJECT.toType();
    }

    /** Element type for the list that collects loop iterations. */
    public TypeRef listElementType(TypeRef resolved) {
        if (resolved.isKnown() && !resolved.isVoid()) {
            return resolved.boxed();
        }
        TypeRef parameter = soleConcrete(Combinator.ARRAY, true);
        if (parameter.isKnown() && parameter.typeArguments().size() == 1) {
            TypeRef element = parameter.typeArguments().get(0).wildcardBound();
            if (element.isKnown()) {
                return element;
            }
        }
        return TypeRef.OBJECT;
    }

    private TypeRef soleConcrete(Combinator combinator, boolean parameter) {
        List<CombinatorSignature> overloads = capabilities.overloads(combinator);
        if (overloads.size() != 1) {
            return TypeRef.UNKNOWN;
        }
        CombinatorSignature signature = overloads.get(0);
        TypeRef type = parameter ? signature.parameterTypeAt(0) : signature.returnType();
        if (type.isUnknown() || type.isVoid() || type.mentions(signature.typeParameters())) {
            return TypeRef.UNKNOWN;
        }
        return type.boxed();
    }
}
