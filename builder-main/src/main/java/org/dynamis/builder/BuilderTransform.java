package org.dynamis.builder;

import com.github.javaparser.ast.stmt.BlockStmt;
import org.dynamis.builder.capability.BuilderCapabilities;
import org.dynamis.builder.classify.StatementClassifier;
import org.dynamis.builder.transform.BlockKind;
import org.dynamis.builder.transform.BlockResult;
import org.dynamis.builder.transform.BlockTransformer;
import org.dynamis.builder.transform.NameGenerator;
import org.dynamis.builder.transform.ResultAssembler;
import org.dynamis.builder.transform.TransformContext;
import org.dynamis.builder.types.CombinatorCallResolver;
import org.dynamis.builder.types.ExpressionTyper;
import org.dynamis.builder.types.TypeResolution;
import org.dynamis.builder.types.TypeRef;
import org.dynamis.builder.types.TypingScope;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Rewrites the body of a builder function so that its statements are combined through the static
 * combinators of a builder type and the combined value is returned.
 * <p>
 * The input body is never modified. A body with an explicit {@code return} is left alone; a body
 * whose statements produce nothing comes back unchanged.
 */
public class BuilderTransform {

    private static final Logger LOG = LoggerFactory.getLogger(BuilderTransform.class);

    private final ExpressionTyper typer;
    private final CombinatorCallResolver callResolver;
    private final TransformOptions options;
    private final StatementClassifier classifier = new StatementClassifier();

    public BuilderTransform() {
        this(ExpressionTyper.UNTYPED, TypeResolution.jdk(), TransformOptions.defaults());
    }

    public BuilderTransform(ExpressionTyper typer, TypeResolution types, TransformOptions options) {
        this.typer = typer;
        this.callResolver = new CombinatorCallResolver(types);
        this.options = options;
    }

    public TransformOptions getOptions() {
        return options;
    }

    public TransformResult transform(BlockStmt body, BuilderCapabilities capabilities, boolean hasNonLocalReturn) {
        return transform(body, capabilities, hasNonLocalReturn, TypingScope.root());
    }

    /**
     * @param hasNonLocalReturn whether the body contains a {@code return} of its own, see
     *                          {@link org.dynamis.builder.classify.ReturnScanner}
     * @param scope             types of the locals visible to the body, typically the method parameters
     * @throws BuilderTransformException if the body cannot be expressed with the builder's combinators
     */
    public TransformResult transform(BlockStmt body, BuilderCapabilities capabilities, boolean hasNonLocalReturn,
                                     TypingScope scope) {
        if (hasNonLocalReturn) {
            LOG.debug("Body returns explicitly, builder {} not applied", capabilities.builderName());
            return new TransformResult(TransformResult.Status.SUPPRESSED, body.clone(), TypeRef.UNKNOWN);
        }
        TransformContext context = new TransformContext(capabilities, options, typer, callResolver, classifier,
                                                        NameGenerator.forBody(body, options.variablePrefix()));
        BlockResult lowered = new BlockTransformer(context).transform(body.getStatements(), BlockKind.BODY, scope, body);
        TransformResult result = new ResultAssembler(context).assemble(body, lowered);
        LOG.debug("Builder {}: body {} with result type {}", capabilities.builderName(), result.status(),
                  result.resultType());
        return result;
    }
}
