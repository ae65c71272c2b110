package org.dynamis.builder.transform;

import java.util.ArrayList;
import java.util.List;

import com.github.javaparser.ast.Node;
import com.github.javaparser.ast.NodeList;
import com.github.javaparser.ast.body.VariableDeclarator;
import com.github.javaparser.ast.expr.Expression;
import com.github.javaparser.ast.expr.NameExpr;
import com.github.javaparser.ast.expr.VariableDeclarationExpr;
import com.github.javaparser.ast.stmt.BlockStmt;
import com.github.javaparser.ast.stmt.ExpressionStmt;
import com.github.javaparser.ast.stmt.ForEachStmt;
import com.github.javaparser.ast.stmt.Statement;
import org.dynamis.builder.capability.Capability;
import org.dynamis.builder.capability.Combinator;
import org.dynamis.builder.classify.StatementKind;
import org.dynamis.builder.parser.util.AstUtils;
import org.dynamis.builder.types.TypeRef;
import org.dynamis.builder.types.TypingScope;

/**
 * Rewrites one block, statement by statement, into declarations of partial results followed by
 * the expression that combines them.
 * <p>
 * A block that always ends in a {@code throw}, or that produces no partial result, is returned
 * unchanged and contributes nothing to its parent.
 */
public final class BlockTransformer {

    private final TransformContext context;
    private final SelectionTransformer selections;

    public BlockTransformer(TransformContext context) {
        this.context = context;
        this.selections = new SelectionTransformer(context, this);
    }

    public BlockResult transform(List<Statement> statements, BlockKind kind, TypingScope parentScope, Node origin) {
        TypingScope scope = parentScope.child();
        NodeList<Statement> out = new NodeList<>();
        List<PartialResult> partials = new ArrayList<>();
        boolean completesNormally = true;

        for (Statement statement : statements) {
            StatementKind statementKind = context.classifier().classify(statement);
            switch (statementKind) {
                case DECLARATION -> {
                    declare(statement, scope);
                    out.add(statement.clone());
                }
                case THROW -> {
                    out.add(statement.clone());
                    completesNormally = false;
                }
                case DIAGNOSTIC -> out.add(statement.clone());
                case EXPRESSION -> expression(statement.asExpressionStmt(), scope, out, partials);
                case ASSIGNMENT -> noValue(statement, out, partials);
                case SELECTION -> completesNormally &= selections.transform(statement, scope, out, partials);
                case DO -> completesNormally &= nested(statement.asBlockStmt(), scope, out, partials);
                case FOR_IN -> loop(statement.asForEachStmt(), scope, out, partials);
                default -> throw context.classifier().illegal(statement);
            }
        }
        return finish(statements, kind, origin, out, partials, completesNormally);
    }

    private BlockResult finish(List<Statement> statements, BlockKind kind, Node origin, NodeList<Statement> out,
                               List<PartialResult> partials, boolean completesNormally) {
        if (!completesNormally || partials.isEmpty()) {
            NodeList<Statement> unchanged = new NodeList<>();
            statements.forEach(statement -> unchanged.add(statement.clone()));
            return BlockResult.ignored(unchanged, completesNormally);
        }
        if (kind == BlockKind.BRANCH && partials.size() == 1) {
            PartialResult only = partials.get(0);
            return BlockResult.combined(out, only.reference(), only.type());
        }
        Combinator combinator = kind.combinator();
        context.require(combinator.capability(), kind.construct(), origin);
        List<TypeRef> types = new ArrayList<>();
        NodeList<Expression> references = new NodeList<>();
        for (PartialResult partial : partials) {
            types.add(partial.type());
            references.add(partial.reference());
        }
        TypeRef type = context.resolve(combinator, types, origin);
        return BlockResult.combined(out, context.call(combinator, references), type);
    }

    private void declare(Statement statement, TypingScope scope) {
        if (!(statement instanceof ExpressionStmt expressionStmt)
            || !(expressionStmt.getExpression() instanceof VariableDeclarationExpr declaration)) {
            return;
        }
        for (VariableDeclarator variable : declaration.getVariables()) {
            TypeRef type = variable.getType().isVarType()
                    ? variable.getInitializer().map(init -> context.typeOf(init, scope)).orElse(TypeRef.UNKNOWN)
                    : TypeRef.of(variable.getType());
            scope.declare(variable.getNameAsString(), type);
        }
    }

    private void expression(ExpressionStmt statement, TypingScope scope, NodeList<Statement> out,
                            List<PartialResult> partials) {
        Expression expression = statement.getExpression();
        TypeRef type = context.typeOf(expression, scope);
        if (type.isVoid()) {
            noValue(statement, out, partials);
            return;
        }
        String name = context.names().next();
        if (context.has(Capability.EXPRESSION)) {
            TypeRef lifted = context.resolve(Combinator.EXPRESSION, List.of(type), statement);
            out.add(Lowering.declare(name, context.call(Combinator.EXPRESSION, expression.clone())));
            partials.add(new PartialResult(name, lifted));
        } else {
            out.add(Lowering.declare(name, expression.clone()));
            partials.add(new PartialResult(name, type));
        }
    }

    /** Statements run for their effect contribute the lifted {@code (Void) null}, when lifting is on. */
    private void noValue(Statement statement, NodeList<Statement> out, List<PartialResult> partials) {
        out.add(statement.clone());
        if (!context.options().liftAssignments()) {
            return;
        }
        String name = context.names().next();
        if (context.has(Capability.EXPRESSION)) {
            TypeRef lifted = context.resolve(Combinator.EXPRESSION, List.of(TypeRef.VOID_VALUE), statement);
            out.add(Lowering.declare(name, context.call(Combinator.EXPRESSION, Lowering.noValue())));
            partials.add(new PartialResult(name, lifted));
        } else {
            out.add(Lowering.declare(name, Lowering.noValue()));
            partials.add(new PartialResult(name, TypeRef.VOID_VALUE));
        }
    }

    private boolean nested(BlockStmt block, TypingScope scope, NodeList<Statement> out, List<PartialResult> partials) {
        BlockResult inner = transform(block.getStatements(), BlockKind.DO, scope, block);
        if (inner.isIgnored()) {
            out.add(block.clone());
            return inner.completesNormally();
        }
        String slot = context.names().next();
        out.add(Lowering.declareSlot(slot, context.slotType(inner.combinedType(), Combinator.BLOCK, Combinator.DO),
                                     false));
        out.add(new BlockStmt(inner.statementsThen(value -> Lowering.assign(slot, value))));
        partials.add(new PartialResult(slot, inner.combinedType()));
        return true;
    }

    private void loop(ForEachStmt loop, TypingScope scope, NodeList<Statement> out, List<PartialResult> partials) {
        TypingScope loopScope = scope.child();
        VariableDeclarator variable = loop.getVariableDeclarator();
        TypeRef variableType = variable.getType().isVarType()
                ? elementType(context.typeOf(loop.getIterable(), scope))
                : TypeRef.of(variable.getType());
        loopScope.declare(variable.getNameAsString(), variableType);

        BlockResult body = transform(AstUtils.statementsOf(loop.getBody()), BlockKind.LOOP, loopScope, loop);
        if (body.isIgnored()) {
            out.add(loop.clone());
            return;
        }
        TypeRef elements = body.combinedType().isKnown() ? TypeRef.listOf(body.combinedType()) : TypeRef.UNKNOWN;
        TypeRef arrayType = context.resolve(Combinator.ARRAY, List.of(elements), loop);

        String list = context.names().next();
        out.add(Lowering.declareList(list, context.listElementType(body.combinedType())));
        BlockStmt loopBody = new BlockStmt(body.statementsThen(value -> Lowering.append(list, value)));
        out.add(new ForEachStmt(loop.getVariable().clone(), loop.getIterable().clone(), loopBody));

        String name = context.names().next();
        out.add(Lowering.declare(name, context.call(Combinator.ARRAY, new NameExpr(list))));
        partials.add(new PartialResult(name, arrayType));
    }

    private static TypeRef elementType(TypeRef iterable) {
        if (iterable.isArray()) {
            return iterable.componentType();
        }
        List<TypeRef> arguments = iterable.typeArguments();
        return arguments.size() == 1 ? arguments.get(0).wildcardBound() : TypeRef.UNKNOWN;
    }
}
