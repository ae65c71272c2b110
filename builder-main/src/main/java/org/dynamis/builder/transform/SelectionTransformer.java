package org.dynamis.builder.transform;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.function.Function;
import java.util.function.UnaryOperator;

import com.github.javaparser.ast.Node;
import com.github.javaparser.ast.NodeList;
import com.github.javaparser.ast.expr.Expression;
import com.github.javaparser.ast.expr.MethodCallExpr;
import com.github.javaparser.ast.expr.NameExpr;
import com.github.javaparser.ast.expr.SimpleName;
import com.github.javaparser.ast.stmt.BlockStmt;
import com.github.javaparser.ast.stmt.BreakStmt;
import com.github.javaparser.ast.stmt.IfStmt;
import com.github.javaparser.ast.stmt.Statement;
import com.github.javaparser.ast.stmt.SwitchEntry;
import com.github.javaparser.ast.stmt.SwitchStmt;
import com.github.javaparser.ast.stmt.ThrowStmt;
import org.dynamis.builder.CombinatorTypeMismatchException;
import org.dynamis.builder.IllegalStatementException;
import org.dynamis.builder.capability.Capability;
import org.dynamis.builder.capability.Combinator;
import org.dynamis.builder.parser.util.AstUtils;
import org.dynamis.builder.types.TypeRef;
import org.dynamis.builder.types.TypingScope;

/**
 * Lowers {@code if} chains and {@code switch} statements. Every result-producing branch assigns a
 * slot declared ahead of the statement; the slot is then read as one or more partial results.
 * <p>
 * With {@code buildEitherFirst}/{@code buildEitherSecond} all branches share one slot and are
 * injected through a balanced {@link InjectionTree}. Without them every producing branch gets its
 * own slot, passed through {@code buildOptional} unless that branch always runs.
 */
final class SelectionTransformer {

    private final TransformContext context;
    private final BlockTransformer blocks;

    SelectionTransformer(TransformContext context, BlockTransformer blocks) {
        this.context = context;
        this.blocks = blocks;
    }

    /**
     * @return false when every path through the statement ends in a {@code throw}
     */
    boolean transform(Statement statement, TypingScope scope, NodeList<Statement> out, List<PartialResult> partials) {
        if (statement instanceof IfStmt ifStmt) {
            return transformIf(ifStmt, scope, out, partials);
        }
        return transformSwitch((SwitchStmt) statement, scope, out, partials);
    }

    private boolean transformIf(IfStmt root, TypingScope scope, NodeList<Statement> out, List<PartialResult> partials) {
        List<Expression> conditions = new ArrayList<>();
        List<Branch> branches = new ArrayList<>();
        IfStmt current = root;
        Statement otherwise = null;
        while (current != null) {
            conditions.add(current.getCondition());
            branches.add(branch(AstUtils.statementsOf(current.getThenStmt()), scope, current.getThenStmt(),
                                isAvailabilityCheck(current.getCondition())));
            Optional<Statement> elseStmt = current.getElseStmt();
            current = null;
            if (elseStmt.isPresent()) {
                if (elseStmt.get() instanceof IfStmt elseIf) {
                    current = elseIf;
                } else {
                    otherwise = elseStmt.get();
                    branches.add(branch(AstUtils.statementsOf(otherwise), scope, otherwise, false));
                }
            }
        }

        boolean exhaustive = otherwise != null;
        Function<List<NodeList<Statement>>, Statement> rebuild = bodies -> {
            Statement tail = exhaustive ? new BlockStmt(bodies.get(conditions.size())) : null;
            for (int i = conditions.size() - 1; i >= 0; i--) {
                tail = new IfStmt(conditions.get(i).clone(), new BlockStmt(bodies.get(i)), tail);
            }
            return tail;
        };
        return lower(root, branches, exhaustive, rebuild, out, partials);
    }

    private boolean transformSwitch(SwitchStmt switchStmt, TypingScope scope, NodeList<Statement> out,
                                    List<PartialResult> partials) {
        NodeList<SwitchEntry> entries = switchStmt.getEntries();
        List<Branch> branches = new ArrayList<>();
        // per entry: index into branches, or -1 for a label-only entry that falls into the next one
        List<Integer> branchOfEntry = new ArrayList<>();
        List<Boolean> breakOfEntry = new ArrayList<>();
        boolean exhaustive = false;

        for (int i = 0; i < entries.size(); i++) {
            SwitchEntry entry = entries.get(i);
            boolean last = i == entries.size() - 1;
            if (entry.isDefault() || entry.getLabels().isEmpty()) {
                exhaustive = true;
            }
            List<Statement> body = new ArrayList<>(entryStatements(entry));
            boolean trailingBreak = false;
            if (entry.getType() == SwitchEntry.Type.STATEMENT_GROUP) {
                if (body.isEmpty() && !last) {
                    branchOfEntry.add(-1);
                    breakOfEntry.add(false);
                    continue;
                }
                if (!body.isEmpty() && isPlainBreak(body.get(body.size() - 1))) {
                    body.remove(body.size() - 1);
                    trailingBreak = true;
                } else if (!last && !(body.get(body.size() - 1) instanceof ThrowStmt)) {
                    throw new IllegalStatementException("fall-through between switch cases", AstUtils.describe(entry));
                }
            }
            branchOfEntry.add(branches.size());
            breakOfEntry.add(trailingBreak);
            branches.add(branch(body, scope, entry, false));
        }

        Function<List<NodeList<Statement>>, Statement> rebuild = bodies -> {
            NodeList<SwitchEntry> rebuilt = new NodeList<>();
            for (int i = 0; i < entries.size(); i++) {
                SwitchEntry entry = entries.get(i);
                int branch = branchOfEntry.get(i);
                if (branch < 0) {
                    rebuilt.add(entry.clone());
                    continue;
                }
                NodeList<Expression> labels = new NodeList<>();
                entry.getLabels().forEach(label -> labels.add(label.clone()));
                Expression guard = entry.getGuard().map(Expression::clone).orElse(null);
                NodeList<Statement> statements = bodies.get(branch);
                if (entry.getType() == SwitchEntry.Type.STATEMENT_GROUP) {
                    if (breakOfEntry.get(i)) {
                        statements.add(new BreakStmt((SimpleName) null));
                    }
                    rebuilt.add(new SwitchEntry(labels, SwitchEntry.Type.STATEMENT_GROUP, statements,
                                                entry.isDefault(), guard));
                } else {
                    rebuilt.add(new SwitchEntry(labels, SwitchEntry.Type.BLOCK, new NodeList<>(new BlockStmt(statements)),
                                                entry.isDefault(), guard));
                }
            }
            return new SwitchStmt(switchStmt.getSelector().clone(), rebuilt);
        };
        return lower(switchStmt, branches, exhaustive, rebuild, out, partials);
    }

    private static List<Statement> entryStatements(SwitchEntry entry) {
        NodeList<Statement> statements = entry.getStatements();
        if (entry.getType() == SwitchEntry.Type.BLOCK && statements.size() == 1 && statements.get(0).isBlockStmt()) {
            return statements.get(0).asBlockStmt().getStatements();
        }
        return statements;
    }

    private static boolean isPlainBreak(Statement statement) {
        return statement instanceof BreakStmt breakStmt && breakStmt.getLabel().isEmpty();
    }

    private boolean isAvailabilityCheck(Expression condition) {
        return condition instanceof MethodCallExpr call
               && call.getNameAsString().equals(context.options().availabilityMethod());
    }

    private Branch branch(List<Statement> statements, TypingScope scope, Node origin, boolean limitedAvailability) {
        BlockResult result = blocks.transform(statements, BlockKind.BRANCH, scope, origin);
        Branch branch = new Branch(result, origin);
        if (!result.isIgnored()) {
            branch.type = result.combinedType();
            if (limitedAvailability && context.has(Capability.LIMITED_AVAILABILITY)) {
                branch.type = context.resolve(Combinator.LIMITED_AVAILABILITY, List.of(branch.type), origin);
                branch.wrap = value -> context.call(Combinator.LIMITED_AVAILABILITY, value);
            }
        }
        return branch;
    }

    private boolean lower(Statement origin, List<Branch> branches, boolean exhaustive,
                          Function<List<NodeList<Statement>>, Statement> rebuild,
                          NodeList<Statement> out, List<PartialResult> partials) {
        List<Branch> producing = new ArrayList<>();
        boolean anyCompletes = false;
        for (Branch branch : branches) {
            if (!branch.result.isIgnored()) {
                producing.add(branch);
            }
            anyCompletes |= branch.result.completesNormally();
        }
        boolean completesNormally = !exhaustive || anyCompletes;
        if (producing.isEmpty()) {
            out.add(origin.clone());
            return completesNormally;
        }

        boolean skippable = !exhaustive || producing.size() < branches.size();
        if (context.has(Capability.EITHER)) {
            lowerWithEither(origin, branches, producing, skippable, rebuild, out, partials);
        } else {
            lowerWithOptionals(origin, branches, producing, skippable, rebuild, out, partials);
        }
        return completesNormally;
    }

    private void lowerWithEither(Statement origin, List<Branch> branches, List<Branch> producing, boolean skippable,
                                 Function<List<NodeList<Statement>>, Statement> rebuild,
                                 NodeList<Statement> out, List<PartialResult> partials) {
        if (skippable) {
            context.require(Capability.OPTIONAL, "a conditional whose result-producing branches may not run", origin);
        }
        InjectionTree tree = InjectionTree.balanced(producing.size());
        List<TypeRef> injectedTypes = new ArrayList<>();
        for (int leaf = 0; leaf < producing.size(); leaf++) {
            Branch branch = producing.get(leaf);
            branch.type = tree.inject(leaf, branch.type,
                                      type -> context.resolve(Combinator.EITHER_FIRST, List.of(type), branch.origin),
                                      type -> context.resolve(Combinator.EITHER_SECOND, List.of(type), branch.origin));
            UnaryOperator<Expression> own = branch.wrap;
            int index = leaf;
            branch.wrap = value -> tree.inject(index, own.apply(value),
                                               inner -> context.call(Combinator.EITHER_FIRST, inner),
                                               inner -> context.call(Combinator.EITHER_SECOND, inner));
            injectedTypes.add(branch.type);
        }
        TypeRef common = unify(injectedTypes, origin);

        String slot = context.names().next();
        out.add(Lowering.declareSlot(slot,
                                     context.slotType(common, skippable ? Combinator.OPTIONAL : Combinator.BLOCK,
                                                      Combinator.EITHER_FIRST),
                                     skippable));
        List<NodeList<Statement>> bodies = new ArrayList<>();
        for (Branch branch : branches) {
            bodies.add(branch.result.isIgnored()
                       ? branch.result.statements()
                       : branch.result.statementsThen(value -> Lowering.assign(slot, branch.wrap.apply(value))));
        }
        out.add(rebuild.apply(bodies));
        partials.add(skippable ? optional(slot, common, origin, out) : new PartialResult(slot, common));
    }

    private void lowerWithOptionals(Statement origin, List<Branch> branches, List<Branch> producing, boolean skippable,
                                    Function<List<NodeList<Statement>>, Statement> rebuild,
                                    NodeList<Statement> out, List<PartialResult> partials) {
        boolean optional = skippable || producing.size() > 1;
        if (optional) {
            context.require(Capability.OPTIONAL, "a conditional whose result-producing branches may not run", origin);
        }
        for (Branch branch : producing) {
            branch.slot = context.names().next();
            out.add(Lowering.declareSlot(branch.slot,
                                         context.slotType(branch.type, optional ? Combinator.OPTIONAL : Combinator.BLOCK,
                                                          null),
                                         optional));
        }
        List<NodeList<Statement>> bodies = new ArrayList<>();
        for (Branch branch : branches) {
            bodies.add(branch.result.isIgnored()
                       ? branch.result.statements()
                       : branch.result.statementsThen(value -> Lowering.assign(branch.slot, branch.wrap.apply(value))));
        }
        out.add(rebuild.apply(bodies));
        for (Branch branch : producing) {
            partials.add(optional
                         ? optional(branch.slot, branch.type, origin, out)
                         : new PartialResult(branch.slot, branch.type));
        }
    }

    private PartialResult optional(String slot, TypeRef type, Node origin, NodeList<Statement> out) {
        TypeRef result = context.resolve(Combinator.OPTIONAL, List.of(type), origin);
        String name = context.names().next();
        out.add(Lowering.declare(name, context.call(Combinator.OPTIONAL, new NameExpr(slot))));
        return new PartialResult(name, result);
    }

    private static TypeRef unify(List<TypeRef> types, Node origin) {
        TypeRef common = TypeRef.UNKNOWN;
        for (TypeRef type : types) {
            if (type.isUnknown()) {
                continue;
            }
            if (common.isUnknown()) {
                common = type;
            } else if (!common.sameAs(type)) {
                throw new CombinatorTypeMismatchException(Combinator.EITHER_FIRST, types,
                                                          "branches produce incompatible types",
                                                          AstUtils.describe(origin));
            }
        }
        return common;
    }

    private static final class Branch {

        final BlockResult result;
        final Node origin;
        TypeRef type = TypeRef.UNKNOWN;
        UnaryOperator<Expression> wrap = UnaryOperator.identity();
        String slot;

        Branch(BlockResult result, Node origin) {
            this.result = result;
            this.origin = origin;
        }
    }
}
