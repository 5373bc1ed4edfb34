package com.raditha.smells.refactoring;

import com.github.javaparser.ast.Modifier;
import com.github.javaparser.ast.NodeList;
import com.github.javaparser.ast.body.MethodDeclaration;
import com.github.javaparser.ast.body.TypeDeclaration;
import com.github.javaparser.ast.expr.AssignExpr;
import com.github.javaparser.ast.expr.Expression;
import com.github.javaparser.ast.expr.MethodCallExpr;
import com.github.javaparser.ast.expr.NameExpr;
import com.github.javaparser.ast.expr.VariableDeclarationExpr;
import com.github.javaparser.ast.stmt.BlockStmt;
import com.github.javaparser.ast.stmt.ExpressionStmt;
import com.github.javaparser.ast.stmt.ReturnStmt;
import com.github.javaparser.ast.stmt.Statement;
import com.github.javaparser.ast.type.ReferenceType;
import com.github.javaparser.ast.type.Type;
import com.raditha.smells.analysis.FreeVariableAnalyzer;
import com.raditha.smells.analysis.ScopeAnalyzer;
import com.raditha.smells.model.BlockOccurrence;
import com.raditha.smells.model.DuplicateBlockGroup;
import com.raditha.smells.model.HelperFunction;
import com.raditha.smells.tree.FunctionDecl;
import com.raditha.smells.tree.SourceSerializer;
import com.raditha.smells.tree.SourceTree;
import com.raditha.smells.tree.StatementKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.SortedSet;

/**
 * Extracts each group of duplicate blocks into a new helper method and replaces every
 * occurrence with a call to it.
 * <p>
 * The helper is built from the group's representative (first) occurrence. Its
 * parameters are the block's free variables that resolve to a parameter, local or field
 * of the representative's function, in name order. It is added to the type declaring
 * the representative's function.
 * <p>
 * Block indices refer to the bodies as they were when the groups were detected. Edits
 * made earlier in the same session are accounted for; an occurrence that overlaps an
 * already replaced block is dropped.
 */
public class BlockDuplicateRefactorer {
    private static final Logger logger = LoggerFactory.getLogger(BlockDuplicateRefactorer.class);

    private final FreeVariableAnalyzer freeVariableAnalyzer = new FreeVariableAnalyzer();
    private final ScopeAnalyzer scopeAnalyzer = new ScopeAnalyzer();
    private final NamingOracle namingOracle;
    private final SourceSerializer serializer;

    public BlockDuplicateRefactorer(NamingOracle namingOracle) {
        this(namingOracle, new SourceSerializer());
    }

    public BlockDuplicateRefactorer(NamingOracle namingOracle, SourceSerializer serializer) {
        this.namingOracle = namingOracle;
        this.serializer = serializer;
    }

    /**
     * Rewrite a copy of the tree.
     *
     * @throws RewriteException if a function named by an occurrence is missing, or a
     *                          block does not fit in its function
     * @throws com.raditha.smells.tree.SerializationException if the result cannot be printed as valid Java
     */
    public Result refactor(SourceTree tree, List<DuplicateBlockGroup> groups) {
        SourceTree work = tree.mutableCopy();
        HelperNameGenerator nameGenerator = new HelperNameGenerator(namingOracle);
        EditLog edits = new EditLog();
        List<HelperFunction> helpers = new ArrayList<>();
        List<DuplicateBlockGroup> skipped = new ArrayList<>();

        for (DuplicateBlockGroup group : groups) {
            List<Located> located = locate(work, group, edits);
            if (located.size() < 2) {
                logger.warn("Skipping duplicate block group at {}[{}]: overlaps blocks already extracted",
                        group.representative().owningFunction(), group.representative().startIndex());
                skipped.add(group);
                continue;
            }
            helpers.add(extract(located, group.windowSize(), nameGenerator, edits));
        }

        return new Result(serializer.reparse(work), helpers, skipped);
    }

    private List<Located> locate(SourceTree work, DuplicateBlockGroup group, EditLog edits) {
        List<Located> located = new ArrayList<>();
        for (BlockOccurrence occurrence : group.occurrences()) {
            FunctionDecl owner = work.findFunction(occurrence.functionIndex(), occurrence.owningFunction())
                    .orElseThrow(() -> RewriteException.missingFunction(occurrence.owningFunction()));
            if (edits.overlaps(owner.index(), occurrence.startIndex(), group.windowSize())) {
                logger.debug("Dropping occurrence {}[{}]: already rewritten",
                        owner.name(), occurrence.startIndex());
                continue;
            }
            int index = edits.translate(owner.index(), occurrence.startIndex());
            if (index < 0 || index + group.windowSize() > owner.body().size()) {
                throw new RewriteException(String.format("Block %d..%d does not fit in the body of %s",
                        occurrence.startIndex(), occurrence.startIndex() + group.windowSize() - 1, owner.name()),
                        owner.name());
            }
            located.add(new Located(occurrence, owner));
        }
        return located;
    }

    private HelperFunction extract(List<Located> located, int windowSize,
            HelperNameGenerator nameGenerator, EditLog edits) {
        Located representative = located.get(0);
        FunctionDecl owner = representative.owner();
        int start = edits.translate(owner.index(), representative.occurrence().startIndex());
        List<Statement> statements = new ArrayList<>(owner.body().subList(start, start + windowSize));

        SortedSet<String> free = freeVariableAnalyzer.freeVariables(statements);
        List<ScopeAnalyzer.VariableInfo> parameters = free.stream()
                .map(name -> scopeAnalyzer.resolve(owner, name))
                .flatMap(Optional::stream)
                .toList();

        TypeDeclaration<?> targetType = owner.declaringType();
        String name = nameGenerator.generateName(SourceSerializer.render(statements), targetType);
        MethodDeclaration helper = createHelperMethod(name, statements, parameters, located, targetType);
        logger.info("Extracting {} from {} occurrences (parameters: {})", name, located.size(), free);

        List<String> parameterNames = parameters.stream().map(ScopeAnalyzer.VariableInfo::name).toList();
        boolean returnsValue = !helper.getType().isVoidType();
        for (Located occurrence : located) {
            replaceWithCall(occurrence, windowSize, helper, targetType, parameterNames, returnsValue, edits);
        }

        targetType.addMember(helper);
        return new HelperFunction(name, parameterNames, helper.getTypeAsString(), helper);
    }

    /**
     * Create the helper method from the representative block.
     */
    private MethodDeclaration createHelperMethod(String name, List<Statement> statements,
            List<ScopeAnalyzer.VariableInfo> parameters, List<Located> located, TypeDeclaration<?> targetType) {
        MethodDeclaration method = new MethodDeclaration();
        method.setName(name);

        boolean allStatic = located.stream().allMatch(l -> l.owner().isStatic());
        boolean sameType = located.stream().allMatch(l -> l.owner().declaringType() == targetType);
        List<Modifier.Keyword> modifiers = new ArrayList<>();
        if (sameType) {
            modifiers.add(Modifier.Keyword.PRIVATE);
        }
        if (allStatic) {
            modifiers.add(Modifier.Keyword.STATIC);
        }
        method.setModifiers(modifiers.toArray(new Modifier.Keyword[0]));

        for (ScopeAnalyzer.VariableInfo param : parameters) {
            method.addParameter(param.type(), param.name());
        }

        FunctionDecl owner = located.get(0).owner();
        for (ReferenceType exception : owner.method().getThrownExceptions()) {
            method.addThrownException(exception.clone());
        }

        BlockStmt body = new BlockStmt();
        statements.forEach(stmt -> body.addStatement(stmt.clone()));

        Statement first = statements.get(0);
        Statement last = statements.get(statements.size() - 1);
        if (last.isReturnStmt()) {
            method.setType(owner.method().getType().clone());
        } else {
            Optional<String> assigned = StatementKind.assignedName(first);
            if (assigned.isPresent()) {
                body.addStatement(new ReturnStmt(new NameExpr(assigned.get())));
                method.setType(assignedType(first, owner, assigned.get()));
            } else {
                body.addStatement(new ReturnStmt());
                method.setType("void");
            }
        }

        method.setBody(body);
        return method;
    }

    private String assignedType(Statement first, FunctionDecl owner, String name) {
        if (StatementKind.of(first) == StatementKind.DECLARATION) {
            Type type = first.asExpressionStmt().getExpression().asVariableDeclarationExpr().getVariable(0).getType();
            if (!type.isVarType()) {
                return type.asString();
            }
        }
        return scopeAnalyzer.typeOf(owner, name);
    }

    /**
     * Swap the block for a single call. A block ending in {@code return} becomes
     * {@code return helper(..)}; otherwise the first statement's assignment is kept when
     * the helper returns a value.
     */
    private void replaceWithCall(Located located, int windowSize, MethodDeclaration helper,
            TypeDeclaration<?> targetType, List<String> parameterNames, boolean returnsValue, EditLog edits) {
        FunctionDecl owner = located.owner();
        NodeList<Statement> body = owner.body();
        int index = edits.translate(owner.index(), located.occurrence().startIndex());

        NodeList<Expression> arguments = new NodeList<>();
        parameterNames.forEach(p -> arguments.add(new NameExpr(p)));
        Expression scope = helper.isStatic() && owner.declaringType() != targetType
                ? new NameExpr(targetType.getNameAsString())
                : null;
        MethodCallExpr call = new MethodCallExpr(scope, helper.getNameAsString(), arguments);

        Statement first = body.get(index);
        Statement last = body.get(index + windowSize - 1);
        Statement replacement = new ExpressionStmt(call);
        Optional<String> assigned = StatementKind.assignedName(first);
        if (last.isReturnStmt()) {
            if (returnsValue) {
                replacement = new ReturnStmt(call);
            }
        } else if (returnsValue && assigned.isPresent()) {
            if (StatementKind.of(first) == StatementKind.DECLARATION) {
                VariableDeclarationExpr declaration = first.asExpressionStmt().getExpression()
                        .asVariableDeclarationExpr().clone();
                declaration.getVariable(0).setInitializer(call);
                replacement = new ExpressionStmt(declaration);
            } else {
                replacement = new ExpressionStmt(
                        new AssignExpr(new NameExpr(assigned.get()), call, AssignExpr.Operator.ASSIGN));
            }
        }

        for (int i = 0; i < windowSize; i++) {
            body.remove(index);
        }
        body.add(index, replacement);
        edits.record(owner.index(), located.occurrence().startIndex(), windowSize);
    }

    /**
     * Outcome of a block rewrite.
     *
     * @param tree    Rewritten tree, parsed from its printed form
     * @param helpers Helpers added, in the order the groups were processed
     * @param skipped Groups left alone because their occurrences overlapped earlier edits
     */
    public record Result(SourceTree tree, List<HelperFunction> helpers, List<DuplicateBlockGroup> skipped) {
    }

    private record Located(BlockOccurrence occurrence, FunctionDecl owner) {
    }

    /**
     * Blocks replaced so far, per function declaration index, in original body indices.
     */
    static class EditLog {
        private final Map<Integer, List<int[]>> replaced = new HashMap<>();

        void record(int function, int originalStart, int length) {
            replaced.computeIfAbsent(function, k -> new ArrayList<>()).add(new int[]{originalStart, length});
        }

        boolean overlaps(int function, int originalStart, int length) {
            for (int[] edit : replaced.getOrDefault(function, List.of())) {
                if (originalStart < edit[0] + edit[1] && edit[0] < originalStart + length) {
                    return true;
                }
            }
            return false;
        }

        /**
         * Current index of a statement that was at {@code originalIndex} before any edit.
         * Each earlier replacement shrank the body by its length minus one.
         */
        int translate(int function, int originalIndex) {
            int index = originalIndex;
            for (int[] edit : replaced.getOrDefault(function, List.of())) {
                if (edit[0] < originalIndex) {
                    index -= edit[1] - 1;
                }
            }
            return index;
        }
    }
}
