package com.raditha.smells.refactoring;

import com.github.javaparser.ast.NodeList;
import com.github.javaparser.ast.body.Parameter;
import com.github.javaparser.ast.expr.Expression;
import com.github.javaparser.ast.expr.MethodCallExpr;
import com.github.javaparser.ast.expr.NameExpr;
import com.github.javaparser.ast.stmt.BlockStmt;
import com.github.javaparser.ast.stmt.ExpressionStmt;
import com.github.javaparser.ast.stmt.ReturnStmt;
import com.github.javaparser.ast.stmt.Statement;
import com.raditha.smells.model.DuplicateFunctionPair;
import com.raditha.smells.tree.FunctionDecl;
import com.raditha.smells.tree.SourceSerializer;
import com.raditha.smells.tree.SourceTree;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Turns every duplicate function into a delegate of its primary.
 * <p>
 * The duplicate keeps its name, signature and modifiers; its body becomes a single
 * call to the primary with its own parameters passed through by name.
 * <p>
 * Delegation needs the call to land on the primary, so both functions must take the same
 * parameter types and the duplicate must return the primary's type or nothing. An
 * instance primary is only callable from an instance duplicate of the same type. With
 * identical parameter types an overload of the primary's name never wins the call.
 * Pairs that fail these conditions, such as two overloads whose bodies read the same,
 * are left alone.
 */
public class FunctionDuplicateRefactorer {
    private static final Logger logger = LoggerFactory.getLogger(FunctionDuplicateRefactorer.class);

    private final SourceSerializer serializer;

    public FunctionDuplicateRefactorer() {
        this(new SourceSerializer());
    }

    public FunctionDuplicateRefactorer(SourceSerializer serializer) {
        this.serializer = serializer;
    }

    /**
     * Rewrite a copy of the tree.
     *
     * @throws RewriteException if a function of a pair is not in the tree
     * @throws com.raditha.smells.tree.SerializationException if the result cannot be printed as valid Java
     */
    public Result refactor(SourceTree tree, List<DuplicateFunctionPair> pairs) {
        SourceTree work = tree.mutableCopy();
        List<DuplicateFunctionPair> replaced = new ArrayList<>();
        List<DuplicateFunctionPair> skipped = new ArrayList<>();

        for (DuplicateFunctionPair pair : pairs) {
            FunctionDecl primary = work.findFunction(pair.primaryIndex(), pair.primary())
                    .orElseThrow(() -> RewriteException.missingFunction(pair.primary()));
            FunctionDecl duplicate = work.findFunction(pair.duplicateIndex(), pair.duplicate())
                    .orElseThrow(() -> RewriteException.missingFunction(pair.duplicate()));
            if (!duplicate.hasBody()) {
                throw new RewriteException("Function has no body to replace: " + duplicate.name(), duplicate.name());
            }

            String reason = whyNotDelegable(primary, duplicate);
            if (reason != null) {
                logger.warn("Leaving {} as is: {}", signature(duplicate), reason);
                skipped.add(pair);
                continue;
            }

            duplicate.method().setBody(new BlockStmt(new NodeList<>(delegateTo(primary, duplicate))));
            logger.info("Replaced body of {} with a call to {}", signature(duplicate), signature(primary));
            replaced.add(pair);
        }

        return new Result(serializer.reparse(work), replaced, skipped);
    }

    /**
     * @return why the duplicate cannot call the primary, null when it can
     */
    static String whyNotDelegable(FunctionDecl primary, FunctionDecl duplicate) {
        if (!parameterTypes(primary).equals(parameterTypes(duplicate))) {
            return "parameter types differ from " + signature(primary);
        }
        if (!duplicate.method().getType().isVoidType()
                && !duplicate.method().getType().asString().equals(primary.method().getType().asString())) {
            return "return type differs from " + signature(primary);
        }
        boolean sameType = primary.declaringType() == duplicate.declaringType();
        if (!primary.isStatic() && (!sameType || duplicate.isStatic())) {
            return signature(primary) + " is an instance method it cannot call";
        }
        return null;
    }

    private static Statement delegateTo(FunctionDecl primary, FunctionDecl duplicate) {
        NodeList<Expression> arguments = new NodeList<>();
        duplicate.parameters().forEach(name -> arguments.add(new NameExpr(name)));

        MethodCallExpr call = new MethodCallExpr(callScope(primary, duplicate), primary.name(), arguments);
        if (duplicate.method().getType().isVoidType()) {
            return new ExpressionStmt(call);
        }
        return new ReturnStmt(call);
    }

    /**
     * A static primary in another top-level type has to be called through that type.
     */
    private static Expression callScope(FunctionDecl primary, FunctionDecl caller) {
        if (primary.isStatic() && primary.declaringType() != caller.declaringType()) {
            return new NameExpr(primary.declaringTypeName());
        }
        return null;
    }

    private static List<String> parameterTypes(FunctionDecl function) {
        return function.method().getParameters().stream()
                .map(FunctionDuplicateRefactorer::parameterType)
                .toList();
    }

    private static String parameterType(Parameter parameter) {
        return parameter.getType().asString() + (parameter.isVarArgs() ? "..." : "");
    }

    private static String signature(FunctionDecl function) {
        return function.declaringTypeName() + "." + function.name()
                + "(" + String.join(", ", parameterTypes(function)) + ")";
    }

    /**
     * Outcome of a function rewrite.
     *
     * @param tree     Rewritten tree, parsed from its printed form
     * @param replaced Pairs whose duplicate now delegates to the primary
     * @param skipped  Pairs left alone because the duplicate cannot reach the primary by a call
     */
    public record Result(SourceTree tree, List<DuplicateFunctionPair> replaced, List<DuplicateFunctionPair> skipped) {
    }
}
