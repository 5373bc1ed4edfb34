package com.raditha.smells.tree;

import com.github.javaparser.ast.body.VariableDeclarator;
import com.github.javaparser.ast.expr.AssignExpr;
import com.github.javaparser.ast.expr.Expression;
import com.github.javaparser.ast.expr.VariableDeclarationExpr;
import com.github.javaparser.ast.stmt.Statement;

import java.util.Optional;

/**
 * Closed classification of the statements the analyzers care about.
 * Anything not recognized is {@link #OTHER} and is passed through untouched.
 */
public enum StatementKind {
    DECLARATION,
    ASSIGNMENT,
    CALL,
    CONDITIONAL,
    LOOP,
    RETURN,
    BLOCK,
    TRY,
    OTHER;

    /**
     * Classify a statement.
     */
    public static StatementKind of(Statement stmt) {
        if (stmt.isExpressionStmt()) {
            Expression expr = stmt.asExpressionStmt().getExpression();
            if (expr.isVariableDeclarationExpr()) {
                return DECLARATION;
            }
            if (expr.isAssignExpr()) {
                return ASSIGNMENT;
            }
            if (expr.isMethodCallExpr() || expr.isObjectCreationExpr()) {
                return CALL;
            }
            return OTHER;
        }
        if (stmt.isIfStmt() || stmt.isSwitchStmt()) {
            return CONDITIONAL;
        }
        if (stmt.isForStmt() || stmt.isForEachStmt() || stmt.isWhileStmt() || stmt.isDoStmt()) {
            return LOOP;
        }
        if (stmt.isReturnStmt()) {
            return RETURN;
        }
        if (stmt.isBlockStmt()) {
            return BLOCK;
        }
        if (stmt.isTryStmt()) {
            return TRY;
        }
        return OTHER;
    }

    /**
     * A single-target assignment is either {@code x = expr;} with a plain name on the
     * left, or a declaration of exactly one initialized variable {@code T x = expr;}.
     */
    public static boolean isSingleTargetAssignment(Statement stmt) {
        return assignedName(stmt).isPresent();
    }

    /**
     * Name written by a single-target assignment.
     *
     * @return the assigned identifier, or empty when the statement is not a single-target assignment
     */
    public static Optional<String> assignedName(Statement stmt) {
        StatementKind kind = of(stmt);
        if (kind == ASSIGNMENT) {
            AssignExpr assign = stmt.asExpressionStmt().getExpression().asAssignExpr();
            if (assign.getOperator() == AssignExpr.Operator.ASSIGN && assign.getTarget().isNameExpr()) {
                return Optional.of(assign.getTarget().asNameExpr().getNameAsString());
            }
        } else if (kind == DECLARATION) {
            VariableDeclarationExpr declaration = stmt.asExpressionStmt().getExpression().asVariableDeclarationExpr();
            if (declaration.getVariables().size() == 1) {
                VariableDeclarator variable = declaration.getVariable(0);
                if (variable.getInitializer().isPresent()) {
                    return Optional.of(variable.getNameAsString());
                }
            }
        }
        return Optional.empty();
    }
}
