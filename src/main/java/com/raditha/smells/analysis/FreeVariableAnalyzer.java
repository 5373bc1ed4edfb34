package com.raditha.smells.analysis;

import com.github.javaparser.ast.Node;
import com.github.javaparser.ast.body.Parameter;
import com.github.javaparser.ast.body.VariableDeclarator;
import com.github.javaparser.ast.expr.AssignExpr;
import com.github.javaparser.ast.expr.NameExpr;
import com.github.javaparser.ast.expr.TypePatternExpr;
import com.github.javaparser.ast.expr.UnaryExpr;
import com.github.javaparser.ast.stmt.Statement;

import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Determines which identifiers a block of statements needs from its surroundings.
 * <p>
 * An identifier is free when it is read somewhere in the block and written nowhere
 * in it. The analysis ignores statement order: a name written anywhere in the block is
 * never free, even if it is read before the write.
 */
public class FreeVariableAnalyzer {

    /**
     * @return free identifiers, sorted by name
     */
    public SortedSet<String> freeVariables(List<Statement> statements) {
        SortedSet<String> read = new TreeSet<>();
        for (Statement stmt : statements) {
            stmt.findAll(NameExpr.class).stream()
                    .filter(name -> !isWriteTarget(name))
                    .forEach(name -> read.add(name.getNameAsString()));
        }

        read.removeAll(writtenVariables(statements));
        return Collections.unmodifiableSortedSet(read);
    }

    /**
     * Names written in the block: assignment targets, increments, declarations and the
     * names bound by lambdas, catch clauses and patterns.
     */
    public Set<String> writtenVariables(List<Statement> statements) {
        Set<String> written = new HashSet<>();
        for (Statement stmt : statements) {
            stmt.findAll(NameExpr.class).stream()
                    .filter(FreeVariableAnalyzer::isWriteTarget)
                    .forEach(name -> written.add(name.getNameAsString()));
            stmt.findAll(VariableDeclarator.class).forEach(v -> written.add(v.getNameAsString()));
            stmt.findAll(Parameter.class).forEach(p -> written.add(p.getNameAsString()));
            stmt.findAll(TypePatternExpr.class).forEach(p -> written.add(p.getNameAsString()));
        }
        return written;
    }

    static boolean isWriteTarget(NameExpr name) {
        Optional<Node> parent = name.getParentNode();
        if (parent.isEmpty()) {
            return false;
        }
        if (parent.get() instanceof AssignExpr assign) {
            return assign.getTarget() == name;
        }
        if (parent.get() instanceof UnaryExpr unary) {
            UnaryExpr.Operator op = unary.getOperator();
            return op == UnaryExpr.Operator.PREFIX_INCREMENT
                    || op == UnaryExpr.Operator.PREFIX_DECREMENT
                    || op == UnaryExpr.Operator.POSTFIX_INCREMENT
                    || op == UnaryExpr.Operator.POSTFIX_DECREMENT;
        }
        return false;
    }
}
