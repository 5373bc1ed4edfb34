package com.raditha.smells.detection;

import com.github.javaparser.ast.Node;
import com.github.javaparser.ast.body.VariableDeclarator;
import com.github.javaparser.ast.expr.AssignExpr;
import com.github.javaparser.ast.expr.BinaryExpr;
import com.github.javaparser.ast.expr.ConditionalExpr;
import com.github.javaparser.ast.expr.MethodCallExpr;
import com.github.javaparser.ast.expr.ObjectCreationExpr;
import com.github.javaparser.ast.stmt.BlockStmt;
import com.github.javaparser.ast.stmt.DoStmt;
import com.github.javaparser.ast.stmt.ForEachStmt;
import com.github.javaparser.ast.stmt.ForStmt;
import com.github.javaparser.ast.stmt.IfStmt;
import com.github.javaparser.ast.stmt.ReturnStmt;
import com.github.javaparser.ast.stmt.SwitchStmt;
import com.github.javaparser.ast.stmt.WhileStmt;
import com.raditha.smells.model.StructuralDuplicatePair;
import com.raditha.smells.similarity.LCSSimilarity;
import com.raditha.smells.tree.FunctionDecl;
import com.raditha.smells.tree.SourceTree;

import java.util.ArrayList;
import java.util.List;

/**
 * Reports pairs of functions that do the same kind of work, regardless of the names
 * and literals they use.
 * <p>
 * Each body is reduced to the breadth-first sequence of the operations it contains
 * (branches, loops, binary operations, calls, assignments, returns). Two sequences are
 * compared with {@link LCSSimilarity}. The result is informational; nothing is
 * rewritten from it.
 */
public class StructuralDuplicateDetector {

    public static final double DEFAULT_THRESHOLD = 0.80;

    private final double threshold;
    private final LCSSimilarity similarity = new LCSSimilarity();

    public StructuralDuplicateDetector() {
        this(DEFAULT_THRESHOLD);
    }

    public StructuralDuplicateDetector(double threshold) {
        if (threshold < 0.0 || threshold > 1.0) {
            throw new IllegalArgumentException("Structural threshold must be between 0.0 and 1.0");
        }
        this.threshold = threshold;
    }

    public List<StructuralDuplicatePair> detect(SourceTree tree) {
        List<FunctionDecl> functions = new ArrayList<>();
        List<List<String>> shapes = new ArrayList<>();
        for (FunctionDecl function : tree.functions()) {
            if (!function.hasBody()) {
                continue;
            }
            functions.add(function);
            shapes.add(shapeOf(function.method().getBody().orElseThrow()));
        }

        List<StructuralDuplicatePair> pairs = new ArrayList<>();
        for (int i = 0; i < functions.size(); i++) {
            for (int j = i + 1; j < functions.size(); j++) {
                double score = similarity.calculate(shapes.get(i), shapes.get(j));
                if (score > threshold) {
                    FunctionDecl first = functions.get(i);
                    FunctionDecl second = functions.get(j);
                    pairs.add(new StructuralDuplicatePair(first.name(), first.index(),
                            second.name(), second.index(), score));
                }
            }
        }
        return pairs;
    }

    /**
     * Operation labels of a body in breadth-first order.
     */
    static List<String> shapeOf(BlockStmt body) {
        List<String> labels = new ArrayList<>();
        body.walk(Node.TreeTraversal.BREADTHFIRST, node -> {
            String label = labelOf(node);
            if (label != null) {
                labels.add(label);
            }
        });
        return labels;
    }

    private static String labelOf(Node node) {
        if (node instanceof IfStmt || node instanceof SwitchStmt || node instanceof ConditionalExpr) {
            return "if";
        }
        if (node instanceof ForStmt || node instanceof ForEachStmt
                || node instanceof WhileStmt || node instanceof DoStmt) {
            return "loop";
        }
        if (node instanceof BinaryExpr) {
            return "binary";
        }
        if (node instanceof MethodCallExpr || node instanceof ObjectCreationExpr) {
            return "call";
        }
        if (node instanceof AssignExpr) {
            return "assign";
        }
        if (node instanceof VariableDeclarator variable && variable.getInitializer().isPresent()) {
            return "assign";
        }
        if (node instanceof ReturnStmt) {
            return "return";
        }
        return null;
    }
}
