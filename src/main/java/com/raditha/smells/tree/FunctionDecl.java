package com.raditha.smells.tree;

import com.github.javaparser.ast.NodeList;
import com.github.javaparser.ast.body.MethodDeclaration;
import com.github.javaparser.ast.body.Parameter;
import com.github.javaparser.ast.body.TypeDeclaration;
import com.github.javaparser.ast.stmt.BlockStmt;
import com.github.javaparser.ast.stmt.Statement;

import java.util.List;

/**
 * A method declared directly in one of the top-level types of a compilation unit.
 * This is a live view: {@link #body()} reflects edits made to the underlying method.
 *
 * @param index         Position in the tree's declaration order
 * @param name          Method name
 * @param declaringType Top-level type that declares the method
 * @param method        The JavaParser declaration
 */
public record FunctionDecl(
        int index,
        String name,
        TypeDeclaration<?> declaringType,
        MethodDeclaration method) {

    /**
     * Parameter names in declaration order.
     */
    public List<String> parameters() {
        return method.getParameters().stream()
                .map(Parameter::getNameAsString)
                .toList();
    }

    public int parameterCount() {
        return method.getParameters().size();
    }

    public boolean hasBody() {
        return method.getBody().isPresent();
    }

    /**
     * Top-level statements of the body. Empty (and detached) when the method has no body.
     */
    public NodeList<Statement> body() {
        return method.getBody()
                .map(BlockStmt::getStatements)
                .orElseGet(NodeList::new);
    }

    public boolean isStatic() {
        return method.isStatic();
    }

    public String declaringTypeName() {
        return declaringType.getNameAsString();
    }
}
