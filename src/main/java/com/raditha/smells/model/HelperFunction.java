package com.raditha.smells.model;

import com.github.javaparser.ast.body.MethodDeclaration;

import java.util.List;

/**
 * A method synthesized from a duplicate block.
 *
 * @param name       Method name
 * @param parameters Parameter names, sorted
 * @param returnType Declared return type
 * @param method     The declaration that was added to the tree
 */
public record HelperFunction(
        String name,
        List<String> parameters,
        String returnType,
        MethodDeclaration method) {
}
