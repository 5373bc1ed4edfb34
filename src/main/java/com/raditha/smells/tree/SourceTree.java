package com.raditha.smells.tree;

import com.github.javaparser.ast.CompilationUnit;
import com.github.javaparser.ast.body.BodyDeclaration;
import com.github.javaparser.ast.body.MethodDeclaration;
import com.github.javaparser.ast.body.TypeDeclaration;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * A parsed source file: the compilation unit, the text it came from and the ordered
 * index of its top-level functions.
 * <p>
 * Functions are addressed by their position in declaration order, which tells
 * overloads apart. The lookup by name is a convenience that returns the first
 * declaration of an overloaded name.
 */
public final class SourceTree {

    private final CompilationUnit compilationUnit;
    private final String source;
    private final List<FunctionDecl> functions;

    SourceTree(CompilationUnit compilationUnit, String source) {
        this.compilationUnit = compilationUnit;
        this.source = source;
        this.functions = Collections.unmodifiableList(indexFunctions(compilationUnit));
    }

    /**
     * Wrap a compilation unit that was built or edited in memory.
     * Such a tree has no source text, so position-based analysis is unavailable.
     */
    public static SourceTree of(CompilationUnit compilationUnit) {
        return new SourceTree(compilationUnit, null);
    }

    private static List<FunctionDecl> indexFunctions(CompilationUnit cu) {
        List<FunctionDecl> result = new ArrayList<>();
        for (TypeDeclaration<?> type : cu.getTypes()) {
            for (BodyDeclaration<?> member : type.getMembers()) {
                if (member.isMethodDeclaration()) {
                    MethodDeclaration method = member.asMethodDeclaration();
                    result.add(new FunctionDecl(result.size(), method.getNameAsString(), type, method));
                }
            }
        }
        return result;
    }

    public CompilationUnit compilationUnit() {
        return compilationUnit;
    }

    /**
     * @return the text this tree was parsed from, empty for in-memory trees
     */
    public Optional<String> source() {
        return Optional.ofNullable(source);
    }

    /**
     * Top-level functions in declaration order.
     */
    public List<FunctionDecl> functions() {
        return functions;
    }

    /**
     * The function at {@code index}, provided it still has the expected name. An index
     * from another tree, or one that no longer matches, yields empty.
     */
    public Optional<FunctionDecl> findFunction(int index, String name) {
        if (index < 0 || index >= functions.size()) {
            return Optional.empty();
        }
        FunctionDecl function = functions.get(index);
        return function.name().equals(name) ? Optional.of(function) : Optional.empty();
    }

    public Optional<FunctionDecl> findFunction(String name) {
        return functions.stream()
                .filter(f -> f.name().equals(name))
                .findFirst();
    }

    /**
     * Deep copy suitable for mutation. The copy carries no source text, so it must be
     * serialized and parsed again before position-based analysis.
     */
    public SourceTree mutableCopy() {
        return new SourceTree(compilationUnit.clone(), null);
    }
}
