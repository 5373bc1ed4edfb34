package com.raditha.smells.tree;

import com.github.javaparser.ast.Node;
import com.github.javaparser.ast.stmt.Statement;
import com.github.javaparser.printer.configuration.PrettyPrinterConfiguration;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Renders trees and statements back to Java source.
 */
public class SourceSerializer {

    private final SourceTreeBuilder builder;

    public SourceSerializer() {
        this(new SourceTreeBuilder());
    }

    public SourceSerializer(SourceTreeBuilder builder) {
        this.builder = builder;
    }

    /**
     * Print a whole tree, comments included.
     */
    public String print(SourceTree tree) {
        return tree.compilationUnit().toString();
    }

    /**
     * Print a tree and parse the output again, so the result carries fresh positions
     * and is known to be valid source.
     *
     * @throws SerializationException if the printed text does not parse
     */
    public SourceTree reparse(SourceTree tree) {
        String text;
        try {
            text = print(tree);
        } catch (RuntimeException e) {
            throw new SerializationException("Could not print refactored tree: " + e.getMessage(), e);
        }
        try {
            return builder.parse(text);
        } catch (SourceParseException e) {
            throw new SerializationException("Refactored code is not valid Java: " + e.getMessage(), e);
        }
    }

    /**
     * Render a node without comments. This is the text used for comparison,
     * tokenizing and naming.
     */
    public static String render(Node node) {
        PrettyPrinterConfiguration config = new PrettyPrinterConfiguration();
        config.setPrintComments(false);
        return node.toString(config);
    }

    /**
     * Render consecutive statements, one after the other, separated by newlines.
     */
    public static String render(List<Statement> statements) {
        return statements.stream()
                .map(SourceSerializer::render)
                .collect(Collectors.joining("\n"));
    }
}
