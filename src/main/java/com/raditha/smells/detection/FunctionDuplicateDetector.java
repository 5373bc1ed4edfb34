package com.raditha.smells.detection;

import com.github.javaparser.ast.stmt.Statement;
import com.raditha.smells.model.DuplicateFunctionPair;
import com.raditha.smells.tree.FunctionDecl;
import com.raditha.smells.tree.SourceSerializer;
import com.raditha.smells.tree.SourceTree;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Finds functions whose bodies are identical once the signature, comments and
 * formatting are removed.
 * <p>
 * Matching is exact. The first function seen with a given body is the primary of
 * every later function that repeats it. Empty bodies all match each other.
 */
public class FunctionDuplicateDetector {

    public List<DuplicateFunctionPair> detect(SourceTree tree) {
        Map<String, FunctionDecl> firstByBody = new LinkedHashMap<>();
        List<DuplicateFunctionPair> duplicates = new ArrayList<>();

        for (FunctionDecl function : tree.functions()) {
            if (!function.hasBody()) {
                continue;
            }
            String body = canonicalBody(function.body());
            FunctionDecl primary = firstByBody.putIfAbsent(body, function);
            if (primary != null) {
                duplicates.add(new DuplicateFunctionPair(primary.name(), primary.index(),
                        function.name(), function.index()));
            }
        }
        return duplicates;
    }

    /**
     * One trimmed line per printed line, blank lines dropped.
     */
    static String canonicalBody(List<Statement> statements) {
        return statements.stream()
                .map(SourceSerializer::render)
                .flatMap(String::lines)
                .map(String::strip)
                .filter(line -> !line.isEmpty())
                .collect(Collectors.joining("\n"));
    }
}
