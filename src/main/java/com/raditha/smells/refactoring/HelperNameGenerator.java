package com.raditha.smells.refactoring;

import com.github.javaparser.ast.body.MethodDeclaration;
import com.github.javaparser.ast.body.TypeDeclaration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.lang.model.SourceVersion;
import java.util.HashSet;
import java.util.Set;

/**
 * Names extracted helper methods.
 * <p>
 * The {@link NamingOracle} is asked first; its answer is used only if it is a legal
 * Java identifier. Otherwise the name is {@value #DEFAULT_NAME}. Clashes with methods
 * already in the class or with names handed out earlier by this generator are resolved
 * with a numeric suffix: {@code name_1}, {@code name_2}, ...
 * <p>
 * One instance covers one rewrite session.
 */
public class HelperNameGenerator {
    private static final Logger logger = LoggerFactory.getLogger(HelperNameGenerator.class);

    public static final String DEFAULT_NAME = "commonBlock";

    private final NamingOracle oracle;
    private final Set<String> generatedNames = new HashSet<>();

    public HelperNameGenerator(NamingOracle oracle) {
        this.oracle = oracle;
    }

    /**
     * Generate a unique method name for an extracted snippet.
     *
     * @param snippet         code being extracted
     * @param containingType  type the helper will be added to, may be null
     */
    public String generateName(String snippet, TypeDeclaration<?> containingType) {
        String candidate = suggestedName(snippet);
        return ensureUnique(candidate, containingType);
    }

    private String suggestedName(String snippet) {
        try {
            String suggestion = oracle.suggestName(snippet).map(HelperNameGenerator::cleanResponse).orElse(null);
            if (isValidMethodName(suggestion)) {
                return suggestion;
            }
            if (suggestion != null) {
                logger.debug("Rejected suggested name '{}'", suggestion);
            }
        } catch (RuntimeException e) {
            logger.warn("Naming oracle failed, using default name: {}", e.getMessage());
        }
        return DEFAULT_NAME;
    }

    /**
     * First line of the answer without code fences, quotes or surrounding blanks.
     */
    static String cleanResponse(String response) {
        String firstLine = response.strip().lines().findFirst().orElse("");
        return firstLine.replace("`", "")
                .replaceAll("^[\"']|[\"']$", "")
                .strip();
    }

    static boolean isValidMethodName(String name) {
        return name != null
                && !name.isEmpty()
                && SourceVersion.isIdentifier(name)
                && !SourceVersion.isKeyword(name);
    }

    private String ensureUnique(String baseName, TypeDeclaration<?> containingType) {
        Set<String> taken = new HashSet<>(generatedNames);
        if (containingType != null) {
            for (MethodDeclaration method : containingType.getMethods()) {
                taken.add(method.getNameAsString());
            }
        }

        String uniqueName = baseName;
        int suffix = 1;
        while (taken.contains(uniqueName)) {
            uniqueName = baseName + "_" + suffix;
            suffix++;
        }

        generatedNames.add(uniqueName);
        return uniqueName;
    }
}
