package com.raditha.smells.analysis;

import com.github.javaparser.ast.body.FieldDeclaration;
import com.github.javaparser.ast.body.Parameter;
import com.github.javaparser.ast.body.VariableDeclarator;
import com.github.javaparser.ast.type.Type;
import com.raditha.smells.tree.FunctionDecl;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;

/**
 * Looks up the declaration of a variable that is visible inside a function, so an
 * extracted helper can declare a parameter or return value of the right type.
 * <p>
 * Lookup order: the function's parameters, local variables declared anywhere in its
 * body, then fields of the declaring type. Inherited members and static imports are
 * not resolved.
 */
public class ScopeAnalyzer {
    private static final Logger logger = LoggerFactory.getLogger(ScopeAnalyzer.class);

    private static final String FALLBACK_TYPE = "Object";

    public Optional<VariableInfo> resolve(FunctionDecl function, String name) {
        for (Parameter param : function.method().getParameters()) {
            if (param.getNameAsString().equals(name)) {
                String type = param.getTypeAsString() + (param.isVarArgs() ? "[]" : "");
                return Optional.of(new VariableInfo(name, type, true, false));
            }
        }

        Optional<VariableDeclarator> local = function.method().getBody()
                .flatMap(body -> body.findFirst(VariableDeclarator.class,
                        v -> v.getNameAsString().equals(name)));
        if (local.isPresent()) {
            return Optional.of(new VariableInfo(name, typeName(local.get().getType()), false, false));
        }

        Optional<Parameter> nested = function.method().getBody()
                .flatMap(body -> body.findFirst(Parameter.class,
                        p -> p.getNameAsString().equals(name) && !p.getType().isUnknownType()));
        if (nested.isPresent()) {
            return Optional.of(new VariableInfo(name, typeName(nested.get().getType()), false, false));
        }

        for (FieldDeclaration field : function.declaringType().getFields()) {
            for (VariableDeclarator var : field.getVariables()) {
                if (var.getNameAsString().equals(name)) {
                    return Optional.of(new VariableInfo(name, typeName(var.getType()), false, true));
                }
            }
        }
        return Optional.empty();
    }

    /**
     * Declared type of a variable, {@code Object} when it cannot be determined.
     */
    public String typeOf(FunctionDecl function, String name) {
        return resolve(function, name).map(VariableInfo::type).orElseGet(() -> {
            logger.debug("No declaration found for {} in {}, using {}", name, function.name(), FALLBACK_TYPE);
            return FALLBACK_TYPE;
        });
    }

    private static String typeName(Type type) {
        if (type.isVarType()) {
            return FALLBACK_TYPE;
        }
        return type.asString();
    }

    /**
     * A variable visible in a function.
     */
    public record VariableInfo(
            String name,
            String type,
            boolean isParameter,
            boolean isField) {

        public boolean isLocal() {
            return !isParameter && !isField;
        }

        @Override
        public String toString() {
            String kind = isParameter ? "param" : isField ? "field" : "local";
            return String.format("%s %s %s", kind, type, name);
        }
    }
}
