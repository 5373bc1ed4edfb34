package com.raditha.smells.tree;

import com.github.javaparser.JavaParser;
import com.github.javaparser.ParseResult;
import com.github.javaparser.ParserConfiguration;
import com.github.javaparser.Problem;
import com.github.javaparser.ast.CompilationUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Parses Java source text into a {@link SourceTree}.
 */
public class SourceTreeBuilder {
    private static final Logger logger = LoggerFactory.getLogger(SourceTreeBuilder.class);

    private final JavaParser parser;

    public SourceTreeBuilder() {
        ParserConfiguration configuration = new ParserConfiguration()
                .setLanguageLevel(ParserConfiguration.LanguageLevel.JAVA_17);
        this.parser = new JavaParser(configuration);
    }

    /**
     * Parse source text.
     *
     * @param source complete text of one compilation unit
     * @return the parsed tree, with positions
     * @throws SourceParseException if the text is not valid Java
     */
    public SourceTree parse(String source) {
        ParseResult<CompilationUnit> result = parser.parse(source);
        if (!result.isSuccessful() || result.getResult().isEmpty()) {
            Problem first = result.getProblems().isEmpty() ? null : result.getProblems().get(0);
            SourceParseException ex = SourceParseException.from(first);
            logger.debug("Parse failed with {} problem(s): {}", result.getProblems().size(), ex.getMessage());
            throw ex;
        }
        return new SourceTree(result.getResult().get(), source);
    }

    /**
     * Read a UTF-8 file and parse it.
     */
    public SourceTree parse(Path file) throws IOException {
        return parse(Files.readString(file, StandardCharsets.UTF_8));
    }
}
