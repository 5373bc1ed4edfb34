package com.raditha.smells.analysis;

import com.github.javaparser.StaticJavaParser;
import com.github.javaparser.ast.stmt.Statement;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for FreeVariableAnalyzer.
 */
class FreeVariableAnalyzerTest {

    private FreeVariableAnalyzer analyzer;

    @BeforeEach
    void setUp() {
        analyzer = new FreeVariableAnalyzer();
    }

    @Test
    void testWrittenNameIsNotFree() {
        List<Statement> block = statements("x = a + b;", "return x;");

        assertEquals(List.of("a", "b"), List.copyOf(analyzer.freeVariables(block)));
    }

    @Test
    void testDeclaredLocalIsNotFree() {
        List<Statement> block = statements("int total = price * quantity;", "System.out.println(total);");

        // System is read like any other name; callers decide what it resolves to
        assertEquals(List.of("System", "price", "quantity"), List.copyOf(analyzer.freeVariables(block)));
    }

    @Test
    void testReadBeforeWriteIsStillNotFree() {
        List<Statement> block = statements("log(count);", "count = 0;");

        assertTrue(analyzer.freeVariables(block).isEmpty());
    }

    @Test
    void testIncrementIsWrite() {
        List<Statement> block = statements("i++;", "--j;", "use(k);");

        assertEquals(List.of("k"), List.copyOf(analyzer.freeVariables(block)));
        assertEquals(Set.of("i", "j"), analyzer.writtenVariables(block));
    }

    @Test
    void testLambdaAndCatchParametersAreBound() {
        List<Statement> block = statements(
                "items.forEach(item -> sink.accept(item));",
                "try { risky(); } catch (Exception e) { report(e); }");

        assertEquals(List.of("items", "sink"), List.copyOf(analyzer.freeVariables(block)));
        assertEquals(Set.of("item", "e"), analyzer.writtenVariables(block));
    }

    @Test
    void testFieldAccessAndMethodNamesAreNotNames() {
        List<Statement> block = statements("this.value = compute(input);");

        assertEquals(List.of("input"), List.copyOf(analyzer.freeVariables(block)));
    }

    @Test
    void testCompoundAssignmentTargetIsWritten() {
        List<Statement> block = statements("sum += v;");

        assertEquals(List.of("v"), List.copyOf(analyzer.freeVariables(block)));
    }

    private static List<Statement> statements(String... code) {
        return Arrays.stream(code).map(StaticJavaParser::parseStatement).toList();
    }
}
