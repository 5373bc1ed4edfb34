package com.raditha.smells.refactoring;

import com.raditha.smells.detection.FunctionDuplicateDetector;
import com.raditha.smells.model.DuplicateFunctionPair;
import com.raditha.smells.tree.FunctionDecl;
import com.raditha.smells.tree.SourceSerializer;
import com.raditha.smells.tree.SourceTree;
import com.raditha.smells.tree.SourceTreeBuilder;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class FunctionDuplicateRefactorerTest {

    private FunctionDuplicateRefactorer refactorer;
    private SourceTreeBuilder builder;

    @BeforeEach
    void setUp() {
        refactorer = new FunctionDuplicateRefactorer();
        builder = new SourceTreeBuilder();
    }

    @Test
    void testPlusOneDelegatesToAddOne() {
        SourceTree tree = builder.parse("""
                class MathUtil {
                    int addOne(int n) {
                        return n + 1;
                    }

                    int plusOne(int n) {
                        return n + 1;
                    }
                }
                """);
        List<DuplicateFunctionPair> pairs = new FunctionDuplicateDetector().detect(tree);

        FunctionDuplicateRefactorer.Result result = refactorer.refactor(tree, pairs);

        assertEquals(pairs, result.replaced());
        assertTrue(result.skipped().isEmpty());
        FunctionDecl plusOne = result.tree().findFunction("plusOne").orElseThrow();
        assertEquals(1, plusOne.body().size());
        assertEquals("return addOne(n);", render(plusOne));
        assertEquals("return n + 1;", render(result.tree().findFunction("addOne").orElseThrow()));
        // the input is left alone
        assertEquals("return n + 1;", render(tree.findFunction("plusOne").orElseThrow()));
        assertTrue(result.tree().source().isPresent());
    }

    @Test
    void testVoidDuplicateForwardsParametersPositionally() {
        SourceTree tree = builder.parse("""
                class Printer {
                    void show(String label, int value) {
                        System.out.println(label + value);
                    }

                    public void display(String name, int amount) {
                        System.out.println(label + value);
                    }
                }
                """);

        FunctionDuplicateRefactorer.Result result = refactorer.refactor(tree,
                List.of(new DuplicateFunctionPair("show", 0, "display", 1)));

        FunctionDecl display = result.tree().findFunction("display").orElseThrow();
        assertEquals("show(name, amount);", render(display));
        assertTrue(display.method().isPublic());
        assertEquals(List.of("name", "amount"), display.parameters());
    }

    @Test
    void testStaticPrimaryInOtherTypeIsQualified() {
        SourceTree tree = builder.parse("""
                class First {
                    static int twice(int x) { return x * 2; }
                }

                class Second {
                    static int doubled(int y) { return x * 2; }
                }
                """);

        FunctionDuplicateRefactorer.Result result = refactorer.refactor(tree,
                List.of(new DuplicateFunctionPair("twice", 0, "doubled", 1)));

        assertEquals("return First.twice(y);", render(result.tree().findFunction("doubled").orElseThrow()));
    }

    @Test
    void testOverloadsWithDifferentParameterTypesAreLeftAlone() {
        SourceTree tree = builder.parse("""
                class Counter {
                    int inc(int a) { return a + 1; }
                    long inc(long a) { return a + 1; }
                }
                """);
        List<DuplicateFunctionPair> pairs = new FunctionDuplicateDetector().detect(tree);

        FunctionDuplicateRefactorer.Result result = refactorer.refactor(tree, pairs);

        assertTrue(result.replaced().isEmpty());
        assertEquals(pairs, result.skipped());
        assertEquals("return a + 1;", render(result.tree().functions().get(0)));
        assertEquals("return a + 1;", render(result.tree().functions().get(1)));
    }

    @Test
    void testSameSignatureInOtherTypeCallsThePrimary() {
        SourceTree tree = builder.parse("""
                class Left {
                    static int inc(int a) { return a + 1; }
                }

                class Right {
                    static int inc(int a) { return a + 1; }
                    static long inc(long a) { return a + 2; }
                }
                """);

        FunctionDuplicateRefactorer.Result result = refactorer.refactor(tree,
                new FunctionDuplicateDetector().detect(tree));

        assertEquals(1, result.replaced().size());
        assertEquals("return Left.inc(a);", render(result.tree().functions().get(1)));
        assertEquals("return a + 1;", render(result.tree().functions().get(0)));
    }

    @Test
    void testInstancePrimaryUnreachableFromStaticDuplicate() {
        SourceTree tree = builder.parse("""
                class Mixed {
                    int twice(int x) { return x * 2; }
                    static int doubled(int y) { return x * 2; }
                }
                """);

        FunctionDuplicateRefactorer.Result result = refactorer.refactor(tree,
                List.of(new DuplicateFunctionPair("twice", 0, "doubled", 1)));

        assertEquals(1, result.skipped().size());
        assertEquals("return x * 2;", render(result.tree().findFunction("doubled").orElseThrow()));
    }

    @Test
    void testDifferentReturnTypeIsLeftAlone() {
        SourceTree tree = builder.parse("""
                class Widen {
                    long big(int a) { return a + 1; }
                    int small(int b) { return a + 1; }
                }
                """);

        FunctionDuplicateRefactorer.Result result = refactorer.refactor(tree,
                List.of(new DuplicateFunctionPair("big", 0, "small", 1)));

        assertTrue(result.replaced().isEmpty());
        assertEquals(1, result.skipped().size());
    }

    @Test
    void testMissingFunction() {
        SourceTree tree = builder.parse("class A { int f() { return 1; } }");

        RewriteException ex = assertThrows(RewriteException.class,
                () -> refactorer.refactor(tree, List.of(new DuplicateFunctionPair("f", 0, "ghost", 1))));
        assertEquals("ghost", ex.getFunctionName());
    }

    @Test
    void testIndexThatNamesAnotherFunctionIsMissing() {
        SourceTree tree = builder.parse("class A { int f() { return 1; } int g() { return 1; } }");

        RewriteException ex = assertThrows(RewriteException.class,
                () -> refactorer.refactor(tree, List.of(new DuplicateFunctionPair("g", 0, "f", 1))));
        assertEquals("g", ex.getFunctionName());
    }

    @Test
    void testBodylessDuplicate() {
        SourceTree tree = builder.parse("abstract class A { int f() { return 1; } abstract int g(); }");

        assertThrows(RewriteException.class,
                () -> refactorer.refactor(tree, List.of(new DuplicateFunctionPair("f", 0, "g", 1))));
    }

    private static String render(FunctionDecl function) {
        return SourceSerializer.render(function.body().get(0));
    }
}
