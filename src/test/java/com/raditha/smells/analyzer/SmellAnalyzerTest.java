package com.raditha.smells.analyzer;

import com.github.javaparser.StaticJavaParser;
import com.raditha.smells.config.SmellDetectorConfig;
import com.raditha.smells.model.SmellKind;
import com.raditha.smells.tree.SourceTree;
import com.raditha.smells.tree.SourceTreeBuilder;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class SmellAnalyzerTest {

    private static final String SOURCE = """
            class Service {
                int addOne(int n) {
                    return n + 1;
                }

                int plusOne(int n) {
                    return n + 1;
                }

                void configure(String host, int port, boolean secure, long timeout) {
                    connect(host, port);
                }
            }
            """;

    @Test
    void testCollectsAllDetectors() {
        SourceTree tree = new SourceTreeBuilder().parse(SOURCE);

        SmellReport report = new SmellAnalyzer().analyze(tree, "Service.java");

        assertFalse(report.hasErrors());
        assertEquals(1, report.findingsOf(SmellKind.LONG_PARAMETER_LIST).size());
        assertEquals(4, report.findingsOf(SmellKind.LONG_PARAMETER_LIST).get(0).metric());
        assertEquals(1, report.duplicateFunctions().size());
        assertEquals("Duplicate functions detected: addOne and plusOne",
                report.findingsOf(SmellKind.DUPLICATE_FUNCTION).get(0).detail());
        assertTrue(report.findingsOf(SmellKind.LONG_METHOD).isEmpty());
    }

    @Test
    void testDetectorFailureIsIsolated() {
        // built in memory, so there is no text to count lines in
        SourceTree tree = SourceTree.of(StaticJavaParser.parse(SOURCE));

        SmellReport report = new SmellAnalyzer().analyze(tree, "Service.java");

        assertEquals(1, report.errors().size());
        assertEquals("long-method", report.errors().get(0).detector());
        assertEquals(1, report.findingsOf(SmellKind.LONG_PARAMETER_LIST).size());
        assertEquals(1, report.duplicateFunctions().size());
        assertTrue(report.getDetailedReport().contains("Detector errors:"));
    }

    @Test
    void testStructuralMatchOfExactDuplicateNotRepeated() {
        SourceTree tree = new SourceTreeBuilder().parse("""
                class Loops {
                    int sum(int[] values) {
                        int total = 0;
                        for (int v : values) {
                            total = total + v;
                        }
                        return total;
                    }

                    int sumAgain(int[] values) {
                        int total = 0;
                        for (int v : values) {
                            total = total + v;
                        }
                        return total;
                    }

                    long count(long[] items) {
                        long n = 0;
                        for (long item : items) {
                            n = n + 1;
                        }
                        return n;
                    }
                }
                """);

        SmellReport report = new SmellAnalyzer().analyze(tree, "Loops.java");

        assertEquals(1, report.duplicateFunctions().size());
        List<String> structural = report.structuralDuplicates().stream()
                .map(p -> p.first() + "/" + p.second())
                .toList();
        assertEquals(List.of("sum/count", "sumAgain/count"), structural);
    }

    @Test
    void testConfigThresholdsApplied() {
        SourceTree tree = new SourceTreeBuilder().parse(SOURCE);
        SmellDetectorConfig config = new SmellDetectorConfig(2, 5, 2, 0.75, 0.80, null);

        SmellReport report = new SmellAnalyzer(config).analyze(tree, "Service.java");

        assertTrue(report.findingsOf(SmellKind.LONG_PARAMETER_LIST).isEmpty());
        assertEquals(3, report.findingsOf(SmellKind.LONG_METHOD).size());
    }

    @Test
    void testCleanFile() {
        SourceTree tree = new SourceTreeBuilder().parse("class Empty { }");

        SmellReport report = new SmellAnalyzer().analyze(tree, "Empty.java");

        assertFalse(report.hasFindings());
        assertTrue(report.getDetailedReport().contains("No code smells found."));
        assertEquals("Found 0 smells in Empty.java (0 duplicate functions, 0 duplicate block groups, 0 structural matches)",
                report.getSummary());
    }
}
