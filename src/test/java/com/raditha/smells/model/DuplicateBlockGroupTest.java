package com.raditha.smells.model;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class DuplicateBlockGroupTest {

    @Test
    void testNeedsTwoOccurrences() {
        BlockOccurrence only = new BlockOccurrence("f", 0, 0, "a();", Set.of("a();"));

        assertThrows(IllegalArgumentException.class, () -> new DuplicateBlockGroup(List.of(only), 2));
    }

    @Test
    void testOwnersMustDiffer() {
        BlockOccurrence first = new BlockOccurrence("f", 0, 0, "a();", Set.of("a();"));
        BlockOccurrence second = new BlockOccurrence("f", 0, 3, "a();", Set.of("a();"));

        assertThrows(IllegalArgumentException.class, () -> new DuplicateBlockGroup(List.of(first, second), 2));
    }

    @Test
    void testOverloadsAreDifferentOwners() {
        BlockOccurrence first = new BlockOccurrence("log", 0, 1, "a();", Set.of("a();"));
        BlockOccurrence second = new BlockOccurrence("log", 1, 0, "a();", Set.of("a();"));

        DuplicateBlockGroup group = new DuplicateBlockGroup(List.of(first, second), 2);

        assertEquals(2, group.size());
        assertEquals("In functions log, log, duplicate block starts at indices: 0, 1", group.toFinding().detail());
    }

    @Test
    void testFinding() {
        DuplicateBlockGroup group = new DuplicateBlockGroup(List.of(
                new BlockOccurrence("g", 1, 3, "", Set.of()),
                new BlockOccurrence("f", 0, 0, "", Set.of())), 2);

        Finding finding = group.toFinding();

        assertEquals(SmellKind.DUPLICATE_BLOCK, finding.kind());
        assertEquals("g", finding.subject());
        assertEquals("In functions f, g, duplicate block starts at indices: 0, 3", finding.detail());
    }
}
