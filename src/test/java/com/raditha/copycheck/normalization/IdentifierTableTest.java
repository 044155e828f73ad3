package com.raditha.copycheck.normalization;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class IdentifierTableTest {

    @Test
    void testPlaceholdersInEncounterOrder() {
        IdentifierTable table = new IdentifierTable();

        assertEquals("VAR_1", table.placeholderFor("count"));
        assertEquals("VAR_2", table.placeholderFor("total"));
        assertEquals("VAR_1", table.placeholderFor("count"));
        assertEquals("VAR_3", table.placeholderFor("index"));

        assertEquals(3, table.size());
        assertEquals(List.of("count", "total", "index"), List.copyOf(table.asMap().keySet()));
    }

    @Test
    void testMapIsReadOnly() {
        IdentifierTable table = new IdentifierTable();
        table.placeholderFor("x");

        assertThrows(UnsupportedOperationException.class, () -> table.asMap().put("y", "VAR_9"));
    }

    @Test
    void testReservedWords() {
        assertTrue(ReservedWords.isReserved("while"));
        assertTrue(ReservedWords.isReserved("vector"));
        assertTrue(ReservedWords.isReserved("include"));
        assertFalse(ReservedWords.isReserved("counter"));
        assertFalse(ReservedWords.isReserved("While"));
    }
}
