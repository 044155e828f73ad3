package com.raditha.copycheck.model;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class SegmentTest {

    @Test
    void testRanges() {
        Segment segment = new Segment(2, 5, 7, 9, List.of("a"));

        assertEquals(new Range(2, 5), segment.firstRange());
        assertEquals(4, segment.firstRange().getLineCount());
        assertEquals("L7-9", segment.secondRange().toDisplayString());
        assertEquals("L3", new Range(3, 3).toString());
    }

    @Test
    void testBoundsValidated() {
        assertThrows(IllegalArgumentException.class, () -> new Segment(3, 2, 0, 0, List.of()));
        assertThrows(IllegalArgumentException.class, () -> new Segment(0, 0, 5, 1, List.of()));
        assertThrows(IllegalArgumentException.class, () -> new Range(4, 1));
    }

    @Test
    void testDocumentSplitsLines() {
        assertEquals(List.of("a", "b", ""), Document.of("a\nb\n").lines());
        assertEquals(List.of("a", "b"), Document.of("a\r\nb").lines());
        assertTrue(Document.of("").isEmpty());
        assertTrue(Document.of(null).isEmpty());
    }
}
