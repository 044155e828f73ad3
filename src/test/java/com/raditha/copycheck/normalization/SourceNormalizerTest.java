package com.raditha.copycheck.normalization;

import com.raditha.copycheck.model.Document;
import com.raditha.copycheck.model.NormalizedDocument;
import com.raditha.copycheck.model.NormalizedLine;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class SourceNormalizerTest {

    private SourceNormalizer normalizer;

    @BeforeEach
    void setUp() {
        normalizer = new SourceNormalizer();
    }

    @Test
    void testStripsLineCommentsAndBlankLines() {
        String code = "int a = 1; // set a\n\n   \n// only comment\nint b = a;";

        NormalizedDocument doc = normalizer.normalize(code);

        assertEquals(List.of("int VAR_1 = 1;", "int VAR_2 = VAR_1;"), doc.texts());
        assertEquals(1, doc.sourceLineOf(0));
        assertEquals(5, doc.sourceLineOf(1));
    }

    @Test
    void testBlockCommentSpanningLines() {
        String code = """
                int x = 0; /* start
                still comment
                end */ x = x + 1;
                /* whole */
                y = x;
                """;

        NormalizedDocument doc = normalizer.normalize(code);

        assertEquals(List.of("int VAR_1 = 0;", "VAR_1 = VAR_1 + 1;", "VAR_2 = VAR_1;"), doc.texts());
        assertEquals(List.of(1, 3, 5), doc.lines().stream().map(NormalizedLine::sourceLine).toList());
    }

    @Test
    void testInlineBlockCommentsRemoved() {
        NormalizedDocument doc = normalizer.normalize("a /* one */ + /* two */ b;");

        assertEquals(List.of("VAR_1 + VAR_2;"), doc.texts());
    }

    @Test
    void testCommentOnlyRemainderAfterTerminatorIsDropped() {
        NormalizedDocument doc = normalizer.normalize("/* open\nclose */   \nx = 1;");

        assertEquals(List.of("VAR_1 = 1;"), doc.texts());
        assertEquals(3, doc.sourceLineOf(0));
    }

    @Test
    void testWhitespaceCollapsed() {
        NormalizedDocument doc = normalizer.normalize("  if   (a\t==  b)   {");

        assertEquals(List.of("if (VAR_1 == VAR_2) {"), doc.texts());
    }

    @Test
    void testPlaceholdersAdvanceAcrossLines() {
        NormalizedDocument doc = normalizer.normalize("foo(bar);\nbaz = foo;");

        assertEquals(List.of("VAR_1(VAR_2);", "VAR_3 = VAR_1;"), doc.texts());
    }

    @Test
    void testReservedWordsPreserved() {
        NormalizedDocument doc = normalizer.normalize("return std::string(value);");

        assertEquals(List.of("return std::string(VAR_1);"), doc.texts());
    }

    @Test
    void testNumericLiteralsUntouched() {
        NormalizedDocument doc = normalizer.normalize("x = 0x1F + 10UL;");

        assertEquals(List.of("VAR_1 = 0x1F + 10UL;"), doc.texts());
    }

    @Test
    void testFreshIdentifierTablePerDocument() {
        NormalizedDocument first = normalizer.normalize("alpha = 1;");
        NormalizedDocument second = normalizer.normalize("beta = 2;");

        assertEquals(List.of("VAR_1 = 1;"), first.texts());
        assertEquals(List.of("VAR_1 = 2;"), second.texts());
    }

    @Test
    void testCommentStateDoesNotLeakBetweenDocuments() {
        normalizer.normalize("x = 1; /* never closed");

        NormalizedDocument next = normalizer.normalize("y = 2;");

        assertEquals(List.of("VAR_1 = 2;"), next.texts());
    }

    @Test
    void testEmptyAndNullDocuments() {
        assertTrue(normalizer.normalize("").isEmpty());
        assertTrue(normalizer.normalize(Document.of(null)).isEmpty());
        assertTrue(normalizer.normalize("\n\n   \n// nothing\n").isEmpty());
    }

    @Test
    void testWindowsLineEndings() {
        NormalizedDocument doc = normalizer.normalize("a = 1;\r\nb = 2;\r\n");

        assertEquals(List.of("VAR_1 = 1;", "VAR_2 = 2;"), doc.texts());
        assertEquals(2, doc.sourceLineOf(1));
    }
}
