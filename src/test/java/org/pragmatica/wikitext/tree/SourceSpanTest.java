package org.pragmatica.wikitext.tree;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class SourceSpanTest {

    private static SourceLocation location(String text, int offset) {
        int line = 1;
        int column = 1;
        for (int i = 0; i < offset; i++) {
            if (text.charAt(i) == '\n') {
                line++;
                column = 1;
            } else {
                column++;
            }
        }
        return SourceLocation.at(line, column, offset);
    }

    private static SourceSpan span(String text, int start, int end) {
        return SourceSpan.of(location(text, start), location(text, end));
    }

    @Test
    void location_printsAsLineAndColumn() {
        assertEquals("1:1", SourceLocation.START.toString());
        assertEquals("2:2", location("ab\ncd", 4).toString());
    }

    @Test
    void extract_returnsHalfOpenSlice() {
        var text = "hello world";

        assertEquals("world", span(text, 6, 11).extract(text));
        assertEquals("", span(text, 3, 3).extract(text));
        assertTrue(span(text, 3, 3).isEmpty());
    }

    @Test
    void extendTo_neverShrinks() {
        var text = "abcdef";
        var base = span(text, 1, 3);

        assertEquals(5, base.extendTo(location(text, 5)).endOffset());
        assertSame(base, base.extendTo(location(text, 2)));
    }

    @Test
    void contains_isInclusiveOfBothEnds() {
        var text = "abcdef";

        assertTrue(span(text, 0, 6).contains(span(text, 2, 4)));
        assertTrue(span(text, 2, 4).contains(span(text, 4, 4)));
        assertFalse(span(text, 2, 4).contains(span(text, 3, 5)));
    }

    @Test
    void merge_coversBoth() {
        var text = "abcdef";

        var merged = span(text, 4, 5).merge(span(text, 1, 2));

        assertEquals(1, merged.startOffset());
        assertEquals(5, merged.endOffset());
    }

    @Test
    void statusAndAlignmentLookups() {
        assertEquals(IncludeStatus.NOT_FOUND, IncludeStatus.fromReason("not-found").orElseThrow());
        assertTrue(IncludeStatus.fromReason("bogus").isEmpty());
        assertEquals(Alignment.JUSTIFY, Alignment.fromMarker("==").orElseThrow());
        assertTrue(Alignment.fromMarker("===").isEmpty());
    }
}
