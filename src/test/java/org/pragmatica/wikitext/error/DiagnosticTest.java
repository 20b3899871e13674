package org.pragmatica.wikitext.error;

import org.junit.jupiter.api.Test;
import org.pragmatica.wikitext.tree.SourceLocation;
import org.pragmatica.wikitext.tree.SourceSpan;

import static org.junit.jupiter.api.Assertions.*;

class DiagnosticTest {

    private static final String SOURCE = "first line\n**never closed";
    private static final SourceSpan OPENER = SourceSpan.of(SourceLocation.at(2, 1, 11), SourceLocation.at(2, 3, 13));

    @Test
    void format_showsHeaderLocationAndUnderline() {
        var diagnostic = Diagnostic.warning(DiagnosticKind.UNCLOSED_BLOCK_AUTO_CLOSED,
                                            "unclosed bold auto-closed at end of input",
                                            OPENER)
                                   .withLabel("opened here");

        var formatted = diagnostic.format(SOURCE, "page.wiki");

        assertTrue(formatted.startsWith("warning[W002]: unclosed bold auto-closed at end of input\n"));
        assertTrue(formatted.contains("  --> page.wiki:2:1\n"));
        assertTrue(formatted.contains("2 | **never closed\n"));
        assertTrue(formatted.contains("  | ^^ opened here\n"));
        assertFalse(formatted.contains("first line"));
    }

    @Test
    void format_listsHelpNotes() {
        var diagnostic = Diagnostic.info(DiagnosticKind.DEPRECATED_CONSTRUCT_USED, "alignment block is deprecated", OPENER)
                                   .withHelp("use a div instead");

        var formatted = diagnostic.format(SOURCE, "page.wiki");

        assertTrue(formatted.startsWith("info[W004]"));
        assertTrue(formatted.contains("= help: use a div instead"));
    }

    @Test
    void format_withoutLabels_underlinesPrimarySpan() {
        var diagnostic = Diagnostic.warning(DiagnosticKind.UNMATCHED_CLOSING_MARKER, "stray", OPENER);

        assertTrue(diagnostic.format(SOURCE, null).contains("  | ^^\n"));
        assertTrue(diagnostic.format(SOURCE, null).contains("  --> 2:1\n"));
    }

    @Test
    void format_drawsSecondaryLabelsWithDashes() {
        var closer = SourceSpan.of(SourceLocation.at(2, 4, 14), SourceLocation.at(2, 9, 19));
        var diagnostic = Diagnostic.warning(DiagnosticKind.UNCLOSED_BLOCK_AUTO_CLOSED, "unclosed bold", OPENER)
                                   .withLabel("opened here")
                                   .withSecondaryLabel(closer, "no closer on this line");

        var formatted = diagnostic.format(SOURCE, "page.wiki");

        assertTrue(formatted.contains("  | ^^ opened here ----- no closer on this line\n"));
    }

    @Test
    void formatSimple_isOneLine() {
        var diagnostic = Diagnostic.warning(DiagnosticKind.MALFORMED_CONSTRUCT_DEGRADED_TO_TEXT, "malformed link kept as text", OPENER);

        assertEquals("page.wiki:2:1: warning[W003]: malformed link kept as text", diagnostic.formatSimple("page.wiki"));
    }

    @Test
    void kinds_haveStableCodesAndTags() {
        assertEquals("W001", DiagnosticKind.UNMATCHED_CLOSING_MARKER.code());
        assertEquals("W002", DiagnosticKind.UNCLOSED_BLOCK_AUTO_CLOSED.code());
        assertEquals("W003", DiagnosticKind.MALFORMED_CONSTRUCT_DEGRADED_TO_TEXT.code());
        assertEquals("W004", DiagnosticKind.DEPRECATED_CONSTRUCT_USED.code());
        assertEquals("unclosed-block-auto-closed", DiagnosticKind.UNCLOSED_BLOCK_AUTO_CLOSED.tag());
    }

    @Test
    void builders_doNotMutateOriginal() {
        var original = Diagnostic.warning(DiagnosticKind.UNMATCHED_CLOSING_MARKER, "stray", OPENER);

        var annotated = original.withLabel("here").withNote("note");

        assertTrue(original.labels().isEmpty());
        assertTrue(original.notes().isEmpty());
        assertEquals(1, annotated.labels().size());
        assertEquals("note", annotated.notes().get(0));
    }
}
