package org.pragmatica.wikitext.parser;

import org.junit.jupiter.api.Test;
import org.pragmatica.wikitext.lexer.Scanner;
import org.pragmatica.wikitext.lexer.Token;

import static org.junit.jupiter.api.Assertions.*;

class BuildContextTest {

    private static BuildContext context(String text) {
        return BuildContext.create(Scanner.tokenize(text));
    }

    // === Lookahead ===

    @Test
    void repeatedSearches_agreeWithFreshOnes() {
        var text = "[[ a ]] [[ b\n[[ c ]]\n\n]]";
        var cached = context(text);

        for (int from = 0; from < cached.size(); from++) {
            var fresh = context(text);
            assertEquals(fresh.findOnLine(from, Token.RIGHT_BLOCK), cached.findOnLine(from, Token.RIGHT_BLOCK), "line from " + from);
            assertEquals(fresh.findInParagraph(from, Token.RIGHT_BLOCK), cached.findInParagraph(from, Token.RIGHT_BLOCK), "paragraph from " + from);
            assertEquals(fresh.findAhead(from, Token.RIGHT_BLOCK), cached.findAhead(from, Token.RIGHT_BLOCK), "input from " + from);
        }
    }

    @Test
    void searchesFromLaterStarts_stopAtTheirOwnBoundary() {
        var context = context("[[ x\n]] [[ y\n\nz ]]");

        assertEquals(-1, context.findOnLine(0, Token.RIGHT_BLOCK));

        var first = context.findInParagraph(0, Token.RIGHT_BLOCK);
        assertTrue(first > 0);
        assertEquals(-1, context.findInParagraph(first, Token.RIGHT_BLOCK));

        var last = context.findAhead(first, Token.RIGHT_BLOCK);
        assertTrue(last > first);
        assertEquals(first, context.findAhead(0, Token.RIGHT_BLOCK));
    }

    @Test
    void blockEndLines_matchByNameAtLineStartOnly() {
        var context = context("[[code]]\nx [[/code]]\n[[/CODE]]\n[[/div]]");

        var end = context.findBlockEndLine(0, "code");

        assertTrue(end > 0);
        assertTrue(context.atLineStart(end));
        assertEquals("CODE", context.between(end, end + 2));
        assertEquals(-1, context.findBlockEndLine(end, "code"));
        assertTrue(context.findBlockEndLine(0, "div") > end);
    }
}
