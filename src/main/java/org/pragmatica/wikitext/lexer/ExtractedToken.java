package org.pragmatica.wikitext.lexer;

import org.pragmatica.wikitext.tree.SourceSpan;

/**
 * A token with the exact source slice it covers.
 *
 * @param flank provisional role for ambiguous delimiters, {@link Flank#NONE} otherwise
 */
public record ExtractedToken(Token token, String slice, SourceSpan span, Flank flank) {

    public static ExtractedToken of(Token token, String slice, SourceSpan span) {
        return new ExtractedToken(token, slice, span, Flank.NONE);
    }

    public boolean is(Token kind) {
        return token == kind;
    }

    public int startOffset() {
        return span.startOffset();
    }

    public int endOffset() {
        return span.endOffset();
    }

    @Override
    public String toString() {
        return token.tag() + "@" + span.start() + (flank == Flank.NONE ? "" : "[" + flank + "]");
    }
}
