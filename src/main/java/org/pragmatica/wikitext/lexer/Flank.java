package org.pragmatica.wikitext.lexer;

/**
 * Provisional role of a symmetric delimiter, computed from its neighbouring characters.
 *
 * <p>A delimiter is left-flanking when followed by non-whitespace and right-flanking when
 * preceded by non-whitespace. Start and end of input count as whitespace.
 */
public enum Flank {
    /**
     * Not a symmetric delimiter.
     */
    NONE,
    LEFT,
    RIGHT,
    BOTH,
    ISOLATED;

    public static Flank of(boolean leftFlanking, boolean rightFlanking) {
        if (leftFlanking && rightFlanking) {
            return BOTH;
        }
        if (leftFlanking) {
            return LEFT;
        }
        return rightFlanking ? RIGHT : ISOLATED;
    }

    public boolean canOpen() {
        return this == LEFT || this == BOTH;
    }

    public boolean canClose() {
        return this == RIGHT || this == BOTH;
    }
}
