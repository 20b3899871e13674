package org.pragmatica.wikitext.lexer;

/**
 * Token kinds produced by the scanner.
 *
 * <p>Ambiguous kinds are symmetric delimiters whose role (open, close or literal) is decided later
 * by the tree builder from the token's {@link Flank}.
 */
public enum Token {
    LEFT_COMMENT("left-comment"),
    RIGHT_COMMENT("right-comment"),
    LEFT_LINK("left-link"),
    RIGHT_LINK("right-link"),
    LEFT_BLOCK_END("left-block-end"),
    LEFT_BLOCK("left-block"),
    RIGHT_BLOCK("right-block"),
    LEFT_BRACKET("left-bracket"),
    RIGHT_BRACKET("right-bracket"),
    PIPE("pipe"),
    TABLE_COLUMN("table-column"),
    TABLE_COLUMN_TITLE("table-column-title"),
    HEADING("heading"),
    BULLET_ITEM("bullet-item"),
    NUMBERED_ITEM("numbered-item"),
    HORIZONTAL_RULE("horizontal-rule"),
    BOLD("bold", true),
    ITALICS("italics", true),
    UNDERLINE("underline", true),
    STRIKETHROUGH("strikethrough", true),
    SUPERSCRIPT("superscript", true),
    SUBSCRIPT("subscript", true),
    LEFT_MONOSPACE("left-monospace"),
    RIGHT_MONOSPACE("right-monospace"),
    COLOR("color", true),
    RAW("raw"),
    LEFT_RAW("left-raw"),
    RIGHT_RAW("right-raw"),
    URL("url"),
    EMAIL("email"),
    LINE_BREAK("line-break"),
    PARAGRAPH_BREAK("paragraph-break"),
    WHITESPACE("whitespace"),
    TEXT("text"),
    INPUT_END("input-end");

    private final String tag;
    private final boolean ambiguous;

    Token(String tag) {
        this(tag, false);
    }

    Token(String tag, boolean ambiguous) {
        this.tag = tag;
        this.ambiguous = ambiguous;
    }

    /**
     * Stable kebab-case name.
     */
    public String tag() {
        return tag;
    }

    public boolean ambiguous() {
        return ambiguous;
    }

    /**
     * True for tokens that are only recognized at the start of a line.
     */
    public boolean lineStart() {
        return this == HEADING || this == BULLET_ITEM || this == NUMBERED_ITEM || this == HORIZONTAL_RULE;
    }

    public boolean newline() {
        return this == LINE_BREAK || this == PARAGRAPH_BREAK || this == INPUT_END;
    }
}
