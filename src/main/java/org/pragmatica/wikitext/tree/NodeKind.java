package org.pragmatica.wikitext.tree;

/**
 * Stable tag of every {@link WikiNode} variant.
 *
 * <p>Tags never change once published; serializers use {@link #tag()} as the discriminator
 * of a tagged-union encoding.
 */
public enum NodeKind {
    DOCUMENT("document"),
    PARAGRAPH("paragraph"),
    HEADING("heading"),
    LIST("list"),
    LIST_ITEM("list-item"),
    TABLE("table"),
    TABLE_ROW("table-row"),
    TABLE_CELL("table-cell"),
    FORMAT("format"),
    COLOR("color"),
    CONTAINER("container"),
    COLLAPSIBLE("collapsible"),
    FOOTNOTE("footnote"),
    FOOTNOTE_BLOCK("footnote-block"),
    LINK("link"),
    EMAIL("email"),
    TEXT("text"),
    LINE_BREAK("line-break"),
    HORIZONTAL_RULE("horizontal-rule"),
    RAW("raw"),
    CODE("code"),
    INCLUDE_PLACEHOLDER("include-placeholder"),
    UNRECOGNIZED("unrecognized");

    private final String tag;

    NodeKind(String tag) {
        this.tag = tag;
    }

    public String tag() {
        return tag;
    }

    /**
     * Leaf kinds never own children.
     */
    public boolean isLeaf() {
        return switch (this) {
            case LINK, EMAIL, TEXT, LINE_BREAK, HORIZONTAL_RULE, RAW, CODE, FOOTNOTE_BLOCK, INCLUDE_PLACEHOLDER, UNRECOGNIZED -> true;
            default -> false;
        };
    }
}
