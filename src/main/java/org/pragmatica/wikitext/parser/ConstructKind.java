package org.pragmatica.wikitext.parser;

/**
 * Kinds of construct the tree builder keeps on its stack while they are open.
 */
public enum ConstructKind {
    DOCUMENT("document", Role.BLOCK_CONTAINER, false),
    PARAGRAPH("paragraph", Role.INLINE_HOST, false),
    HEADING("heading", Role.INLINE_HOST, false),
    LIST("list", Role.STRUCTURAL, false),
    LIST_ITEM("list item", Role.INLINE_HOST, false),
    TABLE("table", Role.STRUCTURAL, false),
    TABLE_ROW("table row", Role.STRUCTURAL, false),
    TABLE_CELL("table cell", Role.INLINE_HOST, true),
    FORMAT("formatting span", Role.INLINE_SPAN, true),
    COLOR("color span", Role.INLINE_SPAN, true),
    DIV("div block", Role.BLOCK_CONTAINER, true),
    SPAN("span block", Role.INLINE_HOST, true);

    private enum Role {
        BLOCK_CONTAINER,
        STRUCTURAL,
        INLINE_HOST,
        INLINE_SPAN
    }

    private final String description;
    private final Role role;
    private final boolean explicitCloser;

    ConstructKind(String description, Role role, boolean explicitCloser) {
        this.description = description;
        this.role = role;
        this.explicitCloser = explicitCloser;
    }

    public String description() {
        return description;
    }

    /**
     * Holds block-level children: the document and {@code div} containers.
     */
    public boolean blockContainer() {
        return role == Role.BLOCK_CONTAINER;
    }

    /**
     * Accepts inline children directly.
     */
    public boolean inline() {
        return role == Role.INLINE_HOST || role == Role.INLINE_SPAN;
    }

    /**
     * Formatting and colour spans, closed by a matching delimiter.
     */
    public boolean inlineSpan() {
        return role == Role.INLINE_SPAN;
    }

    /**
     * Constructs written with a closing marker. Closing one without its marker is reported.
     */
    public boolean explicitCloser() {
        return explicitCloser;
    }
}
