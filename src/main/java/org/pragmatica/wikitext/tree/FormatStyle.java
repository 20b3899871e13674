package org.pragmatica.wikitext.tree;

/**
 * Inline formatting applied by a {@link WikiNode.Format} span.
 */
public enum FormatStyle {
    BOLD("bold"),
    ITALICS("italics"),
    UNDERLINE("underline"),
    STRIKETHROUGH("strikethrough"),
    SUPERSCRIPT("superscript"),
    SUBSCRIPT("subscript"),
    MONOSPACE("monospace");

    private final String tag;

    FormatStyle(String tag) {
        this.tag = tag;
    }

    public String tag() {
        return tag;
    }
}
