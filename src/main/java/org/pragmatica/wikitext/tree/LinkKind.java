package org.pragmatica.wikitext.tree;

/**
 * Source syntax a {@link WikiNode.Link} was written in.
 */
public enum LinkKind {
    /**
     * A bare URL in running text.
     */
    BARE,
    /**
     * {@code [url label]}.
     */
    SINGLE_BRACKET,
    /**
     * {@code [[[page | label]]]}.
     */
    TRIPLE_BRACKET,
    /**
     * {@code [#anchor label]}, a jump within the page.
     */
    ANCHOR
}
