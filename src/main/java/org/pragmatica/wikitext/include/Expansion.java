package org.pragmatica.wikitext.include;

import java.util.List;

/**
 * Text with its include directives expanded, and the pages that were included into it.
 *
 * @param text  expanded text
 * @param pages every page whose text was included, in the order resolved, nested includes
 *              included; a page included twice appears twice
 */
public record Expansion(String text, List<PageRef> pages) {
    public Expansion {
        pages = List.copyOf(pages);
    }
}
