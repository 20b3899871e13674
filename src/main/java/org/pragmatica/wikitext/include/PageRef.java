package org.pragmatica.wikitext.include;

import java.util.Locale;
import java.util.Objects;
import java.util.Optional;

/**
 * Reference to a page, optionally on another site: {@code page-name} or {@code :site:page-name}.
 */
public record PageRef(Optional<String> site, String page) {
    public PageRef {
        Objects.requireNonNull(site, "site");
        Objects.requireNonNull(page, "page");
    }

    public static PageRef pageOnly(String page) {
        return new PageRef(Optional.empty(), page);
    }

    public static PageRef pageAndSite(String site, String page) {
        return new PageRef(Optional.of(site), page);
    }

    /**
     * Parse the written form. A leading {@code :site:} prefix selects another site;
     * a malformed prefix is kept as part of the page name.
     */
    public static PageRef parse(String text) {
        var trimmed = text.trim();
        if (trimmed.startsWith(":")) {
            int close = trimmed.indexOf(':', 1);
            if (close > 1 && close < trimmed.length() - 1) {
                return pageAndSite(trimmed.substring(1, close), trimmed.substring(close + 1));
            }
        }
        return pageOnly(trimmed);
    }

    /**
     * Case-insensitive identity used to detect include cycles.
     */
    public String key() {
        return toString().toLowerCase(Locale.ROOT);
    }

    @Override
    public String toString() {
        return site.map(s -> ":" + s + ":" + page)
                   .orElse(page);
    }
}
