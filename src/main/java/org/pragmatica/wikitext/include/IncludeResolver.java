package org.pragmatica.wikitext.include;

import java.util.Map;

/**
 * Caller-supplied capability mapping an include target to its text.
 *
 * <p>Called synchronously, possibly many times for the same page. Implementations need not be
 * idempotent or thread-safe; cycle detection is done by the caller of this interface.
 */
@FunctionalInterface
public interface IncludeResolver {

    Resolution resolve(PageRef page);

    /**
     * Resolver that never finds anything.
     */
    static IncludeResolver none() {
        return Resolution::notFound;
    }

    /**
     * Resolver backed by a fixed map of page name to text. Lookups ignore the site prefix.
     */
    static IncludeResolver fromMap(Map<String, String> pages) {
        var copy = Map.copyOf(pages);
        return page -> {
            var text = copy.get(page.page());
            return text == null
                   ? Resolution.notFound(page)
                   : Resolution.resolved(text);
        };
    }
}
