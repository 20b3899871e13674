package org.pragmatica.wikitext.include;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A parsed include directive: the page to include and the variables passed to it.
 */
public record IncludeRef(PageRef page, Map<String, String> variables) {
    public IncludeRef {
        variables = Collections.unmodifiableMap(new LinkedHashMap<>(variables));
    }
}
