package org.pragmatica.wikitext.preprocess;

import java.util.List;
import java.util.regex.Pattern;

/**
 * Typographic quotes, guillemets and ellipses.
 *
 * <p>Double quotes run before single quotes, otherwise {@code ``x''} would be read as two single-quoted runs.
 */
public final class Typography {
    private Typography() {}

    public static final List<Replacer> PASSES = List.of(
        Replacer.surround("double-quotes", Pattern.compile("``(.*?)''"), "“", "”"),
        Replacer.surround("low-double-quotes", Pattern.compile(",,(.*?)''"), "„", "”"),
        Replacer.surround("single-quotes", Pattern.compile("`(.*?)'"), "‘", "’"),
        Replacer.literal("left-guillemet", "<<", "«"),
        Replacer.literal("right-guillemet", ">>", "»"),
        Replacer.regex("ellipsis", Pattern.compile("\\.\\.\\.|\\. \\. \\."), "…")
    );
}
