package org.pragmatica.wikitext.preprocess;

import java.util.List;
import java.util.regex.Pattern;

/**
 * Whitespace, comment and quote normalization run before typography.
 *
 * <p>Comments go first so that typography never sees the dashes of {@code [!--} and {@code --]}.
 * Quote prefixes are rewritten before typography turns {@code >>} into a guillemet.
 */
public final class MiscSubstitutions {
    private MiscSubstitutions() {}

    public static final Replacer COMMENTS = Replacer.regex("comments", Pattern.compile("\\[!--.*?--\\]", Pattern.DOTALL), "");

    public static final List<Replacer> PASSES = List.of(
        COMMENTS,
        Replacer.literal("dos-newlines", "\r\n", "\n"),
        Replacer.literal("mac-newlines", "\r", "\n"),
        Replacer.regex("whitespace-lines", Pattern.compile("^[ \\t\\f\\u000B]+$", Pattern.MULTILINE), ""),
        Replacer.repeated(Replacer.literal("line-continuation", "\\\n", "")),
        Replacer.literal("tabs", "\t", "    "),
        QuoteBlocks.PASS,
        Replacer.regex("compress-newlines", Pattern.compile("\\n{3,}"), "\n\n"),
        Replacer.regex("leading-newlines", Pattern.compile("\\A\\n+"), ""),
        Replacer.regex("trailing-newlines", Pattern.compile("\\n+\\z"), "")
    );
}
