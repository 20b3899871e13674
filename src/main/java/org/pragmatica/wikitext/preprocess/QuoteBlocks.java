package org.pragmatica.wikitext.preprocess;

import java.util.regex.MatchResult;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Rewrites runs of {@code >}-prefixed lines into nested {@code [[quote]]} blocks.
 *
 * <p>The number of leading {@code >} sets the nesting depth of a line. Depth changes between
 * consecutive lines open or close blocks, and the run closes every block it opened. A line that
 * starts with {@code >@} closes angled raw text and is not a quote line.
 */
public final class QuoteBlocks {
    private QuoteBlocks() {}

    private static final Pattern QUOTE_RUN = Pattern.compile("^(?:>++(?!@) *+[^\\n]*+(?:\\n|\\z))+", Pattern.MULTILINE);
    private static final Pattern QUOTE_LINE = Pattern.compile("(>++) *+(.*)");

    public static final Replacer PASS = Replacer.computed("quote-blocks", QUOTE_RUN, QuoteBlocks::rewrite);

    static String rewrite(MatchResult run) {
        var sb = new StringBuilder(run.group().length() + 32);
        int depth = 0;
        for (var line : run.group().split("\n")) {
            Matcher matcher = QUOTE_LINE.matcher(line);
            if (!matcher.matches()) {
                continue;
            }
            var lineDepth = matcher.group(1).length();
            for (; depth < lineDepth; depth++) {
                sb.append("[[quote]]\n");
            }
            for (; depth > lineDepth; depth--) {
                sb.append("[[/quote]]\n");
            }
            sb.append(matcher.group(2)).append('\n');
        }
        for (; depth > 0; depth--) {
            sb.append("[[/quote]]\n");
        }
        return sb.toString();
    }
}
