package org.pragmatica.wikitext.lexer;

import java.util.List;
import java.util.regex.Pattern;

/**
 * One entry of the scanner's rule table.
 *
 * @param firstChars characters a match can start with, used to skip rules cheaply
 */
public record ScanRule(Token token, Pattern pattern, String firstChars, Constraint constraint) {

    public enum Constraint {
        NONE,
        /**
         * Match only at the start of input or right after a newline.
         */
        LINE_START,
        /**
         * Match only when not preceded by a letter or digit.
         */
        WORD_BOUNDARY
    }

    private static final String ALPHANUMERIC = "ABCDEFGHIJKLMNOPQRSTUVWXYZabcdefghijklmnopqrstuvwxyz0123456789";

    public static ScanRule rule(Token token, String regex, String firstChars) {
        return new ScanRule(token, Pattern.compile(regex), firstChars, Constraint.NONE);
    }

    public static ScanRule lineStart(Token token, String regex, String firstChars) {
        return new ScanRule(token, Pattern.compile(regex), firstChars, Constraint.LINE_START);
    }

    public static ScanRule wordBoundary(Token token, String regex, String firstChars) {
        return new ScanRule(token, Pattern.compile(regex), firstChars, Constraint.WORD_BOUNDARY);
    }

    /**
     * Rule table in priority order. On equal match length the earlier rule wins.
     */
    public static final List<ScanRule> RULES = List.of(
        rule(Token.LEFT_COMMENT, "\\[!--", "["),
        rule(Token.RIGHT_COMMENT, "--\\]", "-"),
        rule(Token.LEFT_LINK, "\\[\\[\\[", "["),
        rule(Token.RIGHT_LINK, "\\]\\]\\]", "]"),
        rule(Token.LEFT_BLOCK_END, "\\[\\[/", "["),
        rule(Token.LEFT_BLOCK, "\\[\\[", "["),
        rule(Token.RIGHT_BLOCK, "\\]\\]", "]"),
        rule(Token.LEFT_BRACKET, "\\[", "["),
        rule(Token.RIGHT_BRACKET, "\\]", "]"),
        rule(Token.TABLE_COLUMN_TITLE, "\\|\\|~", "|"),
        rule(Token.TABLE_COLUMN, "\\|\\|", "|"),
        rule(Token.PIPE, "\\|", "|"),
        lineStart(Token.HEADING, "\\+{1,6} ", "+"),
        lineStart(Token.BULLET_ITEM, " *\\* ", " *"),
        lineStart(Token.NUMBERED_ITEM, " *# ", " #"),
        lineStart(Token.HORIZONTAL_RULE, "-{4,}(?=\\n|\\z)", "-"),
        rule(Token.BOLD, "\\*\\*", "*"),
        rule(Token.ITALICS, "//", "/"),
        rule(Token.UNDERLINE, "__", "_"),
        rule(Token.STRIKETHROUGH, "--", "-"),
        rule(Token.SUPERSCRIPT, "\\^\\^", "^"),
        rule(Token.SUBSCRIPT, ",,", ","),
        rule(Token.LEFT_MONOSPACE, "\\{\\{", "{"),
        rule(Token.RIGHT_MONOSPACE, "\\}\\}", "}"),
        rule(Token.COLOR, "##", "#"),
        rule(Token.RAW, "@@", "@"),
        rule(Token.LEFT_RAW, "@<", "@"),
        rule(Token.RIGHT_RAW, ">@", ">"),
        wordBoundary(Token.URL, "(?:https?|ftp)://[^\\s\\[\\]|]+", "hf"),
        wordBoundary(Token.EMAIL, "[A-Za-z0-9._%+-]++@(?:[A-Za-z0-9-]+\\.)+[A-Za-z]{2,}", ALPHANUMERIC),
        rule(Token.PARAGRAPH_BREAK, "\\n(?:[ \\t]*\\n)+", "\n"),
        rule(Token.LINE_BREAK, "\\n", "\n"),
        rule(Token.WHITESPACE, "[ \\t]+", " \t")
    );

    public boolean canStartWith(char c) {
        return firstChars.indexOf(c) >= 0;
    }

    /**
     * Length of the match at the given position, or -1 if the rule does not apply there.
     */
    public int matchLength(String text, int pos) {
        if (!constraintHolds(text, pos)) {
            return -1;
        }
        var matcher = pattern.matcher(text)
                             .region(pos, text.length())
                             .useTransparentBounds(true)
                             .useAnchoringBounds(false);
        if (!matcher.lookingAt()) {
            return -1;
        }
        return matcher.end() - pos;
    }

    private boolean constraintHolds(String text, int pos) {
        return switch (constraint) {
            case NONE -> true;
            case LINE_START -> pos == 0 || text.charAt(pos - 1) == '\n';
            case WORD_BOUNDARY -> pos == 0 || !Character.isLetterOrDigit(text.charAt(pos - 1));
        };
    }
}
