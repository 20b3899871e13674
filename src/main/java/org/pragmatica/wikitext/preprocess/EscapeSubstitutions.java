package org.pragmatica.wikitext.preprocess;

import java.time.Clock;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.Map;
import java.util.regex.MatchResult;
import java.util.regex.Pattern;

/**
 * Character references and {@code {$name}} macros.
 *
 * <p>A reference that decodes to a markup character is emitted as angled raw text, {@code @<*>@},
 * so the decoded character stays literal. A literal {@code @} right before such a reference is
 * wrapped as well, otherwise it would pair with the opening {@code @<}. The closing {@code @} of a
 * preceding {@code >@} is left alone.
 */
public final class EscapeSubstitutions {
    private EscapeSubstitutions() {}

    private static final Pattern NUMERIC_REFERENCE = Pattern.compile("((?<!>)@)?&#(?:([0-9]{1,7})|[xX]([0-9A-Fa-f]{1,6}));");
    private static final Pattern NAMED_REFERENCE = Pattern.compile("((?<!>)@)?&([A-Za-z]+);");
    private static final Pattern MACRO = Pattern.compile("\\{\\$([A-Za-z0-9_-]+)\\}");

    /**
     * Characters that start or form a token in the scanner's rule table.
     */
    public static final String MARKUP_CHARACTERS = "*/_-^,#@[]{}|+~<>";

    private static final DateTimeFormatter TIME = DateTimeFormatter.ofPattern("HH:mm:ss");

    public static final Map<String, String> NAMED_ENTITIES = Map.ofEntries(
        Map.entry("amp", "&"),
        Map.entry("lt", "<"),
        Map.entry("gt", ">"),
        Map.entry("quot", "\""),
        Map.entry("apos", "'"),
        Map.entry("nbsp", " "),
        Map.entry("copy", "©"),
        Map.entry("reg", "®"),
        Map.entry("trade", "™"),
        Map.entry("mdash", "—"),
        Map.entry("ndash", "–"),
        Map.entry("hellip", "…")
    );

    /**
     * Passes for the given macros, with date and time macros read from the clock.
     * Caller macros override the built-in ones.
     */
    public static List<Replacer> passes(Map<String, String> macros, Clock clock) {
        return List.of(
            Replacer.computed("numeric-references", NUMERIC_REFERENCE, EscapeSubstitutions::numericReference),
            Replacer.computed("named-references", NAMED_REFERENCE, EscapeSubstitutions::namedReference),
            Replacer.computed("macros", MACRO, match -> macro(match.group(1), macros, clock))
        );
    }

    private static String numericReference(MatchResult match) {
        var codePoint = match.group(2) != null
                        ? Integer.parseInt(match.group(2))
                        : Integer.parseInt(match.group(3), 16);
        if (codePoint == 0 || !Character.isValidCodePoint(codePoint)
            || (codePoint >= Character.MIN_SURROGATE && codePoint <= Character.MAX_SURROGATE)) {
            return null;
        }
        return literal(match.group(1), new String(Character.toChars(codePoint)));
    }

    private static String namedReference(MatchResult match) {
        var decoded = NAMED_ENTITIES.get(match.group(2));
        return decoded == null ? null : literal(match.group(1), decoded);
    }

    /**
     * The decoded text, kept out of the scanner's reach when it is a markup character.
     */
    static String literal(String prefix, String decoded) {
        var at = prefix == null ? "" : prefix;
        if (decoded.length() != 1 || MARKUP_CHARACTERS.indexOf(decoded.charAt(0)) < 0) {
            return at + decoded;
        }
        var wrapped = "@<" + decoded + ">@";
        return at.isEmpty() ? wrapped : "@<" + at + ">@" + wrapped;
    }

    private static String macro(String name, Map<String, String> macros, Clock clock) {
        var value = macros.get(name);
        if (value != null) {
            return value;
        }
        return switch (name) {
            case "date" -> DateTimeFormatter.ISO_LOCAL_DATE.format(ZonedDateTime.now(clock));
            case "time" -> TIME.format(ZonedDateTime.now(clock));
            case "year" -> String.valueOf(ZonedDateTime.now(clock).getYear());
            default -> null;
        };
    }
}
