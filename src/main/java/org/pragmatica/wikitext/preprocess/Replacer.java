package org.pragmatica.wikitext.preprocess;

import java.util.function.Function;
import java.util.regex.MatchResult;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * A single text rewrite applied by the preprocessor.
 */
public sealed interface Replacer {
    /**
     * Short name used in trace logging.
     */
    String name();

    String apply(String text);

    static Replacer literal(String name, String pattern, String replacement) {
        return new Literal(name, pattern, replacement);
    }

    static Replacer regex(String name, Pattern pattern, String replacement) {
        return new RegexReplace(name, pattern, replacement);
    }

    static Replacer surround(String name, Pattern pattern, String begin, String end) {
        return new RegexSurround(name, pattern, begin, end);
    }

    static Replacer computed(String name, Pattern pattern, Function<MatchResult, String> replacement) {
        return new Computed(name, pattern, replacement);
    }

    /**
     * Apply a pass until the text stops changing. The pass must shorten the text whenever it changes it.
     */
    static Replacer repeated(Replacer pass) {
        return new Repeated(pass);
    }

    /**
     * Replace every occurrence of a fixed string.
     */
    record Literal(String name, String pattern, String replacement) implements Replacer {
        @Override
        public String apply(String text) {
            return text.replace(pattern, replacement);
        }
    }

    /**
     * Replace every match of a pattern with a fixed string.
     */
    record RegexReplace(String name, Pattern pattern, String replacement) implements Replacer {
        @Override
        public String apply(String text) {
            return pattern.matcher(text)
                          .replaceAll(Matcher.quoteReplacement(replacement));
        }
    }

    /**
     * Replace the delimiters around the first capture group, keeping the group itself.
     */
    record RegexSurround(String name, Pattern pattern, String begin, String end) implements Replacer {
        @Override
        public String apply(String text) {
            return pattern.matcher(text)
                          .replaceAll(match -> Matcher.quoteReplacement(begin + match.group(1) + end));
        }
    }

    /**
     * Replace every match with a value computed from the match. A {@code null} result keeps the match verbatim.
     */
    record Computed(String name, Pattern pattern, Function<MatchResult, String> replacement) implements Replacer {
        @Override
        public String apply(String text) {
            return pattern.matcher(text)
                          .replaceAll(match -> {
                              var value = replacement.apply(match);
                              return Matcher.quoteReplacement(value == null ? match.group() : value);
                          });
        }
    }

    /**
     * Reapply a pass while it keeps changing the text, so rewrites that expose new matches are also applied.
     */
    record Repeated(Replacer pass) implements Replacer {
        @Override
        public String name() {
            return pass.name();
        }

        @Override
        public String apply(String text) {
            var current = text;
            while (true) {
                var rewritten = pass.apply(current);
                if (rewritten.length() >= current.length()) {
                    return rewritten;
                }
                current = rewritten;
            }
        }
    }
}
