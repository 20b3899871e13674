package org.pragmatica.wikitext.parser;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Parser for block arguments, {@code key="value" other='value' flag=bare}.
 *
 * <p>Keys are lower-cased. Quoted values support backslash escapes. Anything that is not a
 * well-formed pair is skipped.
 */
public final class BlockArguments {
    private final String input;
    private int pos;

    private BlockArguments(String input) {
        this.input = input;
        this.pos = 0;
    }

    public static Map<String, String> parse(String input) {
        return new BlockArguments(input).parseAll();
    }

    /**
     * Split a block header into its lower-cased name and the remaining argument text.
     */
    public static String[] splitName(String header) {
        var trimmed = header.strip();
        int end = 0;
        while (end < trimmed.length() && !Character.isWhitespace(trimmed.charAt(end))) {
            end++;
        }
        return new String[]{trimmed.substring(0, end).toLowerCase(Locale.ROOT), trimmed.substring(end)};
    }

    private Map<String, String> parseAll() {
        var arguments = new LinkedHashMap<String, String>();
        while (!isAtEnd()) {
            skipWhitespace();
            if (isAtEnd()) {
                break;
            }
            var key = scanKey();
            if (key.isEmpty()) {
                advance();
                continue;
            }
            skipWhitespace();
            if (isAtEnd() || peek() != '=') {
                continue;
            }
            advance();
            skipWhitespace();
            if (isAtEnd()) {
                break;
            }
            arguments.put(key.toLowerCase(Locale.ROOT), scanValue());
        }
        return arguments;
    }

    private String scanKey() {
        var start = pos;
        while (!isAtEnd() && isKeyPart(peek())) {
            advance();
        }
        return input.substring(start, pos);
    }

    private String scanValue() {
        char c = peek();
        if (c != '"' && c != '\'') {
            var start = pos;
            while (!isAtEnd() && !Character.isWhitespace(peek())) {
                advance();
            }
            return input.substring(start, pos);
        }
        char quote = advance();
        var sb = new StringBuilder();
        while (!isAtEnd() && peek() != quote) {
            if (peek() == '\\' && pos + 1 < input.length()) {
                advance();
                // skip backslash
                sb.append(scanEscapeSequence());
            } else {
                sb.append(advance());
            }
        }
        if (!isAtEnd()) {
            advance();
            // skip closing quote
        }
        return sb.toString();
    }

    private char scanEscapeSequence() {
        char c = advance();
        return switch (c) {
            case 'n' -> '\n';
            case 'r' -> '\r';
            case 't' -> '\t';
            case '0' -> '\0';
            default -> c;
        };
    }

    // Helper methods

    private boolean isAtEnd() {
        return pos >= input.length();
    }

    private char peek() {
        return input.charAt(pos);
    }

    private char advance() {
        return input.charAt(pos++);
    }

    private void skipWhitespace() {
        while (!isAtEnd() && Character.isWhitespace(peek())) {
            advance();
        }
    }

    private static boolean isKeyPart(char c) {
        return Character.isLetterOrDigit(c) || c == '_' || c == '-';
    }
}
