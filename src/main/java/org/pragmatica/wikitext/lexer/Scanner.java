package org.pragmatica.wikitext.lexer;

import org.pragmatica.wikitext.tree.SourceLocation;
import org.pragmatica.wikitext.tree.SourceSpan;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Rule-table driven scanner for wikitext.
 *
 * <p>Scanning is total: every character belongs to exactly one token, characters that start no
 * rule are gathered into {@link Token#TEXT} runs, and the output always ends with a zero-length
 * {@link Token#INPUT_END}.
 */
public final class Scanner {
    private static final Logger log = LoggerFactory.getLogger(Scanner.class);
    private static final int DEFAULT_TOKEN_CAPACITY = 64;

    private final String input;
    private final List<ScanRule> rules;
    private int pos;
    private int line;
    private int column;

    private Scanner(String input, List<ScanRule> rules) {
        this.input = input;
        this.rules = rules;
        this.pos = 0;
        this.line = 1;
        this.column = 1;
    }

    public static Tokenization tokenize(String input) {
        return tokenize(input, ScanRule.RULES);
    }

    public static Tokenization tokenize(String input, List<ScanRule> rules) {
        Objects.requireNonNull(input, "input");
        Objects.requireNonNull(rules, "rules");
        log.debug("Tokenizing {} chars", input.length());
        var tokenization = new Scanner(input, rules).tokenizeAll();
        log.debug("Produced {} tokens", tokenization.size());
        return tokenization;
    }

    private Tokenization tokenizeAll() {
        var tokens = new ArrayList<ExtractedToken>(Math.max(DEFAULT_TOKEN_CAPACITY, input.length() / 4));
        var textStart = -1;
        var textLocation = SourceLocation.START;
        while (!isAtEnd()) {
            var rule = longestMatch();
            if (rule == null) {
                if (textStart < 0) {
                    textStart = pos;
                    textLocation = currentLocation();
                }
                advance();
                continue;
            }
            if (textStart >= 0) {
                tokens.add(emit(Token.TEXT, textLocation, Flank.NONE));
                textStart = -1;
            }
            tokens.add(scan(rule.token(), rule.length()));
        }
        if (textStart >= 0) {
            tokens.add(emit(Token.TEXT, textLocation, Flank.NONE));
        }
        tokens.add(ExtractedToken.of(Token.INPUT_END, "", SourceSpan.at(currentLocation())));
        return new Tokenization(input, tokens);
    }

    private record Match(Token token, int length) {}

    private Match longestMatch() {
        char c = peek();
        Match best = null;
        for (var rule : rules) {
            if (!rule.canStartWith(c)) {
                continue;
            }
            var length = rule.matchLength(input, pos);
            if (length > 0 && (best == null || length > best.length())) {
                best = new Match(rule.token(), length);
            }
        }
        return best;
    }

    private ExtractedToken scan(Token token, int length) {
        var start = currentLocation();
        var before = pos;
        var leftNeighbour = before > 0 ? input.charAt(before - 1) : ' ';
        for (int i = 0; i < length; i++) {
            advance();
        }
        var rightNeighbour = isAtEnd() ? ' ' : peek();
        var flank = token.ambiguous()
                    ? Flank.of(!Character.isWhitespace(rightNeighbour), !Character.isWhitespace(leftNeighbour))
                    : Flank.NONE;
        return emit(token, start, flank);
    }

    private ExtractedToken emit(Token token, SourceLocation start, Flank flank) {
        var span = SourceSpan.of(start, currentLocation());
        var extracted = new ExtractedToken(token, span.extract(input), span, flank);
        if (log.isTraceEnabled()) {
            log.trace("Token {} '{}'", extracted, escape(extracted.slice()));
        }
        return extracted;
    }

    // Helper methods

    private boolean isAtEnd() {
        return pos >= input.length();
    }

    private char peek() {
        return input.charAt(pos);
    }

    private char advance() {
        char c = input.charAt(pos++);
        if (c == '\n') {
            line++;
            column = 1;
        } else {
            column++;
        }
        return c;
    }

    private SourceLocation currentLocation() {
        return SourceLocation.at(line, column, pos);
    }

    private static String escape(String slice) {
        return slice.replace("\n", "\\n")
                    .replace("\t", "\\t");
    }
}
