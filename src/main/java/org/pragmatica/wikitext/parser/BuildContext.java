package org.pragmatica.wikitext.parser;

import org.pragmatica.wikitext.error.Diagnostic;
import org.pragmatica.wikitext.error.DiagnosticKind;
import org.pragmatica.wikitext.lexer.ExtractedToken;
import org.pragmatica.wikitext.lexer.Token;
import org.pragmatica.wikitext.lexer.Tokenization;
import org.pragmatica.wikitext.tree.SourceSpan;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Per-call state of the tree builder: the token sequence with lookahead helpers and the
 * diagnostics collected so far.
 *
 * <p>Lookahead searches remember their last answer per token kind and scope. A later search that
 * starts inside the range already scanned reuses it, so runs of unclosed openers cost linear time.
 */
public final class BuildContext {
    private enum Scope {
        LINE,
        PARAGRAPH,
        INPUT;

        boolean stopsAt(Token token) {
            return switch (this) {
                case LINE -> token.newline();
                case PARAGRAPH -> token == Token.PARAGRAPH_BREAK || token == Token.INPUT_END;
                case INPUT -> false;
            };
        }
    }

    /**
     * Searches starting at any index in {@code [from, until)} yield {@code result}.
     */
    private record Lookup(int from, int until, int result) {
        boolean covers(int start) {
            return start >= from && start < until;
        }
    }

    private final Tokenization tokenization;
    private final String text;
    private final List<Diagnostic> diagnostics = new ArrayList<>();
    private final Map<Scope, Map<Token, Lookup>> lookups = new EnumMap<>(Scope.class);
    private Map<String, List<Integer>> blockEnds;

    private BuildContext(Tokenization tokenization) {
        this.tokenization = tokenization;
        this.text = tokenization.text();
    }

    public static BuildContext create(Tokenization tokenization) {
        return new BuildContext(tokenization);
    }

    // === Token Access ===

    public String text() {
        return text;
    }

    public int size() {
        return tokenization.size();
    }

    public ExtractedToken token(int index) {
        return tokenization.get(Math.min(index, tokenization.size() - 1));
    }

    public boolean is(int index, Token kind) {
        return token(index).is(kind);
    }

    /**
     * True if the token is the first one on its line.
     */
    public boolean atLineStart(int index) {
        if (index == 0) {
            return true;
        }
        var previous = token(index - 1).token();
        return previous == Token.LINE_BREAK || previous == Token.PARAGRAPH_BREAK;
    }

    /**
     * Index of the next token of the given kind on the same line, or -1.
     */
    public int findOnLine(int from, Token kind) {
        return find(from, kind, Scope.LINE);
    }

    /**
     * Index of the next token of the given kind before the next paragraph break, or -1.
     */
    public int findInParagraph(int from, Token kind) {
        return find(from, kind, Scope.PARAGRAPH);
    }

    /**
     * Index of the next token of the given kind anywhere after {@code from}, or -1.
     */
    public int findAhead(int from, Token kind) {
        return find(from, kind, Scope.INPUT);
    }

    private int find(int from, Token kind, Scope scope) {
        var cache = lookups.computeIfAbsent(scope, key -> new EnumMap<>(Token.class));
        var known = cache.get(kind);
        if (known != null && known.covers(from)) {
            return known.result();
        }
        int i = from + 1;
        for (; i < size(); i++) {
            var current = token(i).token();
            if (current == kind) {
                cache.put(kind, new Lookup(from, i, i));
                return i;
            }
            if (scope.stopsAt(current)) {
                break;
            }
        }
        cache.put(kind, new Lookup(from, i, -1));
        return -1;
    }

    /**
     * Index of the first {@code [[/name]]} after {@code from} that starts a line, or -1.
     * Names compare case-insensitively.
     */
    public int findBlockEndLine(int from, String name) {
        if (blockEnds == null) {
            blockEnds = indexBlockEnds();
        }
        var candidates = blockEnds.getOrDefault(name.toLowerCase(Locale.ROOT), List.of());
        var position = Collections.binarySearch(candidates, from + 1);
        var index = position >= 0 ? position : -position - 1;
        return index < candidates.size() ? candidates.get(index) : -1;
    }

    private Map<String, List<Integer>> indexBlockEnds() {
        var index = new HashMap<String, List<Integer>>();
        for (int i = 0; i < size(); i++) {
            if (!is(i, Token.LEFT_BLOCK_END) || !atLineStart(i)) {
                continue;
            }
            var close = findOnLine(i, Token.RIGHT_BLOCK);
            if (close >= 0) {
                var name = between(i, close).strip().toLowerCase(Locale.ROOT);
                index.computeIfAbsent(name, key -> new ArrayList<>()).add(i);
            }
        }
        return index;
    }

    /**
     * Span from the start of one token to the end of another.
     */
    public SourceSpan spanOf(int first, int last) {
        return SourceSpan.of(token(first).span().start(), token(last).span().end());
    }

    /**
     * Source text strictly between two tokens.
     */
    public String between(int first, int last) {
        return text.substring(token(first).endOffset(), token(last).startOffset());
    }

    // === Diagnostics ===

    public void report(Diagnostic diagnostic) {
        diagnostics.add(diagnostic);
    }

    public void unmatchedCloser(SourceSpan span) {
        var marker = span.extract(text);
        report(Diagnostic.warning(DiagnosticKind.UNMATCHED_CLOSING_MARKER,
                                  "closing marker '" + marker + "' has no matching opener",
                                  span)
                         .withLabel("kept as text")
                         .withHelp("remove the marker or add the opening one"));
    }

    public void autoClosed(OpenConstruct construct, String boundary) {
        report(Diagnostic.warning(DiagnosticKind.UNCLOSED_BLOCK_AUTO_CLOSED,
                                  "unclosed " + construct.description() + " auto-closed at " + boundary,
                                  construct.opener())
                         .withLabel("opened here"));
    }

    public void degraded(SourceSpan span, String construct) {
        report(Diagnostic.warning(DiagnosticKind.MALFORMED_CONSTRUCT_DEGRADED_TO_TEXT,
                                  "malformed " + construct + " kept as text",
                                  span)
                         .withLabel("not recognized"));
    }

    public void deprecated(SourceSpan span, String message, String help) {
        report(Diagnostic.info(DiagnosticKind.DEPRECATED_CONSTRUCT_USED, message, span)
                         .withLabel("deprecated")
                         .withHelp(help));
    }

    /**
     * Diagnostics in document order. Reports at the same offset keep the order they were made in.
     */
    public List<Diagnostic> diagnostics() {
        var sorted = new ArrayList<>(diagnostics);
        sorted.sort(Comparator.comparingInt(d -> d.span().startOffset()));
        return List.copyOf(sorted);
    }
}
