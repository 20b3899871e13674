package org.pragmatica.wikitext.error;

import org.pragmatica.wikitext.tree.SourceSpan;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Non-fatal diagnostic for Rust-style lint output.
 *
 * <p>Example output:
 * <pre>
 * warning[W002]: unclosed bold span auto-closed at end of paragraph
 *   --> page.wiki:3:1
 *    |
 *  3 | **never closed
 *    | ^^ opened here
 *    |
 * </pre>
 *
 * @param severity Severity level, never a failure
 * @param kind     What was recovered from
 * @param message  Primary message
 * @param span     Source span the diagnostic refers to
 * @param labels   Additional labeled spans for context
 * @param notes    Additional notes or suggestions
 */
public record Diagnostic(
    Severity severity,
    DiagnosticKind kind,
    String message,
    SourceSpan span,
    List<Label> labels,
    List<String> notes
) {
    public Diagnostic {
        labels = List.copyOf(labels);
        notes = List.copyOf(notes);
    }

    /**
     * Severity levels. None of them means the parse failed.
     */
    public enum Severity {
        WARNING("warning"),
        INFO("info"),
        HINT("hint");

        private final String display;

        Severity(String display) {
            this.display = display;
        }

        public String display() {
            return display;
        }
    }

    /**
     * A labeled span providing additional context.
     *
     * @param span    Source span for this label
     * @param message Label message
     * @param primary Whether this is the primary label (shown with ^^^)
     */
    public record Label(SourceSpan span, String message, boolean primary) {
        public static Label primary(SourceSpan span, String message) {
            return new Label(span, message, true);
        }

        public static Label secondary(SourceSpan span, String message) {
            return new Label(span, message, false);
        }
    }

    public static Diagnostic warning(DiagnosticKind kind, String message, SourceSpan span) {
        return new Diagnostic(Severity.WARNING, kind, message, span, List.of(), List.of());
    }

    public static Diagnostic info(DiagnosticKind kind, String message, SourceSpan span) {
        return new Diagnostic(Severity.INFO, kind, message, span, List.of(), List.of());
    }

    public String code() {
        return kind.code();
    }

    public Diagnostic withLabel(String message) {
        var newLabels = new ArrayList<>(labels);
        newLabels.add(Label.primary(span, message));
        return new Diagnostic(severity, kind, this.message, span, newLabels, notes);
    }

    public Diagnostic withSecondaryLabel(SourceSpan labelSpan, String message) {
        var newLabels = new ArrayList<>(labels);
        newLabels.add(Label.secondary(labelSpan, message));
        return new Diagnostic(severity, kind, this.message, span, newLabels, notes);
    }

    public Diagnostic withNote(String note) {
        var newNotes = new ArrayList<>(notes);
        newNotes.add(note);
        return new Diagnostic(severity, kind, message, span, labels, newNotes);
    }

    public Diagnostic withHelp(String help) {
        return withNote("help: " + help);
    }

    /**
     * Format this diagnostic in Rust style: header, location, the affected source lines with
     * underlines, then notes.
     *
     * @param source   The preprocessed source text
     * @param filename Optional filename for display
     * @return Formatted diagnostic string
     */
    public String format(String source, String filename) {
        var lines = source.split("\n", -1);
        var firstLine = labels.stream()
                              .mapToInt(label -> label.span().start().line())
                              .reduce(span.start().line(), Math::min);
        var lastLine = labels.stream()
                             .mapToInt(label -> label.span().end().line())
                             .reduce(span.end().line(), Math::max);
        var gutter = " ".repeat(String.valueOf(lastLine).length());

        var sb = new StringBuilder();
        sb.append(severity.display()).append('[').append(code()).append("]: ").append(message).append('\n');
        sb.append("  --> ");
        if (filename != null) {
            sb.append(filename).append(':');
        }
        sb.append(span.start()).append('\n');

        sb.append(gutter).append(" |\n");
        for (int line = Math.max(1, firstLine); line <= Math.min(lastLine, lines.length); line++) {
            var content = lines[line - 1];
            sb.append(String.format("%" + gutter.length() + "d | ", line)).append(content).append('\n');
            var onLine = labelsOnLine(line);
            if (!onLine.isEmpty()) {
                sb.append(gutter).append(" | ").append(underlines(line, content, onLine)).append('\n');
            }
        }
        sb.append(gutter).append(" |\n");

        notes.forEach(note -> sb.append(gutter).append(" = ").append(note).append('\n'));
        return sb.toString();
    }

    /**
     * Labels touching the given line. Without explicit labels the diagnostic span itself is underlined.
     */
    private List<Label> labelsOnLine(int line) {
        var candidates = labels.isEmpty()
                         ? List.of(Label.primary(span, ""))
                         : labels;
        return candidates.stream()
                         .filter(label -> label.span().start().line() <= line && line <= label.span().end().line())
                         .sorted(Comparator.comparingInt(label -> label.span().start().column()))
                         .toList();
    }

    private static String underlines(int line, String content, List<Label> onLine) {
        var sb = new StringBuilder();
        int column = 1;
        for (var label : onLine) {
            var from = label.span().start().line() == line ? label.span().start().column() : 1;
            var to = label.span().end().line() == line ? label.span().end().column() : content.length() + 1;
            if (column < from) {
                sb.append(" ".repeat(from - column));
                column = from;
            }
            var width = Math.max(1, to - from);
            sb.append(String.valueOf(label.primary() ? '^' : '-').repeat(width));
            column += width;
            if (!label.message().isEmpty()) {
                sb.append(' ').append(label.message());
            }
        }
        return sb.toString();
    }

    /**
     * Single-line format, {@code input:3:1: warning[W002]: message}.
     */
    public String formatSimple(String filename) {
        var loc = span.start();
        return String.format("%s:%d:%d: %s[%s]: %s",
            filename, loc.line(), loc.column(), severity.display(), code(), message);
    }
}
