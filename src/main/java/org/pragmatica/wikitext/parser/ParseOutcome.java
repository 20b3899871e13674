package org.pragmatica.wikitext.parser;

import org.pragmatica.wikitext.error.Diagnostic;
import org.pragmatica.wikitext.error.DiagnosticKind;
import org.pragmatica.wikitext.tree.WikiNode;

import java.util.List;

/**
 * Result of building a tree - the document together with every anomaly recovered from.
 *
 * <p>The tree is always complete. Diagnostics never change it; they only describe where the input
 * was malformed and how the builder recovered.
 *
 * @param tree        The document root
 * @param diagnostics Recovered anomalies in document order
 * @param source      The preprocessed text the spans refer to (for formatting diagnostics)
 */
public record ParseOutcome(
    WikiNode.Document tree,
    List<Diagnostic> diagnostics,
    String source
) {
    public ParseOutcome {
        diagnostics = List.copyOf(diagnostics);
    }

    /**
     * Check if the input was well formed.
     */
    public boolean isClean() {
        return diagnostics.isEmpty();
    }

    public boolean hasDiagnostics() {
        return !diagnostics.isEmpty();
    }

    /**
     * Format all diagnostics in Rust style.
     *
     * @param filename Optional filename for display
     * @return Formatted diagnostics string
     */
    public String formatDiagnostics(String filename) {
        if (diagnostics.isEmpty()) {
            return "";
        }
        var sb = new StringBuilder();
        for (var diag : diagnostics) {
            sb.append(diag.format(source, filename));
            sb.append("\n");
        }
        return sb.toString();
    }

    /**
     * Format all diagnostics with default filename "input".
     */
    public String formatDiagnostics() {
        return formatDiagnostics("input");
    }

    public int warningCount() {
        return count(Diagnostic.Severity.WARNING);
    }

    public int infoCount() {
        return count(Diagnostic.Severity.INFO);
    }

    public int count(Diagnostic.Severity severity) {
        return (int) diagnostics.stream()
            .filter(d -> d.severity() == severity)
            .count();
    }

    public List<Diagnostic> diagnosticsOf(DiagnosticKind kind) {
        return diagnostics.stream()
                          .filter(d -> d.kind() == kind)
                          .toList();
    }
}
