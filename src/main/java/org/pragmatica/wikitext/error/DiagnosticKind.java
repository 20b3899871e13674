package org.pragmatica.wikitext.error;

/**
 * Kinds of anomalies the tree builder recovers from.
 */
public enum DiagnosticKind {
    /**
     * A closing marker with no matching open construct. The marker becomes literal text.
     */
    UNMATCHED_CLOSING_MARKER("W001", "unmatched-closing-marker"),
    /**
     * A construct with an explicit closing marker was closed at a block boundary or end of input instead.
     */
    UNCLOSED_BLOCK_AUTO_CLOSED("W002", "unclosed-block-auto-closed"),
    /**
     * A lookahead construct (link, raw, colour, block) was incomplete. Its opening marker became literal text.
     */
    MALFORMED_CONSTRUCT_DEGRADED_TO_TEXT("W003", "malformed-construct-degraded-to-text"),
    DEPRECATED_CONSTRUCT_USED("W004", "deprecated-construct-used");

    private final String code;
    private final String tag;

    DiagnosticKind(String code, String tag) {
        this.code = code;
        this.tag = tag;
    }

    public String code() {
        return code;
    }

    public String tag() {
        return tag;
    }
}
