package org.pragmatica.wikitext.include;

/**
 * Outcome of resolving one include target.
 */
public sealed interface Resolution {

    static Resolution resolved(String text) {
        return new Resolved(text);
    }

    static Resolution notFound(PageRef page) {
        return new Unresolved(new ResolutionError.NotFound(page));
    }

    static Resolution failed(ResolutionError error) {
        return new Unresolved(error);
    }

    record Resolved(String text) implements Resolution {}

    record Unresolved(ResolutionError error) implements Resolution {}
}
