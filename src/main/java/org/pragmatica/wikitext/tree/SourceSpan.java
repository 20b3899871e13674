package org.pragmatica.wikitext.tree;

/**
 * A half-open range in the preprocessed source text, from start (inclusive) to end (exclusive).
 */
public record SourceSpan(SourceLocation start, SourceLocation end) {

    public static SourceSpan of(SourceLocation start, SourceLocation end) {
        return new SourceSpan(start, end);
    }

    public static SourceSpan at(SourceLocation location) {
        return new SourceSpan(location, location);
    }

    public int startOffset() {
        return start.offset();
    }

    public int endOffset() {
        return end.offset();
    }

    public int length() {
        return end.offset() - start.offset();
    }

    public boolean isEmpty() {
        return length() == 0;
    }

    public String extract(String source) {
        return source.substring(start.offset(), end.offset());
    }

    public SourceSpan merge(SourceSpan other) {
        var newStart = start.offset() <= other.start.offset() ? start : other.start;
        var newEnd = end.offset() >= other.end.offset() ? end : other.end;
        return new SourceSpan(newStart, newEnd);
    }

    /**
     * Same start, new end. Used when an open construct grows as tokens are consumed.
     */
    public SourceSpan extendTo(SourceLocation newEnd) {
        return newEnd.offset() > end.offset()
               ? new SourceSpan(start, newEnd)
               : this;
    }

    public boolean contains(SourceSpan other) {
        return start.offset() <= other.start.offset() && other.end.offset() <= end.offset();
    }

    @Override
    public String toString() {
        return start + "-" + end;
    }
}
