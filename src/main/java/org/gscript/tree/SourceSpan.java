package org.gscript.tree;

/**
 * A range in script source from start (inclusive) to end (exclusive).
 */
public record SourceSpan(SourceLocation start, SourceLocation end) {

    public static final SourceSpan NONE = at(SourceLocation.START);

    public static SourceSpan of(SourceLocation start, SourceLocation end) {
        return new SourceSpan(start, end);
    }

    public static SourceSpan at(SourceLocation location) {
        return new SourceSpan(location, location);
    }

    public int line() {
        return start.line();
    }

    public int length() {
        return end.offset() - start.offset();
    }

    public String extract(String source) {
        return source.substring(start.offset(), end.offset());
    }

    @Override
    public String toString() {
        return start + "-" + end;
    }
}
