package org.kumeo.dsl.tree;

/**
 * A range in source text from start (inclusive) to end (exclusive).
 */
public record SourceSpan(SourceLocation start, SourceLocation end) {

    public static final SourceSpan NONE = new SourceSpan(SourceLocation.START, SourceLocation.START);

    public static SourceSpan of(SourceLocation start, SourceLocation end) {
        return new SourceSpan(start, end);
    }

    public static SourceSpan at(SourceLocation location) {
        return new SourceSpan(location, location);
    }

    @Override
    public String toString() {
        return start + "-" + end;
    }
}
