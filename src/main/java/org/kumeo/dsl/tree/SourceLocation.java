package org.kumeo.dsl.tree;

/**
 * A position in source text. Line and column are 1-based, offset is the 0-based index into the source string.
 * Columns and offsets count UTF-16 code units, so a character outside the BMP counts twice.
 */
public record SourceLocation(int line, int column, int offset) {

    public static final SourceLocation START = new SourceLocation(1, 1, 0);

    public static SourceLocation at(int line, int column, int offset) {
        return new SourceLocation(line, column, offset);
    }

    @Override
    public String toString() {
        return line + ":" + column;
    }
}
