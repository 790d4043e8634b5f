package org.kumeo.dsl.tree;

import java.util.Arrays;

/**
 * Maps offsets in a source string to line/column positions.
 *
 * <p>Line starts are collected once; each lookup is a binary search over them, so resolving
 * the location of every token does not rescan the source.
 */
public final class LineIndex {
    private final int[] lineStarts;
    private final int length;

    private LineIndex(int[] lineStarts, int length) {
        this.lineStarts = lineStarts;
        this.length = length;
    }

    public static LineIndex of(String source) {
        var starts = new int[16];
        int count = 0;
        starts[count++] = 0;
        for (int i = 0; i < source.length(); i++) {
            if (source.charAt(i) == '\n') {
                if (count == starts.length) {
                    starts = Arrays.copyOf(starts, count * 2);
                }
                starts[count++] = i + 1;
            }
        }
        return new LineIndex(Arrays.copyOf(starts, count), source.length());
    }

    /**
     * Location of the given offset. Offsets past the end are clamped to the end of input.
     */
    public SourceLocation locate(int offset) {
        int clamped = Math.max(0, Math.min(offset, length));
        int found = Arrays.binarySearch(lineStarts, clamped);
        int lineIdx = found >= 0 ? found : -found - 2;
        return SourceLocation.at(lineIdx + 1, clamped - lineStarts[lineIdx] + 1, clamped);
    }

    public SourceSpan span(int startOffset, int endOffset) {
        return SourceSpan.of(locate(startOffset), locate(endOffset));
    }
}
