package com.github.rewrite.solidity.tree;

import lombok.Value;

/**
 * A half-open span {@code [start, end)} of character offsets into a source text.
 */
@Value
public class TextRange {
    int start;
    int end;

    public TextRange(int start, int end) {
        if (start < 0 || end < start) {
            throw new IllegalArgumentException("Invalid text range [" + start + ", " + end + ")");
        }
        this.start = start;
        this.end = end;
    }

    public boolean contains(TextRange other) {
        return start <= other.start && other.end <= end;
    }

    @Override
    public String toString() {
        return "[" + start + ", " + end + ")";
    }
}
