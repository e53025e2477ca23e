package com.github.rewrite.solidity.text;

import lombok.Value;

/**
 * Replaces the text of {@link #range} with {@link #newText}. An empty range is an insertion,
 * an empty new text a deletion.
 */
@Value
public class TextEdit {
    Range range;
    String newText;

    public static TextEdit replace(Range range, String newText) {
        return new TextEdit(range, newText);
    }

    public static TextEdit delete(Range range) {
        return new TextEdit(range, "");
    }
}
