package com.github.rewrite.solidity.text;

import com.github.rewrite.solidity.tree.TextRange;
import lombok.Getter;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * An immutable snapshot of a host document: its identity and its full text.
 * <p>
 * Translates between character offsets and line/character positions, and applies a batch
 * of edits that were all computed against this snapshot.
 */
public class TextDocument {

    @Getter
    private final String uri;

    @Getter
    private final String text;

    private final int[] lineStarts;

    public TextDocument(String uri, String text) {
        this.uri = uri;
        this.text = text;
        List<Integer> starts = new ArrayList<>();
        starts.add(0);
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c == '\r' && i + 1 < text.length() && text.charAt(i + 1) == '\n') {
                i++;
                starts.add(i + 1);
            } else if (c == '\n' || c == '\r') {
                starts.add(i + 1);
            }
        }
        this.lineStarts = starts.stream().mapToInt(Integer::intValue).toArray();
    }

    public int getLineCount() {
        return lineStarts.length;
    }

    public Position positionAt(int offset) {
        int clamped = Math.max(0, Math.min(offset, text.length()));
        int low = 0;
        int high = lineStarts.length - 1;
        while (low < high) {
            int mid = (low + high + 1) >>> 1;
            if (lineStarts[mid] <= clamped) {
                low = mid;
            } else {
                high = mid - 1;
            }
        }
        return new Position(low, clamped - lineStarts[low]);
    }

    /**
     * Positions past the end of a line are clamped to the line end, positions past the last
     * line to the end of the text.
     */
    public int offsetAt(Position position) {
        if (position.getLine() >= lineStarts.length) {
            return text.length();
        }
        if (position.getLine() < 0) {
            return 0;
        }
        int lineStart = lineStarts[position.getLine()];
        int lineEnd = position.getLine() + 1 < lineStarts.length ? lineStarts[position.getLine() + 1] : text.length();
        while (lineEnd > lineStart && (text.charAt(lineEnd - 1) == '\n' || text.charAt(lineEnd - 1) == '\r')) {
            lineEnd--;
        }
        return Math.min(lineStart + Math.max(0, position.getCharacter()), lineEnd);
    }

    public Range rangeOf(TextRange textRange) {
        return new Range(positionAt(textRange.getStart()), positionAt(textRange.getEnd()));
    }

    public TextRange textRangeOf(Range range) {
        int start = offsetAt(range.getStart());
        int end = offsetAt(range.getEnd());
        if (end < start) {
            throw new IllegalArgumentException("Range ends before it starts: " + range);
        }
        return new TextRange(start, end);
    }

    public String getText(Range range) {
        TextRange textRange = textRangeOf(range);
        return text.substring(textRange.getStart(), textRange.getEnd());
    }

    /**
     * Applies edits computed against this snapshot and returns the resulting text.
     * <p>
     * Edits are applied as if simultaneously: no edit observes the effect of another.
     * Several insertions at the same position keep the order in which they were supplied.
     *
     * @throws IllegalArgumentException if two edits overlap
     */
    public String applyEdits(List<TextEdit> edits) {
        List<ResolvedEdit> resolved = new ArrayList<>(edits.size());
        for (int i = 0; i < edits.size(); i++) {
            resolved.add(new ResolvedEdit(textRangeOf(edits.get(i).getRange()), edits.get(i).getNewText(), i));
        }
        resolved.sort(Comparator.comparingInt((ResolvedEdit e) -> e.range.getStart())
                .thenComparingInt(e -> e.range.getEnd())
                .thenComparingInt(e -> e.order));
        for (int i = 1; i < resolved.size(); i++) {
            ResolvedEdit previous = resolved.get(i - 1);
            ResolvedEdit next = resolved.get(i);
            if (next.range.getStart() < previous.range.getEnd()) {
                throw new IllegalArgumentException("Overlapping edits at " + previous.range + " and " + next.range);
            }
        }

        StringBuilder result = new StringBuilder(text.length());
        int position = 0;
        for (ResolvedEdit edit : resolved) {
            result.append(text, position, edit.range.getStart());
            result.append(edit.newText);
            position = edit.range.getEnd();
        }
        result.append(text.substring(position));
        return result.toString();
    }

    private static final class ResolvedEdit {
        final TextRange range;
        final String newText;
        final int order;

        ResolvedEdit(TextRange range, String newText, int order) {
            this.range = range;
            this.newText = newText;
            this.order = order;
        }
    }
}
