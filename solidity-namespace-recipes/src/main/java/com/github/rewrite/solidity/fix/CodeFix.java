package com.github.rewrite.solidity.fix;

import com.github.rewrite.solidity.text.TextEdit;
import lombok.Value;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A batch of edits offered to the user as a whole, independent of any editor protocol.
 * <p>
 * All edits of one document were computed against the same snapshot and do not overlap,
 * so the batch is either applied completely or not at all.
 */
@Value
public class CodeFix {

    public static final String QUICK_FIX = "quickfix";

    String title;
    String kind;
    /** Edits per document URI, in the order they were computed. */
    Map<String, List<TextEdit>> changes;
    List<Diagnostic> diagnostics;

    public static CodeFix quickFix(String title, String uri, List<TextEdit> edits, List<Diagnostic> diagnostics) {
        Map<String, List<TextEdit>> changes = new LinkedHashMap<>();
        changes.put(uri, Collections.unmodifiableList(edits));
        return new CodeFix(title, QUICK_FIX, Collections.unmodifiableMap(changes),
                Collections.unmodifiableList(diagnostics));
    }

    public List<TextEdit> getEdits(String uri) {
        return changes.getOrDefault(uri, Collections.emptyList());
    }
}
