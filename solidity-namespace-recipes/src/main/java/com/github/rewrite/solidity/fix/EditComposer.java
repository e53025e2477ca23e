package com.github.rewrite.solidity.fix;

import com.github.rewrite.solidity.namespace.Namespace;
import com.github.rewrite.solidity.namespace.NamespaceCatalog;
import com.github.rewrite.solidity.namespace.Variable;
import com.github.rewrite.solidity.text.Range;
import com.github.rewrite.solidity.text.TextDocument;
import com.github.rewrite.solidity.text.TextEdit;
import com.github.rewrite.solidity.tree.TextRange;
import org.jspecify.annotations.Nullable;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Turns the moved variables into container edits and merges them with the rewritten
 * function bodies into one {@link CodeFix}.
 * <p>
 * Without an existing container, the first declaration is replaced by the generated
 * namespace and the other declarations are deleted. With an existing container, all
 * declarations are deleted and a single edit re-inserts them, in declaration order, in
 * front of the container's closing brace.
 */
public class EditComposer {

    private final NamespaceCatalog catalog;
    private final String indentUnit;

    public EditComposer(NamespaceCatalog catalog, String indentUnit) {
        this.catalog = catalog;
        this.indentUnit = indentUnit;
    }

    /**
     * @param existingContainerEnd the closing brace of the contract's namespace struct, or
     *                             {@code null} when the contract has none
     * @return the fix, or empty when there are no variables to move
     * @throws IllegalStateException if the computed edits overlap
     */
    public Optional<CodeFix> compose(String title, List<Diagnostic> diagnostics, Namespace namespace,
                                     @Nullable TextRange existingContainerEnd, List<TextEdit> bodyEdits,
                                     TextDocument document) {
        if (namespace.getVariables().isEmpty()) {
            return Optional.empty();
        }
        List<TextEdit> edits = existingContainerEnd == null
                ? newContainerEdits(namespace, document)
                : existingContainerEdits(namespace.getVariables(), existingContainerEnd, document);
        edits.addAll(bodyEdits);
        checkDisjoint(edits, document);
        return Optional.of(CodeFix.quickFix(title, document.getUri(), edits, diagnostics));
    }

    List<TextEdit> newContainerEdits(Namespace namespace, TextDocument document) {
        List<Variable> variables = namespace.getVariables();
        List<TextEdit> edits = new ArrayList<>();
        edits.add(TextEdit.replace(variables.get(0).getRange(), catalog.printTemplate(namespace)));
        for (Variable variable : variables.subList(1, variables.size())) {
            edits.add(TextEdit.delete(deletionRange(variable.getRange(), document)));
        }
        return edits;
    }

    List<TextEdit> existingContainerEdits(List<Variable> variables, TextRange closingBrace, TextDocument document) {
        List<TextEdit> edits = new ArrayList<>();
        for (Variable variable : variables) {
            edits.add(TextEdit.delete(deletionRange(variable.getRange(), document)));
        }

        String text = document.getText();
        String lineIndent = FunctionBodyRewriter.lineIndent(text, closingBrace.getStart());
        boolean braceStartsLine = text.substring(0, closingBrace.getStart()).endsWith(lineIndent)
                && isLineStart(text, closingBrace.getStart() - lineIndent.length());
        String memberIndent = lineIndent + indentUnit;

        StringBuilder members = new StringBuilder();
        members.append(braceStartsLine ? indentUnit : "\n" + memberIndent);
        for (int i = 0; i < variables.size(); i++) {
            if (i > 0) {
                members.append(memberIndent);
            }
            members.append(variables.get(i).getContent()).append('\n');
        }
        members.append(lineIndent).append('}');
        edits.add(TextEdit.replace(document.rangeOf(closingBrace), members.toString()));
        return edits;
    }

    /**
     * A declaration alone on its line is deleted with its indentation and line break, so
     * no blank line is left behind; otherwise only the declaration itself is deleted. When
     * the lines above and below are both blank, the one below goes too.
     */
    static Range deletionRange(Range declaration, TextDocument document) {
        String text = document.getText();
        TextRange range = document.textRangeOf(declaration);
        int start = range.getStart();
        while (start > 0 && (text.charAt(start - 1) == ' ' || text.charAt(start - 1) == '\t')) {
            start--;
        }
        int end = range.getEnd();
        while (end < text.length() && (text.charAt(end) == ' ' || text.charAt(end) == '\t')) {
            end++;
        }
        boolean aloneOnLine = isLineStart(text, start)
                && (end == text.length() || text.charAt(end) == '\n' || text.charAt(end) == '\r');
        if (!aloneOnLine) {
            return declaration;
        }
        if (text.startsWith("\r\n", end)) {
            end += 2;
        } else if (end < text.length()) {
            end++;
        }
        if (previousLineIsBlank(text, start)) {
            end += blankLineLength(text, end);
        }
        return document.rangeOf(new TextRange(start, end));
    }

    private static boolean previousLineIsBlank(String text, int lineStart) {
        if (lineStart == 0) {
            return false;
        }
        int offset = lineStart - 1;
        if (offset > 0 && text.charAt(offset) == '\n' && text.charAt(offset - 1) == '\r') {
            offset--;
        }
        while (offset > 0 && (text.charAt(offset - 1) == ' ' || text.charAt(offset - 1) == '\t')) {
            offset--;
        }
        return isLineStart(text, offset);
    }

    /**
     * @return the length of the blank line starting at {@code offset}, line break included,
     * or 0 when that line is not blank or is the last one
     */
    private static int blankLineLength(String text, int offset) {
        int end = offset;
        while (end < text.length() && (text.charAt(end) == ' ' || text.charAt(end) == '\t')) {
            end++;
        }
        if (text.startsWith("\r\n", end)) {
            return end + 2 - offset;
        }
        if (end < text.length() && (text.charAt(end) == '\n' || text.charAt(end) == '\r')) {
            return end + 1 - offset;
        }
        return 0;
    }

    private static boolean isLineStart(String text, int offset) {
        return offset == 0 || text.charAt(offset - 1) == '\n' || text.charAt(offset - 1) == '\r';
    }

    private static void checkDisjoint(List<TextEdit> edits, TextDocument document) {
        List<TextRange> ranges = new ArrayList<>();
        for (TextEdit edit : edits) {
            ranges.add(document.textRangeOf(edit.getRange()));
        }
        ranges.sort(Comparator.comparingInt(TextRange::getStart).thenComparingInt(TextRange::getEnd));
        for (int i = 1; i < ranges.size(); i++) {
            if (ranges.get(i).getStart() < ranges.get(i - 1).getEnd()) {
                throw new IllegalStateException("Edits overlap at " + ranges.get(i - 1) + " and " + ranges.get(i));
            }
        }
    }
}
