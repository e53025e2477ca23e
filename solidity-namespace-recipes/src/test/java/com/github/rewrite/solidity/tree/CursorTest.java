package com.github.rewrite.solidity.tree;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class CursorTest {

    private static final String SOURCE = "contract A {\n    uint256 x;\n}\ncontract B {\n    function f() public { x; }\n}\n";

    private final ParseOutput output = new AntlrSyntaxTreeProvider().parse(NonterminalKind.SOURCE_UNIT, SOURCE);

    @Test
    void textRangesAreAbsoluteOffsets() {
        Cursor cursor = output.createTreeCursor();
        List<String> texts = new ArrayList<>();
        while (cursor.goToNextTerminal()) {
            TextRange range = cursor.textRange();
            texts.add(SOURCE.substring(range.getStart(), range.getEnd()));
            assertThat(texts.get(texts.size() - 1)).isEqualTo(cursor.node().unparse());
        }
        assertThat(String.join("", texts)).isEqualTo(SOURCE);
        assertThat(cursor.isCompleted()).isTrue();
    }

    @Test
    void spawnedCursorStaysInsideItsSubtree() {
        Cursor cursor = output.createTreeCursor();
        assertThat(cursor.goToNextNonterminalWithKind(NonterminalKind.CONTRACT_DEFINITION)).isTrue();

        Cursor contract = cursor.spawn();
        assertThat(contract.textRange()).isEqualTo(cursor.textRange());
        assertThat(contract.goToNextNonterminalWithKind(NonterminalKind.FUNCTION_DEFINITION)).isFalse();
        assertThat(contract.isCompleted()).isTrue();

        // the parent cursor did not move
        assertThat(new ContractDefinition(cursor.node()).getName()).isEqualTo("A");
        assertThat(cursor.goToNextNonterminalWithKind(NonterminalKind.FUNCTION_DEFINITION)).isTrue();
    }

    @Test
    void spawnedCursorKeepsOffsets() {
        Cursor cursor = output.createTreeCursor();
        cursor.goToNextNonterminalWithKind(NonterminalKind.CONTRACT_DEFINITION);
        cursor.goToNextNonterminalWithKind(NonterminalKind.CONTRACT_DEFINITION);

        Cursor body = cursor.spawn();
        assertThat(body.goToNextNonterminalWithKind(NonterminalKind.FUNCTION_BODY)).isTrue();
        TextRange range = body.textRange();
        assertThat(SOURCE.substring(range.getStart(), range.getEnd())).isEqualTo("{ x; }");
        assertThat(body.depth()).isEqualTo(2);
    }

    @Test
    void copyAdvancesIndependently() {
        Cursor cursor = output.createTreeCursor();
        cursor.goToNextTerminalWithKind(TerminalKind.OPEN_BRACE);
        TextRange brace = cursor.textRange();

        Cursor copy = cursor.copy();
        assertThat(copy.goToNextTerminalWithKind(TerminalKind.CLOSE_BRACE)).isTrue();
        assertThat(SOURCE.charAt(copy.textRange().getStart())).isEqualTo('}');
        assertThat(cursor.textRange()).isEqualTo(brace);
    }
}
