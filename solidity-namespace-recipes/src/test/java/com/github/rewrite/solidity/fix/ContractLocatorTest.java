package com.github.rewrite.solidity.fix;

import com.github.rewrite.solidity.tree.AntlrSyntaxTreeProvider;
import com.github.rewrite.solidity.tree.ContractDefinition;
import com.github.rewrite.solidity.tree.Cursor;
import com.github.rewrite.solidity.tree.NonterminalKind;
import com.github.rewrite.solidity.tree.ParseOutput;
import com.github.rewrite.solidity.tree.TextRange;
import org.junit.jupiter.api.Test;

import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;

class ContractLocatorTest {

    private final AntlrSyntaxTreeProvider parser = new AntlrSyntaxTreeProvider();
    private final ContractLocator locator = new ContractLocator(parser);

    @Test
    void findsContractByName() {
        String source = "contract A {\n}\n\ncontract Box {\n    uint256 a;\n}\n";

        Optional<Cursor> cursor = locator.locate(parse(source).createTreeCursor(), "Box", null);

        assertThat(cursor).isPresent();
        assertThat(new ContractDefinition(cursor.get().node()).getName()).isEqualTo("Box");
        TextRange range = cursor.get().textRange();
        assertThat(source.substring(range.getStart(), range.getEnd())).isEqualTo("\n\ncontract Box {\n    uint256 a;\n}");
    }

    @Test
    void returnedCursorIsRootedAtTheContract() {
        String source = "contract Box {\n    function f() public {}\n}\ncontract C {\n    function g() public {}\n}\n";

        Cursor cursor = locator.locate(parse(source).createTreeCursor(), "Box", null).get();

        assertThat(cursor.goToNextNonterminalWithKind(NonterminalKind.FUNCTION_DEFINITION)).isTrue();
        assertThat(cursor.goToNextNonterminalWithKind(NonterminalKind.FUNCTION_DEFINITION)).isFalse();
    }

    @Test
    void treeCursorIsNotAdvanced() {
        String source = "contract Box {}\n";
        Cursor treeCursor = parse(source).createTreeCursor();

        locator.locate(treeCursor, "Box", null);

        assertThat(treeCursor.isCompleted()).isFalse();
        assertThat(treeCursor.node().getTextLength()).isEqualTo(source.length());
    }

    @Test
    void missingContract() {
        assertThat(locator.locate(parse("contract A {}\n").createTreeCursor(), "Box", null)).isEmpty();
    }

    @Test
    void malformedContractIsSkipped() {
        assertThat(locator.locate(parse("contract Box {\n    uint256 a;\n").createTreeCursor(), "Box", null)).isEmpty();
    }

    @Test
    void duplicateNamesPreferTheAnchoredContract() {
        String source = "contract Box {\n    uint256 a;\n}\ncontract Box {\n    uint256 b;\n}\n";
        int second = source.indexOf("uint256 b;");

        Cursor anchored = locator.locate(parse(source).createTreeCursor(), "Box",
                new TextRange(second, second + 10)).get();
        Cursor unanchored = locator.locate(parse(source).createTreeCursor(), "Box", null).get();

        assertThat(anchored.node().unparse()).contains("uint256 b;");
        assertThat(unanchored.node().unparse()).contains("uint256 a;");
    }

    private ParseOutput parse(String source) {
        return parser.parse(NonterminalKind.SOURCE_UNIT, source);
    }
}
