package com.github.rewrite.solidity.tree;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class AntlrSyntaxTreeProviderTest {

    private static final String BOX = """
            // SPDX-License-Identifier: MIT
            pragma solidity ^0.8.20;

            import "./Base.sol";

            /// @title A box
            contract Box is Base {
                uint256 public a;
                mapping(address => uint256) private balances;
                event Stored(uint256 value);

                struct Item {
                    uint256 id;
                }

                function set(uint256 v) public {
                    if (v > 0) {
                        a = v;
                    }
                }

                function total() external view returns (uint256);
            }
            """;

    private final AntlrSyntaxTreeProvider parser = new AntlrSyntaxTreeProvider();

    @Test
    void treeCoversTheWholeText() {
        ParseOutput output = parser.parse(NonterminalKind.SOURCE_UNIT, BOX);

        assertThat(output.isValid()).isTrue();
        assertThat(output.getTree().unparse()).isEqualTo(BOX);
        assertThat(output.getTree().getTextLength()).isEqualTo(BOX.length());
    }

    @Test
    void sourceUnitChildren() {
        NonterminalNode tree = parser.parse(NonterminalKind.SOURCE_UNIT, BOX).getTree();

        assertThat(nonterminalKinds(tree)).containsExactly(NonterminalKind.PRAGMA_DIRECTIVE,
                NonterminalKind.IMPORT_DIRECTIVE, NonterminalKind.CONTRACT_DEFINITION);
    }

    @Test
    void contractMembers() {
        NonterminalNode tree = parser.parse(NonterminalKind.SOURCE_UNIT, BOX).getTree();
        NonterminalNode contract = nonterminals(tree).get(2);

        assertThat(nonterminalKinds(contract)).containsExactly(
                NonterminalKind.STATE_VARIABLE_DEFINITION, NonterminalKind.STATE_VARIABLE_DEFINITION,
                NonterminalKind.OTHER_DEFINITION, NonterminalKind.STRUCT_DEFINITION,
                NonterminalKind.FUNCTION_DEFINITION, NonterminalKind.FUNCTION_DEFINITION);

        ContractDefinition definition = new ContractDefinition(contract);
        assertThat(definition.getName()).isEqualTo("Box");
        assertThat(definition.getKeyword()).isEqualTo("contract");
        assertThat(definition.isAbstract()).isFalse();
        assertThat(contract.unparse()).startsWith("\n\n/// @title A box\ncontract Box");
    }

    @Test
    void functionBodiesAreSeparateNodes() {
        NonterminalNode tree = parser.parse(NonterminalKind.SOURCE_UNIT, BOX).getTree();
        List<NonterminalNode> members = nonterminals(nonterminals(tree).get(2));

        FunctionDefinition set = new FunctionDefinition(members.get(4));
        assertThat(set.getKeyword()).isEqualTo("function");
        assertThat(set.getName()).isEqualTo("set");
        assertThat(set.getBody()).isNotNull();
        assertThat(set.getBody().unparse()).startsWith("{").endsWith("}").contains("a = v;");

        FunctionDefinition total = new FunctionDefinition(members.get(5));
        assertThat(total.getName()).isEqualTo("total");
        assertThat(total.getBody()).isNull();
    }

    @Test
    void abstractContractsAndLibraries() {
        String source = "abstract contract A {}\nlibrary L {}\ninterface I {}\n";
        List<NonterminalNode> contracts = nonterminals(parser.parse(NonterminalKind.SOURCE_UNIT, source).getTree());

        assertThat(contracts).hasSize(3);
        assertThat(new ContractDefinition(contracts.get(0)).isAbstract()).isTrue();
        assertThat(new ContractDefinition(contracts.get(0)).getName()).isEqualTo("A");
        assertThat(new ContractDefinition(contracts.get(1)).getKeyword()).isEqualTo("library");
        assertThat(new ContractDefinition(contracts.get(2)).getKeyword()).isEqualTo("interface");
    }

    @Test
    void unterminatedContractIsReported() {
        String source = "contract A {\n    uint256 a;\n";
        ParseOutput output = parser.parse(NonterminalKind.SOURCE_UNIT, source);

        assertThat(output.isValid()).isFalse();
        assertThat(output.getErrors()).anySatisfy(error -> {
            assertThat(error.getMessage()).contains("'}'");
            assertThat(error.getRange()).isEqualTo(new TextRange(source.length(), source.length()));
        });
        assertThat(output.getTree().unparse()).isEqualTo(source);
    }

    @Test
    void malformedInputStillCoversTheWholeText() {
        String source = "contract A {\n    uint256 a;\n    ))) ;\n    function f() public { a = ; }\n}\n";
        ParseOutput output = parser.parse(NonterminalKind.SOURCE_UNIT, source);

        assertThat(output.isValid()).isFalse();
        assertThat(output.getTree().unparse()).isEqualTo(source);
    }

    @Test
    void functionTypedStateVariableIsNotAFunction() {
        String source = "contract Box {\n    uint256 a;\n    function (uint256) external returns (uint256) callback;\n}\n";
        ParseOutput output = parser.parse(NonterminalKind.SOURCE_UNIT, source);

        assertThat(output.isValid()).isTrue();
        NonterminalNode contract = nonterminals(output.getTree()).get(0);
        assertThat(nonterminalKinds(contract)).containsExactly(
                NonterminalKind.STATE_VARIABLE_DEFINITION, NonterminalKind.STATE_VARIABLE_DEFINITION);
        StateVariableDefinition callback = new StateVariableDefinition(nonterminals(contract).get(1));
        assertThat(callback.getName()).isEqualTo("callback");
        assertThat(callback.getTypeName()).isEqualTo("function (uint256) external returns (uint256)");
    }

    @Test
    void constructorsModifiersAndSpecialFunctionsAreFunctionDefinitions() {
        String source = """
                contract A {
                    constructor() payable {}
                    modifier onlyOwner() { _; }
                    fallback() external {}
                    receive() external payable {}
                }
                """;
        NonterminalNode contract = nonterminals(parser.parse(NonterminalKind.SOURCE_UNIT, source).getTree()).get(0);

        assertThat(nonterminals(contract)).extracting(node -> new FunctionDefinition(node).getKeyword())
                .containsExactly("constructor", "modifier", "fallback", "receive");
        assertThat(new FunctionDefinition(nonterminals(contract).get(1)).getName()).isEqualTo("onlyOwner");
    }

    @Test
    void standaloneContract() {
        String contract = "\n/// doc\ncontract A {\n    uint256 a;\n}";

        ParseOutput output = parser.parse(NonterminalKind.CONTRACT_DEFINITION, contract);

        assertThat(output.isValid()).isTrue();
        assertThat(output.getTree().is(NonterminalKind.CONTRACT_DEFINITION)).isTrue();
        assertThat(output.getTree().unparse()).isEqualTo(contract);
    }

    @Test
    void standaloneContractRejectsTrailingContent() {
        String source = "contract A {}\ncontract B {}";
        ParseOutput output = parser.parse(NonterminalKind.CONTRACT_DEFINITION, source);

        assertThat(output.isValid()).isFalse();
        assertThat(output.getErrors().get(0).getRange().getStart()).isEqualTo(source.indexOf("contract B"));
        assertThat(output.getTree().unparse()).isEqualTo(source);
    }

    @Test
    void fragmentsOtherThanContractsAreNotSupported() {
        assertThatThrownBy(() -> parser.parse(NonterminalKind.FUNCTION_BODY, "{}"))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void typedViewsRejectOtherNodes() {
        NonterminalNode tree = parser.parse(NonterminalKind.SOURCE_UNIT, BOX).getTree();

        assertThatThrownBy(() -> new ContractDefinition(tree))
                .isInstanceOf(UnexpectedNodeException.class)
                .hasMessageContaining("CONTRACT_DEFINITION");
        assertThatThrownBy(() -> tree.getChildren().get(0).asTerminal())
                .isInstanceOf(UnexpectedNodeException.class);
    }

    private static List<NonterminalNode> nonterminals(NonterminalNode node) {
        return node.getChildren().stream()
                .filter(child -> !child.isTerminal())
                .map(child -> (NonterminalNode) child)
                .collect(Collectors.toList());
    }

    private static List<NonterminalKind> nonterminalKinds(NonterminalNode node) {
        return nonterminals(node).stream().map(NonterminalNode::getKind).collect(Collectors.toList());
    }
}
