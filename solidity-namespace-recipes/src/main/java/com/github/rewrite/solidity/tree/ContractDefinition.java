package com.github.rewrite.solidity.tree;

import org.jspecify.annotations.Nullable;

/**
 * Typed view over a {@link NonterminalKind#CONTRACT_DEFINITION} node.
 */
public class ContractDefinition {

    private final NonterminalNode node;

    /**
     * @throws UnexpectedNodeException if {@code node} is not a contract definition
     */
    public ContractDefinition(Node node) {
        this.node = node.asNonterminal(NonterminalKind.CONTRACT_DEFINITION);
    }

    public NonterminalNode getNode() {
        return node;
    }

    /**
     * @return {@code contract}, {@code library} or {@code interface}, or {@code null} when the
     * definition is malformed
     */
    public @Nullable String getKeyword() {
        for (TerminalNode terminal : node.significantTerminals()) {
            if (terminal.isKeyword("contract") || terminal.isKeyword("library") || terminal.isKeyword("interface")) {
                return terminal.getText();
            }
            if (!terminal.isKeyword("abstract")) {
                return null;
            }
        }
        return null;
    }

    public boolean isAbstract() {
        return !node.significantTerminals().isEmpty() && node.significantTerminals().get(0).isKeyword("abstract");
    }

    /**
     * @return the contract name, or {@code null} when the definition has none
     */
    public @Nullable String getName() {
        boolean afterKeyword = false;
        for (TerminalNode terminal : node.significantTerminals()) {
            if (afterKeyword) {
                return terminal.is(TerminalKind.IDENTIFIER) ? terminal.getText() : null;
            }
            if (terminal.isKeyword("contract") || terminal.isKeyword("library") || terminal.isKeyword("interface")) {
                afterKeyword = true;
            }
        }
        return null;
    }
}
