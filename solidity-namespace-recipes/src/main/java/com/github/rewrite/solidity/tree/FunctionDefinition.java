package com.github.rewrite.solidity.tree;

import org.jspecify.annotations.Nullable;

import java.util.ArrayList;
import java.util.List;

/**
 * Typed view over a {@link NonterminalKind#FUNCTION_DEFINITION} node, which covers functions,
 * constructors, modifiers, fallback and receive functions.
 */
public class FunctionDefinition {

    private final NonterminalNode node;

    public FunctionDefinition(Node node) {
        this.node = node.asNonterminal(NonterminalKind.FUNCTION_DEFINITION);
    }

    /**
     * @return {@code function}, {@code constructor}, {@code modifier}, {@code fallback} or
     * {@code receive}
     */
    public String getKeyword() {
        return node.significantTerminals().get(0).getText();
    }

    /**
     * @return the declared name, or {@code null} for constructors, fallback and receive
     */
    public @Nullable String getName() {
        List<TerminalNode> significant = node.significantTerminals();
        if (significant.size() > 1 && significant.get(1).is(TerminalKind.IDENTIFIER)) {
            return significant.get(1).getText();
        }
        return null;
    }

    /**
     * @return the body, or {@code null} for declarations without one
     */
    public @Nullable NonterminalNode getBody() {
        for (Node child : node.getChildren()) {
            if (!child.isTerminal() && ((NonterminalNode) child).is(NonterminalKind.FUNCTION_BODY)) {
                return (NonterminalNode) child;
            }
        }
        return null;
    }

    /**
     * @return the terminals before the body: keyword, name, parameters, attributes, modifier
     * invocations and return parameters
     */
    public List<TerminalNode> getHeaderTerminals() {
        List<TerminalNode> header = new ArrayList<>();
        for (Node child : node.getChildren()) {
            if (!child.isTerminal()) {
                break;
            }
            header.add((TerminalNode) child);
        }
        return header;
    }
}
