package com.github.rewrite.solidity.tree;

/**
 * Parses source text into a full-fidelity concrete syntax tree.
 */
public interface SyntaxTreeProvider {

    /**
     * Parses {@code text} as a node of the given kind.
     * <p>
     * Parsing never fails on malformed input: the returned tree always covers the whole
     * text, and problems are reported through {@link ParseOutput#getErrors()}.
     *
     * @param kind the root kind; {@link NonterminalKind#SOURCE_UNIT} and
     *             {@link NonterminalKind#CONTRACT_DEFINITION} are supported
     * @param text the source text
     * @return the tree and the errors found while building it
     * @throws IllegalArgumentException if {@code kind} cannot be parsed standalone
     */
    ParseOutput parse(NonterminalKind kind, String text);
}
