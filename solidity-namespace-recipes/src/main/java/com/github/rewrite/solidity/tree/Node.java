package com.github.rewrite.solidity.tree;

/**
 * A node of the immutable concrete syntax tree.
 * <p>
 * Nodes carry no parent pointers or absolute offsets, so a subtree can be shared or
 * reparsed in isolation. Positions are tracked by the {@link Cursor} walking the tree.
 */
public abstract class Node {

    /**
     * @return the exact source text covered by this node, trivia included
     */
    public abstract String unparse();

    public abstract int getTextLength();

    public abstract boolean isTerminal();

    abstract String describe();

    public TerminalNode asTerminal() {
        if (!isTerminal()) {
            throw new UnexpectedNodeException("Expected a terminal but found " + describe());
        }
        return (TerminalNode) this;
    }

    public NonterminalNode asNonterminal(NonterminalKind expected) {
        if (isTerminal() || ((NonterminalNode) this).getKind() != expected) {
            throw UnexpectedNodeException.expected(expected, this);
        }
        return (NonterminalNode) this;
    }
}
