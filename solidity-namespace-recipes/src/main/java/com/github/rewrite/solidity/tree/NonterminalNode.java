package com.github.rewrite.solidity.tree;

import lombok.EqualsAndHashCode;
import lombok.Getter;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

@Getter
@EqualsAndHashCode(callSuper = false)
public final class NonterminalNode extends Node {

    private final NonterminalKind kind;
    private final List<Node> children;
    private final int textLength;

    public NonterminalNode(NonterminalKind kind, List<Node> children) {
        this.kind = kind;
        this.children = Collections.unmodifiableList(new ArrayList<>(children));
        int length = 0;
        for (Node child : this.children) {
            length += child.getTextLength();
        }
        this.textLength = length;
    }

    public boolean is(NonterminalKind kind) {
        return this.kind == kind;
    }

    /**
     * @return the terminal children of this node that are not trivia, in source order
     */
    public List<TerminalNode> significantTerminals() {
        List<TerminalNode> result = new ArrayList<>();
        for (Node child : children) {
            if (child.isTerminal() && !((TerminalNode) child).getKind().isTrivia()) {
                result.add((TerminalNode) child);
            }
        }
        return result;
    }

    /**
     * @return the offset of the first non-trivia character relative to the start of this node
     */
    public int leadingTriviaLength() {
        int length = 0;
        for (Node child : children) {
            if (child.isTerminal() && ((TerminalNode) child).getKind().isTrivia()) {
                length += child.getTextLength();
            } else {
                break;
            }
        }
        return length;
    }

    @Override
    public String unparse() {
        StringBuilder sb = new StringBuilder(textLength);
        for (Node child : children) {
            sb.append(child.unparse());
        }
        return sb.toString();
    }

    @Override
    public boolean isTerminal() {
        return false;
    }

    @Override
    String describe() {
        return kind.toString();
    }

    @Override
    public String toString() {
        return kind + "(" + children.size() + " children)";
    }
}
