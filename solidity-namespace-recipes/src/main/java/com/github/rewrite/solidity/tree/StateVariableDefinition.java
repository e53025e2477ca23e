package com.github.rewrite.solidity.tree;

import org.jspecify.annotations.Nullable;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Typed view over a {@link NonterminalKind#STATE_VARIABLE_DEFINITION} node.
 * <p>
 * Splits a declaration such as {@code mapping(address => uint256) private balances = ...;}
 * into its type, attributes, name and initializer.
 */
public class StateVariableDefinition {

    private static final Set<String> ATTRIBUTES = new HashSet<>(Arrays.asList(
            "public", "private", "internal", "constant", "immutable", "override", "transient"
    ));

    private final NonterminalNode node;
    private final List<TerminalNode> terminals = new ArrayList<>();
    private final List<Integer> offsets = new ArrayList<>();
    private final List<Integer> depths = new ArrayList<>();
    private int nameIndex = -1;
    private boolean initializer;

    public StateVariableDefinition(Node node) {
        this.node = node.asNonterminal(NonterminalKind.STATE_VARIABLE_DEFINITION);
        int offset = 0;
        int depth = 0;
        for (Node child : this.node.getChildren()) {
            TerminalNode terminal = child.asTerminal();
            if (!terminal.getKind().isTrivia()) {
                if (terminal.is(TerminalKind.CLOSE_PAREN) || terminal.is(TerminalKind.CLOSE_BRACKET)
                        || terminal.is(TerminalKind.CLOSE_BRACE)) {
                    depth--;
                }
                terminals.add(terminal);
                offsets.add(offset);
                depths.add(depth);
                if (terminal.is(TerminalKind.OPEN_PAREN) || terminal.is(TerminalKind.OPEN_BRACKET)
                        || terminal.is(TerminalKind.OPEN_BRACE)) {
                    depth++;
                }
            }
            offset += terminal.getTextLength();
        }
        for (int i = 0; i < terminals.size(); i++) {
            TerminalNode terminal = terminals.get(i);
            boolean terminator = terminal.is(TerminalKind.SEMICOLON)
                    || (terminal.is(TerminalKind.OPERATOR) && terminal.getText().equals("="));
            if (depths.get(i) == 0 && terminator) {
                initializer = !terminal.is(TerminalKind.SEMICOLON);
                if (i > 0 && terminals.get(i - 1).is(TerminalKind.IDENTIFIER)) {
                    nameIndex = i - 1;
                }
                break;
            }
        }
    }

    /**
     * @return the variable name, or {@code null} when the declaration is malformed
     */
    public @Nullable String getName() {
        return nameIndex < 0 ? null : terminals.get(nameIndex).getText();
    }

    public boolean hasInitializer() {
        return initializer;
    }

    public boolean hasAttribute(String attribute) {
        for (int i = 0; i < nameIndex; i++) {
            if (depths.get(i) == 0 && terminals.get(i).isKeyword(attribute)) {
                return true;
            }
        }
        return false;
    }

    /**
     * @return the type as written, for example {@code mapping(address => uint256)}, or
     * {@code null} when the declaration is malformed
     */
    public @Nullable String getTypeName() {
        if (nameIndex <= 0) {
            return null;
        }
        int last = -1;
        for (int i = 0; i < nameIndex; i++) {
            if (depths.get(i) == 0 && terminals.get(i).is(TerminalKind.KEYWORD)
                    && ATTRIBUTES.contains(terminals.get(i).getText())) {
                break;
            }
            last = i;
        }
        if (last < 0) {
            return null;
        }
        int start = offsets.get(0);
        int end = offsets.get(last) + terminals.get(last).getTextLength();
        return node.unparse().substring(start, end);
    }

    /**
     * @return the declaration as a struct member: type and name without attributes or
     * initializer, e.g. {@code uint256 public a;} gives {@code uint256 a;}
     */
    public @Nullable String toMemberDeclaration() {
        String type = getTypeName();
        String name = getName();
        if (type == null || name == null) {
            return null;
        }
        return type + " " + name + ";";
    }

    /**
     * @return the range of the declaration relative to the start of the node, from its
     * first token through the terminating semicolon; leading trivia is excluded
     */
    public TextRange getDeclarationRange() {
        int start = node.leadingTriviaLength();
        int end = start;
        for (int i = 0; i < terminals.size(); i++) {
            end = offsets.get(i) + terminals.get(i).getTextLength();
        }
        return new TextRange(start, end);
    }
}
