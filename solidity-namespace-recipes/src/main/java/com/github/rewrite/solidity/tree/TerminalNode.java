package com.github.rewrite.solidity.tree;

import lombok.EqualsAndHashCode;
import lombok.Getter;

import java.util.regex.Pattern;

@Getter
@EqualsAndHashCode(callSuper = false)
public final class TerminalNode extends Node {

    private static final Pattern ELEMENTARY_TYPE =
            Pattern.compile("address|bool|string|byte|bytes\\d{0,2}|u?int\\d{0,3}|u?fixed(\\d+x\\d+)?");

    private final TerminalKind kind;
    private final String text;

    public TerminalNode(TerminalKind kind, String text) {
        this.kind = kind;
        this.text = text;
    }

    public boolean is(TerminalKind kind) {
        return this.kind == kind;
    }

    public boolean isKeyword(String keyword) {
        return kind == TerminalKind.KEYWORD && text.equals(keyword);
    }

    /**
     * @return whether this is a built-in value type name such as {@code uint256} or {@code address}
     */
    public boolean isElementaryType() {
        return kind == TerminalKind.KEYWORD && ELEMENTARY_TYPE.matcher(text).matches();
    }

    @Override
    public String unparse() {
        return text;
    }

    @Override
    public int getTextLength() {
        return text.length();
    }

    @Override
    public boolean isTerminal() {
        return true;
    }

    @Override
    String describe() {
        return kind + " '" + text + "'";
    }

    @Override
    public String toString() {
        return describe();
    }
}
