package com.github.rewrite.solidity.tree;

/**
 * Kinds of leaves in the Solidity concrete syntax tree.
 * <p>
 * Trivia kinds (whitespace, line breaks and comments) are kept in the tree so that
 * unparsing a node reproduces its source text exactly.
 */
public enum TerminalKind {
    IDENTIFIER,
    KEYWORD,
    STRING_LITERAL,
    NUMBER_LITERAL,
    OPEN_BRACE,
    CLOSE_BRACE,
    OPEN_PAREN,
    CLOSE_PAREN,
    OPEN_BRACKET,
    CLOSE_BRACKET,
    SEMICOLON,
    COMMA,
    PERIOD,
    COLON,
    OPERATOR,
    WHITESPACE,
    END_OF_LINE,
    SINGLE_LINE_COMMENT,
    MULTI_LINE_COMMENT,
    SINGLE_LINE_NAT_SPEC_COMMENT,
    MULTI_LINE_NAT_SPEC_COMMENT,
    UNRECOGNIZED;

    public boolean isTrivia() {
        switch (this) {
            case WHITESPACE:
            case END_OF_LINE:
            case SINGLE_LINE_COMMENT:
            case MULTI_LINE_COMMENT:
            case SINGLE_LINE_NAT_SPEC_COMMENT:
            case MULTI_LINE_NAT_SPEC_COMMENT:
                return true;
            default:
                return false;
        }
    }
}
