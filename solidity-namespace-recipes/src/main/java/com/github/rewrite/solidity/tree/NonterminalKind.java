package com.github.rewrite.solidity.tree;

/**
 * Kinds of inner nodes produced by {@link AntlrSyntaxTreeProvider}.
 * <p>
 * The tree is structural: it keeps the members of a contract and the extent of every
 * body, while statements and expressions stay flat sequences of terminals.
 */
public enum NonterminalKind {
    SOURCE_UNIT,
    PRAGMA_DIRECTIVE,
    IMPORT_DIRECTIVE,
    CONTRACT_DEFINITION,
    STATE_VARIABLE_DEFINITION,
    FUNCTION_DEFINITION,
    FUNCTION_BODY,
    STRUCT_DEFINITION,
    ENUM_DEFINITION,
    /** Events, errors, using-for directives, user defined value types. */
    OTHER_DEFINITION
}
