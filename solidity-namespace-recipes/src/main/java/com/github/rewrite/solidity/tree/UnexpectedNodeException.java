package com.github.rewrite.solidity.tree;

/**
 * Thrown when traversal finds a node of a kind other than the one the surrounding code
 * structurally requires, for example a typed view built over the wrong node or a contract
 * cursor that is not positioned on a contract.
 * <p>
 * This signals a logic error in the traversal, never malformed input, and aborts the
 * current operation.
 */
public class UnexpectedNodeException extends RuntimeException {

    public UnexpectedNodeException(String message) {
        super(message);
    }

    static UnexpectedNodeException expected(NonterminalKind expected, Node actual) {
        return new UnexpectedNodeException("Expected " + expected + " but found " + actual.describe());
    }
}
