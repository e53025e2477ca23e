package com.github.rewrite.solidity.tree;

import lombok.Value;

import java.util.List;

@Value
public class ParseOutput {
    NonterminalNode tree;
    List<ParseError> errors;

    public boolean isValid() {
        return errors.isEmpty();
    }

    /**
     * @return a cursor positioned on the root of the tree
     */
    public Cursor createTreeCursor() {
        return new Cursor(tree);
    }
}
