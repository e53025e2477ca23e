package com.github.rewrite.solidity.tree;

import lombok.Value;

@Value
public class ParseError {
    String message;
    TextRange range;

    @Override
    public String toString() {
        return message + " at " + range;
    }
}
