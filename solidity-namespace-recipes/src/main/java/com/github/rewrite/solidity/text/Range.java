package com.github.rewrite.solidity.text;

import lombok.Value;

@Value
public class Range {
    Position start;
    Position end;

    public static Range of(int startLine, int startCharacter, int endLine, int endCharacter) {
        return new Range(new Position(startLine, startCharacter), new Position(endLine, endCharacter));
    }

    @Override
    public String toString() {
        return start + "-" + end;
    }
}
