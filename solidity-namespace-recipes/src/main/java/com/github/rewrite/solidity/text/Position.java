package com.github.rewrite.solidity.text;

import lombok.Value;

/**
 * A zero-based line and character position, as editors display them.
 */
@Value
public class Position implements Comparable<Position> {
    int line;
    int character;

    @Override
    public int compareTo(Position other) {
        return line != other.line ? Integer.compare(line, other.line) : Integer.compare(character, other.character);
    }

    @Override
    public String toString() {
        return line + ":" + character;
    }
}
