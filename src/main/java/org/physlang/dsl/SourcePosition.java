package org.physlang.dsl;

/**
 * 1-based line and column of a location in program source.
 */
public record SourcePosition(int line, int column) {

    @Override
    public String toString() {
        return line + ":" + column;
    }
}
