package org.extractfx.rewriter.frontend;

/**
 * A position in the input.
 *
 * @param line The 1-based line number.
 * @param column The 1-based column within that line.
 */
public record SourcePosition(int line, int column) {

    @Override
    public String toString() {
        return line + ":" + column;
    }
}
