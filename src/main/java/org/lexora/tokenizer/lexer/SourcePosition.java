package org.lexora.tokenizer.lexer;

/**
 * A position in the scanned source text.
 *
 * @param offset The 0-based UTF-16 index into the input.
 * @param line The 1-based line number.
 * @param column The 1-based column, counted in code points.
 */
public record SourcePosition(int offset, int line, int column) implements Comparable<SourcePosition> {

    /** The position of the first character of any input. */
    public static final SourcePosition START = new SourcePosition(0, 1, 1);

    @Override
    public int compareTo(SourcePosition other) {
        return Integer.compare(offset, other.offset);
    }

    @Override
    public String toString() {
        return line + ":" + column;
    }
}
