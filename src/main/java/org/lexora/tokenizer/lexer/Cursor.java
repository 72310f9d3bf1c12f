package org.lexora.tokenizer.lexer;

import java.util.Objects;

/**
 * A forward-only reader over the input text that keeps track of the scan position.
 * <p>
 * Characters are read as Unicode code points. The offset is a UTF-16 index so that
 * {@link #slice(int)} returns the exact source text; the column counts code points.
 * Running past the end is not an error: every read then yields {@link #EOF}.
 * <p>
 * A cursor belongs to exactly one {@link Lexer} and is not thread-safe.
 */
public final class Cursor {

    /** Returned by the read methods once the input is exhausted. */
    public static final int EOF = -1;

    private final String input;
    private int offset = 0;
    private int line = 1;
    private int column = 1;

    /**
     * Creates a cursor positioned at the first character of the input.
     * @param input The complete text to read.
     */
    public Cursor(String input) {
        this.input = Objects.requireNonNull(input, "input");
    }

    /**
     * @return The code point at the current position, or {@link #EOF} at the end of the input.
     */
    public int peek() {
        if (isAtEnd()) return EOF;
        return input.codePointAt(offset);
    }

    /**
     * Looks ahead without consuming anything.
     * @param n How many code points past the current one to look; {@code 0} is the current one.
     * @return The code point {@code n} places ahead, or {@link #EOF} if that lies past the end.
     */
    public int peekAt(int n) {
        if (n < 0) {
            throw new IllegalArgumentException("Lookahead distance must not be negative: " + n);
        }
        int index = offset;
        for (int i = 0; i < n; i++) {
            if (index >= input.length()) return EOF;
            index += Character.charCount(input.codePointAt(index));
        }
        if (index >= input.length()) return EOF;
        return input.codePointAt(index);
    }

    /**
     * Consumes the current code point.
     * @return The consumed code point, or {@link #EOF} (without any state change) at the end of the input.
     */
    public int advance() {
        if (isAtEnd()) return EOF;
        int c = input.codePointAt(offset);
        offset += Character.charCount(c);
        if (c == '\n') {
            line++;
            column = 1;
        } else {
            column++;
        }
        return c;
    }

    /**
     * @return {@code true} if all characters have been consumed.
     */
    public boolean isAtEnd() {
        return offset >= input.length();
    }

    /**
     * @return A snapshot of the current position.
     */
    public SourcePosition position() {
        return new SourcePosition(offset, line, column);
    }

    /**
     * Returns the text consumed since an earlier offset.
     * @param from The offset of a {@link #position()} previously taken from this cursor.
     * @return The input between {@code from} and the current offset.
     */
    public String slice(int from) {
        return input.substring(from, offset);
    }
}
