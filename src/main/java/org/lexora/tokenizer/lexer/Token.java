package org.lexora.tokenizer.lexer;

/**
 * Represents a single token extracted from the source text by the {@link Lexer}.
 * <p>
 * The {@code value} depends on the type: the keyword text for {@link TokenType#KEYWORD},
 * a {@link java.math.BigInteger} for integer literals, a {@link java.math.BigDecimal} for
 * float literals, a {@link Character} for punctuation, an {@link OperatorKind} for operators
 * and the offending code point as an {@link Integer} for invalid tokens. It is {@code null}
 * for identifiers and the end-of-input marker.
 *
 * @param type The type of the token.
 * @param text The exact text of the token from the source. Empty only for {@link TokenType#END_OF_INPUT}.
 * @param value The processed value of the token, see above.
 * @param position The position of the first character of the token.
 */
public record Token(
        TokenType type,
        String text,
        Object value,
        SourcePosition position
) {

    /**
     * Creates the end-of-input marker at the given position.
     * @param position The position right after the last consumed character.
     * @return A token of type {@link TokenType#END_OF_INPUT} with empty text.
     */
    public static Token endOfInput(SourcePosition position) {
        return new Token(TokenType.END_OF_INPUT, "", null, position);
    }

    /** @return The 1-based line of the token. */
    public int line() {
        return position.line();
    }

    /** @return The 1-based column of the token. */
    public int column() {
        return position.column();
    }

    /**
     * @param expected The type to test against.
     * @return {@code true} if this token has the given type.
     */
    public boolean is(TokenType expected) {
        return type == expected;
    }

    /**
     * @return The operator of an {@link TokenType#OPERATOR} token.
     * @throws IllegalStateException if this token is not an operator.
     */
    public OperatorKind operator() {
        requireType(TokenType.OPERATOR);
        return (OperatorKind) value;
    }

    /**
     * @return The character of a {@link TokenType#PUNCTUATION} token.
     * @throws IllegalStateException if this token is not punctuation.
     */
    public char punctuation() {
        requireType(TokenType.PUNCTUATION);
        return (Character) value;
    }

    /**
     * @return The offending code point of an {@link TokenType#INVALID} token.
     * @throws IllegalStateException if this token is not invalid.
     */
    public int codePoint() {
        requireType(TokenType.INVALID);
        return (Integer) value;
    }

    private void requireType(TokenType expected) {
        if (type != expected) {
            throw new IllegalStateException("Expected a " + expected + " token but was " + type + " '" + text + "' at " + position);
        }
    }

    @Override
    public String toString() {
        return type == TokenType.END_OF_INPUT
                ? type + "@" + position
                : type + "('" + text + "')@" + position;
    }
}
