package org.lexora.tokenizer.lexer;

/**
 * Stateless predicates that map a code point to its lexical category.
 * All predicates return {@code false} for {@link Cursor#EOF}.
 */
public final class CharClassifier {

    private static final String PUNCTUATION = ";,.(){}[]:#$";

    private CharClassifier() {}

    /**
     * @param c A code point.
     * @return {@code true} for any Unicode letter and the underscore.
     */
    public static boolean isIdentifierStart(int c) {
        return c == '_' || (c != Cursor.EOF && Character.isLetter(c));
    }

    /**
     * @param c A code point.
     * @return {@code true} for identifier-start characters and ASCII digits.
     */
    public static boolean isIdentifierContinue(int c) {
        return isIdentifierStart(c) || isDigit(c);
    }

    public static boolean isDigit(int c) {
        return c >= '0' && c <= '9';
    }

    /**
     * Whitespace as defined by the Unicode {@code White_Space} property: the ASCII controls
     * tab through carriage return, next line (U+0085) and every space, line or paragraph
     * separator, including the non-breaking ones.
     * @param c A code point.
     * @return {@code true} if the character separates tokens and is otherwise ignored.
     */
    public static boolean isWhitespace(int c) {
        return (c >= '\t' && c <= '\r') || c == '\u0085' || (c != Cursor.EOF && Character.isSpaceChar(c));
    }

    public static boolean isPunctuation(int c) {
        return c != Cursor.EOF && PUNCTUATION.indexOf(c) >= 0;
    }

    /**
     * @param c A code point.
     * @return {@code true} if some entry of the {@link OperatorTable} starts with this character.
     */
    public static boolean isOperatorStart(int c) {
        return OperatorTable.isOperatorStart(c);
    }
}
