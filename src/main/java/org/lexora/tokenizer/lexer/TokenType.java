package org.lexora.tokenizer.lexer;

/**
 * Defines the different types of tokens that the {@link Lexer} can recognize.
 */
public enum TokenType {
    // Names.
    /** An identifier, such as a variable or function name. */
    IDENTIFIER,
    /** An identifier-shaped word listed in the configured keyword set. */
    KEYWORD,

    // Literals.
    /** A run of decimal digits, such as 42. */
    INTEGER_LITERAL,
    /** Digits, a dot and digits, such as 3.14. Only produced when float literals are enabled. */
    FLOAT_LITERAL,

    // Symbols.
    /** A separator or bracket, such as ';' or '('. */
    PUNCTUATION,
    /** An operator from the {@link OperatorTable}, such as '+' or '<='. */
    OPERATOR,

    // Miscellaneous.
    /** Represents the end of the input. Always the last token of a pass. */
    END_OF_INPUT,
    /** A character that matches no known category. */
    INVALID
}
