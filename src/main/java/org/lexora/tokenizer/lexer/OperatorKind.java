package org.lexora.tokenizer.lexer;

/**
 * The operators known to the lexer, each with its source spelling.
 */
public enum OperatorKind {
    // Two-character operators.
    EQUAL_EQUAL("=="),
    BANG_EQUAL("!="),
    LESS_EQUAL("<="),
    GREATER_EQUAL(">="),
    AND_AND("&&"),
    OR_OR("||"),
    ARROW("->"),
    SHIFT_LEFT("<<"),
    SHIFT_RIGHT(">>"),
    PLUS_EQUAL("+="),
    MINUS_EQUAL("-="),
    STAR_EQUAL("*="),
    SLASH_EQUAL("/="),
    PERCENT_EQUAL("%="),

    // Single-character operators.
    EQUAL("="),
    PLUS("+"),
    MINUS("-"),
    STAR("*"),
    SLASH("/"),
    PERCENT("%"),
    LESS("<"),
    GREATER(">"),
    BANG("!"),
    AMPERSAND("&"),
    PIPE("|"),
    CARET("^"),
    TILDE("~"),
    QUESTION("?");

    private final String symbol;

    OperatorKind(String symbol) {
        this.symbol = symbol;
    }

    /**
     * @return The exact source text of this operator.
     */
    public String symbol() {
        return symbol;
    }
}
