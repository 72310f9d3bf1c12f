package org.lexora.tokenizer.api;

import org.lexora.tokenizer.lexer.SourcePosition;

/**
 * Thrown when a consumer decides that a tokenization result is unusable,
 * see {@link TokenizationResult#throwIfInvalid()}. The lexer itself never throws it.
 */
public class TokenizationException extends Exception {

    /**
     * Constructs a new tokenization exception with the specified detail message.
     * @param message The detail message.
     */
    public TokenizationException(String message) {
        super(message, null);
    }

    /**
     * Constructs a new tokenization exception with the specified detail message and cause.
     * @param message The detail message.
     * @param cause The cause.
     */
    public TokenizationException(String message, Throwable cause) {
        super(message, cause);
    }

    /**
     * Constructs a new tokenization exception with the specified detail message and source position.
     * @param message The detail message.
     * @param position The position of the first offending token.
     */
    public TokenizationException(String message, SourcePosition position) {
        super(String.format("%s at %s", message, position), null);
    }
}
