package org.lexora.tokenizer.api;

import org.lexora.tokenizer.diagnostics.Diagnostic;
import org.lexora.tokenizer.lexer.Token;
import org.lexora.tokenizer.lexer.TokenType;

import java.util.List;
import java.util.stream.Collectors;

/**
 * The outcome of one complete tokenization pass.
 *
 * @param tokens All tokens in source order; the last one is always {@link TokenType#END_OF_INPUT}.
 * @param diagnostics The diagnostics reported during the pass.
 */
public record TokenizationResult(List<Token> tokens, List<Diagnostic> diagnostics) {

    public TokenizationResult {
        tokens = List.copyOf(tokens);
        diagnostics = List.copyOf(diagnostics);
    }

    /**
     * @return {@code true} if the pass produced at least one {@link TokenType#INVALID} token.
     */
    public boolean hasInvalidTokens() {
        return tokens.stream().anyMatch(t -> t.is(TokenType.INVALID));
    }

    /**
     * @return The invalid tokens in source order.
     */
    public List<Token> invalidTokens() {
        return tokens.stream().filter(t -> t.is(TokenType.INVALID)).collect(Collectors.toList());
    }

    /**
     * @return All tokens except the trailing end-of-input marker.
     */
    public List<Token> significantTokens() {
        if (tokens.isEmpty()) return List.of();
        return tokens.subList(0, tokens.size() - 1);
    }

    /**
     * Applies the strict policy: any invalid token makes the whole result unusable.
     * @return This result, for chaining.
     * @throws TokenizationException if the pass produced invalid tokens.
     */
    public TokenizationResult throwIfInvalid() throws TokenizationException {
        List<Token> invalid = invalidTokens();
        if (!invalid.isEmpty()) {
            String summary = diagnostics.stream()
                    .filter(d -> d.type() == Diagnostic.Type.ERROR)
                    .map(Diagnostic::toString)
                    .collect(Collectors.joining("\n"));
            throw new TokenizationException(invalid.size() + " invalid token(s):\n" + summary, invalid.get(0).position());
        }
        return this;
    }
}
