package org.lexora.tokenizer.api;

/**
 * The public entry point for turning source text into tokens.
 */
public interface ITokenizer {

    /**
     * Tokenizes a complete source text. This never fails: unknown characters are
     * returned as invalid tokens together with an error diagnostic.
     *
     * @param source The text to scan.
     * @return The tokens, ending with the end-of-input marker, and the collected diagnostics.
     */
    TokenizationResult tokenize(String source);

    /**
     * Tokenizes a complete source text under a logical name used in diagnostics.
     *
     * @param source The text to scan.
     * @param sourceName The name of the source, e.g. a file path.
     * @return The tokens, ending with the end-of-input marker, and the collected diagnostics.
     */
    TokenizationResult tokenize(String source, String sourceName);
}
