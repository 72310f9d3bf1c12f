package org.lexora.tokenizer;

import com.typesafe.config.Config;
import org.lexora.config.LoggingConfigurator;
import org.lexora.tokenizer.api.ITokenizer;
import org.lexora.tokenizer.api.TokenizationResult;
import org.lexora.tokenizer.diagnostics.DiagnosticsEngine;
import org.lexora.tokenizer.lexer.Lexer;
import org.lexora.tokenizer.lexer.LexerOptions;
import org.lexora.tokenizer.lexer.Token;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;

/**
 * The main tokenizer implementation. Every call runs a fresh {@link Lexer} pass, so a
 * single instance can be shared between threads.
 */
public class Tokenizer implements ITokenizer {

    private static final Logger LOG = LoggerFactory.getLogger(Tokenizer.class);

    private final LexerOptions options;

    /**
     * Creates a tokenizer with the default grammar options.
     */
    public Tokenizer() {
        this(LexerOptions.defaults());
    }

    /**
     * Creates a tokenizer with explicit grammar options.
     * @param options The grammar extensions to apply.
     */
    public Tokenizer(LexerOptions options) {
        this.options = Objects.requireNonNull(options, "options");
    }

    /**
     * Creates a tokenizer from the {@code lexora.lexer} block of a configuration and applies
     * its {@code lexora.logging} block through {@link LoggingConfigurator}.
     * @param config The loaded application configuration.
     * @return The configured tokenizer.
     */
    public static Tokenizer fromConfig(Config config) {
        LoggingConfigurator.apply(config);
        LexerOptions options = LexerOptions.fromConfig(config);
        LOG.debug("Tokenizer configured with {}", options);
        return new Tokenizer(options);
    }

    @Override
    public TokenizationResult tokenize(String source) {
        return tokenize(source, Lexer.DEFAULT_SOURCE_NAME);
    }

    @Override
    public TokenizationResult tokenize(String source, String sourceName) {
        DiagnosticsEngine diagnostics = new DiagnosticsEngine();
        List<Token> tokens = lexer(source, sourceName, diagnostics).scanTokens();
        LOG.debug("Tokenized {}: {} tokens, {} diagnostics", sourceName, tokens.size(), diagnostics.getDiagnostics().size());
        return new TokenizationResult(tokens, diagnostics.getDiagnostics());
    }

    /**
     * Creates a lazy lexer for consumers that pull tokens one at a time.
     * @param source The text to scan.
     * @param sourceName The name of the source, for diagnostics.
     * @param diagnostics The engine that receives the diagnostics of the pass.
     * @return A new lexer positioned at the start of the source.
     */
    public Lexer lexer(String source, String sourceName, DiagnosticsEngine diagnostics) {
        return new Lexer(source, diagnostics, sourceName, options);
    }

    /** @return The grammar options of this tokenizer. */
    public LexerOptions getOptions() {
        return options;
    }
}
