package org.lexora.tokenizer.lexer;

import com.typesafe.config.Config;

import java.util.LinkedHashSet;
import java.util.Set;

/**
 * The optional grammar extensions of the {@link Lexer}.
 *
 * <h3>Configuration Structure:</h3>
 * <pre>
 * lexora.lexer {
 *   float-literals = true    # 3.14 is one FLOAT_LITERAL instead of 3 . 14
 *   line-comments = false    # skip // up to the end of the line
 *   block-comments = false   # skip /* ... *&#47; (not nested)
 *   keywords = []            # identifier-shaped words emitted as KEYWORD
 * }
 * </pre>
 *
 * @param floatLiterals Whether digits, a dot and digits form a single float literal.
 * @param lineComments Whether {@code //} comments are skipped like whitespace.
 * @param blockComments Whether {@code /* ... *&#47;} comments are skipped like whitespace.
 * @param keywords The reserved words. Each must be identifier-shaped.
 */
public record LexerOptions(
        boolean floatLiterals,
        boolean lineComments,
        boolean blockComments,
        Set<String> keywords
) {

    /** The configuration path of the lexer settings. */
    public static final String CONFIG_PATH = "lexora.lexer";

    private static final LexerOptions DEFAULTS = new LexerOptions(true, false, false, Set.of());

    public LexerOptions {
        if (keywords == null) {
            keywords = Set.of();
        }
        for (String keyword : keywords) {
            if (!isIdentifierShaped(keyword)) {
                throw new IllegalArgumentException("Keyword is not a valid identifier: '" + keyword + "'");
            }
        }
        keywords = Set.copyOf(keywords);
    }

    /**
     * @return Float literals on, comments off, no keywords.
     */
    public static LexerOptions defaults() {
        return DEFAULTS;
    }

    /**
     * Reads the options from the {@value #CONFIG_PATH} block. Missing keys keep their defaults.
     * @param config The application configuration.
     * @return The configured options.
     */
    public static LexerOptions fromConfig(Config config) {
        if (!config.hasPath(CONFIG_PATH)) {
            return DEFAULTS;
        }
        Config lexer = config.getConfig(CONFIG_PATH);
        return new LexerOptions(
                lexer.hasPath("float-literals") ? lexer.getBoolean("float-literals") : DEFAULTS.floatLiterals(),
                lexer.hasPath("line-comments") ? lexer.getBoolean("line-comments") : DEFAULTS.lineComments(),
                lexer.hasPath("block-comments") ? lexer.getBoolean("block-comments") : DEFAULTS.blockComments(),
                lexer.hasPath("keywords") ? new LinkedHashSet<>(lexer.getStringList("keywords")) : DEFAULTS.keywords()
        );
    }

    public LexerOptions withFloatLiterals(boolean enabled) {
        return new LexerOptions(enabled, lineComments, blockComments, keywords);
    }

    public LexerOptions withLineComments(boolean enabled) {
        return new LexerOptions(floatLiterals, enabled, blockComments, keywords);
    }

    public LexerOptions withBlockComments(boolean enabled) {
        return new LexerOptions(floatLiterals, lineComments, enabled, keywords);
    }

    public LexerOptions withKeywords(Set<String> newKeywords) {
        return new LexerOptions(floatLiterals, lineComments, blockComments, newKeywords);
    }

    /**
     * @param text An identifier text.
     * @return {@code true} if the text is one of the configured keywords.
     */
    public boolean isKeyword(String text) {
        return keywords.contains(text);
    }

    private static boolean isIdentifierShaped(String text) {
        if (text == null || text.isEmpty()) return false;
        if (!CharClassifier.isIdentifierStart(text.codePointAt(0))) return false;
        return text.codePoints().allMatch(CharClassifier::isIdentifierContinue);
    }
}
