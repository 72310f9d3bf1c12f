package org.lexora.tokenizer.lexer;

import org.lexora.tokenizer.diagnostics.DiagnosticsEngine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/**
 * The Lexer (also known as Tokenizer or Scanner) is responsible for converting
 * a sequence of characters (source text) into a sequence of tokens.
 * <p>
 * Tokens are produced lazily: every call to {@link #next()} skips whitespace and scans
 * exactly one token. The pass ends with a single {@link TokenType#END_OF_INPUT} token,
 * after which {@link #hasNext()} returns {@code false}. A lexer cannot be restarted;
 * create a new one to scan the same text again. It is not thread-safe.
 * <p>
 * The lexer never throws for any input. Unknown characters become
 * {@link TokenType#INVALID} tokens and are reported to the {@link DiagnosticsEngine}.
 */
public class Lexer implements Iterator<Token> {

    private static final Logger LOG = LoggerFactory.getLogger(Lexer.class);

    /** The logical name used when none is given. */
    public static final String DEFAULT_SOURCE_NAME = "<memory>";

    private enum State { SCANNING, DONE }

    private final Cursor cursor;
    private final DiagnosticsEngine diagnostics;
    private final String sourceName;
    private final LexerOptions options;
    private State state = State.SCANNING;
    private int tokenCount = 0;

    /**
     * Creates a new Lexer with the default grammar options.
     * @param source The source text as a single string.
     * @param diagnostics The engine for reporting errors.
     */
    public Lexer(String source, DiagnosticsEngine diagnostics) {
        this(source, diagnostics, DEFAULT_SOURCE_NAME, LexerOptions.defaults());
    }

    /**
     * Creates a new Lexer with an explicit logical source name.
     * @param source The source text as a single string.
     * @param diagnostics The engine for reporting errors.
     * @param sourceName The name of the source being scanned, for error reporting.
     */
    public Lexer(String source, DiagnosticsEngine diagnostics, String sourceName) {
        this(source, diagnostics, sourceName, LexerOptions.defaults());
    }

    /**
     * Creates a new Lexer.
     * @param source The source text as a single string.
     * @param diagnostics The engine for reporting errors.
     * @param sourceName The name of the source being scanned, for error reporting.
     * @param options The grammar extensions to apply.
     */
    public Lexer(String source, DiagnosticsEngine diagnostics, String sourceName, LexerOptions options) {
        this.cursor = new Cursor(source);
        this.diagnostics = Objects.requireNonNull(diagnostics, "diagnostics");
        this.sourceName = sourceName != null ? sourceName : DEFAULT_SOURCE_NAME;
        this.options = Objects.requireNonNull(options, "options");
    }

    /**
     * Scans all remaining tokens of the pass.
     * @return The remaining tokens, ending with {@link TokenType#END_OF_INPUT}; empty if the pass is already done.
     */
    public List<Token> scanTokens() {
        List<Token> tokens = new ArrayList<>();
        while (hasNext()) {
            tokens.add(next());
        }
        return tokens;
    }

    /**
     * @return The remaining tokens as a lazy, sequential stream.
     */
    public Stream<Token> stream() {
        return StreamSupport.stream(
                Spliterators.spliteratorUnknownSize(this, Spliterator.ORDERED | Spliterator.NONNULL), false);
    }

    @Override
    public boolean hasNext() {
        return state == State.SCANNING;
    }

    @Override
    public Token next() {
        if (state == State.DONE) {
            throw new NoSuchElementException("End of input already reached in " + sourceName);
        }
        skipWhitespaceAndComments();

        SourcePosition start = cursor.position();
        int c = cursor.peek();
        Token token;
        if (c == Cursor.EOF) {
            token = Token.endOfInput(start);
            state = State.DONE;
        } else if (CharClassifier.isIdentifierStart(c)) {
            token = identifier(start);
        } else if (CharClassifier.isDigit(c)) {
            token = number(start);
        } else if (CharClassifier.isOperatorStart(c)) {
            token = operator(start);
        } else if (CharClassifier.isPunctuation(c)) {
            token = punctuation(start);
        } else {
            token = invalid(start);
        }

        tokenCount++;
        if (LOG.isTraceEnabled()) {
            LOG.trace("{}: {}", sourceName, token);
        }
        if (state == State.DONE) {
            LOG.debug("Scanned {} tokens from {}", tokenCount, sourceName);
        }
        return token;
    }

    private void skipWhitespaceAndComments() {
        while (true) {
            int c = cursor.peek();
            if (CharClassifier.isWhitespace(c)) {
                cursor.advance();
            } else if (c == '/' && options.lineComments() && cursor.peekAt(1) == '/') {
                // A comment goes until the end of the line.
                while (cursor.peek() != '\n' && !cursor.isAtEnd()) cursor.advance();
            } else if (c == '/' && options.blockComments() && cursor.peekAt(1) == '*') {
                blockComment();
            } else {
                return;
            }
        }
    }

    private void blockComment() {
        SourcePosition start = cursor.position();
        cursor.advance(); // '/'
        cursor.advance(); // '*'
        while (!cursor.isAtEnd()) {
            if (cursor.peek() == '*' && cursor.peekAt(1) == '/') {
                cursor.advance();
                cursor.advance();
                return;
            }
            cursor.advance();
        }
        diagnostics.reportWarning("Unterminated block comment.", sourceName, start.line(), start.column());
    }

    private Token identifier(SourcePosition start) {
        while (CharClassifier.isIdentifierContinue(cursor.peek())) cursor.advance();
        String text = cursor.slice(start.offset());
        if (options.isKeyword(text)) {
            return new Token(TokenType.KEYWORD, text, text, start);
        }
        return new Token(TokenType.IDENTIFIER, text, null, start);
    }

    private Token number(SourcePosition start) {
        while (CharClassifier.isDigit(cursor.peek())) cursor.advance();

        // A dot only belongs to the number if a digit follows it.
        if (options.floatLiterals() && cursor.peek() == '.' && CharClassifier.isDigit(cursor.peekAt(1))) {
            cursor.advance(); // consume the '.'
            while (CharClassifier.isDigit(cursor.peek())) cursor.advance();
            String text = cursor.slice(start.offset());
            return new Token(TokenType.FLOAT_LITERAL, text, new BigDecimal(text), start);
        }

        String text = cursor.slice(start.offset());
        return new Token(TokenType.INTEGER_LITERAL, text, new BigInteger(text), start);
    }

    private Token operator(SourcePosition start) {
        OperatorKind kind = OperatorTable.longestMatch(cursor);
        if (kind == null) {
            return invalid(start);
        }
        for (int i = 0; i < kind.symbol().length(); i++) {
            cursor.advance();
        }
        return new Token(TokenType.OPERATOR, cursor.slice(start.offset()), kind, start);
    }

    private Token punctuation(SourcePosition start) {
        char c = (char) cursor.advance();
        return new Token(TokenType.PUNCTUATION, cursor.slice(start.offset()), c, start);
    }

    private Token invalid(SourcePosition start) {
        int c = cursor.advance();
        String text = cursor.slice(start.offset());
        diagnostics.reportError(String.format("Unexpected character '%s' (U+%04X)", text, c),
                sourceName, start.line(), start.column());
        return new Token(TokenType.INVALID, text, c, start);
    }

    /** @return The logical name of the scanned source. */
    public String getSourceName() {
        return sourceName;
    }
}
