package org.lexora.tokenizer.lexer;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for the {@link CharClassifier} predicates.
 */
@Tag("unit")
class CharClassifierTest {

    @ParameterizedTest
    @ValueSource(chars = {'a', 'z', 'A', 'Z', '_', 'é', 'ß', 'λ'})
    void identifierStart(char c) {
        assertThat(CharClassifier.isIdentifierStart(c)).isTrue();
        assertThat(CharClassifier.isIdentifierContinue(c)).isTrue();
    }

    @ParameterizedTest
    @ValueSource(chars = {'0', '5', '9'})
    void digitsContinueButDoNotStartIdentifiers(char c) {
        assertThat(CharClassifier.isDigit(c)).isTrue();
        assertThat(CharClassifier.isIdentifierStart(c)).isFalse();
        assertThat(CharClassifier.isIdentifierContinue(c)).isTrue();
    }

    @ParameterizedTest
    @ValueSource(chars = {' ', '\t', '\r', '\n', '\f', '\u000B', '\u0085', '\u00A0', '\u2003', '\u2028', '\u3000'})
    void whitespace(char c) {
        assertThat(CharClassifier.isWhitespace(c)).isTrue();
        assertThat(CharClassifier.isPunctuation(c)).isFalse();
        assertThat(CharClassifier.isOperatorStart(c)).isFalse();
    }

    @ParameterizedTest
    @ValueSource(chars = {';', ',', '.', '(', ')', '{', '}', '[', ']', ':', '#', '$'})
    void punctuation(char c) {
        assertThat(CharClassifier.isPunctuation(c)).isTrue();
        assertThat(CharClassifier.isOperatorStart(c)).isFalse();
    }

    @ParameterizedTest
    @ValueSource(chars = {'=', '+', '-', '*', '/', '%', '<', '>', '!', '&', '|', '^', '~', '?'})
    void operatorStart(char c) {
        assertThat(CharClassifier.isOperatorStart(c)).isTrue();
        assertThat(CharClassifier.isPunctuation(c)).isFalse();
    }

    @ParameterizedTest
    @ValueSource(chars = {'@', '`', '"', '\'', '\\', '\u001C', '\u200B'})
    void unclassifiedCharacters(char c) {
        assertThat(CharClassifier.isIdentifierStart(c)).isFalse();
        assertThat(CharClassifier.isDigit(c)).isFalse();
        assertThat(CharClassifier.isWhitespace(c)).isFalse();
        assertThat(CharClassifier.isPunctuation(c)).isFalse();
        assertThat(CharClassifier.isOperatorStart(c)).isFalse();
    }

    /**
     * Zero-width space and the information separators are not Unicode white space.
     */
    @Test
    void whitespaceFollowsUnicodeWhiteSpaceProperty() {
        assertThat(CharClassifier.isWhitespace(0x1680)).isTrue(); // OGHAM SPACE MARK
        assertThat(CharClassifier.isWhitespace(0x202F)).isTrue(); // NARROW NO-BREAK SPACE
        assertThat(CharClassifier.isWhitespace(0x2029)).isTrue(); // PARAGRAPH SEPARATOR
        assertThat(CharClassifier.isWhitespace(0x200B)).isFalse();
        assertThat(CharClassifier.isWhitespace(0x001F)).isFalse();
        assertThat(CharClassifier.isWhitespace(0xFEFF)).isFalse();
    }

    @Test
    void nonAsciiDigitsAreNotDigits() {
        assertThat(CharClassifier.isDigit('٣')).isFalse(); // ARABIC-INDIC DIGIT THREE
        assertThat(CharClassifier.isIdentifierContinue('٣')).isFalse();
    }

    @Test
    void endOfInputMatchesNothing() {
        assertThat(CharClassifier.isIdentifierStart(Cursor.EOF)).isFalse();
        assertThat(CharClassifier.isIdentifierContinue(Cursor.EOF)).isFalse();
        assertThat(CharClassifier.isDigit(Cursor.EOF)).isFalse();
        assertThat(CharClassifier.isWhitespace(Cursor.EOF)).isFalse();
        assertThat(CharClassifier.isPunctuation(Cursor.EOF)).isFalse();
        assertThat(CharClassifier.isOperatorStart(Cursor.EOF)).isFalse();
    }
}
