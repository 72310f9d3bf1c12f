package org.lexora.tokenizer.lexer;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import static org.assertj.core.api.Assertions.assertThat;

@Tag("unit")
class OperatorTableTest {

    @ParameterizedTest
    @EnumSource(OperatorKind.class)
    void everyOperatorIsReachableBySpelling(OperatorKind kind) {
        assertThat(OperatorTable.lookup(kind.symbol())).isSameAs(kind);
        assertThat(OperatorTable.isOperatorStart(kind.symbol().charAt(0))).isTrue();
    }

    @ParameterizedTest
    @EnumSource(OperatorKind.class)
    void everyPrefixOfAnOperatorIsItselfAnOperator(OperatorKind kind) {
        // Guarantees the fallback after a failed longer match always finds something.
        String symbol = kind.symbol();
        for (int length = 1; length < symbol.length(); length++) {
            assertThat(OperatorTable.lookup(symbol.substring(0, length)))
                    .as("prefix of %s", symbol)
                    .isNotNull();
        }
    }

    @Test
    void longestMatchPrefersTwoCharacterOperators() {
        Cursor cursor = new Cursor("<=b");

        assertThat(OperatorTable.longestMatch(cursor)).isEqualTo(OperatorKind.LESS_EQUAL);
        assertThat(cursor.position()).isEqualTo(SourcePosition.START);
    }

    @Test
    void longestMatchFallsBackToSingleCharacter() {
        assertThat(OperatorTable.longestMatch(new Cursor("<b"))).isEqualTo(OperatorKind.LESS);
        assertThat(OperatorTable.longestMatch(new Cursor("<"))).isEqualTo(OperatorKind.LESS);
        assertThat(OperatorTable.longestMatch(new Cursor("<>"))).isEqualTo(OperatorKind.LESS);
    }

    @Test
    void noMatchForNonOperators() {
        assertThat(OperatorTable.longestMatch(new Cursor("@="))).isNull();
        assertThat(OperatorTable.longestMatch(new Cursor(""))).isNull();
        assertThat(OperatorTable.lookup("===")).isNull();
    }

    @Test
    void maxLengthCoversTwoCharacterOperators() {
        assertThat(OperatorTable.maxLength()).isEqualTo(2);
    }
}
