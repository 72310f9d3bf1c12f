package org.lexora.tokenizer.api;

import org.lexora.tokenizer.lexer.SourcePosition;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

@Tag("unit")
class TokenizationExceptionTest {

    @Test
    void positionIsAppendedToTheMessage() {
        TokenizationException e = new TokenizationException("bad input", new SourcePosition(12, 3, 4));

        assertThat(e).hasMessage("bad input at 3:4").hasNoCause();
    }

    @Test
    void causeIsKept() {
        IllegalStateException cause = new IllegalStateException("boom");

        assertThat(new TokenizationException("wrapped", cause)).hasMessage("wrapped").hasCause(cause);
    }
}
