package org.lexora.tokenizer.lexer;

import java.util.Arrays;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * The immutable mapping from operator spellings to {@link OperatorKind}s, used by the
 * {@link Lexer} for longest-match-first operator recognition.
 */
public final class OperatorTable {

    private static final Map<String, OperatorKind> OPERATORS = Arrays.stream(OperatorKind.values())
            .collect(Collectors.toUnmodifiableMap(OperatorKind::symbol, Function.identity()));

    private static final int MAX_LENGTH = OPERATORS.keySet().stream()
            .mapToInt(String::length)
            .max()
            .orElse(0);

    private static final Set<Integer> STARTS = OPERATORS.keySet().stream()
            .map(symbol -> symbol.codePointAt(0))
            .collect(Collectors.toUnmodifiableSet());

    private OperatorTable() {}

    /**
     * @param c A code point.
     * @return {@code true} if at least one operator starts with the given character.
     */
    public static boolean isOperatorStart(int c) {
        return STARTS.contains(c);
    }

    /**
     * Looks up an exact operator spelling.
     * @param symbol The operator text.
     * @return The matching operator, or {@code null} if the text is not an operator.
     */
    public static OperatorKind lookup(String symbol) {
        return OPERATORS.get(symbol);
    }

    /**
     * Finds the longest operator starting at the cursor's current position without
     * consuming anything. Longer spellings are always tried before their prefixes.
     * @param cursor The cursor to look ahead on.
     * @return The longest matching operator, or {@code null} if none matches.
     */
    public static OperatorKind longestMatch(Cursor cursor) {
        for (int length = MAX_LENGTH; length > 0; length--) {
            String candidate = lookahead(cursor, length);
            if (candidate == null) continue;
            OperatorKind kind = OPERATORS.get(candidate);
            if (kind != null) return kind;
        }
        return null;
    }

    private static String lookahead(Cursor cursor, int length) {
        StringBuilder sb = new StringBuilder(length);
        for (int i = 0; i < length; i++) {
            int c = cursor.peekAt(i);
            if (c == Cursor.EOF) return null;
            sb.appendCodePoint(c);
        }
        return sb.toString();
    }

    /** @return The length of the longest operator spelling. */
    public static int maxLength() {
        return MAX_LENGTH;
    }
}
