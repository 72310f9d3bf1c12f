package org.lexora.tokenizer.diagnostics;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/**
 * An engine for collecting diagnostic messages (errors, warnings)
 * that occur during tokenization.
 * <p>
 * This decouples error reporting from the scanning logic: the lexer never throws,
 * it reports here and lets the consumer decide what is fatal.
 */
public class DiagnosticsEngine {

    private final List<Diagnostic> diagnostics = new ArrayList<>();

    /**
     * Reports an error.
     *
     * @param message    The error message.
     * @param sourceName The source in which the error occurred.
     * @param line       The line of the error.
     * @param column     The column of the error.
     */
    public void reportError(String message, String sourceName, int line, int column) {
        diagnostics.add(new Diagnostic(Diagnostic.Type.ERROR, message, sourceName, line, column));
    }

    /**
     * Reports a warning.
     *
     * @param message    The warning message.
     * @param sourceName The source in which the warning occurred.
     * @param line       The line of the warning.
     * @param column     The column of the warning.
     */
    public void reportWarning(String message, String sourceName, int line, int column) {
        diagnostics.add(new Diagnostic(Diagnostic.Type.WARNING, message, sourceName, line, column));
    }

    /**
     * Checks if errors have been reported.
     *
     * @return {@code true} if at least one error exists, otherwise {@code false}.
     */
    public boolean hasErrors() {
        return diagnostics.stream().anyMatch(d -> d.type() == Diagnostic.Type.ERROR);
    }

    /**
     * Returns an unmodifiable view of all collected diagnostics.
     *
     * @return An unmodifiable list of diagnostics.
     */
    public List<Diagnostic> getDiagnostics() {
        return Collections.unmodifiableList(diagnostics);
    }

    /**
     * Returns all collected diagnostics as a single, formatted string.
     *
     * @return A formatted string summary of all diagnostics.
     */
    public String summary() {
        return diagnostics.stream()
                .map(Diagnostic::toString)
                .collect(Collectors.joining("\n"));
    }
}
