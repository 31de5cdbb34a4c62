package io.github.cyfko.reverhttp.core.api;

import io.github.cyfko.reverhttp.core.ast.SourceFile;
import io.github.cyfko.reverhttp.core.exception.FlowSyntaxException;

import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Outcome of parsing one source unit.
 *
 * @param ast         the syntax tree, partial when diagnostics were reported
 * @param diagnostics diagnostics in report order
 */
public record ParseResult(SourceFile ast, List<String> diagnostics) {

    public ParseResult {
        Objects.requireNonNull(ast, "ast cannot be null");
        diagnostics = List.copyOf(diagnostics);
    }

    public boolean hasDiagnostics() {
        return !diagnostics.isEmpty();
    }

    /**
     * @return the tree when the parse was clean
     * @throws FlowSyntaxException carrying every diagnostic otherwise
     */
    public SourceFile requireNoDiagnostics() {
        if (hasDiagnostics()) {
            throw new FlowSyntaxException(diagnostics);
        }
        return ast;
    }

    /**
     * @return the diagnostics as typed values
     * @throws IllegalArgumentException if a diagnostic does not follow the documented shape
     */
    public List<Diagnostic> parsedDiagnostics() {
        return diagnostics.stream().map(Diagnostic::parse).collect(Collectors.toList());
    }
}
