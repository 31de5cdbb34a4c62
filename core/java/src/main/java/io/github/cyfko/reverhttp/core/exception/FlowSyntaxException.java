package io.github.cyfko.reverhttp.core.exception;

import io.github.cyfko.reverhttp.core.api.ParseResult;

import java.util.List;

/**
 * Raised by callers that want fail-fast behaviour on a source with diagnostics.
 * <p>
 * The parser itself never throws: it accumulates diagnostics. This exception is produced by
 * {@link ParseResult#requireNoDiagnostics()} and carries every diagnostic of the parse, in order.
 * </p>
 *
 * <p><strong>Usage Example:</strong></p>
 * <pre>{@code
 * try {
 *     SourceFile ast = parser.parse(source, "users.flow").requireNoDiagnostics();
 * } catch (FlowSyntaxException e) {
 *     e.getDiagnostics().forEach(System.err::println);
 * }
 * }</pre>
 *
 * @author Frank KOSSI
 * @since 0.1.0
 */
public class FlowSyntaxException extends RuntimeException {

    private final List<String> diagnostics;

    /**
     * @param diagnostics diagnostics of the failed parse, {@code file:line:column: message}
     */
    public FlowSyntaxException(List<String> diagnostics) {
        super(buildMessage(diagnostics));
        this.diagnostics = List.copyOf(diagnostics);
    }

    public List<String> getDiagnostics() {
        return diagnostics;
    }

    private static String buildMessage(List<String> diagnostics) {
        if (diagnostics.isEmpty()) {
            return "Syntax errors found";
        }
        StringBuilder sb = new StringBuilder()
                .append(diagnostics.size())
                .append(diagnostics.size() == 1 ? " syntax error" : " syntax errors")
                .append(":");
        for (String diagnostic : diagnostics) {
            sb.append(System.lineSeparator()).append("  ").append(diagnostic);
        }
        return sb.toString();
    }
}
