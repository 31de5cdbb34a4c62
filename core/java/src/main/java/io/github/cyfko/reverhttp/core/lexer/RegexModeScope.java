package io.github.cyfko.reverhttp.core.lexer;

/**
 * Scoped activation of the lexer's regex mode.
 * <p>
 * Obtained from {@link Lexer#enterRegexMode()} and meant for try-with-resources: closing the
 * scope restores whatever mode was active when it was opened, even when the enclosed parsing
 * code fails.
 * </p>
 *
 * <pre>{@code
 * try (RegexModeScope ignored = lexer.enterRegexMode()) {
 *     // '/' now starts a regex literal
 * }
 * }</pre>
 *
 * @author Frank KOSSI
 * @since 0.1.0
 */
public final class RegexModeScope implements AutoCloseable {

    private final Lexer lexer;
    private final boolean previous;
    private boolean closed;

    RegexModeScope(Lexer lexer, boolean previous) {
        this.lexer = lexer;
        this.previous = previous;
    }

    @Override
    public void close() {
        if (!closed) {
            closed = true;
            lexer.setRegexMode(previous);
        }
    }
}
