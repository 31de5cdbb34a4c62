package io.github.cyfko.reverhttp.core.lexer;

import java.util.Objects;

/**
 * Immutable source location attached to every token and to every AST node able to
 * produce a diagnostic.
 * <p>
 * Lines and columns are 1-based. The {@link #toString()} form {@code file:line:column}
 * is the prefix of every parser diagnostic.
 * </p>
 *
 * @param file   the file identifier supplied by the caller (never {@code null})
 * @param line   1-based line number
 * @param column 1-based column number
 * @author Frank KOSSI
 * @since 0.1.0
 */
public record Position(String file, int line, int column) {

    public Position {
        Objects.requireNonNull(file, "file identifier cannot be null");
    }

    @Override
    public String toString() {
        return file + ":" + line + ":" + column;
    }
}
