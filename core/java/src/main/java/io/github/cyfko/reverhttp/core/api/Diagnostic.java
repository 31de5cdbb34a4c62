package io.github.cyfko.reverhttp.core.api;

import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Typed view of a diagnostic string {@code file:line:column: message}.
 * <p>
 * Editor integrations rely on the pattern {@link #FORMAT}; line and column are 1-based and
 * {@link #zeroBasedLine()} / {@link #zeroBasedColumn()} convert them for protocols counting from 0.
 * The file part cannot contain a colon.
 * </p>
 *
 * @param line    1-based line
 * @param column  1-based column
 * @param message diagnostic text
 * @author Frank KOSSI
 * @since 0.1.0
 */
public record Diagnostic(int line, int column, String message) {

    public static final Pattern FORMAT = Pattern.compile("^[^:]+:(\\d+):(\\d+): (.+)$");

    public Diagnostic {
        Objects.requireNonNull(message, "message cannot be null");
    }

    /**
     * @param diagnostic a diagnostic string
     * @return the parsed diagnostic
     * @throws IllegalArgumentException if the string does not match {@link #FORMAT}
     */
    public static Diagnostic parse(String diagnostic) {
        Objects.requireNonNull(diagnostic, "diagnostic cannot be null");
        Matcher m = FORMAT.matcher(diagnostic);
        if (!m.matches()) {
            throw new IllegalArgumentException("Not a diagnostic: " + diagnostic);
        }
        try {
            return new Diagnostic(Integer.parseInt(m.group(1)), Integer.parseInt(m.group(2)), m.group(3));
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Position out of range in diagnostic: " + diagnostic, e);
        }
    }

    public int zeroBasedLine() {
        return Math.max(0, line - 1);
    }

    public int zeroBasedColumn() {
        return Math.max(0, column - 1);
    }
}
