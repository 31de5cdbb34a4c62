package io.github.cyfko.reverhttp.core.parsing;

import io.github.cyfko.reverhttp.core.lexer.Position;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Ordered collector of parse diagnostics.
 * <p>
 * Every entry has the shape {@code file:line:column: message}. Editor integrations extract the
 * position with {@code ^[^:]+:(\d+):(\d+): (.+)$}, so this format must not change.
 * </p>
 *
 * @author Frank KOSSI
 * @since 0.1.0
 */
public final class Diagnostics {

    private final List<String> entries = new ArrayList<>();

    /**
     * Records a diagnostic at the given position.
     *
     * @param position where the problem was detected
     * @param message  human-readable message
     */
    public void report(Position position, String message) {
        entries.add(position + ": " + message);
    }

    public boolean isEmpty() {
        return entries.isEmpty();
    }

    public int size() {
        return entries.size();
    }

    /**
     * @return an unmodifiable view of the diagnostics, in the order they were reported
     */
    public List<String> asList() {
        return Collections.unmodifiableList(entries);
    }

    /**
     * Quotes a literal for inclusion in a message, escaping quotes, backslashes and control characters.
     *
     * @param literal raw token text
     * @return the literal wrapped in double quotes
     */
    static String quote(String literal) {
        StringBuilder sb = new StringBuilder(literal.length() + 2).append('"');
        for (char c : literal.toCharArray()) {
            switch (c) {
                case '"' -> sb.append("\\\"");
                case '\\' -> sb.append("\\\\");
                case '\n' -> sb.append("\\n");
                case '\r' -> sb.append("\\r");
                case '\t' -> sb.append("\\t");
                default -> sb.append(c);
            }
        }
        return sb.append('"').toString();
    }
}
