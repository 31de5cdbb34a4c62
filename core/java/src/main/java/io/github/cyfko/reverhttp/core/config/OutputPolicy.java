package io.github.cyfko.reverhttp.core.config;

/**
 * Formatting of serialized IR documents.
 *
 * @param prettyPrint     indent the JSON output
 * @param trailingNewline end the output with a line feed
 * @author Frank KOSSI
 * @since 0.1.0
 */
public record OutputPolicy(boolean prettyPrint, boolean trailingNewline) {

    /**
     * Single-line JSON without trailing newline, suited to piping.
     */
    public static OutputPolicy compact() {
        return new OutputPolicy(false, false);
    }

    /**
     * Indented JSON ending with a newline, suited to files checked into a repository.
     */
    public static OutputPolicy pretty() {
        return new OutputPolicy(true, true);
    }
}
