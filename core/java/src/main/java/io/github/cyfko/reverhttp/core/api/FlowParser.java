package io.github.cyfko.reverhttp.core.api;

/**
 * Parse entry point: turns the text of one source unit into a syntax tree plus diagnostics.
 *
 * <p><strong>Example:</strong></p>
 * <pre>{@code
 * FlowParser parser = new BasicFlowParser();
 * ParseResult result = parser.parse("GET /health\n  |> respond 200\n", "health.flow");
 * result.diagnostics();   // []
 * result.ast().routes();  // one route
 * }</pre>
 *
 * @author Frank KOSSI
 * @since 0.1.0
 */
public interface FlowParser {

    /**
     * Parses one source unit. Malformed input never throws: the result holds a best-effort tree and
     * one diagnostic per problem, each shaped {@code file:line:column: message} with 1-based
     * line and column.
     *
     * @param source source text
     * @param file   file identifier used in positions and diagnostics
     * @return the tree and its diagnostics
     * @throws NullPointerException if any argument is null
     */
    ParseResult parse(String source, String file);
}
