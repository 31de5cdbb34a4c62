package io.github.cyfko.reverhttp.core.ast;

import io.github.cyfko.reverhttp.core.lexer.Position;

import java.util.List;

/**
 * Alternate path taken when a step fails: {@code ~> 404 { error: "not found" }}.
 *
 * @param position location of the {@code ~>} operator
 * @param status   status code literal, empty if it was missing
 * @param body     body fields in source order
 */
public record ErrorFlow(Position position, String status, List<BodyField> body) {

    public ErrorFlow {
        body = List.copyOf(body);
    }
}
