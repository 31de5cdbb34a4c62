package io.github.cyfko.reverhttp.core.ast;

import io.github.cyfko.reverhttp.core.lexer.Position;

import java.util.List;

/**
 * A route and its pipeline.
 *
 * @param position   location of the HTTP method keyword
 * @param method     HTTP method, upper case
 * @param path       literal path text, {@code {param}} placeholders included
 * @param directives directives in source order
 * @param steps      pipeline steps in source order
 * @author Frank KOSSI
 * @since 0.1.0
 */
public record Route(Position position, String method, String path, List<Directive> directives, List<PipelineStep> steps) {

    public Route {
        directives = List.copyOf(directives);
        steps = List.copyOf(steps);
    }
}
