package io.github.cyfko.reverhttp.core.ast;

import io.github.cyfko.reverhttp.core.lexer.Position;

import java.util.List;

/**
 * File-level directives applied to every route as cross-cutting defaults.
 *
 * @param position   location of the {@code defaults} keyword
 * @param directives directives in source order
 */
public record DefaultsBlock(Position position, List<Directive> directives) {

    public DefaultsBlock {
        directives = List.copyOf(directives);
    }
}
