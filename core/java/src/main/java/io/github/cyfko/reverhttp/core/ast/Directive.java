package io.github.cyfko.reverhttp.core.ast;

import io.github.cyfko.reverhttp.core.lexer.Position;

import java.util.List;

/**
 * A {@code cache}, {@code cors} or {@code auth} directive, e.g.
 * {@code auth(bearer, roles: ["admin"]) as current_user}.
 *
 * @param position location of the directive name
 * @param name     directive name
 * @param args     arguments in source order
 * @param bind     result variable from a trailing {@code as name}, or {@code null}
 * @author Frank KOSSI
 * @since 0.1.0
 */
public record Directive(Position position, String name, List<DirectiveArg> args, String bind) {

    public Directive {
        args = List.copyOf(args);
    }

    /**
     * Tells whether the directive carries the {@code none} sentinel, meaning "disabled for this route".
     * This is distinct from the directive being absent altogether.
     *
     * @return {@code true} if one argument is named {@code none}
     */
    public boolean isDisabled() {
        return args.stream().anyMatch(DirectiveArg::isNone);
    }
}
