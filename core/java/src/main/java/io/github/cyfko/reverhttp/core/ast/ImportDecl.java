package io.github.cyfko.reverhttp.core.ast;

import io.github.cyfko.reverhttp.core.lexer.Position;

/**
 * Import of a remote package ({@code import fetch = github.com/reverhttp/std-fetch@0.1.0}) or of
 * a local flow file ({@code import users = @/src/users.rever}).
 *
 * @param position location of the {@code import} keyword
 * @param alias    name the package is referred to by in pipeline steps
 * @param source   source path, verbatim; local sources keep their {@code @/} prefix
 * @param version  version tag of a remote import, empty when absent or local
 * @param local    whether the source is a local path
 */
public record ImportDecl(Position position, String alias, String source, String version, boolean local) {
}
