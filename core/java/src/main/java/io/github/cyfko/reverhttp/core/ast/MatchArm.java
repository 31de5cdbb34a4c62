package io.github.cyfko.reverhttp.core.ast;

import io.github.cyfko.reverhttp.core.lexer.Position;

/**
 * {@code pattern: action [~> status { body }]}
 *
 * @param position  location of the first pattern token
 * @param pattern   arm pattern; {@link MatchPattern.Wildcard} for the default arm
 * @param action    what the arm does
 * @param errorFlow arm-level error flow, or {@code null}
 */
public record MatchArm(Position position, MatchPattern pattern, ArmAction action, ErrorFlow errorFlow) {

    public boolean isDefault() {
        return pattern instanceof MatchPattern.Wildcard;
    }
}
