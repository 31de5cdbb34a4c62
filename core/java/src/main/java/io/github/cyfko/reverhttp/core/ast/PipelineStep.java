package io.github.cyfko.reverhttp.core.ast;

import io.github.cyfko.reverhttp.core.lexer.Position;

/**
 * One {@code |>} stage of a route.
 * <p>
 * The binding and the error flow may follow any {@link StepBody} variant.
 * </p>
 *
 * @param position  location of the {@code |>} operator
 * @param body      the step variant
 * @param bind      result variable, or {@code null}
 * @param errorFlow error flow, or {@code null}
 * @author Frank KOSSI
 * @since 0.1.0
 */
public record PipelineStep(Position position, StepBody body, String bind, ErrorFlow errorFlow) {
}
