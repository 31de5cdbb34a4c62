package io.github.cyfko.reverhttp.core.ir;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

/**
 * A match step.
 *
 * @param bind  variable receiving the selected arm's result
 * @param match the match block
 * @param error failure response of the whole block, or {@code null}
 */
@JsonPropertyOrder({"bind", "match", "error"})
public record IrMatchStep(
        @JsonInclude(JsonInclude.Include.NON_EMPTY) String bind,
        IrMatchBlock match,
        @JsonInclude(JsonInclude.Include.NON_NULL) IrErrorResponse error) implements IrProcessStep {
}
