package io.github.cyfko.reverhttp.core.ir;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

/**
 * A guard: the request continues only when the condition holds.
 */
@JsonPropertyOrder({"guard", "error"})
public record IrGuardStep(
        IrGuard guard,
        @JsonInclude(JsonInclude.Include.NON_NULL) IrErrorResponse error) implements IrProcessStep {
}
