package io.github.cyfko.reverhttp.core.ir;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.Map;

/**
 * One arm of a match block. An arm either invokes a package ({@code use} + {@code input}) or
 * references a variable ({@code ref}). When used as the default arm the pattern is {@code null}.
 */
@JsonPropertyOrder({"pattern", "use", "input", "error", "ref"})
@JsonInclude(JsonInclude.Include.NON_EMPTY)
public record IrMatchArm(
        IrPattern pattern,
        String use,
        Map<String, Object> input,
        IrErrorResponse error,
        String ref) implements IrMatchDefault {

    public IrMatchArm {
        input = Copies.map(input);
    }
}
