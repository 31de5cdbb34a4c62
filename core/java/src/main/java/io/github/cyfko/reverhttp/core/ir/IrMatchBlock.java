package io.github.cyfko.reverhttp.core.ir;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.List;

/**
 * Scrutinee, ordered arms and the optional default arm.
 *
 * @param on         expression being matched
 * @param arms       non-default arms, in source order; always written
 * @param defaultArm the default arm, or {@code null}
 */
@JsonPropertyOrder({"on", "arms", "default"})
public record IrMatchBlock(
        String on,
        List<IrMatchArm> arms,
        @JsonInclude(JsonInclude.Include.NON_NULL) @JsonProperty("default") IrMatchDefault defaultArm) {

    public IrMatchBlock {
        arms = Copies.list(arms);
    }
}
