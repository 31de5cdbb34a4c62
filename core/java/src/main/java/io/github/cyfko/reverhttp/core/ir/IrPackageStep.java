package io.github.cyfko.reverhttp.core.ir;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.Map;

/**
 * Invocation of an imported package.
 *
 * @param bind  variable receiving the result
 * @param use   package alias
 * @param input arguments; values are strings, or a string map for {@code data}. Always written.
 * @param error failure response, or {@code null}
 */
@JsonPropertyOrder({"bind", "use", "input", "error"})
public record IrPackageStep(
        @JsonInclude(JsonInclude.Include.NON_EMPTY) String bind,
        String use,
        Map<String, Object> input,
        @JsonInclude(JsonInclude.Include.NON_NULL) IrErrorResponse error) implements IrProcessStep {

    public IrPackageStep {
        input = Copies.map(input);
    }
}
