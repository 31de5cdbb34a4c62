package io.github.cyfko.reverhttp.core.ir;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.Map;

/**
 * Validation rules keyed by field, with the response sent when any of them fails.
 *
 * @param rules rules keyed by field name; always written
 * @param error failure response, or {@code null}
 */
@JsonPropertyOrder({"rules", "error"})
public record IrValidate(
        Map<String, IrValidateRule> rules,
        @JsonInclude(JsonInclude.Include.NON_NULL) IrErrorResponse error) {

    public IrValidate {
        rules = Copies.map(rules);
    }
}
