package io.github.cyfko.reverhttp.core.ir;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

/**
 * Constraints on one field. Every component is optional.
 *
 * @param type   declared primitive type
 * @param min    inclusive lower bound
 * @param max    inclusive upper bound
 * @param format format tag such as {@code email}
 */
@JsonPropertyOrder({"type", "min", "max", "format"})
@JsonInclude(JsonInclude.Include.NON_EMPTY)
public record IrValidateRule(String type, Integer min, Integer max, String format) {
}
