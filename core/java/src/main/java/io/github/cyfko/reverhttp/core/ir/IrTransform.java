package io.github.cyfko.reverhttp.core.ir;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

/**
 * Transformation of one input variable: either a cast to a primitive type or a function call.
 * Exactly one of {@code cast} and {@code fn} is non-empty.
 *
 * @param cast primitive type name
 * @param fn   function name
 * @param from source variable, or {@code null} when none was written
 */
@JsonPropertyOrder({"cast", "fn", "from"})
@JsonInclude(JsonInclude.Include.NON_EMPTY)
public record IrTransform(String cast, String fn, String from) {

    public static IrTransform cast(String type, String from) {
        return new IrTransform(type, null, from);
    }

    public static IrTransform function(String function, String from) {
        return new IrTransform(null, function, from);
    }
}
