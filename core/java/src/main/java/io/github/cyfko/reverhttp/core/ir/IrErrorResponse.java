package io.github.cyfko.reverhttp.core.ir;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.Map;

/**
 * Response sent on the error path of a step.
 */
@JsonPropertyOrder({"status", "body"})
public record IrErrorResponse(
        int status,
        @JsonInclude(JsonInclude.Include.NON_EMPTY) Map<String, String> body) {

    public IrErrorResponse {
        body = Copies.map(body);
    }
}
