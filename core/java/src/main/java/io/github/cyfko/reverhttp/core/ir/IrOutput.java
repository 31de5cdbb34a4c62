package io.github.cyfko.reverhttp.core.ir;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.Map;

/**
 * Success response of a route. Status {@code 0} stands for a route without {@code respond}.
 *
 * @param status  HTTP status
 * @param body    body fields, values are literals or dotted paths
 * @param headers response headers
 */
@JsonPropertyOrder({"status", "body", "headers"})
public record IrOutput(
        int status,
        @JsonInclude(JsonInclude.Include.NON_EMPTY) Map<String, String> body,
        @JsonInclude(JsonInclude.Include.NON_EMPTY) Map<String, String> headers) {

    public IrOutput {
        body = Copies.map(body);
        headers = Copies.map(headers);
    }

    public static IrOutput empty() {
        return new IrOutput(0, Map.of(), Map.of());
    }
}
