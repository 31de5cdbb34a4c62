package io.github.cyfko.reverhttp.core.ir;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.List;

/**
 * CORS configuration.
 */
@JsonPropertyOrder({"origins", "methods", "headers", "expose_headers", "max_age", "credentials"})
@JsonInclude(JsonInclude.Include.NON_EMPTY)
public record IrCors(
        List<String> origins,
        List<String> methods,
        List<String> headers,
        @JsonProperty("expose_headers") List<String> exposeHeaders,
        @JsonProperty("max_age") Integer maxAge,
        Boolean credentials) {

    public IrCors {
        origins = Copies.list(origins);
        methods = Copies.list(methods);
        headers = Copies.list(headers);
        exposeHeaders = Copies.list(exposeHeaders);
    }
}
