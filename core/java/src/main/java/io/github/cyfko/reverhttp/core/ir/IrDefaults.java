package io.github.cyfko.reverhttp.core.ir;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

/**
 * File-level directives. Stored apart from the routes; merging them into each route is left to
 * downstream consumers.
 */
@JsonPropertyOrder({"cache", "cors", "auth"})
@JsonInclude(JsonInclude.Include.NON_NULL)
public record IrDefaults(IrCache cache, IrCors cors, IrAuth auth) {
}
