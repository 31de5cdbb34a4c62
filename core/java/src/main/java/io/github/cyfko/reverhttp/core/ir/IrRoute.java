package io.github.cyfko.reverhttp.core.ir;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.Map;
import java.util.Objects;

/**
 * A lowered route.
 * <p>
 * {@code route} and {@code output} are always serialized. {@code cors} follows the three-state
 * contract of {@link CorsSetting}; every other section is omitted when absent or empty.
 * </p>
 *
 * @param route       method and path
 * @param auth        authentication requirements, or {@code null}
 * @param cache       cache directives, or {@code null}
 * @param cors        CORS setting, never {@code null}
 * @param input       request extraction keyed by variable name
 * @param validate    validation rules, or {@code null}
 * @param transformIn input transformations keyed by variable name
 * @param process     processing steps, or {@code null}
 * @param output      success response, never {@code null}
 * @author Frank KOSSI
 * @since 0.1.0
 */
@JsonPropertyOrder({"route", "auth", "cache", "cors", "input", "validate", "transform_in", "process", "output"})
public record IrRoute(
        Endpoint route,
        @JsonInclude(JsonInclude.Include.NON_NULL) IrAuth auth,
        @JsonInclude(JsonInclude.Include.NON_NULL) IrCache cache,
        @JsonInclude(value = JsonInclude.Include.CUSTOM, valueFilter = CorsSetting.InheritFilter.class) CorsSetting cors,
        @JsonInclude(JsonInclude.Include.NON_EMPTY) Map<String, IrInput> input,
        @JsonInclude(JsonInclude.Include.NON_NULL) IrValidate validate,
        @JsonInclude(JsonInclude.Include.NON_EMPTY) @JsonProperty("transform_in") Map<String, IrTransform> transformIn,
        @JsonInclude(JsonInclude.Include.NON_NULL) IrProcess process,
        IrOutput output) {

    public IrRoute {
        Objects.requireNonNull(route, "route endpoint cannot be null");
        cors = cors == null ? CorsSetting.INHERIT : cors;
        input = Copies.map(input);
        transformIn = Copies.map(transformIn);
        output = output == null ? IrOutput.empty() : output;
    }

    /**
     * @param method HTTP method
     * @param path   path template, verbatim
     */
    @JsonPropertyOrder({"method", "path"})
    public record Endpoint(String method, String path) {
    }
}
