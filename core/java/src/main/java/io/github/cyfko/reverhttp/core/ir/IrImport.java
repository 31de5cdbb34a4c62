package io.github.cyfko.reverhttp.core.ir;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

/**
 * An imported package: either remote (with a version) or local (path starting with {@code @/}).
 *
 * @param source  package source
 * @param version version tag for remote imports, empty for local ones
 * @param local   {@code true} for local imports, {@code null} otherwise
 */
@JsonPropertyOrder({"source", "version", "local"})
public record IrImport(
        String source,
        @JsonInclude(JsonInclude.Include.NON_EMPTY) String version,
        @JsonInclude(JsonInclude.Include.NON_NULL) Boolean local) {

    public static IrImport remote(String source, String version) {
        return new IrImport(source, version, null);
    }

    public static IrImport local(String source) {
        return new IrImport(source, "", Boolean.TRUE);
    }
}
