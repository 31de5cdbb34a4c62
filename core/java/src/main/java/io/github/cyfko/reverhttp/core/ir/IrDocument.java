package io.github.cyfko.reverhttp.core.ir;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Root of the intermediate representation produced for one or more source units.
 * <p>
 * {@code routes} is always serialized, possibly as an empty array; {@code imports}, {@code types}
 * and {@code defaults} are omitted when empty or absent.
 * </p>
 *
 * @param version  IR schema version, {@value #CURRENT_VERSION} for this generation
 * @param imports  package imports keyed by alias
 * @param types    declared types, each mapping field name to type name
 * @param defaults file-level directive defaults, or {@code null}
 * @param routes   routes in declaration order
 * @author Frank KOSSI
 * @since 0.1.0
 */
@JsonPropertyOrder({"version", "imports", "types", "defaults", "routes"})
public record IrDocument(
        String version,
        @JsonInclude(JsonInclude.Include.NON_EMPTY) Map<String, IrImport> imports,
        @JsonInclude(JsonInclude.Include.NON_EMPTY) Map<String, Map<String, String>> types,
        @JsonInclude(JsonInclude.Include.NON_NULL) IrDefaults defaults,
        List<IrRoute> routes) {

    public static final String CURRENT_VERSION = "0.1";

    public IrDocument {
        Objects.requireNonNull(version, "version cannot be null");
        imports = Copies.map(imports);
        types = Copies.map(types);
        routes = Copies.list(routes);
    }

    /**
     * @return a document with the current version and no content
     */
    public static IrDocument empty() {
        return new IrDocument(CURRENT_VERSION, Map.of(), Map.of(), null, List.of());
    }
}
