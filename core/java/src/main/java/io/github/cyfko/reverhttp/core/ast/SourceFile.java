package io.github.cyfko.reverhttp.core.ast;

import java.util.List;
import java.util.Optional;

/**
 * Root of the syntax tree built for one source unit.
 * <p>
 * Declarations keep the order in which they were written. A second {@code defaults} block in
 * the same source replaces the first one.
 * </p>
 *
 * @param imports  import declarations in source order
 * @param types    type declarations in source order
 * @param defaults the file-level defaults block, or {@code null} when absent
 * @param routes   routes in source order
 * @author Frank KOSSI
 * @since 0.1.0
 */
public record SourceFile(List<ImportDecl> imports, List<TypeDecl> types, DefaultsBlock defaults, List<Route> routes) {

    public SourceFile {
        imports = List.copyOf(imports);
        types = List.copyOf(types);
        routes = List.copyOf(routes);
    }

    /**
     * @return an empty tree, as produced for sources that were rejected before parsing
     */
    public static SourceFile empty() {
        return new SourceFile(List.of(), List.of(), null, List.of());
    }

    public Optional<DefaultsBlock> defaultsBlock() {
        return Optional.ofNullable(defaults);
    }
}
