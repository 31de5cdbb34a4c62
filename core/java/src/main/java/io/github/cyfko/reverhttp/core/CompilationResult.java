package io.github.cyfko.reverhttp.core;

import io.github.cyfko.reverhttp.core.ast.SourceFile;
import io.github.cyfko.reverhttp.core.ir.IrDocument;

import java.util.List;
import java.util.Objects;

/**
 * Syntax tree, diagnostics and IR of a compilation.
 *
 * @param ast         syntax tree
 * @param diagnostics diagnostics in report order
 * @param ir          generated document
 */
public record CompilationResult(SourceFile ast, List<String> diagnostics, IrDocument ir) {

    public CompilationResult {
        Objects.requireNonNull(ast, "ast cannot be null");
        Objects.requireNonNull(ir, "ir cannot be null");
        diagnostics = List.copyOf(diagnostics);
    }

    public boolean isSuccessful() {
        return diagnostics.isEmpty();
    }
}
