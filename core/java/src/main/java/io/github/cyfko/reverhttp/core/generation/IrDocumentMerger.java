package io.github.cyfko.reverhttp.core.generation;

import io.github.cyfko.reverhttp.core.ir.IrDefaults;
import io.github.cyfko.reverhttp.core.ir.IrDocument;
import io.github.cyfko.reverhttp.core.ir.IrImport;
import io.github.cyfko.reverhttp.core.ir.IrRoute;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.logging.Logger;

/**
 * Combines the documents of several source units into one.
 * <ul>
 *   <li>imports and types: union, the last alias or name wins</li>
 *   <li>defaults: replaced wholesale by any later document that defines them</li>
 *   <li>routes: concatenated in document order</li>
 * </ul>
 * Inputs are left untouched.
 *
 * @author Frank KOSSI
 * @since 0.1.0
 */
public final class IrDocumentMerger {

    private static final Logger log = Logger.getLogger(IrDocumentMerger.class.getName());

    private IrDocumentMerger() {
    }

    public static IrDocument merge(IrDocument first, IrDocument second) {
        return merge(List.of(
                Objects.requireNonNull(first, "first document cannot be null"),
                Objects.requireNonNull(second, "second document cannot be null")));
    }

    /**
     * @param documents documents in processing order
     * @return a fresh document; {@link IrDocument#empty()} for an empty list
     */
    public static IrDocument merge(List<IrDocument> documents) {
        Objects.requireNonNull(documents, "documents cannot be null");

        Map<String, IrImport> imports = new LinkedHashMap<>();
        Map<String, Map<String, String>> types = new LinkedHashMap<>();
        IrDefaults defaults = null;
        List<IrRoute> routes = new ArrayList<>();

        for (IrDocument document : documents) {
            Objects.requireNonNull(document, "documents cannot contain null");
            imports.putAll(document.imports());
            types.putAll(document.types());
            if (document.defaults() != null) {
                defaults = document.defaults();
            }
            routes.addAll(document.routes());
        }

        log.info(() -> String.format("Merged %d IR documents: %d imports, %d types, %d routes",
                documents.size(), imports.size(), types.size(), routes.size()));

        return new IrDocument(IrDocument.CURRENT_VERSION, imports, types, defaults, routes);
    }
}
