package io.github.cyfko.reverhttp.core.generation;

import io.github.cyfko.reverhttp.core.ir.IrAuth;
import io.github.cyfko.reverhttp.core.ir.IrDefaults;
import io.github.cyfko.reverhttp.core.ir.IrDocument;
import io.github.cyfko.reverhttp.core.ir.IrImport;
import io.github.cyfko.reverhttp.core.ir.IrOutput;
import io.github.cyfko.reverhttp.core.ir.IrRoute;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("IrDocumentMerger Tests")
class IrDocumentMergerTest {

    private static IrRoute route(String method, String path) {
        return new IrRoute(new IrRoute.Endpoint(method, path), null, null, null, null, null, null, null,
                new IrOutput(200, Map.of(), Map.of()));
    }

    private static IrDefaults defaults(String authMethod) {
        return new IrDefaults(null, null, new IrAuth(authMethod, List.of(), List.of(), null));
    }

    @Test
    @DisplayName("Routes are concatenated in document order")
    void testRoutes() {
        IrDocument a = new IrDocument("0.1", Map.of(), Map.of(), null, List.of(route("GET", "/a")));
        IrDocument b = new IrDocument("0.1", Map.of(), Map.of(), null,
                List.of(route("POST", "/b"), route("DELETE", "/b")));

        IrDocument merged = IrDocumentMerger.merge(a, b);

        assertEquals(List.of("/a", "/b", "/b"),
                merged.routes().stream().map(r -> r.route().path()).toList());
        assertEquals(IrDocument.CURRENT_VERSION, merged.version());
    }

    @Test
    @DisplayName("Later imports and types replace earlier ones with the same name")
    void testLastWins() {
        IrDocument a = new IrDocument("0.1",
                Map.of("db", IrImport.remote("github.com/acme/db", "v1"), "mail", IrImport.local("@/mail")),
                Map.of("User", Map.of("id", "int")), null, List.of());
        IrDocument b = new IrDocument("0.1",
                Map.of("db", IrImport.remote("github.com/acme/db", "v2")),
                Map.of("User", Map.of("id", "string")), null, List.of());

        IrDocument merged = IrDocumentMerger.merge(List.of(a, b));

        assertEquals("v2", merged.imports().get("db").version());
        assertEquals(IrImport.local("@/mail"), merged.imports().get("mail"));
        assertEquals(Map.of("id", "string"), merged.types().get("User"));
    }

    @Test
    @DisplayName("Defaults come from the last document defining them")
    void testDefaults() {
        IrDocument a = new IrDocument("0.1", Map.of(), Map.of(), defaults("bearer"), List.of());
        IrDocument b = new IrDocument("0.1", Map.of(), Map.of(), defaults("basic"), List.of());
        IrDocument c = IrDocument.empty();

        assertEquals("basic", IrDocumentMerger.merge(List.of(a, b, c)).defaults().auth().method());
        assertEquals("bearer", IrDocumentMerger.merge(List.of(c, a)).defaults().auth().method());
    }

    @Test
    @DisplayName("Inputs are left untouched")
    void testInputsUntouched() {
        IrDocument a = new IrDocument("0.1", Map.of(), Map.of(), null, List.of(route("GET", "/a")));
        IrDocument b = new IrDocument("0.1", Map.of(), Map.of(), null, List.of(route("GET", "/b")));

        IrDocumentMerger.merge(a, b);

        assertEquals(1, a.routes().size());
        assertEquals(1, b.routes().size());
    }

    @Test
    @DisplayName("Empty input list yields an empty document")
    void testEmptyList() {
        assertEquals(IrDocument.empty(), IrDocumentMerger.merge(List.of()));
    }

    @Test
    @DisplayName("Null documents are rejected")
    void testNull() {
        assertThrows(NullPointerException.class, () -> IrDocumentMerger.merge(null, IrDocument.empty()));
        assertThrows(NullPointerException.class, () -> IrDocumentMerger.merge((List<IrDocument>) null));
    }
}
