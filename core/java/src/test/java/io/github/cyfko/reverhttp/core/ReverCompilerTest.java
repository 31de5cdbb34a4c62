package io.github.cyfko.reverhttp.core;

import io.github.cyfko.reverhttp.core.api.FlowParser;
import io.github.cyfko.reverhttp.core.api.ParseResult;
import io.github.cyfko.reverhttp.core.ast.SourceFile;
import io.github.cyfko.reverhttp.core.config.CompilerPolicy;
import io.github.cyfko.reverhttp.core.generation.IrGenerator;
import io.github.cyfko.reverhttp.core.ir.IrDocument;
import io.github.cyfko.reverhttp.core.ir.IrRoute;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

/**
 * Tests for the compilation pipeline entry point.
 *
 * @author Frank KOSSI
 * @since 0.1.0
 */
@DisplayName("ReverCompiler Tests")
class ReverCompilerTest {

    private final ReverCompiler compiler = new ReverCompiler();

    @Test
    @DisplayName("Compiles a clean source")
    void testCompile() {
        CompilationResult result = compiler.compile("GET /health\n  |> respond 200 { status: \"up\" }\n", "health.flow");

        assertTrue(result.isSuccessful());
        assertEquals(1, result.ast().routes().size());
        IrRoute route = result.ir().routes().get(0);
        assertEquals(new IrRoute.Endpoint("GET", "/health"), route.route());
        assertEquals(Map.of("status", "up"), route.output().body());
    }

    @Test
    @DisplayName("IR is produced even when diagnostics were reported")
    void testCompileWithDiagnostics() {
        CompilationResult result = compiler.compile("GET /a\n  |> respond\nGET /b\n  |> respond 204\n", "partial.flow");

        assertFalse(result.isSuccessful());
        assertEquals(List.of("partial.flow:2:13: expected status code after 'respond'"), result.diagnostics());
        assertEquals(2, result.ir().routes().size());
        assertEquals(204, result.ir().routes().get(1).output().status());
    }

    @Test
    @DisplayName("Policy limits apply through the compiler")
    void testPolicy() {
        ReverCompiler strict = new ReverCompiler(CompilerPolicy.builder().maxSourceLength(5).build());

        CompilationResult result = strict.compile("GET /health\n", "h.flow");

        assertEquals(1, result.diagnostics().size());
        assertTrue(result.diagnostics().get(0).startsWith("h.flow:1:1: source too long"));
        assertEquals(IrDocument.empty(), result.ir());
    }

    @Test
    @DisplayName("Delegates to the configured parser and generator")
    void testDelegation() {
        // Given
        FlowParser parser = mock(FlowParser.class);
        IrGenerator generator = spy(new IrGenerator());
        SourceFile ast = SourceFile.empty();
        when(parser.parse("src", "f.flow")).thenReturn(new ParseResult(ast, List.of()));

        // When
        CompilationResult result = new ReverCompiler(parser, generator).compile("src", "f.flow");

        // Then
        verify(parser).parse("src", "f.flow");
        verify(generator).generate(ast);
        assertSame(ast, result.ast());
        assertEquals(IrDocument.empty(), result.ir());
    }

    @Test
    @DisplayName("compileAll merges clean units and collects every diagnostic")
    void testCompileAll() {
        Map<String, String> sources = new LinkedHashMap<>();
        sources.put("users.flow", "import db = github.com/acme/db@v1\nGET /users\n  |> respond 200\n");
        sources.put("broken.flow", "GET /broken\n  |> respond\n");
        sources.put("orders.flow", "GET /orders\n  |> respond 200\nPOST /orders\n  |> respond 201\n");

        CompilationResult result = compiler.compileAll(sources);

        assertEquals(List.of("broken.flow:2:13: expected status code after 'respond'"), result.diagnostics());
        assertEquals(List.of("/users", "/orders", "/orders"),
                result.ir().routes().stream().map(r -> r.route().path()).toList());
        assertTrue(result.ir().imports().containsKey("db"));
        assertEquals(2, result.ast().routes().size());
    }

    @Test
    @DisplayName("compileAll of nothing is an empty document")
    void testCompileAllEmpty() {
        CompilationResult result = compiler.compileAll(Map.of());

        assertTrue(result.isSuccessful());
        assertEquals(IrDocument.empty(), result.ir());
        assertEquals(SourceFile.empty(), result.ast());
    }

    @Test
    @DisplayName("Null collaborators are rejected")
    void testNullCollaborators() {
        assertThrows(NullPointerException.class, () -> new ReverCompiler(null, new IrGenerator()));
        assertThrows(NullPointerException.class, () -> new ReverCompiler(mock(FlowParser.class), null));
        assertThrows(NullPointerException.class, () -> compiler.compileAll(null));
    }
}
