package io.github.cyfko.reverhttp.core.exception;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class FlowSyntaxExceptionTest {

    @Test
    @DisplayName("Should list every diagnostic in the message")
    void shouldListDiagnostics() {
        // Given
        List<String> diagnostics = List.of("a.flow:1:5: expected path after GET", "a.flow:3:1: unexpected token RBRACE (\"}\")");

        // When
        FlowSyntaxException exception = new FlowSyntaxException(diagnostics);

        // Then
        String nl = System.lineSeparator();
        assertEquals("2 syntax errors:" + nl
                + "  a.flow:1:5: expected path after GET" + nl
                + "  a.flow:3:1: unexpected token RBRACE (\"}\")", exception.getMessage());
        assertEquals(diagnostics, exception.getDiagnostics());
        assertNull(exception.getCause());
    }

    @Test
    @DisplayName("Should use singular form for one diagnostic")
    void shouldUseSingular() {
        FlowSyntaxException exception = new FlowSyntaxException(List.of("a.flow:1:1: oops"));
        assertTrue(exception.getMessage().startsWith("1 syntax error:"));
    }

    @Test
    @DisplayName("Should handle empty diagnostics")
    void shouldHandleEmpty() {
        FlowSyntaxException exception = new FlowSyntaxException(List.of());
        assertEquals("Syntax errors found", exception.getMessage());
        assertTrue(exception.getDiagnostics().isEmpty());
    }

    @Test
    @DisplayName("Should copy the diagnostics list")
    void shouldCopyDiagnostics() {
        // Given
        List<String> diagnostics = new ArrayList<>(List.of("a.flow:1:1: oops"));

        // When
        FlowSyntaxException exception = new FlowSyntaxException(diagnostics);
        diagnostics.add("a.flow:2:1: later");

        // Then
        assertEquals(1, exception.getDiagnostics().size());
        assertThrows(UnsupportedOperationException.class, () -> exception.getDiagnostics().add("x"));
    }

    @Test
    @DisplayName("Serialization exception keeps its cause")
    void shouldWrapSerializationCause() {
        Throwable cause = new IllegalStateException("boom");
        IrSerializationException exception = new IrSerializationException("Failed to serialize IR document", cause);
        assertEquals("Failed to serialize IR document", exception.getMessage());
        assertSame(cause, exception.getCause());
    }
}
