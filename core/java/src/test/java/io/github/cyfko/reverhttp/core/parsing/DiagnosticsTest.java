package io.github.cyfko.reverhttp.core.parsing;

import io.github.cyfko.reverhttp.core.lexer.Position;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Diagnostics Tests")
class DiagnosticsTest {

    @Test
    @DisplayName("Entries are formatted as file:line:column: message, in report order")
    void testFormat() {
        Diagnostics diagnostics = new Diagnostics();
        diagnostics.report(new Position("a.flow", 2, 5), "first");
        diagnostics.report(new Position("a.flow", 1, 1), "second");

        assertEquals(List.of("a.flow:2:5: first", "a.flow:1:1: second"), diagnostics.asList());
        assertEquals(2, diagnostics.size());
        assertFalse(diagnostics.isEmpty());
    }

    @Test
    @DisplayName("View is read-only")
    void testUnmodifiable() {
        Diagnostics diagnostics = new Diagnostics();
        assertThrows(UnsupportedOperationException.class, () -> diagnostics.asList().add("x"));
    }

    @Test
    @DisplayName("Quoting escapes control characters")
    void testQuote() {
        assertEquals("\"\\n\"", Diagnostics.quote("\n"));
        assertEquals("\"a\\\"b\"", Diagnostics.quote("a\"b"));
        assertEquals("\"\\\\\"", Diagnostics.quote("\\"));
        assertEquals("\"\"", Diagnostics.quote(""));
    }
}
