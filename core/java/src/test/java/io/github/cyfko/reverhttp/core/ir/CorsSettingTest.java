package io.github.cyfko.reverhttp.core.ir;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("CorsSetting Tests")
class CorsSettingTest {

    private static final IrCors ANY_ORIGIN = new IrCors(List.of("*"), null, null, null, null, null);

    @Test
    @DisplayName("States and configuration")
    void testStates() {
        assertEquals(CorsSetting.State.INHERIT, CorsSetting.INHERIT.state());
        assertNull(CorsSetting.INHERIT.config());
        assertEquals(CorsSetting.State.DISABLED, CorsSetting.DISABLED.state());
        assertNull(CorsSetting.DISABLED.config());

        CorsSetting configured = CorsSetting.of(ANY_ORIGIN);
        assertEquals(CorsSetting.State.CONFIGURED, configured.state());
        assertSame(ANY_ORIGIN, configured.config());
    }

    @Test
    @DisplayName("Equality follows state and configuration")
    void testEquality() {
        assertEquals(CorsSetting.of(ANY_ORIGIN), CorsSetting.of(new IrCors(List.of("*"), null, null, null, null, null)));
        assertEquals(CorsSetting.of(ANY_ORIGIN).hashCode(), CorsSetting.of(ANY_ORIGIN).hashCode());
        assertNotEquals(CorsSetting.INHERIT, CorsSetting.DISABLED);
        assertNotEquals(CorsSetting.DISABLED, CorsSetting.of(ANY_ORIGIN));
    }

    @Test
    @DisplayName("Inherit filter only suppresses the inherit state")
    void testInheritFilter() {
        CorsSetting.InheritFilter filter = new CorsSetting.InheritFilter();
        assertTrue(filter.equals(CorsSetting.INHERIT));
        assertFalse(filter.equals(CorsSetting.DISABLED));
        assertFalse(filter.equals(CorsSetting.of(ANY_ORIGIN)));
    }

    @Test
    @DisplayName("Configured state requires a configuration")
    void testNullConfig() {
        assertThrows(NullPointerException.class, () -> CorsSetting.of(null));
    }

    @Test
    @DisplayName("Route defaults to inherit and to an empty output")
    void testRouteDefaults() {
        IrRoute route = new IrRoute(new IrRoute.Endpoint("GET", "/"), null, null, null, null, null, null, null, null);
        assertEquals(CorsSetting.INHERIT, route.cors());
        assertEquals(IrOutput.empty(), route.output());
        assertTrue(route.input().isEmpty());
    }
}
