package com.jz.injector.planner;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class PlannerHookRegistryTest {

    private PlannerHookRegistry registry;
    private final PlannerPromptBuilder a = (c, t, ac, m, cb, i, k) -> new PlannerPrompt("A", m);
    private final PlannerPromptBuilder b = (c, t, ac, m, cb, i, k) -> new PlannerPrompt("B", m);

    @BeforeEach
    void setUp() {
        registry = new PlannerHookRegistry();
    }

    @Test
    void shouldNotBeReadyBeforeBind() throws Exception {
        assertFalse(registry.isReady());
        assertFalse(registry.awaitReady(Duration.ofMillis(10)));
        assertTrue(registry.current().isEmpty());
        assertThrows(IllegalStateException.class,
                () -> registry.buildPrompt("c", null, Map.of(), List.of(), "", "", null));
    }

    @Test
    void shouldOpenGateOnBind() throws Exception {
        registry.bind(a);

        assertTrue(registry.isReady());
        assertTrue(registry.awaitReady(Duration.ZERO));
        assertEquals("A", registry.buildPrompt("c", null, Map.of(), List.of(), "", "", null).getPrompt());
    }

    @Test
    void shouldReplaceOnlyExpectedBuilder() {
        registry.bind(a);

        assertFalse(registry.replace(b, b));
        assertTrue(registry.replace(a, b));
        assertSame(b, registry.current().orElseThrow());
    }

    @Test
    void shouldRejectNullBuilder() {
        assertThrows(IllegalArgumentException.class, () -> registry.bind(null));
        assertFalse(registry.isReady());
    }
}
