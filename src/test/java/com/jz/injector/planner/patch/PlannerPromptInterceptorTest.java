package com.jz.injector.planner.patch;

import com.jz.injector.affinity.AffinityRecordStore;
import com.jz.injector.config.PlannerInjectorProperties;
import com.jz.injector.planner.PlannerHookRegistry;
import com.jz.injector.planner.PlannerPrompt;
import com.jz.injector.planner.PlannerPromptBuilder;
import com.jz.injector.planner.TargetPersonInfo;
import com.jz.injector.support.MutableClock;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class PlannerPromptInterceptorTest {

    private ScheduledExecutorService scheduler;
    private PlannerInjectorProperties props;
    private AffinityRecordStore store;
    private PlannerHookRegistry registry;

    private final PlannerPromptBuilder hostPlanner =
            (chatId, target, actions, messages, content, interest, key) -> new PlannerPrompt("Hello", messages);

    @BeforeEach
    void setUp() {
        scheduler = Executors.newSingleThreadScheduledExecutor();
        props = new PlannerInjectorProperties();
        props.getPatch().setSettleDelay(Duration.ofMillis(20));
        props.getPatch().setReadinessTimeout(Duration.ofMillis(100));
        props.getPatch().setInitialBackoff(Duration.ofMillis(10));
        props.getPatch().setMaxAttempts(3);
        store = new AffinityRecordStore(Duration.ofSeconds(3600), new MutableClock(Instant.parse("2025-01-01T00:00:00Z")));
        registry = new PlannerHookRegistry();
    }

    @AfterEach
    void tearDown() {
        scheduler.shutdownNow();
    }

    private PlannerPrompt invoke(String userId) {
        return registry.buildPrompt("chat-001", new TargetPersonInfo("qq", userId, null),
                Map.of(), List.of(), "", "", PlannerPromptBuilder.DEFAULT_PROMPT_KEY);
    }

    @Test
    void shouldWrapBoundPlannerAfterSettling() throws Exception {
        registry.bind(hostPlanner);
        store.set("u1", 80, "friendly");
        PlannerPromptInterceptor interceptor = new PlannerPromptInterceptor(store, scheduler, props);

        assertTrue(interceptor.install(registry));
        assertEquals(InterceptionState.INSTALLED, interceptor.whenSettled().get(5, TimeUnit.SECONDS));

        assertSame(hostPlanner, interceptor.original().orElseThrow());
        assertInstanceOf(AffinityPromptDecorator.class, registry.current().orElseThrow());
        assertTrue(invoke("u1").getPrompt().startsWith("Hello\n你对当前用户的好感度是80"));
    }

    @Test
    void shouldRunOriginalUntilInstalled() throws Exception {
        props.getPatch().setSettleDelay(Duration.ofSeconds(30));
        registry.bind(hostPlanner);
        store.set("u1", 80, "friendly");
        PlannerPromptInterceptor interceptor = new PlannerPromptInterceptor(store, scheduler, props);

        interceptor.install(registry);

        assertEquals(InterceptionState.PENDING, interceptor.state());
        assertEquals("Hello", invoke("u1").getPrompt());
    }

    @Test
    void shouldWaitForLateReadinessSignal() throws Exception {
        props.getPatch().setReadinessTimeout(Duration.ofSeconds(5));
        PlannerPromptInterceptor interceptor = new PlannerPromptInterceptor(store, scheduler, props);

        interceptor.install(registry);
        Thread.sleep(60);
        registry.bind(hostPlanner);

        assertEquals(InterceptionState.INSTALLED, interceptor.whenSettled().get(5, TimeUnit.SECONDS));
        assertSame(hostPlanner, interceptor.original().orElseThrow());
    }

    @Test
    void shouldNotDoubleWrapOnSecondInstall() throws Exception {
        registry.bind(hostPlanner);
        store.set("u1", 80, "friendly");
        PlannerPromptInterceptor interceptor = new PlannerPromptInterceptor(store, scheduler, props);

        assertTrue(interceptor.install(registry));
        assertFalse(interceptor.install(registry));
        interceptor.whenSettled().get(5, TimeUnit.SECONDS);
        assertFalse(interceptor.install(registry));

        String prompt = invoke("u1").getPrompt();
        assertEquals(prompt.indexOf("好感度是"), prompt.lastIndexOf("好感度是"));
    }

    @Test
    void shouldNotDoubleWrapWhenAnotherInterceptorInstalledFirst() throws Exception {
        registry.bind(hostPlanner);
        store.set("u1", 80, "friendly");
        PlannerPromptInterceptor first = new PlannerPromptInterceptor(store, scheduler, props);
        PlannerPromptInterceptor second = new PlannerPromptInterceptor(store, scheduler, props);

        first.install(registry);
        first.whenSettled().get(5, TimeUnit.SECONDS);
        second.install(registry);

        assertEquals(InterceptionState.INSTALLED, second.whenSettled().get(5, TimeUnit.SECONDS));
        assertSame(hostPlanner, second.original().orElseThrow());
        String prompt = invoke("u1").getPrompt();
        assertEquals(prompt.indexOf("好感度是"), prompt.lastIndexOf("好感度是"));
    }

    @Test
    void shouldFailAfterBoundedAttemptsWhenPlannerNeverBinds() throws Exception {
        props.getPatch().setReadinessTimeout(Duration.ofMillis(20));
        PlannerPromptInterceptor interceptor = new PlannerPromptInterceptor(store, scheduler, props);

        interceptor.install(registry);

        assertEquals(InterceptionState.FAILED, interceptor.whenSettled().get(5, TimeUnit.SECONDS));
        assertTrue(interceptor.original().isEmpty());
        assertTrue(registry.current().isEmpty());
        assertFalse(interceptor.install(registry));
    }

    @Test
    void shouldFailQuietlyWhenSchedulerIsGone() throws Exception {
        scheduler.shutdownNow();
        PlannerPromptInterceptor interceptor = new PlannerPromptInterceptor(store, scheduler, props);

        interceptor.install(registry);

        assertEquals(InterceptionState.FAILED, interceptor.whenSettled().get(1, TimeUnit.SECONDS));
    }
}
