package com.jz.injector.plugin;

import com.jz.injector.command.CommandResult;
import com.jz.injector.command.PluginCommand;
import com.jz.injector.config.PlannerInjectorProperties;
import com.jz.injector.handler.EventType;
import com.jz.injector.handler.HandlerResult;
import com.jz.injector.handler.InboundMessage;
import com.jz.injector.handler.MessageEventHandler;
import com.jz.injector.planner.PlannerHookRegistry;
import com.jz.injector.planner.patch.PlannerPromptInterceptor;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;
import java.util.regex.Pattern;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.verify;

@ExtendWith(MockitoExtension.class)
class PlannerInjectorPluginTest {

    @Mock
    private PlannerPromptInterceptor interceptor;

    private final PlannerHookRegistry registry = new PlannerHookRegistry();
    private final List<String> order = new ArrayList<>();
    private PlannerInjectorPlugin plugin;

    private MessageEventHandler handler(String name, int weight, boolean proceed) {
        return new MessageEventHandler() {
            public EventType eventType() { return EventType.ON_MESSAGE; }
            public String handlerName() { return name; }
            public String handlerDescription() { return name; }
            public int weight() { return weight; }
            public CompletableFuture<HandlerResult> execute(InboundMessage message) {
                order.add(name);
                return CompletableFuture.completedFuture(new HandlerResult(true, proceed));
            }
        };
    }

    private final PluginCommand echo = new PluginCommand() {
        public String commandName() { return "echo"; }
        public String commandDescription() { return "echo"; }
        public Pattern pattern() { return Pattern.compile("^/echo( (?<word>\\w+))?$"); }
        public CommandResult execute(com.jz.injector.command.CommandInvocation inv) {
            inv.getReplySender().sendText("echo:" + inv.group("word"), false);
            return new CommandResult(true, inv.getUserId() + "@" + inv.getStreamId(), 2);
        }
    };

    @BeforeEach
    void setUp() {
        plugin = new PlannerInjectorPlugin(new PlannerInjectorProperties(),
                List.of(handler("low", 10, true), handler("high", 900, true)),
                List.of(echo), interceptor, registry);
    }

    @Test
    void shouldStartInterceptionOnInit() {
        plugin.init();

        verify(interceptor).install(registry);
    }

    @Test
    void shouldRunHandlersByDescendingWeight() throws Exception {
        HandlerResult r = plugin.onMessage(new InboundMessage("u1", "s1", null, "hi")).get(1, TimeUnit.SECONDS);

        assertTrue(r.success());
        assertEquals(List.of("high", "low"), order);
    }

    @Test
    void shouldStopChainWhenHandlerAsksTo() throws Exception {
        plugin = new PlannerInjectorPlugin(new PlannerInjectorProperties(),
                List.of(handler("low", 10, true), handler("stopper", 500, false)),
                List.of(), interceptor, registry);

        HandlerResult r = plugin.onMessage(new InboundMessage("u1", "s1", null, "hi")).get(1, TimeUnit.SECONDS);

        assertFalse(r.continueProcessing());
        assertEquals(List.of("stopper"), order);
    }

    @Test
    void shouldDispatchCommandWithNamedGroups() {
        List<String> replies = new ArrayList<>();

        Optional<CommandResult> r = plugin.onCommand("  /echo hello ", "u1", "s1", (t, s) -> replies.add(t));

        assertEquals("u1@s1", r.orElseThrow().message());
        assertEquals(List.of("echo:hello"), replies);
    }

    @Test
    void shouldIgnoreUnknownCommands() {
        assertTrue(plugin.onCommand("/nope", "u1", "s1", (t, s) -> { }).isEmpty());
        assertTrue(plugin.onCommand(null, "u1", "s1", (t, s) -> { }).isEmpty());
    }
}
