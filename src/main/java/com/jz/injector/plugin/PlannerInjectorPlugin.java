package com.jz.injector.plugin;

import com.jz.injector.command.CommandInvocation;
import com.jz.injector.command.CommandResult;
import com.jz.injector.command.PluginCommand;
import com.jz.injector.command.ReplySender;
import com.jz.injector.config.PlannerInjectorProperties;
import com.jz.injector.handler.EventType;
import com.jz.injector.handler.HandlerResult;
import com.jz.injector.handler.InboundMessage;
import com.jz.injector.handler.MessageEventHandler;
import com.jz.injector.planner.PlannerHookRegistry;
import com.jz.injector.planner.patch.PlannerPromptInterceptor;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 把回复概率与好感度挂钩。
 * <p>
 * 插件组件：ON_MESSAGE 处理器（预取好感度）+ /debug 命令；
 * 启动时发起 planner 注入。
 */
@Slf4j
@Component
public class PlannerInjectorPlugin {

    private static final Pattern GROUP_NAME = Pattern.compile("\\(\\?<([a-zA-Z][a-zA-Z0-9]*)>");

    private final PlannerInjectorProperties props;
    private final List<MessageEventHandler> handlers;
    private final List<PluginCommand> commands;
    private final PlannerPromptInterceptor interceptor;
    private final PlannerHookRegistry registry;

    public PlannerInjectorPlugin(PlannerInjectorProperties props,
                                 List<MessageEventHandler> handlers,
                                 List<PluginCommand> commands,
                                 PlannerPromptInterceptor interceptor,
                                 PlannerHookRegistry registry) {
        this.props = props;
        this.handlers = handlers.stream()
                .sorted(Comparator.comparingInt(MessageEventHandler::weight).reversed())
                .toList();
        this.commands = List.copyOf(commands);
        this.interceptor = interceptor;
        this.registry = registry;
    }

    @PostConstruct
    public void init() {
        log.info("插件{}已加载", props.getPlugin().getName());
        interceptor.install(registry);
    }

    public List<MessageEventHandler> getHandlers() {
        return handlers;
    }

    public List<PluginCommand> getCommands() {
        return commands;
    }

    /** 依权重顺序执行 ON_MESSAGE 处理器，某个处理器要求中断时停止 */
    public CompletableFuture<HandlerResult> onMessage(InboundMessage message) {
        CompletableFuture<HandlerResult> chain = CompletableFuture.completedFuture(HandlerResult.proceed());
        for (MessageEventHandler h : handlers) {
            if (h.eventType() != EventType.ON_MESSAGE) continue;
            chain = chain.thenCompose(prev -> prev.continueProcessing()
                    ? h.execute(message)
                    : CompletableFuture.completedFuture(prev));
        }
        return chain;
    }

    /** 找到第一个匹配的命令并执行；没有匹配返回 empty */
    public Optional<CommandResult> onCommand(String text, String userId, String streamId, ReplySender sender) {
        if (text == null) return Optional.empty();
        String trimmed = text.trim();
        for (PluginCommand c : commands) {
            Matcher m = c.pattern().matcher(trimmed);
            if (!m.matches()) continue;

            CommandInvocation inv = CommandInvocation.builder()
                    .rawText(trimmed)
                    .matchedGroups(namedGroups(c.pattern(), m))
                    .userId(userId)
                    .streamId(streamId)
                    .replySender(sender)
                    .build();
            return Optional.of(c.execute(inv));
        }
        return Optional.empty();
    }

    private static Map<String, String> namedGroups(Pattern p, Matcher m) {
        Map<String, String> out = new HashMap<>();
        Matcher names = GROUP_NAME.matcher(p.pattern());
        while (names.find()) {
            String name = names.group(1);
            String v = m.group(name);
            if (v != null) out.put(name, v);
        }
        return out;
    }
}
