package com.jz.injector.controller;

import com.jz.injector.affinity.AffinityRecordStore;
import com.jz.injector.chat.ChatStreamDirectory;
import com.jz.injector.command.PluginCommand;
import com.jz.injector.common.Result;
import com.jz.injector.config.PlannerInjectorProperties;
import com.jz.injector.domain.dto.CommandReplyDTO;
import com.jz.injector.domain.dto.CommandRequest;
import com.jz.injector.domain.dto.MessageEventRequest;
import com.jz.injector.domain.dto.PlannerPromptRequest;
import com.jz.injector.domain.vo.PluginStatusVO;
import com.jz.injector.handler.HandlerResult;
import com.jz.injector.handler.InboundMessage;
import com.jz.injector.handler.MessageEventHandler;
import com.jz.injector.planner.ActionInfo;
import com.jz.injector.planner.PlannerHookRegistry;
import com.jz.injector.planner.PlannerMessage;
import com.jz.injector.planner.PlannerPrompt;
import com.jz.injector.planner.PlannerPromptBuilder;
import com.jz.injector.planner.patch.AffinityPromptDecorator;
import com.jz.injector.planner.patch.PlannerPromptInterceptor;
import com.jz.injector.plugin.PlannerInjectorPlugin;
import lombok.RequiredArgsConstructor;
import org.springframework.util.StringUtils;
import org.springframework.web.bind.annotation.*;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * 独立运行时模拟宿主：接收消息事件、命令和 planner 构建请求。
 */
@RestController
@RequestMapping("api/plugin")
@RequiredArgsConstructor
public class PluginHostController {

    private final PlannerInjectorPlugin plugin;
    private final PlannerHookRegistry plannerRegistry;
    private final PlannerPromptInterceptor interceptor;
    private final ChatStreamDirectory streams;
    private final AffinityRecordStore store;
    private final PlannerInjectorProperties props;

    @PostMapping("/messages")
    public CompletableFuture<Result<HandlerResult>> onMessage(@RequestBody MessageEventRequest req) {
        if (!StringUtils.hasText(req.getUserId())) {
            return CompletableFuture.completedFuture(Result.badRequest("userId 不能为空"));
        }
        InboundMessage msg = InboundMessage.builder()
                .userId(req.getUserId())
                .streamId(req.getStreamId())
                .groupId(req.getGroupId())
                .plainText(req.getText())
                .build();
        streams.register(msg.getStreamId(), msg.isGroupMessage());
        return plugin.onMessage(msg).thenApply(Result::success);
    }

    @PostMapping("/commands")
    public Result<CommandReplyDTO> onCommand(@RequestBody CommandRequest req) {
        List<String> replies = new ArrayList<>();
        Optional<CommandReplyDTO> out = plugin.onCommand(req.getText(), req.getUserId(), req.getStreamId(),
                        (text, storage) -> replies.add(text))
                .map(r -> new CommandReplyDTO(r.success(), r.message(), r.interceptLevel(), replies));
        return out.map(Result::success)
                .orElseGet(() -> Result.badRequest("未知命令: " + req.getText()));
    }

    @PostMapping("/planner/prompt")
    public Result<PlannerPrompt> buildPlannerPrompt(@RequestBody PlannerPromptRequest req) {
        if (plannerRegistry.current().isEmpty()) {
            return Result.error("planner 尚未就绪");
        }
        Map<String, ActionInfo> actions = new LinkedHashMap<>();
        if (req.getAvailableActions() != null) {
            for (ActionInfo a : req.getAvailableActions()) {
                if (a != null && StringUtils.hasText(a.getName())) {
                    actions.put(a.getName(), a);
                }
            }
        }
        // 显式传 null 时按空列表处理
        List<PlannerMessage> messages = req.getMessageIdList() == null ? new ArrayList<>() : req.getMessageIdList();
        String promptKey = StringUtils.hasText(req.getPromptKey())
                ? req.getPromptKey() : PlannerPromptBuilder.DEFAULT_PROMPT_KEY;
        PlannerPrompt prompt = plannerRegistry.buildPrompt(req.getChatId(), req.getChatTargetInfo(), actions,
                messages, nullToEmpty(req.getChatContentBlock()), nullToEmpty(req.getInterest()), promptKey);
        return Result.success(prompt);
    }

    @GetMapping("/status")
    public Result<PluginStatusVO> status() {
        PlannerInjectorProperties.Plugin p = props.getPlugin();
        return Result.success(PluginStatusVO.builder()
                .name(p.getName())
                .configVersion(p.getConfigVersion())
                .enabled(p.isEnabled())
                .userDebug(p.isUserDebug())
                .interception(interceptor.state())
                .wrapperActive(plannerRegistry.current().filter(AffinityPromptDecorator.class::isInstance).isPresent())
                .cachedUsers(store.size())
                .cacheTtlSeconds(store.getTtl().getSeconds())
                .handlers(plugin.getHandlers().stream().map(MessageEventHandler::handlerName).toList())
                .commands(plugin.getCommands().stream().map(PluginCommand::commandName).toList())
                .build());
    }

    private static String nullToEmpty(String s) {
        return s == null ? "" : s;
    }
}
