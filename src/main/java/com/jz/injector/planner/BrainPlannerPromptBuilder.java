package com.jz.injector.planner;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * 宿主侧的 planner 提示词构建（独立运行时的默认实现）。
 * 应用就绪后绑定到 {@link PlannerHookRegistry}，即打开注入的就绪闸门。
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class BrainPlannerPromptBuilder implements PlannerPromptBuilder {

    private static final Map<String, String> TEMPLATES = Map.of(
            DEFAULT_PROMPT_KEY, """
                    {chat_context_description}
                    【聊天记录】
                    {chat_content_block}

                    {interest}
                    【可选动作】
                    {action_options}
                    请根据聊天内容选择一个动作，以 JSON 输出 {"action": "...", "target_message_id": "..."}。""",
            "brain_planner_prompt_simple", """
                    {chat_content_block}
                    【可选动作】
                    {action_options}
                    只输出动作名。""");

    private final PlannerHookRegistry registry;

    @EventListener(ApplicationReadyEvent.class)
    public void bindOnReady() {
        registry.bind(this);
        log.info("planner prompt builder bound");
    }

    @Override
    public PlannerPrompt build(String chatId,
                               TargetPersonInfo chatTargetInfo,
                               Map<String, ActionInfo> currentAvailableActions,
                               List<PlannerMessage> messageIdList,
                               String chatContentBlock,
                               String interest,
                               String promptKey) {
        String template = TEMPLATES.getOrDefault(
                promptKey == null ? DEFAULT_PROMPT_KEY : promptKey,
                TEMPLATES.get(DEFAULT_PROMPT_KEY));

        String context = chatTargetInfo == null
                ? "你正在一个群聊中。"
                : "你正在和 " + displayName(chatTargetInfo) + " 私聊。";

        String actions = currentAvailableActions == null ? "" : currentAvailableActions.values().stream()
                .map(a -> "- " + a.getName() + "：" + (a.getDescription() == null ? "" : a.getDescription()))
                .collect(Collectors.joining("\n"));

        String prompt = template
                .replace("{chat_context_description}", context)
                .replace("{chat_content_block}", chatContentBlock == null ? "" : chatContentBlock)
                .replace("{interest}", interest == null ? "" : interest)
                .replace("{action_options}", actions);
        return new PlannerPrompt(prompt, messageIdList == null ? List.of() : messageIdList);
    }

    private static String displayName(TargetPersonInfo t) {
        if (t.getUserNickname() != null && !t.getUserNickname().isBlank()) return t.getUserNickname();
        return String.valueOf(t.getUserId());
    }
}
