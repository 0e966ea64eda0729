package com.jz.injector.planner;

import java.util.List;
import java.util.Map;

/**
 * 宿主构建 planner 提示词的函数。包装实现必须保持同样的参数和返回形状。
 */
@FunctionalInterface
public interface PlannerPromptBuilder {

    String DEFAULT_PROMPT_KEY = "brain_planner_prompt_react";

    PlannerPrompt build(String chatId,
                        TargetPersonInfo chatTargetInfo,
                        Map<String, ActionInfo> currentAvailableActions,
                        List<PlannerMessage> messageIdList,
                        String chatContentBlock,
                        String interest,
                        String promptKey);
}
