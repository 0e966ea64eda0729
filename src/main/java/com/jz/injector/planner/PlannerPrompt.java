package com.jz.injector.planner;

import lombok.Value;

import java.util.List;

/** 构建结果：planner 提示词 + 原样返回的消息编号列表 */
@Value
public class PlannerPrompt {
    String prompt;
    List<PlannerMessage> messageIdList;
}
