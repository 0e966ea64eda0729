package com.jz.injector.planner;

import lombok.Value;

/** 带编号的历史消息，planner 用编号引用要回复的消息 */
@Value
public class PlannerMessage {
    String messageId;
    String userId;
    String content;
}
