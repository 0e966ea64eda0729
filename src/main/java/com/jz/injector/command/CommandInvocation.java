package com.jz.injector.command;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

/** 一次命令调用：原始文本、正则命名分组、发起人与所在聊天流 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CommandInvocation {
    private String rawText;
    private Map<String, String> matchedGroups;
    private String userId;
    private String streamId;
    private ReplySender replySender;

    public String group(String name) {
        return matchedGroups == null ? null : matchedGroups.get(name);
    }
}
