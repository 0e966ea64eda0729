package com.jz.injector.handler;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** 宿主传给事件处理器的一条入站消息（只保留本插件关心的字段） */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class InboundMessage {
    private String userId;
    private String streamId;
    /** 群聊时非空 */
    private String groupId;
    private String plainText;

    public boolean isGroupMessage() {
        return groupId != null && !groupId.isBlank();
    }
}
