package com.jz.injector.domain.dto;

import lombok.Data;

@Data
public class MessageEventRequest {
    private String userId;
    private String streamId;
    private String groupId; // 私聊为空
    private String text;
}
