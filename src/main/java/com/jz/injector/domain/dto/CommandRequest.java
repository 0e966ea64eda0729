package com.jz.injector.domain.dto;

import lombok.Data;

@Data
public class CommandRequest {
    private String text;     // 例如 "/debug" 或 "/debug abc123"
    private String userId;
    private String streamId;
}
