package com.jz.injector.planner;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/** 私聊对象信息；群聊时宿主传 null */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class TargetPersonInfo {
    private String platform;
    private String userId;
    private String userNickname;
}
