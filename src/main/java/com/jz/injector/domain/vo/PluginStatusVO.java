package com.jz.injector.domain.vo;

import com.jz.injector.planner.patch.InterceptionState;
import lombok.Builder;
import lombok.Data;

import java.util.List;

@Data
@Builder
public class PluginStatusVO {
    private String name;
    private String configVersion;
    private boolean enabled;
    private boolean userDebug;
    private InterceptionState interception;
    /** 注册点上当前绑定的是否仍是好感度包装（宿主重新绑定后为 false） */
    private boolean wrapperActive;
    private int cachedUsers;
    private long cacheTtlSeconds;
    /** 按执行顺序排列的消息处理器名 */
    private List<String> handlers;
    private List<String> commands;
}
