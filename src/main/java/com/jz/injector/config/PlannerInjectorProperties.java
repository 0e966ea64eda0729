package com.jz.injector.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * 插件配置，对应 application.yml 中的 planner-injector.*
 */
@Data
@ConfigurationProperties(prefix = "planner-injector")
public class PlannerInjectorProperties {

    private Plugin plugin = new Plugin();
    private Api api = new Api();
    private Cache cache = new Cache();
    private Patch patch = new Patch();

    @Data
    public static class Plugin {
        /** 插件名称 */
        private String name = "planner_injector";
        /** 配置版本(不要修改 除非你知道自己在干什么) */
        private String configVersion = "1.0.2";
        /** 是否启用插件 */
        private boolean enabled = true;
        /** 允许用户获取好感度信息 */
        private boolean userDebug = false;
    }

    @Data
    public static class Api {
        /** 与真寻连接的api地址 */
        private String url = "http://url.to.your.zhenxun";
        /** 超时时间(s) */
        private int timeout = 10;
        /** 未取到好感度时使用的态度 */
        private String defaultAttitude = "一般";
    }

    @Data
    public static class Cache {
        private Duration ttl = Duration.ofSeconds(3600);
    }

    @Data
    public static class Patch {
        /** 启动后等待宿主初始化的时间 */
        private Duration settleDelay = Duration.ofSeconds(3);
        /** 每次尝试最多等待就绪信号多久 */
        private Duration readinessTimeout = Duration.ofSeconds(10);
        private int maxAttempts = 5;
        /** 首次重试间隔，之后每次翻倍 */
        private Duration initialBackoff = Duration.ofMillis(500);
    }
}
