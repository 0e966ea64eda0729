package com.jz.injector.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;

@Slf4j
@Configuration
public class AsyncConfig {

    /** 好感度接口调用专用线程池，消息线程只挂起等待结果 */
    @Bean(name = "affinityFetchExecutor")
    public ThreadPoolTaskExecutor affinityFetchExecutor() {
        ThreadPoolTaskExecutor ex = new ThreadPoolTaskExecutor();
        ex.setCorePoolSize(4);
        ex.setMaxPoolSize(16);
        ex.setQueueCapacity(1000);
        ex.setKeepAliveSeconds(60);
        ex.setThreadNamePrefix("affinity-fetch-");
        ex.setAwaitTerminationSeconds(10);
        ex.setWaitForTasksToCompleteOnShutdown(true);
        ex.initialize();
        return ex;
    }

    /** planner 注入专用调度线程（单线程守护），与消息处理隔离 */
    @Bean(name = "plannerPatchScheduler", destroyMethod = "shutdownNow")
    public ScheduledExecutorService plannerPatchScheduler() {
        return Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "planner-patch");
            t.setDaemon(true);
            t.setUncaughtExceptionHandler((th, e) -> log.error("planner patch thread died: {}", e.toString()));
            return t;
        });
    }
}
