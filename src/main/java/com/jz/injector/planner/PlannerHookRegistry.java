package com.jz.injector.planner;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

/**
 * planner 提示词构建函数的注册点。
 * <p>
 * 宿主在 planner 初始化完成后调用 {@link #bind}，同时打开一次性的就绪闸门；
 * 插件通过 {@link #replace} 以 CAS 方式换上包装实现，不直接触碰宿主内部。
 * 宿主始终经由 {@link #buildPrompt} 调用当前绑定的实现。
 */
@Slf4j
@Component
public class PlannerHookRegistry {

    private final AtomicReference<PlannerPromptBuilder> bound = new AtomicReference<>();
    private final CountDownLatch ready = new CountDownLatch(1);

    public void bind(PlannerPromptBuilder builder) {
        if (builder == null) throw new IllegalArgumentException("builder must not be null");
        PlannerPromptBuilder prev = bound.getAndSet(builder);
        if (prev != null) {
            log.warn("planner prompt builder rebound, previous wrapper (if any) is discarded");
        }
        ready.countDown();
    }

    public Optional<PlannerPromptBuilder> current() {
        return Optional.ofNullable(bound.get());
    }

    /** 仅当当前绑定仍是 expected 时替换 */
    public boolean replace(PlannerPromptBuilder expected, PlannerPromptBuilder replacement) {
        return bound.compareAndSet(expected, replacement);
    }

    public boolean isReady() {
        return ready.getCount() == 0;
    }

    public boolean awaitReady(Duration timeout) throws InterruptedException {
        return ready.await(timeout.toMillis(), TimeUnit.MILLISECONDS);
    }

    public PlannerPrompt buildPrompt(String chatId,
                                     TargetPersonInfo chatTargetInfo,
                                     Map<String, ActionInfo> currentAvailableActions,
                                     List<PlannerMessage> messageIdList,
                                     String chatContentBlock,
                                     String interest,
                                     String promptKey) {
        PlannerPromptBuilder b = bound.get();
        if (b == null) {
            throw new IllegalStateException("planner prompt builder is not bound yet");
        }
        return b.build(chatId, chatTargetInfo, currentAvailableActions, messageIdList,
                chatContentBlock, interest, promptKey);
    }
}
