package com.jz.injector.planner.patch;

import com.jz.injector.affinity.AffinityRecordStore;
import com.jz.injector.config.PlannerInjectorProperties;
import com.jz.injector.planner.PlannerHookRegistry;
import com.jz.injector.planner.PlannerPromptBuilder;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

/**
 * 在 planner 注册点上安装好感度包装（全局一次）。
 * <p>
 * 安装在独立的调度线程上进行：先等一个固定的稳定期，再等待宿主的就绪信号；
 * 若宿主仍未绑定构建函数，按指数退避有限次重试，最终失败只记日志。
 * 安装完成前宿主调用的是未包装的原实现。
 */
@Slf4j
@Component
public class PlannerPromptInterceptor {

    private static final Duration MAX_BACKOFF = Duration.ofSeconds(30);

    private final AffinityRecordStore store;
    private final ScheduledExecutorService scheduler;
    private final PlannerInjectorProperties.Patch cfg;

    private final AtomicReference<InterceptionState> state = new AtomicReference<>(InterceptionState.UNINSTALLED);
    private final CompletableFuture<InterceptionState> settled = new CompletableFuture<>();

    private volatile PlannerPromptBuilder original;
    private volatile AffinityPromptDecorator wrapper;

    public PlannerPromptInterceptor(AffinityRecordStore store,
                                    @Qualifier("plannerPatchScheduler") ScheduledExecutorService scheduler,
                                    PlannerInjectorProperties props) {
        this.store = store;
        this.scheduler = scheduler;
        this.cfg = props.getPatch();
    }

    /**
     * 发起安装；重复调用不会重复包装。
     *
     * @return 本次调用是否真正发起了安装
     */
    public boolean install(PlannerHookRegistry registry) {
        if (!state.compareAndSet(InterceptionState.UNINSTALLED, InterceptionState.PENDING)) {
            log.debug("planner patch already {}, skip", state.get());
            return false;
        }
        try {
            scheduler.schedule(() -> attempt(registry, 1), cfg.getSettleDelay().toMillis(), TimeUnit.MILLISECONDS);
        } catch (RejectedExecutionException e) {
            fail("注入失败: 调度线程不可用 " + e.getMessage());
        }
        return true;
    }

    void attempt(PlannerHookRegistry registry, int attemptNo) {
        try {
            boolean ready = registry.isReady() || registry.awaitReady(cfg.getReadinessTimeout());
            Optional<PlannerPromptBuilder> current = registry.current();
            if (ready && current.isPresent() && tryWrap(registry, current.get())) {
                return;
            }

            if (attemptNo >= cfg.getMaxAttempts()) {
                fail("注入失败 (planner patch): planner 未就绪，已尝试 " + attemptNo + " 次");
                return;
            }
            Duration backoff = backoff(attemptNo);
            log.warn("planner 尚未就绪，{} ms 后重试 (第 {} 次)", backoff.toMillis(), attemptNo);
            scheduler.schedule(() -> attempt(registry, attemptNo + 1), backoff.toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            fail("注入失败: 安装线程被中断");
        } catch (Exception e) {
            fail("注入失败: " + e);
        }
    }

    private boolean tryWrap(PlannerHookRegistry registry, PlannerPromptBuilder target) {
        if (target instanceof AffinityPromptDecorator existing) {
            // 已经包装过（例如另一个实例先装上了），不再叠加
            succeed(existing);
            return true;
        }
        log.info("注入好感度提示 (planner patch)");
        AffinityPromptDecorator w = new AffinityPromptDecorator(target, store);
        if (registry.replace(target, w)) {
            succeed(w);
            log.info("成功注入好感度提示 (planner patch)");
            return true;
        }
        // 与宿主重新绑定发生竞争，下一轮再试
        return false;
    }

    private Duration backoff(int attemptNo) {
        long ms = cfg.getInitialBackoff().toMillis() << Math.min(attemptNo - 1, 16);
        return Duration.ofMillis(Math.min(ms, MAX_BACKOFF.toMillis()));
    }

    private void succeed(AffinityPromptDecorator w) {
        this.wrapper = w;
        this.original = w.getOriginal();
        state.set(InterceptionState.INSTALLED);
        settled.complete(InterceptionState.INSTALLED);
    }

    private void fail(String reason) {
        log.error(reason);
        state.set(InterceptionState.FAILED);
        settled.complete(InterceptionState.FAILED);
    }

    public InterceptionState state() {
        return state.get();
    }

    /** 安装到达终态（成功或失败）时完成 */
    public CompletableFuture<InterceptionState> whenSettled() {
        return settled.copy();
    }

    public Optional<PlannerPromptBuilder> original() {
        return Optional.ofNullable(original);
    }

    public Optional<AffinityPromptDecorator> wrapper() {
        return Optional.ofNullable(wrapper);
    }
}
