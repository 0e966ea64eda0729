package com.jz.injector.handler;

import com.jz.injector.affinity.AffinityRecordStore;
import com.jz.injector.affinity.fetch.AffinityFetcher;
import com.jz.injector.config.PlannerInjectorProperties;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 收到消息时预取发送者的好感度：
 * - 插件关闭：直接放行；
 * - 缓存命中：直接放行，不发请求；
 * - 未命中：异步调用 api 并写入缓存。同一用户并发未命中只发一次请求。
 * 无论结果如何都返回成功，不阻断消息管线。
 */
@Slf4j
@Component
public class AffinityEnrichmentHandler implements MessageEventHandler {

    private final AffinityRecordStore store;
    private final AffinityFetcher fetcher;
    private final PlannerInjectorProperties props;

    private final Map<String, CompletableFuture<Void>> inflight = new ConcurrentHashMap<>();

    private final Counter hitCounter;
    private final Counter missCounter;

    public AffinityEnrichmentHandler(AffinityRecordStore store,
                                     AffinityFetcher fetcher,
                                     PlannerInjectorProperties props,
                                     MeterRegistry registry) {
        this.store = store;
        this.fetcher = fetcher;
        this.props = props;
        this.hitCounter = Counter.builder("affinity.cache.hit")
                .description("Messages whose sender affinity was already cached")
                .register(registry);
        this.missCounter = Counter.builder("affinity.cache.miss")
                .description("Messages that triggered an affinity api call")
                .register(registry);
    }

    @Override
    public EventType eventType() {
        return EventType.ON_MESSAGE;
    }

    @Override
    public String handlerName() {
        return "user_info_get";
    }

    @Override
    public String handlerDescription() {
        return "获取用户好感度";
    }

    @Override
    public int weight() {
        return 900;
    }

    @Override
    public CompletableFuture<HandlerResult> execute(InboundMessage message) {
        if (!props.getPlugin().isEnabled()) {
            return CompletableFuture.completedFuture(HandlerResult.proceed());
        }
        if (message == null || message.getUserId() == null || message.getUserId().isBlank()) {
            log.debug("message without user id, skip affinity lookup");
            return CompletableFuture.completedFuture(HandlerResult.proceed());
        }
        String userId = message.getUserId();

        if (store.get(userId).isPresent()) {
            hitCounter.increment();
            return CompletableFuture.completedFuture(HandlerResult.proceed());
        }

        return loadOnce(userId)
                .handle((v, e) -> {
                    if (e != null) {
                        log.error("affinity enrichment failed, userId={}, err={}", userId, e.toString());
                    }
                    return HandlerResult.proceed();
                });
    }

    private CompletableFuture<Void> loadOnce(String userId) {
        CompletableFuture<Void> created = new CompletableFuture<>();
        CompletableFuture<Void> existing = inflight.putIfAbsent(userId, created);
        if (existing != null) {
            return existing;
        }

        // 拿到占位后再查一次：前一个请求可能刚写完缓存并移除了占位
        if (store.get(userId).isPresent()) {
            hitCounter.increment();
            inflight.remove(userId, created);
            created.complete(null);
            return created;
        }

        missCounter.increment();
        try {
            fetcher.fetchAsync(userId)
                    .thenAccept(r -> {
                        if (!r.getStatus().isSuccess()) {
                            log.debug("用户 {} 好感度获取失败({})，缓存默认值", userId, r.getStatus());
                        }
                        store.set(userId, r.getImpression(), r.getAttitude());
                    })
                    .whenComplete((v, e) -> {
                        inflight.remove(userId, created);
                        if (e != null) created.completeExceptionally(e);
                        else created.complete(null);
                    });
        } catch (RuntimeException e) {
            // 线程池拒绝等同步失败
            inflight.remove(userId, created);
            created.completeExceptionally(e);
        }
        return created;
    }

    /** 正在进行中的请求数 */
    int inflightCount() {
        return inflight.size();
    }
}
