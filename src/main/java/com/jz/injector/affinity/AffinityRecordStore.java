package com.jz.injector.affinity;

import com.jz.injector.config.PlannerInjectorProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;

/**
 * 线程安全的好感度缓存：
 * - 所有读写共用一把锁，读到过期条目时在锁内直接删除（惰性过期，无后台清理）；
 * - set 为覆盖写，后拿到锁的写入生效；
 * - 锁内不做任何 IO。
 */
@Slf4j
@Component
public class AffinityRecordStore {

    private static final Duration DEFAULT_TTL = Duration.ofSeconds(3600);

    private final Map<String, CacheEntry> cache = new HashMap<>();
    private final ReentrantLock lock = new ReentrantLock();
    private final Duration ttl;
    private final Clock clock;

    private record CacheEntry(AffinityRecord record, Instant recordedAt) {}

    @Autowired
    public AffinityRecordStore(PlannerInjectorProperties props, Clock clock) {
        this(props.getCache().getTtl(), clock);
    }

    public AffinityRecordStore(Duration ttl, Clock clock) {
        this.ttl = (ttl == null || ttl.isNegative()) ? DEFAULT_TTL : ttl;
        this.clock = clock;
    }

    /** 读取缓存；不存在或已过期返回 empty（过期的顺手删掉） */
    public Optional<AffinityRecord> get(String userId) {
        lock.lock();
        try {
            CacheEntry entry = cache.get(userId);
            if (entry == null) return Optional.empty();

            Duration age = Duration.between(entry.recordedAt(), clock.instant());
            if (age.compareTo(ttl) > 0) {
                cache.remove(userId);
                log.debug("affinity cache expired, userId={}", userId);
                return Optional.empty();
            }
            return Optional.of(entry.record());
        } finally {
            lock.unlock();
        }
    }

    /** 覆盖写入，时间戳取当前时刻 */
    public void set(String userId, int impression, String attitude) {
        AffinityRecord record = new AffinityRecord(userId, impression, attitude);
        lock.lock();
        try {
            cache.put(userId, new CacheEntry(record, clock.instant()));
        } finally {
            lock.unlock();
        }
    }

    /** 当前持有的条目数（含尚未被访问到的过期条目） */
    public int size() {
        lock.lock();
        try {
            return cache.size();
        } finally {
            lock.unlock();
        }
    }

    public Duration getTtl() {
        return ttl;
    }
}
