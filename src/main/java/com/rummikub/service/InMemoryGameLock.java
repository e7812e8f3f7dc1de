package com.rummikub.service;

import com.rummikub.config.RummikubProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 进程内的租约锁
 * 租约到期后即使持有者没有释放，其他请求也可以接管；等待超时抛出并发修改异常
 */
@Component
public class InMemoryGameLock implements GameLock {

    private static final Logger log = LoggerFactory.getLogger(InMemoryGameLock.class);

    private final Map<UUID, Lease> leases = new ConcurrentHashMap<>();
    private final Clock clock;
    private final Duration leaseDuration;
    private final Duration wait;
    private final Duration retryInterval;

    @Autowired
    public InMemoryGameLock(Clock clock, RummikubProperties properties) {
        this(clock, properties.getLock().getLease(), properties.getLock().getWait(),
            properties.getLock().getRetryInterval());
    }

    public InMemoryGameLock(Clock clock, Duration leaseDuration, Duration wait, Duration retryInterval) {
        this.clock = clock;
        this.leaseDuration = leaseDuration;
        this.wait = wait;
        this.retryInterval = retryInterval;
    }

    @Override
    public LockLease acquire(UUID gameId) {
        Instant deadline = clock.instant().plus(wait);
        while (true) {
            Lease lease = tryAcquire(gameId);
            if (lease != null) {
                return lease;
            }
            if (!clock.instant().isBefore(deadline)) {
                log.warn("获取游戏锁超时：{}", gameId);
                throw new ConcurrentGameModificationException(gameId);
            }
            try {
                Thread.sleep(retryInterval.toMillis());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                log.warn("等待游戏锁被中断：{}", gameId);
                throw new ConcurrentGameModificationException(gameId);
            }
        }
    }

    /**
     * 尝试一次：没有租约或租约已过期时占用
     */
    private Lease tryAcquire(UUID gameId) {
        Instant now = clock.instant();
        Lease candidate = new Lease(gameId, UUID.randomUUID(), now.plus(leaseDuration));
        Lease holder = leases.compute(gameId, (id, current) -> {
            if (current == null || !current.expiresAt.isAfter(now)) {
                if (current != null) {
                    log.warn("游戏 {} 的锁租约已过期，被接管", id);
                }
                return candidate;
            }
            return current;
        });
        return holder == candidate ? candidate : null;
    }

    boolean isHeld(UUID gameId) {
        Lease lease = leases.get(gameId);
        return lease != null && lease.expiresAt.isAfter(clock.instant());
    }

    private final class Lease implements LockLease {
        private final UUID gameId;
        private final UUID token;
        private final Instant expiresAt;

        private Lease(UUID gameId, UUID token, Instant expiresAt) {
            this.gameId = gameId;
            this.token = token;
            this.expiresAt = expiresAt;
        }

        @Override
        public UUID getGameId() {
            return gameId;
        }

        @Override
        public void close() {
            // 只删除自己的租约，过期后被别人接管的不动
            if (!leases.remove(gameId, this)) {
                log.debug("游戏 {} 的租约 {} 已不属于当前持有者", gameId, token);
            }
        }
    }
}
