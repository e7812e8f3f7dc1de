package com.rummikub.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * 拉密服务配置（前缀 rummikub）
 */
@Component
@ConfigurationProperties(prefix = "rummikub")
public class RummikubProperties {

    /**
     * 每个座位发牌数
     */
    private int rackSize = 14;

    private final Lock lock = new Lock();

    public int getRackSize() {
        return rackSize;
    }

    public void setRackSize(int rackSize) {
        this.rackSize = rackSize;
    }

    public Lock getLock() {
        return lock;
    }

    /**
     * 单局游戏锁
     */
    public static class Lock {
        private Duration lease = Duration.ofSeconds(5);         // 租约有效期，过期后可被他人接管
        private Duration wait = Duration.ofSeconds(5);          // 获取锁的最长等待时间
        private Duration retryInterval = Duration.ofMillis(100); // 等待期间的重试间隔

        public Duration getLease() {
            return lease;
        }

        public void setLease(Duration lease) {
            this.lease = lease;
        }

        public Duration getWait() {
            return wait;
        }

        public void setWait(Duration wait) {
            this.wait = wait;
        }

        public Duration getRetryInterval() {
            return retryInterval;
        }

        public void setRetryInterval(Duration retryInterval) {
            this.retryInterval = retryInterval;
        }
    }
}
