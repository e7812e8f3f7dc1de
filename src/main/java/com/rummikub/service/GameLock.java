package com.rummikub.service;

import java.util.UUID;

/**
 * 单局游戏的排他锁
 * 同一局游戏同一时间最多只有一个修改操作在进行
 */
public interface GameLock {

    /**
     * 获取锁，等待超过时限时抛出 {@link ConcurrentGameModificationException}
     */
    LockLease acquire(UUID gameId);

    /**
     * 已获取的租约，关闭即释放（只有持有者能释放）
     */
    interface LockLease extends AutoCloseable {

        UUID getGameId();

        @Override
        void close();
    }
}
