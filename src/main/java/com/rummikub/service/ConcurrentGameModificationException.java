package com.rummikub.service;

import java.util.UUID;

/**
 * 在等待时限内没有拿到游戏锁：有另一个操作正在修改同一局游戏
 */
public class ConcurrentGameModificationException extends GameServiceException {

    public ConcurrentGameModificationException(UUID gameId) {
        super("CONCURRENT_MODIFICATION", "游戏正在被其他操作修改：" + gameId);
    }
}
