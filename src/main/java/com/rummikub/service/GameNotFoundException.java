package com.rummikub.service;

import java.util.UUID;

/**
 * 游戏不存在
 */
public class GameNotFoundException extends GameServiceException {

    public GameNotFoundException(UUID gameId) {
        super("GAME_NOT_FOUND", "游戏不存在：" + gameId);
    }
}
