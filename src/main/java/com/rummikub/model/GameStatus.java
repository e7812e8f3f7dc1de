package com.rummikub.model;

/**
 * 游戏状态
 */
public enum GameStatus {
    WAITING_FOR_PLAYERS,    // 等待玩家入座
    IN_PROGRESS,            // 对局中
    COMPLETED               // 已结束（终态）
}
