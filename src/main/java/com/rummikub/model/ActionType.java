package com.rummikub.model;

/**
 * 玩家行动类型
 */
public enum ActionType {
    PLAY_TILES, // 出牌（提交整个新桌面）
    DRAW        // 摸牌
}
