package com.rummikub.model;

/**
 * 牌的种类
 */
public enum TileKind {
    NUMBERED,   // 数字牌（1-13，四种颜色）
    JOKER       // 百搭牌（点数由所在牌组决定）
}
