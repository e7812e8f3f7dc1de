package com.rummikub.engine;

/**
 * 规则违例
 * 每种违例对应一个稳定的原因代码，调用方据此渲染提示，不需要匹配消息文本
 */
public enum RuleViolation {

    // === 组 ===
    SIZE_ERROR("牌组张数不合法"),
    MIXED_NUMBERS("组内数字牌点数不一致"),
    COLOR_DUPLICATION("组内数字牌颜色重复"),
    AMBIGUOUS_GROUP("组内没有数字牌，无法确定点数"),
    TOO_MANY_JOKERS("百搭牌数量超过可补的颜色"),

    // === 顺 ===
    MIXED_COLORS("顺内数字牌颜色不一致"),
    AMBIGUOUS_RUN("顺内没有数字牌，无法确定颜色"),
    NON_CONSECUTIVE("顺内点数不连续"),
    OUT_OF_RANGE("顺超出1-13的范围"),
    INVALID_TILE("牌组中有非法的牌ID"),

    // === 出牌 ===
    TILE_NOT_OWNED("打出的牌不在玩家牌架上"),
    DUPLICATE_TILE("同一张牌在桌面上出现了多次"),
    BOARD_TILE_REMOVED("桌面上原有的牌不能收回"),
    INITIAL_MELD_NOT_MET("破冰出牌不足30点"),
    NO_OP_MOVE("没有打出任何新牌"),

    // === 回合/状态 ===
    NOT_PLAYERS_TURN("还没轮到该玩家"),
    PLAYER_NOT_IN_GAME("玩家不在该游戏中"),
    GAME_NOT_STARTED("游戏尚未开始"),
    GAME_FINISHED("游戏已经结束"),
    POOL_EMPTY("牌池已空"),

    // === 入座/创建 ===
    NAME_TAKEN("该名字已被使用"),
    GAME_FULL("座位已满"),
    INVALID_PLAYER_NAME("玩家名称不能为空"),
    INVALID_PLAYER_COUNT("玩家数量必须在2-4之间");

    private final String defaultMessage;

    RuleViolation(String defaultMessage) {
        this.defaultMessage = defaultMessage;
    }

    /**
     * 稳定的原因代码（即枚举名）
     */
    public String getCode() {
        return name();
    }

    public String getDefaultMessage() {
        return defaultMessage;
    }
}
