package com.rummikub.model;

import java.util.List;
import java.util.Objects;

/**
 * 玩家的一次行动
 * 出牌行动携带出牌后的完整桌面（不是增量），摸牌行动没有内容
 */
public final class TurnAction {

    private static final TurnAction DRAW = new TurnAction(ActionType.DRAW, List.of());

    private final ActionType type;
    private final List<Meld> melds;

    private TurnAction(ActionType type, List<Meld> melds) {
        this.type = type;
        this.melds = List.copyOf(melds);
    }

    public static TurnAction playTiles(List<Meld> melds) {
        return new TurnAction(ActionType.PLAY_TILES, Objects.requireNonNull(melds, "melds"));
    }

    public static TurnAction draw() {
        return DRAW;
    }

    public ActionType getType() {
        return type;
    }

    /**
     * 出牌后的完整桌面；摸牌行动为空列表
     */
    public List<Meld> getMelds() {
        return melds;
    }

    @Override
    public String toString() {
        return type == ActionType.DRAW ? "draw" : "play" + melds;
    }
}
