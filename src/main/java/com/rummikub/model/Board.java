package com.rummikub.model;

import java.util.ArrayList;
import java.util.List;

/**
 * 桌面：所有玩家可见的牌组序列
 * 每次成功出牌都会整体替换
 */
public final class Board {

    private static final Board EMPTY = new Board(List.of());

    private final List<Meld> melds;

    public Board(List<Meld> melds) {
        this.melds = List.copyOf(melds);
    }

    public static Board empty() {
        return EMPTY;
    }

    public List<Meld> getMelds() {
        return melds;
    }

    public int size() {
        return melds.size();
    }

    public boolean isEmpty() {
        return melds.isEmpty();
    }

    /**
     * 桌面上所有牌（按牌组顺序，保留重复）
     */
    public List<String> getTileIds() {
        List<String> result = new ArrayList<>();
        for (Meld meld : melds) {
            result.addAll(meld.getTiles());
        }
        return result;
    }

    @Override
    public boolean equals(Object o) {
        return this == o || (o instanceof Board && melds.equals(((Board) o).melds));
    }

    @Override
    public int hashCode() {
        return melds.hashCode();
    }

    @Override
    public String toString() {
        return melds.toString();
    }
}
