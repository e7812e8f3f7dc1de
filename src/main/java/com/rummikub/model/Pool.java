package com.rummikub.model;

import java.util.Collection;
import java.util.List;

/**
 * 牌池：背面朝上、可供摸取的牌
 * 创建时已洗好，摸牌从牌头取（对调用方来说每张牌都无法区分）
 */
public final class Pool {

    private final List<String> tileIds;

    public Pool(Collection<String> tileIds) {
        this.tileIds = List.copyOf(tileIds);
    }

    public List<String> getTileIds() {
        return tileIds;
    }

    public int size() {
        return tileIds.size();
    }

    public boolean isEmpty() {
        return tileIds.isEmpty();
    }

    /**
     * 牌头的那张牌
     * @throws IllegalStateException 牌池为空
     */
    public String peek() {
        if (tileIds.isEmpty()) {
            throw new IllegalStateException("牌池已空");
        }
        return tileIds.get(0);
    }

    /**
     * 去掉牌头后的牌池
     */
    public Pool withoutHead() {
        if (tileIds.isEmpty()) {
            throw new IllegalStateException("牌池已空");
        }
        return new Pool(tileIds.subList(1, tileIds.size()));
    }

    @Override
    public boolean equals(Object o) {
        return this == o || (o instanceof Pool && tileIds.equals(((Pool) o).tileIds));
    }

    @Override
    public int hashCode() {
        return tileIds.hashCode();
    }

    @Override
    public String toString() {
        return "Pool(" + tileIds.size() + ")";
    }
}
