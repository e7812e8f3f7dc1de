package com.rummikub.model;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Set;

/**
 * 牌架：玩家私有的牌（其他玩家只能看到张数）
 * 不可变，出牌/摸牌都返回新的牌架
 */
public final class Rack {

    private static final Rack EMPTY = new Rack(List.of());

    private final List<String> tileIds;

    public Rack(Collection<String> tileIds) {
        this.tileIds = List.copyOf(tileIds);
    }

    public static Rack empty() {
        return EMPTY;
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

    public boolean contains(String tileId) {
        return tileIds.contains(tileId);
    }

    /**
     * 加入一张摸到的牌（放在最右边）
     */
    public Rack with(String tileId) {
        List<String> next = new ArrayList<>(tileIds);
        next.add(tileId);
        return new Rack(next);
    }

    /**
     * 移除打出的牌
     */
    public Rack without(Set<String> played) {
        List<String> next = new ArrayList<>(tileIds.size());
        for (String tileId : tileIds) {
            if (!played.contains(tileId)) {
                next.add(tileId);
            }
        }
        return new Rack(next);
    }

    @Override
    public boolean equals(Object o) {
        return this == o || (o instanceof Rack && tileIds.equals(((Rack) o).tileIds));
    }

    @Override
    public int hashCode() {
        return tileIds.hashCode();
    }

    @Override
    public String toString() {
        return tileIds.toString();
    }
}
