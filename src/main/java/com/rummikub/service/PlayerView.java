package com.rummikub.service;

import com.rummikub.model.Player;

import java.util.List;

/**
 * 某个观看者眼中的玩家：只有观看者自己能看到牌架内容，其他人只看到张数
 */
public final class PlayerView {

    private final String id;
    private final String name;
    private final int rackSize;
    private final List<String> rack;        // 非观看者本人时为 null
    private final boolean initialMeldMet;

    private PlayerView(String id, String name, int rackSize, List<String> rack, boolean initialMeldMet) {
        this.id = id;
        this.name = name;
        this.rackSize = rackSize;
        this.rack = rack;
        this.initialMeldMet = initialMeldMet;
    }

    static PlayerView of(Player player, boolean viewer) {
        return new PlayerView(player.getId(), player.getName(), player.getRackSize(),
            viewer ? player.getRack().getTileIds() : null, player.isInitialMeldMet());
    }

    public String getId() {
        return id;
    }

    public String getName() {
        return name;
    }

    public int getRackSize() {
        return rackSize;
    }

    /**
     * 牌架内容，只对观看者本人可见
     */
    public List<String> getRack() {
        return rack;
    }

    public boolean isRackVisible() {
        return rack != null;
    }

    public boolean isInitialMeldMet() {
        return initialMeldMet;
    }
}
