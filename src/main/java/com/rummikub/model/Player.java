package com.rummikub.model;

import java.util.Objects;

/**
 * 玩家
 * 开局时所有座位都已发好牌但没有名字，加入时才填上名字
 */
public final class Player {
    private final String id;                    // 玩家ID
    private final String name;                  // 玩家名称（未加入时为 null）
    private final Rack rack;                    // 牌架
    private final boolean initialMeldMet;       // 是否已完成破冰（首次出牌不少于30点）

    public Player(String id, String name, Rack rack, boolean initialMeldMet) {
        this.id = Objects.requireNonNull(id, "id");
        this.name = name;
        this.rack = Objects.requireNonNull(rack, "rack");
        this.initialMeldMet = initialMeldMet;
    }

    /**
     * 尚未有人入座的座位
     */
    public static Player seat(String id, Rack rack) {
        return new Player(id, null, rack, false);
    }

    public String getId() {
        return id;
    }

    public String getName() {
        return name;
    }

    public boolean isJoined() {
        return name != null;
    }

    public Rack getRack() {
        return rack;
    }

    public boolean isInitialMeldMet() {
        return initialMeldMet;
    }

    public int getRackSize() {
        return rack.size();
    }

    public Player withName(String name) {
        return new Player(id, name, rack, initialMeldMet);
    }

    public Player withRack(Rack rack) {
        return new Player(id, name, rack, initialMeldMet);
    }

    public Player withInitialMeldMet(boolean initialMeldMet) {
        return new Player(id, name, rack, initialMeldMet);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Player)) {
            return false;
        }
        Player other = (Player) o;
        return initialMeldMet == other.initialMeldMet
            && id.equals(other.id)
            && Objects.equals(name, other.name)
            && rack.equals(other.rack);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, name, rack, initialMeldMet);
    }

    @Override
    public String toString() {
        return "Player{" + id + ", " + name + ", rack=" + rack.size() + "}";
    }
}
