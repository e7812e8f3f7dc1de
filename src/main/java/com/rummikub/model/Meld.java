package com.rummikub.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;

/**
 * 牌组（组或顺）
 *
 * 牌组ID不单独保存，每次由（类型、牌列表）重新计算：
 * - 组：按规范颜色顺序排序（数字牌在前，百搭牌在后），与提交顺序无关
 * - 顺：保持提交顺序，位置决定了百搭牌代表的点数
 * 组成相同的两个牌组ID相同，也视为相等。
 */
public final class Meld {

    public static final String ID_SEPARATOR = "-";

    /**
     * 组内规范顺序；无法解析的ID排在最后，按字符串比较
     */
    private static final Comparator<String> GROUP_ORDER = (a, b) -> {
        Tile ta = tryParse(a);
        Tile tb = tryParse(b);
        if (ta != null && tb != null) {
            return ta.compareTo(tb);
        }
        if (ta == null && tb == null) {
            return a.compareTo(b);
        }
        return ta == null ? 1 : -1;
    };

    private final MeldKind kind;
    private final List<String> tiles;

    public Meld(MeldKind kind, List<String> tiles) {
        this.kind = Objects.requireNonNull(kind, "kind");
        this.tiles = List.copyOf(Objects.requireNonNull(tiles, "tiles"));
    }

    public static Meld group(String... tiles) {
        return new Meld(MeldKind.GROUP, List.of(tiles));
    }

    public static Meld run(String... tiles) {
        return new Meld(MeldKind.RUN, List.of(tiles));
    }

    public MeldKind getKind() {
        return kind;
    }

    /**
     * 提交时的牌顺序
     */
    public List<String> getTiles() {
        return tiles;
    }

    public int size() {
        return tiles.size();
    }

    /**
     * 规范顺序的牌列表
     */
    public List<String> getCanonicalTiles() {
        if (kind == MeldKind.RUN) {
            return tiles;
        }
        List<String> sorted = new ArrayList<>(tiles);
        sorted.sort(GROUP_ORDER);
        return Collections.unmodifiableList(sorted);
    }

    /**
     * 规范ID：规范顺序的牌ID用 "-" 连接
     */
    public String getId() {
        return String.join(ID_SEPARATOR, getCanonicalTiles());
    }

    private static Tile tryParse(String id) {
        try {
            return Tile.parse(id);
        } catch (IllegalArgumentException e) {
            return null;
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Meld)) {
            return false;
        }
        Meld other = (Meld) o;
        return kind == other.kind && getId().equals(other.getId());
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, getId());
    }

    @Override
    public String toString() {
        return kind.name().toLowerCase() + "[" + getId() + "]";
    }
}
