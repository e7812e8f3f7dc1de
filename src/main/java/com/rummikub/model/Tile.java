package com.rummikub.model;

import java.util.Objects;

/**
 * 拉密牌
 * 不可变值对象：身份完全由（种类、点数、颜色、副本）决定，ID 是这些字段的紧凑文本编码。
 *
 * ID 格式：
 * - 数字牌：{点数}{颜色代码}{副本}，例如 "10ra" = 红10 副本a
 * - 百搭牌：j{副本}，例如 "ja"
 */
public final class Tile implements Comparable<Tile> {

    public static final int MIN_NUMBER = 1;
    public static final int MAX_NUMBER = 13;

    private final TileKind kind;
    private final int number;           // 百搭牌为 0
    private final TileColor color;      // 百搭牌为 null
    private final TileCopy copy;
    private final String id;

    private Tile(TileKind kind, int number, TileColor color, TileCopy copy) {
        this.kind = kind;
        this.number = number;
        this.color = color;
        this.copy = copy;
        this.id = encode(kind, number, color, copy);
    }

    /**
     * 创建数字牌
     */
    public static Tile numbered(int number, TileColor color, TileCopy copy) {
        if (number < MIN_NUMBER || number > MAX_NUMBER) {
            throw new IllegalArgumentException("牌点数必须在1-13之间：" + number);
        }
        return new Tile(TileKind.NUMBERED, number, Objects.requireNonNull(color, "color"),
            Objects.requireNonNull(copy, "copy"));
    }

    /**
     * 创建百搭牌
     */
    public static Tile joker(TileCopy copy) {
        return new Tile(TileKind.JOKER, 0, null, Objects.requireNonNull(copy, "copy"));
    }

    /**
     * 解析牌ID
     * @throws IllegalArgumentException ID 不符合格式
     */
    public static Tile parse(String id) {
        if (id == null || id.length() < 2 || id.length() > 4) {
            throw new IllegalArgumentException("非法的牌ID：" + id);
        }
        TileCopy copy = TileCopy.fromCode(id.charAt(id.length() - 1));
        if (id.charAt(0) == 'j') {
            if (id.length() != 2) {
                throw new IllegalArgumentException("非法的百搭牌ID：" + id);
            }
            return joker(copy);
        }
        if (id.length() < 3) {
            throw new IllegalArgumentException("非法的牌ID：" + id);
        }
        TileColor color = TileColor.fromCode(id.charAt(id.length() - 2));
        String digits = id.substring(0, id.length() - 2);
        // 不接受前导零，保证每张牌只有一种写法
        if (digits.charAt(0) == '0') {
            throw new IllegalArgumentException("非法的牌点数：" + id);
        }
        int number = 0;
        for (char c : digits.toCharArray()) {
            if (c < '0' || c > '9') {
                throw new IllegalArgumentException("非法的牌点数：" + id);
            }
            number = number * 10 + (c - '0');
        }
        return numbered(number, color, copy);
    }

    private static String encode(TileKind kind, int number, TileColor color, TileCopy copy) {
        switch (kind) {
            case NUMBERED:
                return String.valueOf(number) + color.getCode() + copy.getCode();
            case JOKER:
                return "j" + copy.getCode();
            default:
                throw new IllegalStateException("未知的牌种类：" + kind);
        }
    }

    public TileKind getKind() {
        return kind;
    }

    public boolean isJoker() {
        return kind == TileKind.JOKER;
    }

    /**
     * 数字牌的点数
     * @throws IllegalStateException 百搭牌没有固定点数
     */
    public int getNumber() {
        if (isJoker()) {
            throw new IllegalStateException("百搭牌没有固定点数：" + id);
        }
        return number;
    }

    /**
     * 数字牌的颜色
     * @throws IllegalStateException 百搭牌没有颜色
     */
    public TileColor getColor() {
        if (isJoker()) {
            throw new IllegalStateException("百搭牌没有颜色：" + id);
        }
        return color;
    }

    public TileCopy getCopy() {
        return copy;
    }

    public String getId() {
        return id;
    }

    /**
     * 显示名称
     */
    public String getDisplayName() {
        switch (kind) {
            case NUMBERED:
                return colorName(color) + number;
            case JOKER:
                return "百搭";
            default:
                return "未知";
        }
    }

    private static String colorName(TileColor color) {
        switch (color) {
            case BLACK:
                return "黑";
            case RED:
                return "红";
            case BLUE:
                return "蓝";
            case ORANGE:
                return "橙";
            default:
                return "?";
        }
    }

    /**
     * 排序：数字牌在前（按颜色、点数、副本），百搭牌在最后
     */
    @Override
    public int compareTo(Tile other) {
        if (this.kind != other.kind) {
            return this.isJoker() ? 1 : -1;
        }
        if (this.color != other.color) {
            return this.color.ordinal() - other.color.ordinal();
        }
        if (this.number != other.number) {
            return this.number - other.number;
        }
        return this.copy.ordinal() - other.copy.ordinal();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Tile)) {
            return false;
        }
        return id.equals(((Tile) o).id);
    }

    @Override
    public int hashCode() {
        return id.hashCode();
    }

    @Override
    public String toString() {
        return id;
    }
}
