package com.rummikub.model;

/**
 * 牌的颜色
 * 枚举顺序即规范顺序（黑、红、蓝、橙），组的规范ID和百搭牌补色都按这个顺序
 */
public enum TileColor {
    BLACK('k'),
    RED('r'),
    BLUE('b'),
    ORANGE('o');

    private final char code;

    TileColor(char code) {
        this.code = code;
    }

    /**
     * 牌ID中使用的单字符颜色代码
     */
    public char getCode() {
        return code;
    }

    public static TileColor fromCode(char code) {
        for (TileColor color : values()) {
            if (color.code == code) {
                return color;
            }
        }
        throw new IllegalArgumentException("未知的颜色代码：" + code);
    }
}
