package com.rummikub.model;

/**
 * 同一张牌的两个副本（a / b）
 */
public enum TileCopy {
    A('a'),
    B('b');

    private final char code;

    TileCopy(char code) {
        this.code = code;
    }

    public char getCode() {
        return code;
    }

    public static TileCopy fromCode(char code) {
        for (TileCopy copy : values()) {
            if (copy.code == code) {
                return copy;
            }
        }
        throw new IllegalArgumentException("未知的副本代码：" + code);
    }
}
