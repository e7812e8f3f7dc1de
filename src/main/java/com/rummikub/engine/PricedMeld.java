package com.rummikub.engine;

import com.rummikub.model.MeldKind;
import com.rummikub.model.TileColor;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 校验通过的牌组：总点数、每张百搭牌代表的牌面，以及规范ID
 */
public final class PricedMeld {

    private final MeldKind kind;
    private final String canonicalId;
    private final int value;
    private final Map<String, Integer> jokerNumbers;
    private final Map<String, TileColor> jokerColors;

    PricedMeld(MeldKind kind, String canonicalId, int value,
               Map<String, Integer> jokerNumbers, Map<String, TileColor> jokerColors) {
        this.kind = kind;
        this.canonicalId = canonicalId;
        this.value = value;
        this.jokerNumbers = Collections.unmodifiableMap(new LinkedHashMap<>(jokerNumbers));
        this.jokerColors = Collections.unmodifiableMap(new LinkedHashMap<>(jokerColors));
    }

    public MeldKind getKind() {
        return kind;
    }

    public String getCanonicalId() {
        return canonicalId;
    }

    /**
     * 总点数（百搭牌按其代表的点数计）
     */
    public int getValue() {
        return value;
    }

    /**
     * 百搭牌ID -> 代表的点数（按百搭牌在牌组中出现的顺序）
     */
    public Map<String, Integer> getJokerAssignment() {
        return jokerNumbers;
    }

    /**
     * 百搭牌ID -> 代表的颜色
     */
    public Map<String, TileColor> getJokerColors() {
        return jokerColors;
    }

    @Override
    public String toString() {
        return kind.name().toLowerCase() + "[" + canonicalId + "]=" + value;
    }
}
