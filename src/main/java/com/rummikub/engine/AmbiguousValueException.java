package com.rummikub.engine;

/**
 * 百搭牌的点数取决于所在牌组，不能直接取值
 */
public class AmbiguousValueException extends IllegalArgumentException {

    public AmbiguousValueException(String tileId) {
        super("百搭牌的点数取决于所在牌组：" + tileId);
    }
}
