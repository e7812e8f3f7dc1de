package com.rummikub.engine;

import com.rummikub.model.Tile;
import com.rummikub.model.TileColor;
import com.rummikub.model.TileCopy;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Random;

/**
 * 牌编码 - 牌ID与牌面之间的转换，以及创建和洗牌
 *
 * 一副拉密牌共106张：
 * - 数字牌：4 种颜色 × 13 个点数 × 2 个副本 = 104 张
 * - 百搭牌：2 张
 */
public final class TileCodec {

    private static final List<String> UNIVERSE = Collections.unmodifiableList(buildUniverse());

    private TileCodec() {
    }

    public static String encode(int number, TileColor color, TileCopy copy) {
        return Tile.numbered(number, color, copy).getId();
    }

    public static String encodeJoker(TileCopy copy) {
        return Tile.joker(copy).getId();
    }

    /**
     * 解析牌ID
     * @throws IllegalArgumentException ID 不符合格式
     */
    public static Tile decode(String tileId) {
        return Tile.parse(tileId);
    }

    /**
     * 是否是合法的牌ID
     */
    public static boolean isValid(String tileId) {
        try {
            Tile.parse(tileId);
            return true;
        } catch (IllegalArgumentException e) {
            return false;
        }
    }

    public static boolean isJoker(String tileId) {
        return decode(tileId).isJoker();
    }

    public static int numberOf(String tileId) {
        Tile tile = decode(tileId);
        if (tile.isJoker()) {
            throw new AmbiguousValueException(tileId);
        }
        return tile.getNumber();
    }

    public static TileColor colorOf(String tileId) {
        Tile tile = decode(tileId);
        if (tile.isJoker()) {
            throw new IllegalArgumentException("百搭牌没有颜色：" + tileId);
        }
        return tile.getColor();
    }

    /**
     * 数字牌的点数
     * @throws AmbiguousValueException 百搭牌的点数只能在牌组中确定（见 MeldValidator）
     */
    public static int valueOf(String tileId) {
        return numberOf(tileId);
    }

    /**
     * 全部106张牌的ID（按颜色、点数、副本排列，百搭牌在最后）
     */
    public static List<String> fullUniverse() {
        return UNIVERSE;
    }

    /**
     * 创建并洗好的整副牌
     */
    public static List<String> createAndShuffle(Random random) {
        List<String> tiles = new ArrayList<>(UNIVERSE);
        Collections.shuffle(tiles, random);
        return tiles;
    }

    private static List<String> buildUniverse() {
        List<String> tiles = new ArrayList<>(106);

        // 数字牌（每种颜色 1-13，每张2个副本）
        for (TileColor color : TileColor.values()) {
            for (int number = Tile.MIN_NUMBER; number <= Tile.MAX_NUMBER; number++) {
                for (TileCopy copy : TileCopy.values()) {
                    tiles.add(encode(number, color, copy));
                }
            }
        }

        // 百搭牌
        for (TileCopy copy : TileCopy.values()) {
            tiles.add(encodeJoker(copy));
        }

        return tiles;
    }
}
