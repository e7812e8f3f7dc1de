package com.rummikub.engine;

import com.rummikub.model.Meld;
import com.rummikub.model.MeldKind;
import com.rummikub.model.Tile;
import com.rummikub.model.TileColor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 牌组校验器 - 校验组/顺是否合法，确定百搭牌代表的牌面并计算点数
 *
 * 规则：
 * 1. 组：3-4张，数字牌点数相同、颜色互不相同；百搭牌按规范颜色顺序补缺失的颜色
 * 2. 顺：至少3张，数字牌颜色相同、点数连续；百搭牌代表所在位置应有的点数
 *
 * 顺的校验按“位置”而不是“有没有空缺”：第一张数字牌确定起点，之后每张数字牌
 * 都必须等于 起点 + 位置，所以 [3, 百搭, 8] 这种一张百搭补不上的情况会被拒绝。
 */
public final class MeldValidator {

    private static final Logger log = LoggerFactory.getLogger(MeldValidator.class);

    public static final int GROUP_MIN = 3;
    public static final int GROUP_MAX = 4;
    public static final int RUN_MIN = 3;

    private MeldValidator() {
    }

    public static Outcome<PricedMeld> validateAndPrice(Meld meld) {
        return validateAndPrice(meld.getKind(), meld.getTiles());
    }

    /**
     * 校验牌组并计算点数
     */
    public static Outcome<PricedMeld> validateAndPrice(MeldKind kind, List<String> tileIds) {
        if (tileIds == null || tileIds.isEmpty()) {
            return Outcome.rejected(RuleViolation.SIZE_ERROR, "牌组不能为空");
        }

        // 1. 张数
        int size = tileIds.size();
        if (kind == MeldKind.GROUP && (size < GROUP_MIN || size > GROUP_MAX)) {
            return Outcome.rejected(RuleViolation.SIZE_ERROR, "组必须是3-4张，实际" + size + "张");
        }
        if (kind == MeldKind.RUN && size < RUN_MIN) {
            return Outcome.rejected(RuleViolation.SIZE_ERROR, "顺至少3张，实际" + size + "张");
        }

        // 2. 解析并区分百搭牌和数字牌（数字牌保留原始位置）
        // 同一张牌重复出现由桌面完整性检查负责（GameRules.boardIntegrity）
        List<Tile> tiles = new ArrayList<>(size);
        for (String tileId : tileIds) {
            if (!TileCodec.isValid(tileId)) {
                return Outcome.rejected(RuleViolation.INVALID_TILE, "非法的牌ID：" + tileId);
            }
            tiles.add(TileCodec.decode(tileId));
        }

        Outcome<PricedMeld> result;
        switch (kind) {
            case GROUP:
                result = priceGroup(tiles);
                break;
            case RUN:
                result = priceRun(tiles);
                break;
            default:
                throw new IllegalStateException("未知的牌组类型：" + kind);
        }

        if (result.isOk()) {
            log.debug("牌组合法：{}，百搭牌：{}", result.getValue(), result.getValue().getJokerAssignment());
        }
        return result;
    }

    /**
     * 组：同点数、不同颜色
     */
    private static Outcome<PricedMeld> priceGroup(List<Tile> tiles) {
        List<Tile> jokers = new ArrayList<>();
        List<Tile> numbered = new ArrayList<>();
        for (Tile tile : tiles) {
            if (tile.isJoker()) {
                jokers.add(tile);
            } else {
                numbered.add(tile);
            }
        }

        // 所有数字牌点数相同
        int number = -1;
        for (Tile tile : numbered) {
            if (number == -1) {
                number = tile.getNumber();
            } else if (tile.getNumber() != number) {
                return Outcome.rejected(RuleViolation.MIXED_NUMBERS,
                    "组内点数不一致：" + number + " / " + tile.getNumber());
            }
        }

        // 数字牌颜色互不相同
        Set<TileColor> used = EnumSet.noneOf(TileColor.class);
        for (Tile tile : numbered) {
            if (!used.add(tile.getColor())) {
                return Outcome.rejected(RuleViolation.COLOR_DUPLICATION, "组内颜色重复：" + tile.getDisplayName());
            }
        }

        if (numbered.isEmpty()) {
            return Outcome.rejected(RuleViolation.AMBIGUOUS_GROUP);
        }

        // 百搭牌按输入顺序依次补上缺失的颜色（EnumSet 按规范颜色顺序迭代）
        Set<TileColor> available = EnumSet.complementOf(EnumSet.copyOf(used));
        if (jokers.size() > available.size()) {
            return Outcome.rejected(RuleViolation.TOO_MANY_JOKERS,
                "需要补" + jokers.size() + "张，只缺" + available.size() + "种颜色");
        }

        Map<String, Integer> jokerNumbers = new LinkedHashMap<>();
        Map<String, TileColor> jokerColors = new LinkedHashMap<>();
        List<TileColor> freeColors = new ArrayList<>(available);
        for (int i = 0; i < jokers.size(); i++) {
            String jokerId = jokers.get(i).getId();
            jokerNumbers.put(jokerId, number);
            jokerColors.put(jokerId, freeColors.get(i));
        }

        int value = number * tiles.size();
        return Outcome.ok(new PricedMeld(MeldKind.GROUP, canonicalId(MeldKind.GROUP, tiles), value,
            jokerNumbers, jokerColors));
    }

    /**
     * 顺：同颜色、连续点数
     */
    private static Outcome<PricedMeld> priceRun(List<Tile> tiles) {
        TileColor color = null;
        int firstPosition = -1;
        for (int position = 0; position < tiles.size(); position++) {
            Tile tile = tiles.get(position);
            if (tile.isJoker()) {
                continue;
            }
            if (color == null) {
                color = tile.getColor();
                firstPosition = position;
            } else if (tile.getColor() != color) {
                return Outcome.rejected(RuleViolation.MIXED_COLORS, "顺内颜色不一致：" + color + " / " + tile.getColor());
            }
        }

        if (color == null) {
            return Outcome.rejected(RuleViolation.AMBIGUOUS_RUN);
        }

        // 由第一张数字牌推出起点，其余数字牌必须落在 起点 + 位置 上
        int start = tiles.get(firstPosition).getNumber() - firstPosition;
        for (int position = firstPosition + 1; position < tiles.size(); position++) {
            Tile tile = tiles.get(position);
            if (!tile.isJoker() && tile.getNumber() != start + position) {
                return Outcome.rejected(RuleViolation.NON_CONSECUTIVE,
                    "位置" + position + "应为" + (start + position) + "，实际为" + tile.getNumber());
            }
        }

        int end = start + tiles.size() - 1;
        if (start < Tile.MIN_NUMBER || end > Tile.MAX_NUMBER) {
            return Outcome.rejected(RuleViolation.OUT_OF_RANGE, "顺的范围 " + start + "-" + end + " 超出1-13");
        }

        Map<String, Integer> jokerNumbers = new LinkedHashMap<>();
        Map<String, TileColor> jokerColors = new LinkedHashMap<>();
        int value = 0;
        for (int position = 0; position < tiles.size(); position++) {
            Tile tile = tiles.get(position);
            int resolved = start + position;
            if (tile.isJoker()) {
                jokerNumbers.put(tile.getId(), resolved);
                jokerColors.put(tile.getId(), color);
            }
            value += resolved;
        }

        return Outcome.ok(new PricedMeld(MeldKind.RUN, canonicalId(MeldKind.RUN, tiles), value,
            jokerNumbers, jokerColors));
    }

    /**
     * 规范ID：组按颜色顺序排序（百搭牌在后），顺保持原顺序
     */
    public static String canonicalId(MeldKind kind, List<Tile> tiles) {
        List<String> ids = new ArrayList<>(tiles.size());
        for (Tile tile : tiles) {
            ids.add(tile.getId());
        }
        return new Meld(kind, ids).getId();
    }
}
