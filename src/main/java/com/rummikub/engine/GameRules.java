package com.rummikub.engine;

import com.rummikub.model.GameState;
import com.rummikub.model.GameStatus;
import com.rummikub.model.Meld;
import com.rummikub.model.Player;
import com.rummikub.model.Tile;

import java.util.Collection;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * 规则检查器 - 回合归属、牌的归属、破冰门槛、牌池、胜负
 * 所有方法都是无副作用的纯函数
 */
public final class GameRules {

    /**
     * 破冰门槛：首次出牌的新牌组合计不少于30点
     */
    public static final int INITIAL_MELD_THRESHOLD = 30;

    /**
     * 结算时留在牌架上的百搭牌计30点
     */
    public static final int JOKER_PENALTY = 30;

    private GameRules() {
    }

    /**
     * 是否轮到该玩家行动
     */
    public static boolean turnOwnerOk(GameState state, String playerId) {
        return state.getStatus() == GameStatus.IN_PROGRESS
            && state.getCurrentPlayer().getId().equals(playerId);
    }

    /**
     * 检查回合归属，并给出具体的失败原因
     */
    public static Outcome<Player> checkTurn(GameState state, String playerId) {
        switch (state.getStatus()) {
            case WAITING_FOR_PLAYERS:
                return Outcome.rejected(RuleViolation.GAME_NOT_STARTED);
            case COMPLETED:
                return Outcome.rejected(RuleViolation.GAME_FINISHED);
            case IN_PROGRESS:
                break;
            default:
                throw new IllegalStateException("未知的游戏状态：" + state.getStatus());
        }
        Optional<Player> player = state.findPlayer(playerId);
        if (player.isEmpty()) {
            return Outcome.rejected(RuleViolation.PLAYER_NOT_IN_GAME, "玩家不在游戏中：" + playerId);
        }
        if (!turnOwnerOk(state, playerId)) {
            return Outcome.rejected(RuleViolation.NOT_PLAYERS_TURN,
                "当前轮到：" + state.getCurrentPlayer().getId());
        }
        return Outcome.ok(player.get());
    }

    /**
     * 检查玩家是否拥有这些牌
     */
    public static Outcome<Void> ownsTiles(Player player, Collection<String> tileIds) {
        for (String tileId : tileIds) {
            if (!player.getRack().contains(tileId)) {
                return Outcome.rejected(RuleViolation.TILE_NOT_OWNED, "玩家 " + player.getId() + " 没有牌：" + tileId);
            }
        }
        return Outcome.passed();
    }

    /**
     * 新打出的牌：出现在新桌面、但不在当前桌面上的牌
     * 用来区分玩家真正打出的牌和只是在桌面上挪动的牌
     */
    public static Set<String> newlyPlayed(List<Meld> candidateMelds, List<Meld> currentMelds) {
        Set<String> current = new HashSet<>();
        for (Meld meld : currentMelds) {
            current.addAll(meld.getTiles());
        }
        Set<String> result = new LinkedHashSet<>();
        for (Meld meld : candidateMelds) {
            for (String tileId : meld.getTiles()) {
                if (!current.contains(tileId)) {
                    result.add(tileId);
                }
            }
        }
        return result;
    }

    /**
     * 桌面完整性：新桌面上每张牌只能出现一次，当前桌面上的牌一张都不能少
     */
    public static Outcome<Void> boardIntegrity(List<Meld> candidateMelds, List<Meld> currentMelds) {
        Set<String> candidate = new HashSet<>();
        for (Meld meld : candidateMelds) {
            for (String tileId : meld.getTiles()) {
                if (!candidate.add(tileId)) {
                    return Outcome.rejected(RuleViolation.DUPLICATE_TILE, "桌面上重复出现：" + tileId);
                }
            }
        }
        for (Meld meld : currentMelds) {
            for (String tileId : meld.getTiles()) {
                if (!candidate.contains(tileId)) {
                    return Outcome.rejected(RuleViolation.BOARD_TILE_REMOVED, "桌面上的牌不见了：" + tileId);
                }
            }
        }
        return Outcome.passed();
    }

    /**
     * 校验每个牌组，返回第一个不合法牌组的违例
     */
    public static Outcome<Void> allMeldsValid(List<Meld> candidateMelds) {
        for (Meld meld : candidateMelds) {
            Outcome<PricedMeld> priced = MeldValidator.validateAndPrice(meld);
            if (priced.isRejected()) {
                return Outcome.rejected(priced.getViolation(), meld + "：" + priced.getDetail());
            }
        }
        return Outcome.passed();
    }

    /**
     * 破冰检查
     * 已破冰的玩家直接通过；否则含有新牌的牌组点数合计必须不少于30
     */
    public static Outcome<Void> initialMeldOk(Player player, Set<String> newlyPlayed, List<Meld> candidateMelds) {
        if (player.isInitialMeldMet()) {
            return Outcome.passed();
        }
        Outcome<Integer> total = openingValue(newlyPlayed, candidateMelds);
        if (total.isRejected()) {
            return total.propagate();
        }
        if (total.getValue() < INITIAL_MELD_THRESHOLD) {
            return Outcome.rejected(RuleViolation.INITIAL_MELD_NOT_MET,
                "破冰需要" + INITIAL_MELD_THRESHOLD + "点，实际" + total.getValue() + "点");
        }
        return Outcome.passed();
    }

    /**
     * 含有新牌的牌组点数合计
     */
    public static Outcome<Integer> openingValue(Set<String> newlyPlayed, List<Meld> candidateMelds) {
        int total = 0;
        for (Meld meld : candidateMelds) {
            boolean contributes = false;
            for (String tileId : meld.getTiles()) {
                if (newlyPlayed.contains(tileId)) {
                    contributes = true;
                    break;
                }
            }
            if (!contributes) {
                continue;
            }
            Outcome<PricedMeld> priced = MeldValidator.validateAndPrice(meld);
            if (priced.isRejected()) {
                return priced.propagate();
            }
            total += priced.getValue().getValue();
        }
        return Outcome.ok(total);
    }

    /**
     * 牌池不能为空
     */
    public static Outcome<Void> poolNonEmpty(GameState state) {
        if (state.getPool().isEmpty()) {
            return Outcome.rejected(RuleViolation.POOL_EMPTY);
        }
        return Outcome.passed();
    }

    /**
     * 是否获胜：牌架已空，并且已经破冰
     */
    public static boolean win(GameState state, String playerId) {
        return state.findPlayer(playerId)
            .map(GameRules::win)
            .orElse(false);
    }

    public static boolean win(Player player) {
        return player.getRack().isEmpty() && player.isInitialMeldMet();
    }

    // === 结算 ===

    /**
     * 牌架罚分：剩余牌点数之和，百搭牌计30
     */
    public static int rackPenalty(Player player) {
        int penalty = 0;
        for (String tileId : player.getRack().getTileIds()) {
            Tile tile = TileCodec.decode(tileId);
            penalty += tile.isJoker() ? JOKER_PENALTY : tile.getNumber();
        }
        return penalty;
    }

    /**
     * 最终得分
     * 有获胜者时：输家记负的罚分，获胜者得到所有输家罚分之和；
     * 没有获胜者时（游戏仍在进行，例如牌池摸空后僵持）：每人按当前牌架记负的罚分。
     * 引擎不会在没有获胜者的情况下结束游戏，牌池摸空后不做强制结算。
     */
    public static Map<String, Integer> finalScores(GameState state) {
        Map<String, Integer> scores = new LinkedHashMap<>();
        String winnerId = state.getWinnerId();
        int pot = 0;
        for (Player player : state.getPlayers()) {
            if (player.getId().equals(winnerId)) {
                continue;
            }
            int penalty = rackPenalty(player);
            scores.put(player.getId(), -penalty);
            pot += penalty;
        }
        if (winnerId != null) {
            scores.put(winnerId, pot);
        }
        // 保持座位顺序
        Map<String, Integer> ordered = new LinkedHashMap<>();
        for (Player player : state.getPlayers()) {
            ordered.put(player.getId(), scores.get(player.getId()));
        }
        return ordered;
    }
}
