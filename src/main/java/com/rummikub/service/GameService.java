package com.rummikub.service;

import com.rummikub.engine.GameRules;
import com.rummikub.engine.Outcome;
import com.rummikub.engine.RuleViolation;
import com.rummikub.engine.TurnEngine;
import com.rummikub.model.GameState;
import com.rummikub.model.GameStatus;
import com.rummikub.model.Player;
import com.rummikub.model.TurnAction;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * 游戏服务
 * 负责加载/保存快照和单局加锁，规则判断全部交给 {@link TurnEngine}
 */
@Service
public class GameService {

    private static final Logger log = LoggerFactory.getLogger(GameService.class);

    private final TurnEngine engine;
    private final GameStore store;
    private final GameLock lock;
    private final GameNameGenerator nameGenerator;

    public GameService(TurnEngine engine, GameStore store, GameLock lock, GameNameGenerator nameGenerator) {
        this.engine = engine;
        this.store = store;
        this.lock = lock;
        this.nameGenerator = nameGenerator;
    }

    /**
     * 创建游戏
     */
    public GameView createGame(int playerCount) {
        GameState state = engine.createGame(UUID.randomUUID(), playerCount)
            .orElseThrow(RuleViolationException::of)
            .withName(nameGenerator.generate());
        store.save(state);
        log.info("创建游戏 {}（{}），{}人", state.getGameId(), state.getName(), playerCount);
        return GameView.forPlayer(state, null);
    }

    /**
     * 加入游戏
     * 名字已在游戏中时视为重连，直接返回该玩家的视图
     */
    public GameView joinGame(UUID gameId, String playerName) {
        try (GameLock.LockLease ignored = lock.acquire(gameId)) {
            GameState state = load(gameId);

            Optional<Player> existing = state.findPlayerByName(playerName);
            if (existing.isPresent()) {
                log.info("玩家 {} 重新连接到游戏 {}", playerName, gameId);
                return GameView.forPlayer(state, existing.get().getId());
            }

            GameState joined = engine.join(state, playerName).orElseThrow(RuleViolationException::of);
            persist(joined);
            Player player = joined.findPlayerByName(playerName)
                .orElseThrow(() -> new IllegalStateException("入座后找不到玩家：" + playerName));
            return GameView.forPlayer(joined, player.getId());
        }
    }

    /**
     * 某个玩家眼中的游戏状态
     */
    public GameView getGame(UUID gameId, String playerId) {
        GameState state = load(gameId);
        if (state.findPlayer(playerId).isEmpty()) {
            throw new RuleViolationException(RuleViolation.PLAYER_NOT_IN_GAME, "玩家不在游戏中：" + playerId);
        }
        return GameView.forPlayer(state, playerId);
    }

    /**
     * 所有游戏（不显示任何人的牌架）
     */
    public List<GameView> listGames() {
        List<GameView> views = new ArrayList<>();
        for (GameState state : store.findAll()) {
            views.add(GameView.forPlayer(state, null));
        }
        return views;
    }

    /**
     * 执行玩家的行动（出牌或摸牌），成功且游戏未结束时交给下一个玩家
     */
    public GameView executeTurn(UUID gameId, String playerId, TurnAction action) {
        try (GameLock.LockLease ignored = lock.acquire(gameId)) {
            GameState state = load(gameId);

            Outcome<GameState> applied = engine.apply(state, playerId, action);
            GameState next = applied.orElseThrow(RuleViolationException::of);
            if (next.getStatus() == GameStatus.IN_PROGRESS) {
                next = engine.advanceTurn(next).orElseThrow(RuleViolationException::of);
            }

            persist(next);
            log.info("游戏 {}：玩家 {} 执行 {} 成功，状态：{}", gameId, playerId, action.getType(), next.getStatus());
            return GameView.forPlayer(next, playerId);
        }
    }

    /**
     * 当前得分（游戏结束时即最终得分）
     */
    public Map<String, Integer> scores(UUID gameId) {
        return GameRules.finalScores(load(gameId));
    }

    private GameState load(UUID gameId) {
        return store.find(gameId).orElseThrow(() -> new GameNotFoundException(gameId));
    }

    private void persist(GameState state) {
        if (!state.isTileConserved()) {
            throw new IllegalStateException("牌不守恒，拒绝保存游戏：" + state.getGameId());
        }
        store.save(state);
    }
}
