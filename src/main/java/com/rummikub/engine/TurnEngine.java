package com.rummikub.engine;

import com.rummikub.model.Board;
import com.rummikub.model.GameState;
import com.rummikub.model.GameStatus;
import com.rummikub.model.Meld;
import com.rummikub.model.Player;
import com.rummikub.model.Pool;
import com.rummikub.model.Rack;
import com.rummikub.model.TurnAction;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Random;
import java.util.Set;
import java.util.UUID;

/**
 * 回合引擎 - 核心游戏逻辑
 *
 * 引擎本身不保存任何游戏状态：每个操作接收一份快照，返回新的快照或者规则违例，
 * 输入快照永远不会被修改。每个检查按固定顺序进行，报告第一个失败的检查。
 */
public class TurnEngine {

    private static final Logger log = LoggerFactory.getLogger(TurnEngine.class);

    public static final int DEFAULT_RACK_SIZE = 14;

    private final Clock clock;
    private final Random random;
    private final int rackSize;

    public TurnEngine() {
        this(Clock.systemUTC(), new Random(), DEFAULT_RACK_SIZE);
    }

    public TurnEngine(Clock clock, Random random, int rackSize) {
        if (rackSize < 1 || rackSize * GameState.MAX_PLAYERS > GameState.TILE_COUNT) {
            throw new IllegalArgumentException("每人发牌数不合法：" + rackSize);
        }
        this.clock = clock;
        this.random = random;
        this.rackSize = rackSize;
    }

    /**
     * 创建游戏
     * 1. 洗好整副牌
     * 2. 给每个座位发牌（座位此时都没有名字）
     * 3. 剩下的牌按洗好的顺序进入牌池
     */
    public Outcome<GameState> createGame(UUID gameId, int playerCount) {
        if (playerCount < GameState.MIN_PLAYERS || playerCount > GameState.MAX_PLAYERS) {
            return Outcome.rejected(RuleViolation.INVALID_PLAYER_COUNT, "玩家数量：" + playerCount);
        }

        List<String> tiles = TileCodec.createAndShuffle(random);
        List<Player> seats = new ArrayList<>(playerCount);
        int dealt = 0;
        for (int i = 0; i < playerCount; i++) {
            Rack rack = new Rack(tiles.subList(dealt, dealt + rackSize));
            dealt += rackSize;
            seats.add(Player.seat(newPlayerId(), rack));
        }
        Pool pool = new Pool(tiles.subList(dealt, tiles.size()));

        Instant now = clock.instant();
        GameState state = new GameState(gameId, null, seats, pool, Board.empty(), 0,
            GameStatus.WAITING_FOR_PLAYERS, null, now, now);
        log.info("游戏创建成功：{}，{}个座位，牌池剩余{}张", gameId, playerCount, pool.size());
        return Outcome.ok(state);
    }

    /**
     * 入座：把名字填到第一个空座位上，保留该座位已发好的牌
     * 最后一个空座位被填上后游戏开始，由0号座位先行动
     */
    public Outcome<GameState> join(GameState state, String name) {
        if (name == null || name.isBlank()) {
            return reject(state, RuleViolation.INVALID_PLAYER_NAME, RuleViolation.INVALID_PLAYER_NAME.getDefaultMessage());
        }
        if (state.getStatus() == GameStatus.COMPLETED) {
            return reject(state, RuleViolation.GAME_FINISHED, "游戏已结束，不能入座");
        }
        if (state.getStatus() == GameStatus.IN_PROGRESS) {
            return reject(state, RuleViolation.GAME_FULL, "游戏已开始，不能入座");
        }
        if (state.findPlayerByName(name).isPresent()) {
            return reject(state, RuleViolation.NAME_TAKEN, "名字已被使用：" + name);
        }
        int seat = state.firstOpenSeat();
        if (seat < 0) {
            return reject(state, RuleViolation.GAME_FULL, RuleViolation.GAME_FULL.getDefaultMessage());
        }

        Player joined = state.getPlayers().get(seat).withName(name);
        GameState next = state.withPlayer(joined).withUpdatedAt(clock.instant());
        log.info("玩家 {} 加入游戏 {}，座位：{}", name, state.getGameId(), seat);

        if (next.firstOpenSeat() < 0) {
            next = next.withStatus(GameStatus.IN_PROGRESS).withCurrentPlayerIndex(0);
            log.info("游戏 {} 人数已满，开始游戏，先手：{}", state.getGameId(), next.getCurrentPlayer().getName());
        }
        return Outcome.ok(next);
    }

    /**
     * 执行一次行动
     */
    public Outcome<GameState> apply(GameState state, String playerId, TurnAction action) {
        switch (action.getType()) {
            case PLAY_TILES:
                return playTiles(state, playerId, action.getMelds());
            case DRAW:
                return draw(state, playerId);
            default:
                throw new IllegalStateException("未知的行动类型：" + action.getType());
        }
    }

    /**
     * 出牌：提交出牌后的完整桌面
     *
     * 检查顺序：
     * 1. 是否轮到该玩家
     * 2. 新打出的牌是否都在玩家牌架上
     * 3. 至少打出一张新牌
     * 4. 桌面完整（不重复、原有的牌不能收回）
     * 5. 每个牌组都合法
     * 6. 破冰门槛
     */
    public Outcome<GameState> playTiles(GameState state, String playerId, List<Meld> candidateMelds) {
        Outcome<Player> turn = GameRules.checkTurn(state, playerId);
        if (turn.isRejected()) {
            return reject(state, turn);
        }
        Player player = turn.getValue();
        List<Meld> currentMelds = state.getBoard().getMelds();

        Set<String> newlyPlayed = GameRules.newlyPlayed(candidateMelds, currentMelds);

        Outcome<Void> owns = GameRules.ownsTiles(player, newlyPlayed);
        if (owns.isRejected()) {
            return reject(state, owns);
        }

        if (newlyPlayed.isEmpty()) {
            return reject(state, RuleViolation.NO_OP_MOVE, "玩家 " + playerId + " 没有打出新牌");
        }

        Outcome<Void> integrity = GameRules.boardIntegrity(candidateMelds, currentMelds);
        if (integrity.isRejected()) {
            return reject(state, integrity);
        }

        Outcome<Void> melds = GameRules.allMeldsValid(candidateMelds);
        if (melds.isRejected()) {
            return reject(state, melds);
        }

        Outcome<Void> opening = GameRules.initialMeldOk(player, newlyPlayed, candidateMelds);
        if (opening.isRejected()) {
            return reject(state, opening);
        }

        Player updated = player
            .withRack(player.getRack().without(newlyPlayed))
            .withInitialMeldMet(true);
        GameState next = state
            .withBoard(new Board(candidateMelds))
            .withPlayer(updated)
            .withUpdatedAt(clock.instant());
        log.info("玩家 {} 打出{}张牌，桌面共{}个牌组，剩余手牌{}张",
            playerId, newlyPlayed.size(), candidateMelds.size(), updated.getRackSize());

        if (GameRules.win(updated)) {
            log.info("玩家 {} 打完所有牌，获胜！游戏 {}", playerId, state.getGameId());
            next = next.completedBy(playerId);
        }
        return Outcome.ok(next);
    }

    /**
     * 摸牌：从牌池牌头取一张放到玩家牌架最右边
     */
    public Outcome<GameState> draw(GameState state, String playerId) {
        Outcome<Player> turn = GameRules.checkTurn(state, playerId);
        if (turn.isRejected()) {
            return reject(state, turn);
        }
        Outcome<Void> pool = GameRules.poolNonEmpty(state);
        if (pool.isRejected()) {
            return reject(state, pool);
        }

        Player player = turn.getValue();
        String tileId = state.getPool().peek();
        GameState next = state
            .withPool(state.getPool().withoutHead())
            .withPlayer(player.withRack(player.getRack().with(tileId)))
            .withUpdatedAt(clock.instant());
        log.debug("玩家 {} 摸牌：{}（{}），牌池剩余{}张",
            playerId, TileCodec.decode(tileId).getDisplayName(), tileId, next.getPool().size());
        return Outcome.ok(next);
    }

    /**
     * 下一个玩家
     * 交出回合前先检查一遍所有玩家是否已经获胜
     */
    public Outcome<GameState> advanceTurn(GameState state) {
        if (state.getStatus() == GameStatus.WAITING_FOR_PLAYERS) {
            return reject(state, RuleViolation.GAME_NOT_STARTED, RuleViolation.GAME_NOT_STARTED.getDefaultMessage());
        }
        if (state.getStatus() == GameStatus.COMPLETED) {
            return reject(state, RuleViolation.GAME_FINISHED, RuleViolation.GAME_FINISHED.getDefaultMessage());
        }

        for (Player player : state.getPlayers()) {
            if (GameRules.win(player)) {
                log.info("玩家 {} 已满足获胜条件，游戏 {} 结束", player.getId(), state.getGameId());
                return Outcome.ok(state.completedBy(player.getId()).withUpdatedAt(clock.instant()));
            }
        }

        int nextIndex = (state.getCurrentPlayerIndex() + 1) % state.getPlayerCount();
        GameState next = state.withCurrentPlayerIndex(nextIndex).withUpdatedAt(clock.instant());
        log.debug("轮到玩家：{}", next.getCurrentPlayer().getId());
        return Outcome.ok(next);
    }

    /**
     * 玩家ID也取自注入的 Random，同一个种子发出同样的座位
     */
    private String newPlayerId() {
        return new UUID(random.nextLong(), random.nextLong()).toString();
    }

    private static <T> Outcome<GameState> reject(GameState state, Outcome<T> failed) {
        return reject(state, failed.getViolation(), failed.getDetail());
    }

    private static Outcome<GameState> reject(GameState state, RuleViolation violation, String detail) {
        log.warn("游戏 {} 拒绝操作：{}（{}）", state.getGameId(), violation.getCode(), detail);
        return Outcome.rejected(violation, detail);
    }
}
