package com.rummikub.model;

import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

/**
 * 游戏状态快照
 *
 * 不可变：任何状态变化都通过 with* 方法生成新的快照，原快照保持不变，
 * 因此同一份快照可以被多个线程同时读取。
 */
public final class GameState {

    public static final int MIN_PLAYERS = 2;
    public static final int MAX_PLAYERS = 4;
    public static final int TILE_COUNT = 106;

    private final UUID gameId;                  // 游戏ID
    private final String name;                  // 游戏名称（可选）
    private final List<Player> players;         // 玩家座位（2-4个，创建后数量固定）
    private final Pool pool;                    // 牌池
    private final Board board;                  // 桌面
    private final int currentPlayerIndex;       // 当前行动玩家索引
    private final GameStatus status;            // 游戏状态
    private final String winnerId;              // 获胜玩家ID（未结束时为 null）
    private final Instant createdAt;
    private final Instant updatedAt;

    public GameState(UUID gameId, String name, List<Player> players, Pool pool, Board board,
                     int currentPlayerIndex, GameStatus status, String winnerId,
                     Instant createdAt, Instant updatedAt) {
        this.gameId = Objects.requireNonNull(gameId, "gameId");
        this.name = name;
        this.players = List.copyOf(players);
        this.pool = Objects.requireNonNull(pool, "pool");
        this.board = Objects.requireNonNull(board, "board");
        this.currentPlayerIndex = currentPlayerIndex;
        this.status = Objects.requireNonNull(status, "status");
        this.winnerId = winnerId;
        this.createdAt = Objects.requireNonNull(createdAt, "createdAt");
        this.updatedAt = Objects.requireNonNull(updatedAt, "updatedAt");
        if (this.players.size() < MIN_PLAYERS || this.players.size() > MAX_PLAYERS) {
            throw new IllegalArgumentException("玩家数量必须在2-4之间：" + this.players.size());
        }
        if (currentPlayerIndex < 0 || currentPlayerIndex >= this.players.size()) {
            throw new IllegalArgumentException("当前玩家索引越界：" + currentPlayerIndex);
        }
    }

    public UUID getGameId() {
        return gameId;
    }

    public String getName() {
        return name;
    }

    public List<Player> getPlayers() {
        return players;
    }

    public int getPlayerCount() {
        return players.size();
    }

    public Pool getPool() {
        return pool;
    }

    public Board getBoard() {
        return board;
    }

    public int getCurrentPlayerIndex() {
        return currentPlayerIndex;
    }

    public GameStatus getStatus() {
        return status;
    }

    public String getWinnerId() {
        return winnerId;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public Instant getUpdatedAt() {
        return updatedAt;
    }

    /**
     * 获取当前行动玩家
     */
    public Player getCurrentPlayer() {
        return players.get(currentPlayerIndex);
    }

    /**
     * 根据ID查找玩家
     */
    public Optional<Player> findPlayer(String playerId) {
        for (Player player : players) {
            if (player.getId().equals(playerId)) {
                return Optional.of(player);
            }
        }
        return Optional.empty();
    }

    /**
     * 根据名称查找已入座的玩家
     */
    public Optional<Player> findPlayerByName(String playerName) {
        for (Player player : players) {
            if (player.isJoined() && player.getName().equals(playerName)) {
                return Optional.of(player);
            }
        }
        return Optional.empty();
    }

    /**
     * 第一个空座位的索引，没有则返回 -1
     */
    public int firstOpenSeat() {
        for (int i = 0; i < players.size(); i++) {
            if (!players.get(i).isJoined()) {
                return i;
            }
        }
        return -1;
    }

    // === 生成新快照 ===

    public GameState withPlayers(List<Player> players) {
        return new GameState(gameId, name, players, pool, board, currentPlayerIndex, status, winnerId, createdAt, updatedAt);
    }

    /**
     * 替换某个玩家（按ID匹配）
     */
    public GameState withPlayer(Player updated) {
        List<Player> next = new ArrayList<>(players.size());
        boolean found = false;
        for (Player player : players) {
            if (player.getId().equals(updated.getId())) {
                next.add(updated);
                found = true;
            } else {
                next.add(player);
            }
        }
        if (!found) {
            throw new IllegalArgumentException("玩家不在游戏中：" + updated.getId());
        }
        return withPlayers(next);
    }

    public GameState withPool(Pool pool) {
        return new GameState(gameId, name, players, pool, board, currentPlayerIndex, status, winnerId, createdAt, updatedAt);
    }

    public GameState withBoard(Board board) {
        return new GameState(gameId, name, players, pool, board, currentPlayerIndex, status, winnerId, createdAt, updatedAt);
    }

    public GameState withCurrentPlayerIndex(int currentPlayerIndex) {
        return new GameState(gameId, name, players, pool, board, currentPlayerIndex, status, winnerId, createdAt, updatedAt);
    }

    public GameState withStatus(GameStatus status) {
        return new GameState(gameId, name, players, pool, board, currentPlayerIndex, status, winnerId, createdAt, updatedAt);
    }

    /**
     * 结束游戏并记录获胜者
     */
    public GameState completedBy(String winnerId) {
        return new GameState(gameId, name, players, pool, board, currentPlayerIndex, GameStatus.COMPLETED, winnerId, createdAt, updatedAt);
    }

    public GameState withName(String name) {
        return new GameState(gameId, name, players, pool, board, currentPlayerIndex, status, winnerId, createdAt, updatedAt);
    }

    public GameState withUpdatedAt(Instant updatedAt) {
        return new GameState(gameId, name, players, pool, board, currentPlayerIndex, status, winnerId, createdAt, updatedAt);
    }

    /**
     * 检查牌守恒：所有牌架、牌池、桌面的牌合起来恰好是106张全集，不重复也不缺失
     */
    public boolean isTileConserved() {
        List<String> all = new ArrayList<>(TILE_COUNT);
        for (Player player : players) {
            all.addAll(player.getRack().getTileIds());
        }
        all.addAll(pool.getTileIds());
        all.addAll(board.getTileIds());
        if (all.size() != TILE_COUNT) {
            return false;
        }
        Set<Tile> distinct = new HashSet<>();
        for (String tileId : all) {
            try {
                if (!distinct.add(Tile.parse(tileId))) {
                    return false;
                }
            } catch (IllegalArgumentException e) {
                return false;
            }
        }
        // 106张合法且互不相同的牌必然就是全集
        return distinct.size() == TILE_COUNT;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof GameState)) {
            return false;
        }
        GameState other = (GameState) o;
        return currentPlayerIndex == other.currentPlayerIndex
            && gameId.equals(other.gameId)
            && Objects.equals(name, other.name)
            && players.equals(other.players)
            && pool.equals(other.pool)
            && board.equals(other.board)
            && status == other.status
            && Objects.equals(winnerId, other.winnerId)
            && createdAt.equals(other.createdAt)
            && updatedAt.equals(other.updatedAt);
    }

    @Override
    public int hashCode() {
        return Objects.hash(gameId, name, players, pool, board, currentPlayerIndex, status, winnerId, createdAt, updatedAt);
    }

    @Override
    public String toString() {
        return "GameState{" + gameId + ", status=" + status + ", current=" + currentPlayerIndex
            + ", pool=" + pool.size() + ", board=" + board.size() + " melds}";
    }
}
