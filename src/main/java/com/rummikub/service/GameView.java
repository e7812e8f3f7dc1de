package com.rummikub.service;

import com.rummikub.model.GameState;
import com.rummikub.model.GameStatus;
import com.rummikub.model.Meld;
import com.rummikub.model.Player;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * 按观看者裁剪后的游戏状态
 */
public final class GameView {

    private final UUID gameId;
    private final String name;
    private final GameStatus status;
    private final List<PlayerView> players;
    private final List<Meld> board;
    private final int poolSize;
    private final int currentPlayerIndex;
    private final String winnerId;
    private final Instant updatedAt;

    private GameView(GameState state, List<PlayerView> players) {
        this.gameId = state.getGameId();
        this.name = state.getName();
        this.status = state.getStatus();
        this.players = List.copyOf(players);
        this.board = state.getBoard().getMelds();
        this.poolSize = state.getPool().size();
        this.currentPlayerIndex = state.getCurrentPlayerIndex();
        this.winnerId = state.getWinnerId();
        this.updatedAt = state.getUpdatedAt();
    }

    /**
     * 裁剪给某个玩家看；viewerId 为 null 时谁的牌架都不可见
     */
    public static GameView forPlayer(GameState state, String viewerId) {
        List<PlayerView> players = new ArrayList<>(state.getPlayerCount());
        for (Player player : state.getPlayers()) {
            players.add(PlayerView.of(player, player.getId().equals(viewerId)));
        }
        return new GameView(state, players);
    }

    public UUID getGameId() {
        return gameId;
    }

    public String getName() {
        return name;
    }

    public GameStatus getStatus() {
        return status;
    }

    public List<PlayerView> getPlayers() {
        return players;
    }

    public List<Meld> getBoard() {
        return board;
    }

    public int getPoolSize() {
        return poolSize;
    }

    public int getCurrentPlayerIndex() {
        return currentPlayerIndex;
    }

    public String getWinnerId() {
        return winnerId;
    }

    public Instant getUpdatedAt() {
        return updatedAt;
    }
}
