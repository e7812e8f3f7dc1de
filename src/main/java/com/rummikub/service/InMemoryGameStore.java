package com.rummikub.service;

import com.rummikub.model.GameState;
import org.springframework.stereotype.Repository;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 进程内存储；快照本身不可变，直接保存引用即可
 */
@Repository
public class InMemoryGameStore implements GameStore {

    private final Map<UUID, GameState> games = new ConcurrentHashMap<>();

    @Override
    public void save(GameState state) {
        games.put(state.getGameId(), state);
    }

    @Override
    public Optional<GameState> find(UUID gameId) {
        return Optional.ofNullable(games.get(gameId));
    }

    @Override
    public List<GameState> findAll() {
        List<GameState> all = new ArrayList<>(games.values());
        all.sort(Comparator.comparing(GameState::getCreatedAt));
        return all;
    }
}
