package com.rummikub.service;

import com.rummikub.model.GameState;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * 游戏快照存储
 */
public interface GameStore {

    void save(GameState state);

    Optional<GameState> find(UUID gameId);

    List<GameState> findAll();
}
