package com.rummikub.engine;

import com.rummikub.model.GameState;
import com.rummikub.model.GameStatus;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.util.Random;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * 整局模拟：所有人只摸牌，直到牌池摸空
 */
public class GameSimulationTest {

    @Test
    void drawOnlyGame_conservesTilesAndRotatesTurns() {
        for (int players = GameState.MIN_PLAYERS; players <= GameState.MAX_PLAYERS; players++) {
            TurnEngine engine = new TurnEngine(Clock.systemUTC(), new Random(players), TurnEngine.DEFAULT_RACK_SIZE);
            GameState state = engine.createGame(UUID.randomUUID(), players).getValue();
            for (int i = 0; i < players; i++) {
                state = engine.join(state, "P" + i).getValue();
            }
            assertEquals(GameStatus.IN_PROGRESS, state.getStatus());

            int turns = 0;
            while (!state.getPool().isEmpty()) {
                int expectedIndex = turns % players;
                assertEquals(expectedIndex, state.getCurrentPlayerIndex(), "回合顺序不对");

                String playerId = state.getCurrentPlayer().getId();
                state = engine.draw(state, playerId).getValue();
                state = engine.advanceTurn(state).getValue();
                turns++;
                assertTrue(state.isTileConserved(), "第" + turns + "回合后牌不守恒");
            }

            assertEquals(106 - players * 14, turns, "每回合摸一张，直到摸空");
            assertEquals(GameStatus.IN_PROGRESS, state.getStatus(), "牌池摸空后不强制结束");
            assertEquals(RuleViolation.POOL_EMPTY,
                engine.draw(state, state.getCurrentPlayer().getId()).getViolation());
        }
    }
}
