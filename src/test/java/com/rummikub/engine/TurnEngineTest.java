package com.rummikub.engine;

import com.rummikub.model.GameState;
import com.rummikub.model.GameStatus;
import com.rummikub.model.Meld;
import com.rummikub.model.Player;
import com.rummikub.model.TurnAction;
import com.rummikub.support.GameStateBuilder;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.HashSet;
import java.util.List;
import java.util.Random;
import java.util.Set;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class TurnEngineTest {

    private static final Instant NOW = Instant.parse("2026-03-01T12:00:00Z");

    private TurnEngine engine;

    @BeforeEach
    void setUp() {
        engine = new TurnEngine(Clock.fixed(NOW, ZoneOffset.UTC), new Random(7), TurnEngine.DEFAULT_RACK_SIZE);
    }

    // === 创建与入座 ===

    @Test
    void createGame_dealsFourteenTilesPerSeat() {
        UUID gameId = UUID.randomUUID();
        GameState state = engine.createGame(gameId, 3).getValue();

        assertEquals(gameId, state.getGameId());
        assertEquals(GameStatus.WAITING_FOR_PLAYERS, state.getStatus());
        assertEquals(3, state.getPlayerCount());
        for (Player seat : state.getPlayers()) {
            assertEquals(14, seat.getRackSize());
            assertFalse(seat.isJoined());
            assertFalse(seat.isInitialMeldMet());
        }
        assertEquals(106 - 3 * 14, state.getPool().size());
        assertTrue(state.getBoard().isEmpty());
        assertTrue(state.isTileConserved(), "发牌后牌应守恒");
        assertEquals(NOW, state.getCreatedAt());
    }

    @Test
    void createGame_sameSeed_dealsSameSeatsAndPool() {
        UUID gameId = UUID.randomUUID();
        Clock clock = Clock.fixed(NOW, ZoneOffset.UTC);
        GameState first = new TurnEngine(clock, new Random(99), TurnEngine.DEFAULT_RACK_SIZE)
            .createGame(gameId, 4).getValue();
        GameState second = new TurnEngine(clock, new Random(99), TurnEngine.DEFAULT_RACK_SIZE)
            .createGame(gameId, 4).getValue();

        assertEquals(first, second, "同一个种子应得到完全相同的开局");
        Set<String> ids = new HashSet<>();
        for (Player seat : first.getPlayers()) {
            ids.add(seat.getId());
        }
        assertEquals(4, ids.size(), "座位ID互不相同");
    }

    @Test
    void createGame_rejectsInvalidPlayerCount() {
        assertEquals(RuleViolation.INVALID_PLAYER_COUNT, engine.createGame(UUID.randomUUID(), 1).getViolation());
        assertEquals(RuleViolation.INVALID_PLAYER_COUNT, engine.createGame(UUID.randomUUID(), 5).getViolation());
    }

    @Test
    void constructor_rejectsRackSizeThatCannotBeDealt() {
        assertThrows(IllegalArgumentException.class, () -> new TurnEngine(Clock.systemUTC(), new Random(), 0));
        assertThrows(IllegalArgumentException.class, () -> new TurnEngine(Clock.systemUTC(), new Random(), 27));
    }

    @Test
    void join_fillsSeatsInOrder_andStartsWhenFull() {
        GameState created = engine.createGame(UUID.randomUUID(), 2).getValue();
        List<String> firstRack = created.getPlayers().get(0).getRack().getTileIds();

        GameState one = engine.join(created, "Alice").getValue();
        assertEquals("Alice", one.getPlayers().get(0).getName());
        assertEquals(firstRack, one.getPlayers().get(0).getRack().getTileIds(), "入座保留已发好的牌");
        assertEquals(GameStatus.WAITING_FOR_PLAYERS, one.getStatus());

        GameState two = engine.join(one, "Bob").getValue();
        assertEquals(GameStatus.IN_PROGRESS, two.getStatus());
        assertEquals(0, two.getCurrentPlayerIndex());
        assertEquals("Alice", two.getCurrentPlayer().getName());
    }

    @Test
    void join_rejections() {
        GameState created = engine.createGame(UUID.randomUUID(), 2).getValue();
        GameState one = engine.join(created, "Alice").getValue();

        assertEquals(RuleViolation.INVALID_PLAYER_NAME, engine.join(one, "  ").getViolation());
        assertEquals(RuleViolation.INVALID_PLAYER_NAME, engine.join(one, null).getViolation());
        assertEquals(RuleViolation.NAME_TAKEN, engine.join(one, "Alice").getViolation());

        GameState full = engine.join(one, "Bob").getValue();
        assertEquals(RuleViolation.GAME_FULL, engine.join(full, "Carol").getViolation());
        assertEquals(RuleViolation.GAME_FINISHED, engine.join(full.completedBy(
            full.getPlayers().get(0).getId()), "Carol").getViolation());
    }

    // === 出牌 ===

    @Test
    void playGroupThatEmptiesRack_winsTheGame() {
        GameState state = GameStateBuilder.game()
            .player("A", "10ra", "10ba", "10ka")
            .player("B", "1ra")
            .fillPoolWithRest()
            .build();

        Outcome<GameState> result = engine.playTiles(state, "A", List.of(Meld.group("10ra", "10ba", "10ka")));

        assertTrue(result.isOk(), () -> "出牌应该成功：" + result);
        GameState next = result.getValue();
        assertEquals("10ka-10ra-10ba", next.getBoard().getMelds().get(0).getId());
        Player a = next.findPlayer("A").orElseThrow();
        assertTrue(a.getRack().isEmpty());
        assertTrue(a.isInitialMeldMet());
        assertEquals(GameStatus.COMPLETED, next.getStatus());
        assertEquals("A", next.getWinnerId());
        assertTrue(next.isTileConserved());
        assertEquals(NOW, next.getUpdatedAt());
    }

    @Test
    void play_doesNotModifyInputSnapshot() {
        GameState state = GameStateBuilder.game()
            .player("A", "10ra", "10ba", "10ka", "1ra")
            .player("B")
            .fillPoolWithRest()
            .build();
        GameState copy = GameStateBuilder.game()
            .player("A", "10ra", "10ba", "10ka", "1ra")
            .player("B")
            .fillPoolWithRest()
            .build();

        GameState next = engine.playTiles(state, "A", List.of(Meld.group("10ra", "10ba", "10ka"))).getValue();

        assertEquals(copy, state, "输入快照不应被修改");
        assertEquals(List.of("1ra"), next.findPlayer("A").orElseThrow().getRack().getTileIds());
        assertEquals(GameStatus.IN_PROGRESS, next.getStatus());
        assertNull(next.getWinnerId());
        assertEquals(0, next.getCurrentPlayerIndex(), "出牌本身不交出回合");
    }

    @Test
    void play_notYourTurn() {
        GameState state = GameStateBuilder.game().player("A").player("B", "1ra", "2ra", "3ra").build();
        assertEquals(RuleViolation.NOT_PLAYERS_TURN,
            engine.playTiles(state, "B", List.of(Meld.run("1ra", "2ra", "3ra"))).getViolation());
    }

    @Test
    void play_tileNotOwned() {
        GameState state = GameStateBuilder.game().player("A", "10ra", "10ba").player("B", "10ka").build();
        assertEquals(RuleViolation.TILE_NOT_OWNED,
            engine.playTiles(state, "A", List.of(Meld.group("10ra", "10ba", "10ka"))).getViolation());
        // 非法的牌ID既不在桌面也不在牌架上
        assertEquals(RuleViolation.TILE_NOT_OWNED,
            engine.playTiles(state, "A", List.of(Meld.group("10ra", "10ba", "99xa"))).getViolation());
    }

    @Test
    void play_withoutNewTiles_isNoOp_evenIfBoardIsInvalid() {
        GameState state = GameStateBuilder.game()
            .player("A", true, "1ka")
            .player("B")
            .board(Meld.run("3ra", "4ra", "5ra"))
            .build();

        assertEquals(RuleViolation.NO_OP_MOVE,
            engine.playTiles(state, "A", List.of(Meld.run("3ra", "4ra", "5ra"))).getViolation());
        // 摆成不合法的顺也还是“没有新牌”
        assertEquals(RuleViolation.NO_OP_MOVE,
            engine.playTiles(state, "A", List.of(Meld.run("5ra", "3ra", "4ra"))).getViolation());
        assertEquals(RuleViolation.NO_OP_MOVE, engine.playTiles(state, "A", List.of()).getViolation());
    }

    @Test
    void play_cannotTakeTilesBackFromBoard() {
        GameState state = GameStateBuilder.game()
            .player("A", true, "6ra", "7ra", "8ra")
            .player("B")
            .board(Meld.run("3ra", "4ra", "5ra"))
            .build();

        assertEquals(RuleViolation.BOARD_TILE_REMOVED,
            engine.playTiles(state, "A", List.of(Meld.run("6ra", "7ra", "8ra"))).getViolation());
    }

    @Test
    void play_invalidMeldIsRejected() {
        GameState state = GameStateBuilder.game().player("A", "1ra", "3ra", "4ra").player("B").build();
        assertEquals(RuleViolation.NON_CONSECUTIVE,
            engine.playTiles(state, "A", List.of(Meld.run("1ra", "3ra", "4ra"))).getViolation());
    }

    @Test
    void play_initialMeldBelowThirty() {
        GameState state = GameStateBuilder.game().player("A", "1ra", "2ra", "3ra", "9ka").player("B").build();
        assertEquals(RuleViolation.INITIAL_MELD_NOT_MET,
            engine.playTiles(state, "A", List.of(Meld.run("1ra", "2ra", "3ra"))).getViolation());
    }

    @Test
    void play_initialMeldWithJoker_countsResolvedValue() {
        // 9 + 10(百搭) + 11 = 30
        GameState state = GameStateBuilder.game().player("A", "9ra", "ja", "11ra", "1ka").player("B").build();
        Outcome<GameState> result = engine.playTiles(state, "A", List.of(Meld.run("9ra", "ja", "11ra")));
        assertTrue(result.isOk(), () -> "破冰应该成功：" + result);
        assertTrue(result.getValue().findPlayer("A").orElseThrow().isInitialMeldMet());
    }

    @Test
    void play_afterInitialMeld_canExtendAndRearrangeBoard() {
        GameState state = GameStateBuilder.game()
            .player("A", true, "6ra", "3ka")
            .player("B")
            .board(Meld.run("3ra", "4ra", "5ra"), Meld.group("3ba", "3oa", "3kb"))
            .build();

        // 想用 3ka 换下 3kb，把 3kb 收回牌架
        List<Meld> candidate = List.of(
            Meld.run("3ra", "4ra", "5ra", "6ra"),
            Meld.group("3ka", "3ba", "3oa"));
        Outcome<GameState> result = engine.playTiles(state, "A", candidate);

        assertEquals(RuleViolation.BOARD_TILE_REMOVED, result.getViolation(), "3kb 不能收回到牌架");

        List<Meld> keepAll = List.of(
            Meld.run("3ra", "4ra", "5ra", "6ra"),
            Meld.group("3ka", "3ba", "3oa", "3kb"));
        assertEquals(RuleViolation.COLOR_DUPLICATION, engine.playTiles(state, "A", keepAll).getViolation());

        GameState next = engine.playTiles(state, "A", List.of(
            Meld.run("3ra", "4ra", "5ra", "6ra"),
            Meld.group("3ba", "3oa", "3kb"))).getValue();
        assertEquals(List.of("3ka"), next.findPlayer("A").orElseThrow().getRack().getTileIds());
    }

    // === 摸牌 ===

    @Test
    void draw_untilPoolEmpty() {
        GameState state = GameStateBuilder.game()
            .player("A")
            .player("B")
            .pool("1ra", "2ra", "3ra")
            .build();

        state = engine.draw(state, "A").getValue();
        assertEquals(List.of("1ra"), state.findPlayer("A").orElseThrow().getRack().getTileIds());
        assertEquals(0, state.getCurrentPlayerIndex(), "摸牌本身不交出回合");
        state = engine.advanceTurn(state).getValue();

        state = engine.draw(state, "B").getValue();
        state = engine.advanceTurn(state).getValue();
        state = engine.draw(state, "A").getValue();
        state = engine.advanceTurn(state).getValue();

        assertTrue(state.getPool().isEmpty());
        assertEquals(List.of("1ra", "3ra"), state.findPlayer("A").orElseThrow().getRack().getTileIds());
        assertEquals(List.of("2ra"), state.findPlayer("B").orElseThrow().getRack().getTileIds());

        Outcome<GameState> fourth = engine.draw(state, "B");
        assertEquals(RuleViolation.POOL_EMPTY, fourth.getViolation());
    }

    @Test
    void draw_onFinishedGame() {
        GameState state = GameStateBuilder.game().player("A").player("B").pool("1ra").build().completedBy("B");
        assertEquals(RuleViolation.GAME_FINISHED, engine.draw(state, "A").getViolation());
    }

    @Test
    void apply_dispatchesOnActionType() {
        GameState state = GameStateBuilder.game().player("A", "10ra", "10ba", "10ka").player("B").pool("1ka").build();

        GameState drawn = engine.apply(state, "A", TurnAction.draw()).getValue();
        assertEquals(4, drawn.findPlayer("A").orElseThrow().getRackSize());

        GameState played = engine.apply(state, "A",
            TurnAction.playTiles(List.of(Meld.group("10ra", "10ba", "10ka")))).getValue();
        assertEquals(GameStatus.COMPLETED, played.getStatus());
    }

    // === 回合 ===

    @Test
    void advanceTurn_cyclesThroughAllSeats() {
        GameState state = GameStateBuilder.game()
            .player("A", "1ra").player("B", "2ra").player("C", "3ra").player("D", "4ra")
            .current(2)
            .build();

        Set<Integer> visited = new HashSet<>();
        GameState next = state;
        for (int i = 0; i < 4; i++) {
            next = engine.advanceTurn(next).getValue();
            visited.add(next.getCurrentPlayerIndex());
        }
        assertEquals(Set.of(0, 1, 2, 3), visited);
        assertEquals(2, next.getCurrentPlayerIndex(), "转一圈回到原来的玩家");
        assertEquals(3, engine.advanceTurn(state).getValue().getCurrentPlayerIndex());
    }

    @Test
    void advanceTurn_completesGameWhenSomeoneHasWon() {
        GameState state = GameStateBuilder.game().player("A", "1ra").player("B", true).build();
        GameState next = engine.advanceTurn(state).getValue();
        assertEquals(GameStatus.COMPLETED, next.getStatus());
        assertEquals("B", next.getWinnerId());
    }

    @Test
    void advanceTurn_rejectsWhenNotInProgress() {
        GameState state = GameStateBuilder.game().player("A", "1ra").player("B", "2ra").build();
        assertEquals(RuleViolation.GAME_NOT_STARTED,
            engine.advanceTurn(state.withStatus(GameStatus.WAITING_FOR_PLAYERS)).getViolation());
        assertEquals(RuleViolation.GAME_FINISHED, engine.advanceTurn(state.completedBy("A")).getViolation());
    }
}
