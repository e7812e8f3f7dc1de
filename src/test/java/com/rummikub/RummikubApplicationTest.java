package com.rummikub;

import com.rummikub.config.RummikubProperties;
import com.rummikub.model.GameStatus;
import com.rummikub.service.GameService;
import com.rummikub.service.GameView;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.assertEquals;

@SpringBootTest(properties = "rummikub.lock.wait=250ms")
public class RummikubApplicationTest {

    @Autowired
    private RummikubProperties properties;

    @Autowired
    private GameService gameService;

    @Test
    void contextLoads_andBindsProperties() {
        assertEquals(14, properties.getRackSize());
        assertEquals(Duration.ofMillis(250), properties.getLock().getWait());
        assertEquals(Duration.ofSeconds(5), properties.getLock().getLease());
    }

    @Test
    void gameCanBeCreatedAndJoined() {
        GameView created = gameService.createGame(2);
        gameService.joinGame(created.getGameId(), "Alice");
        GameView started = gameService.joinGame(created.getGameId(), "Bob");
        assertEquals(GameStatus.IN_PROGRESS, started.getStatus());
    }
}
