package com.rummikub.engine;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class OutcomeTest {

    @Test
    void rejected_carriesViolationAndDefaultDetail() {
        Outcome<String> rejected = Outcome.rejected(RuleViolation.POOL_EMPTY);
        assertTrue(rejected.isRejected());
        assertEquals(RuleViolation.POOL_EMPTY, rejected.getViolation());
        assertEquals("POOL_EMPTY", rejected.getViolation().getCode());
        assertThrows(IllegalStateException.class, rejected::getValue);
    }

    @Test
    void propagate_keepsViolationAndDetail() {
        Outcome<String> rejected = Outcome.rejected(RuleViolation.NO_OP_MOVE, "没有新牌");

        Outcome<Integer> propagated = rejected.propagate();
        assertTrue(propagated.isRejected());
        assertEquals(RuleViolation.NO_OP_MOVE, propagated.getViolation());
        assertEquals("没有新牌", propagated.getDetail());

        // 成功的结果不能当作失败传递
        assertThrows(IllegalStateException.class, () -> Outcome.ok("x").propagate());
    }

    @Test
    void orElseThrow() {
        assertEquals("x", Outcome.ok("x").orElseThrow(o -> new IllegalStateException()));

        IllegalArgumentException thrown = new IllegalArgumentException();
        Outcome<String> rejected = Outcome.rejected(RuleViolation.GAME_FULL);
        assertSame(thrown, assertThrows(IllegalArgumentException.class, () -> rejected.orElseThrow(o -> thrown)));
    }
}
