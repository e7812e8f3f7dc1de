package com.rummikub.service;

import com.rummikub.engine.Outcome;
import com.rummikub.engine.RuleViolation;

/**
 * 引擎拒绝了操作
 */
public class RuleViolationException extends GameServiceException {

    private final RuleViolation violation;

    public RuleViolationException(RuleViolation violation, String detail) {
        super(violation.getCode(), detail);
        this.violation = violation;
    }

    public static RuleViolationException of(Outcome<?> rejected) {
        return new RuleViolationException(rejected.getViolation(), rejected.getDetail());
    }

    public RuleViolation getViolation() {
        return violation;
    }
}
