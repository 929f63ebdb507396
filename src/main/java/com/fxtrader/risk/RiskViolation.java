package com.fxtrader.risk;

import lombok.Builder;
import lombok.Getter;

/**
 * A risk limit that blocks new entries, with a machine-readable code
 * (e.g. "MAX_DRAWDOWN_BREACHED") and a human-readable message.
 */
@Getter
@Builder
public class RiskViolation {

    private final String code;
    private final String message;

    public static RiskViolation of(String code, String message) {
        return RiskViolation.builder().code(code).message(message).build();
    }

    @Override
    public String toString() {
        return code + ": " + message;
    }
}
