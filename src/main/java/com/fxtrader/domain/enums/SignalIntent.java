package com.fxtrader.domain.enums;

/** Directional trade intent produced by the signal evaluator. */
public enum SignalIntent {
    NONE,
    LONG,
    SHORT;

    public boolean isActionable() {
        return this != NONE;
    }

    /** Position type this intent would open. Not defined for NONE. */
    public PositionType toPositionType() {
        return switch (this) {
            case LONG -> PositionType.LONG;
            case SHORT -> PositionType.SHORT;
            case NONE -> throw new IllegalStateException("NONE has no position type");
        };
    }
}
