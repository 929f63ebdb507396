package com.fxtrader.domain.enums;

public enum MovingAverageType {
    SMA,
    EMA
}
