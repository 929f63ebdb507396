package com.fxtrader.domain.enums;

/**
 * Entry rule variants of the signal evaluator.
 * OSCILLATOR combines CCI extremes with moving-average trend confirmation (long and short).
 * CROSSOVER fires only when price crosses above the moving average (long only).
 */
public enum SignalMode {
    OSCILLATOR,
    CROSSOVER
}
