package com.fxtrader.signal;

import java.math.BigDecimal;
import lombok.Builder;
import lombok.Value;

/**
 * Indicator snapshot a signal is evaluated on. {@code cci} is only read in OSCILLATOR mode,
 * the previous-bar fields only in CROSSOVER mode.
 */
@Value
@Builder
public class SignalInput {

    BigDecimal price;
    BigDecimal movingAverage;
    BigDecimal cci;
    BigDecimal previousPrice;
    BigDecimal previousMovingAverage;
}
