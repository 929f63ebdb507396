package com.fxtrader.signal;

import com.fxtrader.domain.enums.SignalIntent;
import com.fxtrader.domain.enums.SignalMode;
import java.math.BigDecimal;
import org.springframework.stereotype.Component;

/**
 * Turns an indicator snapshot into a trade intent. Pure: the result depends only on the input
 * and the configured mode and thresholds.
 *
 * <p>OSCILLATOR: LONG when CCI is below the lower threshold (oversold) and price is above the
 * moving average; SHORT when CCI is above the upper threshold and price is below it, if shorts
 * are allowed.
 *
 * <p>CROSSOVER: LONG when the previous close was at or below the previous average and the
 * current close is above the current one. Never SHORT.
 */
@Component
public class SignalEvaluator {

    private final SignalConfig signalConfig;

    public SignalEvaluator(SignalConfig signalConfig) {
        this.signalConfig = signalConfig;
    }

    public SignalIntent evaluate(SignalInput input) {
        return signalConfig.getMode() == SignalMode.CROSSOVER ? crossover(input) : oscillator(input);
    }

    private SignalIntent oscillator(SignalInput input) {
        BigDecimal price = input.getPrice();
        BigDecimal movingAverage = input.getMovingAverage();
        BigDecimal cci = input.getCci();
        if (price == null || movingAverage == null || cci == null) {
            return SignalIntent.NONE;
        }

        if (cci.compareTo(signalConfig.getCciLowerThreshold()) < 0 && price.compareTo(movingAverage) > 0) {
            return SignalIntent.LONG;
        }
        if (signalConfig.isAllowShort()
                && cci.compareTo(signalConfig.getCciUpperThreshold()) > 0
                && price.compareTo(movingAverage) < 0) {
            return SignalIntent.SHORT;
        }
        return SignalIntent.NONE;
    }

    private SignalIntent crossover(SignalInput input) {
        if (input.getPrice() == null
                || input.getMovingAverage() == null
                || input.getPreviousPrice() == null
                || input.getPreviousMovingAverage() == null) {
            return SignalIntent.NONE;
        }
        boolean wasAtOrBelow = input.getPreviousPrice().compareTo(input.getPreviousMovingAverage()) <= 0;
        boolean isAbove = input.getPrice().compareTo(input.getMovingAverage()) > 0;
        return wasAtOrBelow && isAbove ? SignalIntent.LONG : SignalIntent.NONE;
    }
}
