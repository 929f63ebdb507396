package com.fxtrader.exit;

import com.fxtrader.domain.enums.PositionType;
import com.fxtrader.domain.model.ExitLevels;
import java.math.BigDecimal;
import java.math.RoundingMode;
import org.springframework.stereotype.Component;

/**
 * Computes protective levels from the latest price and ATR sample.
 *
 * <p>Two independent models, for a LONG (SHORT mirrored):
 * <ul>
 *   <li>ATR: stop = price - atr * slMultiplier, target = price + atr * tpMultiplier</li>
 *   <li>Price structure: stop = price - bufferStop, target = price + bufferTarget, where each
 *       buffer is atr * bufferMultiplier capped at maxBufferPips * pointSize</li>
 * </ul>
 * The hybrid level is their weighted average, {@code (atr * atrWeight + pivot * pivotWeight) /
 * (atrWeight + pivotWeight)}. With hybrid disabled, or a non-positive weight sum, it equals the
 * ATR level.
 *
 * <p>Stateless; every call recomputes from its arguments.
 */
@Component
public class ExitLevelCalculator {

    private static final int SCALE = 10;

    /**
     * @param currentPrice latest price
     * @param atr          latest ATR sample; negative values are treated as zero
     * @param direction    the trade direction the levels protect
     */
    public ExitLevels compute(BigDecimal currentPrice, BigDecimal atr, PositionType direction, ExitParams params) {
        BigDecimal volatility = atr.max(BigDecimal.ZERO);
        BigDecimal sign = BigDecimal.valueOf(direction.sign());

        BigDecimal atrStop = currentPrice.subtract(sign.multiply(volatility.multiply(params.getSlMultiplier())));
        BigDecimal atrTarget = currentPrice.add(sign.multiply(volatility.multiply(params.getTpMultiplier())));

        BigDecimal bufferCap = params.getMaxBufferPips().multiply(params.getPointSize());
        BigDecimal bufferStop = volatility.multiply(params.getSlBufferMultiplier()).min(bufferCap);
        BigDecimal bufferTarget = volatility.multiply(params.getTpBufferMultiplier()).min(bufferCap);

        BigDecimal pivotStop = currentPrice.subtract(sign.multiply(bufferStop));
        BigDecimal pivotTarget = currentPrice.add(sign.multiply(bufferTarget));

        return ExitLevels.builder()
                .direction(direction)
                .atrStop(atrStop)
                .atrTarget(atrTarget)
                .hybridStop(blend(atrStop, pivotStop, params))
                .hybridTarget(blend(atrTarget, pivotTarget, params))
                .bufferStop(bufferStop)
                .bufferTarget(bufferTarget)
                .build();
    }

    private BigDecimal blend(BigDecimal atrLevel, BigDecimal pivotLevel, ExitParams params) {
        if (!params.isHybridEnabled()) {
            return atrLevel;
        }
        BigDecimal weightSum = params.getAtrWeight().add(params.getPivotWeight());
        if (weightSum.signum() <= 0) {
            return atrLevel;
        }
        return atrLevel.multiply(params.getAtrWeight())
                .add(pivotLevel.multiply(params.getPivotWeight()))
                .divide(weightSum, SCALE, RoundingMode.HALF_UP);
    }
}
