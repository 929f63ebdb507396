package com.fxtrader.margin.impl;

import com.fxtrader.domain.model.AccountState;
import com.fxtrader.domain.model.InstrumentInfo;
import com.fxtrader.domain.model.SizingResult;
import com.fxtrader.margin.PositionSizer;
import com.fxtrader.margin.PositionSizingConfig;
import java.math.BigDecimal;
import java.math.RoundingMode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Sizes positions so that a stop-out loses at most a fixed share of the balance.
 *
 * <p>Formula: lots = (balance * riskPercent / 100) / (tickValue * stopLossPips). With a 10,000
 * balance, 1% risk, tick value 10 and a 50 pip stop that is 100 / 500 = 0.20 lots.
 *
 * <p>The result is then capped at {@code freeMargin / (marginPerLot / leverage)}, rounded down
 * to the instrument's lot step and clamped to {@code [minLot, maxLot]}. Bounds that are not on
 * the lot step are first moved inwards to the nearest step, so the result is always a whole
 * number of steps inside the configured range. {@code capped} is set when the margin cap was
 * binding or the clamp moved the value.
 */
@Component
public class RiskBasedSizer implements PositionSizer {

    private static final Logger log = LoggerFactory.getLogger(RiskBasedSizer.class);

    private static final int SCALE = 8;
    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);

    private final PositionSizingConfig positionSizingConfig;

    public RiskBasedSizer(PositionSizingConfig positionSizingConfig) {
        this.positionSizingConfig = positionSizingConfig;
    }

    @Override
    public SizingResult size(
            AccountState account,
            InstrumentInfo instrument,
            BigDecimal riskPercent,
            BigDecimal stopLossDistancePips,
            BigDecimal minLot,
            BigDecimal maxLot) {
        if (account.getBalance() == null || account.getBalance().signum() <= 0) {
            return SizingResult.rejected("Account balance is not positive");
        }
        if (riskPercent == null || riskPercent.signum() <= 0) {
            return SizingResult.rejected("Risk percent is not positive");
        }
        if (account.getLeverage() <= 0) {
            return SizingResult.rejected("Account leverage is not positive");
        }
        if (minLot.compareTo(maxLot) > 0) {
            return SizingResult.rejected("Minimum lot " + minLot + " exceeds maximum lot " + maxLot);
        }
        BigDecimal lotStep = instrument.getLotStep();
        BigDecimal lowestLot = roundUpToStep(minLot, lotStep);
        BigDecimal highestLot = roundDownToStep(maxLot, lotStep);
        if (lowestLot.compareTo(highestLot) > 0) {
            return SizingResult.rejected(
                    "No multiple of lot step " + lotStep + " between " + minLot + " and " + maxLot);
        }

        // Risk amount = balance * riskPercent / 100
        BigDecimal riskAmount = account.getBalance().multiply(riskPercent).divide(HUNDRED, SCALE, RoundingMode.HALF_UP);

        BigDecimal pipValue = instrument.getTickValue().multiply(stopLossDistancePips);
        if (pipValue.signum() <= 0) {
            log.warn(
                    "Pip value for {} is {} (tick value {}, stop {} pips); using floor {}",
                    instrument.getSymbol(),
                    pipValue,
                    instrument.getTickValue(),
                    stopLossDistancePips,
                    positionSizingConfig.getMinPipValue());
            pipValue = positionSizingConfig.getMinPipValue();
        }

        BigDecimal rawLots = riskAmount.divide(pipValue, SCALE, RoundingMode.DOWN);

        BigDecimal marginCapLots = null;
        if (instrument.getMarginPerLot().signum() > 0) {
            BigDecimal marginPerLotLeveraged = instrument.getMarginPerLot()
                    .divide(BigDecimal.valueOf(account.getLeverage()), SCALE, RoundingMode.HALF_UP);
            marginCapLots = account.getFreeMargin()
                    .max(BigDecimal.ZERO)
                    .divide(marginPerLotLeveraged, SCALE, RoundingMode.DOWN);
        } else {
            log.warn("Instrument {} has no margin per lot; margin cap skipped", instrument.getSymbol());
        }

        boolean marginBinding = marginCapLots != null && marginCapLots.compareTo(rawLots) < 0;
        BigDecimal candidate = marginBinding ? marginCapLots : rawLots;

        BigDecimal stepped = roundDownToStep(candidate, lotStep);
        BigDecimal lots = stepped.max(lowestLot).min(highestLot);
        boolean clamped = lots.compareTo(stepped) != 0;

        log.debug(
                "Risk sizing {}: {}% of {} = {} at pip value {} -> raw {} lots, margin cap {}, final {}",
                instrument.getSymbol(),
                riskPercent,
                account.getBalance(),
                riskAmount,
                pipValue,
                rawLots,
                marginCapLots,
                lots);

        return SizingResult.builder()
                .lots(lots)
                .capped(marginBinding || clamped)
                .riskAmount(riskAmount)
                .pipValue(pipValue)
                .rawLots(rawLots)
                .marginCapLots(marginCapLots)
                .build();
    }

    private static BigDecimal roundDownToStep(BigDecimal value, BigDecimal lotStep) {
        return value.divide(lotStep, 0, RoundingMode.DOWN).multiply(lotStep);
    }

    private static BigDecimal roundUpToStep(BigDecimal value, BigDecimal lotStep) {
        return value.divide(lotStep, 0, RoundingMode.UP).multiply(lotStep);
    }
}
