package com.fxtrader.service;

import com.fxtrader.domain.model.InstrumentInfo;
import com.fxtrader.engine.TradingConfig;
import com.fxtrader.exception.InvalidInstrumentDataException;
import java.math.BigDecimal;
import org.springframework.stereotype.Service;

/**
 * Resolves instrument reference data from configuration.
 *
 * <p>Lookups are per call so a refreshed configuration is picked up on the next cycle.
 * Missing or unusable data is rejected here rather than producing nonsense sizes downstream.
 * A missing or non-positive tick value is left to the position sizer, which substitutes its
 * pip-value floor.
 */
@Service
public class InstrumentService {

    private final TradingConfig tradingConfig;

    public InstrumentService(TradingConfig tradingConfig) {
        this.tradingConfig = tradingConfig;
    }

    /**
     * @throws InvalidInstrumentDataException for an unknown symbol, or a point size or lot step
     *     that is missing or not positive
     */
    public InstrumentInfo getInstrument(String symbol) {
        TradingConfig.InstrumentProperties properties = tradingConfig.getInstruments().get(symbol);
        if (properties == null) {
            throw new InvalidInstrumentDataException(symbol, "no instrument configured");
        }
        if (!isPositive(properties.getPointSize())) {
            throw new InvalidInstrumentDataException(symbol, "point size must be positive");
        }
        if (!isPositive(properties.getLotStep())) {
            throw new InvalidInstrumentDataException(symbol, "lot step must be positive");
        }

        return InstrumentInfo.builder()
                .symbol(symbol)
                .tickValue(orZero(properties.getTickValue()))
                .marginPerLot(orZero(properties.getMarginPerLot()))
                .pointSize(properties.getPointSize())
                .lotStep(properties.getLotStep())
                .build();
    }

    private static boolean isPositive(BigDecimal value) {
        return value != null && value.signum() > 0;
    }

    private static BigDecimal orZero(BigDecimal value) {
        return value != null ? value : BigDecimal.ZERO;
    }
}
