package com.fxtrader.exit;

import com.fxtrader.domain.model.InstrumentInfo;
import java.math.BigDecimal;
import lombok.Builder;
import lombok.Value;

/** Inputs of {@link ExitLevelCalculator} besides price, ATR and direction. */
@Value
@Builder
public class ExitParams {

    BigDecimal slMultiplier;
    BigDecimal tpMultiplier;
    BigDecimal slBufferMultiplier;
    BigDecimal tpBufferMultiplier;
    BigDecimal maxBufferPips;
    BigDecimal pointSize;
    boolean hybridEnabled;
    BigDecimal atrWeight;
    BigDecimal pivotWeight;

    public static ExitParams from(ExitLevelConfig config, InstrumentInfo instrument) {
        return ExitParams.builder()
                .slMultiplier(config.getSlMultiplier())
                .tpMultiplier(config.getTpMultiplier())
                .slBufferMultiplier(config.getSlBufferMultiplier())
                .tpBufferMultiplier(config.getTpBufferMultiplier())
                .maxBufferPips(config.getMaxBufferPips())
                .pointSize(instrument.getPointSize())
                .hybridEnabled(config.isHybridEnabled())
                .atrWeight(config.getAtrWeight())
                .pivotWeight(config.getPivotWeight())
                .build();
    }
}
