package com.fxtrader.domain.model;

import com.fxtrader.domain.enums.PositionType;
import java.math.BigDecimal;
import lombok.Builder;
import lombok.Value;

/**
 * Protective price levels for one trade direction, recomputed from scratch each cycle.
 *
 * <p>All levels are prices, not distances. The buffer terms are the capped distances used
 * by the price-structure model and are kept for logging.
 */
@Value
@Builder
public class ExitLevels {

    PositionType direction;
    BigDecimal atrStop;
    BigDecimal atrTarget;
    BigDecimal hybridStop;
    BigDecimal hybridTarget;
    BigDecimal bufferStop;
    BigDecimal bufferTarget;
}
