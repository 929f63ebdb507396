package com.fxtrader.domain.model;

import java.math.BigDecimal;
import java.math.RoundingMode;
import lombok.Builder;
import lombok.Value;

/**
 * Read-only reference data for a tradable instrument, refreshed per evaluation cycle.
 *
 * <p>Distances in pips are expressed in units of {@link #pointSize}: a 50 pip stop on an
 * instrument with pointSize 0.0001 is a price distance of 0.0050. {@link #tickValue} is the
 * account-currency value of one pip for one lot.
 */
@Value
@Builder
public class InstrumentInfo {

    String symbol;

    /** Value of a one-pip move for one lot, in account currency. */
    BigDecimal tickValue;

    /** Notional margin per lot before leverage is applied. */
    BigDecimal marginPerLot;

    BigDecimal pointSize;

    /** Smallest tradable volume increment (0.01 for micro lots). */
    BigDecimal lotStep;

    /** Converts a distance in pips to a price distance. */
    public BigDecimal pipsToPrice(BigDecimal pips) {
        return pips.multiply(pointSize);
    }

    /** Rounds a price to the precision of {@link #pointSize}. */
    public BigDecimal roundToPoint(BigDecimal price) {
        return price.setScale(Math.max(0, pointSize.stripTrailingZeros().scale()), RoundingMode.HALF_UP);
    }
}
