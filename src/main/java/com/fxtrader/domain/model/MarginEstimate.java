package com.fxtrader.domain.model;

import java.math.BigDecimal;
import lombok.Builder;
import lombok.Value;

/** Result of a pre-submission margin check for a proposed order. */
@Value
@Builder
public class MarginEstimate {

    /** Margin the order would block: lots * marginPerLot / leverage. */
    BigDecimal requiredMargin;

    /** Free margin in the account at check time. */
    BigDecimal availableMargin;

    /** True if availableMargin >= requiredMargin. */
    boolean sufficient;

    /** Amount of margin shortfall. Zero if sufficient. */
    BigDecimal shortfall;
}
