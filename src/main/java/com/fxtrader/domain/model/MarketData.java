package com.fxtrader.domain.model;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import lombok.Builder;
import lombok.Value;

/** One completed OHLCV bar for a symbol/timeframe, as delivered by the venue. */
@Value
@Builder
public class MarketData {

    String symbol;

    /** Bar timeframe label, e.g. "H1". */
    String timeframe;

    BigDecimal open;
    BigDecimal high;
    BigDecimal low;
    BigDecimal close;
    long volume;

    /** Bar close time, venue-local. */
    LocalDateTime timestamp;
}
