package com.fxtrader.broker;

import java.math.BigDecimal;
import lombok.Builder;
import lombok.Data;

/** New protective levels for an open position. Null fields are left unchanged. */
@Data
@Builder
public class PositionModifyRequest {

    private BigDecimal stopLoss;
    private BigDecimal takeProfit;
}
