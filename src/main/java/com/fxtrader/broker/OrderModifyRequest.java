package com.fxtrader.broker;

import java.math.BigDecimal;
import lombok.Builder;
import lombok.Data;

/** Changes to a working order. Null fields are left unchanged. */
@Data
@Builder
public class OrderModifyRequest {

    private BigDecimal price;
    private BigDecimal stopLoss;
    private BigDecimal takeProfit;
}
