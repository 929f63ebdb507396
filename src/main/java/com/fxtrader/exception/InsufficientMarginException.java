package com.fxtrader.exception;

import java.math.BigDecimal;
import java.util.Map;
import lombok.Getter;

@Getter
public class InsufficientMarginException extends BaseException {

    private final BigDecimal required;
    private final BigDecimal available;

    public InsufficientMarginException(BigDecimal required, BigDecimal available) {
        super(
                ErrorCode.INSUFFICIENT_MARGIN,
                String.format("Insufficient margin: required %s, available %s", required, available),
                Map.of("required", required, "available", available));
        this.required = required;
        this.available = available;
    }
}
