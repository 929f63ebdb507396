package com.fxtrader.exception;

public class SizingRejectedException extends BaseException {

    public SizingRejectedException(String reason) {
        super(ErrorCode.SIZING_REJECTED, "Position sizing rejected: " + reason);
    }
}
