package com.fxtrader.exception;

public class InvalidOrderRequestException extends BaseException {

    public InvalidOrderRequestException(String message) {
        super(ErrorCode.VALIDATION_ERROR, message);
    }
}
