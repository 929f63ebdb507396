package com.fxtrader.exception;

public class PositionNotFoundException extends ResourceNotFoundException {

    public PositionNotFoundException(String symbol) {
        super("Position", symbol);
    }
}
