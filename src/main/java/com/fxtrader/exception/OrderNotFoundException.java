package com.fxtrader.exception;

public class OrderNotFoundException extends ResourceNotFoundException {

    public OrderNotFoundException(String orderId) {
        super("Order", orderId);
    }
}
