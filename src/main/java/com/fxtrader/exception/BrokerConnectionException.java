package com.fxtrader.exception;

/** Thrown by gateway operations invoked while no venue session is open. */
public class BrokerConnectionException extends BaseException {

    public BrokerConnectionException(String operation) {
        super(ErrorCode.NOT_CONNECTED, "Broker not connected: cannot " + operation);
    }

    public BrokerConnectionException(String message, Throwable cause) {
        super(ErrorCode.NOT_CONNECTED, message, cause);
    }
}
