package com.perpetua.backend.exception;

public class ExchangeCircuitOpenException extends ExchangeGatewayException {
    public ExchangeCircuitOpenException(String message, Throwable cause) {
        super(message, 503, cause);
    }
}
