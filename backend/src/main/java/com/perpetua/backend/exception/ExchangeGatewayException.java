package com.perpetua.backend.exception;

/**
 * Recoverable exchange fault (network, rejected order, HTTP error). Scoped to one symbol in one cycle.
 */
public class ExchangeGatewayException extends TradingException {
    private final int statusCode;

    public ExchangeGatewayException(String message) {
        super(message);
        this.statusCode = -1;
    }

    public ExchangeGatewayException(String message, Throwable cause) {
        super(message, cause);
        this.statusCode = -1;
    }

    public ExchangeGatewayException(String message, int statusCode, Throwable cause) {
        super(message, cause);
        this.statusCode = statusCode;
    }

    public int getStatusCode() {
        return statusCode;
    }
}
