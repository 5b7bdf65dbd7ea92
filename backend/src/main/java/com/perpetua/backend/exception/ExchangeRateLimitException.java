package com.perpetua.backend.exception;

public class ExchangeRateLimitException extends ExchangeGatewayException {
    public ExchangeRateLimitException(String message) {
        super(message, 429, null);
    }

    public ExchangeRateLimitException(String message, Throwable cause) {
        super(message, 429, cause);
    }

    public ExchangeRateLimitException(String message, int statusCode, Throwable cause) {
        super(message, statusCode, cause);
    }
}
