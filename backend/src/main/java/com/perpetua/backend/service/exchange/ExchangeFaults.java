package com.perpetua.backend.service.exchange;

import com.perpetua.backend.exception.ExchangeGatewayException;
import com.perpetua.backend.exception.ExchangeRateLimitException;
import org.springframework.web.client.ResourceAccessException;

/**
 * Classifies exchange failures for the resilience layer.
 */
public final class ExchangeFaults {

    static final int IP_BAN_STATUS = 418;

    private ExchangeFaults() {
    }

    /**
     * Worth another attempt after backoff: request weight exceeded, network fault, or a 5xx.
     * An IP ban is not; retrying only extends it.
     */
    public static boolean isTransient(Throwable error) {
        if (error instanceof ResourceAccessException) {
            return true;
        }
        if (error instanceof ExchangeRateLimitException rateLimit) {
            return rateLimit.getStatusCode() != IP_BAN_STATUS;
        }
        return error instanceof ExchangeGatewayException gatewayError && gatewayError.getStatusCode() >= 500;
    }

    /**
     * The exchange answered and refused the request (bad parameters, insufficient margin, unknown order).
     * Says nothing about exchange health, so it must not trip the circuit breaker.
     */
    public static boolean isRequestRejection(Throwable error) {
        if (!(error instanceof ExchangeGatewayException gatewayError) || error instanceof ExchangeRateLimitException) {
            return false;
        }
        int status = gatewayError.getStatusCode();
        return status >= 400 && status < 500;
    }
}
