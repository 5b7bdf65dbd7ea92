package com.perpetua.backend.config;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

@Configuration
@ConfigurationProperties(prefix = "exchange")
@Data
@Validated
public class ExchangeProperties {

    @NotBlank
    private String baseUrl = "https://fapi.binance.com";

    private String apiKey = "";

    private String apiSecret = "";

    @Positive
    private long recvWindowMs = 5000;

    private Http http = new Http();

    private Resilience resilience = new Resilience();

    @Data
    public static class Http {
        @Positive
        private int connectTimeoutMs = 10000;
        @Positive
        private int readTimeoutMs = 10000;
    }

    @Data
    public static class Resilience {
        private Circuit circuit = new Circuit();
        private Rate rate = new Rate();
        private ReadRetry retry = new ReadRetry();
    }

    @Data
    public static class Circuit {
        @Positive
        private float failureRateThreshold = 50;
        @Positive
        private long waitOpenSeconds = 30;
        @Positive
        private int slidingWindowSize = 20;
    }

    /**
     * Client-side request budget, kept under the exchange's per-IP weight limit.
     */
    @Data
    public static class Rate {
        @Positive
        private int limitPerSecond = 10;
        @PositiveOrZero
        private long timeoutMs = 2000;
    }

    @Data
    public static class ReadRetry {
        @Positive
        private int maxAttempts = 3;
        @Positive
        private long baseDelayMs = 500;
        @PositiveOrZero
        private double jitterFactor = 0.2;
    }
}
