package com.perpetua.backend.config;

import jakarta.validation.constraints.Positive;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

@Configuration
@ConfigurationProperties(prefix = "advisor")
@Data
@Validated
public class AdvisorProperties {

    /** Endpoint that receives the market snapshot and answers with a decision document. */
    private String url = "";

    private String apiKey = "";

    @Positive
    private int connectTimeoutMs = 10000;

    @Positive
    private int readTimeoutMs = 120000;
}
