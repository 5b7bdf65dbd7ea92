package com.perpetua.backend.trading.cycle;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.perpetua.backend.config.AdvisorProperties;
import com.perpetua.backend.exception.TradingException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Service;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.util.List;

/**
 * Posts the market snapshot and account profile to the configured advisor endpoint
 * and hands back the response body untouched.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class HttpTradingAdvisor implements TradingAdvisor {

    private final RestTemplate advisorRestTemplate;
    private final AdvisorProperties advisorProperties;
    private final ObjectMapper objectMapper;

    @Override
    public String decide(AdvisorRequest request) {
        String url = advisorProperties.getUrl();
        if (url == null || url.isBlank()) {
            throw new TradingException("Advisor URL is not configured (advisor.url)");
        }
        String payload;
        try {
            payload = objectMapper.writeValueAsString(request);
        } catch (JsonProcessingException e) {
            throw new TradingException("Could not serialize advisor request for " + request.pair(), e);
        }

        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        headers.setAccept(List.of(MediaType.APPLICATION_JSON));
        if (advisorProperties.getApiKey() != null && !advisorProperties.getApiKey().isBlank()) {
            headers.setBearerAuth(advisorProperties.getApiKey());
        }

        try {
            ResponseEntity<String> response = advisorRestTemplate.postForEntity(url, new HttpEntity<>(payload, headers), String.class);
            String body = response.getBody();
            log.debug("Advisor answered for {}: {}", request.pair(), body);
            return body;
        } catch (RestClientException e) {
            throw new TradingException("Advisor call failed for " + request.pair() + ": " + e.getMessage(), e);
        }
    }
}
