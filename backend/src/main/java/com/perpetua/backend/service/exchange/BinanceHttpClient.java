package com.perpetua.backend.service.exchange;

import com.perpetua.backend.config.ExchangeProperties;
import com.perpetua.backend.exception.ExchangeCircuitOpenException;
import com.perpetua.backend.exception.ExchangeGatewayException;
import com.perpetua.backend.exception.ExchangeRateLimitException;
import com.perpetua.backend.service.MetricsService;
import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.ratelimiter.RateLimiter;
import io.github.resilience4j.ratelimiter.RequestNotPermitted;
import io.github.resilience4j.retry.Retry;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Service;
import org.springframework.web.client.HttpClientErrorException;
import org.springframework.web.client.HttpServerErrorException;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestTemplate;

import java.net.URI;
import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.function.Supplier;

/**
 * REST transport for the USD-M futures API. Reads are retried; order mutations are not.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class BinanceHttpClient {

    private static final String API_KEY_HEADER = "X-MBX-APIKEY";

    private final RestTemplate exchangeRestTemplate;
    private final CircuitBreaker binanceCircuitBreaker;
    private final RateLimiter binanceRateLimiter;
    private final Retry binanceReadRetry;
    private final ExchangeProperties exchangeProperties;
    private final MetricsService metricsService;
    private final MeterRegistry meterRegistry;
    private final Clock clock;

    public String publicGet(String path, Map<String, String> params) {
        return execute(HttpMethod.GET, path, params, false, true);
    }

    public String signedGet(String path, Map<String, String> params) {
        return execute(HttpMethod.GET, path, params, true, true);
    }

    public String signedPost(String path, Map<String, String> params) {
        return execute(HttpMethod.POST, path, params, true, false);
    }

    public String signedDelete(String path, Map<String, String> params) {
        return execute(HttpMethod.DELETE, path, params, true, false);
    }

    private String execute(HttpMethod method, String path, Map<String, String> params, boolean signed, boolean retryable) {
        Timer.Sample sample = Timer.start(meterRegistry);
        boolean success = false;
        Supplier<String> decorated = () -> doRequest(method, path, params, signed);
        if (retryable) {
            decorated = Retry.decorateSupplier(binanceReadRetry, decorated);
        }
        decorated = CircuitBreaker.decorateSupplier(binanceCircuitBreaker, decorated);
        decorated = RateLimiter.decorateSupplier(binanceRateLimiter, decorated);
        try {
            String response = decorated.get();
            success = true;
            return response;
        } catch (CallNotPermittedException e) {
            metricsService.incrementGatewayFailures();
            log.warn("Exchange circuit open, rejecting {} {}", method, path);
            throw new ExchangeCircuitOpenException("Exchange circuit breaker open", e);
        } catch (RequestNotPermitted e) {
            metricsService.incrementGatewayFailures();
            log.warn("Exchange client-side rate limit hit for {} {}", method, path);
            throw new ExchangeRateLimitException("Exchange rate limiter exhausted", e);
        } catch (ExchangeGatewayException e) {
            metricsService.incrementGatewayFailures();
            log.warn("Exchange request failed method={} path={} status={} message={}",
                    method, path, e.getStatusCode(), e.getMessage());
            throw e;
        } catch (ResourceAccessException e) {
            metricsService.incrementGatewayFailures();
            log.warn("Exchange network error method={} path={} message={}", method, path, e.getMessage());
            throw new ExchangeGatewayException("Exchange network error: " + e.getMessage(), e);
        } finally {
            sample.stop(Timer.builder("exchange_call_latency")
                    .tag("method", method.name())
                    .tag("path", path)
                    .tag("status", success ? "success" : "error")
                    .register(meterRegistry));
        }
    }

    private String doRequest(HttpMethod method, String path, Map<String, String> params, boolean signed) {
        Map<String, String> query = new LinkedHashMap<>();
        if (params != null) {
            query.putAll(params);
        }
        HttpHeaders headers = new HttpHeaders();
        String queryString;
        if (signed) {
            BinanceRequestSigner signer = new BinanceRequestSigner(exchangeProperties.getApiSecret());
            query.put("recvWindow", String.valueOf(exchangeProperties.getRecvWindowMs()));
            query.put("timestamp", String.valueOf(clock.millis()));
            String unsigned = BinanceRequestSigner.toQueryString(query);
            queryString = unsigned + "&signature=" + signer.sign(unsigned);
            headers.set(API_KEY_HEADER, exchangeProperties.getApiKey());
        } else {
            queryString = BinanceRequestSigner.toQueryString(query);
        }
        String url = exchangeProperties.getBaseUrl() + path + (queryString.isEmpty() ? "" : "?" + queryString);
        try {
            ResponseEntity<String> response = exchangeRestTemplate.exchange(
                    URI.create(url), method, new HttpEntity<>(headers), String.class);
            return response.getBody();
        } catch (HttpClientErrorException.TooManyRequests e) {
            throw new ExchangeRateLimitException("Exchange rate limit: " + e.getResponseBodyAsString(), e);
        } catch (HttpServerErrorException e) {
            throw new ExchangeGatewayException("Exchange server error (" + e.getStatusCode().value() + "): "
                    + e.getResponseBodyAsString(), e.getStatusCode().value(), e);
        } catch (HttpClientErrorException e) {
            int status = e.getStatusCode().value();
            if (status == ExchangeFaults.IP_BAN_STATUS) {
                throw new ExchangeRateLimitException("Exchange IP ban: " + e.getResponseBodyAsString(), status, e);
            }
            throw new ExchangeGatewayException("Exchange API error (" + status + "): "
                    + e.getResponseBodyAsString(), status, e);
        }
    }
}
