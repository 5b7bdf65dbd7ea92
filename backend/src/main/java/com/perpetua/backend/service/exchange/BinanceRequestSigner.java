package com.perpetua.backend.service.exchange;

import com.perpetua.backend.exception.ExchangeGatewayException;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.util.HexFormat;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * HMAC-SHA256 signing of USD-M futures query strings.
 */
public class BinanceRequestSigner {

    private static final String HMAC_SHA256 = "HmacSHA256";

    private final String apiSecret;

    public BinanceRequestSigner(String apiSecret) {
        this.apiSecret = apiSecret == null ? "" : apiSecret;
    }

    /** Parameters are encoded in insertion order; the signature covers that exact string. */
    public static String toQueryString(Map<String, String> params) {
        if (params == null || params.isEmpty()) {
            return "";
        }
        return params.entrySet().stream()
                .map(e -> e.getKey() + "=" + URLEncoder.encode(e.getValue(), StandardCharsets.UTF_8))
                .collect(Collectors.joining("&"));
    }

    public String sign(String queryString) {
        if (apiSecret.isBlank()) {
            throw new ExchangeGatewayException("Exchange API secret is not configured");
        }
        try {
            Mac mac = Mac.getInstance(HMAC_SHA256);
            mac.init(new SecretKeySpec(apiSecret.getBytes(StandardCharsets.UTF_8), HMAC_SHA256));
            byte[] hash = mac.doFinal(queryString.getBytes(StandardCharsets.UTF_8));
            return HexFormat.of().formatHex(hash);
        } catch (GeneralSecurityException e) {
            throw new ExchangeGatewayException("Unable to sign exchange request", e);
        }
    }
}
