package com.perpetua.backend.service.exchange;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.perpetua.backend.exception.ExchangeGatewayException;
import com.perpetua.backend.model.Candle;
import com.perpetua.backend.model.Instrument;
import com.perpetua.backend.model.PriceSeries;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * USD-M perpetual futures over REST. Only USDT-margined contracts from {@link Instrument} are visible.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class BinanceFuturesGateway implements ExchangeGateway {

    private static final String QUOTE_ASSET = "USDT";

    private final BinanceHttpClient httpClient;
    private final ObjectMapper objectMapper;

    @Override
    public AccountBalance fetchBalance(String marginType) {
        JsonNode assets = read(httpClient.signedGet("/fapi/v2/balance", Map.of()));
        for (JsonNode asset : assets) {
            if (QUOTE_ASSET.equals(asset.path("asset").asText())) {
                return new AccountBalance(
                        number(asset, "availableBalance"),
                        number(asset, "balance")
                );
            }
        }
        throw new ExchangeGatewayException("No " + QUOTE_ASSET + " balance reported for margin type " + marginType);
    }

    @Override
    public List<ExchangePosition> fetchPositions(Collection<Instrument> instruments) {
        Set<Instrument> wanted = instruments == null || instruments.isEmpty()
                ? EnumSet.allOf(Instrument.class)
                : EnumSet.copyOf(instruments);
        JsonNode rows = read(httpClient.signedGet("/fapi/v2/positionRisk", Map.of()));
        List<ExchangePosition> positions = new ArrayList<>();
        for (JsonNode row : rows) {
            Instrument instrument = toInstrument(row.path("symbol").asText());
            if (instrument == null || !wanted.contains(instrument)) {
                continue;
            }
            double contracts = number(row, "positionAmt");
            if (contracts == 0) {
                continue;
            }
            int leverage = Math.max(1, row.path("leverage").asInt(1));
            double notional = number(row, "notional");
            positions.add(new ExchangePosition(
                    instrument,
                    contracts,
                    number(row, "entryPrice"),
                    number(row, "markPrice"),
                    numberOrZero(row, "liquidationPrice"),
                    notional,
                    Math.abs(notional) / leverage,
                    number(row, "unRealizedProfit"),
                    leverage
            ));
        }
        return positions;
    }

    @Override
    public Ticker fetchTicker(Instrument instrument) {
        JsonNode node = read(httpClient.publicGet("/fapi/v1/ticker/price", Map.of("symbol", instrument.marketId())));
        double last = number(node, "price");
        if (last <= 0) {
            throw new ExchangeGatewayException("No last price for " + instrument.pair());
        }
        long time = node.path("time").asLong(0);
        return new Ticker(instrument, last, time > 0 ? Instant.ofEpochMilli(time) : Instant.now());
    }

    @Override
    public PriceSeries fetchOhlcv(Instrument instrument, String timeframe, int limit) {
        Map<String, String> params = new LinkedHashMap<>();
        params.put("symbol", instrument.marketId());
        params.put("interval", timeframe);
        params.put("limit", String.valueOf(limit));
        JsonNode rows = read(httpClient.publicGet("/fapi/v1/klines", params));
        List<Candle> candles = new ArrayList<>();
        for (JsonNode row : rows) {
            candles.add(Candle.builder()
                    .timestamp(Instant.ofEpochMilli(row.get(0).asLong()))
                    .open(row.get(1).asDouble())
                    .high(row.get(2).asDouble())
                    .low(row.get(3).asDouble())
                    .close(row.get(4).asDouble())
                    .volume(row.get(5).asDouble())
                    .build());
        }
        return new PriceSeries(instrument, timeframe, candles);
    }

    @Override
    public double fetchOpenInterest(Instrument instrument) {
        JsonNode node = read(httpClient.publicGet("/fapi/v1/openInterest", Map.of("symbol", instrument.marketId())));
        return number(node, "openInterest");
    }

    @Override
    public double fetchFundingRate(Instrument instrument) {
        JsonNode node = read(httpClient.publicGet("/fapi/v1/premiumIndex", Map.of("symbol", instrument.marketId())));
        return number(node, "lastFundingRate");
    }

    @Override
    public void setLeverage(int leverage, Instrument instrument) {
        Map<String, String> params = new LinkedHashMap<>();
        params.put("symbol", instrument.marketId());
        params.put("leverage", String.valueOf(leverage));
        httpClient.signedPost("/fapi/v1/leverage", params);
        log.info("Leverage set to {}x for {}", leverage, instrument.pair());
    }

    @Override
    public OrderFill createMarketOrder(Instrument instrument, OrderSide side, double amount, boolean reduceOnly) {
        Map<String, String> params = new LinkedHashMap<>();
        params.put("symbol", instrument.marketId());
        params.put("side", side.name());
        params.put("type", OrderType.MARKET.name());
        params.put("quantity", format(amount));
        if (reduceOnly) {
            params.put("reduceOnly", "true");
        }
        params.put("newOrderRespType", "RESULT");
        JsonNode node = read(httpClient.signedPost("/fapi/v1/order", params));
        return new OrderFill(
                text(node, "orderId"),
                text(node, "status"),
                number(node, "avgPrice"),
                number(node, "executedQty")
        );
    }

    @Override
    public OrderFill createProtectionOrder(Instrument instrument, OrderType type, OrderSide side, double stopPrice, boolean reduceOnly) {
        if (!type.isProtection()) {
            throw new IllegalArgumentException("Not a protection order type: " + type);
        }
        Map<String, String> params = new LinkedHashMap<>();
        params.put("symbol", instrument.marketId());
        params.put("side", side.name());
        params.put("type", type.name());
        params.put("stopPrice", format(stopPrice));
        // closePosition implies reduce-only on this exchange
        params.put("closePosition", String.valueOf(reduceOnly));
        params.put("workingType", "MARK_PRICE");
        JsonNode node = read(httpClient.signedPost("/fapi/v1/order", params));
        return new OrderFill(text(node, "orderId"), node.path("status").asText(), 0.0, 0.0);
    }

    @Override
    public List<OpenOrder> fetchOpenOrders(Instrument instrument) {
        JsonNode rows = read(httpClient.signedGet("/fapi/v1/openOrders", Map.of("symbol", instrument.marketId())));
        List<OpenOrder> orders = new ArrayList<>();
        for (JsonNode row : rows) {
            OrderType type = toOrderType(row.path("type").asText());
            if (type == null) {
                continue;
            }
            orders.add(new OpenOrder(
                    text(row, "orderId"),
                    type,
                    OrderSide.valueOf(text(row, "side")),
                    number(row, "stopPrice"),
                    numberOrZero(row, "origQty")
            ));
        }
        return orders;
    }

    @Override
    public void cancelOrder(String orderId, Instrument instrument) {
        Map<String, String> params = new LinkedHashMap<>();
        params.put("symbol", instrument.marketId());
        params.put("orderId", orderId);
        httpClient.signedDelete("/fapi/v1/order", params);
    }

    private JsonNode read(String body) {
        if (body == null || body.isBlank()) {
            throw new ExchangeGatewayException("Empty response from exchange");
        }
        try {
            return objectMapper.readTree(body);
        } catch (JsonProcessingException e) {
            throw new ExchangeGatewayException("Unreadable response from exchange", e);
        }
    }

    private String text(JsonNode node, String field) {
        JsonNode value = node.path(field);
        if (value.isMissingNode() || value.isNull() || value.asText().isBlank()) {
            throw new ExchangeGatewayException("Missing field " + field + " in exchange response");
        }
        return value.asText();
    }

    private double number(JsonNode node, String field) {
        JsonNode value = node.path(field);
        return value.isNumber() ? value.asDouble() : parse(text(node, field), field);
    }

    /**
     * Fields the exchange leaves out when they do not apply to the order or position.
     */
    private double numberOrZero(JsonNode node, String field) {
        JsonNode value = node.path(field);
        if (value.isMissingNode() || value.isNull() || value.asText().isBlank()) {
            return 0.0;
        }
        return number(node, field);
    }

    private double parse(String text, String field) {
        try {
            return Double.parseDouble(text);
        } catch (NumberFormatException e) {
            throw new ExchangeGatewayException("Invalid number in field " + field + ": " + text, e);
        }
    }

    private Instrument toInstrument(String marketId) {
        for (Instrument instrument : Instrument.values()) {
            if (instrument.marketId().equals(marketId)) {
                return instrument;
            }
        }
        return null;
    }

    private OrderType toOrderType(String type) {
        for (OrderType candidate : OrderType.values()) {
            if (candidate.name().equals(type)) {
                return candidate;
            }
        }
        return null;
    }

    static String format(double value) {
        return BigDecimal.valueOf(value).stripTrailingZeros().toPlainString();
    }
}
