package com.perpetua.backend.trading.cycle;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.github.tomakehurst.wiremock.WireMockServer;
import com.perpetua.backend.config.AdvisorProperties;
import com.perpetua.backend.exception.TradingException;
import com.perpetua.backend.model.Instrument;
import com.perpetua.backend.trading.signal.MarketSnapshot;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.web.client.RestTemplate;

import java.time.Instant;
import java.util.List;

import static com.github.tomakehurst.wiremock.client.WireMock.aResponse;
import static com.github.tomakehurst.wiremock.client.WireMock.equalTo;
import static com.github.tomakehurst.wiremock.client.WireMock.matchingJsonPath;
import static com.github.tomakehurst.wiremock.client.WireMock.okJson;
import static com.github.tomakehurst.wiremock.client.WireMock.post;
import static com.github.tomakehurst.wiremock.client.WireMock.postRequestedFor;
import static com.github.tomakehurst.wiremock.client.WireMock.urlEqualTo;
import static com.github.tomakehurst.wiremock.core.WireMockConfiguration.options;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class HttpTradingAdvisorTest {

    private WireMockServer server;
    private AdvisorProperties properties;
    private HttpTradingAdvisor advisor;
    private final ObjectMapper objectMapper = JsonMapper.builder().findAndAddModules().build();

    @BeforeEach
    void setUp() {
        server = new WireMockServer(options().dynamicPort());
        server.start();
        properties = new AdvisorProperties();
        properties.setUrl(server.baseUrl() + "/decide");
        properties.setApiKey("advisor-key");
        advisor = new HttpTradingAdvisor(new RestTemplate(), properties, objectMapper);
    }

    @AfterEach
    void tearDown() {
        server.stop();
    }

    @Test
    void returnsRawDecisionBody() {
        server.stubFor(post(urlEqualTo("/decide")).willReturn(okJson("{\"operation\":\"Hold\"}")));

        String body = advisor.decide(request());

        assertThat(body).isEqualTo("{\"operation\":\"Hold\"}");
        server.verify(postRequestedFor(urlEqualTo("/decide"))
                .withHeader("Authorization", equalTo("Bearer advisor-key"))
                .withRequestBody(matchingJsonPath("$.pair", equalTo("BTC/USDT")))
                .withRequestBody(matchingJsonPath("$.cycleId", equalTo("cycle-7")))
                .withRequestBody(matchingJsonPath("$.market.intraday.currentRsi", equalTo("64.5")))
                .withRequestBody(matchingJsonPath("$.market.intraday.rsi7[1]", equalTo("64.5"))));
    }

    @Test
    void serverErrorBecomesTradingException() {
        server.stubFor(post(urlEqualTo("/decide")).willReturn(aResponse().withStatus(500)));

        assertThatThrownBy(() -> advisor.decide(request()))
                .isInstanceOf(TradingException.class)
                .hasMessageStartingWith("Advisor call failed for BTC/USDT");
    }

    @Test
    void missingUrlFailsFast() {
        properties.setUrl("");

        assertThatThrownBy(() -> advisor.decide(request()))
                .isInstanceOf(TradingException.class)
                .hasMessage("Advisor URL is not configured (advisor.url)");
    }

    private static AdvisorRequest request() {
        MarketSnapshot.IntradaySeries intraday = new MarketSnapshot.IntradaySeries(
                List.of(49990.0, 50000.0), List.of(49980.0, 49985.0), List.of(3.0, 4.0),
                List.of(61.5, 64.5), List.of(55.0, 57.0), 49985.0, 4.0, 64.5);
        MarketSnapshot market = MarketSnapshot.builder()
                .instrument(Instrument.BTC)
                .currentPrice(50000)
                .intraday(intraday)
                .build();
        return AdvisorRequest.of("cycle-7", market, null, null, Instant.parse("2025-03-01T12:00:00Z"));
    }
}
