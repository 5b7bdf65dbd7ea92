package com.perpetua.backend.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.RestTemplate;

@Configuration
public class ExchangeHttpConfig {

    @Bean
    public RestTemplate exchangeRestTemplate(ExchangeProperties exchangeProperties) {
        SimpleClientHttpRequestFactory factory = new SimpleClientHttpRequestFactory();
        factory.setConnectTimeout(exchangeProperties.getHttp().getConnectTimeoutMs());
        factory.setReadTimeout(exchangeProperties.getHttp().getReadTimeoutMs());
        return new RestTemplate(factory);
    }

    @Bean
    public RestTemplate advisorRestTemplate(AdvisorProperties advisorProperties) {
        SimpleClientHttpRequestFactory factory = new SimpleClientHttpRequestFactory();
        factory.setConnectTimeout(advisorProperties.getConnectTimeoutMs());
        factory.setReadTimeout(advisorProperties.getReadTimeoutMs());
        return new RestTemplate(factory);
    }
}
