package com.alphix.liquidity.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.net.http.HttpClient;
import java.time.Duration;

@Configuration
public class HttpClientConfig {

    @Bean
    public HttpClient liquidityApiHttpClient(DepositProperties properties) {
        return HttpClient.newBuilder()
                .connectTimeout(Duration.ofMillis(Math.max(500, properties.getPrepareApi().getTimeoutMs())))
                .build();
    }
}
