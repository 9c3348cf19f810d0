package com.hcpbridge.leadwebhook.infrastructure.config;

import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.CircuitBreakerConfig;
import io.github.resilience4j.core.IntervalFunction;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.netty.http.client.HttpClient;

import java.time.Duration;

@Configuration
public class HcpClientConfig {

    private final HcpConfig hcpConfig;

    public HcpClientConfig(HcpConfig hcpConfig) {
        this.hcpConfig = hcpConfig;
    }

    @Bean(name = "hcpWebClient")
    public WebClient hcpWebClient(WebClient.Builder builder) {
        HttpClient httpClient = HttpClient.create().responseTimeout(hcpConfig.timeout());
        return builder
                .baseUrl(hcpConfig.baseUrl())
                .clientConnector(new ReactorClientHttpConnector(httpClient))
                .defaultHeader(HttpHeaders.AUTHORIZATION, "Bearer " + hcpConfig.apiKey())
                .defaultHeader(HttpHeaders.ACCEPT, MediaType.APPLICATION_JSON_VALUE)
                .defaultHeader(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
                .build();
    }

    @Bean(name = "hcpCircuitBreaker")
    public CircuitBreaker hcpCircuitBreaker() {
        CircuitBreakerConfig config = CircuitBreakerConfig.custom()
                .slidingWindowSize(10)
                .failureRateThreshold(50)
                .waitDurationInOpenState(Duration.ofSeconds(30))
                .permittedNumberOfCallsInHalfOpenState(3)
                .recordException(HcpClientConfig::isRetryable)
                .build();
        return CircuitBreaker.of("hcpCircuitBreaker", config);
    }

    @Bean(name = "hcpRetry")
    public Retry hcpRetry() {
        RetryConfig config = RetryConfig.custom()
                .maxAttempts(3)
                .intervalFunction(IntervalFunction.ofExponentialBackoff(Duration.ofSeconds(1), 2))
                .retryOnException(HcpClientConfig::isRetryable)
                .build();
        return Retry.of("hcpRetry", config);
    }

    /**
     * Throttling, server errors and connection failures are worth another attempt; other client errors are not.
     */
    public static boolean isRetryable(Throwable e) {
        if (e instanceof WebClientResponseException response) {
            return response.getStatusCode().value() == 429 || response.getStatusCode().is5xxServerError();
        }
        return e instanceof WebClientRequestException;
    }
}
