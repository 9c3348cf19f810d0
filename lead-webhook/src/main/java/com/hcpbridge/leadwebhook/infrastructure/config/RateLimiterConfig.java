package com.hcpbridge.leadwebhook.infrastructure.config;

import com.hcpbridge.leadwebhook.infrastructure.hcp.HcpCallPacer;
import io.github.resilience4j.ratelimiter.RateLimiter;
import io.github.resilience4j.ratelimiter.RateLimiterRegistry;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import reactor.core.scheduler.Schedulers;

/**
 * Throttling shared by every call to the platform in the process. The pacer spaces calls by
 * {@code hcp.request-delay-seconds}; the limiter caps the call rate per period on top of that.
 * The limiter's wait timeout is long, so concurrent requests queue for a permit instead of failing.
 */
@Configuration
public class RateLimiterConfig {

    @Bean
    public RateLimiter hcpRateLimiter(RateLimiterRegistry rateLimiterRegistry) {
        return rateLimiterRegistry.rateLimiter("hcpRateLimiter");
    }

    @Bean
    public HcpCallPacer hcpCallPacer(HcpConfig hcpConfig) {
        return new HcpCallPacer(hcpConfig.requestDelay(), Schedulers.parallel());
    }
}
