package com.clipflow.publisher.config;

import io.github.bucket4j.Bandwidth;
import io.github.bucket4j.Bucket;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;


@Configuration
public class RateLimitConfig {

    @Value("${app.analytics.requests-per-second:5}")
    private long insightsRequestsPerSecond;

    @Bean(name = "insightsRateLimiter")
    public Bucket insightsRateLimiter() {
        return Bucket.builder()
                .addLimit(Bandwidth.simple(insightsRequestsPerSecond, Duration.ofSeconds(1)))
                .build();
    }
}
