package com.clipflow.publisher.service;

import com.clipflow.publisher.exception.PipelineException;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.Predicate;
import java.util.function.Supplier;

/**
 * Runs a call up to {@code maxAttempts} times. After failed attempt {@code n} it waits
 * {@code baseDelay * 2^(n-1)} plus a random jitter of up to {@code jitterMax}. Errors the predicate
 * rejects, and the error of the last attempt, propagate unchanged.
 */
@Slf4j
@Component
public class RetryExecutor {

    private final Duration jitterMax;

    public RetryExecutor(@Value("${app.retry.jitter-max:1s}") Duration jitterMax) {
        this.jitterMax = jitterMax;
    }

    public <T> T execute(Supplier<T> operation, int maxAttempts, Duration baseDelay, Predicate<Throwable> isRetryable) {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be at least 1");
        }
        RetryConfig config = RetryConfig.custom()
                .maxAttempts(maxAttempts)
                .intervalFunction(attempt -> backoffDelay(baseDelay, attempt).toMillis())
                .retryOnException(isRetryable)
                .build();
        Retry retry = Retry.of("pipeline-call", config);
        retry.getEventPublisher().onRetry(event -> log.warn("Attempt {}/{} failed, retrying in {} ms: {}",
                event.getNumberOfRetryAttempts(), maxAttempts, event.getWaitInterval().toMillis(),
                event.getLastThrowable() == null ? "" : event.getLastThrowable().getMessage()));
        return Retry.decorateSupplier(retry, operation).get();
    }

    public <T> T execute(Supplier<T> operation, int maxAttempts, Duration baseDelay) {
        return execute(operation, maxAttempts, baseDelay, RetryExecutor::isRetryable);
    }

    /** Delay before the retry that follows failed attempt {@code attempt} (1-based). */
    public Duration backoffDelay(Duration baseDelay, int attempt) {
        Duration exponential = baseDelay.multipliedBy(1L << Math.min(attempt - 1, 30));
        long jitterMillis = jitterMax.toMillis();
        if (jitterMillis <= 0) {
            return exponential;
        }
        return exponential.plusMillis(ThreadLocalRandom.current().nextLong(jitterMillis + 1));
    }

    /** Rate limits and server-side failures are worth repeating; anything else is not. */
    public static boolean isRetryable(Throwable error) {
        return error instanceof PipelineException pipelineError && pipelineError.isRetryable();
    }
}
