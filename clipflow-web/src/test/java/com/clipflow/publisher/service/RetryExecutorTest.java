package com.clipflow.publisher.service;

import com.clipflow.publisher.exception.RateLimitException;
import com.clipflow.publisher.exception.RemoteRejectionException;
import com.clipflow.publisher.exception.RemoteTransientException;
import com.clipflow.publisher.exception.ValidationException;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class RetryExecutorTest {

    private final RetryExecutor retryExecutor = new RetryExecutor(Duration.ZERO);

    @Test
    void execute_shouldRetryTransientFailuresUntilSuccess() {
        AtomicInteger calls = new AtomicInteger();

        String result = retryExecutor.execute(() -> {
            if (calls.incrementAndGet() < 3) {
                throw new RemoteTransientException("Test", 503, "unavailable");
            }
            return "done";
        }, 3, Duration.ofMillis(1));

        assertEquals("done", result);
        assertEquals(3, calls.get());
    }

    @Test
    void execute_shouldStopAfterMaxAttemptsAndRethrowLastError() {
        AtomicInteger calls = new AtomicInteger();

        RateLimitException error = assertThrows(RateLimitException.class, () -> retryExecutor.execute(() -> {
            calls.incrementAndGet();
            throw new RateLimitException("Test", "slow down #" + calls.get(), null);
        }, 3, Duration.ofMillis(1)));

        assertEquals(3, calls.get());
        assertEquals("slow down #3", error.getMessage());
    }

    @Test
    void execute_shouldNotRetryRejections() {
        AtomicInteger calls = new AtomicInteger();

        assertThrows(RemoteRejectionException.class, () -> retryExecutor.execute(() -> {
            calls.incrementAndGet();
            throw new RemoteRejectionException("Test", 400, "bad request");
        }, 5, Duration.ofMillis(1)));

        assertEquals(1, calls.get());
    }

    @Test
    void execute_shouldHonourCustomPredicate() {
        AtomicInteger calls = new AtomicInteger();

        assertThrows(ValidationException.class, () -> retryExecutor.execute(() -> {
            calls.incrementAndGet();
            throw new ValidationException("nope");
        }, 2, Duration.ofMillis(1), error -> error instanceof ValidationException));

        assertEquals(2, calls.get());
    }

    @Test
    void execute_shouldRejectNonPositiveAttempts() {
        assertThrows(IllegalArgumentException.class,
                () -> retryExecutor.execute(() -> "x", 0, Duration.ofMillis(1)));
    }

    @Test
    void backoffDelay_shouldDoublePerAttempt() {
        Duration base = Duration.ofMillis(100);

        assertEquals(Duration.ofMillis(100), retryExecutor.backoffDelay(base, 1));
        assertEquals(Duration.ofMillis(200), retryExecutor.backoffDelay(base, 2));
        assertEquals(Duration.ofMillis(400), retryExecutor.backoffDelay(base, 3));
    }

    @Test
    void backoffDelay_shouldAddBoundedJitter() {
        RetryExecutor jittered = new RetryExecutor(Duration.ofMillis(50));

        for (int i = 0; i < 20; i++) {
            long delay = jittered.backoffDelay(Duration.ofMillis(100), 2).toMillis();
            assertTrue(delay >= 200 && delay <= 250, "Delay out of range: " + delay);
        }
    }

    @Test
    void isRetryable_shouldOnlyAcceptRetryablePipelineErrors() {
        assertTrue(RetryExecutor.isRetryable(new RemoteTransientException("Test", 500, "boom")));
        assertTrue(RetryExecutor.isRetryable(new RateLimitException("Test", "429", null)));
        assertFalse(RetryExecutor.isRetryable(new RemoteRejectionException("Test", 404, "missing")));
        assertFalse(RetryExecutor.isRetryable(new IllegalStateException("other")));
    }
}
