package me.golemcore.orchestrator.domain.service;

import me.golemcore.orchestrator.domain.exception.ConfigurationException;
import me.golemcore.orchestrator.domain.exception.InvocationFailedException;
import me.golemcore.orchestrator.domain.exception.RetryExhaustedException;
import me.golemcore.orchestrator.domain.model.FailureKind;
import me.golemcore.orchestrator.domain.model.RetryPolicy;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class RetryExecutorTest {

    private List<Duration> sleeps;
    private RetryExecutor retryExecutor;

    @BeforeEach
    void setUp() {
        sleeps = new ArrayList<>();
        retryExecutor = new RetryExecutor(sleeps::add);
    }

    @Test
    void shouldReturnFirstSuccessWithoutSleeping() {
        String result = retryExecutor.invoke("model call", () -> "ok", RetryPolicy.defaults());

        assertEquals("ok", result);
        assertTrue(sleeps.isEmpty());
    }

    @Test
    void shouldRetryRateLimitsWithExponentialBackoff() {
        AtomicInteger attempts = new AtomicInteger();

        String result = retryExecutor.invoke("model call", () -> {
            if (attempts.incrementAndGet() < 4) {
                throw new InvocationFailedException(FailureKind.RATE_LIMITED, "429 Too Many Requests");
            }
            return "done";
        }, RetryPolicy.defaults());

        assertEquals("done", result);
        assertEquals(4, attempts.get());
        assertEquals(List.of(Duration.ofSeconds(1), Duration.ofSeconds(7), Duration.ofSeconds(49)), sleeps);
    }

    @Test
    void shouldThrowRetryExhaustedAfterMaxAttempts() {
        AtomicInteger attempts = new AtomicInteger();
        InvocationFailedException failure = new InvocationFailedException(FailureKind.SERVICE_UNAVAILABLE,
                "503 Service Unavailable");

        RetryExhaustedException error = assertThrows(RetryExhaustedException.class,
                () -> retryExecutor.invoke("model call", () -> {
                    attempts.incrementAndGet();
                    throw failure;
                }, RetryPolicy.defaults()));

        assertEquals(5, attempts.get());
        assertEquals(5, error.getAttempts());
        assertEquals(FailureKind.SERVICE_UNAVAILABLE, error.getLastKind());
        assertSame(failure, error.getCause());
        assertEquals(List.of(Duration.ofSeconds(1), Duration.ofSeconds(7), Duration.ofSeconds(49),
                Duration.ofSeconds(343)), sleeps);
    }

    @Test
    void shouldFailFastOnNonRetryableFailure() {
        AtomicInteger attempts = new AtomicInteger();

        InvocationFailedException error = assertThrows(InvocationFailedException.class,
                () -> retryExecutor.invoke("tool web_search", () -> {
                    attempts.incrementAndGet();
                    throw new IllegalStateException("bad request");
                }, RetryPolicy.defaults()));

        assertEquals(1, attempts.get());
        assertEquals(FailureKind.OTHER, error.getKind());
        assertEquals("tool web_search failed: bad request", error.getMessage());
        assertTrue(sleeps.isEmpty());
    }

    @ParameterizedTest
    @ValueSource(ints = { 408, 501, 502, 505 })
    void shouldNotRetryPermanentHttpStatuses(int status) {
        AtomicInteger attempts = new AtomicInteger();

        InvocationFailedException error = assertThrows(InvocationFailedException.class,
                () -> retryExecutor.invoke("model call", () -> {
                    attempts.incrementAndGet();
                    throw new InvocationFailedException(FailureKind.fromHttpStatus(status), "HTTP " + status);
                }, RetryPolicy.defaults()));

        assertEquals(1, attempts.get());
        assertEquals(FailureKind.OTHER, error.getKind());
        assertTrue(sleeps.isEmpty());
    }

    @Test
    void shouldOnlyRetryKindsListedInPolicy() {
        RetryPolicy rateLimitOnly = new RetryPolicy(3, Duration.ofMillis(10), 2.0, Set.of(FailureKind.RATE_LIMITED));
        AtomicInteger attempts = new AtomicInteger();

        InvocationFailedException error = assertThrows(InvocationFailedException.class,
                () -> retryExecutor.invoke("model call", () -> {
                    attempts.incrementAndGet();
                    throw new InvocationFailedException(FailureKind.SERVER_ERROR, "500");
                }, rateLimitOnly));

        assertEquals(1, attempts.get());
        assertEquals(FailureKind.SERVER_ERROR, error.getKind());
    }

    @Test
    void shouldUnwrapCompletionExceptions() {
        AtomicInteger attempts = new AtomicInteger();

        String result = retryExecutor.invoke("model call", () -> {
            if (attempts.incrementAndGet() == 1) {
                return CompletableFuture.<String>failedFuture(
                        new InvocationFailedException(FailureKind.GATEWAY_TIMEOUT, "timeout")).join();
            }
            return "recovered";
        }, RetryPolicy.defaults());

        assertEquals("recovered", result);
        assertEquals(List.of(Duration.ofSeconds(1)), sleeps);
    }

    @Test
    void shouldPassWorkflowErrorsThroughUnchanged() {
        ConfigurationException configError = new ConfigurationException("missing key");

        ConfigurationException error = assertThrows(ConfigurationException.class,
                () -> retryExecutor.invoke("model call", () -> {
                    throw new CompletionException(configError);
                }, RetryPolicy.defaults()));

        assertSame(configError, error);
        assertTrue(sleeps.isEmpty());
    }

    @Test
    void shouldUseDefaultsWhenPolicyIsNull() {
        AtomicInteger attempts = new AtomicInteger();

        assertThrows(RetryExhaustedException.class, () -> retryExecutor.invoke("model call", () -> {
            attempts.incrementAndGet();
            throw new InvocationFailedException(FailureKind.RATE_LIMITED, "429");
        }, null));

        assertEquals(5, attempts.get());
    }

    @Test
    void shouldStopWhenInterruptedDuringBackoff() {
        RetryExecutor interrupted = new RetryExecutor(delay -> {
            throw new InterruptedException("stop");
        });

        try {
            InvocationFailedException error = assertThrows(InvocationFailedException.class,
                    () -> interrupted.invoke("model call", () -> {
                        throw new InvocationFailedException(FailureKind.RATE_LIMITED, "429");
                    }, RetryPolicy.defaults()));

            assertEquals(FailureKind.OTHER, error.getKind());
            assertTrue(Thread.currentThread().isInterrupted());
        } finally {
            Thread.interrupted();
        }
    }
}
