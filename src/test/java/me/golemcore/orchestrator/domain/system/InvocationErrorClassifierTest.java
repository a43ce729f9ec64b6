package me.golemcore.orchestrator.domain.system;

import dev.langchain4j.exception.HttpException;
import dev.langchain4j.exception.RateLimitException;
import feign.FeignException;
import feign.Request;
import feign.Response;
import me.golemcore.orchestrator.domain.exception.InvocationFailedException;
import me.golemcore.orchestrator.domain.model.FailureKind;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.net.SocketTimeoutException;
import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletionException;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class InvocationErrorClassifierTest {

    @ParameterizedTest
    @CsvSource({
            "429, RATE_LIMITED",
            "500, SERVER_ERROR",
            "503, SERVICE_UNAVAILABLE",
            "504, GATEWAY_TIMEOUT",
            "501, OTHER",
            "502, OTHER",
            "505, OTHER",
            "408, OTHER",
            "400, OTHER",
            "401, OTHER",
            "404, OTHER"
    })
    void shouldClassifyLangchainHttpErrorsByStatus(int status, FailureKind expected) {
        assertEquals(expected, InvocationErrorClassifier.classify(new HttpException(status, "status " + status)));
    }

    @ParameterizedTest
    @CsvSource({
            "429, RATE_LIMITED",
            "503, SERVICE_UNAVAILABLE",
            "500, SERVER_ERROR",
            "502, OTHER",
            "408, OTHER",
            "403, OTHER"
    })
    void shouldClassifyFeignErrorsByStatus(int status, FailureKind expected) {
        assertEquals(expected, InvocationErrorClassifier.classify(feignError(status)));
    }

    @Test
    void shouldClassifyRateLimitException() {
        assertEquals(FailureKind.RATE_LIMITED,
                InvocationErrorClassifier.classify(new RateLimitException("slow down")));
    }

    @Test
    void shouldFindTransientCauseDeepInChain() {
        Throwable wrapped = new CompletionException(new RuntimeException("adapter",
                new HttpException(503, "overloaded")));

        assertEquals(FailureKind.SERVICE_UNAVAILABLE, InvocationErrorClassifier.classify(wrapped));
        assertTrue(InvocationErrorClassifier.isTransient(wrapped));
    }

    @Test
    void shouldTreatSocketTimeoutAsGatewayTimeout() {
        Throwable wrapped = new RuntimeException(new SocketTimeoutException("read timed out"));

        assertEquals(FailureKind.GATEWAY_TIMEOUT, InvocationErrorClassifier.classify(wrapped));
    }

    @Test
    void shouldKeepKindOfInvocationFailure() {
        assertEquals(FailureKind.SERVER_ERROR, InvocationErrorClassifier.classify(
                new InvocationFailedException(FailureKind.SERVER_ERROR, "500")));
    }

    @Test
    void shouldNotRetryCancellationOrUnknownErrors() {
        assertEquals(FailureKind.OTHER, InvocationErrorClassifier.classify(new CancellationException()));
        assertEquals(FailureKind.OTHER, InvocationErrorClassifier.classify(new IOException("connection reset")));
        assertEquals(FailureKind.OTHER, InvocationErrorClassifier.classify(null));
        assertFalse(InvocationErrorClassifier.isTransient(new IllegalArgumentException("bad")));
    }

    @Test
    void shouldSurviveCyclicCauseChains() {
        RuntimeException first = new RuntimeException("first");
        RuntimeException second = new RuntimeException("second", first);
        first.initCause(second);

        assertEquals(FailureKind.OTHER, InvocationErrorClassifier.classify(second));
    }

    private static FeignException feignError(int status) {
        Request request = Request.create(Request.HttpMethod.GET, "https://api.search.brave.com/res/v1/web/search",
                Map.of(), null, StandardCharsets.UTF_8, null);
        Response response = Response.builder()
                .status(status)
                .reason("status " + status)
                .request(request)
                .headers(Map.of())
                .build();
        return FeignException.errorStatus("WebSearchApi#search", response);
    }
}
