package me.golemcore.linkbay.adapter.outbound.llm;

import dev.langchain4j.exception.AuthenticationException;
import dev.langchain4j.exception.ContentFilteredException;
import dev.langchain4j.exception.HttpException;
import dev.langchain4j.exception.InternalServerException;
import dev.langchain4j.exception.InvalidRequestException;
import dev.langchain4j.exception.LangChain4jException;
import dev.langchain4j.exception.ModelNotFoundException;
import dev.langchain4j.exception.NonRetriableException;
import dev.langchain4j.exception.RateLimitException;
import dev.langchain4j.exception.RetriableException;
import dev.langchain4j.exception.TimeoutException;
import dev.langchain4j.exception.UnresolvedModelServerException;
import me.golemcore.linkbay.domain.exception.ChatBackendException;
import me.golemcore.linkbay.domain.exception.ProviderException;
import me.golemcore.linkbay.domain.model.ProviderErrorKind;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.net.ConnectException;
import java.net.SocketTimeoutException;
import java.net.UnknownHostException;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ProviderErrorClassifierTest {

    @Test
    void shouldClassifyRateLimitFromCauseChain() {
        Throwable throwable = new CompletionException(
                new RuntimeException("wrapper", new RateLimitException("too many requests")));

        assertEquals(ProviderErrorKind.RATE_LIMIT, ProviderErrorClassifier.classify(throwable));
    }

    @ParameterizedTest
    @CsvSource({
            "429, RATE_LIMIT",
            "401, CLIENT_ERROR",
            "400, CLIENT_ERROR",
            "408, TIMEOUT",
            "504, TIMEOUT",
            "500, SERVER_ERROR",
            "503, SERVER_ERROR",
            "200, UNEXPECTED"
    })
    void shouldClassifyHttpStatuses(int statusCode, ProviderErrorKind expected) {
        assertEquals(expected, ProviderErrorClassifier.classify(new HttpException(statusCode, "status")));
    }

    @Test
    void shouldClassifyLangchainSpecificExceptions() {
        assertEquals(ProviderErrorKind.CLIENT_ERROR,
                ProviderErrorClassifier.classify(new AuthenticationException("auth")));
        assertEquals(ProviderErrorKind.CLIENT_ERROR,
                ProviderErrorClassifier.classify(new ContentFilteredException("filtered")));
        assertEquals(ProviderErrorKind.CLIENT_ERROR,
                ProviderErrorClassifier.classify(new InvalidRequestException("invalid")));
        assertEquals(ProviderErrorKind.CLIENT_ERROR,
                ProviderErrorClassifier.classify(new ModelNotFoundException("not-found")));
        assertEquals(ProviderErrorKind.CLIENT_ERROR,
                ProviderErrorClassifier.classify(new NonRetriableException("non-retriable")));
        assertEquals(ProviderErrorKind.SERVER_ERROR,
                ProviderErrorClassifier.classify(new InternalServerException("internal")));
        assertEquals(ProviderErrorKind.SERVER_ERROR,
                ProviderErrorClassifier.classify(new RetriableException("retriable")));
        assertEquals(ProviderErrorKind.TIMEOUT,
                ProviderErrorClassifier.classify(new TimeoutException("timeout")));
        assertEquals(ProviderErrorKind.CONNECTION,
                ProviderErrorClassifier.classify(new UnresolvedModelServerException("unresolved")));
    }

    @Test
    void shouldLookPastGenericLangchainException() {
        Throwable throwable = new LangChain4jException("generic", new ConnectException("refused"));

        assertEquals(ProviderErrorKind.CONNECTION, ProviderErrorClassifier.classify(throwable));
    }

    @Test
    void shouldClassifyJdkNetworkExceptions() {
        assertEquals(ProviderErrorKind.TIMEOUT,
                ProviderErrorClassifier.classify(new SocketTimeoutException("read timed out")));
        assertEquals(ProviderErrorKind.TIMEOUT,
                ProviderErrorClassifier.classify(new java.util.concurrent.TimeoutException()));
        assertEquals(ProviderErrorKind.CONNECTION,
                ProviderErrorClassifier.classify(new UnknownHostException("api.deepseek.com")));
    }

    @Test
    void shouldUseKindCarriedByOwnExceptions() {
        assertEquals(ProviderErrorKind.SERVER_ERROR, ProviderErrorClassifier.classify(
                new ChatBackendException(ProviderErrorKind.SERVER_ERROR, "502")));
        assertEquals(ProviderErrorKind.RATE_LIMIT, ProviderErrorClassifier.classify(
                ProviderException.of(ProviderErrorKind.RATE_LIMIT, "openai", "limited", null)));
    }

    @Test
    void shouldReturnUnexpectedWhenNothingIsRecognised() {
        assertEquals(ProviderErrorKind.UNEXPECTED, ProviderErrorClassifier
                .classify(new CompletionException(new RuntimeException("generic"))));
        assertEquals(ProviderErrorKind.UNEXPECTED, ProviderErrorClassifier.classify(null));
    }

    @Test
    void shouldUnwrapFutureWrappers() {
        IllegalStateException root = new IllegalStateException("root");

        assertSame(root, ProviderErrorClassifier.unwrap(new CompletionException(new ExecutionException(root))));
        assertSame(root, ProviderErrorClassifier.unwrap(root));
    }

    @Test
    void shouldMarkOnlyTransientKindsRetryable() {
        assertTrue(ProviderErrorKind.RATE_LIMIT.isRetryable());
        assertTrue(ProviderErrorKind.TIMEOUT.isRetryable());
        assertTrue(ProviderErrorKind.CONNECTION.isRetryable());
        assertTrue(ProviderErrorKind.SERVER_ERROR.isRetryable());
        assertFalse(ProviderErrorKind.CLIENT_ERROR.isRetryable());
        assertFalse(ProviderErrorKind.UNEXPECTED.isRetryable());
    }
}
