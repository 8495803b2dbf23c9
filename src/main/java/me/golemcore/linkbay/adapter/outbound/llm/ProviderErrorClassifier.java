package me.golemcore.linkbay.adapter.outbound.llm;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

import me.golemcore.linkbay.domain.exception.ChatBackendException;
import me.golemcore.linkbay.domain.exception.ProviderException;
import me.golemcore.linkbay.domain.model.ProviderErrorKind;

import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Method;
import java.net.ConnectException;
import java.net.NoRouteToHostException;
import java.net.SocketException;
import java.net.SocketTimeoutException;
import java.net.UnknownHostException;
import java.net.http.HttpTimeoutException;
import java.util.HashSet;
import java.util.Set;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeoutException;

/**
 * Maps provider failures to a {@link ProviderErrorKind} by walking the cause
 * chain. langchain4j exceptions are matched by class name so the classifier
 * does not depend on a particular client version.
 */
public final class ProviderErrorClassifier {

    private static final String LANGCHAIN4J_EXCEPTIONS_PREFIX = "dev.langchain4j.exception.";
    private static final String CLASS_RATE_LIMIT_EXCEPTION = LANGCHAIN4J_EXCEPTIONS_PREFIX + "RateLimitException";
    private static final String CLASS_TIMEOUT_EXCEPTION = LANGCHAIN4J_EXCEPTIONS_PREFIX + "TimeoutException";
    private static final String CLASS_AUTHENTICATION_EXCEPTION = LANGCHAIN4J_EXCEPTIONS_PREFIX
            + "AuthenticationException";
    private static final String CLASS_INVALID_REQUEST_EXCEPTION = LANGCHAIN4J_EXCEPTIONS_PREFIX
            + "InvalidRequestException";
    private static final String CLASS_MODEL_NOT_FOUND_EXCEPTION = LANGCHAIN4J_EXCEPTIONS_PREFIX
            + "ModelNotFoundException";
    private static final String CLASS_CONTENT_FILTERED_EXCEPTION = LANGCHAIN4J_EXCEPTIONS_PREFIX
            + "ContentFilteredException";
    private static final String CLASS_INTERNAL_SERVER_EXCEPTION = LANGCHAIN4J_EXCEPTIONS_PREFIX
            + "InternalServerException";
    private static final String CLASS_UNSUPPORTED_FEATURE_EXCEPTION = LANGCHAIN4J_EXCEPTIONS_PREFIX
            + "UnsupportedFeatureException";
    private static final String CLASS_UNRESOLVED_MODEL_SERVER_EXCEPTION = LANGCHAIN4J_EXCEPTIONS_PREFIX
            + "UnresolvedModelServerException";
    private static final String CLASS_RETRIABLE_EXCEPTION = LANGCHAIN4J_EXCEPTIONS_PREFIX + "RetriableException";
    private static final String CLASS_NON_RETRIABLE_EXCEPTION = LANGCHAIN4J_EXCEPTIONS_PREFIX
            + "NonRetriableException";
    private static final String CLASS_HTTP_EXCEPTION = LANGCHAIN4J_EXCEPTIONS_PREFIX + "HttpException";

    private ProviderErrorClassifier() {
    }

    /**
     * Classify a failure based on structured throwable types in its cause chain.
     * Anything not recognised is {@link ProviderErrorKind#UNEXPECTED}.
     */
    public static ProviderErrorKind classify(Throwable throwable) {
        Set<Throwable> visited = new HashSet<>();
        Throwable current = throwable;
        while (current != null && !visited.contains(current)) {
            visited.add(current);

            ProviderErrorKind kind = classifyKnownThrowable(current);
            if (kind != null) {
                return kind;
            }

            current = current.getCause();
        }
        return ProviderErrorKind.UNEXPECTED;
    }

    /**
     * Strips the wrappers added by {@link java.util.concurrent.CompletableFuture}.
     */
    public static Throwable unwrap(Throwable throwable) {
        Throwable current = throwable;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
                && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }

    public static ProviderErrorKind classifyStatus(int statusCode) {
        if (statusCode == 429) {
            return ProviderErrorKind.RATE_LIMIT;
        }
        if (statusCode == 408 || statusCode == 504) {
            return ProviderErrorKind.TIMEOUT;
        }
        if (statusCode >= 500) {
            return ProviderErrorKind.SERVER_ERROR;
        }
        if (statusCode >= 400) {
            return ProviderErrorKind.CLIENT_ERROR;
        }
        return ProviderErrorKind.UNEXPECTED;
    }

    private static ProviderErrorKind classifyKnownThrowable(Throwable throwable) {
        if (throwable instanceof ProviderException providerException) {
            return providerException.getKind();
        }
        if (throwable instanceof ChatBackendException backendException) {
            return backendException.getKind();
        }
        if (throwable instanceof SocketTimeoutException
                || throwable instanceof HttpTimeoutException
                || throwable instanceof TimeoutException) {
            return ProviderErrorKind.TIMEOUT;
        }
        if (throwable instanceof ConnectException
                || throwable instanceof UnknownHostException
                || throwable instanceof NoRouteToHostException
                || throwable instanceof SocketException) {
            return ProviderErrorKind.CONNECTION;
        }

        String className = throwable.getClass().getName();
        if (!className.startsWith(LANGCHAIN4J_EXCEPTIONS_PREFIX)) {
            return null;
        }

        if (CLASS_RATE_LIMIT_EXCEPTION.equals(className)) {
            return ProviderErrorKind.RATE_LIMIT;
        }
        if (CLASS_TIMEOUT_EXCEPTION.equals(className)) {
            return ProviderErrorKind.TIMEOUT;
        }
        if (CLASS_AUTHENTICATION_EXCEPTION.equals(className)
                || CLASS_INVALID_REQUEST_EXCEPTION.equals(className)
                || CLASS_MODEL_NOT_FOUND_EXCEPTION.equals(className)
                || CLASS_CONTENT_FILTERED_EXCEPTION.equals(className)
                || CLASS_UNSUPPORTED_FEATURE_EXCEPTION.equals(className)) {
            return ProviderErrorKind.CLIENT_ERROR;
        }
        if (CLASS_INTERNAL_SERVER_EXCEPTION.equals(className)) {
            return ProviderErrorKind.SERVER_ERROR;
        }
        if (CLASS_UNRESOLVED_MODEL_SERVER_EXCEPTION.equals(className)) {
            return ProviderErrorKind.CONNECTION;
        }
        if (CLASS_HTTP_EXCEPTION.equals(className)) {
            Integer statusCode = readHttpStatusCode(throwable);
            return statusCode != null ? classifyStatus(statusCode) : ProviderErrorKind.SERVER_ERROR;
        }
        if (CLASS_RETRIABLE_EXCEPTION.equals(className)) {
            return ProviderErrorKind.SERVER_ERROR;
        }
        if (CLASS_NON_RETRIABLE_EXCEPTION.equals(className)) {
            return ProviderErrorKind.CLIENT_ERROR;
        }
        // Generic LangChain4jException: look at the cause
        return null;
    }

    private static Integer readHttpStatusCode(Throwable throwable) {
        try {
            Method method = throwable.getClass().getMethod("statusCode");
            Object result = method.invoke(throwable);
            if (result instanceof Integer) {
                return (Integer) result;
            }
        } catch (NoSuchMethodException | IllegalAccessException | InvocationTargetException ignored) {
            return null;
        }
        return null;
    }
}
