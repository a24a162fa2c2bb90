package me.golemcore.orchestrator.domain.router;

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

import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Method;
import java.net.ConnectException;
import java.net.SocketTimeoutException;
import java.net.UnknownHostException;
import java.net.http.HttpTimeoutException;
import java.util.HashSet;
import java.util.Locale;
import java.util.Set;
import java.util.concurrent.CancellationException;
import java.util.concurrent.TimeoutException;

/**
 * Maps model call failures to stable machine-readable codes.
 *
 * <p>
 * Vendor client exceptions are recognized by class name so the domain layer
 * does not depend on the vendor SDK. The cause chain is walked until a known
 * type is found. Codes can be embedded in diagnostics as {@code [code] text}
 * and recovered with {@link #extractCode(String)}.
 */
public final class LlmErrorClassifier {

    public static final String REQUEST_ABORTED = "llm.request.aborted";
    public static final String REQUEST_TIMEOUT = "llm.request.timeout";
    public static final String CONNECTION_FAILED = "llm.connection.failed";
    public static final String MALFORMED_RESPONSE = "llm.response.malformed";
    public static final String CONTEXT_LENGTH_EXCEEDED = "llm.context.length_exceeded";
    public static final String LANGCHAIN4J_RATE_LIMIT = "llm.langchain4j.rate_limit";
    public static final String LANGCHAIN4J_TIMEOUT = "llm.langchain4j.timeout";
    public static final String LANGCHAIN4J_AUTHENTICATION = "llm.langchain4j.authentication";
    public static final String LANGCHAIN4J_INVALID_REQUEST = "llm.langchain4j.invalid_request";
    public static final String LANGCHAIN4J_MODEL_NOT_FOUND = "llm.langchain4j.model_not_found";
    public static final String LANGCHAIN4J_CONTENT_FILTERED = "llm.langchain4j.content_filtered";
    public static final String LANGCHAIN4J_INTERNAL_SERVER = "llm.langchain4j.internal_server";
    public static final String LANGCHAIN4J_UNSUPPORTED_FEATURE = "llm.langchain4j.unsupported_feature";
    public static final String LANGCHAIN4J_RETRIABLE = "llm.langchain4j.retriable";
    public static final String LANGCHAIN4J_NON_RETRIABLE = "llm.langchain4j.non_retriable";
    public static final String LANGCHAIN4J_HTTP_ERROR = "llm.langchain4j.http_error";
    public static final String LANGCHAIN4J_ERROR = "llm.langchain4j.error";
    public static final String UNKNOWN = "llm.error.unknown";

    private static final String LANGCHAIN4J_EXCEPTIONS_PREFIX = "dev.langchain4j.exception.";

    private LlmErrorClassifier() {
    }

    /**
     * Classify a model failure based on throwable types along the cause chain.
     */
    public static String classifyFromThrowable(Throwable throwable) {
        if (throwable == null) {
            return UNKNOWN;
        }

        Set<Throwable> visited = new HashSet<>();
        Throwable current = throwable;
        while (current != null && !visited.contains(current)) {
            visited.add(current);

            if (current instanceof MalformedLlmResponseException) {
                return MALFORMED_RESPONSE;
            }

            String embedded = extractCode(current.getMessage());
            if (embedded != null && !embedded.isBlank()) {
                return embedded;
            }

            String byType = classifyKnownThrowable(current);
            if (!UNKNOWN.equals(byType)) {
                return byType;
            }

            String byMessage = classifyFromMessage(current.getMessage());
            if (!UNKNOWN.equals(byMessage)) {
                return byMessage;
            }

            current = current.getCause();
        }
        return UNKNOWN;
    }

    /**
     * Prefix a human diagnostic with a machine-readable code.
     */
    public static String withCode(String code, String message) {
        if (message == null || message.isBlank()) {
            return "[" + code + "]";
        }
        if (message.startsWith("[" + code + "]")) {
            return message;
        }
        return "[" + code + "] " + message;
    }

    /**
     * Extract a code from diagnostics like: "[llm.some.code] details".
     */
    public static String extractCode(String message) {
        if (message == null || message.isBlank() || message.charAt(0) != '[') {
            return null;
        }
        int end = message.indexOf(']');
        if (end <= 1) {
            return null;
        }
        return message.substring(1, end);
    }

    /**
     * Codes that mean the same request may succeed later or elsewhere.
     */
    public static boolean isTransientCode(String code) {
        if (code == null || code.isBlank()) {
            return false;
        }
        return LANGCHAIN4J_RATE_LIMIT.equals(code)
                || LANGCHAIN4J_TIMEOUT.equals(code)
                || LANGCHAIN4J_INTERNAL_SERVER.equals(code)
                || REQUEST_TIMEOUT.equals(code)
                || CONNECTION_FAILED.equals(code)
                || LANGCHAIN4J_RETRIABLE.equals(code);
    }

    /**
     * Whether a failed attempt should move on to the next fallback entry. Only an
     * aborted request stops the chain.
     */
    public static boolean shouldAdvanceChain(String code) {
        return !REQUEST_ABORTED.equals(code);
    }

    private static String classifyKnownThrowable(Throwable throwable) {
        if (throwable instanceof CancellationException || throwable instanceof InterruptedException) {
            return REQUEST_ABORTED;
        }
        if (throwable instanceof SocketTimeoutException
                || throwable instanceof HttpTimeoutException
                || throwable instanceof TimeoutException) {
            return REQUEST_TIMEOUT;
        }
        if (throwable instanceof ConnectException || throwable instanceof UnknownHostException) {
            return CONNECTION_FAILED;
        }

        String className = throwable.getClass().getName();
        if (!className.startsWith(LANGCHAIN4J_EXCEPTIONS_PREFIX)) {
            return UNKNOWN;
        }

        switch (className.substring(LANGCHAIN4J_EXCEPTIONS_PREFIX.length())) {
        case "RateLimitException":
            return LANGCHAIN4J_RATE_LIMIT;
        case "TimeoutException":
            return LANGCHAIN4J_TIMEOUT;
        case "AuthenticationException":
            return LANGCHAIN4J_AUTHENTICATION;
        case "InvalidRequestException":
            return LANGCHAIN4J_INVALID_REQUEST;
        case "ModelNotFoundException":
            return LANGCHAIN4J_MODEL_NOT_FOUND;
        case "ContentFilteredException":
            return LANGCHAIN4J_CONTENT_FILTERED;
        case "InternalServerException":
            return LANGCHAIN4J_INTERNAL_SERVER;
        case "UnsupportedFeatureException":
            return LANGCHAIN4J_UNSUPPORTED_FEATURE;
        case "HttpException":
            return classifyHttpExceptionByStatus(throwable);
        case "RetriableException":
            return LANGCHAIN4J_RETRIABLE;
        case "NonRetriableException":
            return LANGCHAIN4J_NON_RETRIABLE;
        case "LangChain4jException":
            return LANGCHAIN4J_ERROR;
        default:
            return UNKNOWN;
        }
    }

    private static String classifyHttpExceptionByStatus(Throwable throwable) {
        Integer statusCode = readHttpStatusCode(throwable);
        if (statusCode == null) {
            return LANGCHAIN4J_HTTP_ERROR;
        }
        if (statusCode == 429) {
            return LANGCHAIN4J_RATE_LIMIT;
        }
        if (statusCode == 401 || statusCode == 403) {
            return LANGCHAIN4J_AUTHENTICATION;
        }
        if (statusCode == 408 || statusCode == 504) {
            return LANGCHAIN4J_TIMEOUT;
        }
        if (statusCode >= 500) {
            return LANGCHAIN4J_INTERNAL_SERVER;
        }
        if (statusCode >= 400) {
            return LANGCHAIN4J_INVALID_REQUEST;
        }
        return LANGCHAIN4J_HTTP_ERROR;
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

    private static String classifyFromMessage(String message) {
        if (message == null || message.isBlank()) {
            return UNKNOWN;
        }

        String normalized = message.toLowerCase(Locale.ROOT);
        if (normalized.contains("context length")
                || normalized.contains("context window")
                || normalized.contains("maximum context")
                || normalized.contains("prompt is too long")) {
            return CONTEXT_LENGTH_EXCEEDED;
        }

        return UNKNOWN;
    }
}
