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

package me.golemcore.pipeline.adapter.outbound.llm;

import me.golemcore.pipeline.domain.exception.AnalysisException;
import me.golemcore.pipeline.domain.exception.NonRetryableAnalysisException;
import me.golemcore.pipeline.domain.exception.TransientIOException;

import java.io.IOException;
import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Method;
import java.net.SocketTimeoutException;
import java.net.http.HttpTimeoutException;
import java.util.HashSet;
import java.util.Set;
import java.util.concurrent.TimeoutException;

/**
 * Maps generation-client failures onto the retryable / non-retryable
 * taxonomy. Langchain4j exceptions are matched by class name so the mapping
 * does not depend on which provider module threw them.
 */
public final class GenerationErrorClassifier {

    public static final String RATE_LIMIT = "llm.rate_limit";
    public static final String TIMEOUT = "llm.timeout";
    public static final String INTERNAL_SERVER = "llm.internal_server";
    public static final String NETWORK = "llm.network";
    public static final String RETRIABLE = "llm.retriable";
    public static final String AUTHENTICATION = "llm.authentication";
    public static final String INVALID_REQUEST = "llm.invalid_request";
    public static final String MODEL_NOT_FOUND = "llm.model_not_found";
    public static final String CONTENT_FILTERED = "llm.content_filtered";
    public static final String UNSUPPORTED_FEATURE = "llm.unsupported_feature";
    public static final String NON_RETRIABLE = "llm.non_retriable";
    public static final String UNKNOWN = "llm.error.unknown";

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
    private static final String CLASS_RETRIABLE_EXCEPTION = LANGCHAIN4J_EXCEPTIONS_PREFIX + "RetriableException";
    private static final String CLASS_NON_RETRIABLE_EXCEPTION = LANGCHAIN4J_EXCEPTIONS_PREFIX
            + "NonRetriableException";
    private static final String CLASS_HTTP_EXCEPTION = LANGCHAIN4J_EXCEPTIONS_PREFIX + "HttpException";

    private GenerationErrorClassifier() {
    }

    /**
     * Classify a failure by walking its cause chain.
     */
    public static String classify(Throwable throwable) {
        Set<Throwable> visited = new HashSet<>();
        Throwable current = throwable;
        while (current != null && visited.add(current)) {
            String code = classifyKnownThrowable(current);
            if (!UNKNOWN.equals(code)) {
                return code;
            }
            current = current.getCause();
        }
        return UNKNOWN;
    }

    public static boolean isTransientCode(String code) {
        return RATE_LIMIT.equals(code)
                || TIMEOUT.equals(code)
                || INTERNAL_SERVER.equals(code)
                || NETWORK.equals(code)
                || RETRIABLE.equals(code);
    }

    /**
     * Wrap a client failure into the matching analysis exception.
     */
    public static AnalysisException toAnalysisException(Throwable throwable) {
        if (throwable instanceof AnalysisException analysisException) {
            return analysisException;
        }
        String code = classify(throwable);
        String message = "[" + code + "] " + throwable.getMessage();
        if (isTransientCode(code)) {
            return new TransientIOException(message, throwable);
        }
        return new NonRetryableAnalysisException(message, throwable);
    }

    private static String classifyKnownThrowable(Throwable throwable) {
        if (throwable instanceof SocketTimeoutException
                || throwable instanceof HttpTimeoutException
                || throwable instanceof TimeoutException) {
            return TIMEOUT;
        }
        if (throwable instanceof IOException) {
            return NETWORK;
        }

        String className = throwable.getClass().getName();
        if (!className.startsWith(LANGCHAIN4J_EXCEPTIONS_PREFIX)) {
            return UNKNOWN;
        }
        if (CLASS_RATE_LIMIT_EXCEPTION.equals(className)) {
            return RATE_LIMIT;
        }
        if (CLASS_TIMEOUT_EXCEPTION.equals(className)) {
            return TIMEOUT;
        }
        if (CLASS_AUTHENTICATION_EXCEPTION.equals(className)) {
            return AUTHENTICATION;
        }
        if (CLASS_INVALID_REQUEST_EXCEPTION.equals(className)) {
            return INVALID_REQUEST;
        }
        if (CLASS_MODEL_NOT_FOUND_EXCEPTION.equals(className)) {
            return MODEL_NOT_FOUND;
        }
        if (CLASS_CONTENT_FILTERED_EXCEPTION.equals(className)) {
            return CONTENT_FILTERED;
        }
        if (CLASS_INTERNAL_SERVER_EXCEPTION.equals(className)) {
            return INTERNAL_SERVER;
        }
        if (CLASS_UNSUPPORTED_FEATURE_EXCEPTION.equals(className)) {
            return UNSUPPORTED_FEATURE;
        }
        if (CLASS_HTTP_EXCEPTION.equals(className)) {
            return classifyHttpStatus(readHttpStatusCode(throwable));
        }
        if (CLASS_RETRIABLE_EXCEPTION.equals(className)) {
            return RETRIABLE;
        }
        if (CLASS_NON_RETRIABLE_EXCEPTION.equals(className)) {
            return NON_RETRIABLE;
        }
        return UNKNOWN;
    }

    static String classifyHttpStatus(Integer statusCode) {
        if (statusCode == null) {
            return RETRIABLE;
        }
        if (statusCode == 429) {
            return RATE_LIMIT;
        }
        if (statusCode == 401 || statusCode == 403) {
            return AUTHENTICATION;
        }
        if (statusCode == 408 || statusCode == 504) {
            return TIMEOUT;
        }
        if (statusCode >= 500) {
            return INTERNAL_SERVER;
        }
        if (statusCode >= 400) {
            return INVALID_REQUEST;
        }
        return RETRIABLE;
    }

    private static Integer readHttpStatusCode(Throwable throwable) {
        try {
            Method method = throwable.getClass().getMethod("statusCode");
            Object result = method.invoke(throwable);
            if (result instanceof Integer status) {
                return status;
            }
        } catch (NoSuchMethodException | IllegalAccessException | InvocationTargetException e) {
            return null;
        }
        return null;
    }
}
