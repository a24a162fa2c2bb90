package me.golemcore.orchestrator.domain.tools;

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

import lombok.Getter;

/**
 * Failure talking to a tool provider, classified by what it means for the
 * provider's health.
 */
@Getter
public class ToolProviderException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public enum Kind {
        /**
         * Unreachable, timed out, 5xx, 408/429 or unparseable reply.
         */
        UNAVAILABLE,
        /**
         * 401, 403 or another 4xx.
         */
        REJECTED
    }

    private final String namespace;
    private final Kind kind;
    private final int statusCode;

    public ToolProviderException(String namespace, Kind kind, int statusCode, String message, Throwable cause) {
        super(message, cause);
        this.namespace = namespace;
        this.kind = kind;
        this.statusCode = statusCode;
    }

    public static ToolProviderException unavailable(String namespace, String message, Throwable cause) {
        return new ToolProviderException(namespace, Kind.UNAVAILABLE, -1, message, cause);
    }

    public static ToolProviderException fromStatus(String namespace, int status, String message, Throwable cause) {
        return new ToolProviderException(namespace, classifyStatus(status), status, message, cause);
    }

    /**
     * Status codes that indicate the provider cannot serve right now are
     * unavailability; any other client error is a rejection.
     */
    public static Kind classifyStatus(int status) {
        if (status < 0 || status >= 500 || status == 408 || status == 429) {
            return Kind.UNAVAILABLE;
        }
        return Kind.REJECTED;
    }
}
