package me.golemcore.orchestrator.domain.model;

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

import com.fasterxml.jackson.databind.JsonNode;
import lombok.Builder;
import lombok.Data;

/**
 * Outcome of a tool invocation: either the provider's payload, verbatim, or a
 * classified failure.
 */
@Data
@Builder
public class ToolInvocationResult {

    private boolean success;
    private JsonNode payload;
    private String error;
    private ToolFailureKind failureKind;

    public static ToolInvocationResult success(JsonNode payload) {
        return ToolInvocationResult.builder()
                .success(true)
                .payload(payload)
                .build();
    }

    public static ToolInvocationResult failure(ToolFailureKind kind, String error) {
        return ToolInvocationResult.builder()
                .success(false)
                .failureKind(kind)
                .error(error)
                .build();
    }
}
