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

import me.golemcore.orchestrator.domain.model.LlmResponse;
import me.golemcore.orchestrator.domain.model.Message;
import me.golemcore.orchestrator.domain.model.StopReason;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.UUID;

/**
 * Enforces the canonical response shape on vendor output: {@code tool_use}
 * carries at least one call, {@code end_turn} carries none, text is never
 * null and every call has an id.
 */
public final class LlmResponseNormalizer {

    private LlmResponseNormalizer() {
    }

    public static LlmResponse normalize(LlmResponse raw, ModelRef modelRef) {
        if (raw == null) {
            throw new MalformedLlmResponseException("Empty response from " + modelRef);
        }
        String content = raw.getContent() != null ? raw.getContent() : "";

        if (raw.getStopReason() == StopReason.ERROR) {
            return raw.toBuilder()
                    .content(content)
                    .toolCalls(List.of())
                    .model(modelRef.toString())
                    .build();
        }

        if (raw.hasToolCalls()) {
            List<Message.ToolCall> calls = new ArrayList<>();
            for (Message.ToolCall call : raw.getToolCalls()) {
                if (call.getName() == null || call.getName().isBlank()) {
                    throw new MalformedLlmResponseException("Tool call without name from " + modelRef);
                }
                calls.add(Message.ToolCall.builder()
                        .id(call.getId() != null && !call.getId().isBlank() ? call.getId() : syntheticCallId())
                        .name(call.getName())
                        .arguments(call.getArguments() != null ? call.getArguments() : new HashMap<>())
                        .build());
            }
            return raw.toBuilder()
                    .content(content)
                    .toolCalls(List.copyOf(calls))
                    .stopReason(StopReason.TOOL_USE)
                    .model(modelRef.toString())
                    .build();
        }

        if (raw.getStopReason() == StopReason.TOOL_USE) {
            throw new MalformedLlmResponseException("tool_use without tool calls from " + modelRef);
        }
        return raw.toBuilder()
                .content(content)
                .toolCalls(List.of())
                .stopReason(StopReason.END_TURN)
                .model(modelRef.toString())
                .build();
    }

    private static String syntheticCallId() {
        return "call_" + UUID.randomUUID().toString().replace("-", "");
    }
}
