package me.golemcore.orchestrator.port.outbound;

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

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;
import me.golemcore.orchestrator.domain.tools.ToolProviderException;

import java.util.Map;

/**
 * Transport to remote tool providers.
 *
 * <p>
 * Both operations throw {@link ToolProviderException} for transport failures,
 * HTTP rejections and unparseable replies; the registry decides what each
 * means for provider health.
 */
public interface ToolProviderPort {

    /**
     * {@code GET /manifest}, returned as raw JSON for validation.
     */
    JsonNode fetchManifest(String namespace, String baseUrl);

    /**
     * {@code POST /execute}, returning the raw {@code {success, result | error}}
     * envelope.
     */
    JsonNode execute(String namespace, String baseUrl, ExecuteRequest request);

    @JsonInclude(JsonInclude.Include.NON_NULL)
    record ExecuteRequest(
            @JsonProperty("tool_name") String toolName,
            @JsonProperty("arguments") Map<String, Object> arguments,
            @JsonProperty("acting_user") String actingUser,
            @JsonProperty("routing_context") Map<String, Object> routingContext) {
    }
}
