package me.golemcore.orchestrator.adapter.outbound.llm;

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

import com.fasterxml.jackson.databind.ObjectMapper;
import dev.langchain4j.model.anthropic.AnthropicChatModel;
import dev.langchain4j.model.chat.ChatModel;
import me.golemcore.orchestrator.domain.router.ModelRef;
import me.golemcore.orchestrator.infrastructure.config.OrchestratorProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Anthropic (Claude) models through langchain4j.
 *
 * <p>
 * Configuration: {@code orchestrator.llm.vendors.anthropic.api-key} and
 * optional {@code base-url}.
 */
@Component
public class AnthropicLlmAdapter extends AbstractLangchain4jAdapter {

    public AnthropicLlmAdapter(OrchestratorProperties properties, ObjectMapper objectMapper) {
        super(properties, objectMapper);
    }

    @Override
    public String getVendor() {
        return ModelRef.ANTHROPIC;
    }

    @Override
    protected ChatModel createModel(String modelName, OrchestratorProperties.VendorProperties config) {
        OrchestratorProperties.LlmProperties llm = properties.getLlm();
        var builder = AnthropicChatModel.builder()
                .apiKey(config.getApiKey())
                .modelName(modelName)
                .maxRetries(0) // fallback chain handles retries
                .maxTokens(llm.getMaxOutputTokens())
                .timeout(Duration.ofMillis(llm.getTimeoutMs()));

        if (config.getBaseUrl() != null) {
            builder.baseUrl(config.getBaseUrl());
        }
        if (llm.getTemperature() != null) {
            builder.temperature(llm.getTemperature());
        }
        return builder.build();
    }
}
