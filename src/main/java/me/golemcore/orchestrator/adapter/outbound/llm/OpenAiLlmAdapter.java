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
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.openai.OpenAiChatModel;
import me.golemcore.orchestrator.domain.router.ModelRef;
import me.golemcore.orchestrator.infrastructure.config.OrchestratorProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Locale;

/**
 * OpenAI models through langchain4j. Reasoning models (o-series) do not accept
 * a temperature.
 */
@Component
public class OpenAiLlmAdapter extends AbstractLangchain4jAdapter {

    public OpenAiLlmAdapter(OrchestratorProperties properties, ObjectMapper objectMapper) {
        super(properties, objectMapper);
    }

    @Override
    public String getVendor() {
        return ModelRef.OPENAI;
    }

    @Override
    protected ChatModel createModel(String modelName, OrchestratorProperties.VendorProperties config) {
        return buildOpenAiCompatible(modelName, config.getApiKey(), config.getBaseUrl(),
                supportsTemperature(modelName));
    }

    protected ChatModel buildOpenAiCompatible(String modelName, String apiKey, String baseUrl,
            boolean withTemperature) {
        OrchestratorProperties.LlmProperties llm = properties.getLlm();
        var builder = OpenAiChatModel.builder()
                .apiKey(apiKey)
                .modelName(modelName)
                .maxRetries(0) // fallback chain handles retries
                .timeout(Duration.ofMillis(llm.getTimeoutMs()));

        if (baseUrl != null) {
            builder.baseUrl(baseUrl);
        }
        if (withTemperature && llm.getTemperature() != null) {
            builder.temperature(llm.getTemperature());
        }
        return builder.build();
    }

    private static boolean supportsTemperature(String modelName) {
        String lower = modelName.toLowerCase(Locale.ROOT);
        return !(lower.startsWith("o1") || lower.startsWith("o3") || lower.startsWith("o4"));
    }
}
