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
import me.golemcore.orchestrator.domain.router.ModelRef;
import me.golemcore.orchestrator.infrastructure.config.OrchestratorProperties;
import org.springframework.stereotype.Component;

/**
 * Google Gemini models through Gemini's OpenAI-compatible endpoint.
 */
@Component
public class GoogleLlmAdapter extends OpenAiLlmAdapter {

    static final String DEFAULT_BASE_URL = "https://generativelanguage.googleapis.com/v1beta/openai/";

    public GoogleLlmAdapter(OrchestratorProperties properties, ObjectMapper objectMapper) {
        super(properties, objectMapper);
    }

    @Override
    public String getVendor() {
        return ModelRef.GOOGLE;
    }

    @Override
    protected ChatModel createModel(String modelName, OrchestratorProperties.VendorProperties config) {
        String baseUrl = config.getBaseUrl() != null ? config.getBaseUrl() : DEFAULT_BASE_URL;
        return buildOpenAiCompatible(modelName, config.getApiKey(), baseUrl, true);
    }
}
