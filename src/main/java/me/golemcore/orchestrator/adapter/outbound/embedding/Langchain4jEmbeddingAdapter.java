package me.golemcore.orchestrator.adapter.outbound.embedding;

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

import dev.langchain4j.data.embedding.Embedding;
import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.langchain4j.model.openai.OpenAiEmbeddingModel;
import dev.langchain4j.model.output.Response;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.orchestrator.infrastructure.config.OrchestratorProperties;
import me.golemcore.orchestrator.port.outbound.EmbeddingPort;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;

/**
 * Embedding adapter using langchain4j and OpenAI.
 *
 * <p>
 * Used to embed memory summaries when they are written and incoming turns
 * when memory is recalled. Without an OpenAI key the port reports itself
 * unavailable and recall falls back to recency.
 *
 * <p>
 * Configuration:
 * <ul>
 * <li>{@code orchestrator.llm.vendors.openai.api-key} - OpenAI API key
 * <li>{@code orchestrator.router.embedding-model} - embedding model name
 * </ul>
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class Langchain4jEmbeddingAdapter implements EmbeddingPort {

    private final OrchestratorProperties properties;

    private volatile EmbeddingModel embeddingModel;
    private volatile boolean initialized = false;

    private synchronized void ensureInitialized() {
        if (initialized)
            return;

        var openaiConfig = properties.getLlm().getVendors().get("openai");
        String apiKey = openaiConfig != null ? openaiConfig.getApiKey() : null;
        if (apiKey == null || apiKey.isBlank()) {
            log.warn("OpenAI API key not configured, embedding service unavailable");
            initialized = true;
            return;
        }

        String model = properties.getRouter().getEmbeddingModel();
        try {
            var builder = OpenAiEmbeddingModel.builder()
                    .apiKey(apiKey)
                    .modelName(model)
                    .timeout(Duration.ofMillis(properties.getLlm().getTimeoutMs()));
            if (openaiConfig.getBaseUrl() != null) {
                builder.baseUrl(openaiConfig.getBaseUrl());
            }
            embeddingModel = builder.build();
            log.info("Embedding model initialized: {}", model);
        } catch (RuntimeException e) {
            log.error("Failed to initialize embedding model", e);
        }

        initialized = true;
    }

    @Override
    public CompletableFuture<float[]> embed(String text) {
        return CompletableFuture.supplyAsync(() -> {
            ensureInitialized();

            if (embeddingModel == null) {
                throw new IllegalStateException("Embedding model not available");
            }

            Response<Embedding> response = embeddingModel.embed(text);
            return response.content().vector();
        });
    }

    @Override
    public boolean isAvailable() {
        ensureInitialized();
        return embeddingModel != null;
    }
}
