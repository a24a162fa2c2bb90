package me.golemcore.orchestrator.infrastructure.config;

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

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Centralized configuration properties for the orchestrator, bound from
 * application.yml.
 *
 * <p>
 * All configuration is organized under the {@code orchestrator.*} prefix. This
 * class contains nested property classes for different subsystems:
 * <ul>
 * <li>{@link LlmProperties} - vendor credentials and call timeouts</li>
 * <li>{@link RouterProperties} - default model and fallback chain</li>
 * <li>{@link ToolsProperties} - tool provider endpoints and refresh policy</li>
 * <li>{@link MemoryProperties} - context window and summarization</li>
 * <li>{@link LoopProperties} - iteration cap and turn resolution</li>
 * <li>{@link StorageProperties} - persistence configuration</li>
 * </ul>
 *
 * @since 1.0
 */
@Component
@ConfigurationProperties(prefix = "orchestrator")
@Data
public class OrchestratorProperties {

    private LlmProperties llm = new LlmProperties();
    private RouterProperties router = new RouterProperties();
    private ToolsProperties tools = new ToolsProperties();
    private MemoryProperties memory = new MemoryProperties();
    private LoopProperties loop = new LoopProperties();
    private UsersProperties users = new UsersProperties();
    private List<PersonaProperties> personas = new ArrayList<>();
    private StorageProperties storage = new StorageProperties();
    private HttpProperties http = new HttpProperties();

    // ==================== LLM ====================

    @Data
    public static class LlmProperties {
        private long timeoutMs = 120000;
        private int maxOutputTokens = 4096;
        private Double temperature = 0.7;
        private Map<String, VendorProperties> vendors = new HashMap<>();
    }

    @Data
    public static class VendorProperties {
        private String apiKey;
        private String baseUrl;
    }

    @Data
    public static class RouterProperties {
        private String defaultModel = "anthropic/claude-sonnet-4-20250514";
        private String summarizationModel = "openai/gpt-4o-mini";
        private List<String> fallbackChain = new ArrayList<>();
        private String embeddingModel = "text-embedding-3-small";
    }

    // ==================== TOOLS ====================

    @Data
    public static class ToolsProperties {
        private List<ToolProviderProperties> providers = new ArrayList<>();
        private long manifestTimeoutMs = 10000;
        private long executeTimeoutMs = 30000;
        private long manifestTtlMs = 3600000;
        private long refreshIntervalMs = 300000;
        private int executeTransportRetries = 1;
        private int maxConcurrentExecutions = 4;
        private int maxResultLength = 100000;
    }

    @Data
    public static class ToolProviderProperties {
        private String namespace;
        private String url;
        private boolean routingContext = false;
    }

    // ==================== CONTEXT ====================

    @Data
    public static class MemoryProperties {
        private int workingMemoryMessages = 20;
        private int contextWindowTokens = 200000;
        private double contextBudgetRatio = 0.8;
        private int recallTopK = 3;
        private int summarizeThresholdMessages = 40;
        private int summaryInputMaxChars = 6000;
        private long idleSummarizationIntervalMs = 300000;
        private int idleSummarizationBatchSize = 10;
    }

    // ==================== LOOP ====================

    @Data
    public static class LoopProperties {
        private int maxIterations = 10;
        private int minimalCallReserveTokens = 0;
        private int conversationTimeoutMinutes = 30;
        private String defaultSystemPrompt = "You are a helpful assistant. "
                + "Use the available tools when they help answer the user.";
        private List<String> defaultNamespaces = new ArrayList<>(List.of("research"));
    }

    @Data
    public static class UsersProperties {
        private Long defaultGuestTokenBudget = 5000L;
        private Map<String, String> permissionOverrides = new HashMap<>();
    }

    @Data
    public static class PersonaProperties {
        private String id;
        private String name;
        private String systemPrompt;
        private List<String> allowedNamespaces = new ArrayList<>();
        private String preferredModel;
        private Integer maxTokensPerRequest;
        private String platform;
        private String serverId;
        private boolean defaultPersona = false;
    }

    // ==================== INFRASTRUCTURE ====================

    @Data
    public static class StorageProperties {
        private String basePath = "${user.home}/.golemcore/orchestrator";
    }

    @Data
    public static class HttpProperties {
        private long connectTimeout = 10000;
        private long readTimeout = 60000;
        private long writeTimeout = 60000;
        private int maxIdleConnections = 5;
        private long keepAliveDuration = 300000;
    }
}
