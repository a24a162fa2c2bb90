package me.golemcore.orchestrator;

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

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Main application class for the GolemCore orchestrator.
 *
 * <p>
 * The orchestrator turns one conversational turn into zero or more tool
 * invocations and a final answer. It is built around four collaborating
 * components:
 *
 * <h2>Components</h2>
 * <ul>
 * <li><b>Tool Registry</b> - discovers remote tool providers, caches their
 * manifests and routes invocations</li>
 * <li><b>Model Router</b> - OpenAI, Anthropic and Google models via langchain4j
 * with an ordered fallback chain</li>
 * <li><b>Context Assembler</b> - persona, long-term memory, conversation
 * summary and recent history</li>
 * <li><b>Agent Loop</b> - the turn state machine composing the three</li>
 * </ul>
 *
 * <h2>Architecture</h2>
 * <p>
 * Hexagonal architecture (Ports & Adapters):
 *
 * <pre>
 * Input Layer        → TurnsController, ToolsController
 * Domain Layer       → AgentLoop, ToolRegistry, ModelRouter, ContextAssembler
 * Infrastructure     → LLM/Embedding/Storage/Tool provider adapters
 * </pre>
 */
@SpringBootApplication
public class OrchestratorApplication {

    public static void main(String[] args) {
        SpringApplication.run(OrchestratorApplication.class, args);
    }
}
