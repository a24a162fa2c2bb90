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

import me.golemcore.orchestrator.domain.model.LlmRequest;
import me.golemcore.orchestrator.domain.model.LlmResponse;

import java.util.concurrent.CompletableFuture;

/**
 * Port for a single model vendor. Implementations translate the canonical
 * {@link LlmRequest} to the vendor API and back; the request's model is the
 * vendor-local model name (no {@code vendor/} prefix).
 */
public interface LlmPort {

    /**
     * Vendor identifier used in model references ({@code openai},
     * {@code anthropic}, {@code google}).
     */
    String getVendor();

    /**
     * True when credentials for this vendor are configured.
     */
    boolean isAvailable();

    /**
     * Submit the request. Vendor failures complete the future exceptionally with
     * the vendor client's exception as cause.
     */
    CompletableFuture<LlmResponse> chat(LlmRequest request);
}
