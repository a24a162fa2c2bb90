package me.golemcore.orchestrator.adapter.outbound.tools;

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
import feign.Headers;
import feign.RequestLine;
import me.golemcore.orchestrator.port.outbound.ToolProviderPort;

/**
 * Feign contract of a tool provider service.
 */
public interface ToolProviderApi {

    @RequestLine("GET /manifest")
    @Headers("Accept: application/json")
    JsonNode manifest();

    @RequestLine("POST /execute")
    @Headers({ "Content-Type: application/json", "Accept: application/json" })
    JsonNode execute(ToolProviderPort.ExecuteRequest request);
}
