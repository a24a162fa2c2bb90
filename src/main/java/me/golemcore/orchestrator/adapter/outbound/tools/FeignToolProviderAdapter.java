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
import feign.Feign;
import feign.FeignException;
import feign.Request;
import feign.RetryableException;
import feign.Retryer;
import feign.codec.DecodeException;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.orchestrator.domain.tools.ToolProviderException;
import me.golemcore.orchestrator.infrastructure.config.OrchestratorProperties;
import me.golemcore.orchestrator.infrastructure.http.FeignClientFactory;
import me.golemcore.orchestrator.port.outbound.ToolProviderPort;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;

/**
 * Tool provider transport over Feign and OkHttp.
 *
 * <p>
 * Two clients are kept per provider: one with the manifest timeout and one
 * with the execute timeout. Feign's own retryer is disabled; retry policy
 * belongs to the registry. Every Feign failure is translated into a
 * {@link ToolProviderException}:
 * <ul>
 * <li>I/O errors and timeouts - unavailable</li>
 * <li>unparseable bodies - unavailable</li>
 * <li>HTTP status - classified by
 * {@link ToolProviderException#classifyStatus(int)}</li>
 * </ul>
 */
@Component
@Slf4j
public class FeignToolProviderAdapter implements ToolProviderPort {

    private final FeignClientFactory feignClientFactory;
    private final OrchestratorProperties.ToolsProperties config;
    private final Map<String, ToolProviderApi> manifestClients = new ConcurrentHashMap<>();
    private final Map<String, ToolProviderApi> executeClients = new ConcurrentHashMap<>();

    public FeignToolProviderAdapter(FeignClientFactory feignClientFactory, OrchestratorProperties properties) {
        this.feignClientFactory = feignClientFactory;
        this.config = properties.getTools();
    }

    @Override
    public JsonNode fetchManifest(String namespace, String baseUrl) {
        ToolProviderApi api = manifestClients.computeIfAbsent(baseUrl,
                url -> createClient(url, config.getManifestTimeoutMs()));
        return call(namespace, "manifest", api::manifest);
    }

    @Override
    public JsonNode execute(String namespace, String baseUrl, ExecuteRequest request) {
        ToolProviderApi api = executeClients.computeIfAbsent(baseUrl,
                url -> createClient(url, config.getExecuteTimeoutMs()));
        return call(namespace, "execute " + request.toolName(), () -> api.execute(request));
    }

    private ToolProviderApi createClient(String baseUrl, long timeoutMs) {
        Feign.Builder builder = Feign.builder()
                .retryer(Retryer.NEVER_RETRY)
                .options(new Request.Options(timeoutMs, TimeUnit.MILLISECONDS, timeoutMs, TimeUnit.MILLISECONDS,
                        false));
        return feignClientFactory.create(ToolProviderApi.class, baseUrl, builder);
    }

    private JsonNode call(String namespace, String operation, Supplier<JsonNode> request) {
        try {
            return request.get();
        } catch (DecodeException e) {
            throw ToolProviderException.unavailable(namespace,
                    "Malformed " + operation + " reply from " + namespace + ": " + e.getMessage(), e);
        } catch (RetryableException e) {
            throw ToolProviderException.unavailable(namespace,
                    operation + " on " + namespace + " failed: " + e.getMessage(), e);
        } catch (FeignException e) {
            int status = e.status();
            if (status >= 200 && status < 300) {
                // body could not be read or parsed
                throw ToolProviderException.unavailable(namespace,
                        "Malformed " + operation + " reply from " + namespace + ": " + e.getMessage(), e);
            }
            log.debug("[ToolProvider] {} on {} returned HTTP {}", operation, namespace, status);
            throw ToolProviderException.fromStatus(namespace, status,
                    operation + " on " + namespace + " returned HTTP " + status, e);
        }
    }
}
