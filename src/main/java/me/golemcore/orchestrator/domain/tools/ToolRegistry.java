package me.golemcore.orchestrator.domain.tools;

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
import com.fasterxml.jackson.databind.node.NullNode;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.orchestrator.domain.model.PermissionLevel;
import me.golemcore.orchestrator.domain.model.ProviderHealth;
import me.golemcore.orchestrator.domain.model.ToolDescriptor;
import me.golemcore.orchestrator.domain.model.ToolFailureKind;
import me.golemcore.orchestrator.domain.model.ToolInvocation;
import me.golemcore.orchestrator.domain.model.ToolInvocationResult;
import me.golemcore.orchestrator.domain.model.ToolManifest;
import me.golemcore.orchestrator.infrastructure.config.OrchestratorProperties;
import me.golemcore.orchestrator.port.outbound.ToolProviderPort;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Registry of remote tool providers.
 *
 * <p>
 * Each configured provider owns one namespace. The registry fetches the
 * provider's manifest, validates it and installs it in an immutable catalog
 * snapshot. Readers always see a complete snapshot: every update builds a new
 * map and swaps it through an {@link AtomicReference}.
 *
 * <p>
 * A provider that cannot be reached, serves a malformed manifest, or fails an
 * invocation at the transport level is marked unhealthy. Its tools disappear
 * from {@link #listTools} until a refresh succeeds. Other providers are never
 * affected.
 *
 * <p>
 * Lifecycle: manifests are fetched in {@link #start()}, refreshed on a
 * background schedule and on demand via {@link #discover()}; the scheduler is
 * stopped in {@link #shutdown()}. Refreshes may overlap: every fetch is
 * numbered when its refresh starts and a provider's state is only replaced by
 * one from a later-started fetch.
 */
@Service
@Slf4j
public class ToolRegistry {

    private final OrchestratorProperties.ToolsProperties config;
    private final ToolProviderPort toolProviderPort;
    private final Clock clock;
    private final Map<String, ProviderRoute> routes;
    private final AtomicReference<Map<String, ProviderState>> catalog = new AtomicReference<>(Map.of());
    private final AtomicLong fetchGeneration = new AtomicLong();

    private ScheduledExecutorService refreshScheduler;

    public ToolRegistry(OrchestratorProperties properties, ToolProviderPort toolProviderPort, Clock clock) {
        this.config = properties.getTools();
        this.toolProviderPort = toolProviderPort;
        this.clock = clock;
        this.routes = buildRoutes(config.getProviders());
    }

    @PostConstruct
    public void start() {
        discover();
        long interval = config.getRefreshIntervalMs();
        if (interval > 0) {
            refreshScheduler = Executors.newSingleThreadScheduledExecutor(runnable -> {
                Thread thread = new Thread(runnable, "tool-manifest-refresh");
                thread.setDaemon(true);
                return thread;
            });
            refreshScheduler.scheduleWithFixedDelay(this::refreshSafely, interval, interval, TimeUnit.MILLISECONDS);
        }
    }

    @PreDestroy
    public void shutdown() {
        if (refreshScheduler != null) {
            refreshScheduler.shutdownNow();
            refreshScheduler = null;
        }
    }

    /**
     * Fetch every provider's manifest concurrently and install the results. A
     * failing provider is marked unhealthy; the rest are installed regardless.
     *
     * @return number of healthy providers after the refresh
     */
    public int discover() {
        return refresh(routes.values());
    }

    /**
     * Refresh only providers whose manifest is missing, expired or unhealthy.
     */
    public int refreshStale() {
        Instant now = clock.instant();
        Map<String, ProviderState> snapshot = catalog.get();
        List<ProviderRoute> stale = new ArrayList<>();
        for (ProviderRoute route : routes.values()) {
            ProviderState state = snapshot.get(route.namespace());
            if (state == null || !state.isServing(now)) {
                stale.add(route);
            }
        }
        if (stale.isEmpty()) {
            return countHealthy();
        }
        return refresh(stale);
    }

    /**
     * Tools visible to a caller: unexpired, from healthy providers, inside the
     * allowed namespaces and at or below the caller's permission level.
     */
    public List<ToolDescriptor> listTools(PermissionLevel level, Collection<String> allowedNamespaces) {
        if (level == null || allowedNamespaces == null || allowedNamespaces.isEmpty()) {
            return Collections.emptyList();
        }
        Instant now = clock.instant();
        Map<String, ProviderState> snapshot = catalog.get();
        List<ToolDescriptor> visible = new ArrayList<>();
        for (ProviderRoute route : routes.values()) {
            if (!allowedNamespaces.contains(route.namespace())) {
                continue;
            }
            ProviderState state = snapshot.get(route.namespace());
            if (state == null || !state.isServing(now)) {
                continue;
            }
            for (ToolDescriptor tool : state.manifest().tools()) {
                if (level.allows(tool.getMinPermission())) {
                    visible.add(tool);
                }
            }
        }
        return visible;
    }

    /**
     * Execute a tool. Unknown, stale or unroutable names resolve to
     * {@link ToolFailureKind#UNKNOWN_TOOL} without any network call. This method
     * never throws.
     */
    public ToolInvocationResult execute(ToolInvocation invocation) {
        String toolName = invocation.getToolName();
        Optional<ProviderRoute> route = resolveRoute(toolName);
        if (route.isEmpty()) {
            log.debug("[ToolRegistry] Unknown tool: {}", toolName);
            return ToolInvocationResult.failure(ToolFailureKind.UNKNOWN_TOOL, "Unknown tool: " + toolName);
        }

        ProviderRoute target = route.get();
        ToolProviderPort.ExecuteRequest request = new ToolProviderPort.ExecuteRequest(
                toolName,
                invocation.getArguments() != null ? invocation.getArguments() : Map.of(),
                invocation.getActingUserId(),
                target.routingContext() ? invocation.getRoutingContext() : null);

        int attempts = 1 + Math.max(0, config.getExecuteTransportRetries());
        ToolProviderException lastFailure = null;
        for (int attempt = 1; attempt <= attempts; attempt++) {
            try {
                JsonNode reply = toolProviderPort.execute(target.namespace(), target.baseUrl(), request);
                return interpretReply(target, toolName, reply);
            } catch (ToolProviderException e) {
                lastFailure = e;
                if (e.getKind() == ToolProviderException.Kind.REJECTED) {
                    break;
                }
                log.warn("[ToolRegistry] {} transport failure (attempt {}/{}): {}", toolName, attempt, attempts,
                        e.getMessage());
            }
        }

        markUnhealthy(target.namespace(), lastFailure.getMessage());
        ToolFailureKind kind = lastFailure.getKind() == ToolProviderException.Kind.REJECTED
                ? ToolFailureKind.PROVIDER_REJECTED
                : ToolFailureKind.PROVIDER_UNAVAILABLE;
        return ToolInvocationResult.failure(kind, lastFailure.getMessage());
    }

    /**
     * Exclude a provider until its next successful refresh.
     */
    public void markUnhealthy(String namespace, String reason) {
        catalog.updateAndGet(current -> {
            ProviderState state = current.get(namespace);
            if (state == null || !state.healthy()) {
                return current;
            }
            Map<String, ProviderState> next = new LinkedHashMap<>(current);
            next.put(namespace, state.unhealthy(reason));
            return Collections.unmodifiableMap(next);
        });
        log.warn("[ToolRegistry] Provider {} marked unhealthy: {}", namespace, reason);
    }

    public List<ProviderHealth> getProviderHealth() {
        Map<String, ProviderState> snapshot = catalog.get();
        Instant now = clock.instant();
        List<ProviderHealth> health = new ArrayList<>();
        for (ProviderRoute route : routes.values()) {
            ProviderState state = snapshot.get(route.namespace());
            if (state == null) {
                health.add(new ProviderHealth(route.namespace(), route.baseUrl(), false, 0, null, "not discovered"));
                continue;
            }
            ToolManifest manifest = state.manifest();
            health.add(new ProviderHealth(route.namespace(), route.baseUrl(), state.isServing(now),
                    manifest != null ? manifest.tools().size() : 0,
                    manifest != null ? manifest.expiresAt() : null,
                    state.lastError()));
        }
        return health;
    }

    private void refreshSafely() {
        try {
            refreshStale();
        } catch (RuntimeException e) {
            log.warn("[ToolRegistry] Background refresh failed: {}", e.getMessage());
        }
    }

    private int refresh(Collection<ProviderRoute> targets) {
        long generation = fetchGeneration.incrementAndGet();
        List<CompletableFuture<ProviderState>> fetches = targets.stream()
                .map(route -> CompletableFuture.supplyAsync(() -> fetch(route, generation)))
                .toList();
        CompletableFuture.allOf(fetches.toArray(new CompletableFuture[0])).join();

        Map<String, ProviderState> fetched = new LinkedHashMap<>();
        for (CompletableFuture<ProviderState> future : fetches) {
            ProviderState state = future.join();
            fetched.put(state.route().namespace(), state);
        }

        catalog.updateAndGet(current -> {
            Map<String, ProviderState> next = new LinkedHashMap<>(current);
            for (ProviderState state : fetched.values()) {
                ProviderState installed = current.get(state.route().namespace());
                if (installed == null || installed.generation() < state.generation()) {
                    next.put(state.route().namespace(), state);
                } else {
                    log.debug("[ToolRegistry] Discarding outdated manifest of {}", state.route().namespace());
                }
            }
            return Collections.unmodifiableMap(next);
        });

        int healthy = countHealthy();
        log.info("[ToolRegistry] Refreshed {} provider(s), {} of {} healthy", fetched.size(), healthy, routes.size());
        return healthy;
    }

    private ProviderState fetch(ProviderRoute route, long generation) {
        Instant now = clock.instant();
        try {
            JsonNode raw = toolProviderPort.fetchManifest(route.namespace(), route.baseUrl());
            List<ToolDescriptor> tools = ManifestValidator.validate(route.namespace(), raw);
            ToolManifest manifest = new ToolManifest(route.namespace(), tools, now,
                    now.plus(Duration.ofMillis(config.getManifestTtlMs())));
            log.info("[ToolRegistry] Provider {}: {} tool(s)", route.namespace(), tools.size());
            return new ProviderState(route, manifest, true, null, generation);
        } catch (ToolProviderException | ManifestValidationException e) {
            log.warn("[ToolRegistry] Provider {} excluded: {}", route.namespace(), e.getMessage());
            return new ProviderState(route, null, false, e.getMessage(), generation);
        } catch (RuntimeException e) {
            log.warn("[ToolRegistry] Provider {} excluded after unexpected error", route.namespace(), e);
            return new ProviderState(route, null, false, e.getClass().getSimpleName() + ": " + e.getMessage(),
                    generation);
        }
    }

    private Optional<ProviderRoute> resolveRoute(String toolName) {
        if (toolName == null) {
            return Optional.empty();
        }
        int dot = toolName.indexOf('.');
        if (dot <= 0 || dot == toolName.length() - 1) {
            return Optional.empty();
        }
        ProviderRoute route = routes.get(toolName.substring(0, dot));
        if (route == null) {
            return Optional.empty();
        }
        ProviderState state = catalog.get().get(route.namespace());
        if (state == null || !state.isServing(clock.instant()) || !state.hasTool(toolName)) {
            return Optional.empty();
        }
        return Optional.of(route);
    }

    private ToolInvocationResult interpretReply(ProviderRoute route, String toolName, JsonNode reply) {
        if (reply == null || !reply.isObject() || !reply.path("success").isBoolean()) {
            String reason = "Malformed execute reply from " + route.namespace();
            markUnhealthy(route.namespace(), reason);
            return ToolInvocationResult.failure(ToolFailureKind.PROVIDER_UNAVAILABLE, reason);
        }
        if (reply.get("success").asBoolean()) {
            JsonNode payload = reply.has("result") ? reply.get("result") : NullNode.getInstance();
            return ToolInvocationResult.success(payload);
        }
        String error = reply.path("error").asText("");
        log.debug("[ToolRegistry] {} reported failure: {}", toolName, error);
        return ToolInvocationResult.failure(ToolFailureKind.EXECUTION_FAILED,
                error.isBlank() ? "Tool reported failure" : error);
    }

    private int countHealthy() {
        Instant now = clock.instant();
        return (int) catalog.get().values().stream().filter(state -> state.isServing(now)).count();
    }

    private static Map<String, ProviderRoute> buildRoutes(
            List<OrchestratorProperties.ToolProviderProperties> providers) {
        Map<String, ProviderRoute> table = new LinkedHashMap<>();
        for (OrchestratorProperties.ToolProviderProperties provider : providers) {
            String namespace = provider.getNamespace();
            if (namespace == null || namespace.isBlank() || namespace.contains(".")) {
                throw new IllegalStateException("Invalid tool provider namespace: " + namespace);
            }
            if (provider.getUrl() == null || provider.getUrl().isBlank()) {
                throw new IllegalStateException("Tool provider " + namespace + " has no url");
            }
            if (table.containsKey(namespace)) {
                throw new IllegalStateException("Duplicate tool provider namespace: " + namespace);
            }
            String baseUrl = provider.getUrl().endsWith("/")
                    ? provider.getUrl().substring(0, provider.getUrl().length() - 1)
                    : provider.getUrl();
            table.put(namespace, new ProviderRoute(namespace, baseUrl, provider.isRoutingContext()));
        }
        return Collections.unmodifiableMap(table);
    }

    private record ProviderState(ProviderRoute route, ToolManifest manifest, boolean healthy, String lastError,
            long generation) {

        boolean isServing(Instant now) {
            return healthy && manifest != null && !manifest.isExpired(now);
        }

        boolean hasTool(String toolName) {
            return manifest != null && manifest.tools().stream().anyMatch(tool -> tool.getName().equals(toolName));
        }

        ProviderState unhealthy(String reason) {
            return new ProviderState(route, manifest, false, reason, generation);
        }
    }
}
