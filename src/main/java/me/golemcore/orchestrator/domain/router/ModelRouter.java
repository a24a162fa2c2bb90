package me.golemcore.orchestrator.domain.router;

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

import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.orchestrator.domain.model.LlmRequest;
import me.golemcore.orchestrator.domain.model.LlmResponse;
import me.golemcore.orchestrator.infrastructure.config.OrchestratorProperties;
import me.golemcore.orchestrator.port.outbound.LlmPort;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Routes model requests to vendor adapters along an ordered fallback chain.
 *
 * <p>
 * Only adapters whose credentials are configured are registered. For each
 * request the chain is the requested model followed by
 * {@code orchestrator.router.fallback-chain}, duplicates removed. Entries whose
 * vendor is not registered are skipped without counting as an attempt. Any
 * classified failure other than an aborted request moves on to the next entry
 * with the same logical request. When every entry has failed a
 * {@link ProviderUnavailableException} reports the number of attempts made.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ModelRouter {

    private static final long TIMEOUT_GRACE_MS = 5_000;

    private final OrchestratorProperties properties;
    private final List<LlmPort> adapters;

    private final Map<String, LlmPort> adaptersByVendor = new ConcurrentHashMap<>();

    @PostConstruct
    public void init() {
        for (LlmPort adapter : adapters) {
            if (adapter.isAvailable()) {
                adaptersByVendor.put(adapter.getVendor(), adapter);
                log.info("[ModelRouter] Registered vendor: {}", adapter.getVendor());
            } else {
                log.info("[ModelRouter] Vendor {} not configured, skipping", adapter.getVendor());
            }
        }
        if (adaptersByVendor.isEmpty()) {
            log.warn("[ModelRouter] No model vendor configured");
        }
    }

    public boolean isVendorRegistered(String vendor) {
        return adaptersByVendor.containsKey(vendor);
    }

    public Set<String> getRegisteredVendors() {
        return Set.copyOf(adaptersByVendor.keySet());
    }

    /**
     * Complete a request through the fallback chain. {@code request.model} selects
     * the first entry; the default model is used when it is absent.
     *
     * @throws ProviderUnavailableException
     *             when no chain entry produced a response
     * @throws CancellationException
     *             when the calling thread was interrupted
     */
    public RoutedResponse complete(LlmRequest request) {
        String requested = request.getModel() != null && !request.getModel().isBlank()
                ? request.getModel()
                : properties.getRouter().getDefaultModel();
        return completeWithChain(buildChain(requested), request);
    }

    /**
     * Complete a request using the configured summarization model.
     */
    public RoutedResponse completeForSummarization(LlmRequest request) {
        return completeWithChain(buildChain(properties.getRouter().getSummarizationModel()), request);
    }

    List<ModelRef> buildChain(String requestedModel) {
        Set<ModelRef> chain = new LinkedHashSet<>();
        addEntry(chain, requestedModel);
        for (String entry : properties.getRouter().getFallbackChain()) {
            addEntry(chain, entry);
        }
        return new ArrayList<>(chain);
    }

    private RoutedResponse completeWithChain(List<ModelRef> chain, LlmRequest request) {
        int attempts = 0;
        String lastCode = null;
        Throwable lastError = null;

        for (ModelRef ref : chain) {
            LlmPort adapter = adaptersByVendor.get(ref.vendor());
            if (adapter == null) {
                log.debug("[ModelRouter] Skipping {}: vendor not registered", ref);
                continue;
            }
            attempts++;
            try {
                LlmResponse raw = invoke(adapter, request.toBuilder().model(ref.model()).build());
                LlmResponse normalized = LlmResponseNormalizer.normalize(raw, ref);
                if (attempts > 1) {
                    log.info("[ModelRouter] Served by fallback {} after {} attempt(s)", ref, attempts);
                }
                return new RoutedResponse(normalized, ref, attempts);
            } catch (RuntimeException e) {
                String code = LlmErrorClassifier.classifyFromThrowable(e);
                if (!LlmErrorClassifier.shouldAdvanceChain(code)) {
                    throw e instanceof CancellationException ? (CancellationException) e
                            : new CancellationException("Model call aborted");
                }
                log.warn("[ModelRouter] {} failed ({}{}): {}", ref, code,
                        LlmErrorClassifier.isTransientCode(code) ? ", transient" : "", rootMessage(e));
                lastCode = code;
                lastError = e;
            }
        }

        log.error("[ModelRouter] Fallback chain exhausted after {} attempt(s), last error: {}", attempts, lastCode);
        throw new ProviderUnavailableException(attempts, lastCode, lastError);
    }

    private LlmResponse invoke(LlmPort adapter, LlmRequest request) {
        CompletableFuture<LlmResponse> future = adapter.chat(request);
        long timeoutMs = properties.getLlm().getTimeoutMs() + TIMEOUT_GRACE_MS;
        try {
            return future.get(timeoutMs, TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            throw new CancellationException("Interrupted while waiting for model");
        } catch (TimeoutException e) {
            future.cancel(true);
            throw new ModelCallException(LlmErrorClassifier.REQUEST_TIMEOUT, "Model call timed out", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            if (cause instanceof RuntimeException) {
                throw (RuntimeException) cause;
            }
            throw new ModelCallException(LlmErrorClassifier.classifyFromThrowable(cause), cause.getMessage(), cause);
        }
    }

    private void addEntry(Set<ModelRef> chain, String entry) {
        if (entry == null || entry.isBlank()) {
            return;
        }
        try {
            chain.add(ModelRef.parse(entry));
        } catch (IllegalArgumentException e) {
            log.warn("[ModelRouter] Ignoring chain entry '{}': {}", entry, e.getMessage());
        }
    }

    private static String rootMessage(Throwable throwable) {
        Throwable current = throwable;
        while (current.getCause() != null && current.getCause() != current) {
            current = current.getCause();
        }
        return current.getMessage();
    }

    /**
     * Model call failure carrying its classification code in the message.
     */
    static class ModelCallException extends RuntimeException {

        private static final long serialVersionUID = 1L;

        ModelCallException(String code, String message, Throwable cause) {
            super(LlmErrorClassifier.withCode(code, message), cause);
        }
    }
}
