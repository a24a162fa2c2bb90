package me.golemcore.orchestrator.domain.loop;

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

import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.orchestrator.domain.model.ToolFailureKind;
import me.golemcore.orchestrator.domain.model.ToolInvocation;
import me.golemcore.orchestrator.domain.model.ToolInvocationResult;
import me.golemcore.orchestrator.domain.tools.ToolRegistry;
import me.golemcore.orchestrator.infrastructure.config.OrchestratorProperties;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Semaphore;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs the tool invocations of one model response concurrently, with at most
 * {@code orchestrator.tools.max-concurrent-executions} in flight per batch.
 * Results are returned in request order.
 */
@Component
@Slf4j
public class ToolBatchExecutor {

    private final ToolRegistry toolRegistry;
    private final int maxConcurrent;
    private final AtomicInteger threadCounter = new AtomicInteger();
    private final ExecutorService executor = Executors.newCachedThreadPool(runnable -> {
        Thread thread = new Thread(runnable, "tool-exec-" + threadCounter.incrementAndGet());
        thread.setDaemon(true);
        return thread;
    });

    public ToolBatchExecutor(ToolRegistry toolRegistry, OrchestratorProperties properties) {
        this.toolRegistry = toolRegistry;
        this.maxConcurrent = Math.max(1, properties.getTools().getMaxConcurrentExecutions());
    }

    @PreDestroy
    public void shutdown() {
        executor.shutdownNow();
    }

    public List<ToolInvocationResult> executeAll(List<ToolInvocation> invocations) {
        if (invocations.size() == 1) {
            return List.of(toolRegistry.execute(invocations.get(0)));
        }
        Semaphore permits = new Semaphore(maxConcurrent);
        List<CompletableFuture<ToolInvocationResult>> futures = new ArrayList<>(invocations.size());
        for (ToolInvocation invocation : invocations) {
            futures.add(CompletableFuture.supplyAsync(() -> executeWithPermit(invocation, permits), executor));
        }

        List<ToolInvocationResult> results = new ArrayList<>(invocations.size());
        for (int i = 0; i < futures.size(); i++) {
            try {
                results.add(futures.get(i).join());
            } catch (CompletionException e) {
                log.error("[ToolBatch] Invocation of {} failed unexpectedly", invocations.get(i).getToolName(), e);
                results.add(ToolInvocationResult.failure(ToolFailureKind.EXECUTION_FAILED,
                        "Tool execution failed: " + e.getCause().getMessage()));
            }
        }
        return results;
    }

    private ToolInvocationResult executeWithPermit(ToolInvocation invocation, Semaphore permits) {
        try {
            permits.acquire();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return ToolInvocationResult.failure(ToolFailureKind.EXECUTION_FAILED, "Interrupted before execution");
        }
        try {
            return toolRegistry.execute(invocation);
        } finally {
            permits.release();
        }
    }
}
