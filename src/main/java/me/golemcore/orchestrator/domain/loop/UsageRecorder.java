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

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.orchestrator.domain.model.LlmUsage;
import me.golemcore.orchestrator.domain.model.UsageRecord;
import me.golemcore.orchestrator.domain.model.UserAccount;
import me.golemcore.orchestrator.domain.router.ModelRef;
import me.golemcore.orchestrator.port.outbound.UsagePort;
import me.golemcore.orchestrator.port.outbound.UserAccountPort;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Debits model token usage from the user's budget and records it with an
 * estimated cost.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class UsageRecorder {

    // USD per million tokens: input, output
    private static final Map<String, double[]> MODEL_COSTS = new LinkedHashMap<>();
    private static final double[] DEFAULT_COST = { 3.0, 15.0 };

    static {
        MODEL_COSTS.put("claude-sonnet-4", new double[] { 3.0, 15.0 });
        MODEL_COSTS.put("claude-opus-4", new double[] { 15.0, 75.0 });
        MODEL_COSTS.put("claude-3-5-haiku", new double[] { 0.8, 4.0 });
        MODEL_COSTS.put("claude-3-haiku", new double[] { 0.25, 1.25 });
        MODEL_COSTS.put("gpt-4o-mini", new double[] { 0.15, 0.6 });
        MODEL_COSTS.put("gpt-4o", new double[] { 2.5, 10.0 });
        MODEL_COSTS.put("gpt-4.1-mini", new double[] { 0.4, 1.6 });
        MODEL_COSTS.put("gpt-4.1", new double[] { 2.0, 8.0 });
        MODEL_COSTS.put("gemini-2.0-flash", new double[] { 0.075, 0.3 });
        MODEL_COSTS.put("gemini-2.5-flash", new double[] { 0.3, 2.5 });
        MODEL_COSTS.put("gemini-2.5-pro", new double[] { 1.25, 10.0 });
    }

    private final UserAccountPort userAccountPort;
    private final UsagePort usagePort;
    private final Clock clock;

    /**
     * Debit the call's tokens and write a usage record.
     *
     * @return the account after the debit
     */
    public UserAccount record(UserAccount user, String conversationId, ModelRef servedBy, LlmUsage usage) {
        if (usage == null || usage.getTotalTokens() <= 0) {
            return user;
        }
        UserAccount updated = userAccountPort.debit(user.getId(), usage.getTotalTokens());
        usagePort.record(UsageRecord.builder()
                .userId(user.getId())
                .conversationId(conversationId)
                .vendor(servedBy.vendor())
                .model(servedBy.model())
                .inputTokens(usage.getInputTokens())
                .outputTokens(usage.getOutputTokens())
                .estimatedCostUsd(estimateCost(servedBy.model(), usage.getInputTokens(), usage.getOutputTokens()))
                .timestamp(clock.instant())
                .build());
        log.debug("[Usage] {} used {} tokens on {}", user.getId(), usage.getTotalTokens(), servedBy);
        return updated;
    }

    /**
     * Longest matching model prefix wins; unknown models use a mid-range price.
     */
    static double estimateCost(String model, int inputTokens, int outputTokens) {
        double[] cost = DEFAULT_COST;
        int matched = -1;
        if (model != null) {
            for (Map.Entry<String, double[]> entry : MODEL_COSTS.entrySet()) {
                if (model.startsWith(entry.getKey()) && entry.getKey().length() > matched) {
                    cost = entry.getValue();
                    matched = entry.getKey().length();
                }
            }
        }
        return inputTokens / 1_000_000.0 * cost[0] + outputTokens / 1_000_000.0 * cost[1];
    }
}
