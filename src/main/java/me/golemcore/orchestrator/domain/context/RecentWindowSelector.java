package me.golemcore.orchestrator.domain.context;

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

import me.golemcore.orchestrator.domain.model.Message;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Picks the most recent raw messages that fit a message count and a token
 * budget.
 *
 * <p>
 * A run of consecutive tool_call/tool_result messages is one unit: it is kept
 * or dropped as a whole, so the window never starts with a tool_result whose
 * tool_call fell outside it. Tool messages without their partner are removed.
 */
public final class RecentWindowSelector {

    private RecentWindowSelector() {
    }

    public static List<Message> select(List<Message> history, int maxMessages, int tokenBudget) {
        List<Message> paired = dropUnpaired(history);
        List<List<Message>> units = toUnits(paired);

        Deque<List<Message>> selected = new ArrayDeque<>();
        int count = 0;
        int tokens = 0;
        for (int i = units.size() - 1; i >= 0; i--) {
            List<Message> unit = units.get(i);
            int unitTokens = TokenEstimator.estimate(unit);
            if (count + unit.size() > maxMessages || tokens + unitTokens > tokenBudget) {
                break;
            }
            selected.addFirst(unit);
            count += unit.size();
            tokens += unitTokens;
        }

        List<Message> window = new ArrayList<>(count);
        selected.forEach(window::addAll);
        return window;
    }

    private static List<List<Message>> toUnits(List<Message> messages) {
        List<List<Message>> units = new ArrayList<>();
        List<Message> toolRun = null;
        for (Message message : messages) {
            if (message.isToolCall() || message.isToolResult()) {
                if (toolRun == null) {
                    toolRun = new ArrayList<>();
                    units.add(toolRun);
                }
                toolRun.add(message);
            } else {
                toolRun = null;
                units.add(List.of(message));
            }
        }
        return units;
    }

    private static List<Message> dropUnpaired(List<Message> messages) {
        Set<String> calls = new HashSet<>();
        Set<String> results = new HashSet<>();
        for (Message message : messages) {
            if (message.isToolCall()) {
                calls.add(message.getToolCallId());
            } else if (message.isToolResult()) {
                results.add(message.getToolCallId());
            }
        }
        List<Message> paired = new ArrayList<>(messages.size());
        for (Message message : messages) {
            if (message.isToolCall() && !results.contains(message.getToolCallId())) {
                continue;
            }
            if (message.isToolResult() && !calls.contains(message.getToolCallId())) {
                continue;
            }
            paired.add(message);
        }
        return paired;
    }
}
