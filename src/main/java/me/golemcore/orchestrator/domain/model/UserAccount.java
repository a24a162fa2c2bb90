package me.golemcore.orchestrator.domain.model;

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

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * A user known to the orchestrator, identified by a platform identity. A null
 * {@link #monthlyTokenBudget} means the user is not metered.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class UserAccount {

    private String id;
    private String platform;
    private String platformUserId;
    private String username;

    @Builder.Default
    private PermissionLevel permissionLevel = PermissionLevel.GUEST;

    private Long monthlyTokenBudget;
    private long tokensUsedThisPeriod;
    private Instant periodStart;
    private Instant createdAt;

    @JsonIgnore
    public boolean isMetered() {
        return monthlyTokenBudget != null;
    }

    /**
     * Remaining tokens in the current period, or {@link Long#MAX_VALUE} for
     * unmetered users.
     */
    @JsonIgnore
    public long getRemainingTokens() {
        if (monthlyTokenBudget == null) {
            return Long.MAX_VALUE;
        }
        return Math.max(0, monthlyTokenBudget - tokensUsedThisPeriod);
    }
}
