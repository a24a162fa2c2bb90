package me.golemcore.orchestrator.adapter.outbound.storage;

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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.orchestrator.domain.model.PermissionLevel;
import me.golemcore.orchestrator.domain.model.UserAccount;
import me.golemcore.orchestrator.infrastructure.config.OrchestratorProperties;
import me.golemcore.orchestrator.port.outbound.StoragePort;
import me.golemcore.orchestrator.port.outbound.UserAccountPort;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * User accounts on the local workspace ({@code users/<id>.json}).
 *
 * <p>
 * Unknown platform identities become guests with the default guest budget.
 * Identities listed in {@code orchestrator.users.permission-overrides}
 * ({@code platform:userId -> level}) get that level; admins and owners are not
 * metered. Usage resets when the 30-day period has elapsed. Debits go through
 * {@link ConcurrentHashMap#compute} so concurrent turns of one user never lose
 * an update.
 */
@Component
@Slf4j
public class LocalUserAccountAdapter implements UserAccountPort {

    private static final String DIR = "users";
    private static final Duration BUDGET_PERIOD = Duration.ofDays(30);

    private final StoragePort storagePort;
    private final ObjectMapper objectMapper;
    private final Clock clock;
    private final OrchestratorProperties.UsersProperties config;

    private final Map<String, UserAccount> accounts = new ConcurrentHashMap<>();
    private final Map<String, String> idsByIdentity = new ConcurrentHashMap<>();

    public LocalUserAccountAdapter(StoragePort storagePort, ObjectMapper objectMapper, Clock clock,
            OrchestratorProperties properties) {
        this.storagePort = storagePort;
        this.objectMapper = objectMapper;
        this.clock = clock;
        this.config = properties.getUsers();
    }

    @PostConstruct
    public void loadAccounts() {
        List<String> files = storagePort.listObjects(DIR, "").join();
        for (String file : files) {
            try {
                UserAccount account = objectMapper.readValue(storagePort.getText(DIR, file).join(),
                        UserAccount.class);
                accounts.put(account.getId(), account);
                idsByIdentity.put(identity(account.getPlatform(), account.getPlatformUserId()), account.getId());
            } catch (JsonProcessingException | RuntimeException e) {
                log.warn("[Users] Skipping unreadable account {}: {}", file, e.getMessage());
            }
        }
        log.info("[Users] Loaded {} account(s)", accounts.size());
    }

    @Override
    public UserAccount findOrCreate(String platform, String platformUserId, String username) {
        String key = identity(platform, platformUserId);
        String userId = idsByIdentity.computeIfAbsent(key, k -> create(platform, platformUserId, username).getId());
        return accounts.compute(userId, (id, account) -> {
            UserAccount current = applyOverride(key, resetPeriodIfDue(account));
            if (current != account) {
                persist(current);
            }
            return current;
        }).toBuilder().build();
    }

    @Override
    public UserAccount debit(String userId, long tokens) {
        UserAccount updated = accounts.compute(userId, (id, account) -> {
            if (account == null) {
                throw new IllegalArgumentException("Unknown user: " + userId);
            }
            UserAccount current = resetPeriodIfDue(account);
            UserAccount debited = current.toBuilder()
                    .tokensUsedThisPeriod(current.getTokensUsedThisPeriod() + Math.max(0, tokens))
                    .build();
            persist(debited);
            return debited;
        });
        return updated.toBuilder().build();
    }

    private UserAccount create(String platform, String platformUserId, String username) {
        Instant now = clock.instant();
        UserAccount account = UserAccount.builder()
                .id(UUID.randomUUID().toString())
                .platform(platform)
                .platformUserId(platformUserId)
                .username(username)
                .permissionLevel(PermissionLevel.GUEST)
                .monthlyTokenBudget(config.getDefaultGuestTokenBudget())
                .tokensUsedThisPeriod(0)
                .periodStart(now)
                .createdAt(now)
                .build();
        accounts.put(account.getId(), account);
        persist(account);
        log.info("[Users] Created guest account {} for {}:{}", account.getId(), platform, platformUserId);
        return account;
    }

    private UserAccount resetPeriodIfDue(UserAccount account) {
        Instant now = clock.instant();
        if (account.getPeriodStart() == null || !now.isBefore(account.getPeriodStart().plus(BUDGET_PERIOD))) {
            return account.toBuilder().tokensUsedThisPeriod(0).periodStart(now).build();
        }
        return account;
    }

    private UserAccount applyOverride(String identity, UserAccount account) {
        String override = config.getPermissionOverrides().get(identity);
        if (override == null) {
            return account;
        }
        Optional<PermissionLevel> level = PermissionLevel.parse(override);
        if (level.isEmpty()) {
            log.warn("[Users] Ignoring unknown permission override '{}' for {}", override, identity);
            return account;
        }
        if (level.get() == account.getPermissionLevel()) {
            return account;
        }
        boolean unmetered = level.get().allows(PermissionLevel.ADMIN);
        return account.toBuilder()
                .permissionLevel(level.get())
                .monthlyTokenBudget(unmetered ? null : account.getMonthlyTokenBudget())
                .build();
    }

    private void persist(UserAccount account) {
        try {
            storagePort.putTextAtomic(DIR, account.getId() + ".json", objectMapper.writeValueAsString(account))
                    .join();
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize account " + account.getId(), e);
        }
    }

    private static String identity(String platform, String platformUserId) {
        return platform + ":" + platformUserId;
    }
}
