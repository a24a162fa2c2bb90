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

import me.golemcore.orchestrator.domain.model.UserAccount;

/**
 * User accounts and their token budgets.
 */
public interface UserAccountPort {

    /**
     * Resolve the account linked to a platform identity, creating a guest account
     * on first contact.
     */
    UserAccount findOrCreate(String platform, String platformUserId, String username);

    /**
     * Atomically add {@code tokens} to the user's usage for the current period.
     * Concurrent debits for the same user never lose updates.
     */
    UserAccount debit(String userId, long tokens);
}
