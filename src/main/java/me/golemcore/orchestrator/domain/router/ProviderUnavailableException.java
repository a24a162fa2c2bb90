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

import lombok.Getter;

/**
 * Every entry of the fallback chain failed, or no entry had a registered
 * vendor.
 */
@Getter
public class ProviderUnavailableException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final int attempts;
    private final String lastErrorCode;

    public ProviderUnavailableException(int attempts, String lastErrorCode, Throwable cause) {
        super(LlmErrorClassifier.withCode(lastErrorCode != null ? lastErrorCode : LlmErrorClassifier.UNKNOWN,
                "No model available after " + attempts + " attempt(s)"), cause);
        this.attempts = attempts;
        this.lastErrorCode = lastErrorCode;
    }
}
