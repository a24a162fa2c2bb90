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

/**
 * Classification of tool invocation failures. Used to decide provider health
 * and how the failure is reported to the model.
 */
public enum ToolFailureKind {

    /**
     * Name is not in the current catalog or its namespace has no route. No
     * network call was made.
     */
    UNKNOWN_TOOL,

    /**
     * Provider unreachable, timed out, answered 5xx or sent an unparseable reply.
     */
    PROVIDER_UNAVAILABLE,

    /**
     * Provider refused the request (401, 403 or another 4xx).
     */
    PROVIDER_REJECTED,

    /**
     * Provider ran the tool and reported a failure.
     */
    EXECUTION_FAILED
}
