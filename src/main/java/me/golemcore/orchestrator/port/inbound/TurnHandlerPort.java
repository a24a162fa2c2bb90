package me.golemcore.orchestrator.port.inbound;

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

import me.golemcore.orchestrator.domain.model.TurnCancellation;
import me.golemcore.orchestrator.domain.model.TurnRequest;
import me.golemcore.orchestrator.domain.model.TurnResponse;

import java.util.concurrent.CompletableFuture;

/**
 * Entry point for front ends delivering conversational turns.
 */
public interface TurnHandlerPort {

    /**
     * Process one turn. The returned future always completes normally with a
     * structured response, failures included.
     */
    CompletableFuture<TurnResponse> handleTurn(TurnRequest request, TurnCancellation cancellation);
}
