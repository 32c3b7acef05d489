package me.golemcore.council.port.outbound;

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

import me.golemcore.council.domain.model.AgentEvent;
import me.golemcore.council.domain.model.AgentResponse;
import reactor.core.publisher.Flux;

import java.util.concurrent.CompletableFuture;

/**
 * Handle to one running agent turn.
 */
public interface AgentRun {

    /**
     * Events of the turn. Completion of the flux marks the end of the turn.
     */
    Flux<AgentEvent> events();

    /**
     * Final response; settles exactly once and is consistent with
     * {@link #events()}.
     */
    CompletableFuture<AgentResponse> result();

    void cancel(String reason);
}
