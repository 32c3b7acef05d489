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

import me.golemcore.council.domain.model.AgentRequest;
import me.golemcore.council.domain.runtime.CancellationToken;

/**
 * Port for the agent capability a pattern calls into: one model of one
 * provider, able to complete a conversation.
 */
public interface AgentModel {

    /**
     * Returns the provider identifier (e.g., "openai", "anthropic").
     */
    String getProviderId();

    /**
     * Returns the model identifier used for requests.
     */
    String getModel();

    /**
     * Starts one turn. Implementations must return promptly and must end the
     * run (error or completion) soon after {@code cancellation} fires.
     */
    AgentRun run(AgentRequest request, CancellationToken cancellation);
}
