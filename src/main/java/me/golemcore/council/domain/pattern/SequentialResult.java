package me.golemcore.council.domain.pattern;

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

import me.golemcore.council.domain.model.AgentResponse;

import java.util.List;

public record SequentialResult(String finalAnswer, List<Step> steps, long totalDurationMs) {

    public SequentialResult {
        steps = List.copyOf(steps);
    }

    /**
     * One link of the chain, with the exact prompt the agent received.
     */
    public record Step(String agentId, String input, AgentResponse response, long durationMs) {
    }
}
