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

/**
 * Per-agent entry of a fan-out result. Failed agents carry an empty response,
 * zero duration and a non-empty {@code error}.
 */
public record AgentOutcome(String agentId, AgentResponse response, long durationMs, boolean success,
        String error) {

    public static AgentOutcome success(String agentId, AgentInvocation invocation) {
        return new AgentOutcome(agentId, invocation.response(), invocation.durationMs(), true, null);
    }

    public static AgentOutcome failure(String agentId, String error) {
        return new AgentOutcome(agentId, AgentResponse.empty(), 0, false, error);
    }

    public String content() {
        return response.getContent();
    }

    static String describe(Throwable error) {
        String message = error.getMessage();
        return message != null && !message.isBlank() ? message : error.getClass().getSimpleName();
    }
}
