package me.golemcore.council.domain.exception;

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
 * An agent capability call failed with a checked cause.
 */
public class AgentInvocationException extends CouncilException {
    private static final long serialVersionUID = 1L;
    private final String agentId;

    public AgentInvocationException(String agentId, Throwable cause) {
        super("Agent " + agentId + " failed: " + cause.getMessage(), cause);
        this.agentId = agentId;
    }

    public AgentInvocationException(String agentId, String message) {
        super("Agent " + agentId + " failed: " + message);
        this.agentId = agentId;
    }

    public String getAgentId() {
        return agentId;
    }
}
