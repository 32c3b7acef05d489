package me.golemcore.council.domain.model;

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
 * Event produced by an agent capability while a turn is running. Completion
 * of the event stream marks the end of the turn.
 */
public sealed interface AgentEvent permits AgentEvent.TokenDelta, AgentEvent.MessageCompleted,
        AgentEvent.UsageReported {

    /**
     * Incremental piece of generated text.
     */
    record TokenDelta(String text) implements AgentEvent {
    }

    /**
     * The complete assistant message of the turn.
     */
    record MessageCompleted(Message message) implements AgentEvent {
    }

    record UsageReported(LlmUsage usage) implements AgentEvent {
    }
}
