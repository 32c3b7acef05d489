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

import lombok.Builder;
import lombok.Value;

/**
 * Final response of one agent turn. {@code usage} is optional; providers that
 * do not report token counts leave it {@code null}.
 */
@Value
@Builder
public class AgentResponse {

    Message message;
    LlmUsage usage;

    public static AgentResponse of(String content) {
        return AgentResponse.builder().message(Message.assistant(content)).build();
    }

    /**
     * Placeholder response used for agents that failed in partial-failure
     * patterns.
     */
    public static AgentResponse empty() {
        return of("");
    }

    public String getContent() {
        return message != null ? message.contentOrEmpty() : "";
    }

    public boolean hasUsage() {
        return usage != null;
    }
}
