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
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * Request sent to an agent capability: the conversation to complete.
 */
@Value
@Builder
public class AgentRequest {

    @Singular
    List<Message> messages;

    public static AgentRequest of(List<Message> messages) {
        return AgentRequest.builder().messages(messages).build();
    }

    /**
     * Returns the text of the last user message, or an empty string.
     */
    public String lastUserContent() {
        for (int i = messages.size() - 1; i >= 0; i--) {
            Message message = messages.get(i);
            if (message.isUserMessage()) {
                return message.contentOrEmpty();
            }
        }
        return "";
    }
}
