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
import me.golemcore.council.port.outbound.AgentModel;

import java.util.List;

/**
 * One configured agent: the capability it runs on plus its identity and
 * optional system prompt. Debate participants use the same type;
 * {@code skills} overrides the debate's skill selection for this participant.
 */
@Value
@Builder(toBuilder = true)
public class AgentConfig {

    String id;
    String name;
    AgentModel model;
    String systemPrompt;

    @Singular
    List<String> skills;

    public String getDisplayName() {
        return name != null && !name.isBlank() ? name : id;
    }

    public boolean hasSystemPrompt() {
        return systemPrompt != null && !systemPrompt.isBlank();
    }
}
