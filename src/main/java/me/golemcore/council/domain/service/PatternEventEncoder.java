package me.golemcore.council.domain.service;

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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.RequiredArgsConstructor;
import me.golemcore.council.domain.model.PatternEvent;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;

/**
 * Encodes pattern events as single-line JSON objects for external consumers.
 * Each object carries a {@code type} field with the {@code PatternEventType}
 * name followed by the event's own fields.
 */
@Component
@RequiredArgsConstructor
public class PatternEventEncoder {

    private final ObjectMapper objectMapper;

    public String encode(PatternEvent event) {
        ObjectNode node = objectMapper.createObjectNode();
        node.put("type", event.type().name());
        node.setAll((ObjectNode) objectMapper.valueToTree(event));
        try {
            return objectMapper.writeValueAsString(node);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to encode " + event.type() + " event", e);
        }
    }

    /**
     * Encodes a run's event stream as newline-delimited JSON.
     */
    public Flux<String> encodeLines(Flux<PatternEvent> events) {
        return events.map(event -> encode(event) + "\n");
    }
}
