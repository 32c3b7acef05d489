package me.golemcore.council.adapter.outbound.llm;

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

import lombok.extern.slf4j.Slf4j;
import me.golemcore.council.domain.model.AgentEvent;
import me.golemcore.council.domain.model.AgentRequest;
import me.golemcore.council.domain.model.AgentResponse;
import me.golemcore.council.domain.model.LlmUsage;
import me.golemcore.council.domain.model.Message;
import me.golemcore.council.domain.runtime.CancellationToken;
import me.golemcore.council.port.outbound.AgentModel;
import me.golemcore.council.port.outbound.AgentRun;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;

import java.util.concurrent.CompletableFuture;

/**
 * No-op agent capability used when no provider is configured.
 *
 * <p>
 * Always answers with a placeholder without calling any external API.
 *
 * <p>
 * Provider ID: {@code "none"}
 */
@Component
@Slf4j
public class NoOpAgentModel implements AgentModel {

    public static final String PROVIDER_ID = "none";
    static final String PLACEHOLDER = "[No LLM configured]";

    @Override
    public String getProviderId() {
        return PROVIDER_ID;
    }

    @Override
    public String getModel() {
        return PROVIDER_ID;
    }

    @Override
    public AgentRun run(AgentRequest request, CancellationToken cancellation) {
        log.warn("NoOpAgentModel: run() called - no LLM configured");
        AgentResponse response = AgentResponse.builder()
                .message(Message.assistant(PLACEHOLDER))
                .usage(LlmUsage.builder()
                        .inputTokens(0)
                        .outputTokens(0)
                        .totalTokens(0)
                        .model(PROVIDER_ID)
                        .providerId(PROVIDER_ID)
                        .build())
                .build();
        return new AgentRun() {
            @Override
            public Flux<AgentEvent> events() {
                return Flux.just(new AgentEvent.MessageCompleted(response.getMessage()));
            }

            @Override
            public CompletableFuture<AgentResponse> result() {
                return CompletableFuture.completedFuture(response);
            }

            @Override
            public void cancel(String reason) {
                // Already complete
            }
        };
    }
}
