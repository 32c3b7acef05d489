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

import dev.langchain4j.model.anthropic.AnthropicChatModel;
import dev.langchain4j.model.anthropic.AnthropicStreamingChatModel;
import dev.langchain4j.model.openai.OpenAiChatModel;
import dev.langchain4j.model.openai.OpenAiStreamingChatModel;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.council.infrastructure.config.CouncilProperties;
import me.golemcore.council.port.outbound.AgentModel;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.ExecutorService;

/**
 * Builds langchain4j-backed agent models from {@code council.providers.*}.
 *
 * <p>
 * {@code anthropic} uses the Anthropic API; every other provider is treated as
 * OpenAI-compatible and may point at its own {@code base-url}. Provider retries
 * are disabled since retries are handled by the agent executor.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class Langchain4jModelFactory {

    static final String PROVIDER_ANTHROPIC = "anthropic";

    private final CouncilProperties properties;
    private final ExecutorService councilExecutor;
    private final Clock clock;

    public boolean isConfigured(String provider) {
        CouncilProperties.ProviderProperties config = properties.getProviders().get(provider);
        return config != null && config.getApiKey() != null && !config.getApiKey().isBlank();
    }

    public AgentModel create(String provider, String model) {
        if (!isConfigured(provider)) {
            throw new IllegalArgumentException("Provider '" + provider + "' has no API key configured");
        }
        CouncilProperties.ProviderProperties config = properties.getProviders().get(provider);
        log.info("[LLM] Creating {} model {} (streaming: {})", provider, model, config.isStreaming());

        if (PROVIDER_ANTHROPIC.equals(provider)) {
            return config.isStreaming()
                    ? new Langchain4jAgentModel(provider, model, anthropicStreaming(model, config), clock)
                    : new Langchain4jAgentModel(provider, model, anthropic(model, config), councilExecutor, clock);
        }
        return config.isStreaming()
                ? new Langchain4jAgentModel(provider, model, openAiStreaming(model, config), clock)
                : new Langchain4jAgentModel(provider, model, openAi(model, config), councilExecutor, clock);
    }

    private AnthropicChatModel anthropic(String model, CouncilProperties.ProviderProperties config) {
        var builder = AnthropicChatModel.builder()
                .apiKey(config.getApiKey())
                .modelName(model)
                .maxRetries(0)
                .maxTokens(config.getMaxTokens())
                .timeout(Duration.ofMillis(config.getTimeoutMs()));
        if (config.getBaseUrl() != null) {
            builder.baseUrl(config.getBaseUrl());
        }
        return builder.build();
    }

    private AnthropicStreamingChatModel anthropicStreaming(String model,
            CouncilProperties.ProviderProperties config) {
        var builder = AnthropicStreamingChatModel.builder()
                .apiKey(config.getApiKey())
                .modelName(model)
                .maxTokens(config.getMaxTokens())
                .timeout(Duration.ofMillis(config.getTimeoutMs()));
        if (config.getBaseUrl() != null) {
            builder.baseUrl(config.getBaseUrl());
        }
        return builder.build();
    }

    private OpenAiChatModel openAi(String model, CouncilProperties.ProviderProperties config) {
        var builder = OpenAiChatModel.builder()
                .apiKey(config.getApiKey())
                .modelName(model)
                .maxRetries(0)
                .timeout(Duration.ofMillis(config.getTimeoutMs()));
        if (config.getBaseUrl() != null) {
            builder.baseUrl(config.getBaseUrl());
        }
        return builder.build();
    }

    private OpenAiStreamingChatModel openAiStreaming(String model, CouncilProperties.ProviderProperties config) {
        var builder = OpenAiStreamingChatModel.builder()
                .apiKey(config.getApiKey())
                .modelName(model)
                .timeout(Duration.ofMillis(config.getTimeoutMs()));
        if (config.getBaseUrl() != null) {
            builder.baseUrl(config.getBaseUrl());
        }
        return builder.build();
    }
}
