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

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.council.port.outbound.AgentModel;
import me.golemcore.council.port.outbound.AgentModelProvider;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Resolves agent models by provider and model name.
 *
 * <p>
 * Models are created once and cached under {@code provider/model}. A provider
 * without credentials, or the {@code none} provider, resolves to the
 * {@link NoOpAgentModel}.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class AgentModelRegistry implements AgentModelProvider {

    private final Langchain4jModelFactory modelFactory;
    private final NoOpAgentModel noOpAgentModel;

    private final Map<String, AgentModel> models = new ConcurrentHashMap<>();

    @Override
    public AgentModel get(String provider, String model) {
        if (provider == null || NoOpAgentModel.PROVIDER_ID.equals(provider)) {
            return noOpAgentModel;
        }
        if (!modelFactory.isConfigured(provider)) {
            log.warn("[LLM] Provider '{}' not configured, using: {}", provider, NoOpAgentModel.PROVIDER_ID);
            return noOpAgentModel;
        }
        return models.computeIfAbsent(provider + "/" + model, key -> modelFactory.create(provider, model));
    }

    public boolean isProviderAvailable(String provider) {
        return provider != null && modelFactory.isConfigured(provider);
    }

    public Map<String, AgentModel> getCachedModels() {
        return Map.copyOf(models);
    }
}
