package me.golemcore.council.infrastructure.config;

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

import lombok.Data;
import me.golemcore.council.domain.model.DebateMode;
import me.golemcore.council.domain.model.DebatePhase;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Configuration properties for the council, bound from application.yml.
 *
 * <p>
 * All settings live under the {@code council.*} prefix:
 * <ul>
 * <li>{@link ProviderProperties} - API credentials per provider</li>
 * <li>{@link AgentProperties} - named agents referenced by patterns</li>
 * <li>{@link BudgetProperties} - default run budget</li>
 * <li>{@link AgentExecutorProperties} - timeout and retry per agent call</li>
 * <li>{@link SkillsProperties} - skill directories and selection</li>
 * <li>{@link DebateProperties} - default debate setup</li>
 * </ul>
 */
@Component
@ConfigurationProperties(prefix = "council")
@Data
public class CouncilProperties {

    private ExecutorProperties executor = new ExecutorProperties();
    private BudgetProperties budget = new BudgetProperties();
    private AgentExecutorProperties agentExecutor = new AgentExecutorProperties();
    private Map<String, Map<String, PriceProperties>> pricing = new HashMap<>();
    private Map<String, ProviderProperties> providers = new HashMap<>();
    private Map<String, AgentProperties> agents = new LinkedHashMap<>();
    private SkillsProperties skills = new SkillsProperties();
    private DebateProperties debate = new DebateProperties();

    @Data
    public static class ExecutorProperties {
        private String threadNamePrefix = "council-run";
    }

    @Data
    public static class BudgetProperties {
        private Long maxTokens;
        private Double maxCostUsd;
        private Long maxDurationMs;
    }

    @Data
    public static class AgentExecutorProperties {
        private long timeoutMs = 120_000;
        private boolean retryEnabled = false;
        private int maxRetries = 3;
        private long retryDelayMs = 1_000;
    }

    @Data
    public static class PriceProperties {
        private double input;
        private double output;
    }

    @Data
    public static class ProviderProperties {
        private String apiKey;
        private String baseUrl;
        private long timeoutMs = 120_000;
        private boolean streaming = true;
        private int maxTokens = 4096;
    }

    @Data
    public static class AgentProperties {
        private String name;
        private String provider;
        private String model;
        private String systemPrompt;
        private List<String> skills = new ArrayList<>();
    }

    @Data
    public static class SkillsProperties {
        private List<String> directories = new ArrayList<>(List.of(".ai/skills"));
        private List<String> global = new ArrayList<>();
        private Map<String, List<String>> participants = new HashMap<>();
    }

    @Data
    public static class DebateProperties {
        private DebateMode mode = DebateMode.STRONG;
        private List<String> participants = new ArrayList<>();
        private String orchestrator;
        private int maxRounds = 10;
        private long timeoutMs = 300_000;
        private Set<DebatePhase> toolPhases = new LinkedHashSet<>();
        private boolean useNativeWebSearch = false;
    }
}
