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

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.council.domain.executor.AgentExecutor;
import me.golemcore.council.domain.executor.ExecutorConfig;
import me.golemcore.council.domain.model.AgentConfig;
import me.golemcore.council.domain.model.DebateMode;
import me.golemcore.council.domain.pattern.AggregationStrategy;
import me.golemcore.council.domain.pattern.CrossCheckConfig;
import me.golemcore.council.domain.pattern.CrossCheckPattern;
import me.golemcore.council.domain.pattern.EnsembleConfig;
import me.golemcore.council.domain.pattern.EnsemblePattern;
import me.golemcore.council.domain.pattern.ParallelConfig;
import me.golemcore.council.domain.pattern.ParallelPattern;
import me.golemcore.council.domain.pattern.SequentialConfig;
import me.golemcore.council.domain.pattern.SequentialPattern;
import me.golemcore.council.domain.pattern.debate.DebateConfig;
import me.golemcore.council.domain.pattern.debate.DebatePattern;
import me.golemcore.council.domain.pattern.debate.SkillsConfig;
import me.golemcore.council.domain.runtime.Budget;
import me.golemcore.council.domain.runtime.PricingCatalog;
import me.golemcore.council.domain.runtime.RunContext;
import me.golemcore.council.infrastructure.config.CouncilProperties;
import me.golemcore.council.port.outbound.AgentModelProvider;
import me.golemcore.council.port.outbound.SkillLoader;
import me.golemcore.council.port.outbound.UsageTrackingPort;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.ExecutorService;

/**
 * Assembles runs and patterns from {@code council.*} configuration.
 *
 * <p>
 * Agents are looked up by id in {@code council.agents}. Every agent handed to a
 * pattern is bound to the run it was created for: its model is wrapped in an
 * {@link AgentExecutor} that enforces the run's budget, timeout and retry
 * policy and records usage in the run's session.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class PatternFactory {

    private final CouncilProperties properties;
    private final AgentModelProvider modelProvider;
    private final SkillLoader skillLoader;
    private final UsageTrackingPort usageTracker;
    private final PricingCatalog pricingCatalog;
    private final ExecutorService councilExecutor;
    private final Clock clock;

    public RunContext newRunContext() {
        CouncilProperties.BudgetProperties limits = properties.getBudget();
        Budget budget = null;
        if (limits.getMaxTokens() != null || limits.getMaxCostUsd() != null || limits.getMaxDurationMs() != null) {
            budget = Budget.builder()
                    .maxTokens(limits.getMaxTokens())
                    .maxCostUsd(limits.getMaxCostUsd())
                    .maxDurationMs(limits.getMaxDurationMs())
                    .build();
        }
        RunContext context = RunContext.builder()
                .budget(budget)
                .pricing(pricingCatalog)
                .session(usageTracker)
                .build();
        log.debug("[Pattern] New run {} (budget: {})", context.getTraceContext().getTraceId(),
                budget != null ? budget : "unlimited");
        return context;
    }

    public ExecutorConfig executorConfig() {
        CouncilProperties.AgentExecutorProperties executor = properties.getAgentExecutor();
        return ExecutorConfig.builder()
                .timeout(Duration.ofMillis(executor.getTimeoutMs()))
                .retryEnabled(executor.isRetryEnabled())
                .maxRetries(executor.getMaxRetries())
                .retryDelay(Duration.ofMillis(executor.getRetryDelayMs()))
                .build();
    }

    /**
     * Resolves a configured agent and binds its model to {@code context}.
     *
     * @throws IllegalArgumentException
     *             if no agent is configured under {@code agentId}
     */
    public AgentConfig agent(String agentId, RunContext context) {
        CouncilProperties.AgentProperties agent = properties.getAgents().get(agentId);
        if (agent == null) {
            throw new IllegalArgumentException("Unknown agent: " + agentId);
        }
        AgentExecutor model = new AgentExecutor(
                modelProvider.get(agent.getProvider(), agent.getModel()),
                executorConfig(), context, councilExecutor, clock);
        return AgentConfig.builder()
                .id(agentId)
                .name(agent.getName())
                .model(model)
                .systemPrompt(agent.getSystemPrompt())
                .skills(agent.getSkills())
                .build();
    }

    public List<AgentConfig> agents(List<String> agentIds, RunContext context) {
        return agentIds.stream().map(id -> agent(id, context)).toList();
    }

    public SequentialPattern sequential(List<String> agentIds, boolean passContext, RunContext context) {
        return new SequentialPattern(SequentialConfig.builder()
                .agents(agents(agentIds, context))
                .passContext(passContext)
                .build(), councilExecutor, clock);
    }

    public ParallelPattern parallel(List<String> agentIds, RunContext context) {
        return new ParallelPattern(ParallelConfig.builder()
                .agents(agents(agentIds, context))
                .build(), councilExecutor, clock);
    }

    public EnsemblePattern ensemble(List<String> agentIds, AggregationStrategy aggregation, RunContext context) {
        return new EnsemblePattern(EnsembleConfig.builder()
                .agents(agents(agentIds, context))
                .aggregation(aggregation)
                .build(), councilExecutor, clock);
    }

    public CrossCheckPattern crossCheck(List<String> agentIds, String judgeId, RunContext context) {
        return new CrossCheckPattern(CrossCheckConfig.builder()
                .agents(agents(agentIds, context))
                .judge(agent(judgeId, context))
                .build(), councilExecutor, clock);
    }

    /**
     * Builds the debate described by {@code council.debate}.
     */
    public DebatePattern debate(RunContext context) {
        CouncilProperties.DebateProperties debate = properties.getDebate();
        return debate(debate.getParticipants(), debate.getOrchestrator(), debate.getMode(), context);
    }

    public DebatePattern debate(List<String> participantIds, String orchestratorId, DebateMode mode,
            RunContext context) {
        CouncilProperties.DebateProperties debate = properties.getDebate();
        CouncilProperties.SkillsProperties skills = properties.getSkills();
        DebateConfig.DebateConfigBuilder builder = DebateConfig.builder()
                .participants(agents(participantIds, context))
                .mode(mode)
                .maxRounds(debate.getMaxRounds())
                .timeoutMs(debate.getTimeoutMs())
                .toolPhases(debate.getToolPhases())
                .useNativeWebSearch(debate.isUseNativeWebSearch())
                .skills(SkillsConfig.builder()
                        .global(skills.getGlobal())
                        .participants(skills.getParticipants())
                        .build())
                .skillLoader(skillLoader);
        if (orchestratorId != null && !orchestratorId.isBlank()) {
            builder.orchestrator(agent(orchestratorId, context));
        }
        return new DebatePattern(builder.build(), councilExecutor, clock);
    }
}
