package me.golemcore.council.domain.pattern;

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

import me.golemcore.council.domain.exception.AllAgentsFailedException;
import me.golemcore.council.domain.model.AgentResponse;
import me.golemcore.council.domain.model.PatternEvent;
import me.golemcore.council.domain.runtime.RunContext;
import me.golemcore.council.domain.runtime.TraceContext;

import java.time.Clock;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.function.Consumer;
import java.util.function.Function;

/**
 * Asks every agent the same question concurrently and reduces the usable
 * answers with the configured {@link AggregationStrategy}. Failed or empty
 * answers are dropped; the run fails only when none remain.
 */
public class EnsemblePattern extends AbstractPattern<PromptInput, EnsembleResult> {

    public static final String DEFAULT_NAME = "ensemble";
    static final String EXECUTION_PHASE = "parallel-execution";
    static final String AGGREGATION_PHASE = "aggregation";

    private final EnsembleConfig config;
    private final Function<List<AgentResponse>, String> aggregator;

    public EnsemblePattern(EnsembleConfig config) {
        this(config, PatternExecutors.shared(), Clock.systemUTC());
    }

    public EnsemblePattern(EnsembleConfig config, Executor executor, Clock clock) {
        super(nameOr(config.getName(), DEFAULT_NAME), executor, clock);
        if (config.getAgents().isEmpty()) {
            throw new IllegalArgumentException("Ensemble pattern requires at least one agent");
        }
        this.config = config;
        this.aggregator = aggregatorFor(config);
    }

    @Override
    public PatternStreamingProtocol getStreamingProtocol() {
        return PatternStreamingProtocol.ENSEMBLE;
    }

    public EnsembleConfig getConfig() {
        return config;
    }

    @Override
    protected EnsembleResult execute(RunContext context, PromptInput input, Consumer<PatternEvent> events) {
        long startTime = clock.millis();
        TraceContext rootTrace = context.getTraceContext();
        TraceContext executionTrace = rootTrace.createChild(EXECUTION_PHASE);
        String prompt = input.wrap("question", true);

        events.accept(new PatternEvent.PhaseStart(EXECUTION_PHASE, trace(executionTrace)));

        List<CompletableFuture<AgentOutcome>> futures = fanOut(config.getAgents(),
                agent -> invokeRecordingFailure(agent, prompt, context, executionTrace, EXECUTION_PHASE, events));
        List<AgentOutcome> outcomes = awaitAll(futures);
        context.getCancellation().throwIfCancelled();

        List<AgentResponse> usable = outcomes.stream()
                .filter(outcome -> outcome.success() && !outcome.content().isEmpty())
                .map(AgentOutcome::response)
                .toList();

        events.accept(new PatternEvent.PhaseEnd(EXECUTION_PHASE, clock.millis() - startTime,
                trace(executionTrace)));

        if (usable.isEmpty()) {
            throw new AllAgentsFailedException("All agents failed to respond");
        }

        TraceContext aggregationTrace = rootTrace.createChild(AGGREGATION_PHASE);
        long aggregationStart = clock.millis();
        events.accept(new PatternEvent.PhaseStart(AGGREGATION_PHASE, trace(aggregationTrace)));
        String finalAnswer = aggregator.apply(usable);
        events.accept(new PatternEvent.PhaseEnd(AGGREGATION_PHASE, clock.millis() - aggregationStart,
                trace(aggregationTrace)));
        events.accept(new PatternEvent.Done(trace(rootTrace)));

        return new EnsembleResult(finalAnswer, outcomes, config.getAggregation(), clock.millis() - startTime);
    }

    static Function<List<AgentResponse>, String> aggregatorFor(EnsembleConfig config) {
        AggregationStrategy strategy = config.getAggregation();
        return switch (strategy) {
        case FIRST -> responses -> responses.get(0).getContent();
        case LONGEST -> EnsemblePattern::longest;
        case SHORTEST -> EnsemblePattern::shortest;
        case CONCAT -> EnsemblePattern::concat;
        case CUSTOM -> {
            if (config.getCustomAggregator() == null) {
                throw new IllegalArgumentException("CUSTOM aggregation requires a customAggregator");
            }
            yield config.getCustomAggregator();
        }
        };
    }

    private static String longest(List<AgentResponse> responses) {
        String best = responses.get(0).getContent();
        for (AgentResponse response : responses) {
            if (response.getContent().length() > best.length()) {
                best = response.getContent();
            }
        }
        return best;
    }

    private static String shortest(List<AgentResponse> responses) {
        String best = responses.get(0).getContent();
        for (AgentResponse response : responses) {
            if (response.getContent().length() < best.length()) {
                best = response.getContent();
            }
        }
        return best;
    }

    private static String concat(List<AgentResponse> responses) {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < responses.size(); i++) {
            if (i > 0) {
                sb.append("\n\n");
            }
            sb.append("[Agent ").append(i + 1).append("]\n").append(responses.get(i).getContent());
        }
        return sb.toString();
    }
}
