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

import me.golemcore.council.domain.model.PatternEvent;
import me.golemcore.council.domain.runtime.RunContext;
import me.golemcore.council.domain.runtime.TraceContext;

import java.time.Clock;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.function.Consumer;

/**
 * Sends the same prompt to every agent at once and waits for all of them.
 * Individual failures are recorded in the result and never fail the run.
 */
public class ParallelPattern extends AbstractPattern<PromptInput, ParallelResult> {

    public static final String DEFAULT_NAME = "parallel";
    static final String PHASE = "parallel-execution";

    private final ParallelConfig config;

    public ParallelPattern(ParallelConfig config) {
        this(config, PatternExecutors.shared(), Clock.systemUTC());
    }

    public ParallelPattern(ParallelConfig config, Executor executor, Clock clock) {
        super(nameOr(config.getName(), DEFAULT_NAME), executor, clock);
        if (config.getAgents().isEmpty()) {
            throw new IllegalArgumentException("Parallel pattern requires at least one agent");
        }
        this.config = config;
    }

    @Override
    public PatternStreamingProtocol getStreamingProtocol() {
        return PatternStreamingProtocol.PARALLEL;
    }

    public ParallelConfig getConfig() {
        return config;
    }

    @Override
    protected ParallelResult execute(RunContext context, PromptInput input, Consumer<PatternEvent> events) {
        long startTime = clock.millis();
        TraceContext rootTrace = context.getTraceContext();
        TraceContext phaseTrace = rootTrace.createChild(PHASE);
        String prompt = input.wrap("task", false);

        events.accept(new PatternEvent.PhaseStart(PHASE, trace(phaseTrace)));

        List<CompletableFuture<AgentOutcome>> futures = fanOut(config.getAgents(),
                agent -> invokeRecordingFailure(agent, prompt, context, phaseTrace, PHASE, events));
        List<AgentOutcome> responses = awaitAll(futures);
        context.getCancellation().throwIfCancelled();

        events.accept(new PatternEvent.PhaseEnd(PHASE, clock.millis() - startTime, trace(phaseTrace)));
        events.accept(new PatternEvent.Done(trace(rootTrace)));

        return new ParallelResult(responses, clock.millis() - startTime);
    }
}
