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

import me.golemcore.council.domain.model.AgentConfig;
import me.golemcore.council.domain.model.PatternEvent;
import me.golemcore.council.domain.runtime.RunContext;
import me.golemcore.council.domain.runtime.TraceContext;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Executor;
import java.util.function.Consumer;

/**
 * Runs agents one after another. Any failure aborts the chain.
 */
public class SequentialPattern extends AbstractPattern<PromptInput, SequentialResult> {

    public static final String DEFAULT_NAME = "sequential";
    static final String PHASE = "sequential-execution";

    private final SequentialConfig config;

    public SequentialPattern(SequentialConfig config) {
        this(config, PatternExecutors.shared(), Clock.systemUTC());
    }

    public SequentialPattern(SequentialConfig config, Executor executor, Clock clock) {
        super(nameOr(config.getName(), DEFAULT_NAME), executor, clock);
        if (config.getAgents().isEmpty()) {
            throw new IllegalArgumentException("Sequential pattern requires at least one agent");
        }
        this.config = config;
    }

    @Override
    public PatternStreamingProtocol getStreamingProtocol() {
        return PatternStreamingProtocol.SEQUENTIAL;
    }

    public SequentialConfig getConfig() {
        return config;
    }

    @Override
    protected SequentialResult execute(RunContext context, PromptInput input, Consumer<PatternEvent> events) {
        long startTime = clock.millis();
        TraceContext rootTrace = context.getTraceContext();
        TraceContext phaseTrace = rootTrace.createChild(PHASE);
        String task = input.wrap("task", false);

        events.accept(new PatternEvent.PhaseStart(PHASE, trace(phaseTrace)));

        List<SequentialResult.Step> steps = new ArrayList<>();
        for (AgentConfig agent : config.getAgents()) {
            String stepPrompt = task;
            if (config.isPassContext() && !steps.isEmpty()) {
                String previous = steps.get(steps.size() - 1).response().getContent();
                stepPrompt = "<previous_output>\n" + previous + "\n</previous_output>\n\n<current_task>\n"
                        + task + "\n</current_task>";
            }
            AgentInvocation invocation = invoker.invoke(agent, stepPrompt, context.getCancellation(),
                    phaseTrace.createChild(agent.getId()), events);
            steps.add(new SequentialResult.Step(agent.getId(), stepPrompt, invocation.response(),
                    invocation.durationMs()));
        }

        events.accept(new PatternEvent.PhaseEnd(PHASE, clock.millis() - startTime, trace(phaseTrace)));
        events.accept(new PatternEvent.Done(trace(rootTrace)));

        String finalAnswer = steps.get(steps.size() - 1).response().getContent();
        return new SequentialResult(finalAnswer, steps, clock.millis() - startTime);
    }
}
