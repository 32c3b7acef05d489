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

import lombok.extern.slf4j.Slf4j;
import me.golemcore.council.domain.exception.AllAgentsFailedException;
import me.golemcore.council.domain.model.AgentConfig;
import me.golemcore.council.domain.model.PatternEvent;
import me.golemcore.council.domain.runtime.CancellationToken;
import me.golemcore.council.domain.runtime.RunContext;
import me.golemcore.council.domain.runtime.TraceContext;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.function.Consumer;

/**
 * Asks every agent concurrently, then lets a judge synthesize one answer from
 * theirs. Any failure in either stage fails the run; the first agent failure
 * cancels the agents still running.
 */
@Slf4j
public class CrossCheckPattern extends AbstractPattern<PromptInput, CrossCheckResult> {

    public static final String DEFAULT_NAME = "cross-check";
    static final String EXECUTION_PHASE = "parallel-execution";
    static final String JUDGE_PHASE = "judge-evaluation";
    static final String RESPONSES_PLACEHOLDER = "{{responses}}";

    static final String DEFAULT_JUDGE_PROMPT = """
            <role>
            You are an impartial judge evaluating responses from multiple AI agents.
            </role>

            <task>
            Analyze each agent's response and synthesize the best answer.
            </task>

            <evaluation_criteria>
            - Accuracy: Is the information correct?
            - Completeness: Does it fully address the question?
            - Reasoning: Is the logic sound?
            - Clarity: Is it well-explained?
            </evaluation_criteria>

            <agent_responses>
            {{responses}}
            </agent_responses>

            <instructions>
            1. Compare all responses against the evaluation criteria
            2. Identify consensus points and disagreements
            3. Synthesize the strongest elements into a final answer
            4. If significant disagreement exists, explain your reasoning
            </instructions>

            <output_format>
            Provide your synthesized answer directly. Be concise but thorough.
            </output_format>""";

    private final CrossCheckConfig config;
    private final String judgeTemplate;

    public CrossCheckPattern(CrossCheckConfig config) {
        this(config, PatternExecutors.shared(), Clock.systemUTC());
    }

    public CrossCheckPattern(CrossCheckConfig config, Executor executor, Clock clock) {
        super(nameOr(config.getName(), DEFAULT_NAME), executor, clock);
        if (config.getAgents().isEmpty()) {
            throw new IllegalArgumentException("Cross-check pattern requires at least one agent");
        }
        Objects.requireNonNull(config.getJudge(), "judge");
        this.config = config;
        this.judgeTemplate = config.getJudgePromptTemplate() != null ? config.getJudgePromptTemplate()
                : DEFAULT_JUDGE_PROMPT;
    }

    @Override
    public PatternStreamingProtocol getStreamingProtocol() {
        return PatternStreamingProtocol.CROSS_CHECK;
    }

    public CrossCheckConfig getConfig() {
        return config;
    }

    @Override
    protected CrossCheckResult execute(RunContext context, PromptInput input, Consumer<PatternEvent> events) {
        long startTime = clock.millis();
        TraceContext rootTrace = context.getTraceContext();
        TraceContext executionTrace = rootTrace.createChild(EXECUTION_PHASE);
        String prompt = input.wrap("question", true);

        events.accept(new PatternEvent.PhaseStart(EXECUTION_PHASE, trace(executionTrace)));

        CancellationToken stageCancellation = context.getCancellation().createLinked();
        List<CompletableFuture<AgentOutcome>> futures = fanOut(config.getAgents(), agent -> AgentOutcome.success(
                agent.getId(), invoker.invoke(agent, prompt, stageCancellation,
                        executionTrace.createChild(agent.getId()), events)));
        List<AgentOutcome> outcomes = awaitAllFailFast(futures, () -> {
            log.debug("[CrossCheck] Agent failed, cancelling the remaining agents");
            stageCancellation.cancel("Another cross-check agent failed");
        });

        events.accept(new PatternEvent.PhaseEnd(EXECUTION_PHASE, clock.millis() - startTime,
                trace(executionTrace)));

        if (outcomes.stream().allMatch(outcome -> outcome.content().isEmpty())) {
            throw new AllAgentsFailedException("No cross-check agent produced a response");
        }

        TraceContext judgeTrace = rootTrace.createChild(JUDGE_PHASE);
        events.accept(new PatternEvent.PhaseStart(JUDGE_PHASE, trace(judgeTrace)));

        String judgePrompt = "<original_question>\n" + input.prompt() + "\n</original_question>\n\n"
                + buildJudgePrompt(judgeTemplate, outcomes);
        AgentConfig judge = config.getJudge();
        AgentInvocation verdict = invoker.invoke(judge, judgePrompt, context.getCancellation(),
                judgeTrace.createChild(judge.getId()), events);

        events.accept(new PatternEvent.PhaseEnd(JUDGE_PHASE, verdict.durationMs(), trace(judgeTrace)));

        double agreement = AgentAgreement.jaccard(outcomes.stream().map(AgentOutcome::content).toList());
        events.accept(new PatternEvent.Done(trace(rootTrace)));

        return new CrossCheckResult(verdict.response().getContent(), outcomes, verdict.response(), agreement,
                clock.millis() - startTime);
    }

    static String buildJudgePrompt(String template, List<AgentOutcome> outcomes) {
        List<String> blocks = new ArrayList<>(outcomes.size());
        for (int i = 0; i < outcomes.size(); i++) {
            AgentOutcome outcome = outcomes.get(i);
            blocks.add("<agent id=\"" + escape(outcome.agentId()) + "\" index=\"" + (i + 1) + "\">\n"
                    + escape(outcome.content()) + "\n</agent>");
        }
        String responses = String.join("\n\n", blocks);
        int at = template.indexOf(RESPONSES_PLACEHOLDER);
        if (at < 0) {
            return template + "\n\n" + responses;
        }
        return template.substring(0, at) + responses + template.substring(at + RESPONSES_PLACEHOLDER.length());
    }

    static String escape(String text) {
        return text.replace("&", "&amp;")
                .replace("<", "&lt;")
                .replace(">", "&gt;")
                .replace("\"", "&quot;");
    }
}
