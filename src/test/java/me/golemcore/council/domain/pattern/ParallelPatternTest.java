package me.golemcore.council.domain.pattern;

import me.golemcore.council.domain.model.AgentConfig;
import me.golemcore.council.domain.model.PatternEvent;
import me.golemcore.council.domain.model.PatternEventType;
import me.golemcore.council.domain.runtime.RunContext;
import me.golemcore.council.testsupport.PatternRuns;
import me.golemcore.council.testsupport.ScriptedAgentModel;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ParallelPatternTest {

    @Test
    void shouldRecordFailureAndKeepOtherResponses() throws Exception {
        ParallelPattern pattern = new ParallelPattern(ParallelConfig.builder()
                .agent(AgentConfig.builder().id("ok").model(ScriptedAgentModel.replying("answer")).build())
                .agent(AgentConfig.builder().id("broken")
                        .model(ScriptedAgentModel.failing(new IllegalStateException("rate limited"))
                                .as("openai", "gpt-4o"))
                        .build())
                .build());

        PatternRuns.Completed<ParallelResult> run = PatternRuns.complete(
                pattern.run(RunContext.noop(), PromptInput.of("question")));

        Map<String, AgentOutcome> byAgent = run.result().responses().stream()
                .collect(Collectors.toMap(AgentOutcome::agentId, Function.identity()));
        assertTrue(byAgent.get("ok").success());
        assertEquals("answer", byAgent.get("ok").content());
        assertFalse(byAgent.get("broken").success());
        assertEquals("rate limited", byAgent.get("broken").error());
        assertEquals("", byAgent.get("broken").content());
        assertEquals(1, run.result().successful().size());

        PatternEvent.ErrorEvent error = run.eventsOf(PatternEvent.ErrorEvent.class).get(0);
        assertEquals("broken", error.attribution().agentId());
        assertEquals("openai", error.attribution().provider());
        assertEquals("gpt-4o", error.attribution().model());
        assertEquals(ParallelPattern.PHASE, error.attribution().phase());
        assertEquals(PatternEventType.DONE, run.events().get(run.events().size() - 1).type());
    }

    @Test
    void shouldRunAgentsConcurrently() throws Exception {
        ParallelConfig.ParallelConfigBuilder builder = ParallelConfig.builder();
        for (int i = 0; i < 4; i++) {
            builder.agent(AgentConfig.builder().id("agent-" + i)
                    .model(ScriptedAgentModel.replying("r" + i).withDelay(Duration.ofMillis(300)))
                    .build());
        }
        ParallelPattern pattern = new ParallelPattern(builder.build());

        long start = System.currentTimeMillis();
        PatternRuns.Completed<ParallelResult> run = PatternRuns.complete(
                pattern.run(RunContext.noop(), PromptInput.of("go")));
        long elapsed = System.currentTimeMillis() - start;

        assertEquals(4, run.result().successful().size());
        assertTrue(elapsed < 1000, "expected concurrent execution, took " + elapsed + "ms");
    }

    @Test
    void shouldTraceEachAgentUnderExecutionPhase() throws Exception {
        ParallelPattern pattern = new ParallelPattern(ParallelConfig.builder()
                .agent(AgentConfig.builder().id("a").model(ScriptedAgentModel.replying("x")).build())
                .agent(AgentConfig.builder().id("b").model(ScriptedAgentModel.replying("y")).build())
                .build());
        RunContext context = RunContext.noop();

        PatternRuns.Completed<ParallelResult> run = PatternRuns.complete(pattern.run(context, PromptInput.of("go")));

        List<List<String>> paths = run.eventsOf(PatternEvent.AgentStart.class).stream()
                .map(event -> event.trace().path())
                .sorted((left, right) -> left.get(2).compareTo(right.get(2)))
                .toList();
        assertEquals(List.of(List.of("root", "parallel-execution", "a"), List.of("root", "parallel-execution", "b")),
                paths);
        String traceId = context.getTraceContext().getTraceId();
        assertTrue(run.events().stream().allMatch(event -> traceId.equals(event.trace().traceId())));
    }
}
