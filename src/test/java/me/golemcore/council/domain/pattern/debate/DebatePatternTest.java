package me.golemcore.council.domain.pattern.debate;

import me.golemcore.council.domain.exception.SkillLoadException;
import me.golemcore.council.domain.model.AgentConfig;
import me.golemcore.council.domain.model.DebateMode;
import me.golemcore.council.domain.model.DebatePhase;
import me.golemcore.council.domain.model.DebateRound;
import me.golemcore.council.domain.model.PatternEvent;
import me.golemcore.council.domain.model.PatternEventType;
import me.golemcore.council.domain.model.Skill;
import me.golemcore.council.domain.pattern.PatternRunHandle;
import me.golemcore.council.domain.runtime.RunContext;
import me.golemcore.council.port.outbound.SkillLoader;
import me.golemcore.council.testsupport.PatternRuns;
import me.golemcore.council.testsupport.ScriptedAgentModel;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class DebatePatternTest {

    private static final String TOPIC = "Which database should we use?";

    private static AgentConfig participant(String id, String name, ScriptedAgentModel model) {
        return AgentConfig.builder().id(id).name(name).model(model).build();
    }

    private static ScriptedAgentModel byPhase(String initial, String rebuttal, String revised) {
        return ScriptedAgentModel.responding(request -> {
            String prompt = request.lastUserContent();
            if (prompt.contains("Your role: Critical Reviewer")) {
                return rebuttal;
            }
            if (prompt.contains("Discussion so far:")) {
                return revised;
            }
            return initial;
        });
    }

    @Test
    void shouldRunOnlyInitialAndConsensusInWeakMode() throws Exception {
        DebatePattern pattern = new DebatePattern(DebateConfig.builder()
                .participant(participant("claude", "Claude", ScriptedAgentModel.replying("Postgres")))
                .participant(participant("gpt", "GPT", ScriptedAgentModel.replying("MySQL")))
                .orchestrator(participant("mod", "Moderator", ScriptedAgentModel.replying("Summary")))
                .mode(DebateMode.WEAK)
                .build());

        PatternRuns.Completed<DebateResult> run = PatternRuns.complete(
                pattern.run(RunContext.noop(), new DebateInput(TOPIC)));

        List<DebateRound> rounds = run.result().rounds();
        assertEquals(3, rounds.size());
        assertEquals(List.of(DebatePhase.INITIAL, DebatePhase.INITIAL, DebatePhase.CONSENSUS),
                rounds.stream().map(DebateRound::phase).toList());
        assertEquals(List.of(1, 2, 3), rounds.stream().map(DebateRound::roundNumber).toList());
        assertEquals("Moderator", rounds.get(2).speaker());
        assertEquals("Summary", run.result().consensus());
        assertTrue(run.result().positionChanges().isEmpty());
        assertEquals(2, run.result().metadata().participantCount());
    }

    @Test
    void shouldRunAllPhasesInOrderInStrongMode() throws Exception {
        DebatePattern pattern = new DebatePattern(DebateConfig.builder()
                .participant(participant("a", "A", byPhase("init-a", "reb-a", "rev-a")))
                .participant(participant("b", "B", byPhase("init-b", "reb-b", "rev-b")))
                .participant(participant("c", "C", byPhase("init-c", "reb-c", "rev-c")))
                .orchestrator(participant("mod", "Moderator", ScriptedAgentModel.replying("Summary")))
                .build());

        PatternRuns.Completed<DebateResult> run = PatternRuns.complete(
                pattern.run(RunContext.noop(), new DebateInput(TOPIC)));

        List<String> contents = run.result().rounds().stream().map(DebateRound::content).toList();
        assertEquals(List.of("init-a", "init-b", "init-c", "reb-a", "reb-b", "reb-c", "rev-a", "rev-b", "rev-c",
                "Summary"), contents);

        List<DebatePhase> phaseStarts = run.eventsOf(PatternEvent.DebatePhaseStart.class).stream()
                .map(PatternEvent.DebatePhaseStart::phase).toList();
        assertEquals(List.of(DebatePhase.INITIAL, DebatePhase.REBUTTAL, DebatePhase.REVISED, DebatePhase.CONSENSUS),
                phaseStarts);
        assertEquals(PatternEventType.DONE, run.events().get(run.events().size() - 1).type());
    }

    @Test
    void shouldShowOnlyOtherInitialPositionsInRebuttal() throws Exception {
        ScriptedAgentModel first = byPhase("Postgres", "r1", "v1");
        DebatePattern pattern = new DebatePattern(DebateConfig.builder()
                .participant(participant("a", "A", first))
                .participant(participant("b", "B", byPhase("MySQL", "r2", "v2")))
                .build());

        PatternRuns.complete(pattern.run(RunContext.noop(), new DebateInput(TOPIC)));

        String rebuttalPrompt = first.getRequests().get(1).lastUserContent();
        assertTrue(rebuttalPrompt.contains("Other experts' opinions:\n[B] MySQL\n\n"));
        assertFalse(rebuttalPrompt.contains("Postgres"));

        String revisedPrompt = first.getRequests().get(2).lastUserContent();
        assertTrue(revisedPrompt.contains("[A] Postgres\n\n---\n\n[B] MySQL\n\n---\n\n[A(rebuttal)] r1"));
        assertFalse(revisedPrompt.contains("[user]"));
    }

    @Test
    void shouldIncludeTopicInConsensusTranscript() throws Exception {
        ScriptedAgentModel moderator = ScriptedAgentModel.replying("Summary");
        DebatePattern pattern = new DebatePattern(DebateConfig.builder()
                .participant(participant("a", "A", ScriptedAgentModel.replying("Postgres")))
                .orchestrator(participant("mod", "Moderator", moderator))
                .mode(DebateMode.WEAK)
                .build());

        PatternRuns.complete(pattern.run(RunContext.noop(), new DebateInput(TOPIC)));

        assertTrue(moderator.lastPrompt().contains("[user] " + TOPIC + "\n\n---\n\n[A] Postgres"));
    }

    @Test
    void shouldRecordPositionChange() throws Exception {
        DebatePattern pattern = new DebatePattern(DebateConfig.builder()
                .participant(participant("a", "A", byPhase("Postgres", "r", "After reviewing, MySQL.")))
                .participant(participant("b", "B", byPhase("MySQL", "r", "Still MySQL.")))
                .build());

        PatternRuns.Completed<DebateResult> run = PatternRuns.complete(
                pattern.run(RunContext.noop(), new DebateInput(TOPIC)));

        assertEquals(1, run.result().positionChanges().size());
        assertEquals("A", run.result().positionChanges().get(0).participant());
        assertEquals("Postgres", run.result().positionChanges().get(0).from());
        assertEquals("After reviewing, MySQL.", run.result().positionChanges().get(0).to());
        assertEquals(DebatePattern.REVISION_REASON, run.result().positionChanges().get(0).reason());
        assertEquals(1, run.eventsOf(PatternEvent.PositionChanged.class).size());
        assertEquals("", run.result().consensus());
    }

    @Test
    void shouldExtractDisagreementsFromConsensus() throws Exception {
        DebatePattern pattern = new DebatePattern(DebateConfig.builder()
                .participant(participant("a", "A", ScriptedAgentModel.replying("x")))
                .orchestrator(participant("mod", "Moderator", ScriptedAgentModel.replying(
                        "Unresolved disagreements:\n- Hosting cost\n- Team skills\nFinal recommendation: go")))
                .mode(DebateMode.WEAK)
                .build());

        PatternRuns.Completed<DebateResult> run = PatternRuns.complete(
                pattern.run(RunContext.noop(), new DebateInput(TOPIC)));

        assertEquals(List.of("Hosting cost", "Team skills"), run.result().unresolvedDisagreements());
    }

    @Test
    void shouldTraceParticipantUnderPhaseSpan() throws Exception {
        DebatePattern pattern = new DebatePattern(DebateConfig.builder()
                .participant(participant("claude", "Claude", ScriptedAgentModel.replying("x")))
                .build());
        RunContext context = RunContext.noop();

        PatternRuns.Completed<DebateResult> run = PatternRuns.complete(pattern.run(context, new DebateInput(TOPIC)));

        String traceId = context.getTraceContext().getTraceId();
        assertTrue(run.events().stream().allMatch(event -> traceId.equals(event.trace().traceId())));
        List<List<String>> agentPaths = run.eventsOf(PatternEvent.AgentStart.class).stream()
                .map(event -> event.trace().path()).toList();
        assertEquals(List.of(List.of("root", "initial", "claude"), List.of("root", "rebuttal", "claude"),
                List.of("root", "revised", "claude")), agentPaths);
    }

    @Test
    void shouldLoadEachSkillOnceAcrossPhases() throws Exception {
        SkillLoader loader = mock(SkillLoader.class);
        when(loader.load("db-expert")).thenReturn(Skill.builder()
                .name("db-expert")
                .description("Database know-how")
                .instructions("Think about indexes.")
                .frontmatter(Map.of())
                .location(Path.of("skills/db-expert/SKILL.md"))
                .build());
        ScriptedAgentModel model = ScriptedAgentModel.replying("x");
        DebatePattern pattern = new DebatePattern(DebateConfig.builder()
                .participant(participant("a", "A", model))
                .skills(SkillsConfig.builder().globalSkill("db-expert").build())
                .skillLoader(loader)
                .build());

        PatternRuns.complete(pattern.run(RunContext.noop(), new DebateInput(TOPIC)));

        verify(loader, times(1)).load("db-expert");
        assertTrue(model.getRequests().get(0).lastUserContent().contains("<activation-phase>initial"));
        assertTrue(model.getRequests().get(2).lastUserContent().contains("<activation-phase>revised"));
    }

    @Test
    void shouldSkipSkillsThatFailToLoad() throws Exception {
        SkillLoader loader = mock(SkillLoader.class);
        when(loader.load(anyString())).thenThrow(new SkillLoadException("missing", "not found"));
        ScriptedAgentModel model = ScriptedAgentModel.replying("x");
        DebatePattern pattern = new DebatePattern(DebateConfig.builder()
                .participant(participant("a", "A", model))
                .skills(SkillsConfig.builder().participant("A", List.of("missing")).build())
                .skillLoader(loader)
                .mode(DebateMode.WEAK)
                .build());

        PatternRuns.complete(pattern.run(RunContext.noop(), new DebateInput(TOPIC)));

        assertFalse(model.lastPrompt().contains("<skills_context>"));
    }

    @Test
    void shouldAddWebSearchInstructionsOnlyForRebuttalToolPhase() throws Exception {
        ScriptedAgentModel model = byPhase("i", "r", "v");
        DebatePattern pattern = new DebatePattern(DebateConfig.builder()
                .participant(participant("a", "A", model))
                .participant(participant("b", "B", byPhase("i", "r", "v")))
                .toolPhase(DebatePhase.REBUTTAL)
                .useNativeWebSearch(true)
                .build());

        PatternRuns.complete(pattern.run(RunContext.noop(), new DebateInput(TOPIC)));

        assertFalse(model.getRequests().get(0).lastUserContent().contains("webSearch"));
        assertTrue(model.getRequests().get(1).lastUserContent().contains("use the webSearch tool"));
    }

    @Test
    void shouldAbortDebateWhenParticipantFails() {
        ScriptedAgentModel second = ScriptedAgentModel.replying("never");
        DebatePattern pattern = new DebatePattern(DebateConfig.builder()
                .participant(participant("a", "A",
                        ScriptedAgentModel.failing(new IllegalStateException("provider down"))))
                .participant(participant("b", "B", second))
                .build());

        PatternRunHandle<DebateResult> handle = pattern.run(RunContext.noop(), new DebateInput(TOPIC));
        PatternRuns.drain(handle);

        ExecutionException error = assertThrows(ExecutionException.class,
                () -> handle.result().get(5, TimeUnit.SECONDS));
        assertInstanceOf(IllegalStateException.class, error.getCause());
        assertEquals(0, second.getCallCount());
    }

    @Test
    void shouldRejectDuplicateParticipantNames() {
        DebateConfig config = DebateConfig.builder()
                .participant(participant("a", "Same", ScriptedAgentModel.replying("x")))
                .participant(participant("b", "Same", ScriptedAgentModel.replying("y")))
                .build();

        assertThrows(IllegalArgumentException.class, () -> new DebatePattern(config));
    }

    @Test
    void shouldRejectOrchestratorWithoutName() {
        DebateConfig config = DebateConfig.builder()
                .participant(participant("a", "A", ScriptedAgentModel.replying("x")))
                .orchestrator(participant("mod", null, ScriptedAgentModel.replying("Summary")))
                .build();

        IllegalArgumentException error = assertThrows(IllegalArgumentException.class,
                () -> new DebatePattern(config));
        assertEquals("Debate orchestrator mod needs a name", error.getMessage());
    }

    @Test
    void shouldRecordConsensusUnderOrchestratorName() throws Exception {
        DebatePattern pattern = new DebatePattern(DebateConfig.builder()
                .participant(participant("claude", "Claude", ScriptedAgentModel.replying("Postgres")))
                .orchestrator(participant("moderator-agent", "Chair", ScriptedAgentModel.replying("Summary")))
                .mode(DebateMode.WEAK)
                .build());

        DebateResult result = PatternRuns.complete(pattern.run(RunContext.noop(), new DebateInput(TOPIC))).result();

        DebateRound consensus = result.rounds().get(result.rounds().size() - 1);
        assertEquals(DebatePhase.CONSENSUS, consensus.phase());
        assertEquals("Chair", consensus.speaker());
    }

    @Test
    void shouldRejectBlankTopic() {
        assertThrows(IllegalArgumentException.class, () -> new DebateInput(" "));
    }
}
