package me.golemcore.council.domain.pattern.debate;

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
import me.golemcore.council.domain.exception.SkillLoadException;
import me.golemcore.council.domain.model.AgentConfig;
import me.golemcore.council.domain.model.DebateMode;
import me.golemcore.council.domain.model.DebatePhase;
import me.golemcore.council.domain.model.DebateRound;
import me.golemcore.council.domain.model.PatternEvent;
import me.golemcore.council.domain.model.PositionChange;
import me.golemcore.council.domain.model.Skill;
import me.golemcore.council.domain.pattern.AbstractPattern;
import me.golemcore.council.domain.pattern.AgentInvocation;
import me.golemcore.council.domain.pattern.PatternExecutors;
import me.golemcore.council.domain.pattern.PatternStreamingProtocol;
import me.golemcore.council.domain.runtime.RunContext;
import me.golemcore.council.domain.runtime.TraceContext;
import me.golemcore.council.port.outbound.SkillLoader;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.function.BiFunction;
import java.util.function.Consumer;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Multi-phase debate between participants, optionally summarized by an
 * orchestrator.
 *
 * <p>
 * Phases run strictly in order: {@code initial}, then in strong mode
 * {@code rebuttal} and {@code revised}, then {@code consensus} when an
 * orchestrator is configured. Within a phase participants speak one at a time
 * in configuration order. Every contribution is appended to a plain transcript
 * that later phases read:
 * <ul>
 * <li>initial: topic only;</li>
 * <li>rebuttal: the other participants' initial positions;</li>
 * <li>revised: the whole transcript so far;</li>
 * <li>consensus: the whole transcript including the topic.</li>
 * </ul>
 *
 * <p>
 * Any failed agent call aborts the debate. Loaded skills are cached by name
 * for the lifetime of this instance.
 */
@Slf4j
public class DebatePattern extends AbstractPattern<DebateInput, DebateResult> {

    public static final String DEFAULT_NAME = "debate";
    static final String REVISION_REASON = "Revised after rebuttal phase";
    private static final String TRANSCRIPT_SEPARATOR = "\n\n---\n\n";
    private static final String TOPIC_ROLE = "user";

    private final DebateConfig config;
    private final SkillLoader skillLoader;
    private final Map<String, Skill> skillCache = new ConcurrentHashMap<>();

    public DebatePattern(DebateConfig config) {
        this(config, PatternExecutors.shared(), Clock.systemUTC());
    }

    public DebatePattern(DebateConfig config, Executor executor, Clock clock) {
        super(nameOr(config.getName(), DEFAULT_NAME), executor, clock);
        validate(config);
        this.config = config;
        this.skillLoader = config.getSkillLoader();
    }

    private static void validate(DebateConfig config) {
        List<AgentConfig> participants = config.getParticipants();
        if (participants.isEmpty()) {
            throw new IllegalArgumentException("Debate requires at least one participant");
        }
        Set<String> names = new HashSet<>();
        for (AgentConfig participant : participants) {
            if (participant.getId() == null || participant.getId().isBlank()) {
                throw new IllegalArgumentException("Debate participant id is required");
            }
            if (participant.getName() == null || participant.getName().isBlank()) {
                throw new IllegalArgumentException("Debate participant " + participant.getId() + " needs a name");
            }
            if (!names.add(participant.getName())) {
                throw new IllegalArgumentException("Duplicate debate participant name: " + participant.getName());
            }
        }
        AgentConfig orchestrator = config.getOrchestrator();
        if (orchestrator != null && (orchestrator.getName() == null || orchestrator.getName().isBlank())) {
            throw new IllegalArgumentException("Debate orchestrator " + orchestrator.getId() + " needs a name");
        }
    }

    @Override
    public PatternStreamingProtocol getStreamingProtocol() {
        return PatternStreamingProtocol.DEBATE;
    }

    public DebateConfig getConfig() {
        return config;
    }

    @Override
    protected DebateResult execute(RunContext context, DebateInput input, Consumer<PatternEvent> events) {
        Instant startTime = clock.instant();
        TraceContext rootTrace = context.getTraceContext();
        DebateRun run = new DebateRun(context, events, input.topic());

        log.info("[Debate] '{}' started: {} participants, mode {}", name, config.getParticipants().size(),
                config.getMode());

        run.participantPhase(DebatePhase.INITIAL, rootTrace.createChild(DebatePhase.INITIAL.getId()),
                (participant, skills) -> DebatePrompts.initial(run.topic, skills), AgentConfig::getName);

        List<PositionChange> positionChanges = new ArrayList<>();
        if (config.getMode() == DebateMode.STRONG) {
            boolean webSearch = config.isUseNativeWebSearch() && config.getToolPhases().contains(DebatePhase.REBUTTAL);
            run.participantPhase(DebatePhase.REBUTTAL, rootTrace.createChild(DebatePhase.REBUTTAL.getId()),
                    (participant, skills) -> DebatePrompts.rebuttal(run.topic, run.othersInitial(participant),
                            webSearch, skills),
                    participant -> participant.getName() + "(rebuttal)");
            run.participantPhase(DebatePhase.REVISED, rootTrace.createChild(DebatePhase.REVISED.getId()),
                    (participant, skills) -> DebatePrompts.revised(run.topic, run.transcript(false), skills),
                    participant -> participant.getName() + "(final)");
            positionChanges.addAll(detectPositionChanges(run, rootTrace));
        }

        String consensus = "";
        if (config.getOrchestrator() != null) {
            consensus = run.consensusPhase(rootTrace.createChild(DebatePhase.CONSENSUS.getId()));
        }

        Instant endTime = clock.instant();
        events.accept(new PatternEvent.Done(trace(rootTrace)));

        long totalDurationMs = Duration.between(startTime, endTime).toMillis();
        log.info("[Debate] '{}' finished: {} rounds, {} position changes, {}ms", name, run.rounds.size(),
                positionChanges.size(), totalDurationMs);

        return new DebateResult(run.topic, config.getMode(), run.rounds, consensus, positionChanges,
                DebateTranscriptAnalyzer.extractDisagreements(consensus),
                new DebateResult.Metadata(startTime, endTime, totalDurationMs, config.getParticipants().size()));
    }

    private List<PositionChange> detectPositionChanges(DebateRun run, TraceContext rootTrace) {
        List<PositionChange> changes = new ArrayList<>();
        for (AgentConfig participant : config.getParticipants()) {
            Optional<String> initial = run.contentOf(DebatePhase.INITIAL, participant.getName());
            Optional<String> revised = run.contentOf(DebatePhase.REVISED, participant.getName());
            if (initial.isEmpty() || revised.isEmpty()) {
                continue;
            }
            if (DebateTranscriptAnalyzer.hasPositionChanged(initial.get(), revised.get())) {
                PositionChange change = new PositionChange(participant.getName(), initial.get(), revised.get(),
                        REVISION_REASON, DebatePhase.REVISED);
                changes.add(change);
                run.events.accept(new PatternEvent.PositionChanged(change, trace(rootTrace)));
                log.debug("[Debate] {} changed position", participant.getName());
            }
        }
        return changes;
    }

    List<Skill> loadSkills(AgentConfig participant) {
        List<Skill> skills = new ArrayList<>();
        for (String skillName : skillNamesFor(participant)) {
            Skill skill = skillCache.get(skillName);
            if (skill == null) {
                skill = loadSkill(skillName);
            }
            if (skill != null) {
                skills.add(skill);
            }
        }
        return skills;
    }

    private Skill loadSkill(String skillName) {
        if (skillLoader == null) {
            log.debug("[Debate] No skill loader configured, skipping skill {}", skillName);
            return null;
        }
        try {
            Skill skill = skillLoader.load(skillName);
            if (skill != null) {
                skillCache.put(skillName, skill);
            }
            return skill;
        } catch (SkillLoadException | RuntimeException e) {
            log.debug("[Debate] Skill {} not loaded: {}", skillName, e.getMessage());
            return null;
        }
    }

    private List<String> skillNamesFor(AgentConfig participant) {
        if (!participant.getSkills().isEmpty()) {
            return participant.getSkills();
        }
        SkillsConfig skills = config.getSkills();
        if (skills == null) {
            return List.of();
        }
        List<String> perParticipant = skills.getParticipants().get(participant.getName());
        if (perParticipant != null && !perParticipant.isEmpty()) {
            return perParticipant;
        }
        return skills.getGlobal();
    }

    private record Turn(String role, String content) {
    }

    /**
     * Mutable state of one debate run, confined to the driver thread.
     */
    private final class DebateRun {

        private final RunContext context;
        private final Consumer<PatternEvent> events;
        private final String topic;
        private final List<DebateRound> rounds = new ArrayList<>();
        private final List<Turn> history = new ArrayList<>();

        private DebateRun(RunContext context, Consumer<PatternEvent> events, String topic) {
            this.context = context;
            this.events = events;
            this.topic = topic;
            history.add(new Turn(TOPIC_ROLE, topic));
        }

        void participantPhase(DebatePhase phase, TraceContext phaseTrace,
                BiFunction<AgentConfig, String, String> promptFor,
                Function<AgentConfig, String> historyRole) {
            long phaseStart = startPhase(phase, phaseTrace);
            for (AgentConfig participant : config.getParticipants()) {
                TraceContext participantTrace = phaseTrace.createChild(participant.getId());
                events.accept(new PatternEvent.DebateRoundStart(phase, participant.getName(), clock.instant(),
                        trace(participantTrace)));

                String skillBlock = SkillPromptBuilder.build(loadSkills(participant), phase);
                String prompt = promptFor.apply(participant, skillBlock);
                AgentInvocation invocation = invoker.invoke(participant, prompt, context.getCancellation(),
                        participantTrace, events);
                String content = invocation.response().getContent();

                addRound(phase, participant.getName(), content);
                history.add(new Turn(historyRole.apply(participant), content));
                events.accept(new PatternEvent.DebateRoundEnd(phase, participant.getName(), content,
                        clock.instant(), trace(participantTrace)));
                log.debug("[Debate] {} round by {} ({} chars)", phase.getId(), participant.getName(),
                        content.length());
            }
            endPhase(phase, phaseTrace, phaseStart);
        }

        String consensusPhase(TraceContext phaseTrace) {
            AgentConfig orchestrator = config.getOrchestrator();
            long phaseStart = startPhase(DebatePhase.CONSENSUS, phaseTrace);
            AgentInvocation invocation = invoker.invoke(orchestrator, DebatePrompts.consensus(transcript(true)),
                    context.getCancellation(), phaseTrace.createChild(orchestrator.getId()), events);
            String consensus = invocation.response().getContent();
            addRound(DebatePhase.CONSENSUS, orchestrator.getName(), consensus);
            endPhase(DebatePhase.CONSENSUS, phaseTrace, phaseStart);
            return consensus;
        }

        private long startPhase(DebatePhase phase, TraceContext phaseTrace) {
            log.info("[Debate] Phase {} started", phase.getId());
            events.accept(new PatternEvent.DebatePhaseStart(phase, clock.instant(), trace(phaseTrace)));
            events.accept(new PatternEvent.PhaseStart(phase.getId(), trace(phaseTrace)));
            return clock.millis();
        }

        private void endPhase(DebatePhase phase, TraceContext phaseTrace, long phaseStart) {
            events.accept(new PatternEvent.PhaseEnd(phase.getId(), clock.millis() - phaseStart, trace(phaseTrace)));
            events.accept(new PatternEvent.DebatePhaseEnd(phase, clock.instant(), trace(phaseTrace)));
        }

        private void addRound(DebatePhase phase, String speaker, String content) {
            rounds.add(new DebateRound(rounds.size() + 1, phase, speaker, content, clock.instant()));
        }

        String othersInitial(AgentConfig participant) {
            return rounds.stream()
                    .filter(round -> round.phase() == DebatePhase.INITIAL)
                    .filter(round -> !round.speaker().equals(participant.getName()))
                    .map(round -> "[" + round.speaker() + "] " + round.content())
                    .collect(Collectors.joining(TRANSCRIPT_SEPARATOR));
        }

        String transcript(boolean includeTopic) {
            return history.stream()
                    .skip(includeTopic ? 0 : 1)
                    .map(turn -> "[" + turn.role() + "] " + turn.content())
                    .collect(Collectors.joining(TRANSCRIPT_SEPARATOR));
        }

        Optional<String> contentOf(DebatePhase phase, String speaker) {
            return rounds.stream()
                    .filter(round -> round.phase() == phase && round.speaker().equals(speaker))
                    .map(DebateRound::content)
                    .filter(content -> !content.isEmpty())
                    .reduce((first, second) -> second);
        }
    }
}
