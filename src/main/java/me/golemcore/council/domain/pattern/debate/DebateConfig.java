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

import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import me.golemcore.council.domain.model.AgentConfig;
import me.golemcore.council.domain.model.DebateMode;
import me.golemcore.council.domain.model.DebatePhase;
import me.golemcore.council.port.outbound.SkillLoader;

import java.util.List;
import java.util.Set;

/**
 * Debate configuration.
 *
 * <p>
 * Without an {@code orchestrator} the consensus phase is skipped.
 * {@code maxRounds} and {@code timeoutMs} are advisory and not enforced by the
 * pattern. Web-search instructions are added to the rebuttal prompt only when
 * {@code toolPhases} contains {@link DebatePhase#REBUTTAL} and
 * {@code useNativeWebSearch} is set.
 */
@Value
@Builder
public class DebateConfig {

    String name;
    String description;

    @Singular
    List<AgentConfig> participants;

    AgentConfig orchestrator;

    @Builder.Default
    DebateMode mode = DebateMode.STRONG;

    @Builder.Default
    int maxRounds = 10;

    @Builder.Default
    long timeoutMs = 300_000;

    @Builder.Default
    SkillsConfig skills = SkillsConfig.none();

    @Singular
    Set<DebatePhase> toolPhases;

    boolean useNativeWebSearch;

    SkillLoader skillLoader;
}
