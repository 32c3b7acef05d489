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

import me.golemcore.council.domain.model.DebateMode;
import me.golemcore.council.domain.model.DebateRound;
import me.golemcore.council.domain.model.PositionChange;

import java.time.Instant;
import java.util.List;

/**
 * Final output of a debate. {@code consensus} is empty when no orchestrator
 * was configured.
 */
public record DebateResult(String topic, DebateMode mode, List<DebateRound> rounds, String consensus,
        List<PositionChange> positionChanges, List<String> unresolvedDisagreements, Metadata metadata) {

    public DebateResult {
        rounds = List.copyOf(rounds);
        positionChanges = List.copyOf(positionChanges);
        unresolvedDisagreements = List.copyOf(unresolvedDisagreements);
    }

    public record Metadata(Instant startTime, Instant endTime, long totalDurationMs, int participantCount) {
    }
}
