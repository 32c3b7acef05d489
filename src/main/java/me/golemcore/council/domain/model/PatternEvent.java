package me.golemcore.council.domain.model;

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

import java.time.Instant;

/**
 * Event emitted on a pattern run's event stream. Every variant carries the
 * trace of the span it was emitted from.
 */
public sealed interface PatternEvent permits PatternEvent.AgentStart, PatternEvent.AgentEnd,
        PatternEvent.AgentOutput, PatternEvent.ErrorEvent, PatternEvent.PhaseStart, PatternEvent.PhaseEnd,
        PatternEvent.DebatePhaseStart, PatternEvent.DebatePhaseEnd, PatternEvent.DebateRoundStart,
        PatternEvent.DebateRoundEnd, PatternEvent.PositionChanged, PatternEvent.Done {

    PatternEventType type();

    EventTrace trace();

    record AgentStart(String agentId, String agentName, EventTrace trace) implements PatternEvent {
        @Override
        public PatternEventType type() {
            return PatternEventType.AGENT_START;
        }
    }

    record AgentEnd(String agentId, long durationMs, EventTrace trace) implements PatternEvent {
        @Override
        public PatternEventType type() {
            return PatternEventType.AGENT_END;
        }
    }

    /**
     * Capability event forwarded verbatim from a running agent.
     */
    record AgentOutput(String agentId, AgentEvent event, EventTrace trace) implements PatternEvent {
        @Override
        public PatternEventType type() {
            return PatternEventType.AGENT_OUTPUT;
        }
    }

    record ErrorEvent(String message, ErrorAttribution attribution, EventTrace trace) implements PatternEvent {
        @Override
        public PatternEventType type() {
            return PatternEventType.ERROR;
        }
    }

    record PhaseStart(String phase, EventTrace trace) implements PatternEvent {
        @Override
        public PatternEventType type() {
            return PatternEventType.PHASE_START;
        }
    }

    record PhaseEnd(String phase, long durationMs, EventTrace trace) implements PatternEvent {
        @Override
        public PatternEventType type() {
            return PatternEventType.PHASE_END;
        }
    }

    record DebatePhaseStart(DebatePhase phase, Instant timestamp, EventTrace trace) implements PatternEvent {
        @Override
        public PatternEventType type() {
            return PatternEventType.DEBATE_PHASE_START;
        }
    }

    record DebatePhaseEnd(DebatePhase phase, Instant timestamp, EventTrace trace) implements PatternEvent {
        @Override
        public PatternEventType type() {
            return PatternEventType.DEBATE_PHASE_END;
        }
    }

    record DebateRoundStart(DebatePhase phase, String participant, Instant timestamp, EventTrace trace)
            implements PatternEvent {
        @Override
        public PatternEventType type() {
            return PatternEventType.DEBATE_ROUND_START;
        }
    }

    record DebateRoundEnd(DebatePhase phase, String participant, String content, Instant timestamp,
            EventTrace trace) implements PatternEvent {
        @Override
        public PatternEventType type() {
            return PatternEventType.DEBATE_ROUND_END;
        }
    }

    record PositionChanged(PositionChange change, EventTrace trace) implements PatternEvent {
        @Override
        public PatternEventType type() {
            return PatternEventType.POSITION_CHANGED;
        }
    }

    /**
     * Last event of every run, emitted after the result is known.
     */
    record Done(EventTrace trace) implements PatternEvent {
        @Override
        public PatternEventType type() {
            return PatternEventType.DONE;
        }
    }
}
