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

/**
 * Describes how a pattern's event stream behaves.
 */
public record PatternStreamingProtocol(EventOrdering eventOrdering,
        CancellationPropagation cancellationPropagation, boolean supportsReplay) {

    public enum EventOrdering {
        /** Events follow the order in which work was started. */
        CAUSAL,
        /** Events from concurrent agents interleave in arrival order. */
        ARRIVAL
    }

    public enum CancellationPropagation {
        IMMEDIATE,
        GRACEFUL,
        BEST_EFFORT
    }

    public static final PatternStreamingProtocol DEFAULT = new PatternStreamingProtocol(EventOrdering.ARRIVAL,
            CancellationPropagation.BEST_EFFORT, false);

    public static final PatternStreamingProtocol SEQUENTIAL = new PatternStreamingProtocol(EventOrdering.CAUSAL,
            CancellationPropagation.IMMEDIATE, false);

    public static final PatternStreamingProtocol PARALLEL = DEFAULT;

    public static final PatternStreamingProtocol ENSEMBLE = DEFAULT;

    public static final PatternStreamingProtocol CROSS_CHECK = new PatternStreamingProtocol(
            EventOrdering.ARRIVAL, CancellationPropagation.GRACEFUL, false);

    public static final PatternStreamingProtocol DEBATE = new PatternStreamingProtocol(EventOrdering.CAUSAL,
            CancellationPropagation.GRACEFUL, false);
}
