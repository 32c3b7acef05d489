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

import me.golemcore.council.domain.runtime.TraceContext;

import java.time.Clock;
import java.time.Instant;
import java.util.List;

/**
 * Trace stamp carried by every {@link PatternEvent}.
 */
public record EventTrace(String traceId, String spanId, String parentSpanId, List<String> path,
        Instant timestamp) {

    public EventTrace {
        path = List.copyOf(path);
    }

    public static EventTrace of(TraceContext context, Clock clock) {
        return new EventTrace(context.getTraceId(), context.getSpanId(), context.getParentSpanId(),
                context.getPath(), Instant.now(clock));
    }
}
