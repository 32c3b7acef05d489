package me.golemcore.council.domain.runtime;

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

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.security.SecureRandom;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Immutable position in a run's call tree.
 *
 * <p>
 * The trace id stays the same for the whole tree; every context created from
 * another one gets a fresh span id. Ids follow the usual 128-bit trace / 64-bit
 * span convention (32 and 16 lower-case hex characters). They are unique within
 * the process: a random per-process seed is mixed with a counter through a
 * bijection, so no two calls return the same value.
 */
@Getter
@EqualsAndHashCode
@ToString
public final class TraceContext {

    private static final long MIX_MULTIPLIER = 0x9E3779B97F4A7C15L;
    private static final long PROCESS_SEED;
    private static final long TRACE_PREFIX;
    private static final AtomicLong SEQUENCE = new AtomicLong();

    static {
        SecureRandom random = new SecureRandom();
        PROCESS_SEED = random.nextLong();
        long prefix;
        do {
            prefix = random.nextLong();
        } while (prefix == 0L);
        TRACE_PREFIX = prefix;
    }

    private final String traceId;
    private final String spanId;
    private final String parentSpanId;
    private final List<String> path;

    private TraceContext(String traceId, String spanId, String parentSpanId, List<String> path) {
        this.traceId = traceId;
        this.spanId = spanId;
        this.parentSpanId = parentSpanId;
        this.path = List.copyOf(path);
    }

    /**
     * Starts a new trace whose path is {@code [name]}.
     */
    public static TraceContext root(String name) {
        Objects.requireNonNull(name, "name");
        return new TraceContext(toHex(TRACE_PREFIX) + nextId(), nextId(), null, List.of(name));
    }

    /**
     * Creates a nested span: same trace, parent set to this span, {@code name}
     * appended to the path.
     */
    public TraceContext createChild(String name) {
        Objects.requireNonNull(name, "name");
        List<String> childPath = new ArrayList<>(path.size() + 1);
        childPath.addAll(path);
        childPath.add(name);
        return new TraceContext(traceId, nextId(), spanId, childPath);
    }

    /**
     * Creates a span next to this one under the same parent.
     */
    public TraceContext createSibling() {
        return new TraceContext(traceId, nextId(), parentSpanId, path);
    }

    /**
     * Creates a sibling span whose last path segment is replaced by
     * {@code name}.
     */
    public TraceContext createSibling(String name) {
        if (name == null) {
            return createSibling();
        }
        List<String> siblingPath = new ArrayList<>(path);
        if (siblingPath.isEmpty()) {
            siblingPath.add(name);
        } else {
            siblingPath.set(siblingPath.size() - 1, name);
        }
        return new TraceContext(traceId, nextId(), parentSpanId, siblingPath);
    }

    public String getName() {
        return path.isEmpty() ? "" : path.get(path.size() - 1);
    }

    public int getDepth() {
        return path.size();
    }

    static String nextId() {
        long value;
        do {
            value = SEQUENCE.incrementAndGet() * MIX_MULTIPLIER + PROCESS_SEED;
        } while (value == 0L);
        return toHex(value);
    }

    private static String toHex(long value) {
        return String.format("%016x", value);
    }
}
