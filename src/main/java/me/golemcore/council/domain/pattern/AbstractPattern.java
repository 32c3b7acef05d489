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
import me.golemcore.council.domain.exception.CouncilException;
import me.golemcore.council.domain.exception.RunCancelledException;
import me.golemcore.council.domain.model.AgentConfig;
import me.golemcore.council.domain.model.ErrorAttribution;
import me.golemcore.council.domain.model.EventTrace;
import me.golemcore.council.domain.model.PatternEvent;
import me.golemcore.council.domain.runtime.RunContext;
import me.golemcore.council.domain.runtime.TraceContext;
import me.golemcore.council.port.outbound.AgentModel;
import org.slf4j.MDC;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.function.Consumer;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * Base class of all patterns: runs {@link #execute} on the executor behind an
 * {@link EventBridge} and offers helpers for fanning agent calls out.
 */
@Slf4j
public abstract class AbstractPattern<I, O> implements Pattern<I, O> {

    static final String MDC_TRACE_ID = "traceId";
    static final String MDC_PATTERN = "pattern";

    protected final String name;
    protected final Executor executor;
    protected final Clock clock;
    protected final AgentInvoker invoker;

    protected AbstractPattern(String name, Executor executor, Clock clock) {
        this.name = Objects.requireNonNull(name, "name");
        this.executor = Objects.requireNonNull(executor, "executor");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.invoker = new AgentInvoker(clock);
    }

    @Override
    public String getName() {
        return name;
    }

    @Override
    public PatternRunHandle<O> run(RunContext context, I input) {
        Objects.requireNonNull(context, "context");
        Objects.requireNonNull(input, "input");
        EventBridge<O> bridge = new EventBridge<>(context.getCancellation());
        return bridge.start(executor, () -> {
            MDC.put(MDC_TRACE_ID, context.getTraceContext().getTraceId());
            MDC.put(MDC_PATTERN, name);
            long start = clock.millis();
            try {
                log.info("[Pattern] {} started", name);
                O result = execute(context, input, bridge::push);
                log.info("[Pattern] {} completed in {}ms", name, clock.millis() - start);
                return result;
            } catch (RuntimeException e) {
                log.warn("[Pattern] {} failed after {}ms: {}", name, clock.millis() - start, e.getMessage());
                throw e;
            } finally {
                MDC.remove(MDC_TRACE_ID);
                MDC.remove(MDC_PATTERN);
            }
        });
    }

    /**
     * Drives one run. Runs on the pattern executor; {@code events} may be
     * called from any thread.
     */
    protected abstract O execute(RunContext context, I input, Consumer<PatternEvent> events);

    protected EventTrace trace(TraceContext traceContext) {
        return EventTrace.of(traceContext, clock);
    }

    protected static String nameOr(String configured, String defaultName) {
        return configured != null && !configured.isBlank() ? configured : defaultName;
    }

    /**
     * Invokes one agent and turns a failure into an unsuccessful
     * {@link AgentOutcome} plus an {@code ErrorEvent}.
     */
    protected AgentOutcome invokeRecordingFailure(AgentConfig agent, String prompt, RunContext context,
            TraceContext phaseTrace, String phase, Consumer<PatternEvent> events) {
        TraceContext agentTrace = phaseTrace.createChild(agent.getId());
        try {
            AgentInvocation invocation = invoker.invoke(agent, prompt, context.getCancellation(), agentTrace,
                    events);
            return AgentOutcome.success(agent.getId(), invocation);
        } catch (RuntimeException e) {
            String error = AgentOutcome.describe(e);
            log.warn("[Pattern] {}: agent {} failed: {}", name, agent.getId(), error);
            AgentModel model = agent.getModel();
            ErrorAttribution attribution = new ErrorAttribution(agent.getId(),
                    model != null ? model.getProviderId() : null, model != null ? model.getModel() : null, phase);
            events.accept(new PatternEvent.ErrorEvent(error, attribution, trace(agentTrace)));
            return AgentOutcome.failure(agent.getId(), error);
        }
    }

    /**
     * Starts {@code call} for every agent on the executor, in configuration
     * order.
     */
    protected <T> List<CompletableFuture<T>> fanOut(List<AgentConfig> agents, Function<AgentConfig, T> call) {
        Map<String, String> mdc = MDC.getCopyOfContextMap();
        List<CompletableFuture<T>> futures = new ArrayList<>(agents.size());
        for (AgentConfig agent : agents) {
            futures.add(CompletableFuture.supplyAsync(withMdc(mdc, () -> call.apply(agent)), executor));
        }
        return futures;
    }

    /**
     * Waits for every future; once all have finished, a failure of any of them
     * is rethrown.
     */
    protected static <T> List<T> awaitAll(List<CompletableFuture<T>> futures) {
        await(CompletableFuture.allOf(futures.toArray(new CompletableFuture<?>[0])));
        return futures.stream().map(CompletableFuture::join).toList();
    }

    /**
     * Waits for every future but fails as soon as one of them fails.
     * {@code onFirstFailure} runs once, before the failure is rethrown.
     */
    protected static <T> List<T> awaitAllFailFast(List<CompletableFuture<T>> futures, Runnable onFirstFailure) {
        CompletableFuture<Void> gate = new CompletableFuture<>();
        for (CompletableFuture<T> future : futures) {
            future.whenComplete((value, error) -> {
                if (error != null && gate.completeExceptionally(EventBridge.unwrap(error))) {
                    onFirstFailure.run();
                }
            });
        }
        CompletableFuture.allOf(futures.toArray(new CompletableFuture<?>[0])).whenComplete((value, error) -> {
            if (error != null) {
                gate.completeExceptionally(EventBridge.unwrap(error));
            } else {
                gate.complete(null);
            }
        });
        await(gate);
        return futures.stream().map(CompletableFuture::join).toList();
    }

    private static void await(CompletableFuture<?> future) {
        try {
            future.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new RunCancelledException("Interrupted while waiting for agents", e);
        } catch (ExecutionException e) {
            throw rethrow(EventBridge.unwrap(e));
        }
    }

    private static RuntimeException rethrow(Throwable failure) {
        if (failure instanceof RuntimeException runtimeException) {
            return runtimeException;
        }
        if (failure instanceof Error error) {
            throw error;
        }
        return new CouncilException(failure.getMessage(), failure);
    }

    private static <T> Supplier<T> withMdc(Map<String, String> mdc, Supplier<T> supplier) {
        return () -> {
            if (mdc != null) {
                MDC.setContextMap(mdc);
            }
            try {
                return supplier.get();
            } finally {
                MDC.clear();
            }
        };
    }
}
