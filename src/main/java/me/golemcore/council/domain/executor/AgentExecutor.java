package me.golemcore.council.domain.executor;

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
import me.golemcore.council.domain.exception.AgentTimeoutException;
import me.golemcore.council.domain.exception.BudgetExceededException;
import me.golemcore.council.domain.exception.CouncilException;
import me.golemcore.council.domain.exception.RunCancelledException;
import me.golemcore.council.domain.model.AgentEvent;
import me.golemcore.council.domain.model.AgentRequest;
import me.golemcore.council.domain.model.AgentResponse;
import me.golemcore.council.domain.model.LlmUsage;
import me.golemcore.council.domain.runtime.BudgetTracker;
import me.golemcore.council.domain.runtime.CancellationToken;
import me.golemcore.council.domain.runtime.RunContext;
import me.golemcore.council.port.outbound.AgentModel;
import me.golemcore.council.port.outbound.AgentRun;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;

import java.time.Clock;
import java.time.Duration;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Decorates an {@link AgentModel} for one {@link RunContext}.
 *
 * <p>
 * Each call checks the run's budget before it is issued, is bounded by the
 * configured timeout and, when enabled, is retried with a fixed delay. A call
 * is never retried after cancellation or a budget breach. Successful calls
 * record their tokens in the budget and in the run's usage session; every
 * attempt records its duration.
 */
@Slf4j
public class AgentExecutor implements AgentModel {

    private final AgentModel delegate;
    private final ExecutorConfig config;
    private final RunContext context;
    private final Executor executor;
    private final Clock clock;

    public AgentExecutor(AgentModel delegate, ExecutorConfig config, RunContext context, Executor executor,
            Clock clock) {
        this.delegate = Objects.requireNonNull(delegate, "delegate");
        this.config = Objects.requireNonNull(config, "config");
        this.context = Objects.requireNonNull(context, "context");
        this.executor = Objects.requireNonNull(executor, "executor");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    @Override
    public String getProviderId() {
        return delegate.getProviderId();
    }

    @Override
    public String getModel() {
        return delegate.getModel();
    }

    public AgentModel getDelegate() {
        return delegate;
    }

    @Override
    public AgentRun run(AgentRequest request, CancellationToken cancellation) {
        ExecutedRun run = new ExecutedRun(cancellation);
        try {
            executor.execute(() -> run.drive(request));
        } catch (RejectedExecutionException e) {
            run.finish(null, e);
        }
        return run;
    }

    AgentResponse execute(AgentRequest request, CancellationToken cancellation, Sinks.Many<AgentEvent> events)
            throws Exception {
        int maxAttempts = config.maxAttempts();
        for (int attempt = 1;; attempt++) {
            cancellation.throwIfCancelled();
            checkBudget();
            long start = clock.millis();
            try {
                AgentResponse response = attempt(request, cancellation, events);
                recordDuration(clock.millis() - start);
                recordUsage(response, clock.millis() - start);
                return response;
            } catch (RunCancelledException | BudgetExceededException e) {
                recordDuration(clock.millis() - start);
                throw e;
            } catch (Exception e) {
                recordDuration(clock.millis() - start);
                if (cancellation.isCancelled()) {
                    throw new RunCancelledException(cancellation.getReason(), e);
                }
                if (attempt >= maxAttempts) {
                    if (maxAttempts > 1) {
                        log.warn("[Executor] {}/{} failed after {} attempts: {}", getProviderId(), getModel(),
                                attempt, e.getMessage());
                    }
                    throw e;
                }
                log.warn("[Executor] {}/{} attempt {}/{} failed: {}, retrying in {}ms", getProviderId(), getModel(),
                        attempt, maxAttempts, e.getMessage(), config.getRetryDelay().toMillis());
                if (cancellation.awaitCancellation(config.getRetryDelay())) {
                    throw new RunCancelledException(cancellation.getReason(), e);
                }
            }
        }
    }

    private AgentResponse attempt(AgentRequest request, CancellationToken cancellation,
            Sinks.Many<AgentEvent> events) throws Exception {
        Duration timeout = config.getTimeout();
        long deadline = System.nanoTime() + timeout.toNanos();
        CancellationToken attemptToken = cancellation.createLinked();
        AgentRun run = delegate.run(request, attemptToken);
        try (CancellationToken.Registration ignored = attemptToken
                .onCancel(() -> run.cancel(attemptToken.getReason()))) {
            drainEvents(run.events(), timeout, events);
            long remaining = Math.max(0, deadline - System.nanoTime());
            return run.result().get(remaining, TimeUnit.NANOSECONDS);
        } catch (TimeoutException e) {
            attemptToken.cancel("Timed out after " + timeout.toMillis() + "ms");
            throw new AgentTimeoutException(getProviderId() + "/" + getModel(), timeout);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            attemptToken.cancel("Interrupted");
            throw new RunCancelledException("Interrupted", e);
        } catch (CancellationException e) {
            throw new RunCancelledException(cancellation.getReason(), e);
        } catch (ExecutionException e) {
            throw unwrap(e);
        }
    }

    private void drainEvents(Flux<AgentEvent> source, Duration timeout, Sinks.Many<AgentEvent> events)
            throws TimeoutException {
        Throwable failure = source
                .doOnNext(event -> emit(events, event))
                .then(Mono.<Throwable>empty())
                .timeout(timeout)
                .onErrorResume(Mono::just)
                .block();
        if (failure instanceof TimeoutException timeoutException) {
            throw timeoutException;
        }
        if (failure != null) {
            log.debug("[Executor] Event stream of {} failed: {}", getModel(), failure.getMessage());
        }
    }

    private void checkBudget() {
        Optional<BudgetTracker> budget = context.getBudget();
        if (budget.isPresent() && budget.get().isExceeded()) {
            log.warn("[Executor] Budget exceeded before calling {}/{}: {}", getProviderId(), getModel(),
                    budget.get().getUsage());
            throw new BudgetExceededException(budget.get().getUsage());
        }
    }

    private void recordDuration(long durationMs) {
        context.getBudget().ifPresent(budget -> budget.recordDuration(durationMs));
    }

    private void recordUsage(AgentResponse response, long durationMs) {
        if (!response.hasUsage()) {
            return;
        }
        LlmUsage usage = response.getUsage().toBuilder()
                .providerId(getProviderId())
                .model(getModel())
                .latency(response.getUsage().getLatency() != null ? response.getUsage().getLatency()
                        : Duration.ofMillis(durationMs))
                .timestamp(clock.instant())
                .build();
        context.getBudget().ifPresent(budget -> budget.recordTokens(usage, getProviderId(), getModel()));
        context.getSession().ifPresent(session -> session.recordUsage(getProviderId(), getModel(), usage));
        log.debug("[Executor] Usage: {} input, {} output tokens", usage.getInputTokens(), usage.getOutputTokens());
    }

    private static void emit(Sinks.Many<AgentEvent> events, AgentEvent event) {
        synchronized (events) {
            events.tryEmitNext(event);
        }
    }

    private static Exception unwrap(ExecutionException e) {
        Throwable cause = e.getCause() != null ? e.getCause() : e;
        if (cause instanceof Exception exception) {
            return exception;
        }
        if (cause instanceof Error error) {
            throw error;
        }
        return new CouncilException(cause.getMessage(), cause);
    }

    /**
     * {@link AgentRun} returned to callers; its events span all attempts.
     */
    private final class ExecutedRun implements AgentRun {

        private final Sinks.Many<AgentEvent> events = Sinks.many().unicast().onBackpressureBuffer();
        private final CompletableFuture<AgentResponse> result = new CompletableFuture<>();
        private final CancellationToken cancellation;

        private ExecutedRun(CancellationToken cancellation) {
            this.cancellation = cancellation.createLinked();
        }

        void drive(AgentRequest request) {
            try {
                finish(execute(request, cancellation, events), null);
            } catch (Exception | Error e) { // NOSONAR - the outcome goes to result()
                finish(null, e);
            }
        }

        void finish(AgentResponse response, Throwable failure) {
            synchronized (events) {
                events.tryEmitComplete();
            }
            if (failure != null) {
                result.completeExceptionally(failure);
            } else {
                result.complete(response);
            }
        }

        @Override
        public Flux<AgentEvent> events() {
            return events.asFlux();
        }

        @Override
        public CompletableFuture<AgentResponse> result() {
            return result;
        }

        @Override
        public void cancel(String reason) {
            cancellation.cancel(reason);
        }
    }
}
