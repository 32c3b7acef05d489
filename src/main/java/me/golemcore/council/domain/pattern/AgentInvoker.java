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
import me.golemcore.council.domain.exception.AgentInvocationException;
import me.golemcore.council.domain.exception.RunCancelledException;
import me.golemcore.council.domain.model.AgentConfig;
import me.golemcore.council.domain.model.AgentRequest;
import me.golemcore.council.domain.model.AgentResponse;
import me.golemcore.council.domain.model.EventTrace;
import me.golemcore.council.domain.model.Message;
import me.golemcore.council.domain.model.PatternEvent;
import me.golemcore.council.domain.runtime.CancellationToken;
import me.golemcore.council.domain.runtime.TraceContext;
import me.golemcore.council.port.outbound.AgentRun;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.function.Consumer;

/**
 * Runs one agent turn on behalf of a pattern.
 *
 * <p>
 * Emits {@code AgentStart}, forwards every capability event as
 * {@code AgentOutput}, waits for the final response and emits
 * {@code AgentEnd}, all stamped with the caller's trace. Failures of the
 * capability are rethrown as they are: unchecked causes unchanged, checked
 * causes wrapped once in {@link AgentInvocationException}. There is no retry
 * here.
 */
@Slf4j
public class AgentInvoker {

    private final Clock clock;

    public AgentInvoker(Clock clock) {
        this.clock = clock;
    }

    public AgentInvocation invoke(AgentConfig agent, String prompt, CancellationToken cancellation,
            TraceContext trace, Consumer<PatternEvent> events) {
        cancellation.throwIfCancelled();

        long startTime = clock.millis();
        String agentId = agent.getId();

        List<Message> messages = new ArrayList<>(2);
        if (agent.hasSystemPrompt()) {
            messages.add(Message.system(agent.getSystemPrompt()));
        }
        messages.add(Message.user(prompt));

        events.accept(new PatternEvent.AgentStart(agentId, agent.getDisplayName(), EventTrace.of(trace, clock)));
        log.debug("[Agent] {} started ({} messages)", agentId, messages.size());

        AgentRun run = agent.getModel().run(AgentRequest.of(messages), cancellation);
        try (CancellationToken.Registration ignored = cancellation
                .onCancel(() -> run.cancel(cancellation.getReason()))) {
            run.events()
                    .doOnNext(event -> events.accept(
                            new PatternEvent.AgentOutput(agentId, event, EventTrace.of(trace, clock))))
                    .onErrorResume(e -> {
                        log.debug("[Agent] {} event stream failed: {}", agentId, e.getMessage());
                        return Mono.empty();
                    })
                    .blockLast();

            AgentResponse response = awaitResponse(agentId, run, cancellation);
            long durationMs = clock.millis() - startTime;
            events.accept(new PatternEvent.AgentEnd(agentId, durationMs, EventTrace.of(trace, clock)));
            log.debug("[Agent] {} finished in {}ms", agentId, durationMs);
            return new AgentInvocation(response, durationMs);
        }
    }

    private AgentResponse awaitResponse(String agentId, AgentRun run, CancellationToken cancellation) {
        try {
            return run.result().get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            run.cancel("Interrupted");
            throw new RunCancelledException("Interrupted while waiting for agent " + agentId, e);
        } catch (CancellationException e) {
            throw new RunCancelledException(cancellation.getReason(), e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            if (cause instanceof RuntimeException runtimeException) {
                throw runtimeException;
            }
            if (cause instanceof Error error) {
                throw error;
            }
            throw new AgentInvocationException(agentId, cause);
        }
    }
}
