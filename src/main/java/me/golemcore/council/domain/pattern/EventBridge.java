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
import me.golemcore.council.domain.model.PatternEvent;
import me.golemcore.council.domain.runtime.CancellationToken;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Sinks;

import java.util.concurrent.Callable;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

/**
 * Connects a pattern's driver task to its consumers.
 *
 * <p>
 * The driver pushes events from any thread; they are buffered without bound
 * and delivered in push order to the single subscriber of {@link #events()}.
 * When the driver returns or throws, the stream completes and then
 * {@link #result()} settles with the driver's value or original exception.
 * Events pushed after that are dropped.
 */
@Slf4j
public final class EventBridge<O> implements PatternRunHandle<O> {

    private final Sinks.Many<PatternEvent> sink = Sinks.many().unicast().onBackpressureBuffer();
    private final CompletableFuture<O> result = new CompletableFuture<>();
    private final CancellationToken cancellation;
    private boolean closed;

    public EventBridge(CancellationToken cancellation) {
        this.cancellation = cancellation;
    }

    public synchronized void push(PatternEvent event) {
        if (closed) {
            log.trace("[Bridge] Dropping {} pushed after completion", event.type());
            return;
        }
        Sinks.EmitResult emitResult = sink.tryEmitNext(event);
        if (emitResult.isFailure()) {
            log.debug("[Bridge] Failed to emit {}: {}", event.type(), emitResult);
        }
    }

    /**
     * Runs {@code driver} on {@code executor}. Returns this bridge as the run's
     * handle.
     */
    public EventBridge<O> start(Executor executor, Callable<O> driver) {
        try {
            executor.execute(() -> drive(driver));
        } catch (RejectedExecutionException e) {
            close();
            result.completeExceptionally(e);
        }
        return this;
    }

    private void drive(Callable<O> driver) {
        O value = null;
        Throwable failure = null;
        try {
            value = driver.call();
        } catch (Exception | Error e) { // NOSONAR - the driver outcome goes to result()
            failure = unwrap(e);
        }
        close();
        if (failure != null) {
            result.completeExceptionally(failure);
        } else {
            result.complete(value);
        }
    }

    private synchronized void close() {
        if (!closed) {
            closed = true;
            sink.tryEmitComplete();
        }
    }

    @Override
    public Flux<PatternEvent> events() {
        return sink.asFlux();
    }

    @Override
    public CompletableFuture<O> result() {
        return result;
    }

    @Override
    public void cancel(String reason) {
        cancellation.cancel(reason);
    }

    /**
     * Strips {@link CompletionException} and {@link ExecutionException} layers.
     */
    static Throwable unwrap(Throwable throwable) {
        Throwable current = throwable;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
                && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }
}
