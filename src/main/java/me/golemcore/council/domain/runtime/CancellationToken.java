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

import lombok.extern.slf4j.Slf4j;
import me.golemcore.council.domain.exception.RunCancelledException;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * Cooperative cancellation signal threaded through a run's call tree.
 *
 * <p>
 * Cancelling is idempotent and the first reason wins. Listeners registered
 * through {@link #onCancel(Runnable)} run once, on the cancelling thread, or
 * immediately when the token is already cancelled.
 */
@Slf4j
public final class CancellationToken {

    private final CountDownLatch cancelled = new CountDownLatch(1);
    private final List<Runnable> listeners = new CopyOnWriteArrayList<>();
    private volatile String reason;

    /**
     * Handle returned by {@link #onCancel(Runnable)}; closing it removes the
     * listener.
     */
    @FunctionalInterface
    public interface Registration extends AutoCloseable {
        @Override
        void close();
    }

    public void cancel(String reason) {
        synchronized (this) {
            if (isCancelled()) {
                return;
            }
            this.reason = reason != null ? reason : "Cancelled";
            cancelled.countDown();
        }
        for (Runnable listener : listeners) {
            runListener(listener);
        }
        listeners.clear();
    }

    public boolean isCancelled() {
        return cancelled.getCount() == 0;
    }

    public String getReason() {
        return reason;
    }

    public void throwIfCancelled() {
        if (isCancelled()) {
            throw new RunCancelledException(reason);
        }
    }

    public Registration onCancel(Runnable listener) {
        synchronized (this) {
            if (!isCancelled()) {
                listeners.add(listener);
                return () -> listeners.remove(listener);
            }
        }
        runListener(listener);
        return () -> {
        };
    }

    /**
     * Returns a token that is cancelled whenever this one is, but can also be
     * cancelled on its own without affecting this token.
     */
    public CancellationToken createLinked() {
        CancellationToken child = new CancellationToken();
        Registration registration = onCancel(() -> child.cancel(reason));
        child.onCancel(registration::close);
        return child;
    }

    /**
     * Waits up to {@code timeout} for cancellation.
     *
     * @return {@code true} if the token was cancelled
     */
    public boolean awaitCancellation(Duration timeout) throws InterruptedException {
        return cancelled.await(timeout.toMillis(), TimeUnit.MILLISECONDS);
    }

    private void runListener(Runnable listener) {
        try {
            listener.run();
        } catch (RuntimeException e) {
            log.warn("[Cancel] Listener failed: {}", e.getMessage(), e);
        }
    }
}
