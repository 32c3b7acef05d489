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

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Executors for pattern drivers and agent calls.
 *
 * <p>
 * Drivers block on agent calls running on the same executor, so the pool must
 * be able to grow; a fixed-size pool can deadlock.
 */
public final class PatternExecutors {

    private static final ExecutorService SHARED = newCachedExecutor("council-pattern");

    private PatternExecutors() {
    }

    public static ExecutorService shared() {
        return SHARED;
    }

    public static ExecutorService newCachedExecutor(String prefix) {
        return Executors.newCachedThreadPool(daemonThreads(prefix));
    }

    static ThreadFactory daemonThreads(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, prefix + "-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}
