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

import lombok.Builder;
import lombok.Value;

import java.time.Duration;

/**
 * Policy of the {@link AgentExecutor}. Retries use a fixed delay and are off
 * by default.
 */
@Value
@Builder
public class ExecutorConfig {

    @Builder.Default
    Duration timeout = Duration.ofSeconds(120);

    @Builder.Default
    boolean retryEnabled = false;

    @Builder.Default
    int maxRetries = 3;

    @Builder.Default
    Duration retryDelay = Duration.ofSeconds(1);

    public static ExecutorConfig defaults() {
        return ExecutorConfig.builder().build();
    }

    public int maxAttempts() {
        return retryEnabled ? Math.max(0, maxRetries) + 1 : 1;
    }
}
