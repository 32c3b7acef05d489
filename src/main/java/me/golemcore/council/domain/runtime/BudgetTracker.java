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

import me.golemcore.council.domain.model.LlmUsage;

/**
 * Accumulates token, cost and duration usage of a run and reports whether a
 * configured ceiling has been crossed. Usage never decreases.
 */
public interface BudgetTracker {

    /**
     * Adds the tokens of one agent turn and their estimated cost.
     */
    void recordTokens(LlmUsage usage, String provider, String model);

    void recordDuration(long durationMs);

    boolean isExceeded();

    BudgetUsage getUsage();

    Budget getBudget();
}
