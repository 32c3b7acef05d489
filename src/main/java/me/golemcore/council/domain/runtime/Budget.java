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

import lombok.Builder;
import lombok.Value;

/**
 * Resource ceilings for one top-level run. A {@code null} or non-positive
 * limit is not enforced.
 */
@Value
@Builder
public class Budget {

    Long maxTokens;
    Double maxCostUsd;
    Long maxDurationMs;

    public static Budget unlimited() {
        return Budget.builder().build();
    }

    public boolean hasTokenLimit() {
        return maxTokens != null && maxTokens > 0;
    }

    public boolean hasCostLimit() {
        return maxCostUsd != null && maxCostUsd > 0;
    }

    public boolean hasDurationLimit() {
        return maxDurationMs != null && maxDurationMs > 0;
    }
}
