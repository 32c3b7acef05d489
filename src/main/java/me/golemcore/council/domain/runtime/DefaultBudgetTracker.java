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
import me.golemcore.council.domain.model.LlmUsage;

import java.util.Objects;

/**
 * Thread-safe {@link BudgetTracker}. A ceiling counts as exceeded once usage
 * is strictly above it.
 */
@Slf4j
public class DefaultBudgetTracker implements BudgetTracker {

    private final Budget budget;
    private final PricingCatalog pricing;

    private long totalTokens;
    private double estimatedCostUsd;
    private long durationMs;

    public DefaultBudgetTracker(Budget budget, PricingCatalog pricing) {
        this.budget = Objects.requireNonNull(budget, "budget");
        this.pricing = Objects.requireNonNull(pricing, "pricing");
    }

    @Override
    public synchronized void recordTokens(LlmUsage usage, String provider, String model) {
        if (usage == null) {
            return;
        }
        long input = Math.max(0, usage.getInputTokens());
        long output = Math.max(0, usage.getOutputTokens());
        long total = usage.getTotalTokens() > 0 ? usage.getTotalTokens() : input + output;
        totalTokens += total;
        double cost = pricing.estimateCost(provider, model, input, output);
        if (cost > 0) {
            estimatedCostUsd += cost;
        }
        log.trace("[Budget] +{} tokens, +${} ({}/{})", total, cost, provider, model);
    }

    @Override
    public synchronized void recordDuration(long durationMs) {
        if (durationMs > 0) {
            this.durationMs += durationMs;
        }
    }

    @Override
    public synchronized boolean isExceeded() {
        if (budget.hasTokenLimit() && totalTokens > budget.getMaxTokens()) {
            return true;
        }
        if (budget.hasCostLimit() && estimatedCostUsd > budget.getMaxCostUsd()) {
            return true;
        }
        return budget.hasDurationLimit() && durationMs > budget.getMaxDurationMs();
    }

    @Override
    public synchronized BudgetUsage getUsage() {
        return new BudgetUsage(totalTokens, estimatedCostUsd, durationMs);
    }

    @Override
    public Budget getBudget() {
        return budget;
    }
}
