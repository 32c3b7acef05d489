package me.golemcore.council.usage;

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

import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.council.domain.model.LlmUsage;
import me.golemcore.council.domain.model.UsageStats;
import me.golemcore.council.port.outbound.UsageTrackingPort;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;

/**
 * In-memory {@link UsageTrackingPort}: keeps every recorded turn and
 * aggregates them per provider and per {@code provider/model}. Nothing is
 * persisted. Records older than the retention period are rejected on arrival
 * and evicted hourly.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class InMemoryUsageTracker implements UsageTrackingPort {

    private static final String UNKNOWN = "unknown";
    private static final String PATH_SEPARATOR = "/";
    private static final String LOG_PREFIX = "[Usage]";
    private static final long DEFAULT_AVERAGE_LATENCY = 0L;

    private static final int RETENTION_DAYS = 30;
    private static final int EVICTION_INTERVAL_HOURS = 1;
    private static final int EXECUTOR_TERMINATION_TIMEOUT_SECONDS = 2;

    static final Duration RETENTION_PERIOD = Duration.ofDays(RETENTION_DAYS);

    private final Clock clock;

    private final Map<String, List<LlmUsage>> usageByProvider = new ConcurrentHashMap<>();

    private final ScheduledExecutorService evictionExecutor = Executors.newSingleThreadScheduledExecutor(r -> {
        Thread t = new Thread(r, "usage-eviction");
        t.setDaemon(true);
        return t;
    });

    @PostConstruct
    void init() {
        evictionExecutor.scheduleAtFixedRate(this::evictOldRecords,
                EVICTION_INTERVAL_HOURS, EVICTION_INTERVAL_HOURS, TimeUnit.HOURS);
    }

    @PreDestroy
    void destroy() {
        evictionExecutor.shutdownNow();
        try {
            evictionExecutor.awaitTermination(EXECUTOR_TERMINATION_TIMEOUT_SECONDS, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    @Override
    public void recordUsage(String providerId, String model, LlmUsage usage) {
        if (usage == null) {
            return;
        }
        LlmUsage stored = usage.toBuilder()
                .providerId(providerId)
                .model(model)
                .timestamp(usage.getTimestamp() != null ? usage.getTimestamp() : clock.instant())
                .build();
        if (stored.getTimestamp().isBefore(retentionCutoff())) {
            log.debug("{} Ignoring usage older than {}d retention: provider={}, timestamp={}", LOG_PREFIX,
                    RETENTION_DAYS, providerId, stored.getTimestamp());
            return;
        }
        String provider = providerId != null ? providerId : UNKNOWN;
        usageByProvider.computeIfAbsent(provider, k -> new CopyOnWriteArrayList<>()).add(stored);
        log.debug("{} Recorded usage: provider={}, model={}, tokens={}, latency={}ms", LOG_PREFIX, provider,
                model, stored.getTotalTokens(), stored.getLatency() != null ? stored.getLatency().toMillis() : "N/A");
    }

    public UsageStats getStats(String providerId, Duration period) {
        List<LlmUsage> usages = usageByProvider.getOrDefault(providerId, Collections.emptyList());
        return aggregateUsages(providerId, filterByPeriod(usages, period));
    }

    public Map<String, UsageStats> getAllStats(Duration period) {
        Map<String, UsageStats> stats = new HashMap<>();
        for (Map.Entry<String, List<LlmUsage>> entry : usageByProvider.entrySet()) {
            stats.put(entry.getKey(), aggregateUsages(entry.getKey(), filterByPeriod(entry.getValue(), period)));
        }
        return stats;
    }

    /**
     * Usage grouped by {@code providerId/model}.
     */
    public Map<String, UsageStats> getStatsByModel(Duration period) {
        List<LlmUsage> allUsages = new ArrayList<>();
        for (List<LlmUsage> providerUsages : usageByProvider.values()) {
            allUsages.addAll(providerUsages);
        }
        Map<String, List<LlmUsage>> grouped = filterByPeriod(allUsages, period).stream()
                .collect(Collectors.groupingBy(u -> {
                    String provider = u.getProviderId() != null ? u.getProviderId() : UNKNOWN;
                    String model = u.getModel() != null ? u.getModel() : UNKNOWN;
                    return provider + PATH_SEPARATOR + model;
                }));
        Map<String, UsageStats> result = new HashMap<>();
        for (Map.Entry<String, List<LlmUsage>> entry : grouped.entrySet()) {
            result.put(entry.getKey(), aggregateUsages(entry.getKey(), entry.getValue()));
        }
        return result;
    }

    public void clear() {
        usageByProvider.clear();
    }

    void evictOldRecords() {
        Instant cutoff = retentionCutoff();
        int evicted = 0;
        for (List<LlmUsage> usages : usageByProvider.values()) {
            int before = usages.size();
            usages.removeIf(u -> u.getTimestamp().isBefore(cutoff));
            evicted += before - usages.size();
        }
        if (evicted > 0) {
            log.debug("{} Evicted {} records beyond {}d retention", LOG_PREFIX, evicted, RETENTION_DAYS);
        }
    }

    private Instant retentionCutoff() {
        return clock.instant().minus(RETENTION_PERIOD);
    }

    private List<LlmUsage> filterByPeriod(List<LlmUsage> usages, Duration period) {
        Instant cutoff = clock.instant().minus(period);
        return usages.stream()
                .filter(u -> u.getTimestamp() != null && !u.getTimestamp().isBefore(cutoff))
                .toList();
    }

    private UsageStats aggregateUsages(String key, List<LlmUsage> usages) {
        if (usages.isEmpty()) {
            return UsageStats.empty(key);
        }
        long totalInput = usages.stream().mapToLong(LlmUsage::getInputTokens).sum();
        long totalOutput = usages.stream().mapToLong(LlmUsage::getOutputTokens).sum();
        long avgLatencyMs = (long) usages.stream()
                .filter(u -> u.getLatency() != null)
                .mapToLong(u -> u.getLatency().toMillis())
                .average()
                .orElse(DEFAULT_AVERAGE_LATENCY);

        Map<String, Long> requestsByModel = usages.stream()
                .filter(u -> u.getModel() != null)
                .collect(Collectors.groupingBy(LlmUsage::getModel, Collectors.counting()));
        Map<String, Long> tokensByModel = usages.stream()
                .filter(u -> u.getModel() != null)
                .collect(Collectors.groupingBy(LlmUsage::getModel,
                        Collectors.summingLong(LlmUsage::getTotalTokens)));
        String primaryModel = requestsByModel.entrySet().stream()
                .max(Map.Entry.comparingByValue())
                .map(Map.Entry::getKey)
                .orElse(null);

        return UsageStats.builder()
                .providerId(key)
                .model(primaryModel)
                .totalRequests(usages.size())
                .totalInputTokens(totalInput)
                .totalOutputTokens(totalOutput)
                .totalTokens(totalInput + totalOutput)
                .avgLatency(Duration.ofMillis(avgLatencyMs))
                .requestsByModel(requestsByModel)
                .tokensByModel(tokensByModel)
                .build();
    }
}
