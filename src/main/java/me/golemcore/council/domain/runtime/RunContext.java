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
import me.golemcore.council.port.outbound.UsageTrackingPort;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Per-run bundle of cancellation, budget, trace and usage session.
 *
 * <p>
 * Create one per top-level pattern run with {@link #builder()}. Nested work
 * gets a {@link #createChild(String) child} that shares the budget and
 * session, links its cancellation to this context and traces one level
 * deeper.
 */
public final class RunContext {

    public static final String DEFAULT_ROOT_SPAN = "root";

    private final CancellationToken cancellation;
    private final BudgetTracker budget;
    private final TraceContext traceContext;
    private final UsageTrackingPort session;
    private final Map<String, Object> metadata;

    private RunContext(CancellationToken cancellation, BudgetTracker budget, TraceContext traceContext,
            UsageTrackingPort session, Map<String, Object> metadata) {
        this.cancellation = cancellation;
        this.budget = budget;
        this.traceContext = traceContext;
        this.session = session;
        this.metadata = metadata != null ? Map.copyOf(metadata) : Map.of();
    }

    /**
     * Builds a context. A budget tracker is created from {@code budget} and
     * {@code pricing} unless {@code budgetTracker} is given; without either the
     * run is not budgeted. With a {@code parentTraceContext} the root span is a
     * child of it, otherwise a new trace starts.
     */
    @Builder
    private static RunContext create(CancellationToken parentCancellation, Budget budget,
            BudgetTracker budgetTracker, PricingCatalog pricing, TraceContext parentTraceContext,
            String rootSpanName, UsageTrackingPort session, Map<String, Object> metadata) {
        CancellationToken token = parentCancellation != null
                ? parentCancellation.createLinked()
                : new CancellationToken();

        BudgetTracker tracker = budgetTracker;
        if (tracker == null && budget != null) {
            tracker = new DefaultBudgetTracker(budget, pricing != null ? pricing : MapPricingCatalog.empty());
        }

        String spanName = rootSpanName != null ? rootSpanName : DEFAULT_ROOT_SPAN;
        TraceContext trace = parentTraceContext != null
                ? parentTraceContext.createChild(spanName)
                : TraceContext.root(spanName);

        return new RunContext(token, tracker, trace, session, metadata);
    }

    /**
     * Context with a fresh token and trace and nothing else.
     */
    public static RunContext noop() {
        return builder().build();
    }

    public RunContext createChild(String name) {
        return new RunContext(cancellation.createLinked(), budget, traceContext.createChild(name), session,
                new LinkedHashMap<>(metadata));
    }

    public void cancel(String reason) {
        cancellation.cancel(reason);
    }

    public CancellationToken getCancellation() {
        return cancellation;
    }

    public Optional<BudgetTracker> getBudget() {
        return Optional.ofNullable(budget);
    }

    public TraceContext getTraceContext() {
        return traceContext;
    }

    public Optional<UsageTrackingPort> getSession() {
        return Optional.ofNullable(session);
    }

    public Map<String, Object> getMetadata() {
        return metadata;
    }
}
