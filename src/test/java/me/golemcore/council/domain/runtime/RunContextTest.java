package me.golemcore.council.domain.runtime;

import me.golemcore.council.domain.model.LlmUsage;
import me.golemcore.council.port.outbound.UsageTrackingPort;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.mock;

class RunContextTest {

    @Test
    void shouldCreateUnbudgetedContextByDefault() {
        RunContext context = RunContext.noop();

        assertTrue(context.getBudget().isEmpty());
        assertTrue(context.getSession().isEmpty());
        assertEquals(List.of("root"), context.getTraceContext().getPath());
        assertFalse(context.getCancellation().isCancelled());
    }

    @Test
    void shouldCreateTrackerFromBudget() {
        RunContext context = RunContext.builder()
                .budget(Budget.builder().maxTokens(10L).build())
                .build();

        BudgetTracker tracker = context.getBudget().orElseThrow();
        tracker.recordTokens(LlmUsage.of(20, 0), "p", "m");

        assertTrue(tracker.isExceeded());
    }

    @Test
    void shouldShareBudgetAndSessionWithChild() {
        UsageTrackingPort session = mock(UsageTrackingPort.class);
        RunContext parent = RunContext.builder()
                .budget(Budget.unlimited())
                .session(session)
                .metadata(Map.of("user", "alice"))
                .build();

        RunContext child = parent.createChild("nested");

        assertSame(parent.getBudget().orElseThrow(), child.getBudget().orElseThrow());
        assertSame(session, child.getSession().orElseThrow());
        assertEquals("alice", child.getMetadata().get("user"));
        assertEquals(parent.getTraceContext().getTraceId(), child.getTraceContext().getTraceId());
        assertEquals(List.of("root", "nested"), child.getTraceContext().getPath());
    }

    @Test
    void shouldCancelChildWithParentButNotParentWithChild() {
        RunContext parent = RunContext.noop();
        RunContext first = parent.createChild("first");
        RunContext second = parent.createChild("second");

        first.cancel("first only");
        assertFalse(parent.getCancellation().isCancelled());

        parent.cancel("stop");
        assertTrue(second.getCancellation().isCancelled());
    }

    @Test
    void shouldNestUnderParentTrace() {
        TraceContext outer = TraceContext.root("outer");

        RunContext context = RunContext.builder()
                .parentTraceContext(outer)
                .rootSpanName("debate")
                .build();

        assertEquals(outer.getTraceId(), context.getTraceContext().getTraceId());
        assertEquals(List.of("outer", "debate"), context.getTraceContext().getPath());
    }

    @Test
    void shouldCancelWhenParentTokenCancels() {
        CancellationToken external = new CancellationToken();
        RunContext context = RunContext.builder().parentCancellation(external).build();

        external.cancel("user abort");

        assertTrue(context.getCancellation().isCancelled());
        assertEquals("user abort", context.getCancellation().getReason());
    }
}
