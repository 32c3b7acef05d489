package me.golemcore.council.adapter.outbound.llm;

import me.golemcore.council.port.outbound.AgentModel;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class AgentModelRegistryTest {

    private Langchain4jModelFactory modelFactory;
    private NoOpAgentModel noOpAgentModel;
    private AgentModelRegistry registry;

    @BeforeEach
    void setUp() {
        modelFactory = mock(Langchain4jModelFactory.class);
        noOpAgentModel = new NoOpAgentModel();
        registry = new AgentModelRegistry(modelFactory, noOpAgentModel);
    }

    @Test
    void shouldCreateModelOncePerProviderAndModel() {
        AgentModel created = mock(AgentModel.class);
        when(modelFactory.isConfigured("openai")).thenReturn(true);
        when(modelFactory.create("openai", "gpt-4o")).thenReturn(created);

        assertSame(created, registry.get("openai", "gpt-4o"));
        assertSame(created, registry.get("openai", "gpt-4o"));

        verify(modelFactory, times(1)).create("openai", "gpt-4o");
        assertEquals(1, registry.getCachedModels().size());
    }

    @Test
    void shouldFallBackToNoOpForUnconfiguredProvider() {
        when(modelFactory.isConfigured("anthropic")).thenReturn(false);

        assertSame(noOpAgentModel, registry.get("anthropic", "claude"));
        assertFalse(registry.isProviderAvailable("anthropic"));
        verify(modelFactory, never()).create("anthropic", "claude");
    }

    @Test
    void shouldUseNoOpForNoneProvider() {
        assertSame(noOpAgentModel, registry.get("none", "anything"));
        assertSame(noOpAgentModel, registry.get(null, "anything"));
    }

    @Test
    void shouldReportConfiguredProviderAvailable() {
        when(modelFactory.isConfigured("openai")).thenReturn(true);

        assertTrue(registry.isProviderAvailable("openai"));
    }
}
