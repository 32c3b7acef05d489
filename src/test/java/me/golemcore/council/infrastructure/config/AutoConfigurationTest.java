package me.golemcore.council.infrastructure.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import me.golemcore.council.adapter.outbound.skills.FileSystemSkillLoader;
import me.golemcore.council.domain.runtime.ModelPrice;
import me.golemcore.council.domain.runtime.PricingCatalog;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.info.BuildProperties;

import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ExecutorService;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class AutoConfigurationTest {

    @SuppressWarnings("unchecked")
    private AutoConfiguration configuration(CouncilProperties properties, BuildProperties buildProperties) {
        ObjectProvider<BuildProperties> provider = mock(ObjectProvider.class);
        when(provider.getIfAvailable()).thenReturn(buildProperties);
        return new AutoConfiguration(properties, provider);
    }

    private static CouncilProperties.PriceProperties price(double input, double output) {
        CouncilProperties.PriceProperties price = new CouncilProperties.PriceProperties();
        price.setInput(input);
        price.setOutput(output);
        return price;
    }

    @Test
    void shouldBuildPricingCatalogFromProperties() {
        CouncilProperties properties = new CouncilProperties();
        properties.getPricing().put("openai", Map.of("gpt-4o", price(2.5, 10.0)));

        PricingCatalog catalog = configuration(properties, null).pricingCatalog();

        Optional<ModelPrice> found = catalog.findPrice("openai", "gpt-4o");
        assertTrue(found.isPresent());
        assertEquals(new ModelPrice(2.5, 10.0), found.get());
        assertTrue(catalog.findPrice("anthropic", "gpt-4o").isEmpty());
    }

    @Test
    void shouldProvideSkillLoaderAndExecutor() {
        AutoConfiguration configuration = configuration(new CouncilProperties(), null);

        assertInstanceOf(FileSystemSkillLoader.class, configuration.skillLoader());
        ExecutorService executor = configuration.councilExecutor();
        try {
            assertNotNull(executor);
        } finally {
            executor.shutdownNow();
        }
    }

    @Test
    void shouldConfigureObjectMapperForIsoTimestamps() throws Exception {
        ObjectMapper mapper = AutoConfiguration.objectMapper();

        assertEquals("\"2026-03-01T12:00:00Z\"", mapper.writeValueAsString(Instant.parse("2026-03-01T12:00:00Z")));
    }

    @Test
    void shouldLogStartupWithAndWithoutBuildInfo() {
        CouncilProperties properties = new CouncilProperties();
        properties.getAgents().put("claude", new CouncilProperties.AgentProperties());
        BuildProperties buildProperties = mock(BuildProperties.class);
        when(buildProperties.getVersion()).thenReturn("1.2.3");

        assertDoesNotThrow(() -> configuration(properties, buildProperties).init());
        assertDoesNotThrow(() -> configuration(properties, null).init());
    }
}
