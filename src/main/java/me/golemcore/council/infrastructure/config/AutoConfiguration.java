package me.golemcore.council.infrastructure.config;

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

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.council.adapter.outbound.skills.FileSystemSkillLoader;
import me.golemcore.council.domain.pattern.PatternExecutors;
import me.golemcore.council.domain.runtime.MapPricingCatalog;
import me.golemcore.council.domain.runtime.ModelPrice;
import me.golemcore.council.domain.runtime.PricingCatalog;
import me.golemcore.council.port.outbound.SkillLoader;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.info.BuildProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Path;
import java.time.Clock;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;

/**
 * Spring configuration for the council runtime.
 *
 * <p>
 * Provides the shared clock, JSON mapper, the executor that drives pattern
 * runs and agent calls, the pricing catalog and the skill loader, and logs the
 * configured agents on startup.
 */
@Configuration
@RequiredArgsConstructor
@Slf4j
public class AutoConfiguration {

    private final CouncilProperties properties;
    private final ObjectProvider<BuildProperties> buildPropertiesProvider;

    @Bean
    public static Clock clock() {
        return Clock.systemDefaultZone();
    }

    @Bean
    public static ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        mapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        return mapper;
    }

    @Bean(destroyMethod = "shutdownNow")
    public ExecutorService councilExecutor() {
        return PatternExecutors.newCachedExecutor(properties.getExecutor().getThreadNamePrefix());
    }

    @Bean
    public PricingCatalog pricingCatalog() {
        return new MapPricingCatalog(toPriceTable(properties.getPricing()));
    }

    @Bean
    public SkillLoader skillLoader() {
        List<Path> directories = properties.getSkills().getDirectories().stream()
                .map(Path::of)
                .toList();
        return new FileSystemSkillLoader(directories);
    }

    @PostConstruct
    public void init() {
        BuildProperties buildProps = buildPropertiesProvider.getIfAvailable();
        String version = buildProps != null ? buildProps.getVersion() : "dev";
        log.info("GolemCore Council v{} starting...", version);
        log.info("Providers: {}", properties.getProviders().keySet());
        properties.getAgents().forEach((id, agent) -> log.info("Agent {}: {}/{}", id, agent.getProvider(),
                agent.getModel()));
        log.info("Skill directories: {}", properties.getSkills().getDirectories());
    }

    static Map<String, Map<String, ModelPrice>> toPriceTable(
            Map<String, Map<String, CouncilProperties.PriceProperties>> pricing) {
        Map<String, Map<String, ModelPrice>> table = new HashMap<>();
        pricing.forEach((provider, models) -> {
            Map<String, ModelPrice> byModel = new HashMap<>();
            models.forEach((model, price) -> byModel.put(model, new ModelPrice(price.getInput(), price.getOutput())));
            table.put(provider, byModel);
        });
        return table;
    }
}
