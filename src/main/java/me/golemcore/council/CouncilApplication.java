package me.golemcore.council;

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

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

/**
 * Main application class for GolemCore Council.
 *
 * <p>
 * GolemCore Council runs groups of LLM agents through orchestration patterns
 * and streams every step of the run as events.
 *
 * <h2>Patterns</h2>
 * <ul>
 * <li><b>Sequential</b> - agents in a chain, each seeing the previous
 * answer</li>
 * <li><b>Parallel</b> - all agents on the same prompt, partial failures
 * tolerated</li>
 * <li><b>Ensemble</b> - parallel answers reduced by an aggregation
 * strategy</li>
 * <li><b>Cross-check</b> - parallel answers evaluated by a judge agent</li>
 * <li><b>Debate</b> - initial positions, rebuttals, revisions and an
 * orchestrator consensus</li>
 * </ul>
 *
 * <h2>Architecture</h2>
 * <p>
 * Hexagonal architecture (Ports & Adapters):
 *
 * <pre>
 * Domain Layer       → Patterns, RunContext, AgentExecutor, PatternFactory
 * Ports              → AgentModel, SkillLoader, UsageTrackingPort
 * Infrastructure     → langchain4j models, file-system skills, usage tracking
 * </pre>
 *
 * <h2>Configuration</h2>
 * <p>
 * All configuration via {@code application.yml} under the {@code council.*}
 * prefix.
 *
 * @since 1.0
 */
@SpringBootApplication
@ConfigurationPropertiesScan
public class CouncilApplication {

    public static void main(String[] args) {
        SpringApplication.run(CouncilApplication.class, args);
    }

}
