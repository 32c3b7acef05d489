package me.golemcore.council.domain.pattern;

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
import lombok.Singular;
import lombok.Value;
import me.golemcore.council.domain.model.AgentConfig;
import me.golemcore.council.domain.model.AgentResponse;

import java.util.List;
import java.util.function.Function;

/**
 * Ensemble configuration. {@code customAggregator} is required with
 * {@link AggregationStrategy#CUSTOM} and ignored otherwise.
 */
@Value
@Builder
public class EnsembleConfig {

    String name;
    String description;

    @Singular
    List<AgentConfig> agents;

    @Builder.Default
    AggregationStrategy aggregation = AggregationStrategy.LONGEST;

    Function<List<AgentResponse>, String> customAggregator;
}
