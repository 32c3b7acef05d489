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

/**
 * How an ensemble reduces its successful responses to one answer.
 */
public enum AggregationStrategy {
    /** Content of the first successful agent in configuration order. */
    FIRST,
    /** Longest content by character count; ties keep the earliest. */
    LONGEST,
    /** Shortest content by character count; ties keep the earliest. */
    SHORTEST,
    /** All contents labelled {@code [Agent N]} and joined by blank lines. */
    CONCAT,
    /** Caller-supplied reducer. */
    CUSTOM
}
