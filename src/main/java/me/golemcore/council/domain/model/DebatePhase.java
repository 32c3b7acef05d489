package me.golemcore.council.domain.model;

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
 * Phases of a debate, in execution order. {@link #getId()} is the lower-case
 * name used in trace paths and prompts.
 */
public enum DebatePhase {
    INITIAL("initial"),
    REBUTTAL("rebuttal"),
    REVISED("revised"),
    CONSENSUS("consensus");

    private final String id;

    DebatePhase(String id) {
        this.id = id;
    }

    public String getId() {
        return id;
    }
}
