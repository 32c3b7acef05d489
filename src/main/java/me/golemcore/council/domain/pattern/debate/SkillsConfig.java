package me.golemcore.council.domain.pattern.debate;

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

import java.util.List;
import java.util.Map;

/**
 * Skill selection for a debate: {@code global} applies to every participant
 * unless {@code participants} has an entry under the participant's name.
 */
@Value
@Builder
public class SkillsConfig {

    @Singular("globalSkill")
    List<String> global;

    @Singular
    Map<String, List<String>> participants;

    public static SkillsConfig none() {
        return SkillsConfig.builder().build();
    }
}
