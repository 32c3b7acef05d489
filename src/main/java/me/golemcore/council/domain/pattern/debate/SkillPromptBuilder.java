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

import me.golemcore.council.domain.model.DebatePhase;
import me.golemcore.council.domain.model.Skill;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Renders loaded skills as the XML block appended to a debate prompt.
 */
final class SkillPromptBuilder {

    private static final List<String> OPTIONAL_FRONTMATTER = List.of("license", "compatibility", "allowed-tools");

    private SkillPromptBuilder() {
    }

    /**
     * Returns an empty string when {@code skills} is empty.
     */
    static String build(List<Skill> skills, DebatePhase phase) {
        if (skills.isEmpty()) {
            return "";
        }
        String discovery = skills.stream()
                .map(skill -> "<skill>\n<name>\n" + escapeXml(skill.getName()) + "\n</name>\n"
                        + "<description>\n" + escapeXml(skill.getDescription()) + "\n</description>\n"
                        + "<location>\n" + skill.getLocation() + "\n</location>\n</skill>")
                .collect(Collectors.joining("\n"));

        String activated = skills.stream()
                .map(SkillPromptBuilder::activatedContent)
                .collect(Collectors.joining("\n\n---\n\n"));

        return "<skills_context>\n"
                + "<activation-phase>" + phase.getId() + "</activation-phase>\n"
                + "<purpose>Apply these skills while " + purpose(phase) + "</purpose>\n"
                + "</skills_context>\n\n"
                + "<available_skills>\n" + discovery + "\n</available_skills>\n\n"
                + "<activated_skill_contents>\n" + activated + "\n</activated_skill_contents>";
    }

    private static String activatedContent(Skill skill) {
        Map<String, Object> frontmatter = skill.getFrontmatter() != null ? skill.getFrontmatter() : Map.of();
        List<String> lines = new ArrayList<>();
        lines.add("---");
        lines.add("name: " + frontmatter.getOrDefault("name", skill.getName()));
        lines.add("description: " + frontmatter.getOrDefault("description", skill.getDescription()));
        for (String key : OPTIONAL_FRONTMATTER) {
            Object value = frontmatter.get(key);
            if (value != null) {
                lines.add(key + ": " + value);
            }
        }
        lines.add("---");
        return "[" + skill.getName() + "]\n" + String.join("\n", lines) + "\n\n" + skill.getInstructions();
    }

    private static String purpose(DebatePhase phase) {
        return switch (phase) {
        case INITIAL -> "presenting your initial position";
        case REBUTTAL -> "critiquing other positions";
        case REVISED -> "revising your position";
        case CONSENSUS -> "summarizing the debate";
        };
    }

    private static String escapeXml(String text) {
        if (text == null) {
            return "";
        }
        return text.replace("&", "&amp;").replace("<", "&lt;").replace(">", "&gt;");
    }
}
