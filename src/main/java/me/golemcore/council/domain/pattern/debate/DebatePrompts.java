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

/**
 * Prompt texts of the debate phases. A non-empty skill block is appended
 * after a blank line.
 */
final class DebatePrompts {

    private static final String WEB_SEARCH_INSTRUCTIONS = """


            IMPORTANT: Before making factual claims, use the webSearch tool to verify:
            - Service certifications (SOC2, HIPAA, etc.)
            - Current pricing or feature availability
            - Recent announcements or changes
            - Technical specifications

            Example: If you claim "Service X lacks SOC2", search to confirm this is current.""";

    private DebatePrompts() {
    }

    static String initial(String topic, String skillBlock) {
        return "Topic: " + topic + "\n\n"
                + "You must present a clear position as an expert on this topic.\n"
                + "- Provide a specific recommendation\n"
                + "- Clearly explain the reasoning behind your choice\n"
                + "- Also mention potential risks"
                + skillSection(skillBlock);
    }

    static String rebuttal(String topic, String othersOpinions, boolean webSearch, String skillBlock) {
        return "Topic: " + topic + "\n\n"
                + "Other experts' opinions:\n"
                + othersOpinions + "\n\n"
                + "Your role: Critical Reviewer\n"
                + "Point out problems, gaps, and underestimated risks in the above opinions.\n"
                + "- Find weaknesses even if you agree\n"
                + "- Avoid phrases like \"Good point, but...\"\n"
                + "- Provide specific counterexamples or failure scenarios\n"
                + "- Specify conditions under which the approach could fail"
                + (webSearch ? WEB_SEARCH_INSTRUCTIONS : "")
                + skillSection(skillBlock);
    }

    static String revised(String topic, String discussion, String skillBlock) {
        return "Topic: " + topic + "\n\n"
                + "Discussion so far:\n"
                + discussion + "\n\n"
                + "Considering other experts' rebuttals:\n"
                + "1. Revise your initial position if needed\n"
                + "2. Defend with stronger evidence if you maintain your position\n"
                + "3. Present your final recommendation"
                + skillSection(skillBlock);
    }

    static String consensus(String transcript) {
        return "You are the debate moderator. An intense debate has concluded.\n\n"
                + "Full debate transcript:\n"
                + transcript + "\n\n"
                + "Please summarize:\n"
                + "1. Points of agreement (what all experts agreed on)\n"
                + "2. Unresolved disagreements (where opinions still differ and each position)\n"
                + "3. Final recommendation (practical approach considering disagreements)\n"
                + "4. Cautions (risks raised in rebuttals that must be considered)";
    }

    private static String skillSection(String skillBlock) {
        return skillBlock == null || skillBlock.isEmpty() ? "" : "\n\n" + skillBlock;
    }
}
