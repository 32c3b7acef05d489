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

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Text heuristics over debate output.
 *
 * <p>
 * Both methods depend on how participants and the orchestrator word their
 * answers. Position changes are detected from a fixed phrase list found in the
 * revised text; disagreements are scraped from the consensus text by looking
 * for a section heading and collecting its {@code -} bullets. Neither is a
 * semantic analysis.
 */
public final class DebateTranscriptAnalyzer {

    public static final List<String> POSITION_CHANGE_INDICATORS = List.of(
            "i have revised",
            "i now agree",
            "i changed my position",
            "reconsidering",
            "after reviewing",
            "i must acknowledge",
            "my position has evolved",
            "i revise my position");

    private DebateTranscriptAnalyzer() {
    }

    /**
     * Only the revised text is inspected; the initial text is accepted so a
     * different detector can compare the two.
     */
    public static boolean hasPositionChanged(String initial, String revised) {
        if (revised == null) {
            return false;
        }
        String normalized = revised.toLowerCase(Locale.ROOT).trim();
        return POSITION_CHANGE_INDICATORS.stream().anyMatch(normalized::contains);
    }

    /**
     * Bullet lines between the first heading mentioning "unresolved" or
     * "disagreement" and the next line mentioning "recommendation" or
     * "caution", with the leading dash removed.
     */
    public static List<String> extractDisagreements(String consensus) {
        List<String> disagreements = new ArrayList<>();
        if (consensus == null || consensus.isEmpty()) {
            return disagreements;
        }
        boolean inSection = false;
        for (String line : consensus.split("\n", -1)) {
            String lower = line.toLowerCase(Locale.ROOT);
            if (lower.contains("unresolved") || lower.contains("disagreement")) {
                inSection = true;
                continue;
            }
            if (inSection && (lower.contains("recommendation") || lower.contains("caution"))) {
                break;
            }
            String trimmed = line.trim();
            if (inSection && trimmed.startsWith("-")) {
                disagreements.add(trimmed.substring(1).trim());
            }
        }
        return disagreements;
    }
}
