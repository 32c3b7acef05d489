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

import java.util.Arrays;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Syntactic agreement between answers: mean pairwise Jaccard similarity of
 * their lower-cased, whitespace-separated word sets. A blank answer is the set
 * holding one empty word, so two blank answers agree fully.
 */
public final class AgentAgreement {

    private AgentAgreement() {
    }

    /**
     * Returns a value in {@code [0, 1]}; {@code 1.0} for fewer than two
     * answers.
     */
    public static double jaccard(List<String> contents) {
        if (contents.size() < 2) {
            return 1.0;
        }
        List<Set<String>> wordSets = contents.stream().map(AgentAgreement::words).toList();
        double total = 0;
        int comparisons = 0;
        for (int i = 0; i < wordSets.size(); i++) {
            for (int j = i + 1; j < wordSets.size(); j++) {
                total += similarity(wordSets.get(i), wordSets.get(j));
                comparisons++;
            }
        }
        return total / comparisons;
    }

    static double similarity(Set<String> first, Set<String> second) {
        Set<String> union = new HashSet<>(first);
        union.addAll(second);
        if (union.isEmpty()) {
            return 0;
        }
        Set<String> intersection = new HashSet<>(first);
        intersection.retainAll(second);
        return (double) intersection.size() / union.size();
    }

    private static Set<String> words(String content) {
        String normalized = content == null ? "" : content.toLowerCase(Locale.ROOT).trim();
        if (normalized.isEmpty()) {
            return Set.of("");
        }
        return Arrays.stream(normalized.split("\\s+")).collect(Collectors.toSet());
    }
}
