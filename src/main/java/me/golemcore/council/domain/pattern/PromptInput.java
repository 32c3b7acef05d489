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
 * Input of the fan-out patterns: a prompt and optional background context.
 */
public record PromptInput(String prompt, String context) {

    public PromptInput {
        if (prompt == null) {
            throw new IllegalArgumentException("prompt must not be null");
        }
    }

    public static PromptInput of(String prompt) {
        return new PromptInput(prompt, null);
    }

    public boolean hasContext() {
        return context != null && !context.isEmpty();
    }

    /**
     * {@code <context>} block followed by the prompt inside {@code tag}, or the
     * prompt alone when there is no context and {@code wrapBare} is false.
     */
    String wrap(String tag, boolean wrapBare) {
        if (hasContext()) {
            return "<context>\n" + context + "\n</context>\n\n<" + tag + ">\n" + prompt + "\n</" + tag + ">";
        }
        return wrapBare ? "<" + tag + ">\n" + prompt + "\n</" + tag + ">" : prompt;
    }
}
