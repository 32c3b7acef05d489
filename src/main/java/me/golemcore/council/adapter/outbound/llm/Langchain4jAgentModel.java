package me.golemcore.council.adapter.outbound.llm;

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

import dev.langchain4j.data.message.AiMessage;
import dev.langchain4j.data.message.ChatMessage;
import dev.langchain4j.data.message.SystemMessage;
import dev.langchain4j.data.message.UserMessage;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.chat.StreamingChatModel;
import dev.langchain4j.model.chat.request.ChatRequest;
import dev.langchain4j.model.chat.response.ChatResponse;
import dev.langchain4j.model.chat.response.StreamingChatResponseHandler;
import dev.langchain4j.model.output.TokenUsage;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.council.domain.exception.RunCancelledException;
import me.golemcore.council.domain.model.AgentEvent;
import me.golemcore.council.domain.model.AgentRequest;
import me.golemcore.council.domain.model.AgentResponse;
import me.golemcore.council.domain.model.LlmUsage;
import me.golemcore.council.domain.model.Message;
import me.golemcore.council.domain.runtime.CancellationToken;
import me.golemcore.council.port.outbound.AgentModel;
import me.golemcore.council.port.outbound.AgentRun;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Sinks;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

/**
 * Agent capability backed by a langchain4j chat model.
 *
 * <p>
 * With a {@link StreamingChatModel} every partial response is emitted as a
 * token delta; with a blocking {@link ChatModel} the call runs on the given
 * executor and only the final message is emitted. Cancellation ends the run
 * with {@link RunCancelledException}; a blocking provider call already in
 * flight is left to finish and its answer is discarded.
 */
@Slf4j
public class Langchain4jAgentModel implements AgentModel {

    private final String providerId;
    private final String model;
    private final ChatModel chatModel;
    private final StreamingChatModel streamingChatModel;
    private final Executor executor;
    private final Clock clock;

    public Langchain4jAgentModel(String providerId, String model, ChatModel chatModel, Executor executor,
            Clock clock) {
        this(providerId, model, chatModel, null, executor, clock);
    }

    public Langchain4jAgentModel(String providerId, String model, StreamingChatModel streamingChatModel,
            Clock clock) {
        this(providerId, model, null, streamingChatModel, Runnable::run, clock);
    }

    private Langchain4jAgentModel(String providerId, String model, ChatModel chatModel,
            StreamingChatModel streamingChatModel, Executor executor, Clock clock) {
        this.providerId = providerId;
        this.model = model;
        this.chatModel = chatModel;
        this.streamingChatModel = streamingChatModel;
        this.executor = executor;
        this.clock = clock;
    }

    @Override
    public String getProviderId() {
        return providerId;
    }

    @Override
    public String getModel() {
        return model;
    }

    public boolean supportsStreaming() {
        return streamingChatModel != null;
    }

    @Override
    public AgentRun run(AgentRequest request, CancellationToken cancellation) {
        ChatRequest chatRequest = ChatRequest.builder()
                .messages(convertMessages(request.getMessages()))
                .build();
        Langchain4jRun run = new Langchain4jRun(clock.instant());
        run.watch(cancellation);
        if (cancellation.isCancelled()) {
            return run;
        }
        log.debug("[LLM] {}/{}: sending {} messages", providerId, model, chatRequest.messages().size());
        if (streamingChatModel != null) {
            streamingChatModel.chat(chatRequest, run);
        } else {
            try {
                executor.execute(() -> {
                    try {
                        run.onCompleteResponse(chatModel.chat(chatRequest));
                    } catch (RuntimeException e) {
                        run.onError(e);
                    }
                });
            } catch (RejectedExecutionException e) {
                run.fail(e);
            }
        }
        return run;
    }

    static List<ChatMessage> convertMessages(List<Message> messages) {
        return messages.stream()
                .<ChatMessage>map(message -> {
                    if (message.isSystemMessage()) {
                        return SystemMessage.from(message.contentOrEmpty());
                    }
                    if (message.isAssistantMessage()) {
                        return AiMessage.from(message.contentOrEmpty());
                    }
                    return UserMessage.from(message.contentOrEmpty());
                })
                .toList();
    }

    LlmUsage convertUsage(TokenUsage tokenUsage, Instant startedAt) {
        if (tokenUsage == null) {
            return null;
        }
        int input = tokenUsage.inputTokenCount() != null ? tokenUsage.inputTokenCount() : 0;
        int output = tokenUsage.outputTokenCount() != null ? tokenUsage.outputTokenCount() : 0;
        int total = tokenUsage.totalTokenCount() != null ? tokenUsage.totalTokenCount() : input + output;
        Instant now = clock.instant();
        return LlmUsage.builder()
                .inputTokens(input)
                .outputTokens(output)
                .totalTokens(total)
                .latency(Duration.between(startedAt, now))
                .timestamp(now)
                .model(model)
                .providerId(providerId)
                .build();
    }

    private final class Langchain4jRun implements AgentRun, StreamingChatResponseHandler {

        private final Sinks.Many<AgentEvent> events = Sinks.many().unicast().onBackpressureBuffer();
        private final CompletableFuture<AgentResponse> result = new CompletableFuture<>();
        private final Instant startedAt;
        private CancellationToken.Registration cancelRegistration;

        private Langchain4jRun(Instant startedAt) {
            this.startedAt = startedAt;
        }

        void watch(CancellationToken cancellation) {
            CancellationToken.Registration registration = cancellation
                    .onCancel(() -> fail(new RunCancelledException(cancellation.getReason())));
            synchronized (this) {
                if (result.isDone()) {
                    registration.close();
                } else {
                    cancelRegistration = registration;
                }
            }
        }

        private void release() {
            if (cancelRegistration != null) {
                cancelRegistration.close();
                cancelRegistration = null;
            }
        }

        @Override
        public synchronized void onPartialResponse(String partialResponse) {
            if (!result.isDone()) {
                events.tryEmitNext(new AgentEvent.TokenDelta(partialResponse));
            }
        }

        @Override
        public synchronized void onCompleteResponse(ChatResponse response) {
            if (result.isDone()) {
                return;
            }
            String text = response.aiMessage() != null && response.aiMessage().text() != null
                    ? response.aiMessage().text()
                    : "";
            Message message = Message.assistant(text);
            LlmUsage usage = convertUsage(response.tokenUsage(), startedAt);
            events.tryEmitNext(new AgentEvent.MessageCompleted(message));
            if (usage != null) {
                events.tryEmitNext(new AgentEvent.UsageReported(usage));
            }
            events.tryEmitComplete();
            result.complete(AgentResponse.builder().message(message).usage(usage).build());
            release();
            log.debug("[LLM] {}/{}: response received, {} chars", providerId, model, text.length());
        }

        @Override
        public void onError(Throwable error) {
            log.warn("[LLM] {}/{} failed: {}", providerId, model, error.getMessage());
            fail(error);
        }

        synchronized void fail(Throwable error) {
            if (result.isDone()) {
                return;
            }
            events.tryEmitComplete();
            result.completeExceptionally(error);
            release();
        }

        @Override
        public Flux<AgentEvent> events() {
            return events.asFlux();
        }

        @Override
        public CompletableFuture<AgentResponse> result() {
            return result;
        }

        @Override
        public void cancel(String reason) {
            fail(new RunCancelledException(reason));
        }
    }
}
