package me.golemcore.council.adapter.outbound.llm;

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
import me.golemcore.council.domain.exception.RunCancelledException;
import me.golemcore.council.domain.model.AgentEvent;
import me.golemcore.council.domain.model.AgentRequest;
import me.golemcore.council.domain.model.AgentResponse;
import me.golemcore.council.domain.model.LlmUsage;
import me.golemcore.council.domain.model.Message;
import me.golemcore.council.domain.runtime.CancellationToken;
import me.golemcore.council.port.outbound.AgentRun;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import reactor.test.StepVerifier;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class Langchain4jAgentModelTest {

    private static final Clock CLOCK = Clock.fixed(Instant.parse("2026-01-01T00:00:00Z"), ZoneOffset.UTC);
    private static final AgentRequest REQUEST = AgentRequest.of(List.of(
            Message.system("Be brief."), Message.user("Hello")));

    @Test
    void shouldTranslateBlockingResponse() throws Exception {
        ChatModel chatModel = mock(ChatModel.class);
        when(chatModel.chat(any(ChatRequest.class))).thenReturn(ChatResponse.builder()
                .aiMessage(AiMessage.from("Hi there"))
                .tokenUsage(new TokenUsage(12, 3))
                .build());
        Langchain4jAgentModel model = new Langchain4jAgentModel("openai", "gpt-4o", chatModel, Runnable::run, CLOCK);

        AgentRun run = model.run(REQUEST, new CancellationToken());

        StepVerifier.create(run.events())
                .expectNext(new AgentEvent.MessageCompleted(Message.assistant("Hi there")))
                .assertNext(event -> assertEquals(15,
                        ((AgentEvent.UsageReported) event).usage().getTotalTokens()))
                .verifyComplete();
        AgentResponse response = run.result().get(5, TimeUnit.SECONDS);
        assertEquals("Hi there", response.getContent());
        assertEquals(12, response.getUsage().getInputTokens());
        assertEquals("openai", response.getUsage().getProviderId());
        assertEquals("gpt-4o", response.getUsage().getModel());

        ArgumentCaptor<ChatRequest> request = ArgumentCaptor.forClass(ChatRequest.class);
        verify(chatModel).chat(request.capture());
        assertInstanceOf(SystemMessage.class, request.getValue().messages().get(0));
        assertInstanceOf(UserMessage.class, request.getValue().messages().get(1));
    }

    @Test
    void shouldStreamPartialResponses() throws Exception {
        StreamingChatModel streamingModel = mock(StreamingChatModel.class);
        doAnswer(invocation -> {
            StreamingChatResponseHandler handler = invocation.getArgument(1);
            handler.onPartialResponse("Hi ");
            handler.onPartialResponse("there");
            handler.onCompleteResponse(ChatResponse.builder().aiMessage(AiMessage.from("Hi there")).build());
            return null;
        }).when(streamingModel).chat(any(ChatRequest.class), any(StreamingChatResponseHandler.class));
        Langchain4jAgentModel model = new Langchain4jAgentModel("anthropic", "claude", streamingModel, CLOCK);

        AgentRun run = model.run(REQUEST, new CancellationToken());

        StepVerifier.create(run.events())
                .expectNext(new AgentEvent.TokenDelta("Hi "))
                .expectNext(new AgentEvent.TokenDelta("there"))
                .expectNext(new AgentEvent.MessageCompleted(Message.assistant("Hi there")))
                .verifyComplete();
        AgentResponse response = run.result().get(5, TimeUnit.SECONDS);
        assertEquals("Hi there", response.getContent());
        assertNull(response.getUsage());
        assertTrue(model.supportsStreaming());
    }

    @Test
    void shouldReleaseCancellationListenerOnceCompleted() throws Exception {
        ChatModel chatModel = mock(ChatModel.class);
        when(chatModel.chat(any(ChatRequest.class))).thenReturn(ChatResponse.builder()
                .aiMessage(AiMessage.from("Done"))
                .build());
        CancellationToken token = mock(CancellationToken.class);
        CancellationToken.Registration registration = mock(CancellationToken.Registration.class);
        when(token.onCancel(any(Runnable.class))).thenReturn(registration);
        Langchain4jAgentModel model = new Langchain4jAgentModel("openai", "gpt-4o", chatModel, Runnable::run, CLOCK);

        AgentRun run = model.run(REQUEST, token);

        assertEquals("Done", run.result().get(5, TimeUnit.SECONDS).getContent());
        verify(registration).close();
    }

    @Test
    void shouldReleaseCancellationListenerOnProviderError() {
        StreamingChatModel streamingModel = mock(StreamingChatModel.class);
        doAnswer(invocation -> {
            StreamingChatResponseHandler handler = invocation.getArgument(1);
            handler.onError(new IllegalStateException("503 Service Unavailable"));
            return null;
        }).when(streamingModel).chat(any(ChatRequest.class), any(StreamingChatResponseHandler.class));
        CancellationToken token = mock(CancellationToken.class);
        CancellationToken.Registration registration = mock(CancellationToken.Registration.class);
        when(token.onCancel(any(Runnable.class))).thenReturn(registration);
        Langchain4jAgentModel model = new Langchain4jAgentModel("anthropic", "claude", streamingModel, CLOCK);

        AgentRun run = model.run(REQUEST, token);

        assertThrows(ExecutionException.class, () -> run.result().get(5, TimeUnit.SECONDS));
        verify(registration).close();
    }

    @Test
    void shouldFailResultOnProviderError() {
        StreamingChatModel streamingModel = mock(StreamingChatModel.class);
        doAnswer(invocation -> {
            StreamingChatResponseHandler handler = invocation.getArgument(1);
            handler.onError(new IllegalStateException("401 Unauthorized"));
            return null;
        }).when(streamingModel).chat(any(ChatRequest.class), any(StreamingChatResponseHandler.class));
        Langchain4jAgentModel model = new Langchain4jAgentModel("anthropic", "claude", streamingModel, CLOCK);

        AgentRun run = model.run(REQUEST, new CancellationToken());

        StepVerifier.create(run.events()).verifyComplete();
        ExecutionException error = assertThrows(ExecutionException.class, () -> run.result().get());
        assertEquals("401 Unauthorized", error.getCause().getMessage());
    }

    @Test
    void shouldEndRunWhenCancelled() {
        StreamingChatModel streamingModel = mock(StreamingChatModel.class);
        Langchain4jAgentModel model = new Langchain4jAgentModel("anthropic", "claude", streamingModel, CLOCK);
        CancellationToken token = new CancellationToken();

        AgentRun run = model.run(REQUEST, token);
        token.cancel("user abort");

        StepVerifier.create(run.events()).expectComplete().verify(Duration.ofSeconds(5));
        ExecutionException error = assertThrows(ExecutionException.class, () -> run.result().get());
        assertInstanceOf(RunCancelledException.class, error.getCause());
    }

    @Test
    void shouldConvertMessageRoles() {
        List<ChatMessage> messages = Langchain4jAgentModel.convertMessages(List.of(
                Message.system("s"), Message.user("u"), Message.assistant("a")));

        assertInstanceOf(SystemMessage.class, messages.get(0));
        assertInstanceOf(UserMessage.class, messages.get(1));
        assertInstanceOf(AiMessage.class, messages.get(2));
        assertEquals("a", ((AiMessage) messages.get(2)).text());
    }

    @Test
    void shouldFillMissingTokenCounts() {
        Langchain4jAgentModel model = new Langchain4jAgentModel("openai", "gpt-4o", mock(ChatModel.class),
                Runnable::run, CLOCK);

        LlmUsage usage = model.convertUsage(new TokenUsage(5, null), CLOCK.instant());

        assertEquals(5, usage.getInputTokens());
        assertEquals(0, usage.getOutputTokens());
        assertEquals(5, usage.getTotalTokens());
        assertEquals(Duration.ZERO, usage.getLatency());
        assertNull(model.convertUsage(null, CLOCK.instant()));
    }
}
