package me.golemcore.council.testsupport;

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
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;

/**
 * Fake agent capability answering from a script. Records every request and
 * supports failures, delays and usage reports.
 */
public final class ScriptedAgentModel implements AgentModel {

    private final String providerId;
    private final String model;
    private final Function<AgentRequest, String> responder;
    private final List<AgentRequest> requests = new CopyOnWriteArrayList<>();
    private final AtomicInteger calls = new AtomicInteger();

    private RuntimeException failure;
    private int failingCalls;
    private Duration delay = Duration.ZERO;
    private LlmUsage usage;

    private ScriptedAgentModel(String providerId, String model, Function<AgentRequest, String> responder) {
        this.providerId = providerId;
        this.model = model;
        this.responder = responder;
    }

    public static ScriptedAgentModel replying(String content) {
        return new ScriptedAgentModel("test", "scripted", request -> content);
    }

    public static ScriptedAgentModel responding(Function<AgentRequest, String> responder) {
        return new ScriptedAgentModel("test", "scripted", responder);
    }

    public static ScriptedAgentModel failing(RuntimeException failure) {
        return replying("").failingFirst(Integer.MAX_VALUE, failure);
    }

    public ScriptedAgentModel as(String providerId, String model) {
        ScriptedAgentModel copy = new ScriptedAgentModel(providerId, model, responder);
        copy.failure = failure;
        copy.failingCalls = failingCalls;
        copy.delay = delay;
        copy.usage = usage;
        return copy;
    }

    public ScriptedAgentModel failingFirst(int count, RuntimeException failure) {
        this.failingCalls = count;
        this.failure = failure;
        return this;
    }

    public ScriptedAgentModel withDelay(Duration delay) {
        this.delay = delay;
        return this;
    }

    public ScriptedAgentModel withUsage(int inputTokens, int outputTokens) {
        this.usage = LlmUsage.of(inputTokens, outputTokens);
        return this;
    }

    @Override
    public String getProviderId() {
        return providerId;
    }

    @Override
    public String getModel() {
        return model;
    }

    public int getCallCount() {
        return calls.get();
    }

    public List<AgentRequest> getRequests() {
        return List.copyOf(requests);
    }

    public String lastPrompt() {
        return requests.isEmpty() ? null : requests.get(requests.size() - 1).lastUserContent();
    }

    @Override
    public AgentRun run(AgentRequest request, CancellationToken cancellation) {
        int call = calls.incrementAndGet();
        requests.add(request);
        CompletableFuture<AgentResponse> result = new CompletableFuture<>();
        cancellation.onCancel(() -> result.completeExceptionally(new RunCancelledException(cancellation.getReason())));

        if (call <= failingCalls) {
            fail(result);
        } else {
            AgentResponse response = AgentResponse.builder()
                    .message(Message.assistant(responder.apply(request)))
                    .usage(usage)
                    .build();
            if (delay.isZero()) {
                result.complete(response);
            } else {
                CompletableFuture.delayedExecutor(delay.toMillis(), TimeUnit.MILLISECONDS)
                        .execute(() -> result.complete(response));
            }
        }

        return new AgentRun() {
            @Override
            public Flux<AgentEvent> events() {
                return Mono.fromFuture(result)
                        .flatMapMany(response -> Flux.just(
                                new AgentEvent.TokenDelta(response.getContent()),
                                new AgentEvent.MessageCompleted(response.getMessage())));
            }

            @Override
            public CompletableFuture<AgentResponse> result() {
                return result;
            }

            @Override
            public void cancel(String reason) {
                result.completeExceptionally(new RunCancelledException(reason));
            }
        };
    }

    private void fail(CompletableFuture<AgentResponse> result) {
        if (delay.isZero()) {
            result.completeExceptionally(failure);
        } else {
            CompletableFuture.delayedExecutor(delay.toMillis(), TimeUnit.MILLISECONDS)
                    .execute(() -> result.completeExceptionally(failure));
        }
    }
}
