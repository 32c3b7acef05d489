package me.golemcore.council.domain.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import me.golemcore.council.domain.model.DebatePhase;
import me.golemcore.council.domain.model.EventTrace;
import me.golemcore.council.domain.model.PatternEvent;
import me.golemcore.council.infrastructure.config.AutoConfiguration;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Flux;
import reactor.test.StepVerifier;

import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class PatternEventEncoderTest {

    private static final Instant TIMESTAMP = Instant.parse("2026-03-01T12:00:00Z");
    private static final EventTrace TRACE = new EventTrace("trace-1", "span-2", "span-1",
            List.of("root", "initial", "claude"), TIMESTAMP);

    private final ObjectMapper objectMapper = AutoConfiguration.objectMapper();
    private final PatternEventEncoder encoder = new PatternEventEncoder(objectMapper);

    @Test
    void shouldEncodeTypeAndFields() throws Exception {
        JsonNode json = objectMapper.readTree(encoder.encode(new PatternEvent.PhaseEnd("judge", 42, TRACE)));

        assertEquals("PHASE_END", json.get("type").asText());
        assertEquals("judge", json.get("phase").asText());
        assertEquals(42, json.get("durationMs").asLong());
        assertEquals("trace-1", json.get("trace").get("traceId").asText());
        assertEquals("claude", json.get("trace").get("path").get(2).asText());
        assertEquals("2026-03-01T12:00:00Z", json.get("trace").get("timestamp").asText());
    }

    @Test
    void shouldEncodeDebateEnumsByName() throws Exception {
        PatternEvent event = new PatternEvent.DebateRoundEnd(DebatePhase.INITIAL, "claude", "Use Postgres",
                TIMESTAMP, TRACE);

        JsonNode json = objectMapper.readTree(encoder.encode(event));

        assertEquals("DEBATE_ROUND_END", json.get("type").asText());
        assertEquals("INITIAL", json.get("phase").asText());
        assertEquals("Use Postgres", json.get("content").asText());
    }

    @Test
    void shouldEncodeStreamAsSingleLines() {
        Flux<PatternEvent> events = Flux.just(new PatternEvent.PhaseStart("agents", TRACE),
                new PatternEvent.Done(TRACE));

        StepVerifier.create(encoder.encodeLines(events))
                .assertNext(line -> {
                    assertTrue(line.startsWith("{\"type\":\"PHASE_START\""));
                    assertTrue(line.endsWith("}\n"));
                    assertEquals(1, line.split("\n").length);
                })
                .assertNext(line -> assertTrue(line.contains("\"type\":\"DONE\"")))
                .verifyComplete();
    }
}
