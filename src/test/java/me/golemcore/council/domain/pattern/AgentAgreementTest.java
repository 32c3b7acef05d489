package me.golemcore.council.domain.pattern;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertEquals;

class AgentAgreementTest {

    @Test
    void shouldReturnFullAgreementForFewerThanTwoResponses() {
        assertEquals(1.0, AgentAgreement.jaccard(List.of()));
        assertEquals(1.0, AgentAgreement.jaccard(List.of("anything")));
    }

    @Test
    void shouldIgnoreCaseAndWhitespace() {
        assertEquals(1.0, AgentAgreement.jaccard(List.of("The  Answer", " the answer ")));
    }

    @Test
    void shouldAverageAllPairs() {
        double agreement = AgentAgreement.jaccard(List.of("a b", "a b", "c d"));

        assertEquals(1.0 / 3.0, agreement, 1e-9);
    }

    @Test
    void shouldTreatEmptyUnionAsNoAgreement() {
        assertEquals(0.0, AgentAgreement.similarity(Set.of(), Set.of()));
    }

    @Test
    void shouldTreatBlankAnswersAsAgreeing() {
        assertEquals(1.0, AgentAgreement.jaccard(List.of("", "  ")));
        assertEquals(0.0, AgentAgreement.jaccard(List.of("", "use postgres")));
        assertEquals(1.0 / 3.0, AgentAgreement.jaccard(List.of("", "", "use postgres")), 1e-9);
    }
}
