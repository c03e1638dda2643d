package com.agrisense.engine;

import com.agrisense.fact.Fact;
import com.agrisense.rule.Rule;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

class ConflictResolverTest {

    private static Activation activation(String ruleName, int priority, long... factIds) {
        Rule rule = new Rule(ruleName, priority, null, List.of(), List.of());
        List<Fact> facts = new ArrayList<>();
        for (long id : factIds) {
            facts.add(new Fact(id, "k", Map.of("id", id)));
        }
        return new Activation(rule, Map.of(), facts, Map.of());
    }

    private static String selected(ConflictResolver resolver, Activation... candidates) {
        return resolver.select(List.of(candidates)).orElseThrow().rule().name();
    }

    @Nested
    @DisplayName("earliest-fact")
    class EarliestFact {

        private final ConflictResolver resolver = new ConflictResolver(ResolutionStrategy.EARLIEST_FACT);

        @Test
        void higherPriorityWins_evenWithNewerFacts() {
            assertEquals("high", selected(resolver,
                activation("low", 1, 1),
                activation("high", 10, 9)));
        }

        @Test
        void equalPriority_prefersOldestNewestFact() {
            assertEquals("old", selected(resolver,
                activation("new", 5, 1, 7),
                activation("old", 5, 2, 3)));
        }

        @Test
        void fullTie_brokenByRuleName() {
            assertEquals("alpha", selected(resolver,
                activation("beta", 5, 4),
                activation("alpha", 5, 4)));
        }

        @Test
        void sameRule_brokenByFactIdsInConditionOrder() {
            Activation first = activation("r", 5, 1, 3);
            Activation second = activation("r", 5, 2, 3);
            assertSame(first, resolver.select(List.of(second, first)).orElseThrow());
        }

        @Test
        void activationWithoutFacts_countsAsOldest() {
            assertEquals("negation-only", selected(resolver,
                activation("a-rule", 0, 1),
                activation("negation-only", 0)));
        }

        @Test
        void selectionIndependentOfCandidateOrder() {
            List<Activation> candidates = new ArrayList<>(List.of(
                activation("c", 3, 5), activation("b", 3, 5), activation("a", 2, 1),
                activation("d", 3, 4, 6), activation("e", 3, 2)));
            Random random = new Random(7);
            for (int i = 0; i < 20; i++) {
                Collections.shuffle(candidates, random);
                assertEquals("e", resolver.select(candidates).orElseThrow().rule().name());
            }
        }

        @Test
        void emptyCandidates() {
            assertTrue(resolver.select(List.of()).isEmpty());
        }
    }

    @Nested
    @DisplayName("depth")
    class Depth {

        private final ConflictResolver resolver = new ConflictResolver(ResolutionStrategy.DEPTH);

        @Test
        void equalPriority_prefersNewestFact() {
            assertEquals("new", selected(resolver,
                activation("new", 5, 1, 7),
                activation("old", 5, 2, 3)));
        }

        @Test
        void priorityStillDominates() {
            assertEquals("high", selected(resolver,
                activation("low", 1, 9),
                activation("high", 2, 1)));
        }
    }
}
