package com.agrisense.session;

import com.agrisense.engine.Conclusion;
import com.agrisense.engine.EngineProperties;
import com.agrisense.engine.InferenceEngine;
import com.agrisense.engine.SessionCancelledException;
import com.agrisense.fact.DuplicateFactException;
import com.agrisense.fact.Fact;
import com.agrisense.rule.RuleLibrary;
import com.agrisense.rule.RuleLibraryLoader;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class SessionServiceTest {

    private static final String RULES = """
        {"output_kinds": ["diagnosis"],
         "rules": [
          {"name": "acid-soil-yellowing", "priority": 10,
           "conditions": [
             {"kind": "symptom", "match": {"crop": "?crop", "symptom": "leaf-yellowing"}},
             {"kind": "soil", "tests": [{"attribute": "ph", "op": "lt", "value": 6.0}]}
           ],
           "actions": [{"type": "assert", "kind": "diagnosis", "attributes": {"crop": "?crop", "disease": "nitrogen-deficiency"}}]}
         ]}
        """;

    private SessionService service;

    @BeforeEach
    void setUp() {
        RuleLibrary library = new RuleLibraryLoader().load(RULES, "session-test");
        service = new SessionService(new InferenceEngine(library, EngineProperties.defaults()));
    }

    @Test
    @DisplayName("start, observe, run and end a session")
    void lifecycle() {
        String id = service.startSession();
        assertEquals(1, service.activeSessions());

        long symptom = service.assertObservation(id, "symptom", Map.of("crop", "tomato", "symptom", "leaf-yellowing"));
        long soil = service.assertObservation(id, "soil", Map.of("ph", 5.2));
        assertEquals(1L, symptom);
        assertEquals(2L, soil);

        List<Conclusion> conclusions = service.run(id);
        assertEquals(1, conclusions.size());
        assertEquals(Map.of("crop", "tomato", "disease", "nitrogen-deficiency"), conclusions.get(0).attributes());
        assertEquals(1, service.firingLog(id).size());

        List<Fact> soilFacts = service.facts(id, Optional.of("soil"));
        assertEquals(List.of(soil), soilFacts.stream().map(Fact::id).toList());
        assertEquals(3, service.facts(id, Optional.empty()).size());

        service.endSession(id);
        assertEquals(0, service.activeSessions());
    }

    @Test
    @DisplayName("ended and unknown sessions are rejected")
    void unknownSession() {
        String id = service.startSession();
        service.endSession(id);

        assertThrows(UnknownSessionException.class, () -> service.run(id));
        assertThrows(UnknownSessionException.class, () -> service.endSession(id));
        assertThrows(UnknownSessionException.class,
            () -> service.assertObservation("missing", "soil", Map.of("ph", 6)));
        assertThrows(UnknownSessionException.class, () -> service.cancel(null));
    }

    @Test
    @DisplayName("duplicate observation propagates to the caller")
    void duplicateObservation() {
        String id = service.startSession();
        service.assertObservation(id, "soil", Map.of("ph", 6));

        DuplicateFactException ex = assertThrows(DuplicateFactException.class,
            () -> service.assertObservation(id, "soil", Map.of("ph", 6.0)));
        assertEquals(1L, ex.getExistingFactId());
    }

    @Test
    @DisplayName("sessions are isolated from each other")
    void sessionsAreIsolated() {
        String first = service.startSession();
        String second = service.startSession();
        service.assertObservation(first, "symptom", Map.of("crop", "tomato", "symptom", "leaf-yellowing"));
        service.assertObservation(first, "soil", Map.of("ph", 5.0));
        service.assertObservation(second, "soil", Map.of("ph", 5.0));

        assertEquals(1, service.run(first).size());
        assertTrue(service.run(second).isEmpty());
        assertEquals(1, service.facts(second, Optional.empty()).size());
    }

    @Test
    @DisplayName("parallel sessions with the same input reach the same conclusions")
    void parallelSessions() throws Exception {
        ExecutorService pool = Executors.newFixedThreadPool(4);
        try {
            List<Future<List<Conclusion>>> futures = new ArrayList<>();
            for (int i = 0; i < 16; i++) {
                futures.add(pool.submit(() -> {
                    String id = service.startSession();
                    try {
                        service.assertObservation(id, "symptom", Map.of("crop", "maize", "symptom", "leaf-yellowing"));
                        service.assertObservation(id, "soil", Map.of("ph", 5.5));
                        return service.run(id);
                    } finally {
                        service.endSession(id);
                    }
                }));
            }
            List<Conclusion> expected = futures.get(0).get(10, TimeUnit.SECONDS);
            assertEquals(1, expected.size());
            for (Future<List<Conclusion>> future : futures) {
                assertEquals(expected, future.get(10, TimeUnit.SECONDS));
            }
        } finally {
            pool.shutdownNow();
        }
        assertEquals(0, service.activeSessions());
    }

    @Test
    @DisplayName("cancelled session cannot be run")
    void cancelledSession() {
        String id = service.startSession();
        service.cancel(id);

        assertThrows(SessionCancelledException.class, () -> service.run(id));
    }
}
