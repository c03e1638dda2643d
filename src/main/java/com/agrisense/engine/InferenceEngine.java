package com.agrisense.engine;

import com.agrisense.fact.DuplicateFactException;
import com.agrisense.fact.Fact;
import com.agrisense.fact.FactStore;
import com.agrisense.fact.InMemoryFactStore;
import com.agrisense.fact.UnknownFactException;
import com.agrisense.rule.Action;
import com.agrisense.rule.RuleLibrary;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Map;

/**
 * Forward-chaining driver.
 *
 * A run alternates MATCHING and FIRING: every cycle re-matches the whole rule
 * library against the current facts, drops activations that already fired,
 * lets the {@link ConflictResolver} pick one and applies its actions in order.
 * The run ends QUIESCENT when nothing is eligible, or fails with
 * {@link CycleLimitExceededException} once {@code maxCycles} firings did not
 * reach quiescence.
 *
 * Actions are applied best-effort: an assert of a fact that already holds and
 * a retract of a fact that is gone are skipped and recorded, and the remaining
 * actions of the firing still apply.
 *
 * The engine itself is stateless and may serve concurrent sessions.
 */
public class InferenceEngine {

    private static final Logger log = LoggerFactory.getLogger(InferenceEngine.class);

    private final RuleLibrary library;
    private final EngineProperties properties;
    private final ConflictResolver resolver;
    private final ConclusionCollector collector;

    public InferenceEngine(RuleLibrary library, EngineProperties properties) {
        this.library = library;
        this.properties = properties;
        this.resolver = new ConflictResolver(properties.strategy());
        this.collector = new ConclusionCollector(library);
    }

    public Session openSession(String sessionId) {
        return new Session(sessionId, new InMemoryFactStore(),
            new Matcher(library, properties.incrementalMatching()));
    }

    /**
     * Runs the session to quiescence and returns its conclusions.
     *
     * @throws CycleLimitExceededException if the cycle ceiling is reached first
     * @throws SessionCancelledException   if the session was cancelled
     */
    public InferenceResult run(Session session) {
        session.requireUsable();
        try {
            return runToQuiescence(session);
        } catch (CycleLimitExceededException | SessionCancelledException ex) {
            throw ex;
        } catch (RuntimeException ex) {
            // the facts asserted so far stay; the session may be inspected and run again
            session.transition(EngineState.IDLE);
            log.error("Session {} run aborted: {}", session.id(), ex.getMessage(), ex);
            throw ex;
        }
    }

    private InferenceResult runToQuiescence(Session session) {
        int cycles = 0;
        List<FiringRecord> firings = new ArrayList<>();
        Deque<FiringRecord> recent = new ArrayDeque<>();

        while (true) {
            session.transition(EngineState.MATCHING);
            if (session.isCancelled()) {
                session.transition(EngineState.CANCELLED);
                log.info("Session {} cancelled after {} cycles", session.id(), cycles);
                throw new SessionCancelledException(session.id());
            }

            List<Activation> eligible = session.matcher().match(session.store()).stream()
                .filter(activation -> !session.hasFired(activation))
                .toList();
            if (eligible.isEmpty()) {
                session.transition(EngineState.QUIESCENT);
                break;
            }
            if (cycles >= properties.maxCycles()) {
                session.transition(EngineState.CYCLE_LIMIT_EXCEEDED);
                log.warn("Session {} exceeded cycle limit {} with {} activations pending",
                    session.id(), properties.maxCycles(), eligible.size());
                throw new CycleLimitExceededException(session.id(), properties.maxCycles(), List.copyOf(recent));
            }

            session.transition(EngineState.FIRING);
            Activation selected = resolver.select(eligible).orElseThrow();
            FiringRecord record = fire(session, selected, ++cycles);
            session.record(record);
            firings.add(record);
            if (properties.historySize() > 0) {
                if (recent.size() == properties.historySize()) {
                    recent.removeFirst();
                }
                recent.addLast(record);
            }
        }

        List<Conclusion> conclusions = collector.collect(session.store());
        log.info("Session {} quiescent: cycles={}, facts={}, conclusions={}",
            session.id(), cycles, session.store().size(), conclusions.size());
        return new InferenceResult(session.id(), conclusions, cycles, firings);
    }

    private FiringRecord fire(Session session, Activation activation, int cycle) {
        FactStore store = session.store();
        session.markFired(activation);

        List<Long> asserted = new ArrayList<>();
        List<Long> retracted = new ArrayList<>();
        List<String> skipped = new ArrayList<>();

        for (Action action : activation.rule().actions()) {
            if (action instanceof Action.AssertFact assertFact) {
                Map<String, Object> attributes = assertFact.resolve(activation.bindings());
                try {
                    asserted.add(store.assertFact(assertFact.kind(), attributes));
                } catch (DuplicateFactException ex) {
                    log.debug("Rule {} skipped assert: {}", activation.rule().name(), ex.getMessage());
                    skipped.add("assert " + assertFact.kind() + ": already holds as f-" + ex.getExistingFactId());
                }
            } else if (action instanceof Action.RetractFact retractFact) {
                Fact target = activation.aliasedFacts().get(retractFact.alias());
                try {
                    store.retract(target.id());
                    retracted.add(target.id());
                } catch (UnknownFactException ex) {
                    log.warn("Rule {} skipped retract of '{}' in session {}: {}",
                        activation.rule().name(), retractFact.alias(), session.id(), ex.getMessage());
                    skipped.add("retract " + retractFact.alias() + ": f-" + target.id() + " is no longer live");
                }
            }
        }

        log.debug("Session {} cycle {} fired {} on {} (asserted={}, retracted={})",
            session.id(), cycle, activation.rule().name(), activation.factIds(), asserted, retracted);
        return new FiringRecord(cycle, activation.rule().name(), activation.factIds(), asserted, retracted, skipped);
    }
}
