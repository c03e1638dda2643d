package com.agrisense.session;

import com.agrisense.engine.Conclusion;
import com.agrisense.engine.FiringRecord;
import com.agrisense.engine.InferenceEngine;
import com.agrisense.engine.InferenceResult;
import com.agrisense.engine.Session;
import com.agrisense.fact.Fact;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Session API over the inference engine.
 *
 * Sessions are independent and may run in parallel. Operations on the same
 * session are serialized on the session object, except {@link #cancel(String)},
 * which only raises a flag the running engine checks between cycles.
 */
@Service
public class SessionService {

    private static final Logger log = LoggerFactory.getLogger(SessionService.class);

    private final InferenceEngine engine;
    private final ConcurrentHashMap<String, Session> sessions = new ConcurrentHashMap<>();

    public SessionService(InferenceEngine engine) {
        this.engine = engine;
    }

    public String startSession() {
        String id = UUID.randomUUID().toString();
        sessions.put(id, engine.openSession(id));
        log.debug("Started session {}", id);
        return id;
    }

    public long assertObservation(String sessionId, String kind, Map<String, ?> attributes) {
        Session session = require(sessionId);
        synchronized (session) {
            return session.assertObservation(kind, attributes);
        }
    }

    /**
     * Drives the session to quiescence.
     *
     * @return the session's conclusions in assertion order
     */
    public List<Conclusion> run(String sessionId) {
        return runDetailed(sessionId).conclusions();
    }

    public InferenceResult runDetailed(String sessionId) {
        Session session = require(sessionId);
        synchronized (session) {
            return engine.run(session);
        }
    }

    public void cancel(String sessionId) {
        require(sessionId).cancel();
        log.info("Cancellation requested for session {}", sessionId);
    }

    public void endSession(String sessionId) {
        Session removed = sessions.remove(sessionId);
        if (removed == null) {
            throw new UnknownSessionException(sessionId);
        }
        removed.cancel();
        log.debug("Ended session {}", sessionId);
    }

    public List<Fact> facts(String sessionId, Optional<String> kind) {
        Session session = require(sessionId);
        synchronized (session) {
            return kind
                .map(k -> session.store().query(k).toList())
                .orElseGet(() -> session.store().facts());
        }
    }

    public List<FiringRecord> firingLog(String sessionId) {
        Session session = require(sessionId);
        synchronized (session) {
            return session.firingLog();
        }
    }

    public int activeSessions() {
        return sessions.size();
    }

    private Session require(String sessionId) {
        Session session = sessionId != null ? sessions.get(sessionId) : null;
        if (session == null) {
            throw new UnknownSessionException(sessionId);
        }
        return session;
    }
}
