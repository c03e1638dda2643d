package com.agrisense.advisory;

import com.agrisense.engine.Conclusion;
import com.agrisense.engine.InferenceResult;
import com.agrisense.session.SessionService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * One-shot advisory: opens a session, asserts the farmer's observations, runs
 * the engine and splits the conclusions into diagnoses and recommendations.
 * The session is always ended, also when the run fails.
 */
@Service
public class AdvisoryService {

    private static final Logger log = LoggerFactory.getLogger(AdvisoryService.class);

    static final String DIAGNOSIS = "diagnosis";
    static final String RECOMMENDATION = "recommendation";

    private final SessionService sessions;
    private final ObservationMapper mapper = new ObservationMapper();

    public AdvisoryService(SessionService sessions) {
        this.sessions = sessions;
    }

    public AdvisoryReport advise(CropObservation observation) {
        List<ObservationMapper.Observation> facts = mapper.toObservations(observation);
        String crop = ObservationMapper.cropName(observation);

        String sessionId = sessions.startSession();
        try {
            for (ObservationMapper.Observation fact : facts) {
                sessions.assertObservation(sessionId, fact.kind(), fact.attributes());
            }
            InferenceResult result = sessions.runDetailed(sessionId);

            List<Conclusion> diagnoses = result.conclusions().stream()
                .filter(c -> DIAGNOSIS.equals(c.kind()))
                .toList();
            List<Conclusion> recommendations = result.conclusions().stream()
                .filter(c -> RECOMMENDATION.equals(c.kind()))
                .toList();
            log.info("Advisory for crop={} produced diagnoses={}, recommendations={} in {} cycles",
                crop, diagnoses.size(), recommendations.size(), result.cycles());
            return new AdvisoryReport(crop, diagnoses, recommendations, result.cycles());
        } finally {
            sessions.endSession(sessionId);
        }
    }
}
