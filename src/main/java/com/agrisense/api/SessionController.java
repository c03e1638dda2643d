package com.agrisense.api;

import com.agrisense.engine.InferenceResult;
import com.agrisense.fact.Fact;
import com.agrisense.session.SessionService;
import com.fasterxml.jackson.annotation.JsonProperty;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * REST surface of the session API.
 *
 * POST   /v1/sessions                      start a session
 * POST   /v1/sessions/{id}/observations    assert an observation fact
 * POST   /v1/sessions/{id}/run             run to quiescence
 * POST   /v1/sessions/{id}/cancel          request cancellation
 * GET    /v1/sessions/{id}/facts?kind=     list live facts
 * DELETE /v1/sessions/{id}                 end the session
 */
@RestController
@RequestMapping("/v1/sessions")
public class SessionController {

    private final SessionService sessionService;

    public SessionController(SessionService sessionService) {
        this.sessionService = sessionService;
    }

    @PostMapping
    @ResponseStatus(HttpStatus.CREATED)
    public Map<String, Object> start() {
        return Map.of("session_id", sessionService.startSession());
    }

    @PostMapping("/{sessionId}/observations")
    @ResponseStatus(HttpStatus.CREATED)
    public Map<String, Object> assertObservation(@PathVariable String sessionId,
                                                 @RequestBody ObservationRequest request) {
        long factId = sessionService.assertObservation(sessionId, request.kind(),
            request.attributes() != null ? request.attributes() : Map.of());
        return Map.of(
            "session_id", sessionId,
            "fact_id", factId
        );
    }

    @PostMapping("/{sessionId}/run")
    public InferenceResult run(@PathVariable String sessionId) {
        return sessionService.runDetailed(sessionId);
    }

    @PostMapping("/{sessionId}/cancel")
    public Map<String, Object> cancel(@PathVariable String sessionId) {
        sessionService.cancel(sessionId);
        return Map.of("session_id", sessionId, "status", "cancellation_requested");
    }

    @GetMapping("/{sessionId}/facts")
    public List<Fact> facts(@PathVariable String sessionId,
                            @RequestParam(required = false) String kind) {
        return sessionService.facts(sessionId, Optional.ofNullable(kind));
    }

    @DeleteMapping("/{sessionId}")
    @ResponseStatus(HttpStatus.NO_CONTENT)
    public void end(@PathVariable String sessionId) {
        sessionService.endSession(sessionId);
    }

    public record ObservationRequest(
        @JsonProperty("kind") String kind,
        @JsonProperty("attributes") Map<String, Object> attributes
    ) {}
}
