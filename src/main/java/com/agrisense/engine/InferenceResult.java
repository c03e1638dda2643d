package com.agrisense.engine;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

public record InferenceResult(
    @JsonProperty("session_id") String sessionId,
    @JsonProperty("conclusions") List<Conclusion> conclusions,
    @JsonProperty("cycles") int cycles,
    @JsonProperty("firings") List<FiringRecord> firings
) {}
