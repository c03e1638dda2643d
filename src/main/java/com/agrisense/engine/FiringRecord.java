package com.agrisense.engine;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Observation log entry for one firing.
 */
public record FiringRecord(
    @JsonProperty("cycle") int cycle,
    @JsonProperty("rule") String rule,
    @JsonProperty("matched_fact_ids") List<Long> matchedFactIds,
    @JsonProperty("asserted_fact_ids") List<Long> assertedFactIds,
    @JsonProperty("retracted_fact_ids") List<Long> retractedFactIds,
    @JsonProperty("skipped_actions") List<String> skippedActions
) {

    public FiringRecord {
        matchedFactIds = List.copyOf(matchedFactIds);
        assertedFactIds = List.copyOf(assertedFactIds);
        retractedFactIds = List.copyOf(retractedFactIds);
        skippedActions = List.copyOf(skippedActions);
    }
}
