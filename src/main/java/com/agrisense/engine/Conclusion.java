package com.agrisense.engine;

import com.agrisense.fact.Fact;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Map;

/**
 * Read-only snapshot of an output-kind fact.
 */
public record Conclusion(
    @JsonProperty("fact_id") long factId,
    @JsonProperty("kind") String kind,
    @JsonProperty("attributes") Map<String, Object> attributes
) {

    public static Conclusion of(Fact fact) {
        return new Conclusion(fact.id(), fact.kind(), fact.attributes());
    }
}
