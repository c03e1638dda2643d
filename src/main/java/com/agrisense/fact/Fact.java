package com.agrisense.fact;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * An immutable fact held in working memory. The id is assigned by the
 * {@link FactStore} at assertion time and orders facts by assertion.
 */
public record Fact(
    @JsonProperty("fact_id") long id,
    @JsonProperty("kind") String kind,
    @JsonProperty("attributes") Map<String, Object> attributes
) {

    public Fact {
        attributes = Collections.unmodifiableMap(new LinkedHashMap<>(attributes));
    }

    public Object attribute(String name) {
        return attributes.get(name);
    }

    public boolean hasAttribute(String name) {
        return attributes.containsKey(name);
    }

    @Override
    public String toString() {
        return "f-" + id + " " + kind + attributes;
    }
}
