package com.agrisense.rule;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Map;

/**
 * Serialized form of a rule library, as read from configuration.
 *
 * <pre>
 * {
 *   "output_kinds": ["diagnosis", "recommendation"],
 *   "rules": [{
 *     "name": "low-ph-yellowing",
 *     "priority": 10,
 *     "conditions": [
 *       {"kind": "symptom", "match": {"crop": "?crop", "symptom": "leaf-yellowing"}},
 *       {"kind": "soil", "alias": "soil", "tests": [{"attribute": "ph", "op": "lt", "value": 6.0}]}
 *     ],
 *     "actions": [
 *       {"type": "assert", "kind": "diagnosis", "attributes": {"crop": "?crop", "disease": "nitrogen-deficiency"}}
 *     ]
 *   }]
 * }
 * </pre>
 */
public record RuleLibraryDocument(
    @JsonProperty("output_kinds") List<String> outputKinds,
    @JsonProperty("rules") List<RuleDefinition> rules
) {

    public record RuleDefinition(
        @JsonProperty("name") String name,
        @JsonProperty("priority") Integer priority,
        @JsonProperty("description") String description,
        @JsonProperty("conditions") List<ConditionDefinition> conditions,
        @JsonProperty("actions") List<ActionDefinition> actions
    ) {}

    public record ConditionDefinition(
        @JsonProperty("kind") String kind,
        @JsonProperty("alias") String alias,
        @JsonProperty("negated") Boolean negated,
        @JsonProperty("match") Map<String, Object> match,
        @JsonProperty("tests") List<TestDefinition> tests
    ) {}

    public record TestDefinition(
        @JsonProperty("attribute") String attribute,
        @JsonProperty("op") Operator op,
        @JsonProperty("value") Object value
    ) {}

    public record ActionDefinition(
        @JsonProperty("type") ActionType type,
        @JsonProperty("kind") String kind,
        @JsonProperty("attributes") Map<String, Object> attributes,
        @JsonProperty("fact") String fact
    ) {}
}
